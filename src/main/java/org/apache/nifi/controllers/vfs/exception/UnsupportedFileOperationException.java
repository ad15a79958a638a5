package org.apache.nifi.controllers.vfs.exception;

/**
 * Exception thrown when a backend has no way to perform the requested operation.
 */
public class UnsupportedFileOperationException extends FileOperationException {

    /**
     * Creates a new UnsupportedFileOperationException with the default message.
     *
     * @param path The path of the file or directory involved in the operation
     */
    public UnsupportedFileOperationException(String path) {
        super(FileErrorType.UNSUPPORTED_OPERATION, path);
    }

    /**
     * Creates a new UnsupportedFileOperationException.
     *
     * @param path The path of the file or directory involved in the operation
     * @param message The error message
     */
    public UnsupportedFileOperationException(String path, String message) {
        super(FileErrorType.UNSUPPORTED_OPERATION, path, message);
    }

    /**
     * Creates a new UnsupportedFileOperationException.
     *
     * @param path The path of the file or directory involved in the operation
     * @param nativeCode The code the backend reported, or -1 if not applicable
     * @param message The error message
     * @param cause The cause of the exception
     */
    public UnsupportedFileOperationException(String path, int nativeCode, String message, Throwable cause) {
        super(FileErrorType.UNSUPPORTED_OPERATION, path, nativeCode, message, cause);
    }
}
