package org.apache.nifi.controllers.vfs.exception;

/**
 * Exception thrown when a file or folder an operation requires does not exist.
 */
public class NotFoundException extends FileOperationException {

    /**
     * Creates a new NotFoundException with the default message.
     *
     * @param path The path of the file or directory involved in the operation
     */
    public NotFoundException(String path) {
        super(FileErrorType.NOT_FOUND, path);
    }

    /**
     * Creates a new NotFoundException.
     *
     * @param path The path of the file or directory involved in the operation
     * @param message The error message
     */
    public NotFoundException(String path, String message) {
        super(FileErrorType.NOT_FOUND, path, message);
    }

    /**
     * Creates a new NotFoundException.
     *
     * @param path The path of the file or directory involved in the operation
     * @param nativeCode The code the backend reported, or -1 if not applicable
     * @param message The error message
     * @param cause The cause of the exception
     */
    public NotFoundException(String path, int nativeCode, String message, Throwable cause) {
        super(FileErrorType.NOT_FOUND, path, nativeCode, message, cause);
    }
}
