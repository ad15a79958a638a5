package org.apache.nifi.controllers.vfs.exception;

/**
 * Exception thrown when a regular file was required but the path holds something else.
 */
public class NotAFileException extends FileOperationException {

    /**
     * Creates a new NotAFileException with the default message.
     *
     * @param path The path of the file or directory involved in the operation
     */
    public NotAFileException(String path) {
        super(FileErrorType.NOT_A_FILE, path);
    }

    /**
     * Creates a new NotAFileException.
     *
     * @param path The path of the file or directory involved in the operation
     * @param message The error message
     */
    public NotAFileException(String path, String message) {
        super(FileErrorType.NOT_A_FILE, path, message);
    }

    /**
     * Creates a new NotAFileException.
     *
     * @param path The path of the file or directory involved in the operation
     * @param nativeCode The code the backend reported, or -1 if not applicable
     * @param message The error message
     * @param cause The cause of the exception
     */
    public NotAFileException(String path, int nativeCode, String message, Throwable cause) {
        super(FileErrorType.NOT_A_FILE, path, nativeCode, message, cause);
    }
}
