package org.apache.nifi.controllers.vfs.exception;

/**
 * Exception thrown when a folder was required but the path holds something else.
 */
public class NotADirectoryException extends FileOperationException {

    /**
     * Creates a new NotADirectoryException with the default message.
     *
     * @param path The path of the file or directory involved in the operation
     */
    public NotADirectoryException(String path) {
        super(FileErrorType.NOT_A_DIRECTORY, path);
    }

    /**
     * Creates a new NotADirectoryException.
     *
     * @param path The path of the file or directory involved in the operation
     * @param message The error message
     */
    public NotADirectoryException(String path, String message) {
        super(FileErrorType.NOT_A_DIRECTORY, path, message);
    }

    /**
     * Creates a new NotADirectoryException.
     *
     * @param path The path of the file or directory involved in the operation
     * @param nativeCode The code the backend reported, or -1 if not applicable
     * @param message The error message
     * @param cause The cause of the exception
     */
    public NotADirectoryException(String path, int nativeCode, String message, Throwable cause) {
        super(FileErrorType.NOT_A_DIRECTORY, path, nativeCode, message, cause);
    }
}
