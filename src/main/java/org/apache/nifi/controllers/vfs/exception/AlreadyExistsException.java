package org.apache.nifi.controllers.vfs.exception;

/**
 * Exception thrown when an operation would overwrite something that already exists.
 */
public class AlreadyExistsException extends FileOperationException {

    /**
     * Creates a new AlreadyExistsException with the default message.
     *
     * @param path The path of the file or directory involved in the operation
     */
    public AlreadyExistsException(String path) {
        super(FileErrorType.ALREADY_EXISTS, path);
    }

    /**
     * Creates a new AlreadyExistsException.
     *
     * @param path The path of the file or directory involved in the operation
     * @param message The error message
     */
    public AlreadyExistsException(String path, String message) {
        super(FileErrorType.ALREADY_EXISTS, path, message);
    }

    /**
     * Creates a new AlreadyExistsException.
     *
     * @param path The path of the file or directory involved in the operation
     * @param nativeCode The code the backend reported, or -1 if not applicable
     * @param message The error message
     * @param cause The cause of the exception
     */
    public AlreadyExistsException(String path, int nativeCode, String message, Throwable cause) {
        super(FileErrorType.ALREADY_EXISTS, path, nativeCode, message, cause);
    }
}
