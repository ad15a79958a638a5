package org.apache.nifi.controllers.vfs.exception;

/**
 * Exception thrown when the backend refuses access to a path.
 */
public class PermissionDeniedException extends FileOperationException {

    /**
     * Creates a new PermissionDeniedException with the default message.
     *
     * @param path The path of the file or directory involved in the operation
     */
    public PermissionDeniedException(String path) {
        super(FileErrorType.PERMISSION_DENIED, path);
    }

    /**
     * Creates a new PermissionDeniedException.
     *
     * @param path The path of the file or directory involved in the operation
     * @param message The error message
     */
    public PermissionDeniedException(String path, String message) {
        super(FileErrorType.PERMISSION_DENIED, path, message);
    }

    /**
     * Creates a new PermissionDeniedException.
     *
     * @param path The path of the file or directory involved in the operation
     * @param nativeCode The code the backend reported, or -1 if not applicable
     * @param message The error message
     * @param cause The cause of the exception
     */
    public PermissionDeniedException(String path, int nativeCode, String message, Throwable cause) {
        super(FileErrorType.PERMISSION_DENIED, path, nativeCode, message, cause);
    }
}
