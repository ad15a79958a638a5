package org.apache.nifi.controllers.vfs.exception;

/**
 * Enumeration of error types for virtual file operations.
 */
public enum FileErrorType {
    // Path and type errors
    NOT_FOUND(false, "No such file or directory"),
    ALREADY_EXISTS(false, "File already exists"),
    NOT_A_DIRECTORY(false, "Not a directory"),
    NOT_A_FILE(false, "Is a directory"),
    PATH_ESCAPE(false, "Path escapes its parent folder"),
    TOO_MANY_LINKS(false, "Too many levels of symbolic links"),
    DIRECTORY_NOT_EMPTY(false, "Directory is not empty"),

    // Access errors
    PERMISSION_DENIED(false, "Permission denied"),
    ATTRIBUTE_NAME_RESTRICTED(false, "Attribute name is not permitted on this file"),

    // Capability errors
    UNSUPPORTED_OPERATION(false, "Operation not supported by this backend"),

    // Transport errors
    CONNECTION_ERROR(true, "Failed to establish connection to the backend"),
    AUTHENTICATION_ERROR(false, "Failed to authenticate with the backend"),
    TRANSFER_ERROR(true, "Error during file transfer"),

    // General errors
    UNEXPECTED_ERROR(false, "Unexpected error occurred");

    private final boolean recoverable;
    private final String defaultMessage;

    /**
     * Creates a new FileErrorType.
     *
     * @param recoverable Whether the error is potentially recoverable
     * @param defaultMessage The default error message
     */
    FileErrorType(boolean recoverable, String defaultMessage) {
        this.recoverable = recoverable;
        this.defaultMessage = defaultMessage;
    }

    /**
     * Checks if this error type is potentially recoverable.
     * A recoverable error is one that might succeed if retried.
     *
     * @return true if the error is recoverable, false otherwise
     */
    public boolean isRecoverable() {
        return recoverable;
    }

    /**
     * Gets the default error message for this error type.
     *
     * @return The default error message
     */
    public String getDefaultMessage() {
        return defaultMessage;
    }
}
