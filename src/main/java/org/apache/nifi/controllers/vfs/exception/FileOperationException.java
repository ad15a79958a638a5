package org.apache.nifi.controllers.vfs.exception;

import org.apache.nifi.processor.exception.ProcessException;

/**
 * Base exception class for virtual file operations.
 * This is the parent class for every failure the file contracts report, whatever backend raised it.
 */
public class FileOperationException extends ProcessException {

    private final FileErrorType errorType;
    private final String path;
    private final int nativeCode;

    /**
     * Creates a new FileOperationException with the error type's default message.
     *
     * @param errorType The type of error that occurred
     * @param path The path of the file or directory involved in the operation
     */
    public FileOperationException(FileErrorType errorType, String path) {
        this(errorType, path, -1, errorType.getDefaultMessage() + ": " + path, null);
    }

    /**
     * Creates a new FileOperationException.
     *
     * @param errorType The type of error that occurred
     * @param path The path of the file or directory involved in the operation
     * @param message The error message
     */
    public FileOperationException(FileErrorType errorType, String path, String message) {
        this(errorType, path, -1, message, null);
    }

    /**
     * Creates a new FileOperationException.
     *
     * @param errorType The type of error that occurred
     * @param path The path of the file or directory involved in the operation
     * @param message The error message
     * @param cause The cause of the exception
     */
    public FileOperationException(FileErrorType errorType, String path, String message, Throwable cause) {
        this(errorType, path, -1, message, cause);
    }

    /**
     * Creates a new FileOperationException.
     *
     * @param errorType The type of error that occurred
     * @param path The path of the file or directory involved in the operation
     * @param nativeCode The errno, FTP reply code or SFTP status the backend reported, or -1 if not applicable
     * @param message The error message
     * @param cause The cause of the exception
     */
    public FileOperationException(FileErrorType errorType, String path, int nativeCode, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.path = path;
        this.nativeCode = nativeCode;
    }

    /**
     * Gets the type of error that occurred.
     *
     * @return The error type
     */
    public FileErrorType getErrorType() {
        return errorType;
    }

    /**
     * Gets the path of the file or directory involved in the operation.
     *
     * @return The path, or null if not applicable
     */
    public String getPath() {
        return path;
    }

    /**
     * Gets the code the backend reported for this failure.
     *
     * @return The native code, or -1 if not applicable
     */
    public int getNativeCode() {
        return nativeCode;
    }

    /**
     * Checks if this exception represents a recoverable error.
     *
     * @return true if the error is recoverable, false otherwise
     */
    public boolean isRecoverable() {
        return errorType.isRecoverable();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        sb.append("[errorType=").append(errorType);

        if (path != null) {
            sb.append(", path='").append(path).append("'");
        }

        if (nativeCode != -1) {
            sb.append(", nativeCode=").append(nativeCode);
        }

        sb.append(", message='").append(getMessage()).append("'");

        Throwable cause = getCause();
        if (cause != null) {
            sb.append(", cause=").append(cause.getClass().getSimpleName())
              .append(": ").append(cause.getMessage());
        }

        sb.append("]");
        return sb.toString();
    }
}
