package org.apache.nifi.controllers.vfs.exception;

/**
 * Exception thrown when a remote backend cannot be reached or its connection is lost.
 */
public class BackendConnectionException extends FileOperationException {

    private final String host;
    private final int port;

    /**
     * Creates a new BackendConnectionException.
     *
     * @param errorType The type of error that occurred
     * @param host The host that was being connected to
     * @param port The port that was being connected to
     * @param message The error message
     */
    public BackendConnectionException(FileErrorType errorType, String host, int port, String message) {
        this(errorType, host, port, -1, message, null);
    }

    /**
     * Creates a new BackendConnectionException.
     *
     * @param errorType The type of error that occurred
     * @param host The host that was being connected to
     * @param port The port that was being connected to
     * @param nativeCode The server reply code, or -1 if not applicable
     * @param message The error message
     * @param cause The cause of the exception
     */
    public BackendConnectionException(FileErrorType errorType, String host, int port, int nativeCode,
            String message, Throwable cause) {
        super(errorType, null, nativeCode, message, cause);
        this.host = host;
        this.port = port;
    }

    /**
     * Gets the host that was being connected to.
     *
     * @return The host name
     */
    public String getHost() {
        return host;
    }

    /**
     * Gets the port that was being connected to.
     *
     * @return The port
     */
    public int getPort() {
        return port;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName());
        sb.append("[errorType=").append(getErrorType());
        sb.append(", server=").append(host).append(":").append(port);

        if (getNativeCode() != -1) {
            sb.append(", replyCode=").append(getNativeCode());
        }

        sb.append(", message=").append(getMessage());

        Throwable cause = getCause();
        if (cause != null) {
            sb.append(", cause=").append(cause.getClass().getSimpleName())
              .append(": ").append(cause.getMessage());
        }

        sb.append("]");
        return sb.toString();
    }
}
