package org.apache.nifi.controllers.vfs.exception;

/**
 * Exception thrown when a remote backend rejects the configured credentials.
 */
public class AuthenticationException extends BackendConnectionException {

    private final String username;

    /**
     * Creates a new AuthenticationException.
     *
     * @param host The host that rejected the login
     * @param port The port of the host
     * @param username The username that was used for authentication
     * @param nativeCode The server reply code, or -1 if not applicable
     * @param message The error message
     * @param cause The cause of the exception, may be null
     */
    public AuthenticationException(String host, int port, String username, int nativeCode, String message, Throwable cause) {
        super(FileErrorType.AUTHENTICATION_ERROR, host, port, nativeCode, message, cause);
        this.username = username;
    }

    /**
     * Gets the username that was used for authentication.
     *
     * @return The username
     */
    public String getUsername() {
        return username;
    }
}
