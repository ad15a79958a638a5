package org.apache.nifi.controllers.vfs.ftp;

import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPReply;
import org.apache.commons.net.ftp.FTPSClient;
import org.apache.commons.net.util.TrustManagerUtils;
import org.apache.nifi.controllers.vfs.exception.AuthenticationException;
import org.apache.nifi.controllers.vfs.exception.BackendConnectionException;
import org.apache.nifi.controllers.vfs.exception.FileErrorType;
import org.apache.nifi.logging.ComponentLog;

import java.io.IOException;

/**
 * Opens, checks and closes the FTP control connections the pool hands out.
 */
public class FtpConnectionManager {
    private final FtpConnectionConfig config;
    private final ComponentLog logger;

    public FtpConnectionManager(FtpConnectionConfig config, ComponentLog logger) {
        this.config = config;
        this.logger = logger;
    }

    /**
     * Connects and logs in a new client, ready for binary transfers.
     *
     * @return the connected client
     * @throws BackendConnectionException if the server refuses the connection
     * @throws AuthenticationException if the server rejects the credentials
     * @throws IOException if the connection fails
     */
    public FTPClient createConnection() throws IOException {
        FTPClient client = createAppropriateClient();

        try {
            client.setConnectTimeout(config.getConnectionTimeout());
            client.setDataTimeout(config.getDataTimeout());
            client.setControlEncoding(config.getControlEncoding());
            if (config.getBufferSize() > 0) {
                client.setBufferSize(config.getBufferSize());
            }

            logger.debug("Connecting to FTP server {}:{}", new Object[] { config.getHostname(), config.getPort() });
            client.connect(config.getHostname(), config.getPort());

            int reply = client.getReplyCode();
            if (!FTPReply.isPositiveCompletion(reply)) {
                throw new BackendConnectionException(FileErrorType.CONNECTION_ERROR,
                        config.getHostname(), config.getPort(), reply,
                        "FTP server refused connection: " + client.getReplyString(), null);
            }

            login(client);

            if (client instanceof FTPSClient) {
                // Protect the data channel as well as the control channel
                FTPSClient ftpsClient = (FTPSClient) client;
                ftpsClient.execPBSZ(0);
                ftpsClient.execPROT("P");
            }

            if (config.isActiveMode()) {
                logger.debug("Using active mode");
                client.enterLocalActiveMode();
            } else {
                logger.debug("Using passive mode");
                client.enterLocalPassiveMode();
            }

            client.setFileType(FTP.BINARY_FILE_TYPE);

            logger.debug("FTP connection established to {}:{}", new Object[] { config.getHostname(), config.getPort() });
            return client;

        } catch (IOException | RuntimeException e) {
            closeConnection(client);
            throw e;
        }
    }

    private FTPClient createAppropriateClient() {
        if (config.isUseImplicitSSL() || config.isUseExplicitSSL()) {
            boolean useImplicit = config.isUseImplicitSSL();
            logger.debug("Creating FTPS client with {} SSL", new Object[] { useImplicit ? "implicit" : "explicit" });

            FTPSClient ftpsClient = new FTPSClient(useImplicit);
            if (!config.isValidateServerCertificate()) {
                logger.warn("Server certificate validation is disabled for {}", new Object[] { config.getHostname() });
                ftpsClient.setTrustManager(TrustManagerUtils.getAcceptAllTrustManager());
            }
            return ftpsClient;
        }
        return new FTPClient();
    }

    private void login(FTPClient client) throws IOException {
        logger.debug("Logging in as user {}", new Object[] { config.getUsername() });

        if (!client.login(config.getUsername(), config.getPassword())) {
            throw new AuthenticationException(config.getHostname(), config.getPort(), config.getUsername(),
                    client.getReplyCode(), "Failed to login to FTP server as user " + config.getUsername()
                    + ": " + client.getReplyString(), null);
        }
    }

    /**
     * Checks that a client is still connected and answering commands.
     *
     * @param client the client
     * @return true if the server answered a NOOP
     */
    public boolean validateConnection(FTPClient client) {
        if (client == null || !client.isConnected()) {
            return false;
        }

        try {
            boolean valid = client.sendNoOp();
            if (!valid) {
                logger.debug("NOOP command failed with reply {}", new Object[] { client.getReplyCode() });
            }
            return valid;
        } catch (IOException e) {
            logger.debug("Error validating FTP connection: {}", new Object[] { e.getMessage() });
            return false;
        }
    }

    /**
     * Logs out and disconnects a client. Failures are logged, since the connection is being discarded.
     *
     * @param client the client, may be null
     */
    public void closeConnection(FTPClient client) {
        if (client == null || !client.isConnected()) {
            return;
        }

        try {
            client.logout();
        } catch (IOException e) {
            logger.debug("Error during FTP logout: {}", new Object[] { e.getMessage() });
        }
        try {
            client.disconnect();
        } catch (IOException e) {
            logger.debug("Error during FTP disconnect: {}", new Object[] { e.getMessage() });
        }
    }

    public FtpConnectionConfig getConfig() {
        return config;
    }
}
