package org.apache.nifi.controllers.vfs.ftp;

import org.apache.commons.net.ftp.FTPClient;

import java.io.IOException;

/**
 * Pool of logged-in FTP clients. A borrowed client is either returned or invalidated, exactly once.
 */
public interface FtpConnectionPool {

    /**
     * Borrows a connected client, opening a new connection when no idle one is available.
     *
     * @return the client
     * @throws IOException if a new connection cannot be opened
     */
    FTPClient borrowConnection() throws IOException;

    void returnConnection(FTPClient client);

    /**
     * Discards a client that failed mid-operation instead of returning it.
     */
    void invalidateConnection(FTPClient client);

    int getActiveConnectionCount();

    int getIdleConnectionCount();

    int getMaxConnections();

    /**
     * Closes every pooled connection. Clients still borrowed are closed when they come back.
     */
    void shutdown();
}
