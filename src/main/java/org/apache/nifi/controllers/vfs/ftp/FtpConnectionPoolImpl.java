package org.apache.nifi.controllers.vfs.ftp;

import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.pool2.BasePooledObjectFactory;
import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.impl.DefaultPooledObject;
import org.apache.commons.pool2.impl.GenericObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.apache.nifi.controllers.vfs.exception.BackendConnectionException;
import org.apache.nifi.controllers.vfs.exception.FileErrorType;
import org.apache.nifi.controllers.vfs.exception.FileOperationException;
import org.apache.nifi.logging.ComponentLog;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link FtpConnectionPool} backed by a Commons Pool {@link GenericObjectPool}.
 */
public class FtpConnectionPoolImpl implements FtpConnectionPool {
    private final FtpConnectionConfig config;
    private final FtpConnectionManager connectionManager;
    private final ComponentLog logger;
    private final GenericObjectPool<FTPClient> pool;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public FtpConnectionPoolImpl(FtpConnectionConfig config, ComponentLog logger) {
        this(config, new FtpConnectionManager(config, logger), logger);
    }

    public FtpConnectionPoolImpl(FtpConnectionConfig config, FtpConnectionManager connectionManager, ComponentLog logger) {
        this.config = config;
        this.connectionManager = connectionManager;
        this.logger = logger;

        GenericObjectPoolConfig<FTPClient> poolConfig = config.createPoolConfig();
        this.pool = new GenericObjectPool<>(new FtpConnectionFactory(), poolConfig);

        logger.info("Created FTP connection pool for {}:{} with max connections: {}, min idle: {}",
                new Object[] { config.getHostname(), config.getPort(), poolConfig.getMaxTotal(), poolConfig.getMinIdle() });
    }

    @Override
    public FTPClient borrowConnection() throws IOException {
        if (shutdown.get()) {
            throw new IllegalStateException("Cannot borrow connection from closed pool");
        }

        try {
            logger.debug("Borrowing connection from pool (active: {}, idle: {})",
                    new Object[] { pool.getNumActive(), pool.getNumIdle() });
            return pool.borrowObject();
        } catch (IOException | FileOperationException e) {
            throw e;
        } catch (Exception e) {
            throw new BackendConnectionException(FileErrorType.CONNECTION_ERROR,
                    config.getHostname(), config.getPort(), -1,
                    "Failed to borrow connection from pool: " + e.getMessage(), e);
        }
    }

    @Override
    public void returnConnection(FTPClient client) {
        if (client == null) {
            return;
        }

        if (shutdown.get()) {
            connectionManager.closeConnection(client);
            return;
        }

        try {
            pool.returnObject(client);
            logger.debug("Returned connection to pool (active: {}, idle: {})",
                    new Object[] { pool.getNumActive(), pool.getNumIdle() });
        } catch (Exception e) {
            logger.warn("Error returning connection to pool: {}", new Object[] { e.getMessage() });
            connectionManager.closeConnection(client);
        }
    }

    @Override
    public void invalidateConnection(FTPClient client) {
        if (client == null) {
            return;
        }

        if (shutdown.get()) {
            connectionManager.closeConnection(client);
            return;
        }

        try {
            pool.invalidateObject(client);
            logger.debug("Invalidated connection in pool (active: {}, idle: {})",
                    new Object[] { pool.getNumActive(), pool.getNumIdle() });
        } catch (Exception e) {
            logger.warn("Error invalidating connection in pool: {}", new Object[] { e.getMessage() });
            connectionManager.closeConnection(client);
        }
    }

    @Override
    public int getActiveConnectionCount() {
        return pool.getNumActive();
    }

    @Override
    public int getIdleConnectionCount() {
        return pool.getNumIdle();
    }

    @Override
    public int getMaxConnections() {
        return pool.getMaxTotal();
    }

    @Override
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            logger.info("Shutting down FTP connection pool for {}:{}", new Object[] { config.getHostname(), config.getPort() });
            pool.close();
        }
    }

    private class FtpConnectionFactory extends BasePooledObjectFactory<FTPClient> {

        @Override
        public FTPClient create() throws Exception {
            return connectionManager.createConnection();
        }

        @Override
        public PooledObject<FTPClient> wrap(FTPClient client) {
            return new DefaultPooledObject<>(client);
        }

        @Override
        public boolean validateObject(PooledObject<FTPClient> pooledObject) {
            return connectionManager.validateConnection(pooledObject.getObject());
        }

        @Override
        public void destroyObject(PooledObject<FTPClient> pooledObject) {
            connectionManager.closeConnection(pooledObject.getObject());
            logger.debug("Destroyed FTP connection created at {}", new Object[] { pooledObject.getCreateInstant() });
        }

        @Override
        public void activateObject(PooledObject<FTPClient> pooledObject) throws Exception {
            // Listing relies on the working directory, so every borrower starts from the root
            FTPClient client = pooledObject.getObject();
            if (!client.changeWorkingDirectory("/")) {
                throw new IOException("Cannot reset working directory: " + client.getReplyString());
            }
        }
    }
}
