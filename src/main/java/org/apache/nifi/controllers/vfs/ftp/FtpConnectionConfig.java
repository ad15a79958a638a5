package org.apache.nifi.controllers.vfs.ftp;

import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.apache.nifi.controller.ConfigurationContext;
import org.apache.nifi.controllers.vfs.StandardVirtualFileService;
import org.apache.nifi.logging.ComponentLog;
import org.apache.nifi.processor.DataUnit;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Settings of an FTP or FTPS backend: the server, credentials, timeouts, transfer mode and pool sizing.
 * Instances are immutable and created with {@link Builder} or {@link #fromContext(ConfigurationContext, ComponentLog)}.
 */
public class FtpConnectionConfig {
    // Server and credentials
    private final String hostname;
    private final int port;
    private final String username;
    private final String password;

    // Timeouts in milliseconds
    private final int connectionTimeout;
    private final int dataTimeout;

    private final boolean activeMode;

    // Pool sizing
    private final int maxConnections;
    private final int minConnections;
    private final int connectionIdleTimeout;

    private final int bufferSize;
    private final String controlEncoding;

    // FTPS
    private final boolean useImplicitSSL;
    private final boolean useExplicitSSL;
    private final boolean validateServerCertificate;

    private FtpConnectionConfig(Builder builder) {
        this.hostname = builder.hostname;
        this.port = builder.port;
        this.username = builder.username;
        this.password = builder.password;
        this.connectionTimeout = builder.connectionTimeout;
        this.dataTimeout = builder.dataTimeout;
        this.activeMode = builder.activeMode;
        this.maxConnections = builder.maxConnections;
        this.minConnections = builder.minConnections;
        this.connectionIdleTimeout = builder.connectionIdleTimeout;
        this.bufferSize = builder.bufferSize;
        this.controlEncoding = builder.controlEncoding;
        this.useImplicitSSL = builder.useImplicitSSL;
        this.useExplicitSSL = builder.useExplicitSSL;
        this.validateServerCertificate = builder.validateServerCertificate;
    }

    /**
     * Creates a new FtpConnectionConfig from the properties of {@link StandardVirtualFileService}.
     *
     * @param context the NiFi ConfigurationContext
     * @param logger the logger to report the resulting settings to
     * @return a new FtpConnectionConfig
     */
    public static FtpConnectionConfig fromContext(final ConfigurationContext context, final ComponentLog logger) {
        Builder builder = new Builder();

        builder.hostname(context.getProperty(StandardVirtualFileService.HOSTNAME).evaluateAttributeExpressions().getValue());
        if (context.getProperty(StandardVirtualFileService.PORT).isSet()) {
            builder.port(context.getProperty(StandardVirtualFileService.PORT).evaluateAttributeExpressions().asInteger());
        }
        // Anonymous login unless credentials are configured
        if (context.getProperty(StandardVirtualFileService.USERNAME).isSet()) {
            builder.username(context.getProperty(StandardVirtualFileService.USERNAME).evaluateAttributeExpressions().getValue());
        }
        if (context.getProperty(StandardVirtualFileService.PASSWORD).isSet()) {
            builder.password(context.getProperty(StandardVirtualFileService.PASSWORD).evaluateAttributeExpressions().getValue());
        }

        builder.connectionTimeout(context.getProperty(StandardVirtualFileService.CONNECTION_TIMEOUT)
                .evaluateAttributeExpressions().asTimePeriod(TimeUnit.MILLISECONDS).intValue());
        builder.dataTimeout(context.getProperty(StandardVirtualFileService.DATA_TIMEOUT)
                .evaluateAttributeExpressions().asTimePeriod(TimeUnit.MILLISECONDS).intValue());

        builder.activeMode(context.getProperty(StandardVirtualFileService.ACTIVE_MODE).asBoolean());

        builder.maxConnections(context.getProperty(StandardVirtualFileService.MAX_CONNECTIONS).evaluateAttributeExpressions().asInteger());
        builder.minConnections(context.getProperty(StandardVirtualFileService.MIN_CONNECTIONS).evaluateAttributeExpressions().asInteger());
        builder.connectionIdleTimeout(context.getProperty(StandardVirtualFileService.CONNECTION_IDLE_TIMEOUT)
                .evaluateAttributeExpressions().asTimePeriod(TimeUnit.MILLISECONDS).intValue());

        builder.bufferSize(context.getProperty(StandardVirtualFileService.BUFFER_SIZE)
                .evaluateAttributeExpressions().asDataSize(DataUnit.B).intValue());
        builder.controlEncoding(context.getProperty(StandardVirtualFileService.CONTROL_ENCODING).evaluateAttributeExpressions().getValue());

        String security = context.getProperty(StandardVirtualFileService.FTP_SECURITY).getValue();
        builder.useImplicitSSL(StandardVirtualFileService.FTPS_IMPLICIT.getValue().equals(security));
        builder.useExplicitSSL(StandardVirtualFileService.FTPS_EXPLICIT.getValue().equals(security));
        builder.validateServerCertificate(context.getProperty(StandardVirtualFileService.VALIDATE_SERVER_CERTIFICATE).asBoolean());

        FtpConnectionConfig config = builder.build();
        logger.debug("FTP backend configured for {}:{} (active mode: {}, security: {})",
                new Object[] { config.getHostname(), config.getPort(), config.isActiveMode(), security });
        return config;
    }

    /**
     * Creates the Commons Pool settings for a pool of connections to this server.
     *
     * @return the pool configuration
     */
    public GenericObjectPoolConfig<FTPClient> createPoolConfig() {
        GenericObjectPoolConfig<FTPClient> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(maxConnections);
        poolConfig.setMaxIdle(maxConnections);
        poolConfig.setMinIdle(minConnections);

        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);

        poolConfig.setMaxWait(Duration.ofMillis(connectionTimeout));
        if (connectionIdleTimeout > 0) {
            poolConfig.setMinEvictableIdleTime(Duration.ofMillis(connectionIdleTimeout));
            poolConfig.setTimeBetweenEvictionRuns(Duration.ofMillis(Math.max(1000, connectionIdleTimeout / 2)));
        }
        return poolConfig;
    }

    public static class Builder {
        private String hostname;
        private int port = 21;
        private String username = "anonymous";
        private String password = "";

        private int connectionTimeout = 30000;
        private int dataTimeout = 60000;

        private boolean activeMode = false;

        private int maxConnections = 10;
        private int minConnections = 0;
        private int connectionIdleTimeout = 300000;

        private int bufferSize = 1048576;
        private String controlEncoding = "UTF-8";

        private boolean useImplicitSSL = false;
        private boolean useExplicitSSL = false;
        private boolean validateServerCertificate = true;

        public Builder hostname(String hostname) {
            this.hostname = hostname;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder username(String username) {
            this.username = username;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder connectionTimeout(int connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder dataTimeout(int dataTimeout) {
            this.dataTimeout = dataTimeout;
            return this;
        }

        public Builder activeMode(boolean activeMode) {
            this.activeMode = activeMode;
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
            return this;
        }

        public Builder minConnections(int minConnections) {
            this.minConnections = minConnections;
            return this;
        }

        public Builder connectionIdleTimeout(int connectionIdleTimeout) {
            this.connectionIdleTimeout = connectionIdleTimeout;
            return this;
        }

        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder controlEncoding(String controlEncoding) {
            this.controlEncoding = controlEncoding;
            return this;
        }

        public Builder useImplicitSSL(boolean useImplicitSSL) {
            this.useImplicitSSL = useImplicitSSL;
            return this;
        }

        public Builder useExplicitSSL(boolean useExplicitSSL) {
            this.useExplicitSSL = useExplicitSSL;
            return this;
        }

        public Builder validateServerCertificate(boolean validateServerCertificate) {
            this.validateServerCertificate = validateServerCertificate;
            return this;
        }

        public FtpConnectionConfig build() {
            return new FtpConnectionConfig(this);
        }
    }

    public String getHostname() {
        return hostname;
    }

    public int getPort() {
        return port;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public int getConnectionTimeout() {
        return connectionTimeout;
    }

    public int getDataTimeout() {
        return dataTimeout;
    }

    public boolean isActiveMode() {
        return activeMode;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public int getMinConnections() {
        return minConnections;
    }

    public int getConnectionIdleTimeout() {
        return connectionIdleTimeout;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public String getControlEncoding() {
        return controlEncoding;
    }

    public boolean isUseImplicitSSL() {
        return useImplicitSSL;
    }

    public boolean isUseExplicitSSL() {
        return useExplicitSSL;
    }

    public boolean isValidateServerCertificate() {
        return validateServerCertificate;
    }
}
