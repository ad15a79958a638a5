package org.apache.nifi.controllers.vfs.sftp;

import org.apache.nifi.controller.ConfigurationContext;
import org.apache.nifi.controllers.vfs.StandardVirtualFileService;
import org.apache.nifi.logging.ComponentLog;

import java.util.concurrent.TimeUnit;

/**
 * Settings of an SFTP backend. Authentication uses the password, the private key, or both.
 * Instances are immutable and created with {@link Builder} or {@link #fromContext(ConfigurationContext, ComponentLog)}.
 */
public class SftpConnectionConfig {

    /**
     * Block size SFTP reads default to; larger than the generic default, since every block costs a round trip.
     */
    public static final int DEFAULT_BLOCK_SIZE = 512 * 1024;

    private final String hostname;
    private final int port;
    private final String username;
    private final String password;
    private final String privateKeyPath;
    private final String privateKeyPassphrase;
    private final boolean strictHostKeyChecking;
    private final String knownHostsFile;
    private final int connectionTimeout;
    private final int blockSize;

    private SftpConnectionConfig(Builder builder) {
        this.hostname = builder.hostname;
        this.port = builder.port;
        this.username = builder.username;
        this.password = builder.password;
        this.privateKeyPath = builder.privateKeyPath;
        this.privateKeyPassphrase = builder.privateKeyPassphrase;
        this.strictHostKeyChecking = builder.strictHostKeyChecking;
        this.knownHostsFile = builder.knownHostsFile;
        this.connectionTimeout = builder.connectionTimeout;
        this.blockSize = builder.blockSize;
    }

    /**
     * Creates a new SftpConnectionConfig from the properties of {@link StandardVirtualFileService}.
     *
     * @param context the NiFi ConfigurationContext
     * @param logger the logger to report the resulting settings to
     * @return a new SftpConnectionConfig
     */
    public static SftpConnectionConfig fromContext(final ConfigurationContext context, final ComponentLog logger) {
        Builder builder = new Builder();

        builder.hostname(context.getProperty(StandardVirtualFileService.HOSTNAME).evaluateAttributeExpressions().getValue());
        if (context.getProperty(StandardVirtualFileService.PORT).isSet()) {
            builder.port(context.getProperty(StandardVirtualFileService.PORT).evaluateAttributeExpressions().asInteger());
        }
        builder.username(context.getProperty(StandardVirtualFileService.USERNAME).evaluateAttributeExpressions().getValue());
        builder.password(context.getProperty(StandardVirtualFileService.PASSWORD).evaluateAttributeExpressions().getValue());
        builder.privateKeyPath(context.getProperty(StandardVirtualFileService.PRIVATE_KEY_PATH).evaluateAttributeExpressions().getValue());
        builder.privateKeyPassphrase(context.getProperty(StandardVirtualFileService.PRIVATE_KEY_PASSPHRASE).evaluateAttributeExpressions().getValue());
        builder.strictHostKeyChecking(context.getProperty(StandardVirtualFileService.STRICT_HOST_KEY_CHECKING).asBoolean());
        builder.knownHostsFile(context.getProperty(StandardVirtualFileService.KNOWN_HOSTS_FILE).evaluateAttributeExpressions().getValue());
        builder.connectionTimeout(context.getProperty(StandardVirtualFileService.CONNECTION_TIMEOUT)
                .evaluateAttributeExpressions().asTimePeriod(TimeUnit.MILLISECONDS).intValue());

        SftpConnectionConfig config = builder.build();
        logger.debug("SFTP backend configured for {}@{}:{} (key authentication: {})",
                new Object[] { config.getUsername(), config.getHostname(), config.getPort(), config.getPrivateKeyPath() != null });
        return config;
    }

    public static class Builder {
        private String hostname;
        private int port = 22;
        private String username;
        private String password;
        private String privateKeyPath;
        private String privateKeyPassphrase;
        private boolean strictHostKeyChecking = true;
        private String knownHostsFile;
        private int connectionTimeout = 30000;
        private int blockSize = DEFAULT_BLOCK_SIZE;

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

        public Builder privateKeyPath(String privateKeyPath) {
            this.privateKeyPath = privateKeyPath;
            return this;
        }

        public Builder privateKeyPassphrase(String privateKeyPassphrase) {
            this.privateKeyPassphrase = privateKeyPassphrase;
            return this;
        }

        public Builder strictHostKeyChecking(boolean strictHostKeyChecking) {
            this.strictHostKeyChecking = strictHostKeyChecking;
            return this;
        }

        public Builder knownHostsFile(String knownHostsFile) {
            this.knownHostsFile = knownHostsFile;
            return this;
        }

        public Builder connectionTimeout(int connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder blockSize(int blockSize) {
            this.blockSize = blockSize;
            return this;
        }

        public SftpConnectionConfig build() {
            return new SftpConnectionConfig(this);
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

    public String getPrivateKeyPath() {
        return privateKeyPath;
    }

    public String getPrivateKeyPassphrase() {
        return privateKeyPassphrase;
    }

    public boolean isStrictHostKeyChecking() {
        return strictHostKeyChecking;
    }

    public String getKnownHostsFile() {
        return knownHostsFile;
    }

    public int getConnectionTimeout() {
        return connectionTimeout;
    }

    public int getBlockSize() {
        return blockSize;
    }
}
