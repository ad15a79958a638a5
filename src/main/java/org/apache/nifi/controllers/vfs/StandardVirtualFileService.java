package org.apache.nifi.controllers.vfs;

import org.apache.nifi.annotation.documentation.CapabilityDescription;
import org.apache.nifi.annotation.documentation.Tags;
import org.apache.nifi.annotation.lifecycle.OnDisabled;
import org.apache.nifi.annotation.lifecycle.OnEnabled;
import org.apache.nifi.components.AllowableValue;
import org.apache.nifi.components.PropertyDescriptor;
import org.apache.nifi.components.ValidationContext;
import org.apache.nifi.components.ValidationResult;
import org.apache.nifi.controller.AbstractControllerService;
import org.apache.nifi.controller.ConfigurationContext;
import org.apache.nifi.controllers.vfs.exception.FileOperationException;
import org.apache.nifi.controllers.vfs.exception.UnsupportedFileOperationException;
import org.apache.nifi.controllers.vfs.ftp.FtpConnectionConfig;
import org.apache.nifi.controllers.vfs.ftp.FtpConnectionPool;
import org.apache.nifi.controllers.vfs.ftp.FtpConnectionPoolImpl;
import org.apache.nifi.controllers.vfs.ftp.FtpFileBackend;
import org.apache.nifi.controllers.vfs.local.LocalFileBackend;
import org.apache.nifi.controllers.vfs.sftp.SftpConnectionConfig;
import org.apache.nifi.controllers.vfs.sftp.SftpFileBackend;
import org.apache.nifi.controllers.vfs.url.UrlFileBackend;
import org.apache.nifi.expression.ExpressionLanguageScope;
import org.apache.nifi.processor.util.StandardValidators;
import org.apache.nifi.services.VirtualFileService;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Controller service exposing one backend through the virtual file contract. FTP connections are
 * pooled; SFTP uses one session; local and URL backends hold no connection.
 */
@Tags({"file", "ftp", "ftps", "sftp", "http", "virtual", "filesystem"})
@CapabilityDescription("Provides files on the local disk, an FTP/FTPS server, an SFTP server or a web server "
        + "through one contract for navigation, reading, writing, copying and traversal.")
public class StandardVirtualFileService extends AbstractControllerService implements VirtualFileService {

    public static final AllowableValue BACKEND_LOCAL = new AllowableValue("LOCAL", "Local",
            "Files on the disk of the NiFi node");
    public static final AllowableValue BACKEND_FTP = new AllowableValue("FTP", "FTP",
            "Files on an FTP or FTPS server");
    public static final AllowableValue BACKEND_SFTP = new AllowableValue("SFTP", "SFTP",
            "Files on an SSH server");
    public static final AllowableValue BACKEND_URL = new AllowableValue("URL", "URL",
            "Read-only files on an HTTP or HTTPS server");

    public static final AllowableValue FTP_PLAIN = new AllowableValue("NONE", "None", "Plain FTP");
    public static final AllowableValue FTPS_IMPLICIT = new AllowableValue("IMPLICIT", "Implicit FTPS",
            "TLS from the first byte, usually on port 990");
    public static final AllowableValue FTPS_EXPLICIT = new AllowableValue("EXPLICIT", "Explicit FTPS",
            "Plain connection upgraded with AUTH TLS");

    public static final PropertyDescriptor BACKEND_TYPE = new PropertyDescriptor.Builder()
            .name("Backend Type")
            .description("Where the files live")
            .required(true)
            .allowableValues(BACKEND_LOCAL, BACKEND_FTP, BACKEND_SFTP, BACKEND_URL)
            .defaultValue(BACKEND_LOCAL.getValue())
            .build();

    public static final PropertyDescriptor ROOT_PATH = new PropertyDescriptor.Builder()
            .name("Root Path")
            .description("The folder relative paths are resolved against. Relative local roots are resolved "
                    + "against the working directory of NiFi. Ignored for URL backends")
            .required(true)
            .defaultValue("/")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.NON_EMPTY_VALIDATOR)
            .build();

    public static final PropertyDescriptor BASE_URL = new PropertyDescriptor.Builder()
            .name("Base URL")
            .description("The http or https URL relative paths are resolved against, for URL backends")
            .required(false)
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.URL_VALIDATOR)
            .build();

    public static final PropertyDescriptor HOSTNAME = new PropertyDescriptor.Builder()
            .name("Hostname")
            .description("The hostname of the FTP or SFTP server")
            .required(false)
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.NON_EMPTY_VALIDATOR)
            .build();

    public static final PropertyDescriptor PORT = new PropertyDescriptor.Builder()
            .name("Port")
            .description("The port of the FTP or SFTP server. Defaults to 21 for FTP and 22 for SFTP")
            .required(false)
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.PORT_VALIDATOR)
            .build();

    public static final PropertyDescriptor USERNAME = new PropertyDescriptor.Builder()
            .name("Username")
            .description("The username to log in with. FTP logs in anonymously when none is set")
            .required(false)
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.NON_EMPTY_VALIDATOR)
            .build();

    public static final PropertyDescriptor PASSWORD = new PropertyDescriptor.Builder()
            .name("Password")
            .description("The password to log in with")
            .required(false)
            .sensitive(true)
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.NON_EMPTY_VALIDATOR)
            .build();

    public static final PropertyDescriptor CONNECTION_TIMEOUT = new PropertyDescriptor.Builder()
            .name("Connection Timeout")
            .description("The amount of time to wait when connecting to the server before timing out")
            .required(true)
            .defaultValue("30 sec")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.TIME_PERIOD_VALIDATOR)
            .build();

    public static final PropertyDescriptor DATA_TIMEOUT = new PropertyDescriptor.Builder()
            .name("Data Timeout")
            .description("The amount of time to wait when transferring data to/from the FTP server before timing out")
            .required(true)
            .defaultValue("60 sec")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.TIME_PERIOD_VALIDATOR)
            .build();

    public static final PropertyDescriptor ACTIVE_MODE = new PropertyDescriptor.Builder()
            .name("Active Mode")
            .description("Whether to use active mode for the FTP connection")
            .required(true)
            .allowableValues("true", "false")
            .defaultValue("false")
            .build();

    public static final PropertyDescriptor MAX_CONNECTIONS = new PropertyDescriptor.Builder()
            .name("Max Connections")
            .description("The maximum number of FTP connections to maintain in the connection pool")
            .required(true)
            .defaultValue("10")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.POSITIVE_INTEGER_VALIDATOR)
            .build();

    public static final PropertyDescriptor MIN_CONNECTIONS = new PropertyDescriptor.Builder()
            .name("Min Connections")
            .description("The minimum number of idle FTP connections to keep in the connection pool")
            .required(true)
            .defaultValue("0")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.NON_NEGATIVE_INTEGER_VALIDATOR)
            .build();

    public static final PropertyDescriptor CONNECTION_IDLE_TIMEOUT = new PropertyDescriptor.Builder()
            .name("Connection Idle Timeout")
            .description("The amount of time to allow a pooled FTP connection to remain idle before closing it")
            .required(true)
            .defaultValue("5 min")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.TIME_PERIOD_VALIDATOR)
            .build();

    public static final PropertyDescriptor BUFFER_SIZE = new PropertyDescriptor.Builder()
            .name("Buffer Size")
            .description("The buffer size to use when transferring data over FTP")
            .required(true)
            .defaultValue("1 MB")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.DATA_SIZE_VALIDATOR)
            .build();

    public static final PropertyDescriptor CONTROL_ENCODING = new PropertyDescriptor.Builder()
            .name("Control Encoding")
            .description("The character encoding to use for the FTP control channel")
            .required(true)
            .defaultValue("UTF-8")
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.CHARACTER_SET_VALIDATOR)
            .build();

    public static final PropertyDescriptor FTP_SECURITY = new PropertyDescriptor.Builder()
            .name("FTP Security")
            .description("Whether and how FTP connections are protected with TLS")
            .required(true)
            .allowableValues(FTP_PLAIN, FTPS_IMPLICIT, FTPS_EXPLICIT)
            .defaultValue(FTP_PLAIN.getValue())
            .build();

    public static final PropertyDescriptor VALIDATE_SERVER_CERTIFICATE = new PropertyDescriptor.Builder()
            .name("Validate Server Certificate")
            .description("Whether to validate the FTPS server's certificate")
            .required(true)
            .allowableValues("true", "false")
            .defaultValue("true")
            .build();

    public static final PropertyDescriptor PRIVATE_KEY_PATH = new PropertyDescriptor.Builder()
            .name("Private Key Path")
            .description("The private key file to authenticate to the SFTP server with")
            .required(false)
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.FILE_EXISTS_VALIDATOR)
            .build();

    public static final PropertyDescriptor PRIVATE_KEY_PASSPHRASE = new PropertyDescriptor.Builder()
            .name("Private Key Passphrase")
            .description("The passphrase of the private key")
            .required(false)
            .sensitive(true)
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.NON_EMPTY_VALIDATOR)
            .build();

    public static final PropertyDescriptor STRICT_HOST_KEY_CHECKING = new PropertyDescriptor.Builder()
            .name("Strict Host Key Checking")
            .description("Whether to refuse SFTP servers whose host key is not in the known hosts file")
            .required(true)
            .allowableValues("true", "false")
            .defaultValue("true")
            .build();

    public static final PropertyDescriptor KNOWN_HOSTS_FILE = new PropertyDescriptor.Builder()
            .name("Known Hosts File")
            .description("The known hosts file to check SFTP host keys against")
            .required(false)
            .expressionLanguageSupported(ExpressionLanguageScope.VARIABLE_REGISTRY)
            .addValidator(StandardValidators.FILE_EXISTS_VALIDATOR)
            .build();

    private static final List<PropertyDescriptor> properties;

    static {
        final List<PropertyDescriptor> props = new ArrayList<>();
        props.add(BACKEND_TYPE);
        props.add(ROOT_PATH);
        props.add(BASE_URL);

        // Server and credentials
        props.add(HOSTNAME);
        props.add(PORT);
        props.add(USERNAME);
        props.add(PASSWORD);
        props.add(CONNECTION_TIMEOUT);

        // FTP
        props.add(DATA_TIMEOUT);
        props.add(ACTIVE_MODE);
        props.add(MAX_CONNECTIONS);
        props.add(MIN_CONNECTIONS);
        props.add(CONNECTION_IDLE_TIMEOUT);
        props.add(BUFFER_SIZE);
        props.add(CONTROL_ENCODING);
        props.add(FTP_SECURITY);
        props.add(VALIDATE_SERVER_CERTIFICATE);

        // SFTP
        props.add(PRIVATE_KEY_PATH);
        props.add(PRIVATE_KEY_PASSPHRASE);
        props.add(STRICT_HOST_KEY_CHECKING);
        props.add(KNOWN_HOSTS_FILE);

        properties = Collections.unmodifiableList(props);
    }

    private volatile FtpConnectionPool connectionPool;
    private volatile SftpFileBackend sftpBackend;
    private volatile ReadableFile root;

    @Override
    protected List<PropertyDescriptor> getSupportedPropertyDescriptors() {
        return properties;
    }

    @Override
    protected Collection<ValidationResult> customValidate(ValidationContext validationContext) {
        final List<ValidationResult> results = new ArrayList<>();
        final String backendType = validationContext.getProperty(BACKEND_TYPE).getValue();

        final int minConnections = validationContext.getProperty(MIN_CONNECTIONS).evaluateAttributeExpressions().asInteger();
        final int maxConnections = validationContext.getProperty(MAX_CONNECTIONS).evaluateAttributeExpressions().asInteger();
        if (minConnections > maxConnections) {
            results.add(new ValidationResult.Builder()
                    .subject("Connection Pool Configuration")
                    .valid(false)
                    .explanation("Min Connections cannot be greater than Max Connections")
                    .build());
        }

        final boolean remote = BACKEND_FTP.getValue().equals(backendType) || BACKEND_SFTP.getValue().equals(backendType);
        if (remote && !validationContext.getProperty(HOSTNAME).isSet()) {
            results.add(new ValidationResult.Builder()
                    .subject(HOSTNAME.getName())
                    .valid(false)
                    .explanation("Hostname is required for " + backendType + " backends")
                    .build());
        }

        if (BACKEND_SFTP.getValue().equals(backendType)) {
            if (!validationContext.getProperty(USERNAME).isSet()) {
                results.add(new ValidationResult.Builder()
                        .subject(USERNAME.getName())
                        .valid(false)
                        .explanation("Username is required for SFTP backends")
                        .build());
            }
            if (!validationContext.getProperty(PASSWORD).isSet() && !validationContext.getProperty(PRIVATE_KEY_PATH).isSet()) {
                results.add(new ValidationResult.Builder()
                        .subject("SFTP Authentication")
                        .valid(false)
                        .explanation("Either Password or Private Key Path must be set for SFTP backends")
                        .build());
            }
        }

        if (BACKEND_URL.getValue().equals(backendType) && !validationContext.getProperty(BASE_URL).isSet()) {
            results.add(new ValidationResult.Builder()
                    .subject(BASE_URL.getName())
                    .valid(false)
                    .explanation("Base URL is required for URL backends")
                    .build());
        }

        return results;
    }

    @OnEnabled
    public void onEnabled(final ConfigurationContext context) {
        final String backendType = context.getProperty(BACKEND_TYPE).getValue();
        final String rootPath = context.getProperty(ROOT_PATH).evaluateAttributeExpressions().getValue();

        if (BACKEND_FTP.getValue().equals(backendType)) {
            FtpConnectionConfig config = FtpConnectionConfig.fromContext(context, getLogger());
            connectionPool = createConnectionPool(config);
            root = new FtpFileBackend(connectionPool, config).file(rootPath);
        } else if (BACKEND_SFTP.getValue().equals(backendType)) {
            sftpBackend = new SftpFileBackend(SftpConnectionConfig.fromContext(context, getLogger()));
            root = sftpBackend.file(rootPath);
        } else if (BACKEND_URL.getValue().equals(backendType)) {
            long timeout = context.getProperty(CONNECTION_TIMEOUT).evaluateAttributeExpressions().asTimePeriod(TimeUnit.MILLISECONDS);
            String baseUrl = context.getProperty(BASE_URL).evaluateAttributeExpressions().getValue();
            root = new UrlFileBackend(Duration.ofMillis(timeout)).file(baseUrl);
        } else {
            root = LocalFileBackend.getInstance().file(rootPath);
        }

        getLogger().info("Initialized Virtual File Service with {} backend rooted at {}",
                new Object[] { backendType, root });

        if (!testConnection()) {
            getLogger().warn("Root {} could not be reached", new Object[] { root });
        }
    }

    @OnDisabled
    public void onDisabled() {
        // Marked files are deleted while their backend can still reach them
        int failures = DeleteOnExitRegistry.getInstance().runCleanup();
        if (failures > 0) {
            getLogger().warn("Failed to delete {} files marked for deletion", new Object[] { failures });
        }

        if (connectionPool != null) {
            connectionPool.shutdown();
            connectionPool = null;
        }
        if (sftpBackend != null) {
            sftpBackend.close();
            sftpBackend = null;
        }
        root = null;
    }

    /**
     * Creates the pool of FTP connections used while the service is enabled.
     */
    protected FtpConnectionPool createConnectionPool(FtpConnectionConfig config) {
        return new FtpConnectionPoolImpl(config, getLogger());
    }

    @Override
    public ReadableFile getRoot() {
        final ReadableFile current = root;
        if (current == null) {
            throw new IllegalStateException("Virtual File Service is not enabled");
        }
        return current;
    }

    @Override
    public ReadableFile getFile(String path) {
        return getRoot().child(path);
    }

    @Override
    public ReadWriteFile getWritableFile(String path) {
        final ReadableFile file = getFile(path);
        if (!(file instanceof ReadWriteFile)) {
            throw new UnsupportedFileOperationException(file.getPath(), "Backend of " + file + " is read-only");
        }
        return (ReadWriteFile) file;
    }

    @Override
    public boolean testConnection() {
        final ReadableFile current = root;
        if (current == null) {
            getLogger().warn("Cannot test connection because service is not enabled");
            return false;
        }

        try {
            boolean reachable = current.exists();
            getLogger().debug("Tested root {}: {}", new Object[] { current, reachable ? "exists" : "missing" });
            return reachable;
        } catch (IOException | FileOperationException e) {
            getLogger().error("Error testing connection to {}", new Object[] { current, e });
            return false;
        }
    }
}
