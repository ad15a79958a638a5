package org.apache.nifi.controllers.vfs.sftp;

import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpATTRS;
import com.jcraft.jsch.SftpException;
import org.apache.nifi.controllers.vfs.FileBackend;
import org.apache.nifi.controllers.vfs.FileType;
import org.apache.nifi.controllers.vfs.attribute.AttributeKind;
import org.apache.nifi.controllers.vfs.attribute.AttributeSet;
import org.apache.nifi.controllers.vfs.attribute.PosixPermissions;
import org.apache.nifi.controllers.vfs.exception.AuthenticationException;
import org.apache.nifi.controllers.vfs.exception.BackendConnectionException;
import org.apache.nifi.controllers.vfs.exception.FileErrorType;
import org.apache.nifi.controllers.vfs.exception.FileOperationException;
import org.apache.nifi.controllers.vfs.exception.NotAFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.FilterInputStream;
import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Vector;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Files on an SSH server, through one JSch session.
 * <p>
 * Metadata requests share a single SFTP channel and are serialized on this backend. Each stream opens a
 * channel of its own on the same session and closes it with the stream, so a copy can read and write on
 * the same server at once. The session is opened on first use and reopened if it drops.
 */
public class SftpFileBackend implements FileBackend, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SftpFileBackend.class);

    private static final int PERMISSION_BITS = 0777;

    private final SftpConnectionConfig config;

    private Session session;
    private ChannelSftp channel;

    public SftpFileBackend(SftpConnectionConfig config) {
        this.config = config;
    }

    @FunctionalInterface
    private interface SftpCall<T> {
        T call(ChannelSftp channel) throws SftpException, IOException;
    }

    /**
     * Runs a request on the shared channel, translating SFTP failures with a follow-up lookup of
     * {@code lookupPath} when one is given.
     */
    private synchronized <T> T execute(String path, String lookupPath, SftpCall<T> call) throws IOException {
        ChannelSftp current = channel();
        try {
            return call.call(current);
        } catch (SftpException e) {
            FileType existing = null;
            if (e.id == ChannelSftp.SSH_FX_FAILURE && lookupPath != null) {
                try {
                    existing = typeOf(current, lookupPath);
                } catch (SftpException lookupFailure) {
                    e.addSuppressed(lookupFailure);
                }
            }
            throw SftpErrorTranslator.translate(e, path, existing);
        }
    }

    private ChannelSftp channel() throws IOException {
        if (channel == null || !channel.isConnected()) {
            channel = openChannel();
        }
        return channel;
    }

    /**
     * Opens and connects a new SFTP channel on the session, opening the session first if needed.
     *
     * @return the connected channel
     * @throws IOException if the server cannot be reached or rejects the credentials
     */
    protected ChannelSftp openChannel() throws IOException {
        Session current = session();
        try {
            ChannelSftp opened = (ChannelSftp) current.openChannel("sftp");
            opened.connect(config.getConnectionTimeout());
            return opened;
        } catch (JSchException e) {
            throw connectionFailure(e);
        }
    }

    private synchronized Session session() throws IOException {
        if (session != null && session.isConnected()) {
            return session;
        }

        LOGGER.debug("Connecting to SFTP server {}:{} as {}", config.getHostname(), config.getPort(), config.getUsername());
        try {
            JSch jsch = new JSch();
            if (config.getKnownHostsFile() != null) {
                jsch.setKnownHosts(config.getKnownHostsFile());
            }
            if (config.getPrivateKeyPath() != null) {
                jsch.addIdentity(config.getPrivateKeyPath(), config.getPrivateKeyPassphrase());
            }

            Session opened = jsch.getSession(config.getUsername(), config.getHostname(), config.getPort());
            if (config.getPassword() != null) {
                opened.setPassword(config.getPassword());
            }
            opened.setConfig("StrictHostKeyChecking", config.isStrictHostKeyChecking() ? "yes" : "no");
            opened.connect(config.getConnectionTimeout());
            session = opened;
        } catch (JSchException e) {
            throw connectionFailure(e);
        }

        LOGGER.debug("SFTP session established to {}:{}", config.getHostname(), config.getPort());
        return session;
    }

    private FileOperationException connectionFailure(JSchException e) {
        String message = e.getMessage() == null ? "" : e.getMessage();
        if (message.startsWith("Auth fail") || message.startsWith("Auth cancel")) {
            return new AuthenticationException(config.getHostname(), config.getPort(), config.getUsername(), -1,
                    "Failed to login to SFTP server as user " + config.getUsername() + ": " + message, e);
        }
        return new BackendConnectionException(FileErrorType.CONNECTION_ERROR, config.getHostname(), config.getPort(),
                -1, "Failed to connect to SFTP server: " + message, e);
    }

    /**
     * Disconnects the shared channel and the session. Open streams fail afterwards.
     */
    @Override
    public synchronized void close() {
        if (channel != null) {
            channel.disconnect();
            channel = null;
        }
        if (session != null) {
            LOGGER.debug("Disconnecting SFTP session to {}:{}", config.getHostname(), config.getPort());
            session.disconnect();
            session = null;
        }
    }

    @Override
    public String getSeparator() {
        return "/";
    }

    @Override
    public FileType lstat(String path) throws IOException {
        return execute(path, null, current -> typeOf(current, path));
    }

    private static FileType typeOf(ChannelSftp current, String path) throws SftpException {
        SftpATTRS attrs;
        try {
            attrs = current.lstat(path);
        } catch (SftpException e) {
            if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                return FileType.ABSENT;
            }
            throw e;
        }

        if (attrs.isLink()) {
            return FileType.LINK;
        } else if (attrs.isDir()) {
            return FileType.FOLDER;
        } else if (attrs.isReg()) {
            return FileType.FILE;
        }
        return FileType.OTHER;
    }

    @Override
    public String readlink(String path) throws IOException {
        return execute(path, null, current -> current.readlink(path));
    }

    @Override
    public InputStream openRead(String path) throws IOException {
        boolean folder = execute(path, null, current -> current.stat(path).isDir());
        if (folder) {
            throw new NotAFileException(path, "Cannot read a folder: " + path);
        }

        final ChannelSftp streamChannel = openChannel();
        final InputStream sftpStream;
        try {
            LOGGER.debug("Opening stream to read {}", path);
            sftpStream = streamChannel.get(path);
        } catch (SftpException e) {
            streamChannel.disconnect();
            throw SftpErrorTranslator.translate(e, path, null);
        }

        final AtomicBoolean closed = new AtomicBoolean(false);
        return new FilterInputStream(sftpStream) {
            @Override
            public void close() throws IOException {
                if (closed.compareAndSet(false, true)) {
                    try {
                        super.close();
                    } finally {
                        streamChannel.disconnect();
                    }
                }
            }
        };
    }

    @Override
    public OutputStream openWrite(String path, boolean append) throws IOException {
        final ChannelSftp streamChannel = openChannel();
        final OutputStream sftpStream;
        try {
            LOGGER.debug("Opening stream to {} {}", append ? "append to" : "write", path);
            sftpStream = streamChannel.put(path, append ? ChannelSftp.APPEND : ChannelSftp.OVERWRITE);
        } catch (SftpException e) {
            streamChannel.disconnect();
            if (e.id == ChannelSftp.SSH_FX_FAILURE && lstat(path) == FileType.FOLDER) {
                throw new NotAFileException(path, e.id, "Cannot write a folder: " + path, e);
            }
            throw SftpErrorTranslator.translate(e, path, null);
        }

        final AtomicBoolean closed = new AtomicBoolean(false);
        return new FilterOutputStream(sftpStream) {
            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException {
                if (closed.compareAndSet(false, true)) {
                    try {
                        super.close();
                    } finally {
                        streamChannel.disconnect();
                    }
                }
            }
        };
    }

    @Override
    public List<String> listNames(String path) throws IOException {
        return execute(path, null, current -> {
            SftpATTRS attrs;
            try {
                attrs = current.stat(path);
            } catch (SftpException e) {
                if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                    return null;
                }
                throw e;
            }
            if (!attrs.isDir()) {
                return null;
            }

            Vector<ChannelSftp.LsEntry> entries = current.ls(path);
            List<String> names = new ArrayList<>();
            for (ChannelSftp.LsEntry entry : entries) {
                String name = entry.getFilename();
                if (!".".equals(name) && !"..".equals(name)) {
                    names.add(name);
                }
            }
            Collections.sort(names);
            return names;
        });
    }

    @Override
    public void mkdir(String path) throws IOException {
        execute(path, path, current -> {
            LOGGER.debug("Creating folder {}", path);
            current.mkdir(path);
            return null;
        });
    }

    @Override
    public void remove(String path) throws IOException {
        execute(path, null, current -> {
            LOGGER.debug("Deleting {}", path);
            current.rm(path);
            return null;
        });
    }

    @Override
    public void rmdir(String path) throws IOException {
        execute(path, null, current -> {
            LOGGER.debug("Removing folder {}", path);
            try {
                current.rmdir(path);
            } catch (SftpException e) {
                if (e.id == ChannelSftp.SSH_FX_FAILURE) {
                    // ls includes "." and ".." on most servers
                    for (ChannelSftp.LsEntry entry : current.ls(path)) {
                        String name = entry.getFilename();
                        if (!".".equals(name) && !"..".equals(name)) {
                            throw new FileOperationException(FileErrorType.DIRECTORY_NOT_EMPTY, path, e.id,
                                    "Folder is not empty: " + path, e);
                        }
                    }
                }
                throw e;
            }
            return null;
        });
    }

    @Override
    public void symlink(String path, String target) throws IOException {
        execute(path, path, current -> {
            LOGGER.debug("Linking {} to {}", path, target);
            current.symlink(target, path);
            return null;
        });
    }

    @Override
    public long size(String path) throws IOException {
        return execute(path, null, current -> current.stat(path).getSize());
    }

    @Override
    public boolean supportsRename() {
        return true;
    }

    /**
     * SFTP version 3 renames refuse to replace an existing target.
     */
    @Override
    public void rename(String from, String to) throws IOException {
        execute(to, to, current -> {
            LOGGER.debug("Renaming {} to {}", from, to);
            current.rename(from, to);
            return null;
        });
    }

    @Override
    public Map<AttributeKind<?>, AttributeSet> attributes(String path) throws IOException {
        FileType type = lstat(path);
        if (type == FileType.ABSENT || type == FileType.LINK) {
            return Collections.emptyMap();
        }
        return Collections.singletonMap(AttributeKind.POSIX_PERMISSIONS, new SftpPosixPermissions(path));
    }

    @Override
    public int getDefaultBlockSize() {
        return config.getBlockSize();
    }

    @Override
    public boolean sameBackend(FileBackend other) {
        if (!(other instanceof SftpFileBackend)) {
            return false;
        }
        SftpConnectionConfig that = ((SftpFileBackend) other).config;
        return Objects.equals(config.getHostname(), that.getHostname())
                && config.getPort() == that.getPort()
                && Objects.equals(config.getUsername(), that.getUsername());
    }

    public SftpConnectionConfig getConfig() {
        return config;
    }

    @Override
    public String toString() {
        return "sftp://" + config.getUsername() + "@" + config.getHostname() + ":" + config.getPort();
    }

    private class SftpPosixPermissions extends PosixPermissions {
        private final String path;

        SftpPosixPermissions(String path) {
            this.path = path;
        }

        @Override
        public int getMode() throws IOException {
            return execute(path, null, current -> current.stat(path).getPermissions() & PERMISSION_BITS);
        }

        @Override
        public void setMode(int mode) throws IOException {
            execute(path, null, current -> {
                LOGGER.debug("Changing mode of {} to {}", path, Integer.toOctalString(mode));
                current.chmod(mode & PERMISSION_BITS, path);
                return null;
            });
        }
    }
}
