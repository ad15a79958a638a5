package org.apache.nifi.controllers.vfs.ftp;

import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.net.ftp.FTPReply;
import org.apache.nifi.controllers.vfs.FileBackend;
import org.apache.nifi.controllers.vfs.FileType;
import org.apache.nifi.controllers.vfs.attribute.AttributeKind;
import org.apache.nifi.controllers.vfs.attribute.AttributeSet;
import org.apache.nifi.controllers.vfs.attribute.PosixPermissions;
import org.apache.nifi.controllers.vfs.exception.AlreadyExistsException;
import org.apache.nifi.controllers.vfs.exception.FileErrorType;
import org.apache.nifi.controllers.vfs.exception.FileOperationException;
import org.apache.nifi.controllers.vfs.exception.NotAFileException;
import org.apache.nifi.controllers.vfs.exception.NotFoundException;
import org.apache.nifi.controllers.vfs.exception.UnsupportedFileOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Files on an FTP or FTPS server, reached through an {@link FtpConnectionPool}.
 * <p>
 * Every call borrows one connection and gives it back before returning, except the streams, which hold
 * their connection until they are closed. FTP has no command for symbolic links, so links can be read
 * from listings but not created.
 */
public class FtpFileBackend implements FileBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(FtpFileBackend.class);

    private final FtpConnectionPool connectionPool;
    private final FtpConnectionConfig config;

    public FtpFileBackend(FtpConnectionPool connectionPool, FtpConnectionConfig config) {
        this.connectionPool = connectionPool;
        this.config = config;
    }

    @FunctionalInterface
    private interface FtpCall<T> {
        T call(FTPClient client) throws IOException;
    }

    private <T> T execute(String path, FtpCall<T> call) throws IOException {
        FTPClient client = connectionPool.borrowConnection();
        try {
            return call.call(client);
        } catch (IOException e) {
            LOGGER.debug("Invalidating connection after failure on {}: {}", path, e.getMessage());
            connectionPool.invalidateConnection(client);
            client = null;
            throw e;
        } finally {
            if (client != null) {
                connectionPool.returnConnection(client);
            }
        }
    }

    @Override
    public String getSeparator() {
        return "/";
    }

    @Override
    public FileType lstat(String path) throws IOException {
        if ("/".equals(path)) {
            return FileType.FOLDER;
        }
        return execute(path, client -> typeOf(lookup(client, path)));
    }

    @Override
    public String readlink(String path) throws IOException {
        return execute(path, client -> {
            FTPFile entry = lookup(client, path);
            if (entry == null) {
                throw new NotFoundException(path, "No such link: " + path);
            }
            return entry.getLink();
        });
    }

    @Override
    public InputStream openRead(String path) throws IOException {
        final FTPClient client = connectionPool.borrowConnection();
        final InputStream ftpStream;
        try {
            LOGGER.debug("Opening stream to read {}", path);
            ftpStream = client.retrieveFileStream(path);
        } catch (IOException e) {
            connectionPool.invalidateConnection(client);
            throw e;
        }

        if (ftpStream == null) {
            try {
                int replyCode = client.getReplyCode();
                String replyString = client.getReplyString();
                FileType existing = typeOf(lookup(client, path));
                if (existing == FileType.FOLDER) {
                    throw new NotAFileException(path, replyCode, "Cannot read a folder: " + path, null);
                }
                throw FtpReplyTranslator.translate(replyCode, replyString, path, existing, config);
            } finally {
                connectionPool.returnConnection(client);
            }
        }

        final AtomicBoolean closed = new AtomicBoolean(false);
        return new FilterInputStream(ftpStream) {
            @Override
            public void close() throws IOException {
                if (closed.compareAndSet(false, true)) {
                    completeTransfer(client, path, super::close);
                }
            }
        };
    }

    @Override
    public OutputStream openWrite(String path, boolean append) throws IOException {
        final FTPClient client = connectionPool.borrowConnection();
        final OutputStream ftpStream;
        try {
            LOGGER.debug("Opening stream to {} {}", append ? "append to" : "write", path);
            ftpStream = append ? client.appendFileStream(path) : client.storeFileStream(path);
        } catch (IOException e) {
            connectionPool.invalidateConnection(client);
            throw e;
        }

        if (ftpStream == null) {
            try {
                throw failure(client, path, parentOf(path));
            } finally {
                connectionPool.returnConnection(client);
            }
        }

        final AtomicBoolean closed = new AtomicBoolean(false);
        return new FilterOutputStream(ftpStream) {
            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                out.write(b, off, len);
            }

            @Override
            public void close() throws IOException {
                if (closed.compareAndSet(false, true)) {
                    completeTransfer(client, path, super::close);
                }
            }
        };
    }

    @FunctionalInterface
    private interface StreamCloser {
        void close() throws IOException;
    }

    /**
     * Closes a data stream, then reads the transfer's final reply so the connection can be reused.
     */
    private void completeTransfer(FTPClient client, String path, StreamCloser closer) throws IOException {
        try {
            closer.close();
            if (!client.completePendingCommand()) {
                FileOperationException e = FtpReplyTranslator.translate(client.getReplyCode(), client.getReplyString(),
                        path, null, config);
                connectionPool.invalidateConnection(client);
                throw e;
            }
            connectionPool.returnConnection(client);
        } catch (IOException e) {
            connectionPool.invalidateConnection(client);
            throw e;
        }
    }

    @Override
    public List<String> listNames(String path) throws IOException {
        return execute(path, client -> {
            // Changing into the path follows links on the server side
            if (!client.changeWorkingDirectory(path)) {
                return null;
            }
            List<String> names = new ArrayList<>();
            for (FTPFile entry : client.listFiles()) {
                if (entry != null && !".".equals(entry.getName()) && !"..".equals(entry.getName())) {
                    names.add(entry.getName());
                }
            }
            Collections.sort(names);
            return names;
        });
    }

    @Override
    public void mkdir(String path) throws IOException {
        execute(path, client -> {
            LOGGER.debug("Creating folder {}", path);
            if (!client.makeDirectory(path)) {
                int replyCode = client.getReplyCode();
                if (lookup(client, path) != null) {
                    throw new AlreadyExistsException(path, replyCode, "Path already exists: " + path, null);
                }
                throw failure(client, path, parentOf(path));
            }
            return null;
        });
    }

    @Override
    public void remove(String path) throws IOException {
        execute(path, client -> {
            LOGGER.debug("Deleting {}", path);
            if (!client.deleteFile(path)) {
                throw failure(client, path, path);
            }
            return null;
        });
    }

    @Override
    public void rmdir(String path) throws IOException {
        execute(path, client -> {
            LOGGER.debug("Removing folder {}", path);
            if (!client.removeDirectory(path)) {
                int replyCode = client.getReplyCode();
                String replyString = client.getReplyString();
                FTPFile[] remaining = client.listFiles(path);
                if (remaining != null && remaining.length > 0) {
                    throw new FileOperationException(FileErrorType.DIRECTORY_NOT_EMPTY, path, replyCode,
                            "Folder is not empty: " + path, null);
                }
                throw FtpReplyTranslator.translate(replyCode, replyString, path, typeOf(lookup(client, path)), config);
            }
            return null;
        });
    }

    @Override
    public void symlink(String path, String target) {
        throw new UnsupportedFileOperationException(path, "FTP servers cannot create symbolic links");
    }

    @Override
    public long size(String path) throws IOException {
        return execute(path, client -> {
            FTPFile entry = lookup(client, path);
            if (entry == null) {
                throw new NotFoundException(path, "No such file: " + path);
            }
            return entry.getSize();
        });
    }

    @Override
    public boolean supportsRename() {
        return true;
    }

    @Override
    public void rename(String from, String to) throws IOException {
        execute(from, client -> {
            LOGGER.debug("Renaming {} to {}", from, to);
            if (!client.rename(from, to)) {
                throw failure(client, from, from);
            }
            return null;
        });
    }

    @Override
    public Map<AttributeKind<?>, AttributeSet> attributes(String path) throws IOException {
        FileType type = lstat(path);
        if (type == FileType.ABSENT || type == FileType.LINK || "/".equals(path)) {
            return Collections.emptyMap();
        }
        return Collections.singletonMap(AttributeKind.POSIX_PERMISSIONS, new FtpPosixPermissions(path));
    }

    @Override
    public boolean sameBackend(FileBackend other) {
        if (!(other instanceof FtpFileBackend)) {
            return false;
        }
        FtpConnectionConfig that = ((FtpFileBackend) other).config;
        return Objects.equals(config.getHostname(), that.getHostname())
                && config.getPort() == that.getPort()
                && Objects.equals(config.getUsername(), that.getUsername());
    }

    /**
     * Finds the listing entry for a path by listing its parent folder.
     *
     * @return the entry, or null if the parent has no such entry
     */
    private FTPFile lookup(FTPClient client, String path) throws IOException {
        String name = path.substring(path.lastIndexOf('/') + 1);
        FTPFile[] entries = client.listFiles(parentOf(path));
        if (entries != null) {
            for (FTPFile entry : entries) {
                if (entry != null && name.equals(entry.getName())) {
                    return entry;
                }
            }
        }
        return null;
    }

    private static FileType typeOf(FTPFile entry) {
        if (entry == null) {
            return FileType.ABSENT;
        } else if (entry.isSymbolicLink()) {
            return FileType.LINK;
        } else if (entry.isDirectory()) {
            return FileType.FOLDER;
        } else if (entry.isFile()) {
            return FileType.FILE;
        }
        return FileType.OTHER;
    }

    /**
     * Translates the client's last reply. A 550 reply is disambiguated by looking up {@code lookupPath}
     * afterwards; the reply is read first, since the lookup replaces it.
     */
    private FileOperationException failure(FTPClient client, String path, String lookupPath) throws IOException {
        int replyCode = client.getReplyCode();
        String replyString = client.getReplyString();
        FileType existing = null;
        if (replyCode == FTPReply.FILE_UNAVAILABLE && lookupPath != null) {
            existing = "/".equals(lookupPath) ? FileType.FOLDER : typeOf(lookup(client, lookupPath));
        }
        return FtpReplyTranslator.translate(replyCode, replyString, path, existing, config);
    }

    private static String parentOf(String path) {
        int index = path.lastIndexOf('/');
        return index <= 0 ? "/" : path.substring(0, index);
    }

    @Override
    public String toString() {
        return "ftp://" + config.getUsername() + "@" + config.getHostname() + ":" + config.getPort();
    }

    /**
     * Permission bits as shown in directory listings, changed with {@code SITE CHMOD}.
     */
    private class FtpPosixPermissions extends PosixPermissions {
        private final String path;

        FtpPosixPermissions(String path) {
            this.path = path;
        }

        @Override
        public int getMode() throws IOException {
            return execute(path, client -> {
                FTPFile entry = lookup(client, path);
                if (entry == null) {
                    throw new NotFoundException(path, "No such file: " + path);
                }
                int mode = 0;
                for (int access = FTPFile.USER_ACCESS; access <= FTPFile.WORLD_ACCESS; access++) {
                    for (int permission = FTPFile.READ_PERMISSION; permission <= FTPFile.EXECUTE_PERMISSION; permission++) {
                        if (entry.hasPermission(access, permission)) {
                            mode |= 1 << ((2 - access) * 3 + (2 - permission));
                        }
                    }
                }
                return mode;
            });
        }

        @Override
        public void setMode(int mode) throws IOException {
            execute(path, client -> {
                LOGGER.debug("Changing mode of {} to {}", path, Integer.toOctalString(mode));
                if (!client.sendSiteCommand("CHMOD " + Integer.toOctalString(mode) + " " + path)) {
                    throw failure(client, path, path);
                }
                return null;
            });
        }
    }
}
