package org.apache.nifi.controllers.vfs.local;

import org.apache.nifi.controllers.vfs.FileBackend;
import org.apache.nifi.controllers.vfs.FileType;
import org.apache.nifi.controllers.vfs.ReadWriteFile;
import org.apache.nifi.controllers.vfs.attribute.AttributeKind;
import org.apache.nifi.controllers.vfs.attribute.AttributeSet;
import org.apache.nifi.controllers.vfs.exception.FileErrorTranslator;
import org.apache.nifi.controllers.vfs.exception.FileErrorType;
import org.apache.nifi.controllers.vfs.exception.FileOperationException;
import org.apache.nifi.controllers.vfs.exception.NotAFileException;
import org.apache.nifi.controllers.vfs.exception.UnsupportedFileOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileStore;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.UserDefinedFileAttributeView;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Files on the local disk, through java.nio.
 * <p>
 * Regular files and folders expose POSIX permissions and user extended attributes when the file store
 * supports them. Symbolic links expose neither: java.nio cannot change a link's own mode, and applying
 * it would change the link's target instead.
 */
public class LocalFileBackend implements FileBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileBackend.class);

    private static final LocalFileBackend INSTANCE = new LocalFileBackend(FileSystems.getDefault());

    private final FileSystem fileSystem;

    LocalFileBackend(FileSystem fileSystem) {
        this.fileSystem = fileSystem;
    }

    public static LocalFileBackend getInstance() {
        return INSTANCE;
    }

    /**
     * Gets the folder the JVM was started in.
     */
    public ReadWriteFile workingDirectory() {
        return root().child(System.getProperty("user.dir"));
    }

    /**
     * Gets the system temporary folder.
     */
    public ReadWriteFile temporaryDirectory() {
        return root().child(System.getProperty("java.io.tmpdir"));
    }

    /**
     * Creates a new, uniquely named folder in the system temporary folder.
     *
     * @param prefix the start of the folder name
     * @return the created folder
     * @throws IOException if the folder cannot be created
     */
    public ReadWriteFile createTemporaryFolder(String prefix) throws IOException {
        return temporaryDirectory().createTemporaryFolder(prefix);
    }

    /**
     * Relative paths are resolved against the working directory.
     */
    @Override
    public ReadWriteFile file(String path) {
        return workingDirectory().child(path);
    }

    /**
     * Gets a handle for a java.nio path.
     */
    public ReadWriteFile file(Path path) {
        return root().child(path.toAbsolutePath().toString());
    }

    @Override
    public String getSeparator() {
        return fileSystem.getSeparator();
    }

    @Override
    public FileType lstat(String path) throws IOException {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(toPath(path), BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException e) {
            FileOperationException translated = FileErrorTranslator.translate(e, path);
            if (translated == null) {
                throw e;
            }
            // A path below a regular file holds nothing, the same as a missing one
            if (translated.getErrorType() == FileErrorType.NOT_FOUND
                    || translated.getErrorType() == FileErrorType.NOT_A_DIRECTORY) {
                return FileType.ABSENT;
            }
            throw translated;
        }

        if (attributes.isSymbolicLink()) {
            return FileType.LINK;
        } else if (attributes.isDirectory()) {
            return FileType.FOLDER;
        } else if (attributes.isRegularFile()) {
            return FileType.FILE;
        }
        return FileType.OTHER;
    }

    @Override
    public String readlink(String path) throws IOException {
        try {
            return Files.readSymbolicLink(toPath(path)).toString();
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path);
        }
    }

    @Override
    public InputStream openRead(String path) throws IOException {
        Path p = toPath(path);
        // Opening a folder succeeds on Linux and only the first read fails
        if (Files.isDirectory(p)) {
            throw new NotAFileException(path, "Cannot read a folder: " + path);
        }
        try {
            return Files.newInputStream(p);
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path);
        }
    }

    @Override
    public OutputStream openWrite(String path, boolean append) throws IOException {
        try {
            return Files.newOutputStream(toPath(path), StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    append ? StandardOpenOption.APPEND : StandardOpenOption.TRUNCATE_EXISTING);
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path);
        }
    }

    @Override
    public List<String> listNames(String path) throws IOException {
        Path p = toPath(path);
        if (!Files.isDirectory(p)) {
            return null;
        }
        try (Stream<Path> entries = Files.list(p)) {
            return entries.map(entry -> entry.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path);
        }
    }

    @Override
    public void mkdir(String path) throws IOException {
        try {
            Files.createDirectory(toPath(path));
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path);
        }
    }

    @Override
    public void remove(String path) throws IOException {
        try {
            Files.delete(toPath(path));
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path);
        }
    }

    @Override
    public void rmdir(String path) throws IOException {
        remove(path);
    }

    @Override
    public void symlink(String path, String target) throws IOException {
        LOGGER.debug("Linking {} to {}", path, target);
        try {
            Files.createSymbolicLink(toPath(path), fileSystem.getPath(target));
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path);
        }
    }

    @Override
    public long size(String path) throws IOException {
        try {
            return Files.size(toPath(path));
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, path);
        }
    }

    @Override
    public boolean supportsRename() {
        return true;
    }

    @Override
    public void rename(String from, String to) throws IOException {
        try {
            Files.move(toPath(from), toPath(to), StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            throw new UnsupportedFileOperationException(from, -1,
                    "Cannot rename " + from + " to " + to + " atomically", e);
        } catch (IOException e) {
            throw FileErrorTranslator.propagate(e, from);
        }
    }

    @Override
    public Map<AttributeKind<?>, AttributeSet> attributes(String path) throws IOException {
        FileType type = lstat(path);
        if (type == FileType.ABSENT || type == FileType.LINK) {
            return Collections.emptyMap();
        }

        Path p = toPath(path);
        FileStore store = Files.getFileStore(p);
        Map<AttributeKind<?>, AttributeSet> result = new LinkedHashMap<>();
        if (store.supportsFileAttributeView(PosixFileAttributeView.class)) {
            result.put(AttributeKind.POSIX_PERMISSIONS, new LocalPosixPermissions(p));
        }
        if (store.supportsFileAttributeView(UserDefinedFileAttributeView.class)) {
            result.put(AttributeKind.EXTENDED_ATTRIBUTES, new LocalExtendedAttributes(p));
        }
        return result;
    }

    @Override
    public boolean sameBackend(FileBackend other) {
        return other instanceof LocalFileBackend && fileSystem.equals(((LocalFileBackend) other).fileSystem);
    }

    private Path toPath(String path) {
        return fileSystem.getPath(path);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof LocalFileBackend && fileSystem.equals(((LocalFileBackend) o).fileSystem);
    }

    @Override
    public int hashCode() {
        return fileSystem.hashCode();
    }

    @Override
    public String toString() {
        return "local";
    }
}
