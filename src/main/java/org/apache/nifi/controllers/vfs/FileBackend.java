package org.apache.nifi.controllers.vfs;

import org.apache.nifi.controllers.vfs.attribute.AttributeKind;
import org.apache.nifi.controllers.vfs.attribute.AttributeSet;
import org.apache.nifi.controllers.vfs.exception.UnsupportedFileOperationException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Native operations a transport supplies to {@link FileHandle}. Everything else, such as recursive
 * deletes, folder creation policy and copying, is built on top of these by the handle.
 * <p>
 * Paths passed to these methods are absolute, in the backend's own syntax. Failures are reported with the
 * {@link org.apache.nifi.controllers.vfs.exception.FileOperationException} hierarchy where the cause is
 * known; anything else propagates as the transport's own {@link IOException}.
 */
public interface FileBackend {

    String getSeparator();

    /**
     * Gets what the path holds, without following a final symbolic link.
     *
     * @param path the path
     * @return the type, {@link FileType#ABSENT} if nothing is there
     * @throws IOException if the backend fails
     */
    FileType lstat(String path) throws IOException;

    /**
     * Reads the text of a symbolic link.
     */
    String readlink(String path) throws IOException;

    InputStream openRead(String path) throws IOException;

    /**
     * Opens a file for writing, creating it when missing.
     *
     * @param path the path
     * @param append true to write after the existing content, false to truncate
     * @return the stream
     * @throws IOException if the file cannot be opened
     */
    OutputStream openWrite(String path, boolean append) throws IOException;

    /**
     * Lists a folder, following links.
     *
     * @param path the path
     * @return the child names in sorted order, or null if the path is not a folder
     * @throws IOException if the backend fails
     */
    List<String> listNames(String path) throws IOException;

    /**
     * Creates one folder. Fails if the parent is missing or the path is occupied.
     */
    void mkdir(String path) throws IOException;

    /**
     * Removes a file or link.
     */
    void remove(String path) throws IOException;

    /**
     * Removes an empty folder.
     */
    void rmdir(String path) throws IOException;

    /**
     * Creates a symbolic link at {@code path} whose text is {@code target}, verbatim.
     */
    void symlink(String path, String target) throws IOException;

    /**
     * Gets the size of a regular file.
     */
    long size(String path) throws IOException;

    /**
     * Whether {@link #rename(String, String)} is available.
     */
    default boolean supportsRename() {
        return false;
    }

    default void rename(String from, String to) throws IOException {
        throw new UnsupportedFileOperationException(from, "Backend has no native rename");
    }

    /**
     * Gets the metadata sets available for a path.
     */
    default Map<AttributeKind<?>, AttributeSet> attributes(String path) throws IOException {
        return Collections.emptyMap();
    }

    default int getDefaultBlockSize() {
        return FileBlocks.DEFAULT_BLOCK_SIZE;
    }

    /**
     * Whether handles from this backend and the other one can name the same files. By default this holds
     * for backends of the same type.
     */
    default boolean sameBackend(FileBackend other) {
        return other != null && getClass() == other.getClass();
    }

    default boolean isAbsolute(String path) {
        return path.startsWith(getSeparator());
    }

    /**
     * Splits an absolute path into components. The first component names the root, and is empty on
     * backends with a single root.
     *
     * @param path an absolute path
     * @return the components
     */
    default List<String> split(String path) {
        List<String> components = new ArrayList<>();
        components.add("");
        for (String part : path.split(java.util.regex.Pattern.quote(getSeparator()))) {
            if (!part.isEmpty()) {
                components.add(part);
            }
        }
        return components;
    }

    /**
     * Gets the root folder of this backend.
     */
    default ReadWriteFile root() {
        return new FileHandle(this, Collections.singletonList(""));
    }

    /**
     * Gets a handle for a path. Relative paths are resolved against the root.
     *
     * @param path the path
     * @return the handle
     */
    default ReadWriteFile file(String path) {
        return root().child(path);
    }
}
