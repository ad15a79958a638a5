package org.apache.nifi.controllers.vfs;

import org.apache.nifi.controllers.vfs.attribute.AttributeKind;
import org.apache.nifi.controllers.vfs.attribute.AttributeSet;
import org.apache.nifi.controllers.vfs.exception.AlreadyExistsException;
import org.apache.nifi.controllers.vfs.exception.NotADirectoryException;
import org.apache.nifi.controllers.vfs.exception.NotFoundException;
import org.apache.nifi.controllers.vfs.exception.UnsupportedFileOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * An immutable path on a {@link FileBackend}. Handles are obtained from {@link FileBackend#root()} and
 * {@link FileBackend#file(String)}, then navigated with {@link #child(String...)}.
 */
public final class FileHandle implements ReadWriteFile {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileHandle.class);

    private final FileBackend backend;
    private final List<String> components;

    FileHandle(FileBackend backend, List<String> components) {
        if (components.isEmpty()) {
            throw new IllegalArgumentException("A path needs at least its root component");
        }
        this.backend = backend;
        this.components = Collections.unmodifiableList(new ArrayList<>(components));
    }

    public FileBackend getBackend() {
        return backend;
    }

    @Override
    public FileHandle child(String... names) {
        List<String> result = new ArrayList<>(components);
        for (String name : names) {
            if (backend.isAbsolute(name)) {
                result = backend.split(name);
                continue;
            }
            for (String part : name.split(java.util.regex.Pattern.quote(getSeparator()))) {
                if (part.isEmpty() || ".".equals(part)) {
                    continue;
                }
                if ("..".equals(part)) {
                    // The root has no parent; ".." at the root stays there
                    if (result.size() > 1) {
                        result.remove(result.size() - 1);
                    }
                    continue;
                }
                result.add(part);
            }
        }
        return new FileHandle(backend, result);
    }

    @Override
    public FileHandle getParent() {
        if (components.size() <= 1) {
            return null;
        }
        return new FileHandle(backend, components.subList(0, components.size() - 1));
    }

    @Override
    public List<String> getPathComponents() {
        return components;
    }

    @Override
    public boolean sameAs(VirtualFile other) {
        if (!(other instanceof FileHandle)) {
            return false;
        }
        FileHandle that = (FileHandle) other;
        return backend.sameBackend(that.backend) && components.equals(that.components);
    }

    @Override
    public String getSeparator() {
        return backend.getSeparator();
    }

    @Override
    public FileType getType() throws IOException {
        return backend.lstat(getPath());
    }

    @Override
    public String getLinkTarget() throws IOException {
        if (getType() != FileType.LINK) {
            return null;
        }
        return backend.readlink(getPath());
    }

    @Override
    public InputStream openForReading() throws IOException {
        return backend.openRead(getPath());
    }

    @Override
    public List<String> getChildNames() throws IOException {
        return backend.listNames(getPath());
    }

    @Override
    public int getDefaultBlockSize() {
        return backend.getDefaultBlockSize();
    }

    @Override
    public long size() throws IOException {
        ReadableFile target = dereference(true);
        if (target.getType() == FileType.FILE) {
            return backend.size(target.getPath());
        }
        return ReadWriteFile.super.size();
    }

    @Override
    public Map<AttributeKind<?>, AttributeSet> getAttributes() throws IOException {
        return backend.attributes(getPath());
    }

    @Override
    public void createFolder(boolean ignoreExisting, boolean recursive) throws IOException {
        if (isFolder()) {
            if (ignoreExisting) {
                return;
            }
            throw new AlreadyExistsException(getPath(), "Folder already exists: " + getPath());
        }
        if (exists()) {
            throw new NotADirectoryException(getPath(), "Path is occupied by something other than a folder: " + getPath());
        }

        FileHandle parent = getParent();
        if (parent != null && !parent.isFolder()) {
            if (!recursive) {
                throw new NotFoundException(parent.getPath(), "Parent folder does not exist: " + parent.getPath());
            }
            parent.createFolder(true, true);
        }

        LOGGER.debug("Creating folder {}", getPath());
        backend.mkdir(getPath());
    }

    @Override
    public void delete(boolean ignoreMissing) throws IOException {
        FileType type = getType();
        switch (type) {
            case ABSENT:
                if (!ignoreMissing) {
                    throw new NotFoundException(getPath(), "Nothing to delete at " + getPath());
                }
                return;
            case FOLDER:
                List<String> names = backend.listNames(getPath());
                if (names != null) {
                    for (String name : names) {
                        child(name).delete(true);
                    }
                }
                LOGGER.debug("Removing folder {}", getPath());
                backend.rmdir(getPath());
                return;
            default:
                LOGGER.debug("Removing {} {}", type, getPath());
                backend.remove(getPath());
        }
    }

    @Override
    public void linkTo(String target) throws IOException {
        backend.symlink(getPath(), target);
    }

    @Override
    public OutputStream openForWriting(boolean append) throws IOException {
        return backend.openWrite(getPath(), append);
    }

    @Override
    public boolean canRenameAtomically(VirtualFile other) {
        if (!(other instanceof FileHandle)) {
            return false;
        }
        return backend.supportsRename() && backend.sameBackend(((FileHandle) other).backend);
    }

    @Override
    public void atomicRenameTo(VirtualFile other) throws IOException {
        if (!canRenameAtomically(other)) {
            throw new UnsupportedFileOperationException(getPath(),
                    "No native rename from " + getPath() + " to " + other.getPath());
        }
        LOGGER.debug("Renaming {} to {}", getPath(), other.getPath());
        backend.rename(getPath(), other.getPath());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        FileHandle that = (FileHandle) o;
        return backend.equals(that.backend) && components.equals(that.components);
    }

    @Override
    public int hashCode() {
        return 31 * backend.hashCode() + components.hashCode();
    }

    @Override
    public String toString() {
        return backend + ":" + getPath();
    }
}
