package org.apache.nifi.controllers.vfs;

import org.apache.nifi.controllers.vfs.exception.UnsupportedFileOperationException;

import java.io.IOException;
import java.util.List;

/**
 * A file supporting every capability: reading, listing and writing. This is what the backends in this
 * bundle hand out, apart from the read-only URL backend.
 */
public interface ReadWriteFile extends ListableFile, WritableFile {

    @Override
    ReadWriteFile child(String... names);

    @Override
    ReadWriteFile getParent();

    @Override
    default ReadWriteFile safeChild(String... names) {
        return (ReadWriteFile) ListableFile.super.safeChild(names);
    }

    @Override
    default ReadWriteFile sibling(String... names) {
        return getParent().child(names);
    }

    @Override
    @SuppressWarnings("unchecked")
    default List<? extends ReadWriteFile> getChildren() throws IOException {
        return (List<? extends ReadWriteFile>) ListableFile.super.getChildren();
    }

    @Override
    default ReadWriteFile createTemporaryFolder(String prefix) throws IOException {
        return (ReadWriteFile) WritableFile.super.createTemporaryFolder(prefix);
    }

    /**
     * Whether {@link #atomicRenameTo(VirtualFile)} can move this file to the other path.
     */
    default boolean canRenameAtomically(VirtualFile other) {
        return false;
    }

    /**
     * Moves this file with a single native rename, never by copying.
     *
     * @param other the new path
     * @throws UnsupportedFileOperationException if the two paths do not share a backend that can rename
     * @throws IOException if the backend fails
     */
    default void atomicRenameTo(VirtualFile other) throws IOException {
        throw new UnsupportedFileOperationException(getPath(),
                "No native rename from " + getPath() + " to " + other.getPath());
    }

    /**
     * Moves this file to another path, which may be on a different backend. Uses a native rename when
     * possible; otherwise copies (keeping links as links) and then deletes this file, which is not atomic.
     * The copy is also used when the native rename refuses the move, as between two local file systems.
     *
     * @param other the new path
     * @throws IOException if the move fails; a failed fallback may leave a partial copy behind
     */
    default void renameTo(WritableFile other) throws IOException {
        if (canRenameAtomically(other)) {
            try {
                atomicRenameTo(other);
                return;
            } catch (UnsupportedFileOperationException e) {
                if (!(other instanceof ReadableFile)) {
                    throw e;
                }
            }
        }
        copyTo(other, CopyOptions.builder().dereferenceLinks(false).build());
        delete();
    }
}
