package org.apache.nifi.controllers.vfs;

import org.apache.nifi.controllers.vfs.exception.AlreadyExistsException;
import org.apache.nifi.controllers.vfs.exception.NotADirectoryException;
import org.apache.nifi.controllers.vfs.exception.NotFoundException;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.concurrent.ThreadLocalRandom;

/**
 * A file that can be created, written, linked and deleted.
 */
public interface WritableFile extends VirtualFile {

    /**
     * Number of names {@link #createTemporaryFolder(String)} tries before giving up.
     */
    int TEMPORARY_FOLDER_ATTEMPTS = 20;

    @Override
    WritableFile child(String... names);

    @Override
    WritableFile getParent();

    @Override
    default WritableFile safeChild(String... names) {
        return (WritableFile) VirtualFile.super.safeChild(names);
    }

    @Override
    default WritableFile sibling(String... names) {
        return getParent().child(names);
    }

    /**
     * Creates a folder at this path.
     *
     * @param ignoreExisting whether an existing folder at this path is accepted
     * @param recursive whether missing parent folders are created as well
     * @throws AlreadyExistsException if a folder already exists and {@code ignoreExisting} is false
     * @throws NotADirectoryException if something other than a folder occupies the path
     * @throws NotFoundException if the parent is missing and {@code recursive} is false
     * @throws IOException if the backend fails
     */
    void createFolder(boolean ignoreExisting, boolean recursive) throws IOException;

    default void mkdir() throws IOException {
        createFolder(false, false);
    }

    default void mkdir(boolean ignoreExisting) throws IOException {
        createFolder(ignoreExisting, false);
    }

    default void mkdirs() throws IOException {
        createFolder(true, true);
    }

    /**
     * Deletes this file. A folder is emptied first; a symbolic link is removed as a link, never followed.
     *
     * @param ignoreMissing whether a missing path is accepted
     * @throws NotFoundException if nothing exists at the path and {@code ignoreMissing} is false
     * @throws IOException if the backend fails; a failed folder delete may leave it partially emptied
     */
    void delete(boolean ignoreMissing) throws IOException;

    default void delete() throws IOException {
        delete(false);
    }

    /**
     * Creates a symbolic link at this path holding the given text verbatim.
     *
     * @param target the link text, relative or absolute in the backend's own syntax
     * @throws IOException if the backend fails or has no symbolic links
     */
    void linkTo(String target) throws IOException;

    /**
     * Creates a symbolic link at this path pointing at the absolute path of another file.
     */
    default void linkTo(VirtualFile target) throws IOException {
        linkTo(target.getPath());
    }

    /**
     * Opens this file for writing, creating it if needed. The caller closes the stream.
     *
     * @param append true to keep the existing content and write after it, false to truncate first
     * @return the stream
     * @throws IOException if the file cannot be opened
     */
    OutputStream openForWriting(boolean append) throws IOException;

    default void write(byte[] data) throws IOException {
        try (OutputStream out = openForWriting(false)) {
            out.write(data);
        }
    }

    default void write(CharSequence text, Charset charset) throws IOException {
        write(text.toString().getBytes(charset));
    }

    default void append(byte[] data) throws IOException {
        try (OutputStream out = openForWriting(true)) {
            out.write(data);
        }
    }

    /**
     * Marks or unmarks this file for deletion by {@link DeleteOnExitRegistry#runCleanup()}.
     */
    default void setDeleteOnExit(boolean deleteOnExit) {
        if (deleteOnExit) {
            DeleteOnExitRegistry.getInstance().register(this);
        } else {
            DeleteOnExitRegistry.getInstance().unregister(this);
        }
    }

    default boolean isDeleteOnExit() {
        return DeleteOnExitRegistry.getInstance().isRegistered(this);
    }

    /**
     * Creates a new, uniquely named folder inside this folder.
     *
     * @param prefix the start of the folder name
     * @return the created folder
     * @throws AlreadyExistsException if every attempted name was taken
     * @throws IOException if the backend fails
     */
    default WritableFile createTemporaryFolder(String prefix) throws IOException {
        AlreadyExistsException lastFailure = null;
        for (int attempt = 0; attempt < TEMPORARY_FOLDER_ATTEMPTS; attempt++) {
            String name = prefix + Long.toString(ThreadLocalRandom.current().nextLong() & Long.MAX_VALUE, 36);
            WritableFile folder = child(name);
            try {
                folder.mkdir();
                return folder;
            } catch (AlreadyExistsException e) {
                lastFailure = e;
            }
        }
        throw new AlreadyExistsException(getPath(), -1,
                "No unused temporary folder name found in " + getPath() + " after " + TEMPORARY_FOLDER_ATTEMPTS + " attempts",
                lastFailure);
    }
}
