package org.apache.nifi.controllers.vfs;

import org.apache.nifi.controllers.vfs.exception.FileErrorType;
import org.apache.nifi.controllers.vfs.exception.FileOperationException;
import org.apache.nifi.controllers.vfs.exception.NotADirectoryException;
import org.apache.nifi.controllers.vfs.exception.NotAFileException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * A file whose type, link target and content can be read.
 */
public interface ReadableFile extends VirtualFile {

    /**
     * Maximum number of links a recursive dereference follows before giving up.
     */
    int MAX_LINK_DEPTH = 40;

    @Override
    ReadableFile child(String... names);

    @Override
    ReadableFile getParent();

    @Override
    default ReadableFile safeChild(String... names) {
        return (ReadableFile) VirtualFile.super.safeChild(names);
    }

    @Override
    default ReadableFile sibling(String... names) {
        return getParent().child(names);
    }

    /**
     * Gets what the path currently holds. A symbolic link is reported as {@link FileType#LINK}, whatever it
     * points to.
     *
     * @return the type, {@link FileType#ABSENT} if nothing exists at the path
     * @throws IOException if the backend fails
     */
    FileType getType() throws IOException;

    /**
     * Gets the text of the symbolic link at this path.
     *
     * @return the link target as stored, or null if this file is not a link
     * @throws IOException if the backend fails
     */
    String getLinkTarget() throws IOException;

    /**
     * Opens the content of this file. The caller closes the stream.
     *
     * @return the stream
     * @throws IOException if the file cannot be opened
     */
    InputStream openForReading() throws IOException;

    /**
     * Whether anything exists at this path. True for a broken link.
     */
    default boolean exists() throws IOException {
        return getType() != FileType.ABSENT;
    }

    default boolean isLink() throws IOException {
        return getType() == FileType.LINK;
    }

    /**
     * Whether this path, after following links, is a regular file.
     */
    default boolean isFile() throws IOException {
        return dereference(true).getType() == FileType.FILE;
    }

    /**
     * Whether this path, after following links, is a folder.
     */
    default boolean isFolder() throws IOException {
        return dereference(true).getType() == FileType.FOLDER;
    }

    /**
     * Whether this path exists and, if it is a link, the chain of links ends at something that exists.
     */
    default boolean isValid() throws IOException {
        return dereference(true).exists();
    }

    /**
     * Whether this path is a link whose chain of links ends at nothing.
     */
    default boolean isBroken() throws IOException {
        return isLink() && !isValid();
    }

    default void checkFile() throws IOException {
        if (!isFile()) {
            throw new NotAFileException(getPath(), "Not a regular file: " + getPath());
        }
    }

    default void checkFolder() throws IOException {
        if (!isFolder()) {
            throw new NotADirectoryException(getPath(), "Not a folder: " + getPath());
        }
    }

    /**
     * Resolves a symbolic link. Relative targets are resolved against the folder holding the link.
     *
     * @param recursive whether to keep following until something that is not a link is reached
     * @return this file if it is not a link, otherwise the file the link leads to
     * @throws FileOperationException of type {@link FileErrorType#TOO_MANY_LINKS} if more than
     *         {@link #MAX_LINK_DEPTH} links are followed
     * @throws IOException if the backend fails
     */
    default ReadableFile dereference(boolean recursive) throws IOException {
        ReadableFile current = this;
        for (int depth = 0; depth <= MAX_LINK_DEPTH; depth++) {
            String target = current.getLinkTarget();
            if (target == null) {
                return current;
            }
            // A link at a root resolves against the root itself
            ReadableFile folder = current.getParent();
            current = (folder == null ? current : folder).child(target);
            if (!recursive) {
                return current;
            }
        }
        throw new FileOperationException(FileErrorType.TOO_MANY_LINKS, getPath(),
                "More than " + MAX_LINK_DEPTH + " links followed from " + getPath());
    }

    /**
     * Block size {@link #readBlocks()} uses when none is given.
     */
    default int getDefaultBlockSize() {
        return FileBlocks.DEFAULT_BLOCK_SIZE;
    }

    default FileBlocks readBlocks() {
        return readBlocks(getDefaultBlockSize());
    }

    /**
     * Reads this file lazily in blocks. Each call starts again from the beginning of the file.
     *
     * @param blockSize maximum size of each block
     * @return the blocks; close it when abandoning the iteration early
     */
    default FileBlocks readBlocks(int blockSize) {
        return new FileBlocks(this::openForReading, blockSize);
    }

    /**
     * Computes a digest of this file's content, reading it block by block.
     *
     * @param algorithm a {@link MessageDigest} algorithm name such as "SHA-256" or "MD5"
     * @return the raw digest
     * @throws IllegalArgumentException if the algorithm is unknown
     * @throws IOException if reading fails
     */
    default byte[] digest(String algorithm) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unknown digest algorithm: " + algorithm, e);
        }

        try (FileBlocks blocks = readBlocks()) {
            while (blocks.hasNext()) {
                digest.update(blocks.next());
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return digest.digest();
    }

    /**
     * Same as {@link #digest(String)}, rendered as lowercase hex.
     */
    default String hash(String algorithm) throws IOException {
        return HexFormat.of().formatHex(digest(algorithm));
    }

    /**
     * Reads the whole content of this file into memory.
     */
    default byte[] read() throws IOException {
        try (InputStream in = openForReading()) {
            return in.readAllBytes();
        }
    }

    default String readText(Charset charset) throws IOException {
        return new String(read(), charset);
    }

    /**
     * Gets the size of this file's content in bytes. Links are followed; a broken link or a missing file
     * reports zero.
     *
     * @return the size
     * @throws IOException if the backend fails
     */
    default long size() throws IOException {
        ReadableFile target = dereference(true);
        if (target.getType() != FileType.FILE) {
            return 0;
        }

        long total = 0;
        try (FileBlocks blocks = target.readBlocks()) {
            while (blocks.hasNext()) {
                total += blocks.next().length;
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return total;
    }

    default void copyTo(WritableFile target) throws IOException {
        copyTo(target, CopyOptions.DEFAULT);
    }

    /**
     * Copies this file, folder or link to the target path, then copies attributes as the options say.
     *
     * @param target the path to create
     * @param options overwrite, link and attribute handling
     * @throws IOException if the copy fails; a failed folder copy may leave a partial target behind
     */
    default void copyTo(WritableFile target, CopyOptions options) throws IOException {
        FileCopier.copy(this, target, options);
    }

    default WritableFile copyInto(WritableFile folder) throws IOException {
        return copyInto(folder, CopyOptions.DEFAULT);
    }

    /**
     * Copies this file into a folder under its own name.
     *
     * @param folder the folder to copy into
     * @param options overwrite, link and attribute handling
     * @return the created copy
     * @throws IOException if the copy fails
     */
    default WritableFile copyInto(WritableFile folder, CopyOptions options) throws IOException {
        WritableFile target = folder.child(getName());
        copyTo(target, options);
        return target;
    }
}
