package org.apache.nifi.controllers.vfs;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazily reads a file as a sequence of blocks.
 * <p>
 * The stream is opened on the first call to {@link #hasNext()}. Every block holds between one and
 * {@code blockSize} bytes; no empty block is produced. The stream is closed exactly once: when the end of
 * the file is reached, when reading fails, or when {@link #close()} is called, whichever comes first.
 * Read failures surface as {@link UncheckedIOException}.
 */
public final class FileBlocks implements Iterator<byte[]>, Closeable {

    public static final int DEFAULT_BLOCK_SIZE = 16384;

    /**
     * Opens the stream the blocks are read from.
     */
    @FunctionalInterface
    public interface StreamSource {
        InputStream open() throws IOException;
    }

    private final StreamSource source;
    private final int blockSize;

    private InputStream in;
    private byte[] next;
    private boolean finished;

    public FileBlocks(StreamSource source, int blockSize) {
        if (blockSize <= 0) {
            throw new IllegalArgumentException("Block size must be positive but was " + blockSize);
        }
        this.source = source;
        this.blockSize = blockSize;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (finished) {
            return false;
        }

        try {
            if (in == null) {
                in = source.open();
            }

            byte[] buffer = new byte[blockSize];
            int read = in.readNBytes(buffer, 0, blockSize);
            if (read == 0) {
                close();
                return false;
            }

            next = read == blockSize ? buffer : Arrays.copyOf(buffer, read);
            return true;
        } catch (IOException e) {
            try {
                close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public byte[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        byte[] block = next;
        next = null;
        return block;
    }

    @Override
    public void close() throws IOException {
        if (finished) {
            return;
        }
        finished = true;
        next = null;

        if (in != null) {
            InputStream stream = in;
            in = null;
            stream.close();
        }
    }
}
