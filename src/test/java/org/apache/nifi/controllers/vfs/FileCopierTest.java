package org.apache.nifi.controllers.vfs;

import org.apache.nifi.controllers.vfs.exception.AlreadyExistsException;
import org.apache.nifi.controllers.vfs.exception.NotFoundException;
import org.apache.nifi.controllers.vfs.exception.UnsupportedFileOperationException;
import org.apache.nifi.controllers.vfs.local.LocalFileBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("File Copy Tests")
public class FileCopierTest {

    @TempDir
    Path tempDir;

    private ReadWriteFile source;
    private ReadWriteFile work;

    /**
     * source/
     *   data.txt
     *   sub/inner.txt
     *   link -> data.txt
     */
    @BeforeEach
    void setUp() throws IOException {
        work = LocalFileBackend.getInstance().file(tempDir);
        source = work.child("source");
        source.child("sub").mkdirs();
        source.child("data.txt").write("data", StandardCharsets.UTF_8);
        source.child("sub", "inner.txt").write("inner", StandardCharsets.UTF_8);
        source.child("link").linkTo("data.txt");
    }

    @Test
    @DisplayName("Should copy a tree, replacing links with their targets")
    void testCopyTreeDereferencingLinks() throws IOException {
        ReadWriteFile target = work.child("copy");
        source.copyTo(target);

        assertEquals(Arrays.asList("data.txt", "link", "sub"), target.getChildNames());
        assertEquals(FileType.FILE, target.child("link").getType());
        assertEquals("data", target.child("link").readText(StandardCharsets.UTF_8));
        assertEquals("inner", target.child("sub", "inner.txt").readText(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should copy a tree, keeping links as links")
    void testCopyTreeKeepingLinks() throws IOException {
        ReadWriteFile target = work.child("copy");
        source.copyTo(target, CopyOptions.builder().dereferenceLinks(false).build());

        assertEquals(FileType.LINK, target.child("link").getType());
        assertEquals("data.txt", target.child("link").getLinkTarget());
        assertTrue(target.child("link").dereference(true).sameAs(target.child("data.txt")));
    }

    @Test
    @DisplayName("Should refuse to overwrite unless asked to")
    void testOverwrite() throws IOException {
        ReadWriteFile target = work.child("target.txt");
        target.write("old", StandardCharsets.UTF_8);

        assertThrows(AlreadyExistsException.class, () -> source.child("data.txt").copyTo(target));

        source.child("data.txt").copyTo(target, CopyOptions.builder().overwrite(true).build());
        assertEquals("data", target.readText(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should copy into a folder under the source name")
    void testCopyInto() throws IOException {
        ReadWriteFile folder = work.child("into");
        folder.mkdir();

        WritableFile copied = source.child("sub").copyInto(folder);

        assertTrue(copied.sameAs(folder.child("sub")));
        assertEquals("inner", folder.child("sub", "inner.txt").readText(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should fail to copy something that does not exist")
    void testCopyMissing() {
        assertThrows(NotFoundException.class, () -> work.child("nothing").copyTo(work.child("copy")));
        ReadWriteFile broken = work.child("broken");
        assertThrows(NotFoundException.class, () -> {
            broken.linkTo("nowhere");
            broken.copyTo(work.child("copy"));
        });
    }

    @Test
    @DisplayName("Should move a tree with its links")
    void testRenameTree() throws IOException {
        ReadWriteFile moved = work.child("moved");
        source.renameTo(moved);

        assertFalse(source.exists());
        assertEquals(FileType.LINK, moved.child("link").getType());
        assertEquals("inner", moved.child("sub", "inner.txt").readText(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should move by copy and delete when the backend has no rename")
    void testRenameWithoutNativeRename() throws IOException {
        CopyOnlyBackend backend = new CopyOnlyBackend(false);
        ReadWriteFile from = backend.root().child(tempDir.toAbsolutePath().toString(), "source");
        ReadWriteFile to = backend.root().child(tempDir.toAbsolutePath().toString(), "moved");

        assertFalse(from.canRenameAtomically(to));
        from.renameTo(to);

        assertEquals(0, backend.renameCalls);
        assertFalse(source.exists());
        assertEquals(FileType.LINK, work.child("moved", "link").getType());
        assertEquals("data.txt", work.child("moved", "link").getLinkTarget());
        assertEquals("data", work.child("moved", "data.txt").readText(StandardCharsets.UTF_8));
        assertEquals("inner", work.child("moved", "sub", "inner.txt").readText(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should fall back to copy and delete when the native rename is refused")
    void testRenameRefusedFallsBack() throws IOException {
        CopyOnlyBackend backend = new CopyOnlyBackend(true);
        ReadWriteFile from = backend.root().child(tempDir.toAbsolutePath().toString(), "source");
        ReadWriteFile to = backend.root().child(tempDir.toAbsolutePath().toString(), "moved");

        assertTrue(from.canRenameAtomically(to));
        from.renameTo(to);

        assertEquals(1, backend.renameCalls);
        assertFalse(source.exists());
        assertEquals(FileType.LINK, work.child("moved", "link").getType());
        assertEquals("inner", work.child("moved", "sub", "inner.txt").readText(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should move between backends that cannot name each other's files")
    void testRenameAcrossBackends() throws IOException {
        ReadWriteFile to = new CopyOnlyBackend(true).root().child(tempDir.toAbsolutePath().toString(), "moved");

        assertFalse(source.canRenameAtomically(to));
        source.renameTo(to);

        assertFalse(source.exists());
        assertEquals(FileType.LINK, work.child("moved", "link").getType());
        assertEquals("data", work.child("moved", "data.txt").readText(StandardCharsets.UTF_8));
    }

    /**
     * Local disk access whose rename is either absent or always refused.
     */
    private static final class CopyOnlyBackend implements FileBackend {

        private final FileBackend local = LocalFileBackend.getInstance();
        private final boolean advertisesRename;
        private int renameCalls;

        CopyOnlyBackend(boolean advertisesRename) {
            this.advertisesRename = advertisesRename;
        }

        @Override
        public String getSeparator() {
            return local.getSeparator();
        }

        @Override
        public FileType lstat(String path) throws IOException {
            return local.lstat(path);
        }

        @Override
        public String readlink(String path) throws IOException {
            return local.readlink(path);
        }

        @Override
        public InputStream openRead(String path) throws IOException {
            return local.openRead(path);
        }

        @Override
        public OutputStream openWrite(String path, boolean append) throws IOException {
            return local.openWrite(path, append);
        }

        @Override
        public List<String> listNames(String path) throws IOException {
            return local.listNames(path);
        }

        @Override
        public void mkdir(String path) throws IOException {
            local.mkdir(path);
        }

        @Override
        public void remove(String path) throws IOException {
            local.remove(path);
        }

        @Override
        public void rmdir(String path) throws IOException {
            local.rmdir(path);
        }

        @Override
        public void symlink(String path, String target) throws IOException {
            local.symlink(path, target);
        }

        @Override
        public long size(String path) throws IOException {
            return local.size(path);
        }

        @Override
        public boolean supportsRename() {
            return advertisesRename;
        }

        @Override
        public void rename(String from, String to) {
            renameCalls++;
            throw new UnsupportedFileOperationException(from, "Rename refused for " + from);
        }
    }
}
