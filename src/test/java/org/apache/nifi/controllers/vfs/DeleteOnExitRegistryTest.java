package org.apache.nifi.controllers.vfs;

import org.apache.nifi.controllers.vfs.local.LocalFileBackend;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Delete On Exit Registry Tests")
public class DeleteOnExitRegistryTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Should delete registered files and empty itself")
    void testRunCleanup() throws IOException {
        DeleteOnExitRegistry registry = new DeleteOnExitRegistry();
        ReadWriteFile folder = LocalFileBackend.getInstance().file(tempDir).child("scratch");
        folder.mkdir();
        folder.child("file").write(new byte[] {1});
        ReadWriteFile missing = folder.child("never-created");

        registry.register(folder);
        registry.register(missing);
        assertEquals(2, registry.size());

        assertEquals(0, registry.runCleanup());
        assertFalse(folder.exists());
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Should count files that could not be deleted and carry on")
    void testCleanupFailures() throws IOException {
        DeleteOnExitRegistry registry = new DeleteOnExitRegistry();
        WritableFile failing = mock(WritableFile.class);
        doThrow(new IOException("busy")).when(failing).delete(true);
        when(failing.getPath()).thenReturn("/busy");
        WritableFile fine = mock(WritableFile.class);
        when(fine.getPath()).thenReturn("/fine");

        registry.register(fine);
        registry.register(failing);

        assertEquals(1, registry.runCleanup());
        verify(fine).delete(true);
    }

    @Test
    @DisplayName("Should mark and unmark files through the shared registry")
    void testDeleteOnExitFlag() {
        ReadWriteFile file = LocalFileBackend.getInstance().file(tempDir).child("marked");

        file.setDeleteOnExit(true);
        assertTrue(file.isDeleteOnExit());
        assertTrue(LocalFileBackend.getInstance().file(tempDir).child("marked").isDeleteOnExit());

        file.setDeleteOnExit(false);
        assertFalse(file.isDeleteOnExit());
    }
}
