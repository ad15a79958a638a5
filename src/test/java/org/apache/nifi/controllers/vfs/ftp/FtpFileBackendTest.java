package org.apache.nifi.controllers.vfs.ftp;

import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.nifi.controllers.vfs.FileType;
import org.apache.nifi.controllers.vfs.attribute.AttributeKind;
import org.apache.nifi.controllers.vfs.attribute.PosixPermissions;
import org.apache.nifi.controllers.vfs.exception.AlreadyExistsException;
import org.apache.nifi.controllers.vfs.exception.FileErrorType;
import org.apache.nifi.controllers.vfs.exception.FileOperationException;
import org.apache.nifi.controllers.vfs.exception.NotAFileException;
import org.apache.nifi.controllers.vfs.exception.NotFoundException;
import org.apache.nifi.controllers.vfs.exception.PermissionDeniedException;
import org.apache.nifi.controllers.vfs.exception.UnsupportedFileOperationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FtpFileBackend against a mocked pool and client
 */
@DisplayName("FTP File Backend Tests")
public class FtpFileBackendTest {

    private FtpConnectionPool pool;
    private FTPClient client;
    private FtpConnectionConfig config;
    private FtpFileBackend backend;

    @BeforeEach
    void setUp() throws IOException {
        pool = mock(FtpConnectionPool.class);
        client = mock(FTPClient.class);
        when(pool.borrowConnection()).thenReturn(client);

        config = new FtpConnectionConfig.Builder()
                .hostname("ftp.example.com")
                .port(21)
                .username("testuser")
                .password("testpass")
                .build();
        backend = new FtpFileBackend(pool, config);
    }

    private static FTPFile entry(String name, int type) {
        FTPFile file = new FTPFile();
        file.setName(name);
        file.setType(type);
        return file;
    }

    @Test
    @DisplayName("Should find types by listing the parent folder")
    void testLstat() throws IOException {
        FTPFile link = entry("latest", FTPFile.SYMBOLIC_LINK_TYPE);
        link.setLink("a.txt");
        when(client.listFiles("/data")).thenReturn(new FTPFile[] {
                entry("a.txt", FTPFile.FILE_TYPE), entry("sub", FTPFile.DIRECTORY_TYPE), link });

        assertEquals(FileType.FILE, backend.lstat("/data/a.txt"));
        assertEquals(FileType.FOLDER, backend.lstat("/data/sub"));
        assertEquals(FileType.LINK, backend.lstat("/data/latest"));
        assertEquals(FileType.ABSENT, backend.lstat("/data/missing"));
        assertEquals("a.txt", backend.readlink("/data/latest"));
        assertEquals(FileType.FOLDER, backend.lstat("/"));

        verify(pool, times(5)).returnConnection(client);
        verify(pool, never()).invalidateConnection(any());
    }

    @Test
    @DisplayName("Should list sorted names without dot entries")
    void testListNames() throws IOException {
        when(client.changeWorkingDirectory("/data")).thenReturn(true);
        when(client.listFiles()).thenReturn(new FTPFile[] {
                entry(".", FTPFile.DIRECTORY_TYPE), entry("b", FTPFile.FILE_TYPE), entry("a", FTPFile.FILE_TYPE) });

        assertEquals(List.of("a", "b"), backend.listNames("/data"));
        assertEquals(List.of("a", "b"), backend.file("/data").getChildNames());
    }

    @Test
    @DisplayName("Should report no children for paths that are not folders")
    void testListNamesOfFile() throws IOException {
        when(client.changeWorkingDirectory("/data/a.txt")).thenReturn(false);
        assertNull(backend.listNames("/data/a.txt"));
    }

    @Test
    @DisplayName("Should hold the connection until the read stream is closed")
    void testOpenRead() throws IOException {
        when(client.retrieveFileStream("/data/a.txt"))
                .thenReturn(new ByteArrayInputStream("hello".getBytes(StandardCharsets.UTF_8)));
        when(client.completePendingCommand()).thenReturn(true);

        InputStream in = backend.openRead("/data/a.txt");
        verify(pool, never()).returnConnection(client);

        assertEquals("hello", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        in.close();
        in.close();

        verify(client, times(1)).completePendingCommand();
        verify(pool, times(1)).returnConnection(client);
    }

    @Test
    @DisplayName("Should read text through a file handle")
    void testReadThroughHandle() throws IOException {
        when(client.retrieveFileStream("/data/a.txt"))
                .thenReturn(new ByteArrayInputStream("hello".getBytes(StandardCharsets.UTF_8)));
        when(client.completePendingCommand()).thenReturn(true);

        assertEquals("hello", backend.file("/data/a.txt").readText(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should refuse to read a folder")
    void testOpenReadFolder() throws IOException {
        when(client.retrieveFileStream("/data/sub")).thenReturn(null);
        when(client.getReplyCode()).thenReturn(550);
        when(client.listFiles("/data")).thenReturn(new FTPFile[] { entry("sub", FTPFile.DIRECTORY_TYPE) });

        assertThrows(NotAFileException.class, () -> backend.openRead("/data/sub"));
        verify(pool).returnConnection(client);
    }

    @Test
    @DisplayName("Should report a missing file as not found")
    void testOpenReadMissing() throws IOException {
        when(client.retrieveFileStream("/data/missing")).thenReturn(null);
        when(client.getReplyCode()).thenReturn(550);
        when(client.getReplyString()).thenReturn("550 No such file");
        when(client.listFiles("/data")).thenReturn(new FTPFile[0]);

        NotFoundException e = assertThrows(NotFoundException.class, () -> backend.openRead("/data/missing"));
        assertEquals(550, e.getNativeCode());
        assertEquals("/data/missing", e.getPath());
    }

    @Test
    @DisplayName("Should write through a stored file stream")
    void testOpenWrite() throws IOException {
        ByteArrayOutputStream sink = new ByteArrayOutputStream();
        when(client.storeFileStream("/data/out.txt")).thenReturn(sink);
        when(client.completePendingCommand()).thenReturn(true);

        try (OutputStream out = backend.openWrite("/data/out.txt", false)) {
            out.write("payload".getBytes(StandardCharsets.UTF_8));
        }

        assertEquals("payload", sink.toString(StandardCharsets.UTF_8));
        verify(client, never()).appendFileStream(anyString());
        verify(pool).returnConnection(client);
    }

    @Test
    @DisplayName("Should invalidate the connection when the transfer does not complete")
    void testIncompleteTransfer() throws IOException {
        when(client.appendFileStream("/data/out.txt")).thenReturn(new ByteArrayOutputStream());
        when(client.completePendingCommand()).thenReturn(false);
        when(client.getReplyCode()).thenReturn(426);
        when(client.getReplyString()).thenReturn("426 Connection closed; transfer aborted");

        OutputStream out = backend.openWrite("/data/out.txt", true);
        FileOperationException e = assertThrows(FileOperationException.class, out::close);

        assertEquals(FileErrorType.TRANSFER_ERROR, e.getErrorType());
        verify(pool).invalidateConnection(client);
        verify(pool, never()).returnConnection(client);
    }

    @Test
    @DisplayName("Should report an existing path when a folder cannot be created")
    void testMkdirExisting() throws IOException {
        when(client.makeDirectory("/data/sub")).thenReturn(false);
        when(client.getReplyCode()).thenReturn(550);
        when(client.listFiles("/data")).thenReturn(new FTPFile[] { entry("sub", FTPFile.DIRECTORY_TYPE) });

        assertThrows(AlreadyExistsException.class, () -> backend.mkdir("/data/sub"));
    }

    @Test
    @DisplayName("Should invalidate the connection after an I/O failure")
    void testInvalidateOnIOException() throws IOException {
        when(client.deleteFile("/data/a.txt")).thenThrow(new IOException("Connection reset"));

        assertThrows(IOException.class, () -> backend.remove("/data/a.txt"));

        verify(pool).invalidateConnection(client);
        verify(pool, never()).returnConnection(client);
    }

    @Test
    @DisplayName("Should refuse to remove a folder that still has entries")
    void testRmdirNotEmpty() throws IOException {
        when(client.removeDirectory("/data/sub")).thenReturn(false);
        when(client.getReplyCode()).thenReturn(550);
        when(client.listFiles("/data/sub")).thenReturn(new FTPFile[] { entry("x", FTPFile.FILE_TYPE) });

        FileOperationException e = assertThrows(FileOperationException.class, () -> backend.rmdir("/data/sub"));
        assertEquals(FileErrorType.DIRECTORY_NOT_EMPTY, e.getErrorType());
    }

    @Test
    @DisplayName("Should map a refused rename to permission denied")
    void testRenameRefused() throws IOException {
        when(client.rename("/data/a.txt", "/locked/a.txt")).thenReturn(false);
        when(client.getReplyCode()).thenReturn(553);
        when(client.getReplyString()).thenReturn("553 Requested action not taken");

        assertTrue(backend.supportsRename());
        assertThrows(PermissionDeniedException.class, () -> backend.rename("/data/a.txt", "/locked/a.txt"));
    }

    @Test
    @DisplayName("Should not create symbolic links")
    void testSymlinkUnsupported() {
        assertThrows(UnsupportedFileOperationException.class, () -> backend.symlink("/data/l", "a.txt"));
    }

    @Test
    @DisplayName("Should read permissions from listings and change them with SITE CHMOD")
    void testPermissions() throws IOException {
        FTPFile file = entry("a.txt", FTPFile.FILE_TYPE);
        file.setPermission(FTPFile.USER_ACCESS, FTPFile.READ_PERMISSION, true);
        file.setPermission(FTPFile.USER_ACCESS, FTPFile.WRITE_PERMISSION, true);
        file.setPermission(FTPFile.GROUP_ACCESS, FTPFile.READ_PERMISSION, true);
        when(client.listFiles("/data")).thenReturn(new FTPFile[] { file });
        when(client.sendSiteCommand("CHMOD 755 /data/a.txt")).thenReturn(true);

        PosixPermissions permissions = AttributeKind.POSIX_PERMISSIONS.cast(
                backend.attributes("/data/a.txt").get(AttributeKind.POSIX_PERMISSIONS));

        assertEquals(0640, permissions.getMode());
        permissions.setMode(0755);
        verify(client).sendSiteCommand("CHMOD 755 /data/a.txt");
        assertTrue(backend.attributes("/").isEmpty());
    }

    @Test
    @DisplayName("Should treat backends for the same server and user as the same")
    void testSameBackend() {
        FtpFileBackend other = new FtpFileBackend(mock(FtpConnectionPool.class), new FtpConnectionConfig.Builder()
                .hostname("ftp.example.com").username("testuser").build());
        FtpFileBackend otherUser = new FtpFileBackend(pool, new FtpConnectionConfig.Builder()
                .hostname("ftp.example.com").username("someone").build());

        assertTrue(backend.sameBackend(other));
        assertFalse(backend.sameBackend(otherUser));
        assertEquals("ftp://testuser@ftp.example.com:21", backend.toString());
    }
}
