package org.apache.nifi.controllers.vfs.ftp;

import org.apache.commons.net.ftp.FTPClient;
import org.apache.nifi.controllers.vfs.exception.BackendConnectionException;
import org.apache.nifi.controllers.vfs.exception.FileErrorType;
import org.apache.nifi.logging.ComponentLog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FtpConnectionPoolImpl
 */
@DisplayName("FTP Connection Pool Implementation Tests")
public class FtpConnectionPoolImplTest {

    private ComponentLog mockLogger;
    private FtpConnectionManager mockConnectionManager;
    private FtpConnectionPoolImpl connectionPool;

    @BeforeEach
    void setUp() {
        mockLogger = mock(ComponentLog.class);
        mockConnectionManager = mock(FtpConnectionManager.class);
    }

    @AfterEach
    void tearDown() {
        if (connectionPool != null) {
            connectionPool.shutdown();
        }
    }

    private FtpConnectionConfig config(int maxConnections, int maxWaitMillis) {
        return new FtpConnectionConfig.Builder()
                .hostname("ftp.example.com")
                .maxConnections(maxConnections)
                .connectionTimeout(maxWaitMillis)
                .connectionIdleTimeout(0)
                .build();
    }

    private static FTPClient healthyClient() throws IOException {
        FTPClient client = mock(FTPClient.class);
        when(client.isConnected()).thenReturn(true);
        when(client.changeWorkingDirectory("/")).thenReturn(true);
        return client;
    }

    @Test
    @DisplayName("Should initialize connection pool with correct configuration")
    void testPoolInitialization() {
        connectionPool = new FtpConnectionPoolImpl(config(10, 5000), mockConnectionManager, mockLogger);

        assertEquals(10, connectionPool.getMaxConnections());
        assertEquals(0, connectionPool.getActiveConnectionCount());
        assertEquals(0, connectionPool.getIdleConnectionCount());
    }

    @Test
    @DisplayName("Should borrow and return connections successfully")
    void testBorrowAndReturnConnection() throws Exception {
        FTPClient client = healthyClient();
        when(mockConnectionManager.createConnection()).thenReturn(client);
        when(mockConnectionManager.validateConnection(client)).thenReturn(true);

        connectionPool = new FtpConnectionPoolImpl(config(10, 5000), mockConnectionManager, mockLogger);

        FTPClient borrowed = connectionPool.borrowConnection();
        assertSame(client, borrowed);
        assertEquals(1, connectionPool.getActiveConnectionCount());
        assertEquals(0, connectionPool.getIdleConnectionCount());

        connectionPool.returnConnection(borrowed);
        assertEquals(0, connectionPool.getActiveConnectionCount());
        assertEquals(1, connectionPool.getIdleConnectionCount());

        // The idle connection is reused and starts again from the root folder
        assertSame(client, connectionPool.borrowConnection());
        verify(mockConnectionManager, times(1)).createConnection();
        verify(client, times(2)).changeWorkingDirectory("/");
    }

    @Test
    @DisplayName("Should replace idle connections that fail validation")
    void testConnectionValidationOnBorrow() throws Exception {
        FTPClient stale = healthyClient();
        FTPClient fresh = healthyClient();
        when(mockConnectionManager.createConnection()).thenReturn(stale).thenReturn(fresh);
        when(mockConnectionManager.validateConnection(stale)).thenReturn(true).thenReturn(false);
        when(mockConnectionManager.validateConnection(fresh)).thenReturn(true);

        connectionPool = new FtpConnectionPoolImpl(config(10, 5000), mockConnectionManager, mockLogger);
        connectionPool.returnConnection(connectionPool.borrowConnection());

        assertSame(fresh, connectionPool.borrowConnection());
        verify(mockConnectionManager).closeConnection(stale);
    }

    @Test
    @DisplayName("Should time out when pool is exhausted")
    void testPoolExhaustion() throws Exception {
        FTPClient client = healthyClient();
        when(mockConnectionManager.createConnection()).thenReturn(client);
        when(mockConnectionManager.validateConnection(client)).thenReturn(true);

        connectionPool = new FtpConnectionPoolImpl(config(1, 200), mockConnectionManager, mockLogger);
        assertNotNull(connectionPool.borrowConnection());

        BackendConnectionException e = assertThrows(BackendConnectionException.class,
                () -> connectionPool.borrowConnection());
        assertEquals(FileErrorType.CONNECTION_ERROR, e.getErrorType());
        assertTrue(e.isRecoverable());
    }

    @Test
    @DisplayName("Should pass on connection failures unchanged")
    void testCreateFailure() throws Exception {
        when(mockConnectionManager.createConnection()).thenThrow(new IOException("Connection refused"));

        connectionPool = new FtpConnectionPoolImpl(config(2, 200), mockConnectionManager, mockLogger);

        IOException e = assertThrows(IOException.class, () -> connectionPool.borrowConnection());
        assertEquals("Connection refused", e.getMessage());
    }

    @Test
    @DisplayName("Should destroy invalidated connections")
    void testInvalidateConnection() throws Exception {
        FTPClient client = healthyClient();
        when(mockConnectionManager.createConnection()).thenReturn(client);
        when(mockConnectionManager.validateConnection(client)).thenReturn(true);

        connectionPool = new FtpConnectionPoolImpl(config(2, 5000), mockConnectionManager, mockLogger);
        connectionPool.invalidateConnection(connectionPool.borrowConnection());

        verify(mockConnectionManager).closeConnection(client);
        assertEquals(0, connectionPool.getActiveConnectionCount());
        assertEquals(0, connectionPool.getIdleConnectionCount());
    }

    @Test
    @DisplayName("Should refuse to lend after shutdown and close returned connections")
    void testShutdown() throws Exception {
        FTPClient client = healthyClient();
        when(mockConnectionManager.createConnection()).thenReturn(client);
        when(mockConnectionManager.validateConnection(client)).thenReturn(true);

        connectionPool = new FtpConnectionPoolImpl(config(2, 5000), mockConnectionManager, mockLogger);
        FTPClient borrowed = connectionPool.borrowConnection();
        connectionPool.shutdown();

        assertThrows(IllegalStateException.class, () -> connectionPool.borrowConnection());
        connectionPool.returnConnection(borrowed);
        verify(mockConnectionManager).closeConnection(client);
    }

    @Test
    @DisplayName("Should handle concurrent access correctly")
    void testConcurrentAccess() throws Exception {
        when(mockConnectionManager.createConnection()).thenAnswer(invocation -> healthyClient());
        when(mockConnectionManager.validateConnection(any())).thenReturn(true);

        connectionPool = new FtpConnectionPoolImpl(config(5, 10000), mockConnectionManager, mockLogger);

        int numThreads = 10;
        int operationsPerThread = 20;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch completionLatch = new CountDownLatch(numThreads);
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);

        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < operationsPerThread; j++) {
                        try {
                            FTPClient client = connectionPool.borrowConnection();
                            Thread.sleep(5);
                            connectionPool.returnConnection(client);
                            successCount.incrementAndGet();
                        } catch (Exception e) {
                            errorCount.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    completionLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(completionLatch.await(30, TimeUnit.SECONDS));

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(numThreads * operationsPerThread, successCount.get());
        assertEquals(0, errorCount.get());
        assertTrue(connectionPool.getActiveConnectionCount() + connectionPool.getIdleConnectionCount() <= 5);
    }
}
