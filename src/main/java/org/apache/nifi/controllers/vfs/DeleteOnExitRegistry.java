package org.apache.nifi.controllers.vfs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide set of files to delete when the hosting application shuts down.
 * <p>
 * Nothing is deleted implicitly: the host calls {@link #runCleanup()} from its own shutdown sequence,
 * or opts in to a JVM shutdown hook through {@link #registerShutdownHook()}. Cleanup is best effort;
 * a file that cannot be deleted is logged and skipped.
 */
public final class DeleteOnExitRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeleteOnExitRegistry.class);

    private static final DeleteOnExitRegistry INSTANCE = new DeleteOnExitRegistry();

    private final Set<WritableFile> files = new LinkedHashSet<>();
    private final AtomicBoolean shutdownHookRegistered = new AtomicBoolean(false);

    DeleteOnExitRegistry() {
    }

    public static DeleteOnExitRegistry getInstance() {
        return INSTANCE;
    }

    public synchronized void register(WritableFile file) {
        files.add(file);
    }

    public synchronized void unregister(WritableFile file) {
        files.remove(file);
    }

    public synchronized boolean isRegistered(WritableFile file) {
        return files.contains(file);
    }

    public synchronized int size() {
        return files.size();
    }

    /**
     * Deletes every registered file, most recently registered first, and empties the registry.
     *
     * @return the number of files that could not be deleted
     */
    public int runCleanup() {
        List<WritableFile> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(files);
            files.clear();
        }

        int failures = 0;
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            WritableFile file = snapshot.get(i);
            try {
                file.delete(true);
                LOGGER.debug("Deleted {} on cleanup", file.getPath());
            } catch (Exception e) {
                failures++;
                LOGGER.warn("Failed to delete {} on cleanup: {}", file.getPath(), e.getMessage());
            }
        }
        return failures;
    }

    /**
     * Runs {@link #runCleanup()} from a JVM shutdown hook. Registering more than once has no effect.
     */
    public void registerShutdownHook() {
        if (shutdownHookRegistered.compareAndSet(false, true)) {
            Thread hook = new Thread(this::runCleanup, "VirtualFile-DeleteOnExit");
            Runtime.getRuntime().addShutdownHook(hook);
        }
    }
}
