package de.mirkosertic.mcp.knowledgebase.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutual exclusion for update passes. Threads of this process queue on a fair lock,
 * other processes sharing the cache are kept out by an OS lock on {@code <cache>.lock}.
 */
public class UpdateLock {

    private static final Logger logger = LoggerFactory.getLogger(UpdateLock.class);

    private static final long FILE_LOCK_POLL_MS = 50;

    private final ReentrantLock processLock = new ReentrantLock(true);
    private final Path lockFile;
    private final long timeoutMs;

    public UpdateLock(final Path cachePath, final long timeoutMs) {
        this.lockFile = cachePath.resolveSibling(cachePath.getFileName() + ".lock");
        this.timeoutMs = timeoutMs;
    }

    /**
     * Acquire exclusive update rights, waiting at most the configured timeout.
     *
     * @return a handle that releases the lock when closed
     * @throws UpdateAbortedException if the lock could not be obtained in time
     */
    public Handle acquire() throws UpdateAbortedException {
        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        try {
            if (!processLock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new UpdateAbortedException("Timed out after " + timeoutMs + "ms waiting for the update lock");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpdateAbortedException("Interrupted while waiting for the update lock", e);
        }

        try {
            final FileChannel channel = acquireFileLock(deadline);
            return new Handle(channel);
        } catch (final UpdateAbortedException e) {
            processLock.unlock();
            throw e;
        }
    }

    private FileChannel acquireFileLock(final long deadline) throws UpdateAbortedException {
        final FileChannel channel;
        try {
            Files.createDirectories(lockFile.toAbsolutePath().getParent());
            channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (final IOException e) {
            throw new UpdateAbortedException("Cannot open lock file " + lockFile, e);
        }

        try {
            while (true) {
                final FileLock fileLock;
                try {
                    fileLock = channel.tryLock();
                } catch (final OverlappingFileLockException e) {
                    throw new UpdateAbortedException("Lock file " + lockFile + " is already held by this process", e);
                }
                if (fileLock != null) {
                    logger.debug("Acquired update lock {}", lockFile);
                    return channel;
                }
                if (System.nanoTime() >= deadline) {
                    throw new UpdateAbortedException("Timed out after " + timeoutMs
                            + "ms waiting for lock file " + lockFile + " held by another process");
                }
                Thread.sleep(FILE_LOCK_POLL_MS);
            }
        } catch (final IOException e) {
            closeQuietly(channel);
            throw new UpdateAbortedException("Cannot lock " + lockFile, e);
        } catch (final InterruptedException e) {
            closeQuietly(channel);
            Thread.currentThread().interrupt();
            throw new UpdateAbortedException("Interrupted while waiting for lock file " + lockFile, e);
        } catch (final UpdateAbortedException e) {
            closeQuietly(channel);
            throw e;
        }
    }

    private static void closeQuietly(final FileChannel channel) {
        try {
            channel.close();
        } catch (final IOException e) {
            logger.warn("Failed to close lock file channel", e);
        }
    }

    public boolean isHeldByAnyThread() {
        return processLock.isLocked();
    }

    public Path getLockFile() {
        return lockFile;
    }

    /**
     * Held update lock. Closing the channel releases the OS lock.
     */
    public final class Handle implements AutoCloseable {

        private final FileChannel channel;
        private boolean released;

        private Handle(final FileChannel channel) {
            this.channel = channel;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            try {
                channel.close();
            } catch (final IOException e) {
                logger.warn("Failed to release lock file {}", lockFile, e);
            } finally {
                processLock.unlock();
            }
        }
    }
}
