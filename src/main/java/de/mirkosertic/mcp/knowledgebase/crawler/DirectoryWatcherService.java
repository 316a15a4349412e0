package de.mirkosertic.mcp.knowledgebase.crawler;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_DELETE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

/**
 * Turns {@link WatchService} events into {@link FileChangeListener} callbacks. Directories
 * can be watched recursively (the sources directory) or as a single level restricted to
 * one file name (the directory holding the link list).
 */
public class DirectoryWatcherService {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryWatcherService.class);

    private final long pollIntervalMs;
    private final Map<WatchKey, WatchInfo> watchKeys = new ConcurrentHashMap<>();
    private final AtomicBoolean loopStarted = new AtomicBoolean(false);
    private final ExecutorService watchExecutor = Executors.newSingleThreadExecutor(r -> {
        final Thread thread = new Thread(r, "directory-watcher");
        thread.setDaemon(true);
        return thread;
    });

    private volatile WatchService watchService;

    public DirectoryWatcherService(final long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    /**
     * Watch a directory tree; newly created subdirectories are picked up automatically.
     */
    public void watchDirectory(final Path directory, final FileChangeListener listener) throws IOException {
        ensureWatchService();
        registerRecursive(directory, listener);
        startLoop();
    }

    /**
     * Watch a single file by watching its parent directory without descending.
     */
    public void watchFile(final Path file, final FileChangeListener listener) throws IOException {
        ensureWatchService();
        final Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        final WatchKey key = parent.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
        watchKeys.put(key, new WatchInfo(parent, listener, false, file.getFileName()));
        logger.debug("Registered watch for file: {}", file);
        startLoop();
    }

    private synchronized void ensureWatchService() throws IOException {
        if (watchService == null) {
            watchService = FileSystems.getDefault().newWatchService();
        }
    }

    private void startLoop() {
        if (loopStarted.compareAndSet(false, true)) {
            watchExecutor.execute(this::processEvents);
        }
    }

    private void registerRecursive(final Path directory, final FileChangeListener listener) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(final Path dir, final BasicFileAttributes attrs) throws IOException {
                final WatchKey key = dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY, ENTRY_DELETE);
                watchKeys.put(key, new WatchInfo(dir, listener, true, null));
                logger.debug("Registered watch for directory: {}", dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void processEvents() {
        logger.info("Directory watcher started");

        while (!Thread.currentThread().isInterrupted()) {
            final WatchKey key;
            try {
                key = watchService.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                if (key == null) {
                    continue;
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final ClosedWatchServiceException e) {
                logger.info("Watch service closed");
                break;
            }

            final WatchInfo watchInfo = watchKeys.get(key);
            if (watchInfo == null) {
                logger.warn("Watch key not recognized");
                key.reset();
                continue;
            }

            for (final WatchEvent<?> event : key.pollEvents()) {
                final WatchEvent.Kind<?> kind = event.kind();

                if (kind == OVERFLOW) {
                    logger.warn("Watch event overflow in {}, some changes will only be seen by the next full pass",
                            watchInfo.directory);
                    continue;
                }

                @SuppressWarnings("unchecked") final WatchEvent<Path> pathEvent = (WatchEvent<Path>) event;
                final Path filename = pathEvent.context();
                if (watchInfo.onlyFileName != null && !watchInfo.onlyFileName.equals(filename)) {
                    continue;
                }
                final Path fullPath = watchInfo.directory.resolve(filename);

                try {
                    dispatch(kind, fullPath, watchInfo);
                } catch (final Exception e) {
                    logger.error("Error processing watch event for: {}", fullPath, e);
                }
            }

            final boolean valid = key.reset();
            if (!valid) {
                watchKeys.remove(key);
                logger.debug("Watch key for {} no longer valid, removed from tracking", watchInfo.directory);
            }
        }

        logger.info("Directory watcher stopped");
    }

    private void dispatch(final WatchEvent.Kind<?> kind, final Path fullPath, final WatchInfo watchInfo)
            throws IOException {
        if (kind == ENTRY_CREATE) {
            if (Files.isDirectory(fullPath)) {
                if (watchInfo.recursive) {
                    registerRecursive(fullPath, watchInfo.listener);
                    // Files may have landed in the directory before its watch was registered
                    watchInfo.listener.onFileCreated(fullPath);
                }
            } else {
                watchInfo.listener.onFileCreated(fullPath);
            }
        } else if (kind == ENTRY_MODIFY) {
            if (Files.isRegularFile(fullPath)) {
                watchInfo.listener.onFileModified(fullPath);
            }
        } else if (kind == ENTRY_DELETE) {
            watchInfo.listener.onFileDeleted(fullPath);
        }
    }

    public void stopAll() throws IOException {
        logger.info("Stopping all directory watchers");
        watchExecutor.shutdownNow();

        if (watchService != null) {
            watchService.close();
        }

        watchKeys.clear();
    }

    public void shutdown() {
        try {
            stopAll();
        } catch (final IOException e) {
            logger.error("Error shutting down directory watcher service", e);
        }
    }

    private record WatchInfo(Path directory, FileChangeListener listener, boolean recursive,
                             @Nullable Path onlyFileName) {
    }
}
