package de.mirkosertic.mcp.knowledgebase.crawler;

import de.mirkosertic.mcp.knowledgebase.config.ApplicationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Bridges file system events to update passes. File events are debounced per source id
 * and trigger a {@code FILE} pass for that path, link list events are debounced on a
 * single key and trigger a {@code LINK_LIST} pass.
 */
public class WatchTriggerService implements FileChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(WatchTriggerService.class);

    private static final String LINK_LIST_KEY = "<link-list>";

    private final ApplicationConfig config;
    private final SourceEnumerator enumerator;
    private final DirectoryWatcherService watcherService;
    private final Consumer<UpdateScope> updateSubmitter;
    private final Debouncer<String> fileDebouncer;
    private final Debouncer<String> linkDebouncer;

    public WatchTriggerService(final ApplicationConfig config,
                               final SourceEnumerator enumerator,
                               final DirectoryWatcherService watcherService,
                               final Consumer<UpdateScope> updateSubmitter) {
        this.config = config;
        this.enumerator = enumerator;
        this.watcherService = watcherService;
        this.updateSubmitter = updateSubmitter;
        this.fileDebouncer = new Debouncer<>("file-watch", config.getFileDebounceMs());
        this.linkDebouncer = new Debouncer<>("link-watch", config.getLinkDebounceMs());
    }

    /**
     * Register the configured watches.
     */
    public void start() {
        final Path sourcesDir = enumerator.getSourcesDir();
        final Path linksFile = enumerator.getLinksFile();
        final boolean watchFiles = config.isFileWatchEnabled() && Files.isDirectory(sourcesDir);

        if (watchFiles) {
            try {
                watcherService.watchDirectory(sourcesDir, this);
                logger.info("Watching sources directory: {}", sourcesDir);
            } catch (final IOException e) {
                logger.error("Failed to setup watcher for sources directory: {}", sourcesDir, e);
            }
        }

        // A link list inside a recursively watched sources directory already reports through that watch
        final boolean coveredBySourceWatch = watchFiles && linksFile.startsWith(sourcesDir);
        if (config.isLinkWatchEnabled() && !coveredBySourceWatch) {
            try {
                watcherService.watchFile(linksFile, this);
                logger.info("Watching link list: {}", linksFile);
            } catch (final IOException e) {
                logger.error("Failed to setup watcher for link list: {}", linksFile, e);
            }
        }
    }

    @Override
    public void onFileCreated(final Path path) {
        onChange(path);
    }

    @Override
    public void onFileModified(final Path path) {
        onChange(path);
    }

    @Override
    public void onFileDeleted(final Path path) {
        onChange(path);
    }

    private void onChange(final Path path) {
        final Path absolute = path.toAbsolutePath().normalize();
        if (absolute.equals(enumerator.getLinksFile())) {
            if (config.isLinkWatchEnabled()) {
                logger.debug("Link list changed");
                linkDebouncer.trigger(LINK_LIST_KEY, () -> updateSubmitter.accept(UpdateScope.linkList()));
            }
            return;
        }

        if (!config.isFileWatchEnabled()) {
            return;
        }
        final String sourceId = enumerator.sourceIdOf(absolute);
        if (sourceId == null || FilePatternMatcher.isHidden(Path.of(sourceId))) {
            return;
        }
        logger.debug("Source changed: {}", sourceId);
        fileDebouncer.trigger(sourceId, () -> updateSubmitter.accept(UpdateScope.file(sourceId)));
    }

    public void shutdown() {
        fileDebouncer.close();
        linkDebouncer.close();
        watcherService.shutdown();
    }
}
