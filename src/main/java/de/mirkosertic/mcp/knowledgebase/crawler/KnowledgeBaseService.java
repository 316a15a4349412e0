package de.mirkosertic.mcp.knowledgebase.crawler;

import de.mirkosertic.mcp.knowledgebase.cache.UpdateAbortedException;
import de.mirkosertic.mcp.knowledgebase.config.ApplicationConfig;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lifecycle of the knowledge base: startup sync, watchers, refresh ticks and manual
 * passes. All passes run on the {@link UpdateExecutorService} and serialize on the
 * update lock inside the {@link UpdateOrchestrator}.
 */
public class KnowledgeBaseService {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeBaseService.class);

    private final ApplicationConfig config;
    private final UpdateOrchestrator orchestrator;
    private final UpdateExecutorService updateExecutor;
    private final WatchTriggerService watchTrigger;
    private final RefreshTickService refreshTick;

    private final AtomicInteger runningPasses = new AtomicInteger(0);
    private volatile boolean watching;
    private volatile @Nullable UpdateResult lastResult;
    private volatile @Nullable String lastError;

    public KnowledgeBaseService(final ApplicationConfig config,
                                final UpdateOrchestrator orchestrator,
                                final UpdateExecutorService updateExecutor,
                                final SourceEnumerator enumerator,
                                final DirectoryWatcherService watcherService) {
        this.config = config;
        this.orchestrator = orchestrator;
        this.updateExecutor = updateExecutor;
        this.watchTrigger = new WatchTriggerService(config, enumerator, watcherService, this::submit);
        this.refreshTick = new RefreshTickService(config.getUrlTickIntervalMs(), this::submit);
    }

    /**
     * Start watchers and the refresh tick, and queue the startup sync if enabled.
     */
    public void init() {
        if (config.isSyncOnStartup()) {
            logger.info("Sync on startup is enabled");
            submit(UpdateScope.full());
        }
        if (config.isFileWatchEnabled() || config.isLinkWatchEnabled()) {
            watchTrigger.start();
            watching = true;
        }
        if (config.isUrlTickEnabled()) {
            refreshTick.start();
        }
    }

    /**
     * Queue an update pass, or join the identical pass that is already waiting. Failures
     * are logged and recorded as {@link #getLastError()}, and also surface through the
     * returned future.
     */
    public Future<UpdateResult> submit(final UpdateScope scope) {
        logger.debug("Queueing update pass {}", scope);
        return updateExecutor.submit(scope, () -> update(scope));
    }

    public int getQueuedPasses() {
        return updateExecutor.queuedPasses();
    }

    /**
     * Run an update pass on the calling thread.
     */
    public UpdateResult update(final UpdateScope scope) throws UpdateAbortedException {
        runningPasses.incrementAndGet();
        try {
            final UpdateResult result = orchestrator.update(scope);
            lastResult = result;
            lastError = null;
            return result;
        } catch (final UpdateAbortedException e) {
            logger.error("Update pass {} aborted: {}", scope, e.getMessage());
            lastError = scope + ": " + e.getMessage();
            throw e;
        } catch (final RuntimeException e) {
            logger.error("Update pass {} failed unexpectedly", scope, e);
            lastError = scope + ": " + e;
            throw e;
        } finally {
            runningPasses.decrementAndGet();
        }
    }

    public ServiceState getState() {
        if (runningPasses.get() > 0) {
            return ServiceState.UPDATING;
        }
        return watching ? ServiceState.WATCHING : ServiceState.IDLE;
    }

    public @Nullable UpdateResult getLastResult() {
        return lastResult;
    }

    public @Nullable String getLastError() {
        return lastError;
    }

    /**
     * Shutdown watchers, the tick and the update workers. Should be called on application shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down KnowledgeBaseService");
        refreshTick.shutdown();
        watchTrigger.shutdown();
        watching = false;
        updateExecutor.shutdown();
    }

    public enum ServiceState {
        IDLE,
        UPDATING,
        WATCHING
    }
}
