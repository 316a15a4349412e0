package de.mirkosertic.mcp.knowledgebase.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Raises a {@code REFRESH_TICK} pass at a fixed delay so that due URLs are refreshed
 * without a manual command.
 */
public class RefreshTickService {

    private static final Logger logger = LoggerFactory.getLogger(RefreshTickService.class);

    private final long intervalMs;
    private final Consumer<UpdateScope> updateSubmitter;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "url-refresh-tick");
        t.setDaemon(true);
        return t;
    });

    public RefreshTickService(final long intervalMs, final Consumer<UpdateScope> updateSubmitter) {
        this.intervalMs = intervalMs;
        this.updateSubmitter = updateSubmitter;
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        logger.info("URL refresh tick every {}ms", intervalMs);
    }

    void tick() {
        try {
            updateSubmitter.accept(UpdateScope.refreshTick());
        } catch (final RuntimeException e) {
            // An exception escaping here would cancel all future ticks
            logger.error("Scheduling URL refresh tick failed", e);
        }
    }

    public void shutdown() {
        scheduler.shutdownNow();
    }
}
