package de.mirkosertic.mcp.knowledgebase.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Collapses bursts of events per key. Every event restarts the key's timer; the action
 * runs once, after the key has been quiet for the configured delay.
 *
 * @param <K> key type, e.g. a source id
 */
public class Debouncer<K> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Debouncer.class);

    private final long delayMs;
    private final Map<K, Timer> pending = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;

    public Debouncer(final String name, final long delayMs) {
        this.delayMs = delayMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, name + "-debounce");
            t.setDaemon(true);
            return t;
        });
    }

    public void trigger(final K key, final Runnable action) {
        pending.compute(key, (k, previous) -> {
            if (previous != null) {
                previous.cancel();
            }
            final Timer timer = new Timer();
            timer.future = scheduler.schedule(() -> fire(k, timer, action), delayMs, TimeUnit.MILLISECONDS);
            return timer;
        });
    }

    private void fire(final K key, final Timer timer, final Runnable action) {
        // A newer event may have replaced this timer after it started running
        if (!pending.remove(key, timer)) {
            return;
        }
        try {
            action.run();
        } catch (final RuntimeException e) {
            logger.error("Debounced action for {} failed", key, e);
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void close() {
        pending.values().forEach(Timer::cancel);
        pending.clear();
        scheduler.shutdownNow();
    }

    private static final class Timer {

        private volatile ScheduledFuture<?> future;

        void cancel() {
            final ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
