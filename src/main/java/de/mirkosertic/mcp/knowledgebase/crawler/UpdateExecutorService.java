package de.mirkosertic.mcp.knowledgebase.crawler;

import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Queue of update passes, drained by worker threads. Passes then serialize on the update
 * lock, so triggers never block the watcher or scheduler threads that raise them.
 * <p>
 * A scope that is still waiting in the queue is not queued twice. The second caller gets
 * the future of the waiting pass, which has not read the cache or the sources yet and
 * therefore covers that caller's change as well. As soon as a pass starts running, its
 * scope can be queued again.
 */
public class UpdateExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(UpdateExecutorService.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final ExecutorService workers;
    private final ConcurrentMap<UpdateScope, QueuedPass> queued = new ConcurrentHashMap<>();
    private final AtomicLong coalesced = new AtomicLong(0);

    public UpdateExecutorService(final int threads) {
        final int workerCount = Math.max(1, threads);
        this.workers = Executors.newFixedThreadPool(workerCount, new ThreadFactoryBuilder()
                .setNameFormat("kb-update-%d")
                .build());
        logger.info("Update queue started with {} worker(s)", workerCount);
    }

    /**
     * Queue {@code pass} for {@code scope}, or join the pass already waiting for that scope.
     *
     * @throws RejectedExecutionException after {@link #shutdown()}
     */
    public Future<UpdateResult> submit(final UpdateScope scope, final Callable<UpdateResult> pass) {
        final QueuedPass candidate = new QueuedPass(scope, pass);
        final QueuedPass waiting = queued.putIfAbsent(scope, candidate);
        if (waiting != null) {
            coalesced.incrementAndGet();
            logger.debug("Update pass {} is already queued, joining it", scope);
            return waiting;
        }

        try {
            workers.execute(candidate);
        } catch (final RejectedExecutionException e) {
            queued.remove(scope, candidate);
            throw e;
        }
        return candidate;
    }

    /**
     * Number of passes waiting for a worker.
     */
    public int queuedPasses() {
        return queued.size();
    }

    /**
     * Number of submissions that joined an already queued pass since startup.
     */
    public long coalescedSubmissions() {
        return coalesced.get();
    }

    /**
     * Stop accepting passes and give running ones a grace period before interrupting them.
     */
    public void shutdown() {
        logger.info("Stopping update queue, {} pass(es) still waiting", queued.size());
        if (!MoreExecutors.shutdownAndAwaitTermination(workers, SHUTDOWN_GRACE)) {
            logger.warn("Update workers did not stop within {}s", SHUTDOWN_GRACE.toSeconds());
        }
    }

    private final class QueuedPass extends FutureTask<UpdateResult> {

        private final UpdateScope scope;

        QueuedPass(final UpdateScope scope, final Callable<UpdateResult> pass) {
            super(pass);
            this.scope = scope;
        }

        @Override
        public void run() {
            // Leaving the queue first lets changes that arrive during the run queue a new pass
            queued.remove(scope, this);
            super.run();
        }
    }
}
