package de.mirkosertic.mcp.knowledgebase.source;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs calls into the summarizer and the fetcher on worker threads so that the update
 * pass can give up on them after a deadline. A timed out call is interrupted.
 */
public class ExternalCallExecutor implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExternalCallExecutor.class);

    private final ExecutorService executor;

    public ExternalCallExecutor() {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "external-call-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
        this.executor = Executors.newCachedThreadPool(threadFactory);
    }

    /**
     * Run the call and wait at most {@code timeoutMs} for its result.
     *
     * @throws TimeoutException     the call did not finish in time
     * @throws ExecutionException   the call threw, the original exception is the cause
     * @throws InterruptedException the waiting thread was interrupted
     */
    public <T> T call(final Callable<T> task, final long timeoutMs)
            throws TimeoutException, ExecutionException, InterruptedException {
        final Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (final TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    /**
     * Summarize with a deadline. Timeouts and unexpected failures are reported as
     * {@link SummarizationException} so callers handle a single failure type.
     */
    public String summarize(final Summarizer summarizer, final String sourceId, final String text,
                            final long timeoutMs) throws SummarizationException, InterruptedException {
        try {
            return call(() -> summarizer.summarize(sourceId, text), timeoutMs);
        } catch (final TimeoutException e) {
            throw new SummarizationException("Summarizer timed out after " + timeoutMs + "ms", e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof SummarizationException summarizationException) {
                throw summarizationException;
            }
            throw new SummarizationException("Summarizer failed: " + cause, cause);
        }
    }

    /**
     * Fetch with a deadline. A call that overruns is reported as {@code timeout}, a fetcher
     * that throws despite its contract as {@code error}.
     */
    public FetchResult fetch(final ContentFetcher fetcher, final String url, final @Nullable String etag,
                             final @Nullable String lastModified, final long timeoutMs) throws InterruptedException {
        try {
            return call(() -> fetcher.fetch(url, etag, lastModified), timeoutMs);
        } catch (final TimeoutException e) {
            return FetchResult.timeout("Fetch timed out after " + timeoutMs + "ms");
        } catch (final ExecutionException e) {
            logger.warn("Content fetcher threw for {}", url, e.getCause());
            return FetchResult.error(String.valueOf(e.getCause()));
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
