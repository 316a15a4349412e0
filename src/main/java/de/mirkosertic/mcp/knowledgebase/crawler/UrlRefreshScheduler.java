package de.mirkosertic.mcp.knowledgebase.crawler;

import de.mirkosertic.mcp.knowledgebase.cache.CacheRecord;
import de.mirkosertic.mcp.knowledgebase.cache.FetchStatus;
import de.mirkosertic.mcp.knowledgebase.source.ContentFetcher;
import de.mirkosertic.mcp.knowledgebase.source.ExternalCallExecutor;
import de.mirkosertic.mcp.knowledgebase.source.FetchResult;
import de.mirkosertic.mcp.knowledgebase.source.SummarizationException;
import de.mirkosertic.mcp.knowledgebase.source.Summarizer;
import de.mirkosertic.mcp.knowledgebase.util.ContentHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Decides which URL sources are due and refreshes them with conditional requests.
 * <p>
 * A URL is due when its {@code next_check_at} has passed, or when its last successful
 * fetch is older than the maximum age. Each pass handles at most a budget of due URLs,
 * oldest {@code next_check_at} first; the rest simply stay due. Failed fetches push
 * {@code next_check_at} out exponentially, capped at the configured maximum.
 */
public class UrlRefreshScheduler {

    private static final Logger logger = LoggerFactory.getLogger(UrlRefreshScheduler.class);

    private static final Comparator<CacheRecord> DUE_ORDER = Comparator
            .comparing(CacheRecord::getNextCheckAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(CacheRecord::getSourceId);

    private final Clock clock;
    private final ContentFetcher fetcher;
    private final Summarizer summarizer;
    private final ExternalCallExecutor callExecutor;
    private final Duration minRefreshInterval;
    private final Duration maxAge;
    private final Duration backoffBase;
    private final Duration backoffCap;
    private final long fetchTimeoutMs;
    private final long summarizeTimeoutMs;

    public UrlRefreshScheduler(final Clock clock,
                               final ContentFetcher fetcher,
                               final Summarizer summarizer,
                               final ExternalCallExecutor callExecutor,
                               final Duration minRefreshInterval,
                               final Duration maxAge,
                               final Duration backoffBase,
                               final Duration backoffCap,
                               final long fetchTimeoutMs,
                               final long summarizeTimeoutMs) {
        this.clock = clock;
        this.fetcher = fetcher;
        this.summarizer = summarizer;
        this.callExecutor = callExecutor;
        this.minRefreshInterval = minRefreshInterval;
        this.maxAge = maxAge;
        this.backoffBase = backoffBase;
        this.backoffCap = backoffCap;
        this.fetchTimeoutMs = fetchTimeoutMs;
        this.summarizeTimeoutMs = summarizeTimeoutMs;
    }

    /**
     * What refreshing a single URL did to its record.
     */
    public enum Outcome {
        /** 304, only bookkeeping fields changed. */
        NOT_MODIFIED,
        /** Fetched, but the normalized body hashes as before. No summarizer call. */
        CONTENT_UNCHANGED,
        /** Fetched new content and stored a new summary. */
        SUMMARIZED,
        /** Fetch timed out or failed; backoff applied. */
        FETCH_FAILED,
        /** Fetched new content but the summarizer failed; prior summary kept. */
        SUMMARY_FAILED
    }

    /**
     * Due when {@code next_check_at} has passed or the last successful fetch is older than
     * the maximum age. Only successes and 304s move {@code last_fetched_at}, so a URL that
     * keeps failing after its content went stale is due on every pass regardless of its
     * backoff. The per-pass budget is what limits it.
     */
    public boolean isDue(final CacheRecord record, final Instant now) {
        final Instant nextCheckAt = record.getNextCheckAt();
        if (nextCheckAt == null || !nextCheckAt.isAfter(now)) {
            return true;
        }
        final Instant lastFetchedAt = record.getLastFetchedAt();
        return lastFetchedAt != null && Duration.between(lastFetchedAt, now).compareTo(maxAge) > 0;
    }

    /**
     * The URLs to refresh in this pass, in processing order.
     */
    public List<CacheRecord> selectDue(final Collection<CacheRecord> urlRecords, final int budget) {
        if (budget <= 0) {
            return List.of();
        }
        final Instant now = clock.instant();
        return urlRecords.stream()
                .filter(record -> isDue(record, now))
                .sorted(DUE_ORDER)
                .limit(budget)
                .toList();
    }

    /**
     * Fetch one URL and apply the result to its record.
     */
    public Outcome refresh(final CacheRecord record) throws InterruptedException {
        final String url = record.getSourceId();
        final FetchResult result = callExecutor.fetch(fetcher, url, record.getEtag(), record.getLastModified(),
                fetchTimeoutMs);
        final Instant now = clock.instant();

        switch (result.status()) {
            case NOT_MODIFIED -> {
                markFetched(record, FetchStatus.NOT_MODIFIED, now);
                applyValidators(record, result);
                logger.debug("URL {} not modified, next check at {}", url, record.getNextCheckAt());
                return Outcome.NOT_MODIFIED;
            }
            case SUCCESS -> {
                return applySuccess(record, result, now);
            }
            default -> {
                final int failures = record.getFailureCount() + 1;
                record.setFetchStatus(result.status());
                record.setConsecutiveFailures(failures);
                record.setNextCheckAt(now.plus(backoff(failures, backoffBase, backoffCap)));
                logger.warn("URL {} failed with classification={} ({} consecutive), next check at {}: {}",
                        url, result.status() == FetchStatus.TIMEOUT ? "fetch-timeout" : "fetch-error",
                        failures, record.getNextCheckAt(), result.errorMessage());
                return Outcome.FETCH_FAILED;
            }
        }
    }

    private Outcome applySuccess(final CacheRecord record, final FetchResult result, final Instant now)
            throws InterruptedException {
        final String url = record.getSourceId();
        final String body = result.bodyText() == null ? "" : result.bodyText();
        final String hash = ContentHasher.hash(body);

        if (hash.equals(record.getContentHash()) && record.hasSummary()) {
            markFetched(record, FetchStatus.SUCCESS, now);
            applyValidators(record, result);
            logger.debug("URL {} content unchanged", url);
            return Outcome.CONTENT_UNCHANGED;
        }

        final String summary;
        try {
            summary = callExecutor.summarize(summarizer, url, body, summarizeTimeoutMs);
        } catch (final SummarizationException e) {
            // Validators and hash stay as they were so the next attempt fetches the full body again
            record.setNextCheckAt(now.plus(backoffBase));
            logger.warn("Summarizing URL {} failed with classification=summarize, retry at {}: {}",
                    url, record.getNextCheckAt(), e.getMessage());
            return Outcome.SUMMARY_FAILED;
        }

        record.setContentHash(hash);
        record.setSummaryText(summary);
        record.setLastIndexedAt(now);
        markFetched(record, FetchStatus.SUCCESS, now);
        applyValidators(record, result);
        logger.info("URL {} summarized", url);
        return Outcome.SUMMARIZED;
    }

    private void markFetched(final CacheRecord record, final FetchStatus status, final Instant now) {
        record.setFetchStatus(status);
        record.setLastFetchedAt(now);
        record.setConsecutiveFailures(0);
        record.setNextCheckAt(now.plus(minRefreshInterval));
    }

    private static void applyValidators(final CacheRecord record, final FetchResult result) {
        if (result.etag() != null) {
            record.setEtag(result.etag());
        }
        if (result.lastModified() != null) {
            record.setLastModified(result.lastModified());
        }
    }

    /**
     * Delay before the next attempt after {@code failures} consecutive failures:
     * {@code min(base * 2^(failures - 1), cap)}.
     */
    public static Duration backoff(final int failures, final Duration base, final Duration cap) {
        if (failures <= 0) {
            return Duration.ZERO;
        }
        final int shift = Math.min(failures - 1, 62);
        final long baseMs = base.toMillis();
        final long delayMs;
        if (baseMs > 0 && baseMs > (Long.MAX_VALUE >> shift)) {
            delayMs = Long.MAX_VALUE;
        } else {
            delayMs = baseMs << shift;
        }
        return Duration.ofMillis(Math.min(delayMs, cap.toMillis()));
    }
}
