package de.mirkosertic.mcp.knowledgebase.crawler;

import de.mirkosertic.mcp.knowledgebase.cache.CacheRecord;
import de.mirkosertic.mcp.knowledgebase.cache.CacheStore;
import de.mirkosertic.mcp.knowledgebase.cache.KnowledgeBaseCache;
import de.mirkosertic.mcp.knowledgebase.cache.SourceType;
import de.mirkosertic.mcp.knowledgebase.cache.UpdateAbortedException;
import de.mirkosertic.mcp.knowledgebase.cache.UpdateLock;
import de.mirkosertic.mcp.knowledgebase.config.ApplicationConfig;
import de.mirkosertic.mcp.knowledgebase.index.IndexGenerator;
import de.mirkosertic.mcp.knowledgebase.source.ExternalCallExecutor;
import de.mirkosertic.mcp.knowledgebase.source.SummarizationException;
import de.mirkosertic.mcp.knowledgebase.source.Summarizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs update passes. Every trigger (manual reindex, startup sync, file and link list
 * events, refresh ticks) goes through {@link #update(UpdateScope)}, which
 * <ol>
 *   <li>acquires the update lock,</li>
 *   <li>loads the cache and enumerates the sources in scope,</li>
 *   <li>drops vanished sources, creates new ones and checks retained ones for changes,</li>
 *   <li>refreshes due URLs within the scope's budget,</li>
 *   <li>writes the index and then the cache, only if something changed.</li>
 * </ol>
 * Failures of single sources are logged and counted; they never abort the pass.
 */
public class UpdateOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(UpdateOrchestrator.class);

    private final ApplicationConfig config;
    private final CacheStore cacheStore;
    private final UpdateLock updateLock;
    private final SourceEnumerator enumerator;
    private final ChangeDetector changeDetector;
    private final UrlRefreshScheduler urlScheduler;
    private final Summarizer summarizer;
    private final ExternalCallExecutor callExecutor;
    private final Clock clock;

    public UpdateOrchestrator(final ApplicationConfig config,
                              final CacheStore cacheStore,
                              final UpdateLock updateLock,
                              final SourceEnumerator enumerator,
                              final ChangeDetector changeDetector,
                              final UrlRefreshScheduler urlScheduler,
                              final Summarizer summarizer,
                              final ExternalCallExecutor callExecutor,
                              final Clock clock) {
        this.config = config;
        this.cacheStore = cacheStore;
        this.updateLock = updateLock;
        this.enumerator = enumerator;
        this.changeDetector = changeDetector;
        this.urlScheduler = urlScheduler;
        this.summarizer = summarizer;
        this.callExecutor = callExecutor;
        this.clock = clock;
    }

    /**
     * Run one update pass.
     *
     * @throws UpdateAbortedException if the lock could not be acquired, the sources could
     *                                not be enumerated or the results could not be persisted.
     *                                The durable state is unchanged in all these cases.
     */
    public UpdateResult update(final UpdateScope scope) throws UpdateAbortedException {
        final Instant startedAt = clock.instant();
        final long startNanos = System.nanoTime();

        try (UpdateLock.Handle ignored = updateLock.acquire()) {
            logger.info("Starting update pass {}", scope);
            final KnowledgeBaseCache cache = cacheStore.load();
            final UpdateResult.Builder counts = UpdateResult.builder(scope, startedAt);
            final PassState state = new PassState();

            // Enumerate everything up front so that an enumeration failure leaves the cache untouched
            List<FileSource> files = null;
            List<String> urls = null;
            try {
                if (scope.includesFiles()) {
                    files = scope.kind() == UpdateScope.Kind.FILE
                            ? enumerator.listFiles(scope.relativePath())
                            : enumerator.listFiles();
                }
                if (scope.includesLinkList()) {
                    urls = enumerator.listUrls();
                }
            } catch (final IOException | IllegalArgumentException e) {
                logger.error("Enumerating sources for {} failed, aborting pass", scope, e);
                throw new UpdateAbortedException("Enumerating sources failed: " + e.getMessage(), e);
            }

            try {
                if (files != null) {
                    syncFiles(cache, scope, files, counts, state);
                }
                if (urls != null) {
                    syncUrls(cache, urls, urlBudget(scope), counts, state);
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UpdateAbortedException("Update pass " + scope + " was interrupted", e);
            }

            final boolean writeIndex = state.indexChanged || !cacheStore.indexExists();
            final boolean writeCache = state.cacheChanged;
            persist(cache, writeIndex, writeCache);

            final long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            final UpdateResult result = counts.build(durationMs, writeCache, writeIndex);
            logger.info("Finished update pass {} in {}ms: added={}, changed={}, metadataOnly={}, removed={}, "
                            + "unchanged={}, failed={}, urlsFetched={}, urlsNotModified={}, urlsDeferred={}",
                    scope, durationMs, result.added(), result.changed(), result.metadataOnly(), result.removed(),
                    result.unchanged(), result.failed(), result.urlsFetched(), result.urlsNotModified(),
                    result.urlsDeferred());
            return result;
        }
    }

    int urlBudget(final UpdateScope scope) {
        return switch (scope.kind()) {
            case FULL -> scope.refreshUrls() ? config.getUrlManualBudget() : 0;
            case REFRESH_TICK -> config.getUrlTickBudget();
            case FILE, LINK_LIST -> 0;
        };
    }

    private void syncFiles(final KnowledgeBaseCache cache,
                           final UpdateScope scope,
                           final List<FileSource> files,
                           final UpdateResult.Builder counts,
                           final PassState state) throws InterruptedException {
        final Map<String, FileSource> enumerated = new LinkedHashMap<>();
        for (final FileSource file : files) {
            enumerated.put(file.sourceId(), file);
        }

        // Files of this scope that are cached but no longer on disk
        for (final CacheRecord record : cache.records(SourceType.FILE)) {
            if (inScope(record.getSourceId(), scope) && !enumerated.containsKey(record.getSourceId())) {
                remove(cache, record, counts, state);
            }
        }

        for (final FileSource file : enumerated.values()) {
            processFile(cache, file, counts, state);
        }
    }

    static boolean inScope(final String sourceId, final UpdateScope scope) {
        if (scope.kind() != UpdateScope.Kind.FILE || scope.relativePath() == null || scope.relativePath().isEmpty()) {
            return true;
        }
        final String path = scope.relativePath();
        return sourceId.equals(path) || sourceId.startsWith(path.endsWith("/") ? path : path + "/");
    }

    private void processFile(final KnowledgeBaseCache cache,
                             final FileSource file,
                             final UpdateResult.Builder counts,
                             final PassState state) throws InterruptedException {
        final CacheRecord cached = cache.get(file.sourceId());

        final FileChange change;
        try {
            change = changeDetector.detect(file, cached);
        } catch (final CharacterCodingException e) {
            logger.warn("Skipping {} with classification=decode: not valid UTF-8", file.sourceId());
            counts.failed++;
            return;
        } catch (final ChangeDetector.SourceRejectedException e) {
            logger.warn("Skipping {} with classification=decode: {}", file.sourceId(), e.getMessage());
            counts.failed++;
            return;
        } catch (final IOException e) {
            logger.warn("Skipping {} with classification=read: {}", file.sourceId(), e.toString());
            counts.failed++;
            return;
        }

        switch (change.kind()) {
            case UNCHANGED -> counts.unchanged++;
            case METADATA_ONLY -> {
                cached.setSizeBytes(file.sizeBytes());
                cached.setMtimeNs(file.mtimeNs());
                state.cacheChanged = true;
                counts.metadataOnly++;
                logger.debug("Refreshed fingerprint of {}, content unchanged", file.sourceId());
            }
            case NEW, CHANGED -> summarizeFile(cache, cached, change, counts, state);
        }
    }

    private void summarizeFile(final KnowledgeBaseCache cache,
                               final CacheRecord cached,
                               final FileChange change,
                               final UpdateResult.Builder counts,
                               final PassState state) throws InterruptedException {
        final FileSource file = change.source();
        final String summary;
        try {
            summary = callExecutor.summarize(summarizer, file.sourceId(), change.text(), config.getSummarizeTimeoutMs());
        } catch (final SummarizationException e) {
            // Nothing is committed, so the next pass sees the same difference and tries again
            logger.warn("Summarizing {} failed with classification=summarize: {}", file.sourceId(), e.getMessage());
            counts.failed++;
            return;
        }

        final CacheRecord record = cached != null ? cached : CacheRecord.forFile(file.sourceId());
        record.setContentHash(change.contentHash());
        record.setSummaryText(summary);
        record.setSizeBytes(file.sizeBytes());
        record.setMtimeNs(file.mtimeNs());
        record.setLastIndexedAt(clock.instant());
        cache.put(record);
        state.cacheChanged = true;
        state.indexChanged = true;

        if (change.kind() == FileChange.Kind.NEW) {
            counts.added++;
            logger.info("Added {}", file.sourceId());
        } else {
            counts.changed++;
            logger.info("Updated summary of {}", file.sourceId());
        }
    }

    private void syncUrls(final KnowledgeBaseCache cache,
                          final List<String> urls,
                          final int budget,
                          final UpdateResult.Builder counts,
                          final PassState state) throws InterruptedException {
        final Set<String> listed = new LinkedHashSet<>(urls);

        for (final CacheRecord record : cache.records(SourceType.URL)) {
            if (!listed.contains(record.getSourceId())) {
                remove(cache, record, counts, state);
            }
        }

        final Instant now = clock.instant();
        for (final String url : listed) {
            if (cache.get(url) == null) {
                cache.put(CacheRecord.forUrl(url, now));
                state.cacheChanged = true;
                logger.info("New URL {} scheduled for fetching", url);
            }
        }

        final List<CacheRecord> urlRecords = new ArrayList<>(cache.records(SourceType.URL));
        final long dueCount = urlRecords.stream().filter(r -> urlScheduler.isDue(r, now)).count();
        final List<CacheRecord> selected = urlScheduler.selectDue(urlRecords, budget);
        counts.urlsDeferred = (int) (dueCount - selected.size());

        for (final CacheRecord record : selected) {
            final boolean firstContent = record.getContentHash() == null;
            final UrlRefreshScheduler.Outcome outcome = urlScheduler.refresh(record);
            state.cacheChanged = true;
            counts.urlsFetched++;
            switch (outcome) {
                case NOT_MODIFIED -> {
                    counts.urlsNotModified++;
                    counts.unchanged++;
                }
                case CONTENT_UNCHANGED -> counts.unchanged++;
                case SUMMARIZED -> {
                    state.indexChanged = true;
                    if (firstContent) {
                        counts.added++;
                    } else {
                        counts.changed++;
                    }
                }
                case FETCH_FAILED, SUMMARY_FAILED -> counts.failed++;
            }
        }
    }

    private static void remove(final KnowledgeBaseCache cache,
                               final CacheRecord record,
                               final UpdateResult.Builder counts,
                               final PassState state) {
        cache.remove(record.getSourceId());
        state.cacheChanged = true;
        if (record.hasSummary()) {
            state.indexChanged = true;
        }
        counts.removed++;
        logger.info("Removed {} {}", record.getSourceType() == SourceType.URL ? "URL" : "file", record.getSourceId());
    }

    private void persist(final KnowledgeBaseCache cache, final boolean writeIndex, final boolean writeCache)
            throws UpdateAbortedException {
        try {
            // Index first: a crash in between leaves an older cache, which only causes extra work next time
            if (writeIndex) {
                cacheStore.persistIndex(IndexGenerator.render(cache));
            }
            if (writeCache) {
                cacheStore.persist(cache);
            }
        } catch (final IOException e) {
            logger.error("Persisting update results failed, aborting pass", e);
            throw new UpdateAbortedException("Persisting update results failed: " + e.getMessage(), e);
        }
    }

    private static final class PassState {
        boolean cacheChanged;
        boolean indexChanged;
    }
}
