package de.mirkosertic.mcp.knowledgebase.crawler;

import java.time.Instant;

/**
 * Summary of one completed update pass.
 */
public record UpdateResult(
        String scope,
        Instant startedAt,
        long durationMs,
        /** Sources seen for the first time and summarized. */
        int added,
        /** Sources whose normalized content changed and that were summarized again. */
        int changed,
        /** Files whose fingerprint changed but whose content did not. */
        int metadataOnly,
        /** Sources that were no longer listed and got dropped. */
        int removed,
        int unchanged,
        /** Sources that could not be read, fetched or summarized in this pass. */
        int failed,
        int urlsFetched,
        int urlsNotModified,
        /** Due URLs left for a later pass because the budget was used up. */
        int urlsDeferred,
        boolean cacheWritten,
        boolean indexWritten
) {

    public int summarizerCalls() {
        return added + changed;
    }

    static Builder builder(final UpdateScope scope, final Instant startedAt) {
        return new Builder(scope.toString(), startedAt);
    }

    static final class Builder {

        private final String scope;
        private final Instant startedAt;
        int added;
        int changed;
        int metadataOnly;
        int removed;
        int unchanged;
        int failed;
        int urlsFetched;
        int urlsNotModified;
        int urlsDeferred;

        private Builder(final String scope, final Instant startedAt) {
            this.scope = scope;
            this.startedAt = startedAt;
        }

        UpdateResult build(final long durationMs, final boolean cacheWritten, final boolean indexWritten) {
            return new UpdateResult(scope, startedAt, durationMs, added, changed, metadataOnly, removed,
                    unchanged, failed, urlsFetched, urlsNotModified, urlsDeferred, cacheWritten, indexWritten);
        }
    }
}
