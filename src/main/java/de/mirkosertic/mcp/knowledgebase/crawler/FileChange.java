package de.mirkosertic.mcp.knowledgebase.crawler;

import org.jspecify.annotations.Nullable;

/**
 * Result of comparing a file on disk with its cached record. Text and hash are only
 * present when the file actually had to be read.
 */
public record FileChange(
        Kind kind,
        FileSource source,
        @Nullable String text,
        @Nullable String contentHash
) {

    public enum Kind {
        /** No cached record exists yet. */
        NEW,
        /** Size and modification time match the cached fingerprint; the file was not read. */
        UNCHANGED,
        /** Fingerprint differs but the normalized content hashes the same. */
        METADATA_ONLY,
        /** Normalized content differs from the cached hash. */
        CHANGED
    }

    public boolean needsSummary() {
        return kind == Kind.NEW || kind == Kind.CHANGED;
    }
}
