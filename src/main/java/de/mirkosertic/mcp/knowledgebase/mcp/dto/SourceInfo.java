package de.mirkosertic.mcp.knowledgebase.mcp.dto;

import de.mirkosertic.mcp.knowledgebase.cache.CacheRecord;

import java.time.Instant;

/**
 * Cached state of one source as reported by the listSources tool.
 */
public record SourceInfo(
        String sourceId,
        String sourceType,
        boolean summarized,
        Instant lastIndexedAt,
        Long sizeBytes,
        String fetchStatus,
        Integer consecutiveFailures,
        Instant lastFetchedAt,
        Instant nextCheckAt
) {
    public static SourceInfo fromRecord(final CacheRecord record) {
        return new SourceInfo(
                record.getSourceId(),
                record.getSourceType().name().toLowerCase(),
                record.hasSummary(),
                record.getLastIndexedAt(),
                record.getSizeBytes(),
                record.getFetchStatus() == null ? null : record.getFetchStatus().name().toLowerCase(),
                record.getConsecutiveFailures(),
                record.getLastFetchedAt(),
                record.getNextCheckAt());
    }
}
