package de.mirkosertic.mcp.knowledgebase.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Cached state of one knowledge base source. File sources carry their size and
 * modification time fingerprint, URL sources carry the HTTP validators and the
 * refresh schedule. Records are mutated in place by the update pass that owns the cache.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CacheRecord {

    private String sourceId;
    private SourceType sourceType;
    private @Nullable String contentHash;
    private @Nullable String summaryText;
    private @Nullable Instant lastIndexedAt;

    // File sources
    private @Nullable String relPath;
    private @Nullable Long sizeBytes;
    private @Nullable Long mtimeNs;

    // URL sources
    private @Nullable Instant lastFetchedAt;
    private @Nullable String etag;
    private @Nullable String lastModified;
    private @Nullable FetchStatus fetchStatus;
    private @Nullable Integer consecutiveFailures;
    private @Nullable Instant nextCheckAt;

    // Required by Jackson
    public CacheRecord() {
    }

    public static CacheRecord forFile(final String relPath) {
        final CacheRecord record = new CacheRecord();
        record.sourceId = relPath;
        record.sourceType = SourceType.FILE;
        record.relPath = relPath;
        return record;
    }

    /**
     * A freshly listed URL: never fetched, due immediately.
     */
    public static CacheRecord forUrl(final String url, final Instant now) {
        final CacheRecord record = new CacheRecord();
        record.sourceId = url;
        record.sourceType = SourceType.URL;
        record.consecutiveFailures = 0;
        record.nextCheckAt = now;
        return record;
    }

    @JsonIgnore
    public boolean hasSummary() {
        return summaryText != null && !summaryText.isBlank();
    }

    @JsonIgnore
    public int getFailureCount() {
        return consecutiveFailures == null ? 0 : consecutiveFailures;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(final String sourceId) {
        this.sourceId = sourceId;
    }

    public SourceType getSourceType() {
        return sourceType;
    }

    public void setSourceType(final SourceType sourceType) {
        this.sourceType = sourceType;
    }

    public @Nullable String getContentHash() {
        return contentHash;
    }

    public void setContentHash(final @Nullable String contentHash) {
        this.contentHash = contentHash;
    }

    public @Nullable String getSummaryText() {
        return summaryText;
    }

    public void setSummaryText(final @Nullable String summaryText) {
        this.summaryText = summaryText;
    }

    public @Nullable Instant getLastIndexedAt() {
        return lastIndexedAt;
    }

    public void setLastIndexedAt(final @Nullable Instant lastIndexedAt) {
        this.lastIndexedAt = lastIndexedAt;
    }

    public @Nullable String getRelPath() {
        return relPath;
    }

    public void setRelPath(final @Nullable String relPath) {
        this.relPath = relPath;
    }

    public @Nullable Long getSizeBytes() {
        return sizeBytes;
    }

    public void setSizeBytes(final @Nullable Long sizeBytes) {
        this.sizeBytes = sizeBytes;
    }

    public @Nullable Long getMtimeNs() {
        return mtimeNs;
    }

    public void setMtimeNs(final @Nullable Long mtimeNs) {
        this.mtimeNs = mtimeNs;
    }

    public @Nullable Instant getLastFetchedAt() {
        return lastFetchedAt;
    }

    public void setLastFetchedAt(final @Nullable Instant lastFetchedAt) {
        this.lastFetchedAt = lastFetchedAt;
    }

    public @Nullable String getEtag() {
        return etag;
    }

    public void setEtag(final @Nullable String etag) {
        this.etag = etag;
    }

    public @Nullable String getLastModified() {
        return lastModified;
    }

    public void setLastModified(final @Nullable String lastModified) {
        this.lastModified = lastModified;
    }

    public @Nullable FetchStatus getFetchStatus() {
        return fetchStatus;
    }

    public void setFetchStatus(final @Nullable FetchStatus fetchStatus) {
        this.fetchStatus = fetchStatus;
    }

    public @Nullable Integer getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public void setConsecutiveFailures(final @Nullable Integer consecutiveFailures) {
        this.consecutiveFailures = consecutiveFailures;
    }

    public @Nullable Instant getNextCheckAt() {
        return nextCheckAt;
    }

    public void setNextCheckAt(final @Nullable Instant nextCheckAt) {
        this.nextCheckAt = nextCheckAt;
    }
}
