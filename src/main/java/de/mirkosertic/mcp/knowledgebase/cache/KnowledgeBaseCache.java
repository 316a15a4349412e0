package de.mirkosertic.mcp.knowledgebase.cache;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Root of the persisted cache document. Sources are kept in a sorted map so the
 * serialized JSON is stable between runs.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class KnowledgeBaseCache {

    public static final int CURRENT_SCHEMA_VERSION = 1;

    private int schemaVersion = CURRENT_SCHEMA_VERSION;
    private @Nullable Instant generatedAt;
    private SortedMap<String, CacheRecord> sources = new TreeMap<>();

    public static KnowledgeBaseCache empty() {
        return new KnowledgeBaseCache();
    }

    public @Nullable CacheRecord get(final String sourceId) {
        return sources.get(sourceId);
    }

    public void put(final CacheRecord record) {
        sources.put(record.getSourceId(), record);
    }

    public @Nullable CacheRecord remove(final String sourceId) {
        return sources.remove(sourceId);
    }

    @JsonIgnore
    public List<CacheRecord> records(final SourceType type) {
        return sources.values().stream()
                .filter(r -> r.getSourceType() == type)
                .toList();
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(final int schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public @Nullable Instant getGeneratedAt() {
        return generatedAt;
    }

    public void setGeneratedAt(final @Nullable Instant generatedAt) {
        this.generatedAt = generatedAt;
    }

    public SortedMap<String, CacheRecord> getSources() {
        return sources;
    }

    public void setSources(final SortedMap<String, CacheRecord> sources) {
        this.sources = sources == null ? new TreeMap<>() : new TreeMap<>(sources);
    }
}
