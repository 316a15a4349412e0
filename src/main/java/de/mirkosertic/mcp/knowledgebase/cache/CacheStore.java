package de.mirkosertic.mcp.knowledgebase.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

/**
 * Loads and persists the knowledge base cache document and the rendered index text.
 * Both artifacts are replaced atomically via {@link AtomicFileWriter}.
 */
public class CacheStore {

    private static final Logger logger = LoggerFactory.getLogger(CacheStore.class);

    private final Path cachePath;
    private final Path indexPath;
    private final AtomicFileWriter writer;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public CacheStore(final Path cachePath, final Path indexPath, final AtomicFileWriter writer, final Clock clock) {
        this.cachePath = cachePath;
        this.indexPath = indexPath;
        this.writer = writer;
        this.clock = clock;
        this.objectMapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        final ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    /**
     * Load the cache. A missing, unreadable, corrupt or schema-incompatible cache file
     * yields an empty cache, which makes the next pass rebuild every summary.
     */
    public KnowledgeBaseCache load() {
        if (!Files.exists(cachePath)) {
            logger.info("No cache at {}, starting with an empty knowledge base", cachePath);
            return KnowledgeBaseCache.empty();
        }

        final KnowledgeBaseCache cache;
        try {
            cache = objectMapper.readValue(Files.readAllBytes(cachePath), KnowledgeBaseCache.class);
        } catch (final IOException e) {
            logger.warn("Cache at {} is unreadable or corrupt, rebuilding from scratch: {}", cachePath, e.getMessage());
            return KnowledgeBaseCache.empty();
        }

        if (cache == null) {
            logger.warn("Cache at {} is empty, rebuilding from scratch", cachePath);
            return KnowledgeBaseCache.empty();
        }
        if (cache.getSchemaVersion() != KnowledgeBaseCache.CURRENT_SCHEMA_VERSION) {
            logger.warn("Cache at {} has schema version {} but {} is required, rebuilding from scratch",
                    cachePath, cache.getSchemaVersion(), KnowledgeBaseCache.CURRENT_SCHEMA_VERSION);
            return KnowledgeBaseCache.empty();
        }

        final String invalidRecord = findInvalidRecord(cache);
        if (invalidRecord != null) {
            logger.warn("Cache at {} contains an invalid record for '{}', rebuilding from scratch",
                    cachePath, invalidRecord);
            return KnowledgeBaseCache.empty();
        }

        logger.debug("Loaded cache with {} sources from {}", cache.getSources().size(), cachePath);
        return cache;
    }

    /**
     * Every record must be present, typed and stored under its own source id. Anything
     * else cannot be diffed against the sources reliably.
     *
     * @return the key of the first invalid record, or null if all records are valid
     */
    static @Nullable String findInvalidRecord(final KnowledgeBaseCache cache) {
        for (final Map.Entry<String, CacheRecord> entry : cache.getSources().entrySet()) {
            final CacheRecord record = entry.getValue();
            if (record == null
                    || record.getSourceType() == null
                    || !entry.getKey().equals(record.getSourceId())) {
                return entry.getKey();
            }
        }
        return null;
    }

    public void persist(final KnowledgeBaseCache cache) throws IOException {
        cache.setSchemaVersion(KnowledgeBaseCache.CURRENT_SCHEMA_VERSION);
        cache.setGeneratedAt(clock.instant());
        writer.write(cachePath, toJson(cache));
        logger.debug("Persisted cache with {} sources to {}", cache.getSources().size(), cachePath);
    }

    public void persistIndex(final String indexText) throws IOException {
        writer.writeString(indexPath, indexText);
        logger.debug("Persisted index ({} chars) to {}", indexText.length(), indexPath);
    }

    public boolean indexExists() {
        return Files.isRegularFile(indexPath);
    }

    byte[] toJson(final KnowledgeBaseCache cache) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(cache);
    }

    public Path getCachePath() {
        return cachePath;
    }

    public Path getIndexPath() {
        return indexPath;
    }
}
