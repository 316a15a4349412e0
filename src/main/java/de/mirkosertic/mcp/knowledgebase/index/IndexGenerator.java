package de.mirkosertic.mcp.knowledgebase.index;

import de.mirkosertic.mcp.knowledgebase.cache.CacheRecord;
import de.mirkosertic.mcp.knowledgebase.cache.KnowledgeBaseCache;
import de.mirkosertic.mcp.knowledgebase.cache.SourceType;
import de.mirkosertic.mcp.knowledgebase.util.ContentNormalizer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders the index text from the cache. The output depends on the cache contents only:
 * file sources first, then URL sources, each group in ascending identifier order. Sources
 * without a summary yet are left out.
 */
public final class IndexGenerator {

    private IndexGenerator() {
    }

    public static List<IndexEntry> entries(final KnowledgeBaseCache cache) {
        final List<IndexEntry> entries = new ArrayList<>();
        for (final SourceType type : List.of(SourceType.FILE, SourceType.URL)) {
            cache.records(type).stream()
                    .filter(CacheRecord::hasSummary)
                    .sorted(Comparator.comparing(CacheRecord::getSourceId))
                    .map(record -> new IndexEntry(record.getSourceId(), compactSummary(record.getSummaryText())))
                    .forEach(entries::add);
        }
        return entries;
    }

    public static String render(final KnowledgeBaseCache cache) {
        final List<IndexEntry> entries = entries(cache);
        if (entries.isEmpty()) {
            return "";
        }
        return entries.stream()
                .map(entry -> entry.sourceId() + "\n" + entry.description())
                .collect(Collectors.joining("\n\n", "", "\n"));
    }

    /**
     * Blank lines separate index blocks, so they are removed from the summary itself.
     */
    static String compactSummary(final String summary) {
        return ContentNormalizer.normalize(summary).lines()
                .filter(line -> !line.isBlank())
                .collect(Collectors.joining("\n"));
    }
}
