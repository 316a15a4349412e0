package de.mirkosertic.mcp.knowledgebase.mcp.dto;

import de.mirkosertic.mcp.knowledgebase.index.IndexEntry;

import java.util.List;

public record GetIndexResponse(
        boolean success,
        String indexText,
        List<IndexEntry> entries,
        int entryCount,
        String error
) {
    public static GetIndexResponse success(final String indexText, final List<IndexEntry> entries) {
        return new GetIndexResponse(true, indexText, entries, entries.size(), null);
    }

    public static GetIndexResponse error(final String errorMessage) {
        return new GetIndexResponse(false, null, null, 0, errorMessage);
    }
}
