package de.mirkosertic.mcp.knowledgebase.mcp.dto;

import java.util.List;

public record ListSourcesResponse(
        boolean success,
        List<SourceInfo> sources,
        int total,
        String error
) {
    public static ListSourcesResponse success(final List<SourceInfo> sources) {
        return new ListSourcesResponse(true, sources, sources.size(), null);
    }

    public static ListSourcesResponse error(final String errorMessage) {
        return new ListSourcesResponse(false, null, 0, errorMessage);
    }
}
