package de.mirkosertic.mcp.knowledgebase.mcp.dto;

import de.mirkosertic.mcp.knowledgebase.crawler.UpdateResult;

/**
 * Response DTO for the getKnowledgeBaseStatus tool.
 */
public record KnowledgeBaseStatusResponse(
        boolean success,
        String state,
        Integer queuedPasses,
        String version,
        String buildTimestamp,
        String sourcesDir,
        String linksFile,
        UpdateResult lastUpdate,
        String lastError,
        String error
) {
    public static KnowledgeBaseStatusResponse success(final String state, final int queuedPasses,
                                                      final String version,
                                                      final String buildTimestamp, final String sourcesDir,
                                                      final String linksFile, final UpdateResult lastUpdate,
                                                      final String lastError) {
        return new KnowledgeBaseStatusResponse(true, state, queuedPasses, version, buildTimestamp, sourcesDir, linksFile,
                lastUpdate, lastError, null);
    }

    public static KnowledgeBaseStatusResponse error(final String errorMessage) {
        return new KnowledgeBaseStatusResponse(false, null, null, null, null, null, null, null, null,
                errorMessage);
    }
}
