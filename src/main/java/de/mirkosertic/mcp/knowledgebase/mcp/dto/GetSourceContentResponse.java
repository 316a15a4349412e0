package de.mirkosertic.mcp.knowledgebase.mcp.dto;

public record GetSourceContentResponse(
        boolean success,
        String sourceId,
        String text,
        String error
) {
    public static GetSourceContentResponse success(final String sourceId, final String text) {
        return new GetSourceContentResponse(true, sourceId, text, null);
    }

    public static GetSourceContentResponse error(final String sourceId, final String errorMessage) {
        return new GetSourceContentResponse(false, sourceId, null, errorMessage);
    }
}
