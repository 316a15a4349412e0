package de.mirkosertic.mcp.knowledgebase.mcp.dto;

/**
 * Response DTO for tools that queue an update pass.
 */
public record UpdateStartedResponse(
        boolean success,
        String message,
        String scope,
        String error
) {
    public static UpdateStartedResponse success(final String scope) {
        return new UpdateStartedResponse(true, "Update pass queued", scope, null);
    }

    public static UpdateStartedResponse error(final String errorMessage) {
        return new UpdateStartedResponse(false, null, null, errorMessage);
    }
}
