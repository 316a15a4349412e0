package de.mirkosertic.mcp.knowledgebase.mcp.dto;

import de.mirkosertic.mcp.knowledgebase.mcp.Description;

import java.util.Map;

/**
 * Request DTO for the getSourceContent tool.
 */
public record GetSourceContentRequest(
        @Description("Source identifier as listed in the index: a URL or a file path relative to the sources directory")
        String sourceId
) {
    public static GetSourceContentRequest fromMap(final Map<String, Object> args) {
        return new GetSourceContentRequest(args == null ? null : (String) args.get("sourceId"));
    }
}
