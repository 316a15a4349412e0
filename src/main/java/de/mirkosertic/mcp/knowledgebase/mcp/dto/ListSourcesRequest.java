package de.mirkosertic.mcp.knowledgebase.mcp.dto;

import de.mirkosertic.mcp.knowledgebase.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the listSources tool.
 */
public record ListSourcesRequest(
        @Nullable
        @Description("Only list sources of this type: 'file' or 'url'. Lists all sources when omitted.")
        String sourceType
) {
    public static ListSourcesRequest fromMap(final Map<String, Object> args) {
        return new ListSourcesRequest(args == null ? null : (String) args.get("sourceType"));
    }
}
