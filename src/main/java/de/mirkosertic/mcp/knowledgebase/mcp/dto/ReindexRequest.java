package de.mirkosertic.mcp.knowledgebase.mcp.dto;

import de.mirkosertic.mcp.knowledgebase.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the reindex tool.
 */
public record ReindexRequest(
        @Nullable
        @Description("If false, only local files and the link list are synchronized and no URL is fetched. Default is true.")
        Boolean refreshUrls
) {
    public static ReindexRequest fromMap(final Map<String, Object> args) {
        return new ReindexRequest(args == null ? null : (Boolean) args.get("refreshUrls"));
    }

    public boolean effectiveRefreshUrls() {
        return refreshUrls == null || refreshUrls;
    }
}
