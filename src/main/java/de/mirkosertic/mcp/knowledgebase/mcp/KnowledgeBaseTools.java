package de.mirkosertic.mcp.knowledgebase.mcp;

import de.mirkosertic.mcp.knowledgebase.cache.CacheRecord;
import de.mirkosertic.mcp.knowledgebase.cache.CacheStore;
import de.mirkosertic.mcp.knowledgebase.cache.KnowledgeBaseCache;
import de.mirkosertic.mcp.knowledgebase.cache.SourceType;
import de.mirkosertic.mcp.knowledgebase.config.ApplicationConfig;
import de.mirkosertic.mcp.knowledgebase.config.BuildInfo;
import de.mirkosertic.mcp.knowledgebase.crawler.KnowledgeBaseService;
import de.mirkosertic.mcp.knowledgebase.crawler.UpdateScope;
import de.mirkosertic.mcp.knowledgebase.index.IndexEntry;
import de.mirkosertic.mcp.knowledgebase.index.IndexParser;
import de.mirkosertic.mcp.knowledgebase.mcp.dto.GetIndexResponse;
import de.mirkosertic.mcp.knowledgebase.mcp.dto.GetSourceContentRequest;
import de.mirkosertic.mcp.knowledgebase.mcp.dto.GetSourceContentResponse;
import de.mirkosertic.mcp.knowledgebase.mcp.dto.KnowledgeBaseStatusResponse;
import de.mirkosertic.mcp.knowledgebase.mcp.dto.ListSourcesRequest;
import de.mirkosertic.mcp.knowledgebase.mcp.dto.ListSourcesResponse;
import de.mirkosertic.mcp.knowledgebase.mcp.dto.ReindexRequest;
import de.mirkosertic.mcp.knowledgebase.mcp.dto.SourceInfo;
import de.mirkosertic.mcp.knowledgebase.mcp.dto.UpdateStartedResponse;
import de.mirkosertic.mcp.knowledgebase.source.KnowledgeBaseReader;
import de.mirkosertic.mcp.knowledgebase.source.SourceContent;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * MCP tools for the knowledge base. Read tools only look at the persisted index and
 * cache; update tools queue a pass and return immediately.
 */
public class KnowledgeBaseTools {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeBaseTools.class);

    private static final String GET_INDEX_DESCRIPTION = "Get the knowledge base index. " +
            "Each entry names a source (a file path relative to the sources directory, or a URL) " +
            "together with a short summary of its content. Use the summaries to decide which sources " +
            "are relevant, then call getSourceContent with the source identifier to read the full text.";

    private final ApplicationConfig config;
    private final KnowledgeBaseService knowledgeBaseService;
    private final KnowledgeBaseReader reader;
    private final CacheStore cacheStore;

    public KnowledgeBaseTools(final ApplicationConfig config,
                              final KnowledgeBaseService knowledgeBaseService,
                              final KnowledgeBaseReader reader,
                              final CacheStore cacheStore) {
        this.config = config;
        this.knowledgeBaseService = knowledgeBaseService;
        this.reader = reader;
        this.cacheStore = cacheStore;
    }

    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getIndex")
                        .description(GET_INDEX_DESCRIPTION)
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getIndex())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getSourceContent")
                        .description("Get the full text of one knowledge base source, identified exactly as listed in the index. " +
                                "URLs are fetched live, files are read from the sources directory.")
                        .inputSchema(SchemaGenerator.generateSchema(GetSourceContentRequest.class))
                        .build())
                .callHandler((exchange, request) -> getSourceContent(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("listSources")
                        .description("List all sources known to the knowledge base cache with their summary, fetch and backoff state.")
                        .inputSchema(SchemaGenerator.generateSchema(ListSourcesRequest.class))
                        .build())
                .callHandler((exchange, request) -> listSources(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("reindex")
                        .description("Synchronize the knowledge base with the sources directory and the link list. " +
                                "Only new or changed sources are summarized again. Runs in the background; " +
                                "use getKnowledgeBaseStatus to see the outcome.")
                        .inputSchema(SchemaGenerator.generateSchema(ReindexRequest.class))
                        .build())
                .callHandler((exchange, request) -> reindex(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("refreshUrls")
                        .description("Refresh the URLs that are due for a check, within the configured refresh budget. Runs in the background.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> refreshUrls())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getKnowledgeBaseStatus")
                        .description("Get the state of the knowledge base service and the outcome of the last update pass.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getKnowledgeBaseStatus())
                .build());

        return tools;
    }

    McpSchema.CallToolResult getIndex() {
        logger.info("Get index request");
        try {
            final String indexText = reader.loadIndexText();
            final List<IndexEntry> entries = IndexParser.parse(indexText);
            logger.debug("Index has {} entries", entries.size());
            return ToolResultHelper.createResult(GetIndexResponse.success(indexText, entries));
        } catch (final IOException e) {
            logger.error("Error reading the index", e);
            return ToolResultHelper.createResult(GetIndexResponse.error("Error reading the index: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getSourceContent(final Map<String, Object> args) {
        final GetSourceContentRequest request = GetSourceContentRequest.fromMap(args);
        logger.info("Get source content request: sourceId={}", request.sourceId());

        if (request.sourceId() == null || request.sourceId().isBlank()) {
            return ToolResultHelper.createResult(GetSourceContentResponse.error(request.sourceId(),
                    "Missing required parameter: sourceId"));
        }

        try {
            final SourceContent content = reader.loadSourceContent(request.sourceId());
            return ToolResultHelper.createResult(GetSourceContentResponse.success(content.sourceId(), content.text()));
        } catch (final NoSuchFileException e) {
            logger.warn("Source not found: {}", request.sourceId());
            return ToolResultHelper.createResult(GetSourceContentResponse.error(request.sourceId(),
                    "Source not found: " + request.sourceId()));
        } catch (final CharacterCodingException e) {
            return ToolResultHelper.createResult(GetSourceContentResponse.error(request.sourceId(),
                    "Source is not valid UTF-8 text: " + request.sourceId()));
        } catch (final IllegalArgumentException e) {
            return ToolResultHelper.createResult(GetSourceContentResponse.error(request.sourceId(), e.getMessage()));
        } catch (final IOException e) {
            logger.error("Error loading source {}", request.sourceId(), e);
            return ToolResultHelper.createResult(GetSourceContentResponse.error(request.sourceId(),
                    "Error loading source: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult listSources(final Map<String, Object> args) {
        final ListSourcesRequest request = ListSourcesRequest.fromMap(args);
        logger.info("List sources request: sourceType={}", request.sourceType());

        final List<SourceType> types;
        if (request.sourceType() == null || request.sourceType().isBlank()) {
            types = List.of(SourceType.FILE, SourceType.URL);
        } else {
            try {
                types = List.of(SourceType.valueOf(request.sourceType().strip().toUpperCase(Locale.ROOT)));
            } catch (final IllegalArgumentException e) {
                return ToolResultHelper.createResult(ListSourcesResponse.error(
                        "Invalid sourceType '" + request.sourceType() + "', expected 'file' or 'url'"));
            }
        }

        try {
            final KnowledgeBaseCache cache = cacheStore.load();
            final List<SourceInfo> sources = new ArrayList<>();
            for (final SourceType type : types) {
                for (final CacheRecord record : cache.records(type)) {
                    sources.add(SourceInfo.fromRecord(record));
                }
            }
            return ToolResultHelper.createResult(ListSourcesResponse.success(sources));
        } catch (final RuntimeException e) {
            logger.error("Error listing sources", e);
            return ToolResultHelper.createResult(ListSourcesResponse.error("Error listing sources: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult reindex(final Map<String, Object> args) {
        final ReindexRequest request = ReindexRequest.fromMap(args);
        logger.info("Reindex request: refreshUrls={}", request.refreshUrls());
        return queue(UpdateScope.full(request.effectiveRefreshUrls()));
    }

    McpSchema.CallToolResult refreshUrls() {
        logger.info("Refresh URLs request");
        return queue(UpdateScope.refreshTick());
    }

    private McpSchema.CallToolResult queue(final UpdateScope scope) {
        try {
            knowledgeBaseService.submit(scope);
            return ToolResultHelper.createResult(UpdateStartedResponse.success(scope.toString()));
        } catch (final RuntimeException e) {
            logger.error("Error queueing update pass {}", scope, e);
            return ToolResultHelper.createResult(UpdateStartedResponse.error("Error queueing update pass: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getKnowledgeBaseStatus() {
        logger.info("Knowledge base status request");
        try {
            return ToolResultHelper.createResult(KnowledgeBaseStatusResponse.success(
                    knowledgeBaseService.getState().name(),
                    knowledgeBaseService.getQueuedPasses(),
                    BuildInfo.getVersion(),
                    BuildInfo.getBuildTimestamp(),
                    config.getSourcesDir(),
                    config.getLinksFile(),
                    knowledgeBaseService.getLastResult(),
                    knowledgeBaseService.getLastError()));
        } catch (final RuntimeException e) {
            logger.error("Error getting knowledge base status", e);
            return ToolResultHelper.createResult(KnowledgeBaseStatusResponse.error(
                    "Error getting knowledge base status: " + e.getMessage()));
        }
    }
}
