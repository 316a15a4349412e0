package de.mirkosertic.mcp.knowledgebase;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.knowledgebase.cache.AtomicFileWriter;
import de.mirkosertic.mcp.knowledgebase.cache.CacheStore;
import de.mirkosertic.mcp.knowledgebase.cache.UpdateLock;
import de.mirkosertic.mcp.knowledgebase.config.ApplicationConfig;
import de.mirkosertic.mcp.knowledgebase.config.BuildInfo;
import de.mirkosertic.mcp.knowledgebase.config.LoggingConfigurator;
import de.mirkosertic.mcp.knowledgebase.crawler.ChangeDetector;
import de.mirkosertic.mcp.knowledgebase.crawler.DirectoryWatcherService;
import de.mirkosertic.mcp.knowledgebase.crawler.FilePatternMatcher;
import de.mirkosertic.mcp.knowledgebase.crawler.KnowledgeBaseService;
import de.mirkosertic.mcp.knowledgebase.crawler.SourceEnumerator;
import de.mirkosertic.mcp.knowledgebase.crawler.UpdateExecutorService;
import de.mirkosertic.mcp.knowledgebase.crawler.UpdateOrchestrator;
import de.mirkosertic.mcp.knowledgebase.crawler.UrlRefreshScheduler;
import de.mirkosertic.mcp.knowledgebase.mcp.KnowledgeBaseTools;
import de.mirkosertic.mcp.knowledgebase.source.ContentFetcher;
import de.mirkosertic.mcp.knowledgebase.source.ExternalCallExecutor;
import de.mirkosertic.mcp.knowledgebase.source.ExtractiveSummarizer;
import de.mirkosertic.mcp.knowledgebase.source.JsoupContentFetcher;
import de.mirkosertic.mcp.knowledgebase.source.KnowledgeBaseReader;
import de.mirkosertic.mcp.knowledgebase.source.LanguageModelSummarizer;
import de.mirkosertic.mcp.knowledgebase.source.Summarizer;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Main entry point for the MCP knowledge base server.
 * Wires all services, runs the startup sync and serves the tools over STDIO.
 */
public class KnowledgeBaseApplication {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeBaseApplication.class);

    private final ExternalCallExecutor callExecutor;
    private final DirectoryWatcherService watcherService;
    private final KnowledgeBaseService knowledgeBaseService;
    private final KnowledgeBaseTools tools;
    private McpSyncServer mcpServer;

    public KnowledgeBaseApplication(final ApplicationConfig config) {
        final Clock clock = Clock.systemUTC();
        final Path sourcesDir = Path.of(config.getSourcesDir());
        final Path cachePath = Path.of(config.getCachePath());
        final Path indexPath = Path.of(config.getIndexPath());

        final CacheStore cacheStore = new CacheStore(cachePath, indexPath, new AtomicFileWriter(), clock);
        final UpdateLock updateLock = new UpdateLock(cachePath, config.getLockTimeoutMs());

        final FilePatternMatcher matcher = new FilePatternMatcher(config.getIncludePatterns(), config.getExcludePatterns());
        final SourceEnumerator enumerator = new SourceEnumerator(sourcesDir, Path.of(config.getLinksFile()), matcher);

        this.callExecutor = new ExternalCallExecutor();
        final ContentFetcher fetcher = new JsoupContentFetcher(config.getUserAgent(), config.getFetchTimeoutMs(),
                config.getMaxSourceBytes());
        final Summarizer summarizer = createSummarizer(config);

        final UrlRefreshScheduler urlScheduler = new UrlRefreshScheduler(
                clock,
                fetcher,
                summarizer,
                callExecutor,
                Duration.ofMillis(config.getUrlMinRefreshIntervalMs()),
                Duration.ofMillis(config.getUrlMaxAgeMs()),
                Duration.ofMillis(config.getUrlBackoffBaseMs()),
                Duration.ofMillis(config.getUrlBackoffCapMs()),
                config.getFetchTimeoutMs(),
                config.getSummarizeTimeoutMs()
        );

        final UpdateOrchestrator orchestrator = new UpdateOrchestrator(
                config,
                cacheStore,
                updateLock,
                enumerator,
                new ChangeDetector(config.getMaxSourceBytes()),
                urlScheduler,
                summarizer,
                callExecutor,
                clock
        );

        this.watcherService = new DirectoryWatcherService(config.getWatchPollIntervalMs());

        this.knowledgeBaseService = new KnowledgeBaseService(
                config,
                orchestrator,
                new UpdateExecutorService(config.getUpdateThreads()),
                enumerator,
                watcherService
        );

        final KnowledgeBaseReader reader = new KnowledgeBaseReader(sourcesDir, indexPath, fetcher);
        this.tools = new KnowledgeBaseTools(config, knowledgeBaseService, reader, cacheStore);
    }

    static Summarizer createSummarizer(final ApplicationConfig config) {
        final String provider = config.getSummarizerProvider().toLowerCase(Locale.ROOT);
        return switch (provider) {
            case "extractive" -> new ExtractiveSummarizer(config.getSummaryMaxChars());
            case "openai" -> {
                logger.info("Summarizing with model {} at {}", config.getLlmModel(),
                        config.getLlmBaseUrl().isBlank() ? "the OpenAI API" : config.getLlmBaseUrl());
                yield new LanguageModelSummarizer(
                        LanguageModelSummarizer.openAiChatModel(config.getLlmBaseUrl(), config.getLlmApiKey(),
                                config.getLlmModel(), Duration.ofMillis(config.getSummarizeTimeoutMs())),
                        config.getSummarizationPrompt());
            }
            default -> throw new IllegalArgumentException("Unsupported summarizer provider: " + provider);
        };
    }

    /**
     * Initialize all services.
     */
    public void init() {
        logger.info("Initializing MCP knowledge base server...");
        knowledgeBaseService.init();
        logger.info("All services initialized successfully");
    }

    /**
     * Start the MCP server and block until the process is asked to stop.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                BuildInfo.getServerName(),
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());
        final StdioServerTransportProvider transportProvider = new StdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(tools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully ({})", BuildInfo.describe());

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // The STDIO transport runs on its own threads
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }

        logger.info("Main thread finished, shutting down...");
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down MCP knowledge base server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            knowledgeBaseService.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down knowledge base service", e);
        }

        try {
            watcherService.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down watcher service", e);
        }

        try {
            callExecutor.close();
        } catch (final Exception e) {
            logger.error("Error shutting down external call executor", e);
        }

        logger.info("MCP knowledge base server shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Until the deployed setup is applied everything logs to stderr
            final ApplicationConfig config = ApplicationConfig.load();

            if (!LoggingConfigurator.configure(config)) {
                logger.info("Logging to the console");
                logger.info("Sources directory: {}", config.getSourcesDir());
                logger.info("Link list: {}", config.getLinksFile());
                logger.info("Cache: {}, index: {}", config.getCachePath(), config.getIndexPath());
            }

            final KnowledgeBaseApplication app = new KnowledgeBaseApplication(config);
            app.init();
            app.start();

            logger.info("MCP knowledge base server finished.");

        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to start MCP knowledge base server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
