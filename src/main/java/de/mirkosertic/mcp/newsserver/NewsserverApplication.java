package de.mirkosertic.mcp.newsserver;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.newsserver.config.ApplicationConfig;
import de.mirkosertic.mcp.newsserver.config.BuildInfo;
import de.mirkosertic.mcp.newsserver.config.LoggingConfigurator;
import de.mirkosertic.mcp.newsserver.config.StartupConfigException;
import de.mirkosertic.mcp.newsserver.mcp.LatestProtocolStdioServerTransportProvider;
import de.mirkosertic.mcp.newsserver.news.ArticleFactory;
import de.mirkosertic.mcp.newsserver.news.ContentExtractionService;
import de.mirkosertic.mcp.newsserver.news.DeduplicationGate;
import de.mirkosertic.mcp.newsserver.news.NewsIngestionScheduler;
import de.mirkosertic.mcp.newsserver.news.RetrievalResolver;
import de.mirkosertic.mcp.newsserver.provider.TavilyClient;
import de.mirkosertic.mcp.newsserver.store.ArticleStore;
import de.mirkosertic.mcp.newsserver.store.InMemoryArticleStore;
import de.mirkosertic.mcp.newsserver.store.RedisArticleStore;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Main entry point for the MCP News Server.
 * Wires the article store, the search provider and the news fetcher, then serves the tools over STDIO.
 */
public class NewsserverApplication {

    private static final Logger logger = LoggerFactory.getLogger(NewsserverApplication.class);

    private final ApplicationConfig config;
    private final ArticleStore store;
    private final NewsIngestionScheduler scheduler;
    private final NewsTools newsTools;
    private McpSyncServer mcpServer;

    public NewsserverApplication(final ApplicationConfig config) {
        this(config, createStore(config));
    }

    NewsserverApplication(final ApplicationConfig config, final ArticleStore store) {
        this.config = config;
        this.store = store;

        final TavilyClient tavilyClient = new TavilyClient(
                config.getTavilyApiKey(),
                config.getTavilyBaseUrl(),
                Duration.ofMillis(config.getTavilyTimeoutMs()));

        final Clock clock = Clock.systemUTC();
        final ArticleFactory articleFactory = new ArticleFactory(clock);
        final DeduplicationGate deduplicationGate = new DeduplicationGate(store);

        this.scheduler = new NewsIngestionScheduler(
                config,
                store,
                deduplicationGate,
                tavilyClient,
                articleFactory,
                clock
        );

        final RetrievalResolver resolver = new RetrievalResolver(
                config,
                store,
                deduplicationGate,
                tavilyClient,
                articleFactory
        );

        this.newsTools = new NewsTools(
                resolver,
                new ContentExtractionService(tavilyClient),
                store,
                scheduler
        );
    }

    static ArticleStore createStore(final ApplicationConfig config) {
        if (ApplicationConfig.BACKEND_MEMORY.equals(config.getStoreBackend())) {
            return new InMemoryArticleStore(config.getCacheTtl(), config.getMaxIndexSize());
        }
        return RedisArticleStore.connect(
                config.getRedisHost(),
                config.getRedisPort(),
                config.getKeyPrefix(),
                config.getCacheTtl(),
                config.getMaxIndexSize());
    }

    /**
     * Start the MCP server and the news fetcher.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .build();

        final McpSchema.Implementation serverInfo = new McpSchema.Implementation(
                "MCP News Server",
                BuildInfo.getVersion()
        );

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());

        final LatestProtocolStdioServerTransportProvider transportProvider =
                new LatestProtocolStdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo(serverInfo)
                .capabilities(capabilities)
                .tools(newsTools.getToolSpecifications())
                .build();

        logger.info("MCP server started successfully");

        scheduler.start();

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // Block main thread - the STDIO transport handles communication
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
        logger.info("Shutting down MCP News Server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            scheduler.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down news fetcher", e);
        }

        try {
            store.close();
        } catch (final Exception e) {
            logger.error("Error closing article store", e);
        }

        logger.info("MCP News Server shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Configure logging FIRST, before any other code that might log
            final boolean deployedMode = "deployed".equals(System.getProperty("spring.profiles.active"));
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Store backend: {}, TTL: {} days", config.getStoreBackend(), config.getTtlDays());
                logger.info("Configured queries: {}", config.getQueries().size());
            }

            final NewsserverApplication app = new NewsserverApplication(config);
            app.start();

            logger.info("MCP News Server finished.");

        } catch (final StartupConfigException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(1);
        } catch (final Exception e) {
            // In deployed mode, we can't log to console, so write to stderr
            System.err.println("Failed to start MCP News Server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
