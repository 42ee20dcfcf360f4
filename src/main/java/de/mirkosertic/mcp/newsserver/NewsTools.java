package de.mirkosertic.mcp.newsserver;

import de.mirkosertic.mcp.newsserver.mcp.SchemaGenerator;
import de.mirkosertic.mcp.newsserver.mcp.ToolResultHelper;
import de.mirkosertic.mcp.newsserver.mcp.dto.FetchStatusResponse;
import de.mirkosertic.mcp.newsserver.mcp.dto.GetFullContentRequest;
import de.mirkosertic.mcp.newsserver.mcp.dto.GetFullContentResponse;
import de.mirkosertic.mcp.newsserver.mcp.dto.GetLatestNewsRequest;
import de.mirkosertic.mcp.newsserver.mcp.dto.GetLatestNewsResponse;
import de.mirkosertic.mcp.newsserver.mcp.dto.NewsItem;
import de.mirkosertic.mcp.newsserver.mcp.dto.SearchNewsRequest;
import de.mirkosertic.mcp.newsserver.mcp.dto.SearchNewsResponse;
import de.mirkosertic.mcp.newsserver.mcp.dto.TriggerFetchResponse;
import de.mirkosertic.mcp.newsserver.news.ContentExtractionService;
import de.mirkosertic.mcp.newsserver.news.ExtractedContent;
import de.mirkosertic.mcp.newsserver.news.FetchSummary;
import de.mirkosertic.mcp.newsserver.news.NewsIngestionScheduler;
import de.mirkosertic.mcp.newsserver.news.ResolvedResults;
import de.mirkosertic.mcp.newsserver.news.RetrievalResolver;
import de.mirkosertic.mcp.newsserver.news.ValidationException;
import de.mirkosertic.mcp.newsserver.provider.ProviderException;
import de.mirkosertic.mcp.newsserver.store.Article;
import de.mirkosertic.mcp.newsserver.store.ArticleStore;
import de.mirkosertic.mcp.newsserver.store.StoreException;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MCP tools for cached news search, content extraction and fetch control.
 */
public class NewsTools {

    private static final Logger logger = LoggerFactory.getLogger(NewsTools.class);

    private static final String SEARCH_DESCRIPTION = """
            Search DeFi and crypto news from the targeted news websites. \
            The local news cache is searched first (case-insensitive substring match on title, content and summary). \
            If the cache holds fewer than maxResults matches, a live web search restricted to the targeted websites is performed \
            and new articles are added to the cache. \
            Returns: origin ('cache' or 'live'), and results with title, url, summary content, publishedDate and source host.""";

    private final RetrievalResolver resolver;
    private final ContentExtractionService extractionService;
    private final ArticleStore store;
    private final NewsIngestionScheduler scheduler;

    public NewsTools(final RetrievalResolver resolver,
                     final ContentExtractionService extractionService,
                     final ArticleStore store,
                     final NewsIngestionScheduler scheduler) {
        this.resolver = resolver;
        this.extractionService = extractionService;
        this.store = store;
        this.scheduler = scheduler;
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("searchNews")
                        .description(SEARCH_DESCRIPTION)
                        .inputSchema(SchemaGenerator.generateSchema(SearchNewsRequest.class))
                        .build())
                .callHandler((exchange, request) -> searchNews(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getFullContent")
                        .description("Get the full content of a web page from a URL. The content is fetched live and is not cached.")
                        .inputSchema(SchemaGenerator.generateSchema(GetFullContentRequest.class))
                        .build())
                .callHandler((exchange, request) -> getFullContent(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getLatestNews")
                        .description("Get the latest DeFi news from the cache, newest first.")
                        .inputSchema(SchemaGenerator.generateSchema(GetLatestNewsRequest.class))
                        .build())
                .callHandler((exchange, request) -> getLatestNews(request.arguments()))
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("triggerFetch")
                        .description("Run a news fetch across all configured topic queries now and wait for it to finish. " +
                                "Returns immediately without effect if a fetch is already running.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> triggerFetch())
                .build());

        tools.add(McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name("getFetchStatus")
                        .description("Get the state of the news fetcher (IDLE or RUNNING), the time of the last fetch and the number of indexed articles.")
                        .inputSchema(SchemaGenerator.emptySchema())
                        .build())
                .callHandler((exchange, request) -> getFetchStatus())
                .build());

        return tools;
    }

    // Tool implementation methods
    McpSchema.CallToolResult searchNews(final Map<String, Object> args) {
        try {
            final SearchNewsRequest request = SearchNewsRequest.fromMap(args);

            logger.info("Search request: query='{}', maxResults={}, searchDepth={}",
                    request.query(), request.effectiveMaxResults(), request.effectiveSearchDepth());

            final ResolvedResults resolved = resolver.resolve(
                    request.query(),
                    request.effectiveMaxResults(),
                    request.effectiveSearchDepth());

            final List<NewsItem> items = resolved.articles().stream().map(NewsItem::from).toList();

            logger.info("Search completed: origin={}, {} results", resolved.origin().label(), items.size());

            return ToolResultHelper.createResult(SearchNewsResponse.success(resolved.origin().label(), resolved.query(), items));

        } catch (final ValidationException e) {
            logger.warn("Invalid search request: {}", e.getMessage());
            return ToolResultHelper.createResult(SearchNewsResponse.error(e.getMessage()));
        } catch (final ProviderException | StoreException e) {
            logger.error("Search error", e);
            return ToolResultHelper.createResult(SearchNewsResponse.error("Search failed: " + e.getMessage()));
        } catch (final RuntimeException e) {
            logger.error("Unexpected search error", e);
            return ToolResultHelper.createResult(SearchNewsResponse.error("Search failed: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getFullContent(final Map<String, Object> args) {
        final GetFullContentRequest request = GetFullContentRequest.fromMap(args);

        logger.info("Get full content request: url='{}'", request.url());

        try {
            final ExtractedContent content = extractionService.extract(request.url());
            return ToolResultHelper.createResult(GetFullContentResponse.success(
                    content.url(), content.title(), content.content(), content.publishedDate()));

        } catch (final ValidationException e) {
            logger.warn("Invalid get full content request: {}", e.getMessage());
            return ToolResultHelper.createResult(GetFullContentResponse.error(e.getMessage()));
        } catch (final ProviderException e) {
            logger.error("Content extraction error", e);
            return ToolResultHelper.createResult(GetFullContentResponse.error("Content extraction failed: " + e.getMessage()));
        } catch (final RuntimeException e) {
            logger.error("Unexpected content extraction error", e);
            return ToolResultHelper.createResult(GetFullContentResponse.error("Content extraction failed: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getLatestNews(final Map<String, Object> args) {
        final GetLatestNewsRequest request = GetLatestNewsRequest.fromMap(args);

        logger.info("Get latest news request: limit={}", request.effectiveLimit());

        try {
            final List<Article> articles = store.list(request.effectiveLimit(), 0);
            return ToolResultHelper.createResult(GetLatestNewsResponse.success(
                    articles.stream().map(NewsItem::from).toList()));

        } catch (final StoreException | RuntimeException e) {
            logger.error("Error getting latest news", e);
            return ToolResultHelper.createResult(GetLatestNewsResponse.error("Failed to get latest news: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult triggerFetch() {
        logger.info("Trigger fetch request");

        try {
            final FetchSummary summary = scheduler.fetchLatestNews();
            return ToolResultHelper.createResult(TriggerFetchResponse.success(summary));

        } catch (final StoreException | RuntimeException e) {
            logger.error("Error running news fetch", e);
            return ToolResultHelper.createResult(TriggerFetchResponse.error("News fetch failed: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getFetchStatus() {
        logger.info("Fetch status request");

        try {
            final long lastFetchTime = store.lastFetchTime();
            return ToolResultHelper.createResult(FetchStatusResponse.success(
                    scheduler.getState().name(),
                    lastFetchTime,
                    lastFetchTime > 0 ? Instant.ofEpochSecond(lastFetchTime).toString() : null,
                    store.size()));

        } catch (final StoreException | RuntimeException e) {
            logger.error("Error getting fetch status", e);
            return ToolResultHelper.createResult(FetchStatusResponse.error("Error getting fetch status: " + e.getMessage()));
        }
    }
}
