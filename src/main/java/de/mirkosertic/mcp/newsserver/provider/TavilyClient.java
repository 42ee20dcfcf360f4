package de.mirkosertic.mcp.newsserver.provider;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Tavily REST API client for web search and content extraction.
 * <p>
 * Every call is bounded by the configured call timeout. Failures are never retried here.
 */
public class TavilyClient implements SearchProvider, ExtractionProvider {

    private static final Logger logger = LoggerFactory.getLogger(TavilyClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.tavily.com";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String apiKey;

    public TavilyClient(final String apiKey, final String baseUrl, final Duration callTimeout) {
        this(new OkHttpClient.Builder()
                        .connectTimeout(30, TimeUnit.SECONDS)
                        .readTimeout(30, TimeUnit.SECONDS)
                        .callTimeout(callTimeout.toMillis(), TimeUnit.MILLISECONDS)
                        .build(),
                apiKey,
                baseUrl);
    }

    public TavilyClient(final OkHttpClient client, final String apiKey, final String baseUrl) {
        this.client = client;
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.apiKey = apiKey;
        this.baseUrl = stripTrailingSlash(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl);
    }

    @Override
    public List<SearchResult> search(final String query, final SearchOptions options) throws ProviderException {
        final ObjectNode body = mapper.createObjectNode();
        body.put("query", query);
        body.put("search_depth", options.searchDepth().apiValue());
        body.put("max_results", options.maxResults());
        body.put("include_raw_content", options.includeRawContent());
        if (!options.includeDomains().isEmpty()) {
            final ArrayNode domains = body.putArray("include_domains");
            options.includeDomains().forEach(domains::add);
        }
        if (options.topic() != null) {
            body.put("topic", options.topic());
        }
        if (options.timeRange() != null) {
            body.put("time_range", options.timeRange());
        }

        final JsonNode root = post("/search", body);

        final List<SearchResult> results = new ArrayList<>();
        for (final JsonNode item : root.path("results")) {
            results.add(new SearchResult(
                    item.path("title").asText(""),
                    item.path("url").asText(""),
                    item.path("content").asText(""),
                    textOrNull(item, "snippet"),
                    firstText(item, "published_date", "publishedDate"),
                    item.hasNonNull("score") ? item.get("score").asDouble() : null
            ));
        }

        logger.debug("Search '{}' returned {} results", query, results.size());
        return results;
    }

    @Override
    public List<ExtractResult> extract(final List<String> urls) throws ProviderException {
        final ObjectNode body = mapper.createObjectNode();
        final ArrayNode urlArray = body.putArray("urls");
        urls.forEach(urlArray::add);

        final JsonNode root = post("/extract", body);

        final List<ExtractResult> results = new ArrayList<>();
        for (final JsonNode item : root.path("results")) {
            final String content = firstText(item, "raw_content", "content");
            results.add(new ExtractResult(
                    item.path("url").asText(""),
                    textOrNull(item, "title"),
                    content != null ? content : "",
                    firstText(item, "published_date", "publishedDate")
            ));
        }

        final JsonNode failed = root.path("failed_results");
        if (failed.isArray() && !failed.isEmpty()) {
            logger.warn("Extraction failed for {} url(s): {}", failed.size(), failed);
        }
        return results;
    }

    private JsonNode post(final String path, final ObjectNode body) throws ProviderException {
        final Request request = new Request.Builder()
                .url(baseUrl + path)
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(body.toString(), JSON))
                .build();

        try (Response response = client.newCall(request).execute()) {
            final ResponseBody responseBody = response.body();
            final String payload = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new ProviderException("Tavily API error: " + response.code() + " " + describeError(payload, response.message()));
            }
            return mapper.readTree(payload);
        } catch (final ProviderException e) {
            throw e;
        } catch (final IOException e) {
            throw new ProviderException("Tavily request to " + path + " failed: " + e.getMessage(), e);
        }
    }

    private String describeError(final String payload, final String fallback) {
        try {
            final JsonNode node = mapper.readTree(payload);
            final JsonNode detail = node.path("detail");
            if (detail.hasNonNull("error")) {
                return detail.get("error").asText();
            }
            if (node.hasNonNull("error")) {
                return node.get("error").asText();
            }
        } catch (final IOException e) {
            logger.debug("Error body is not JSON: {}", e.getMessage());
        }
        return fallback;
    }

    private static @Nullable String textOrNull(final JsonNode node, final String field) {
        final JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        final String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    private static @Nullable String firstText(final JsonNode node, final String... fields) {
        for (final String field : fields) {
            final String text = textOrNull(node, field);
            if (text != null) {
                return text;
            }
        }
        return null;
    }

    private static String stripTrailingSlash(final String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
