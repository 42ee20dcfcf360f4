package de.mirkosertic.mcp.newsserver.config;

import de.mirkosertic.mcp.newsserver.provider.SearchDepth;
import de.mirkosertic.mcp.newsserver.provider.TavilyClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Central configuration for the MCP News Server application.
 * Loads configuration from YAML files, environment variables and system properties.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.mcpnews/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 * <p>
 * {@link #load()} fails with a {@link StartupConfigException} if the result is not usable.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_TAVILY_API_KEY = "TAVILY_API_KEY";
    static final String ENV_REDIS_HOST = "REDIS_HOST";
    static final String ENV_REDIS_PORT = "REDIS_PORT";
    static final String ENV_CACHE_TTL_DAYS = "NEWS_CACHE_TTL_DAYS";
    static final String ENV_STORE_BACKEND = "NEWS_STORE_BACKEND";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".mcpnews";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String LOG_DIR = "log";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    public static final String BACKEND_REDIS = "redis";
    public static final String BACKEND_MEMORY = "memory";

    private final Map<String, String> env;
    private final Properties systemProperties;

    // Live provider
    private String tavilyApiKey;
    private String tavilyBaseUrl = TavilyClient.DEFAULT_BASE_URL;
    private long tavilyTimeoutMs = 30_000;

    // Article store
    private String storeBackend = BACKEND_REDIS;
    private String redisHost = "localhost";
    private int redisPort = 6379;
    // Raw port and the setting it came from, parsed in validate()
    private String redisPortValue = "6379";
    private String redisPortSource = "news.store.redis.port";
    private String keyPrefix = "defi_news:";
    private int ttlDays = 7;
    private int maxIndexSize = 1000;

    // Scheduled fetching
    private boolean fetcherEnabled = true;
    private long fetchIntervalMinutes = 180;
    private long initialFetchDelayMs = 5000;
    private int fetchMaxResults = 10;
    private SearchDepth fetchSearchDepth = SearchDepth.ADVANCED;
    private String fetchTimeRange = "week";
    private String fetchTopic = "news";
    private boolean fetchIncludeRawContent = true;
    private List<String> queries = new ArrayList<>();

    private List<String> targetWebsites = new ArrayList<>();

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig(final Map<String, String> env, final Properties systemProperties) {
        this.env = env;
        this.systemProperties = systemProperties;
    }

    /**
     * Load configuration from all sources with proper priority.
     *
     * @throws StartupConfigException if required settings are missing or invalid
     */
    public static ApplicationConfig load() {
        return load(System.getenv(), System.getProperties(), getUserConfigPath());
    }

    static ApplicationConfig load(final Map<String, String> env, final Properties systemProperties,
                                  final Path userConfigPath) {
        final ApplicationConfig config = new ApplicationConfig(env, systemProperties);

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig(userConfigPath);

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        config.validate();

        logger.info("Configuration loaded: backend={}, ttlDays={}, maxIndexSize={}, queries={}, targetWebsites={}, deployedMode={}",
                config.storeBackend, config.ttlDays, config.maxIndexSize, config.queries.size(),
                config.targetWebsites.size(), config.deployedMode);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig(final Path userConfigPath) {
        if (userConfigPath != null && Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> newsConfig = (Map<String, Object>) config.get("news");
        if (newsConfig == null) {
            return;
        }

        final Map<String, Object> tavilyConfig = (Map<String, Object>) newsConfig.get("tavily");
        if (tavilyConfig != null) {
            if (tavilyConfig.get("api-key") != null) {
                this.tavilyApiKey = resolveVariables(tavilyConfig.get("api-key").toString());
            }
            if (tavilyConfig.get("base-url") != null) {
                this.tavilyBaseUrl = resolveVariables(tavilyConfig.get("base-url").toString());
            }
            if (tavilyConfig.containsKey("timeout-ms")) {
                this.tavilyTimeoutMs = ((Number) tavilyConfig.get("timeout-ms")).longValue();
            }
        }

        final Map<String, Object> storeConfig = (Map<String, Object>) newsConfig.get("store");
        if (storeConfig != null) {
            applyStoreConfig(storeConfig);
        }

        final Map<String, Object> fetcherConfig = (Map<String, Object>) newsConfig.get("fetcher");
        if (fetcherConfig != null) {
            applyFetcherConfig(fetcherConfig);
        }

        if (newsConfig.get("target-websites") instanceof List<?> websites) {
            this.targetWebsites = toStringList(websites);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyStoreConfig(final Map<String, Object> storeConfig) {
        if (storeConfig.get("backend") != null) {
            this.storeBackend = resolveVariables(storeConfig.get("backend").toString());
        }
        if (storeConfig.get("key-prefix") != null) {
            this.keyPrefix = storeConfig.get("key-prefix").toString();
        }
        if (storeConfig.containsKey("ttl-days")) {
            this.ttlDays = ((Number) storeConfig.get("ttl-days")).intValue();
        }
        if (storeConfig.containsKey("max-index-size")) {
            this.maxIndexSize = ((Number) storeConfig.get("max-index-size")).intValue();
        }

        final Map<String, Object> redisConfig = (Map<String, Object>) storeConfig.get("redis");
        if (redisConfig != null) {
            if (redisConfig.get("host") != null) {
                this.redisHost = resolveVariables(redisConfig.get("host").toString());
            }
            if (redisConfig.get("port") != null) {
                final String raw = redisConfig.get("port").toString();
                this.redisPortValue = resolveVariables(raw);
                this.redisPortSource = placeholderName(raw, "news.store.redis.port");
            }
        }
    }

    private void applyFetcherConfig(final Map<String, Object> fetcherConfig) {
        if (fetcherConfig.containsKey("enabled")) {
            this.fetcherEnabled = (Boolean) fetcherConfig.get("enabled");
        }
        if (fetcherConfig.containsKey("interval-minutes")) {
            this.fetchIntervalMinutes = ((Number) fetcherConfig.get("interval-minutes")).longValue();
        }
        if (fetcherConfig.containsKey("initial-delay-ms")) {
            this.initialFetchDelayMs = ((Number) fetcherConfig.get("initial-delay-ms")).longValue();
        }
        if (fetcherConfig.containsKey("max-results")) {
            this.fetchMaxResults = ((Number) fetcherConfig.get("max-results")).intValue();
        }
        if (fetcherConfig.get("search-depth") != null) {
            this.fetchSearchDepth = SearchDepth.parse(fetcherConfig.get("search-depth").toString(), SearchDepth.ADVANCED);
        }
        if (fetcherConfig.containsKey("time-range")) {
            final Object timeRange = fetcherConfig.get("time-range");
            this.fetchTimeRange = timeRange != null ? timeRange.toString() : null;
        }
        if (fetcherConfig.containsKey("topic")) {
            final Object topic = fetcherConfig.get("topic");
            this.fetchTopic = topic != null ? topic.toString() : null;
        }
        if (fetcherConfig.containsKey("include-raw-content")) {
            this.fetchIncludeRawContent = (Boolean) fetcherConfig.get("include-raw-content");
        }
        if (fetcherConfig.get("queries") instanceof List<?> list) {
            this.queries = toStringList(list);
        }
    }

    private void applyOverrides() {
        final String apiKey = override(ENV_TAVILY_API_KEY, "news.tavily.api-key");
        if (apiKey != null) {
            this.tavilyApiKey = apiKey;
        }

        final String backend = override(ENV_STORE_BACKEND, "news.store.backend");
        if (backend != null) {
            this.storeBackend = backend;
            logger.info("Store backend from environment: {}", backend);
        }

        final String host = override(ENV_REDIS_HOST, "news.store.redis.host");
        if (host != null) {
            this.redisHost = host;
        }

        final String port = override(ENV_REDIS_PORT, "news.store.redis.port");
        if (port != null) {
            this.redisPortValue = port;
            this.redisPortSource = overrideSource(ENV_REDIS_PORT, "news.store.redis.port");
        }

        final String ttl = override(ENV_CACHE_TTL_DAYS, "news.store.ttl-days");
        if (ttl != null) {
            this.ttlDays = parseInt(ttl, ENV_CACHE_TTL_DAYS);
        }
    }

    /**
     * System property wins over the environment variable. Blank values count as unset.
     */
    private String override(final String envName, final String propertyName) {
        final String property = systemProperties.getProperty(propertyName);
        if (property != null && !property.trim().isEmpty()) {
            return property.trim();
        }
        final String value = env.get(envName);
        if (value != null && !value.trim().isEmpty()) {
            return value.trim();
        }
        return null;
    }

    /**
     * Name of the setting an override was taken from, mirroring the lookup order of {@link #override}.
     */
    private String overrideSource(final String envName, final String propertyName) {
        final String property = systemProperties.getProperty(propertyName);
        return property != null && !property.trim().isEmpty() ? propertyName : envName;
    }

    /**
     * For a value written as {@code ${VAR:default}} the variable name, else the YAML key.
     */
    static String placeholderName(final String raw, final String yamlKey) {
        final String trimmed = raw.trim();
        if (trimmed.startsWith("${") && trimmed.endsWith("}")) {
            final String name = trimmed.substring(2, trimmed.length() - 1).split(":", 2)[0];
            if (!name.isBlank()) {
                return name;
            }
        }
        return yamlKey;
    }

    private void determineProfile() {
        final String profile = systemProperties.getProperty(PROP_PROFILES_ACTIVE,
                systemProperties.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    private void validate() {
        if (tavilyApiKey == null || tavilyApiKey.isBlank()) {
            throw new StartupConfigException(ENV_TAVILY_API_KEY + " environment variable is required");
        }
        this.storeBackend = storeBackend.trim().toLowerCase(Locale.ROOT);
        if (!BACKEND_REDIS.equals(storeBackend) && !BACKEND_MEMORY.equals(storeBackend)) {
            throw new StartupConfigException("Unknown store backend '" + storeBackend + "', expected "
                    + BACKEND_REDIS + " or " + BACKEND_MEMORY);
        }
        this.redisPort = parseInt(redisPortValue, redisPortSource);
        if (ttlDays <= 0) {
            throw new StartupConfigException("Cache TTL must be positive, got " + ttlDays + " days");
        }
        if (maxIndexSize <= 0) {
            throw new StartupConfigException("Maximum index size must be positive, got " + maxIndexSize);
        }
        if (fetcherEnabled && queries.isEmpty()) {
            throw new StartupConfigException("Scheduled fetching is enabled but no queries are configured");
        }
        if (fetchIntervalMinutes <= 0) {
            throw new StartupConfigException("Fetch interval must be positive, got " + fetchIntervalMinutes + " minutes");
        }
    }

    private static int parseInt(final String value, final String name) {
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new StartupConfigException("Invalid integer for " + name + ": " + value);
        }
    }

    private static List<String> toStringList(final List<?> values) {
        final List<String> result = new ArrayList<>(values.size());
        for (final Object value : values) {
            if (value != null && !value.toString().isBlank()) {
                result.add(value.toString().trim());
            }
        }
        return result;
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = env.get(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = systemProperties.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    /**
     * Log directory of the deployed profile, next to the user config file.
     */
    public static Path getLogDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, LOG_DIR);
    }

    // Getters
    public String getTavilyApiKey() {
        return tavilyApiKey;
    }

    public String getTavilyBaseUrl() {
        return tavilyBaseUrl;
    }

    public long getTavilyTimeoutMs() {
        return tavilyTimeoutMs;
    }

    public String getStoreBackend() {
        return storeBackend;
    }

    public String getRedisHost() {
        return redisHost;
    }

    public int getRedisPort() {
        return redisPort;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public int getTtlDays() {
        return ttlDays;
    }

    public Duration getCacheTtl() {
        return Duration.ofDays(ttlDays);
    }

    public int getMaxIndexSize() {
        return maxIndexSize;
    }

    public boolean isFetcherEnabled() {
        return fetcherEnabled;
    }

    public long getFetchIntervalMinutes() {
        return fetchIntervalMinutes;
    }

    public long getInitialFetchDelayMs() {
        return initialFetchDelayMs;
    }

    public int getFetchMaxResults() {
        return fetchMaxResults;
    }

    public SearchDepth getFetchSearchDepth() {
        return fetchSearchDepth;
    }

    public String getFetchTimeRange() {
        return fetchTimeRange;
    }

    public String getFetchTopic() {
        return fetchTopic;
    }

    public boolean isFetchIncludeRawContent() {
        return fetchIncludeRawContent;
    }

    public List<String> getQueries() {
        return queries;
    }

    public List<String> getTargetWebsites() {
        return targetWebsites;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
