package de.mirkosertic.mcp.knowledgebase.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the MCP Knowledge Base Server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.mcpkb/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_SOURCES_DIR = "KB_SOURCES_DIR";
    private static final String ENV_LINKS_FILE = "KB_LINKS_FILE";
    private static final String ENV_CACHE_PATH = "KB_CACHE_PATH";
    private static final String ENV_INDEX_PATH = "KB_INDEX_PATH";
    private static final String PROP_SOURCES_DIR = "kb.sources.dir";
    private static final String PROP_LINKS_FILE = "kb.links.file";
    private static final String PROP_CACHE_PATH = "kb.cache.path";
    private static final String PROP_INDEX_PATH = "kb.index.path";
    private static final String PROP_PROFILES_ACTIVE = "spring.profiles.active";
    private static final String CONFIG_DIR = ".mcpkb";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Knowledge base locations
    private String sourcesDir;
    private String linksFile;
    private String cachePath;
    private String indexPath;
    private String logDir;

    // Source selection
    private List<String> includePatterns = List.of();
    private List<String> excludePatterns = List.of(
            "**/node_modules/**", "**/.git/**",
            "**/target/**", "**/build/**"
    );
    private long maxSourceBytes = 2_000_000;

    // Update pass settings
    private long summarizeTimeoutMs = 120_000;
    private long lockTimeoutMs = 600_000;
    private boolean syncOnStartup = true;
    private int updateThreads = 2;

    // URL refresh settings
    private long urlMinRefreshIntervalMs = 86_400_000L;
    private long urlMaxAgeMs = 604_800_000L;
    private int urlManualBudget = 50;
    private int urlTickBudget = 10;
    private long urlBackoffBaseMs = 300_000;
    private long urlBackoffCapMs = 86_400_000L;
    private long urlTickIntervalMs = 600_000;
    private boolean urlTickEnabled = true;
    private long fetchTimeoutMs = 30_000;
    private String userAgent = "mcp-knowledgebase-server";

    // Watch settings
    private boolean fileWatchEnabled = true;
    private boolean linkWatchEnabled = true;
    private long fileDebounceMs = 2000;
    private long linkDebounceMs = 2000;
    private long watchPollIntervalMs = 2000;

    // Summarizer settings
    private String summarizerProvider = "extractive";
    private int summaryMaxChars = 600;
    private String llmBaseUrl = "";
    private String llmApiKey = "";
    private String llmModel = "gpt-4o-mini";
    private String summarizationPrompt = "Summarize the following document in two or three sentences "
            + "for a knowledge base index. Name the topics it covers so a reader can decide whether "
            + "to open it. Reply with the summary only.";

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: sourcesDir={}, linksFile={}, cachePath={}, indexPath={}, deployedMode={}",
                config.sourcesDir, config.linksFile, config.cachePath, config.indexPath, config.deployedMode);

        return config;
    }

    /**
     * Build a configuration from an in-memory YAML document only, without user config or
     * environment overrides.
     */
    public static ApplicationConfig fromYaml(final String yamlText) {
        final ApplicationConfig config = new ApplicationConfig();
        final Map<String, Object> yamlConfig = new Yaml().load(yamlText);
        if (yamlConfig != null) {
            config.applyYamlConfig(yamlConfig);
        }
        config.applyDefaultLocations();
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

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
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
        final Map<String, Object> kbConfig = (Map<String, Object>) config.get("knowledge-base");
        if (kbConfig == null) {
            return;
        }

        if (kbConfig.containsKey("sources-dir")) {
            this.sourcesDir = resolveVariables(kbConfig.get("sources-dir").toString());
        }
        if (kbConfig.containsKey("links-file")) {
            this.linksFile = resolveVariables(kbConfig.get("links-file").toString());
        }
        if (kbConfig.containsKey("cache-path")) {
            this.cachePath = resolveVariables(kbConfig.get("cache-path").toString());
        }
        if (kbConfig.containsKey("index-path")) {
            this.indexPath = resolveVariables(kbConfig.get("index-path").toString());
        }
        if (kbConfig.containsKey("log-dir")) {
            this.logDir = resolveVariables(kbConfig.get("log-dir").toString());
        }
        if (kbConfig.containsKey("include-patterns")) {
            final Object patterns = kbConfig.get("include-patterns");
            if (patterns instanceof List) {
                this.includePatterns = new ArrayList<>((List<String>) patterns);
            }
        }
        if (kbConfig.containsKey("exclude-patterns")) {
            final Object patterns = kbConfig.get("exclude-patterns");
            if (patterns instanceof List) {
                this.excludePatterns = new ArrayList<>((List<String>) patterns);
            }
        }
        if (kbConfig.containsKey("max-source-bytes")) {
            this.maxSourceBytes = ((Number) kbConfig.get("max-source-bytes")).longValue();
        }
        if (kbConfig.containsKey("summarize-timeout-ms")) {
            this.summarizeTimeoutMs = ((Number) kbConfig.get("summarize-timeout-ms")).longValue();
        }
        if (kbConfig.containsKey("lock-timeout-ms")) {
            this.lockTimeoutMs = ((Number) kbConfig.get("lock-timeout-ms")).longValue();
        }
        if (kbConfig.containsKey("sync-on-startup")) {
            this.syncOnStartup = (Boolean) kbConfig.get("sync-on-startup");
        }
        if (kbConfig.containsKey("update-threads")) {
            this.updateThreads = ((Number) kbConfig.get("update-threads")).intValue();
        }

        final Map<String, Object> refreshConfig = (Map<String, Object>) kbConfig.get("url-refresh");
        if (refreshConfig != null) {
            applyUrlRefreshConfig(refreshConfig);
        }

        final Map<String, Object> watchConfig = (Map<String, Object>) kbConfig.get("watch");
        if (watchConfig != null) {
            applyWatchConfig(watchConfig);
        }

        final Map<String, Object> summarizerConfig = (Map<String, Object>) kbConfig.get("summarizer");
        if (summarizerConfig != null) {
            applySummarizerConfig(summarizerConfig);
        }
    }

    private void applySummarizerConfig(final Map<String, Object> summarizerConfig) {
        if (summarizerConfig.containsKey("provider")) {
            this.summarizerProvider = resolveVariables(summarizerConfig.get("provider").toString()).trim();
        }
        if (summarizerConfig.containsKey("max-chars")) {
            this.summaryMaxChars = ((Number) summarizerConfig.get("max-chars")).intValue();
        }
        if (summarizerConfig.containsKey("base-url")) {
            this.llmBaseUrl = resolveVariables(summarizerConfig.get("base-url").toString());
        }
        if (summarizerConfig.containsKey("api-key")) {
            this.llmApiKey = resolveVariables(summarizerConfig.get("api-key").toString());
        }
        if (summarizerConfig.containsKey("model")) {
            this.llmModel = resolveVariables(summarizerConfig.get("model").toString());
        }
        if (summarizerConfig.containsKey("prompt")) {
            this.summarizationPrompt = summarizerConfig.get("prompt").toString();
        }
    }

    private void applyUrlRefreshConfig(final Map<String, Object> refreshConfig) {
        if (refreshConfig.containsKey("min-interval-ms")) {
            this.urlMinRefreshIntervalMs = ((Number) refreshConfig.get("min-interval-ms")).longValue();
        }
        if (refreshConfig.containsKey("max-age-ms")) {
            this.urlMaxAgeMs = ((Number) refreshConfig.get("max-age-ms")).longValue();
        }
        if (refreshConfig.containsKey("manual-budget")) {
            this.urlManualBudget = ((Number) refreshConfig.get("manual-budget")).intValue();
        }
        if (refreshConfig.containsKey("tick-budget")) {
            this.urlTickBudget = ((Number) refreshConfig.get("tick-budget")).intValue();
        }
        if (refreshConfig.containsKey("backoff-base-ms")) {
            this.urlBackoffBaseMs = ((Number) refreshConfig.get("backoff-base-ms")).longValue();
        }
        if (refreshConfig.containsKey("backoff-cap-ms")) {
            this.urlBackoffCapMs = ((Number) refreshConfig.get("backoff-cap-ms")).longValue();
        }
        if (refreshConfig.containsKey("tick-interval-ms")) {
            this.urlTickIntervalMs = ((Number) refreshConfig.get("tick-interval-ms")).longValue();
        }
        if (refreshConfig.containsKey("tick-enabled")) {
            this.urlTickEnabled = (Boolean) refreshConfig.get("tick-enabled");
        }
        if (refreshConfig.containsKey("fetch-timeout-ms")) {
            this.fetchTimeoutMs = ((Number) refreshConfig.get("fetch-timeout-ms")).longValue();
        }
        if (refreshConfig.containsKey("user-agent")) {
            this.userAgent = refreshConfig.get("user-agent").toString();
        }
    }

    private void applyWatchConfig(final Map<String, Object> watchConfig) {
        if (watchConfig.containsKey("files-enabled")) {
            this.fileWatchEnabled = (Boolean) watchConfig.get("files-enabled");
        }
        if (watchConfig.containsKey("links-enabled")) {
            this.linkWatchEnabled = (Boolean) watchConfig.get("links-enabled");
        }
        if (watchConfig.containsKey("file-debounce-ms")) {
            this.fileDebounceMs = ((Number) watchConfig.get("file-debounce-ms")).longValue();
        }
        if (watchConfig.containsKey("link-debounce-ms")) {
            this.linkDebounceMs = ((Number) watchConfig.get("link-debounce-ms")).longValue();
        }
        if (watchConfig.containsKey("poll-interval-ms")) {
            this.watchPollIntervalMs = ((Number) watchConfig.get("poll-interval-ms")).longValue();
        }
    }

    private void applyEnvironmentOverrides() {
        this.sourcesDir = override(this.sourcesDir, ENV_SOURCES_DIR, PROP_SOURCES_DIR);
        this.linksFile = override(this.linksFile, ENV_LINKS_FILE, PROP_LINKS_FILE);
        this.cachePath = override(this.cachePath, ENV_CACHE_PATH, PROP_CACHE_PATH);
        this.indexPath = override(this.indexPath, ENV_INDEX_PATH, PROP_INDEX_PATH);
        applyDefaultLocations();
    }

    private static String override(final String current, final String envName, final String propertyName) {
        String result = current;

        final String propValue = System.getProperty(propertyName);
        if (propValue != null && !propValue.isBlank()) {
            result = propValue.trim();
        }

        final String envValue = System.getenv(envName);
        if (envValue != null && !envValue.isBlank()) {
            result = envValue.trim();
            logger.info("{} from environment: {}", envName, result);
        }

        return result;
    }

    private void applyDefaultLocations() {
        final Path configDirectory = getConfigDirectory();
        if (sourcesDir == null || sourcesDir.isEmpty()) {
            sourcesDir = configDirectory.resolve("sources").toString();
        }
        if (linksFile == null || linksFile.isEmpty()) {
            linksFile = configDirectory.resolve("links.txt").toString();
        }
        if (cachePath == null || cachePath.isEmpty()) {
            cachePath = configDirectory.resolve("kb-cache.json").toString();
        }
        if (indexPath == null || indexPath.isEmpty()) {
            indexPath = configDirectory.resolve("kb-index.txt").toString();
        }
        if (logDir == null || logDir.isEmpty()) {
            logDir = configDirectory.resolve("log").toString();
        }
    }

    private void determineProfile() {
        // Check system property for profile (supports both old Spring-style and new style)
        final String profile = System.getProperty(PROP_PROFILES_ACTIVE,
                System.getProperty("profile", "default"));
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}. Defaults may themselves
     * contain variables, e.g. ${KB_SOURCES_DIR:${user.home}/sources}.
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        final StringBuilder result = new StringBuilder();
        int position = 0;
        while (position < value.length()) {
            final int start = value.indexOf("${", position);
            if (start < 0) {
                result.append(value, position, value.length());
                break;
            }
            final int end = findClosingBrace(value, start + 2);
            if (end < 0) {
                result.append(value, position, value.length());
                break;
            }
            result.append(value, position, start);

            final String varExpr = value.substring(start + 2, end);
            final int separator = varExpr.indexOf(':');
            final String varName = separator < 0 ? varExpr : varExpr.substring(0, separator);
            final String defaultValue = separator < 0 ? "" : varExpr.substring(separator + 1);

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName);
            }
            if (replacement == null || replacement.isEmpty()) {
                replacement = resolveVariables(defaultValue);
            }

            result.append(replacement);
            position = end + 1;
        }

        return result.toString();
    }

    private static int findClosingBrace(final String value, final int from) {
        int depth = 1;
        for (int i = from; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '{' && i > 0 && value.charAt(i - 1) == '$') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public String getSourcesDir() {
        return sourcesDir;
    }

    public String getLinksFile() {
        return linksFile;
    }

    public String getCachePath() {
        return cachePath;
    }

    public String getIndexPath() {
        return indexPath;
    }

    public String getLogDir() {
        return logDir;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public long getMaxSourceBytes() {
        return maxSourceBytes;
    }

    public long getSummarizeTimeoutMs() {
        return summarizeTimeoutMs;
    }

    public long getLockTimeoutMs() {
        return lockTimeoutMs;
    }

    public boolean isSyncOnStartup() {
        return syncOnStartup;
    }

    public int getUpdateThreads() {
        return updateThreads;
    }

    public long getUrlMinRefreshIntervalMs() {
        return urlMinRefreshIntervalMs;
    }

    public long getUrlMaxAgeMs() {
        return urlMaxAgeMs;
    }

    public int getUrlManualBudget() {
        return urlManualBudget;
    }

    public int getUrlTickBudget() {
        return urlTickBudget;
    }

    public long getUrlBackoffBaseMs() {
        return urlBackoffBaseMs;
    }

    public long getUrlBackoffCapMs() {
        return urlBackoffCapMs;
    }

    public long getUrlTickIntervalMs() {
        return urlTickIntervalMs;
    }

    public boolean isUrlTickEnabled() {
        return urlTickEnabled;
    }

    public long getFetchTimeoutMs() {
        return fetchTimeoutMs;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public boolean isFileWatchEnabled() {
        return fileWatchEnabled;
    }

    public boolean isLinkWatchEnabled() {
        return linkWatchEnabled;
    }

    public long getFileDebounceMs() {
        return fileDebounceMs;
    }

    public long getLinkDebounceMs() {
        return linkDebounceMs;
    }

    public long getWatchPollIntervalMs() {
        return watchPollIntervalMs;
    }

    public String getSummarizerProvider() {
        return summarizerProvider;
    }

    public String getLlmBaseUrl() {
        return llmBaseUrl;
    }

    public String getLlmApiKey() {
        return llmApiKey;
    }

    public String getLlmModel() {
        return llmModel;
    }

    public String getSummarizationPrompt() {
        return summarizationPrompt;
    }

    public int getSummaryMaxChars() {
        return summaryMaxChars;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
