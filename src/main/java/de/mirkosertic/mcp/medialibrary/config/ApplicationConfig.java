package de.mirkosertic.mcp.medialibrary.config;

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
 * Central configuration for the media library server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. System properties
 * 2. Environment variables
 * 3. User config file (~/.mcpmedialibrary/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_CATALOG_PATH = "MEDIA_LIBRARY_CATALOG_PATH";
    private static final String PROP_CATALOG_PATH = "medialibrary.catalog.path";
    private static final String CONFIG_DIR = ".mcpmedialibrary";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";
    private static final String PROP_PROFILE = "profile";
    private static final String DEPLOYED_PROFILE = "deployed";

    private String defaultOwnerId = "default";

    // Catalog settings
    private String catalogPath;
    private long commitIntervalMs = 1000;

    // Crawler settings
    private List<String> includePatterns = List.of(
            "*.jpg", "*.jpeg", "*.png", "*.gif", "*.heic", "*.heif", "*.webp", "*.tif", "*.tiff",
            "*.dng", "*.cr2", "*.nef", "*.arw",
            "*.mp4", "*.mov", "*.m4v", "*.avi", "*.mkv", "*.webm", "*.3gp", "*.mts"
    );
    private List<String> excludePatterns = List.of(
            "**/.git/**", "**/@eaDir/**", "**/.thumbnails/**"
    );

    // Job queue settings
    private int threadPoolSize = 4;
    private int queueCapacity = 10000;
    private int maxAttempts = 3;
    private long retryBackoffMs = 1000;

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

        logger.info("Configuration loaded: catalogPath={}, jobThreads={}, deployedMode={}",
                config.catalogPath, config.threadPoolSize, config.deployedMode);

        return config;
    }

    static ApplicationConfig fromYaml(final Map<String, Object> yaml) {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYamlConfig(yaml);
        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYamlConfig(new Yaml().load(is));
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                applyYamlConfig(new Yaml().load(is));
                logger.debug("Loaded user config from: {}", userConfigPath);
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    void applyYamlConfig(final Map<String, Object> config) {
        if (config == null) {
            return;
        }
        final Map<String, Object> root = (Map<String, Object>) config.get("medialibrary");
        if (root == null) {
            return;
        }

        if (root.containsKey("default-owner-id")) {
            this.defaultOwnerId = root.get("default-owner-id").toString();
        }

        final Map<String, Object> catalogConfig = (Map<String, Object>) root.get("catalog");
        if (catalogConfig != null) {
            final Object path = catalogConfig.get("path");
            if (path != null) {
                this.catalogPath = resolveVariables(path.toString());
            }
            if (catalogConfig.containsKey("commit-interval-ms")) {
                this.commitIntervalMs = ((Number) catalogConfig.get("commit-interval-ms")).longValue();
            }
        }

        final Map<String, Object> crawlerConfig = (Map<String, Object>) root.get("crawler");
        if (crawlerConfig != null) {
            if (crawlerConfig.get("include-patterns") instanceof List) {
                this.includePatterns = new ArrayList<>((List<String>) crawlerConfig.get("include-patterns"));
            }
            if (crawlerConfig.get("exclude-patterns") instanceof List) {
                this.excludePatterns = new ArrayList<>((List<String>) crawlerConfig.get("exclude-patterns"));
            }
        }

        final Map<String, Object> jobsConfig = (Map<String, Object>) root.get("jobs");
        if (jobsConfig != null) {
            if (jobsConfig.containsKey("thread-pool-size")) {
                this.threadPoolSize = ((Number) jobsConfig.get("thread-pool-size")).intValue();
            }
            if (jobsConfig.containsKey("queue-capacity")) {
                this.queueCapacity = ((Number) jobsConfig.get("queue-capacity")).intValue();
            }
            if (jobsConfig.containsKey("max-attempts")) {
                this.maxAttempts = ((Number) jobsConfig.get("max-attempts")).intValue();
            }
            if (jobsConfig.containsKey("retry-backoff-ms")) {
                this.retryBackoffMs = ((Number) jobsConfig.get("retry-backoff-ms")).longValue();
            }
        }
    }

    private void applyEnvironmentOverrides() {
        final String envCatalogPath = System.getenv(ENV_CATALOG_PATH);
        if (envCatalogPath != null && !envCatalogPath.trim().isEmpty()) {
            this.catalogPath = envCatalogPath.trim();
            logger.info("Catalog path from environment: {}", this.catalogPath);
        }

        final String propCatalogPath = System.getProperty(PROP_CATALOG_PATH);
        if (propCatalogPath != null && !propCatalogPath.isEmpty()) {
            this.catalogPath = propCatalogPath;
        }

        if (this.catalogPath == null || this.catalogPath.isEmpty()) {
            this.catalogPath = Paths.get(System.getProperty("user.home"), CONFIG_DIR, "catalog").toString();
        }
    }

    private void determineProfile() {
        this.deployedMode = isDeployedProfileRequested();
    }

    /**
     * Whether the process was started with {@code -Dprofile=deployed}. Usable before the
     * configuration is loaded, which logging setup needs.
     */
    public static boolean isDeployedProfileRequested() {
        return isDeployedProfile(System.getProperty(PROP_PROFILE));
    }

    static boolean isDeployedProfile(final String profile) {
        return DEPLOYED_PROFILE.equalsIgnoreCase(profile == null ? null : profile.trim());
    }

    /**
     * Resolve variables in strings like ${VAR:default}. Defaults may contain variables themselves.
     */
    static String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = findClosingBrace(result, start + 2);
            if (end < 0) {
                break;
            }

            final String[] parts = result.substring(start + 2, end).split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            // Handle nested ${user.home} type variables
            if (replacement.contains("${")) {
                replacement = resolveVariables(replacement);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    private static int findClosingBrace(final String value, final int from) {
        int depth = 0;
        for (int i = from; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '{' && value.charAt(i - 1) == '$') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    return i;
                }
                depth--;
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
    public String getDefaultOwnerId() {
        return defaultOwnerId;
    }

    public String getCatalogPath() {
        return catalogPath;
    }

    public long getCommitIntervalMs() {
        return commitIntervalMs;
    }

    public List<String> getIncludePatterns() {
        return includePatterns;
    }

    public List<String> getExcludePatterns() {
        return excludePatterns;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getRetryBackoffMs() {
        return retryBackoffMs;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
