package de.mirkosertic.archivesync.config;

import de.mirkosertic.archivesync.build.Blacklist;
import de.mirkosertic.archivesync.index.IndexBackendType;
import de.mirkosertic.archivesync.index.IndexOptions;
import de.mirkosertic.archivesync.model.DataFormat;
import de.mirkosertic.archivesync.sync.UpdatePolicy;
import org.jspecify.annotations.Nullable;
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
import java.util.Map;

/**
 * Central configuration for archivesync.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.archivesync/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    static final String ENV_WORKDIR = "ARCHIVESYNC_WORKDIR";
    static final String ENV_ARCHIVE = "ARCHIVESYNC_ARCHIVE";
    static final String ENV_INDEX_BACKEND = "ARCHIVESYNC_INDEX_BACKEND";
    private static final String PROP_PROFILE = "archivesync.profile";
    private static final String CONFIG_DIR = ".archivesync";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Archive settings
    private @Nullable String archivePath;
    private @Nullable String workDirectory;

    // Index settings
    private IndexBackendType indexBackend = IndexBackendType.AUTO;
    private int indexWorkers = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
    private int indexChunkLines = 1000;
    private boolean indexCompress = true;
    private long indexMemoryLimitBytes = IndexOptions.DEFAULT_MEMORY_LIMIT;
    private long indexPathCacheSize = 10_000;
    private @Nullable String indexCacheDirectory;

    // Update settings
    private long successDelayMs = UpdatePolicy.DEFAULT_SUCCESS_DELAY.toMillis();
    private long skippedDelayMs = UpdatePolicy.DEFAULT_SKIPPED_DELAY.toMillis();
    private long failureDelayMs = UpdatePolicy.DEFAULT_FAILURE_DELAY.toMillis();
    private int maxRetries = UpdatePolicy.DEFAULT_MAX_RETRIES;
    private int maxSkips = UpdatePolicy.DEFAULT_MAX_SKIPS;
    private boolean refetch = false;
    private boolean overwrite = false;
    private long progressIntervalMs = 60000;

    // Remote mirror settings
    private @Nullable String remoteMetaDirectory;
    private @Nullable String remoteDataDirectory;
    private DataFormat remoteDataFormat = DataFormat.EPUB;

    // Build settings
    private @Nullable String buildOutputDirectory;
    private @Nullable String buildExtrasDirectory;

    // Blacklist
    private List<Long> blacklistedAuthors = new ArrayList<>();
    private List<Long> blacklistedRecords = new ArrayList<>();

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(getUserConfigPath(), System.getenv());
    }

    static ApplicationConfig load(final Path userConfigPath, final Map<String, String> environment) {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig(userConfigPath);

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides(environment);

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: archive={}, workDirectory={}, indexBackend={}, deployedMode={}",
                config.archivePath, config.workDirectory, config.indexBackend, config.deployedMode);

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
        final Map<String, Object> root = (Map<String, Object>) config.get("archivesync");
        if (root == null) {
            return;
        }

        if (root.get("archive") != null) {
            this.archivePath = resolveVariables(root.get("archive").toString());
        }
        if (root.get("workdir") != null) {
            this.workDirectory = resolveVariables(root.get("workdir").toString());
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) root.get("index");
        if (indexConfig != null) {
            applyIndexConfig(indexConfig);
        }

        final Map<String, Object> updateConfig = (Map<String, Object>) root.get("update");
        if (updateConfig != null) {
            applyUpdateConfig(updateConfig);
        }

        final Map<String, Object> remoteConfig = (Map<String, Object>) root.get("remote");
        if (remoteConfig != null) {
            if (remoteConfig.get("meta-directory") != null) {
                this.remoteMetaDirectory = resolveVariables(remoteConfig.get("meta-directory").toString());
            }
            if (remoteConfig.get("data-directory") != null) {
                this.remoteDataDirectory = resolveVariables(remoteConfig.get("data-directory").toString());
            }
            if (remoteConfig.get("data-format") != null) {
                this.remoteDataFormat = DataFormat.fromName(remoteConfig.get("data-format").toString());
            }
        }

        final Map<String, Object> buildConfig = (Map<String, Object>) root.get("build");
        if (buildConfig != null) {
            if (buildConfig.get("output-directory") != null) {
                this.buildOutputDirectory = resolveVariables(buildConfig.get("output-directory").toString());
            }
            if (buildConfig.get("extras-directory") != null) {
                this.buildExtrasDirectory = resolveVariables(buildConfig.get("extras-directory").toString());
            }
        }

        final Map<String, Object> blacklistConfig = (Map<String, Object>) root.get("blacklist");
        if (blacklistConfig != null) {
            if (blacklistConfig.get("authors") instanceof List) {
                this.blacklistedAuthors = toLongs((List<Object>) blacklistConfig.get("authors"));
            }
            if (blacklistConfig.get("records") instanceof List) {
                this.blacklistedRecords = toLongs((List<Object>) blacklistConfig.get("records"));
            }
        }
    }

    private void applyIndexConfig(final Map<String, Object> indexConfig) {
        if (indexConfig.containsKey("backend")) {
            this.indexBackend = IndexBackendType.fromName(indexConfig.get("backend").toString());
        }
        if (indexConfig.containsKey("workers")) {
            this.indexWorkers = ((Number) indexConfig.get("workers")).intValue();
        }
        if (indexConfig.containsKey("chunk-lines")) {
            this.indexChunkLines = ((Number) indexConfig.get("chunk-lines")).intValue();
        }
        if (indexConfig.containsKey("compress")) {
            this.indexCompress = (Boolean) indexConfig.get("compress");
        }
        if (indexConfig.containsKey("memory-limit-bytes")) {
            this.indexMemoryLimitBytes = ((Number) indexConfig.get("memory-limit-bytes")).longValue();
        }
        if (indexConfig.containsKey("path-cache-size")) {
            this.indexPathCacheSize = ((Number) indexConfig.get("path-cache-size")).longValue();
        }
        if (indexConfig.get("cache-directory") != null) {
            this.indexCacheDirectory = resolveVariables(indexConfig.get("cache-directory").toString());
        }
    }

    private void applyUpdateConfig(final Map<String, Object> updateConfig) {
        if (updateConfig.containsKey("success-delay-ms")) {
            this.successDelayMs = ((Number) updateConfig.get("success-delay-ms")).longValue();
        }
        if (updateConfig.containsKey("skipped-delay-ms")) {
            this.skippedDelayMs = ((Number) updateConfig.get("skipped-delay-ms")).longValue();
        }
        if (updateConfig.containsKey("failure-delay-ms")) {
            this.failureDelayMs = ((Number) updateConfig.get("failure-delay-ms")).longValue();
        }
        if (updateConfig.containsKey("max-retries")) {
            this.maxRetries = ((Number) updateConfig.get("max-retries")).intValue();
        }
        if (updateConfig.containsKey("max-skips")) {
            this.maxSkips = ((Number) updateConfig.get("max-skips")).intValue();
        }
        if (updateConfig.containsKey("refetch")) {
            this.refetch = (Boolean) updateConfig.get("refetch");
        }
        if (updateConfig.containsKey("overwrite")) {
            this.overwrite = (Boolean) updateConfig.get("overwrite");
        }
        if (updateConfig.containsKey("progress-interval-ms")) {
            this.progressIntervalMs = ((Number) updateConfig.get("progress-interval-ms")).longValue();
        }
    }

    private static List<Long> toLongs(final List<Object> values) {
        final List<Long> result = new ArrayList<>(values.size());
        for (final Object value : values) {
            if (value instanceof Number) {
                result.add(((Number) value).longValue());
            } else if (value != null) {
                result.add(Long.parseLong(value.toString().trim()));
            }
        }
        return result;
    }

    private void applyEnvironmentOverrides(final Map<String, String> environment) {
        final String envWorkDirectory = environment.get(ENV_WORKDIR);
        if (envWorkDirectory != null && !envWorkDirectory.trim().isEmpty()) {
            this.workDirectory = envWorkDirectory.trim();
            logger.info("Work directory from environment: {}", this.workDirectory);
        }

        final String envArchive = environment.get(ENV_ARCHIVE);
        if (envArchive != null && !envArchive.trim().isEmpty()) {
            this.archivePath = envArchive.trim();
            logger.info("Archive from environment: {}", this.archivePath);
        }

        final String envBackend = environment.get(ENV_INDEX_BACKEND);
        if (envBackend != null && !envBackend.trim().isEmpty()) {
            this.indexBackend = IndexBackendType.fromName(envBackend);
            logger.info("Index backend from environment: {}", this.indexBackend);
        }

        // Default work directory if not set
        if (this.workDirectory == null || this.workDirectory.isEmpty()) {
            this.workDirectory = Paths.get(System.getProperty("user.home"), CONFIG_DIR, "work").toString();
        }

        // System property for the archive
        final String propArchive = System.getProperty("archivesync.archive");
        if (propArchive != null && !propArchive.isEmpty() && (envArchive == null || envArchive.trim().isEmpty())) {
            this.archivePath = propArchive;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty(PROP_PROFILE, "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (!value.contains("${")) {
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
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

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

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Index loading options derived from the index section.
     */
    public IndexOptions toIndexOptions() {
        return new IndexOptions(indexBackend, indexWorkers, indexChunkLines, indexCompress,
                indexMemoryLimitBytes, indexPathCacheSize,
                indexCacheDirectory != null ? Path.of(indexCacheDirectory) : null);
    }

    /**
     * Update policy derived from the update section.
     */
    public UpdatePolicy toUpdatePolicy() {
        return new UpdatePolicy(Duration.ofMillis(successDelayMs), Duration.ofMillis(skippedDelayMs),
                Duration.ofMillis(failureDelayMs), maxRetries, maxSkips);
    }

    public Blacklist toBlacklist() {
        return Blacklist.of(blacklistedAuthors, blacklistedRecords);
    }

    // Getters
    public @Nullable String getArchivePath() {
        return archivePath;
    }

    public String getWorkDirectory() {
        return workDirectory != null ? workDirectory : getConfigDirectory().resolve("work").toString();
    }

    public IndexBackendType getIndexBackend() {
        return indexBackend;
    }

    public int getIndexWorkers() {
        return indexWorkers;
    }

    public int getIndexChunkLines() {
        return indexChunkLines;
    }

    public boolean isIndexCompress() {
        return indexCompress;
    }

    public long getIndexMemoryLimitBytes() {
        return indexMemoryLimitBytes;
    }

    public long getIndexPathCacheSize() {
        return indexPathCacheSize;
    }

    public @Nullable String getIndexCacheDirectory() {
        return indexCacheDirectory;
    }

    public boolean isRefetch() {
        return refetch;
    }

    public boolean isOverwrite() {
        return overwrite;
    }

    public long getProgressIntervalMs() {
        return progressIntervalMs;
    }

    public @Nullable String getRemoteMetaDirectory() {
        return remoteMetaDirectory;
    }

    public @Nullable String getRemoteDataDirectory() {
        return remoteDataDirectory;
    }

    public DataFormat getRemoteDataFormat() {
        return remoteDataFormat;
    }

    public @Nullable String getBuildOutputDirectory() {
        return buildOutputDirectory;
    }

    public @Nullable String getBuildExtrasDirectory() {
        return buildExtrasDirectory;
    }

    public List<Long> getBlacklistedAuthors() {
        return blacklistedAuthors;
    }

    public List<Long> getBlacklistedRecords() {
        return blacklistedRecords;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
