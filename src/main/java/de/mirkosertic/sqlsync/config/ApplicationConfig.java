package de.mirkosertic.sqlsync.config;

import de.mirkosertic.sqlsync.database.DatabaseAdapterFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Central configuration of the synchronization service.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. Config file given on the command line, or ~/.sqlsync/config.yaml
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    public static final String INDEX_TYPE_LUCENE = "lucene";
    public static final String INDEX_TYPE_MEILISEARCH = "meilisearch";

    static final String ENV_DATABASE_URL = "SQLSYNC_DATABASE_URL";
    static final String ENV_INDEX_TYPE = "SQLSYNC_INDEX_TYPE";
    static final String ENV_INDEX_PATH = "SQLSYNC_INDEX_PATH";
    static final String ENV_MEILISEARCH_HOST = "SQLSYNC_MEILISEARCH_HOST";
    static final String ENV_MEILISEARCH_API_KEY = "SQLSYNC_MEILISEARCH_API_KEY";
    static final String ENV_STATE_PATH = "SQLSYNC_STATE_PATH";
    private static final String CONFIG_DIR = ".sqlsync";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private final Function<String, String> environment;

    // Database settings
    private String databaseType = DatabaseAdapterFactory.TYPE_SQLITE;
    private String connectionString;
    private int connectionPoolSize = 5;
    private long connectionAcquireTimeoutMs = 30000;

    // Index settings
    private String indexType = INDEX_TYPE_LUCENE;
    private String indexPath;
    private String meilisearchHost = "http://localhost:7700";
    private String meilisearchApiKey;
    private long requestTimeoutSeconds = 30;
    private long taskTimeoutSeconds = 120;

    // State persistence
    private String statePath;

    // Sync defaults
    private long pollIntervalSeconds = 60;
    private int documentBatchSize = 100;
    private int deleteBatchSize = 1000;
    private int maxConcurrentBatches = 5;
    private long interBatchDelayMs = 100;
    private int maxAttempts = 5;
    private long initialBackoffMs = 200;
    private long maxBackoffMs = 10000;
    private long shutdownTimeoutSeconds = 60;
    private int maxTextLength = 0;
    private long statisticsIntervalSeconds = 300;

    // Raw table entries, resolved against the sync defaults on access
    private List<Map<String, Object>> tableEntries = new ArrayList<>();

    private ApplicationConfig(final Function<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Load configuration from all sources with proper priority.
     *
     * @param configFile explicit config file, or {@code null} to use ~/.sqlsync/config.yaml if present
     */
    public static ApplicationConfig load(@Nullable final Path configFile) throws ConfigurationException {
        return load(configFile, System::getenv);
    }

    /**
     * Load configuration, resolving variables and overrides through the given environment lookup.
     */
    public static ApplicationConfig load(@Nullable final Path configFile, final Function<String, String> environment)
            throws ConfigurationException {
        final ApplicationConfig config = new ApplicationConfig(environment);

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load the given or the user config file
        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new ConfigurationException("Config file does not exist: " + configFile);
            }
            config.loadFromFile(configFile);
        } else if (Files.exists(getUserConfigPath())) {
            config.loadFromFile(getUserConfigPath());
        }

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        logger.info("Configuration loaded: database={}, index={}, tables={}",
                config.databaseType, config.indexType, config.tableEntries.size());

        return config;
    }

    private void loadFromClasspath() throws ConfigurationException {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                applyYaml(is, DEFAULT_CONFIG_FILE);
                logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromFile(final Path file) throws ConfigurationException {
        try (final InputStream is = Files.newInputStream(file)) {
            applyYaml(is, file.toString());
            logger.debug("Loaded config from: {}", file);
        } catch (final IOException e) {
            throw new ConfigurationException("Cannot read config file " + file, e);
        }
    }

    private void applyYaml(final InputStream is, final String source) throws ConfigurationException {
        try {
            final Map<String, Object> config = new Yaml().load(is);
            if (config != null) {
                applyYamlConfig(config);
            }
        } catch (final YAMLException | ClassCastException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to sqlsync section
        final Map<String, Object> root = (Map<String, Object>) config.get("sqlsync");
        if (root == null) {
            return;
        }

        final Map<String, Object> database = (Map<String, Object>) root.get("database");
        if (database != null) {
            databaseType = stringValue(database, "type", databaseType);
            connectionString = stringValue(database, "connection-string", connectionString);
            connectionPoolSize = intValue(database, "connection-pool-size", connectionPoolSize);
            connectionAcquireTimeoutMs = longValue(database, "acquire-timeout-ms", connectionAcquireTimeoutMs);
        }

        final Map<String, Object> index = (Map<String, Object>) root.get("index");
        if (index != null) {
            indexType = stringValue(index, "type", indexType);
            indexPath = stringValue(index, "path", indexPath);
            meilisearchHost = stringValue(index, "host", meilisearchHost);
            meilisearchApiKey = stringValue(index, "api-key", meilisearchApiKey);
            requestTimeoutSeconds = longValue(index, "request-timeout-seconds", requestTimeoutSeconds);
            taskTimeoutSeconds = longValue(index, "task-timeout-seconds", taskTimeoutSeconds);
        }

        final Map<String, Object> state = (Map<String, Object>) root.get("state");
        if (state != null) {
            statePath = stringValue(state, "path", statePath);
        }

        final Map<String, Object> sync = (Map<String, Object>) root.get("sync");
        if (sync != null) {
            applySyncConfig(sync);
        }

        if (root.containsKey("tables")) {
            final Object tables = root.get("tables");
            if (tables instanceof List) {
                this.tableEntries = new ArrayList<>((List<Map<String, Object>>) tables);
            }
        }
    }

    private void applySyncConfig(final Map<String, Object> sync) {
        pollIntervalSeconds = longValue(sync, "poll-interval-seconds", pollIntervalSeconds);
        documentBatchSize = intValue(sync, "document-batch-size", documentBatchSize);
        deleteBatchSize = intValue(sync, "delete-batch-size", deleteBatchSize);
        maxConcurrentBatches = intValue(sync, "max-concurrent-batches", maxConcurrentBatches);
        interBatchDelayMs = longValue(sync, "inter-batch-delay-ms", interBatchDelayMs);
        maxAttempts = intValue(sync, "max-attempts", maxAttempts);
        initialBackoffMs = longValue(sync, "initial-backoff-ms", initialBackoffMs);
        maxBackoffMs = longValue(sync, "max-backoff-ms", maxBackoffMs);
        shutdownTimeoutSeconds = longValue(sync, "shutdown-timeout-seconds", shutdownTimeoutSeconds);
        maxTextLength = intValue(sync, "max-text-length", maxTextLength);
        statisticsIntervalSeconds = longValue(sync, "statistics-interval-seconds", statisticsIntervalSeconds);
    }

    private void applyEnvironmentOverrides() {
        final String envDatabaseUrl = getenv(ENV_DATABASE_URL);
        if (envDatabaseUrl != null) {
            this.connectionString = envDatabaseUrl;
            logger.info("Database connection string from environment");
        }
        final String envIndexType = getenv(ENV_INDEX_TYPE);
        if (envIndexType != null) {
            this.indexType = envIndexType;
        }
        final String envIndexPath = getenv(ENV_INDEX_PATH);
        if (envIndexPath != null) {
            this.indexPath = envIndexPath;
            logger.info("Index path from environment: {}", this.indexPath);
        }
        final String envHost = getenv(ENV_MEILISEARCH_HOST);
        if (envHost != null) {
            this.meilisearchHost = envHost;
        }
        final String envApiKey = getenv(ENV_MEILISEARCH_API_KEY);
        if (envApiKey != null) {
            this.meilisearchApiKey = envApiKey;
        }
        final String envStatePath = getenv(ENV_STATE_PATH);
        if (envStatePath != null) {
            this.statePath = envStatePath;
        }

        // System property for index path
        final String propIndexPath = System.getProperty("sqlsync.index.path");
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }

        // Default index path if not set
        if (this.indexPath == null || this.indexPath.isEmpty()) {
            this.indexPath = Paths.get(System.getProperty("user.home"), CONFIG_DIR, "index").toString();
        }
    }

    @Nullable
    private String getenv(final String name) {
        final String value = environment.apply(name);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    /**
     * Check the configuration for problems that make synchronization impossible.
     *
     * @throws ConfigurationException listing every problem found
     */
    public void validate() throws ConfigurationException {
        final List<String> problems = new ArrayList<>();

        if (connectionString == null || connectionString.isBlank()) {
            problems.add("database.connection-string is required");
        }
        final String type = databaseType.toLowerCase(Locale.ROOT);
        if (!DatabaseAdapterFactory.TYPE_SQLITE.equals(type) && !DatabaseAdapterFactory.TYPE_JDBC.equals(type)) {
            problems.add("Unsupported database type: " + databaseType);
        }
        if (connectionPoolSize < 1) {
            problems.add("database.connection-pool-size must be positive");
        }
        final String index = indexType.toLowerCase(Locale.ROOT);
        if (!INDEX_TYPE_LUCENE.equals(index) && !INDEX_TYPE_MEILISEARCH.equals(index)) {
            problems.add("Unsupported index type: " + indexType);
        }
        if (INDEX_TYPE_MEILISEARCH.equals(index) && (meilisearchHost == null || meilisearchHost.isBlank())) {
            problems.add("index.host is required for meilisearch");
        }
        if (maxAttempts < 1) {
            problems.add("sync.max-attempts must be positive");
        }
        if (initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
            problems.add("sync.initial-backoff-ms must not exceed sync.max-backoff-ms");
        }

        if (tableEntries.isEmpty()) {
            problems.add("At least one table must be configured");
        }
        final Set<String> tableNames = new HashSet<>();
        final Set<String> indexNames = new HashSet<>();
        try {
            for (final TableConfig table : getTables()) {
                if (!tableNames.add(table.name())) {
                    problems.add("Table " + table.name() + " is configured more than once");
                }
                if (!indexNames.add(table.indexName())) {
                    problems.add("Index " + table.indexName() + " is used by more than one table");
                }
                if (table.pollIntervalSeconds() < 1) {
                    problems.add("Table " + table.name() + ": poll-interval-seconds must be positive");
                }
                if (table.batchSize() < 1 || table.deleteBatchSize() < 1) {
                    problems.add("Table " + table.name() + ": batch sizes must be positive");
                }
                if (table.maxConcurrentBatches() < 1) {
                    problems.add("Table " + table.name() + ": max-concurrent-batches must be positive");
                }
                if (table.interBatchDelayMs() < 0 || table.maxTextLength() < 0) {
                    problems.add("Table " + table.name() + ": delays and lengths must not be negative");
                }
            }
        } catch (final ConfigurationException e) {
            problems.addAll(e.getProblems());
        }

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }
    }

    /**
     * Table settings with the sync defaults applied.
     */
    @SuppressWarnings("unchecked")
    public List<TableConfig> getTables() throws ConfigurationException {
        final List<TableConfig> tables = new ArrayList<>();
        for (final Object rawEntry : tableEntries) {
            if (!(rawEntry instanceof Map)) {
                throw new ConfigurationException("Table entry is not a mapping: " + rawEntry);
            }
            final Map<String, Object> entry = (Map<String, Object>) rawEntry;
            final String name = stringValue(entry, "name", null);
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Table entry without name: " + entry);
            }
            try {
                tables.add(new TableConfig(
                        name,
                        stringValue(entry, "index-name", name),
                        stringValue(entry, "primary-key", null),
                        stringList(entry, "fields-to-index"),
                        stringList(entry, "searchable-attributes"),
                        booleanValue(entry, "typo-tolerance", true),
                        longValue(entry, "poll-interval-seconds", pollIntervalSeconds),
                        intValue(entry, "document-batch-size", documentBatchSize),
                        intValue(entry, "delete-batch-size", deleteBatchSize),
                        intValue(entry, "max-concurrent-batches", maxConcurrentBatches),
                        longValue(entry, "inter-batch-delay-ms", interBatchDelayMs),
                        intValue(entry, "max-text-length", maxTextLength)));
            } catch (final ClassCastException e) {
                throw new ConfigurationException("Malformed settings for table " + name + ": " + e.getMessage(), e);
            }
        }
        return tables;
    }

    @Nullable
    private String stringValue(final Map<String, Object> map, final String key, @Nullable final String defaultValue) {
        final Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        return resolveVariables(value.toString());
    }

    private static int intValue(final Map<String, Object> map, final String key, final int defaultValue) {
        final Object value = map.get(key);
        return value == null ? defaultValue : ((Number) value).intValue();
    }

    private static long longValue(final Map<String, Object> map, final String key, final long defaultValue) {
        final Object value = map.get(key);
        return value == null ? defaultValue : ((Number) value).longValue();
    }

    private static boolean booleanValue(final Map<String, Object> map, final String key, final boolean defaultValue) {
        final Object value = map.get(key);
        return value == null ? defaultValue : (Boolean) value;
    }

    @SuppressWarnings("unchecked")
    private static List<String> stringList(final Map<String, Object> map, final String key) {
        final Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        final List<String> result = new ArrayList<>();
        for (final Object item : (List<Object>) value) {
            result.add(item.toString());
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
            String replacement = environment.apply(varName);
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

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public String getDatabaseType() {
        return databaseType;
    }

    public String getConnectionString() {
        return connectionString;
    }

    public int getConnectionPoolSize() {
        return connectionPoolSize;
    }

    public long getConnectionAcquireTimeoutMs() {
        return connectionAcquireTimeoutMs;
    }

    public String getIndexType() {
        return indexType;
    }

    public String getIndexPath() {
        return indexPath;
    }

    public String getMeilisearchHost() {
        return meilisearchHost;
    }

    @Nullable
    public String getMeilisearchApiKey() {
        return meilisearchApiKey;
    }

    public long getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public long getTaskTimeoutSeconds() {
        return taskTimeoutSeconds;
    }

    @Nullable
    public String getStatePath() {
        return statePath;
    }

    public long getPollIntervalSeconds() {
        return pollIntervalSeconds;
    }

    public int getDocumentBatchSize() {
        return documentBatchSize;
    }

    public int getDeleteBatchSize() {
        return deleteBatchSize;
    }

    public int getMaxConcurrentBatches() {
        return maxConcurrentBatches;
    }

    public long getInterBatchDelayMs() {
        return interBatchDelayMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getInitialBackoffMs() {
        return initialBackoffMs;
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public long getShutdownTimeoutSeconds() {
        return shutdownTimeoutSeconds;
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }

    public long getStatisticsIntervalSeconds() {
        return statisticsIntervalSeconds;
    }
}
