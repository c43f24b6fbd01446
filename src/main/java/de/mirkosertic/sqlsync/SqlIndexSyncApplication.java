package de.mirkosertic.sqlsync;

import de.mirkosertic.sqlsync.cli.SqlIndexSyncCommand;
import de.mirkosertic.sqlsync.config.ApplicationConfig;
import de.mirkosertic.sqlsync.config.ConfigurationException;
import de.mirkosertic.sqlsync.config.TableConfig;
import de.mirkosertic.sqlsync.database.DatabaseAdapter;
import de.mirkosertic.sqlsync.database.DatabaseAdapterFactory;
import de.mirkosertic.sqlsync.database.DatabaseException;
import de.mirkosertic.sqlsync.index.IndexClient;
import de.mirkosertic.sqlsync.index.LuceneIndexClient;
import de.mirkosertic.sqlsync.index.MeilisearchIndexClient;
import de.mirkosertic.sqlsync.sync.BatchDispatcher;
import de.mirkosertic.sqlsync.sync.CycleSummary;
import de.mirkosertic.sqlsync.sync.IndexCallResult;
import de.mirkosertic.sqlsync.sync.RetryPolicy;
import de.mirkosertic.sqlsync.sync.RetryingIndexCaller;
import de.mirkosertic.sqlsync.sync.Sleeper;
import de.mirkosertic.sqlsync.sync.SyncExecutorService;
import de.mirkosertic.sqlsync.sync.SyncScheduler;
import de.mirkosertic.sqlsync.sync.SyncStateStore;
import de.mirkosertic.sqlsync.sync.SyncStatisticsTracker;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point of the SQL index synchronization service.
 * Wires the database adapter, the index client and one sync loop per configured table.
 */
public class SqlIndexSyncApplication {

    private static final Logger logger = LoggerFactory.getLogger(SqlIndexSyncApplication.class);

    private final ApplicationConfig config;
    private final List<TableConfig> tables;
    private final DatabaseAdapter database;
    private final IndexClient indexClient;
    private final RetryingIndexCaller caller;
    private final SyncExecutorService dispatchExecutor;
    private final SyncScheduler scheduler;
    private final SyncStatisticsTracker statisticsTracker;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public SqlIndexSyncApplication(final ApplicationConfig config) throws ConfigurationException {
        this(config, DatabaseAdapterFactory.create(config), createIndexClient(config, config.getTables()));
    }

    SqlIndexSyncApplication(final ApplicationConfig config, final DatabaseAdapter database,
                            final IndexClient indexClient) throws ConfigurationException {
        this.config = config;
        this.tables = config.getTables();
        this.database = database;
        this.indexClient = indexClient;

        // Initialize services in dependency order
        this.caller = new RetryingIndexCaller(
                new RetryPolicy(config.getMaxAttempts(), config.getInitialBackoffMs(), config.getMaxBackoffMs()),
                Sleeper.THREAD,
                new Random());

        this.dispatchExecutor = new SyncExecutorService("dispatch", totalBatchSlots(tables),
                config.getShutdownTimeoutSeconds());
        final SyncExecutorService cycleExecutor = new SyncExecutorService("sync-cycle", Math.max(1, tables.size()),
                config.getShutdownTimeoutSeconds());

        final BatchDispatcher dispatcher = new BatchDispatcher(indexClient, dispatchExecutor, caller, Sleeper.THREAD);

        final SyncStateStore stateStore = config.getStatePath() == null
                ? SyncStateStore.disabled()
                : new SyncStateStore(Paths.get(config.getStatePath()));

        this.scheduler = new SyncScheduler(database, indexClient, dispatcher, caller, stateStore, cycleExecutor);
        this.statisticsTracker = new SyncStatisticsTracker();
        scheduler.addListener(statisticsTracker);
    }

    static IndexClient createIndexClient(final ApplicationConfig config, final List<TableConfig> tables)
            throws ConfigurationException {
        final String type = config.getIndexType().toLowerCase(Locale.ROOT);
        switch (type) {
            case ApplicationConfig.INDEX_TYPE_LUCENE:
                return new LuceneIndexClient(Paths.get(config.getIndexPath()));
            case ApplicationConfig.INDEX_TYPE_MEILISEARCH:
                return new MeilisearchIndexClient(
                        config.getMeilisearchHost(),
                        config.getMeilisearchApiKey(),
                        totalBatchSlots(tables) + 2,
                        Duration.ofSeconds(config.getRequestTimeoutSeconds()),
                        Duration.ofSeconds(config.getTaskTimeoutSeconds()),
                        50);
            default:
                throw new ConfigurationException("Unsupported index type: " + config.getIndexType());
        }
    }

    private static int totalBatchSlots(final List<TableConfig> tables) {
        int slots = 0;
        for (final TableConfig table : tables) {
            slots += table.maxConcurrentBatches();
        }
        return Math.max(1, slots);
    }

    /**
     * Check the configured tables against the database, set up their indexes and register the loops.
     *
     * @throws ConfigurationException if a configured table does not exist
     */
    public void init() throws ConfigurationException {
        logger.info("Initializing SQL index sync for {} tables...", tables.size());

        validateTablesExist();

        for (final TableConfig table : tables) {
            final String primaryKey = table.primaryKey() != null ? table.primaryKey() : detectPrimaryKey(table);
            if (primaryKey != null) {
                final IndexCallResult result = caller.call("set up index " + table.indexName(),
                        () -> indexClient.setupIndex(table.indexName(), primaryKey, table.indexSettings()));
                if (!result.isSuccess()) {
                    // The first cycle reports the problem again if it persists
                    logger.warn("Index {} could not be set up: {}", table.indexName(), result.failureMessage());
                }
            }
            scheduler.registerTable(table);
        }

        logger.info("All services initialized successfully");
    }

    private void validateTablesExist() throws ConfigurationException {
        final Set<String> existing;
        try {
            existing = new HashSet<>(database.listTables());
        } catch (final DatabaseException e) {
            logger.warn("Cannot list database tables, skipping table validation: {}", e.getMessage());
            return;
        }
        for (final TableConfig table : tables) {
            if (!existing.contains(table.name())) {
                throw new ConfigurationException("Table " + table.name() + " does not exist in the database");
            }
        }
    }

    @Nullable
    private String detectPrimaryKey(final TableConfig table) {
        try {
            final List<String> keyColumns = database.getSchema(table.name()).primaryKeyColumns();
            return keyColumns.size() == 1 ? keyColumns.get(0) : null;
        } catch (final DatabaseException e) {
            logger.warn("Cannot read schema of table {}: {}", table.name(), e.getMessage());
            return null;
        }
    }

    /**
     * Run one cycle of every table.
     */
    public List<CycleSummary> runOnce() {
        return scheduler.runOnce();
    }

    /**
     * Start the loops and block until the process is terminated.
     */
    public void start() {
        logger.info("Starting synchronization...");

        scheduler.start();
        statisticsTracker.startPeriodicReports(config.getStatisticsIntervalSeconds());

        // Register shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }
    }

    SyncStatisticsTracker getStatisticsTracker() {
        return statisticsTracker;
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        logger.info("Shutting down SQL index sync...");

        // Shutdown in reverse order of initialization
        try {
            scheduler.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down scheduler", e);
        }

        try {
            statisticsTracker.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down statistics tracker", e);
        }

        try {
            dispatchExecutor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down dispatch executor", e);
        }

        try {
            indexClient.close();
        } catch (final Exception e) {
            logger.error("Error closing index client", e);
        }

        try {
            database.close();
        } catch (final Exception e) {
            logger.error("Error closing database", e);
        }

        logger.info("SQL index sync shutdown complete");
    }

    public static void main(final String[] args) {
        System.exit(new CommandLine(new SqlIndexSyncCommand()).execute(args));
    }
}
