package de.mirkosertic.sqlsync.sync;

import de.mirkosertic.sqlsync.config.TableConfig;
import de.mirkosertic.sqlsync.database.DatabaseAdapter;
import de.mirkosertic.sqlsync.index.IndexClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Owns one {@link TableSyncLoop} per registered table and ticks each at its poll interval.
 * <p>
 * A single timer thread triggers the ticks; the cycles themselves run on the cycle executor, so a slow
 * table never delays the others. A tick that arrives while the previous cycle of the table is still
 * queued or running is skipped, never queued behind it.
 */
public class SyncScheduler {

    private static final Logger logger = LoggerFactory.getLogger(SyncScheduler.class);

    private final DatabaseAdapter database;
    private final IndexClient indexClient;
    private final BatchDispatcher dispatcher;
    private final RetryingIndexCaller caller;
    private final SyncStateStore stateStore;
    private final SyncExecutorService cycleExecutor;

    private final Map<String, TableSyncLoop> loops = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<CycleListener> listeners = new CopyOnWriteArrayList<>();
    // Tables whose triggered cycle has not finished yet
    private final Set<String> pending = ConcurrentHashMap.newKeySet();
    private final CycleListener dispatchingListener = new CycleListener() {
        @Override
        public void onCycleCompleted(final CycleSummary summary) {
            for (final CycleListener listener : listeners) {
                listener.onCycleCompleted(summary);
            }
        }

        @Override
        public void onTickSkipped(final String table) {
            for (final CycleListener listener : listeners) {
                listener.onTickSkipped(table);
            }
        }
    };

    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "sync-timer");
        t.setDaemon(true);
        return t;
    });
    private volatile boolean started = false;

    public SyncScheduler(final DatabaseAdapter database, final IndexClient indexClient,
                         final BatchDispatcher dispatcher, final RetryingIndexCaller caller,
                         final SyncStateStore stateStore, final SyncExecutorService cycleExecutor) {
        this.database = database;
        this.indexClient = indexClient;
        this.dispatcher = dispatcher;
        this.caller = caller;
        this.stateStore = stateStore;
        this.cycleExecutor = cycleExecutor;
    }

    public void addListener(final CycleListener listener) {
        listeners.add(listener);
    }

    /**
     * Register a table. Its last committed state is loaded from the state store.
     *
     * @throws IllegalArgumentException if the table is already registered
     * @throws IllegalStateException if the scheduler was already started
     */
    public TableSyncLoop registerTable(final TableConfig table) {
        if (started) {
            throw new IllegalStateException("Tables must be registered before the scheduler starts");
        }
        synchronized (loops) {
            if (loops.containsKey(table.name())) {
                throw new IllegalArgumentException("Table " + table.name() + " is already registered");
            }
            final TableSyncLoop loop = new TableSyncLoop(table, database, indexClient, dispatcher, caller,
                    stateStore, dispatchingListener, stateStore.load(table.name()));
            loops.put(table.name(), loop);
            logger.info("Registered table {} -> index {} (poll every {}s, batch size {}, {} concurrent batches)",
                    table.name(), table.indexName(), table.pollIntervalSeconds(), table.batchSize(),
                    table.maxConcurrentBatches());
            return loop;
        }
    }

    public Collection<TableSyncLoop> getLoops() {
        synchronized (loops) {
            return List.copyOf(loops.values());
        }
    }

    /**
     * Start ticking every table at its poll interval. The first tick runs immediately.
     */
    public void start() {
        if (started) {
            return;
        }
        started = true;
        for (final TableSyncLoop loop : getLoops()) {
            final long intervalSeconds = loop.getTable().pollIntervalSeconds();
            timer.scheduleAtFixedRate(() -> trigger(loop), 0, intervalSeconds, TimeUnit.SECONDS);
        }
        logger.info("Scheduler started for {} tables", loops.size());
    }

    void trigger(final TableSyncLoop loop) {
        final String table = loop.getTable().name();
        if (cycleExecutor.isShutdown()) {
            return;
        }
        if (!pending.add(table)) {
            logger.debug("Previous cycle of table {} still running, skipping tick", table);
            try {
                dispatchingListener.onTickSkipped(table);
            } catch (final RuntimeException e) {
                logger.error("Cycle listener failed for table {}", table, e);
            }
            return;
        }
        try {
            cycleExecutor.execute(() -> {
                try {
                    loop.tick();
                } finally {
                    pending.remove(table);
                }
            });
        } catch (final RuntimeException e) {
            pending.remove(table);
            // The timer cancels a periodic task whose run throws
            logger.error("Cannot trigger cycle of table {}", table, e);
        }
    }

    /**
     * Run one cycle of every table concurrently and wait for all of them.
     */
    public List<CycleSummary> runOnce() {
        final List<Future<CycleSummary>> futures = new ArrayList<>();
        for (final TableSyncLoop loop : getLoops()) {
            futures.add(cycleExecutor.submit(loop::tick));
        }
        final List<CycleSummary> summaries = new ArrayList<>();
        for (final Future<CycleSummary> future : futures) {
            try {
                final CycleSummary summary = future.get();
                if (summary != null) {
                    summaries.add(summary);
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for cycles to complete");
                break;
            } catch (final ExecutionException e) {
                logger.error("Cycle failed unexpectedly", e.getCause());
            }
        }
        return summaries;
    }

    /**
     * Stop ticking, let running cycles reach their next phase boundary and wait for them.
     */
    public void shutdown() {
        logger.info("Shutting down scheduler");
        for (final TableSyncLoop loop : getLoops()) {
            loop.requestShutdown();
        }
        timer.shutdownNow();
        cycleExecutor.shutdown();
        logger.info("Scheduler stopped");
    }
}
