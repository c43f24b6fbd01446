package de.mirkosertic.sqlsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Collects per-table cycle statistics and logs them periodically.
 * Thread-safe for use from multiple cycle threads.
 */
public class SyncStatisticsTracker implements CycleListener {

    private static final Logger logger = LoggerFactory.getLogger(SyncStatisticsTracker.class);

    private final Map<String, TableStats> tableStats = new ConcurrentHashMap<>();
    private final long startTime = System.currentTimeMillis();

    private final ScheduledExecutorService reportTimerExecutor =
            Executors.newSingleThreadScheduledExecutor(r -> {
                final Thread t = new Thread(r, "statistics-timer");
                t.setDaemon(true);
                return t;
            });
    private volatile ScheduledFuture<?> reportTimerFuture;

    @Override
    public void onCycleCompleted(final CycleSummary summary) {
        final TableStats stats = getOrCreateTableStats(summary.table());
        if (summary.isSuccess()) {
            stats.cyclesSucceeded.incrementAndGet();
        } else if (summary.outcome() == CycleSummary.Outcome.FAILED) {
            stats.cyclesFailed.incrementAndGet();
        }
        // Partially delivered cycles still count what reached the index
        stats.documentsCreated.addAndGet(summary.created());
        stats.documentsUpdated.addAndGet(summary.updated());
        stats.documentsDeleted.addAndGet(summary.deleted());
        stats.lastCycle.set(summary);
    }

    @Override
    public void onTickSkipped(final String table) {
        getOrCreateTableStats(table).ticksSkipped.incrementAndGet();
    }

    /**
     * Start logging a progress line per table at the given interval. A non-positive interval disables it.
     */
    public void startPeriodicReports(final long intervalSeconds) {
        if (intervalSeconds <= 0) {
            return;
        }
        reportTimerFuture = reportTimerExecutor.scheduleAtFixedRate(
                this::logReport,
                intervalSeconds,
                intervalSeconds,
                TimeUnit.SECONDS
        );
        logger.debug("Started periodic statistics reports every {}s", intervalSeconds);
    }

    public void shutdown() {
        final ScheduledFuture<?> future = reportTimerFuture;
        if (future != null) {
            future.cancel(false);
            reportTimerFuture = null;
        }
        reportTimerExecutor.shutdown();
        try {
            if (!reportTimerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                reportTimerExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            reportTimerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void logReport() {
        try {
            for (final SyncStatistics.TableStatistics stats : getStatistics().perTableStats().values()) {
                final CycleSummary last = stats.lastCycle();
                logger.info("Table {}: {} cycles ok, {} failed, {} ticks skipped; {} created, {} updated, "
                                + "{} deleted; last cycle {}",
                        stats.table(), stats.cyclesSucceeded(), stats.cyclesFailed(), stats.ticksSkipped(),
                        stats.documentsCreated(), stats.documentsUpdated(), stats.documentsDeleted(),
                        last == null ? "pending" : last.outcome());
            }
        } catch (final Exception e) {
            // ScheduledExecutorService silently cancels a periodic task that throws
            logger.error("Failed to log statistics report", e);
        }
    }

    public SyncStatistics getStatistics() {
        final Map<String, SyncStatistics.TableStatistics> perTable = new HashMap<>();
        for (final Map.Entry<String, TableStats> entry : tableStats.entrySet()) {
            final TableStats stats = entry.getValue();
            perTable.put(entry.getKey(), new SyncStatistics.TableStatistics(
                    entry.getKey(),
                    stats.cyclesSucceeded.get(),
                    stats.cyclesFailed.get(),
                    stats.ticksSkipped.get(),
                    stats.documentsCreated.get(),
                    stats.documentsUpdated.get(),
                    stats.documentsDeleted.get(),
                    stats.lastCycle.get()
            ));
        }
        return new SyncStatistics(startTime, System.currentTimeMillis(), perTable);
    }

    private TableStats getOrCreateTableStats(final String table) {
        return tableStats.computeIfAbsent(table, k -> new TableStats());
    }

    private static class TableStats {
        final AtomicLong cyclesSucceeded = new AtomicLong(0);
        final AtomicLong cyclesFailed = new AtomicLong(0);
        final AtomicLong ticksSkipped = new AtomicLong(0);
        final AtomicLong documentsCreated = new AtomicLong(0);
        final AtomicLong documentsUpdated = new AtomicLong(0);
        final AtomicLong documentsDeleted = new AtomicLong(0);
        final AtomicReference<CycleSummary> lastCycle = new AtomicReference<>();
    }
}
