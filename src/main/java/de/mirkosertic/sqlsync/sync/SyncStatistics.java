package de.mirkosertic.sqlsync.sync;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Snapshot of the synchronization counters since startup.
 */
public record SyncStatistics(
        long startTimeMs,
        long snapshotTimeMs,
        Map<String, TableStatistics> perTableStats
) {

    public SyncStatistics {
        perTableStats = Map.copyOf(perTableStats);
    }

    public long uptimeMs() {
        return snapshotTimeMs - startTimeMs;
    }

    public long totalDocumentsSent() {
        long total = 0;
        for (final TableStatistics stats : perTableStats.values()) {
            total += stats.documentsCreated() + stats.documentsUpdated() + stats.documentsDeleted();
        }
        return total;
    }

    public record TableStatistics(
            String table,
            long cyclesSucceeded,
            long cyclesFailed,
            long ticksSkipped,
            long documentsCreated,
            long documentsUpdated,
            long documentsDeleted,
            /** Summary of the most recent cycle, {@code null} before the first one completed. */
            @Nullable CycleSummary lastCycle
    ) {
    }
}
