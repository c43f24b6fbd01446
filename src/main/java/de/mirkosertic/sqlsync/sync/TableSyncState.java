package de.mirkosertic.sqlsync.sync;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Last successfully synchronized state of one table.
 * <p>
 * Instances are immutable; a table loop replaces its state only after a fully successful cycle.
 */
public record TableSyncState(
        /** Schema at the time of the last commit, {@code null} before the first successful cycle. */
        @Nullable SchemaSnapshot schema,
        /** Fingerprint of every row sent to the index, by key. */
        Map<NormalizedKey, RowFingerprint> fingerprints,
        /** Incremented whenever a committed cycle observed a schema change. */
        long schemaVersion,
        /** Epoch millis of the last successful cycle, {@code 0} if there was none. */
        long lastSuccessfulCycleMs
) {

    public TableSyncState {
        fingerprints = Map.copyOf(fingerprints);
    }

    public static TableSyncState empty() {
        return new TableSyncState(null, Map.of(), 0, 0);
    }

    public boolean isInitial() {
        return schema == null;
    }
}
