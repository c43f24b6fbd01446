package de.mirkosertic.sqlsync.sync;

/**
 * Receives the outcome of every table cycle. Called on the cycle thread, so implementations must be
 * quick and thread-safe.
 */
public interface CycleListener {

    void onCycleCompleted(CycleSummary summary);

    /**
     * A tick found the previous cycle of the table still running.
     */
    default void onTickSkipped(final String table) {
    }
}
