package de.mirkosertic.sqlsync.sync;

/**
 * Phase of a table loop. A cycle moves through the phases in declaration order and ends in
 * {@link #IDLE}, or in {@link #FAILED} until the next tick starts.
 */
public enum CyclePhase {
    IDLE,
    FETCHING,
    DIFFING,
    DISPATCHING,
    COMMITTING,
    FAILED
}
