package de.mirkosertic.sqlsync.sync;

import java.util.Set;

/**
 * Classified difference between two schema snapshots of one table.
 * <p>
 * The added and removed column sets are always filled in, independent of which kind won the
 * classification, so that an index reconfiguration can apply both at once.
 */
public record SchemaChange(
        Kind kind,
        /** Columns present now but not in the previous snapshot. */
        Set<String> addedColumns,
        /** Columns present in the previous snapshot but no longer. */
        Set<String> removedColumns
) {

    /**
     * Classification kinds, highest precedence first.
     */
    public enum Kind {
        PRIMARY_KEY_CHANGED,
        COLUMNS_REMOVED,
        TYPES_CHANGED,
        COLUMNS_ADDED,
        UNCHANGED
    }

    public SchemaChange {
        addedColumns = Set.copyOf(addedColumns);
        removedColumns = Set.copyOf(removedColumns);
    }

    public static SchemaChange unchanged() {
        return new SchemaChange(Kind.UNCHANGED, Set.of(), Set.of());
    }

    /**
     * Whether prior fingerprint state must be dropped and the index recreated.
     */
    public boolean requiresFullReindex() {
        return kind == Kind.PRIMARY_KEY_CHANGED || kind == Kind.TYPES_CHANGED;
    }

    /**
     * Whether the index field configuration must be updated incrementally before rows are sent.
     */
    public boolean requiresIndexConfiguration() {
        return kind == Kind.COLUMNS_ADDED || kind == Kind.COLUMNS_REMOVED;
    }
}
