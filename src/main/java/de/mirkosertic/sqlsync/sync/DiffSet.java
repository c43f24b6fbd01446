package de.mirkosertic.sqlsync.sync;

import java.util.List;
import java.util.Set;

/**
 * Immutable result of comparing the current rows of a table with its last synchronized state.
 * The three key sets are pairwise disjoint.
 */
public record DiffSet(
        /** Rows whose key was not part of the previous state. */
        List<FingerprintedRow> creations,
        /** Rows whose key was known but whose content hash changed. */
        List<FingerprintedRow> updates,
        /** Keys of the previous state that no longer exist in the table. */
        Set<NormalizedKey> deletions,
        /** Number of rows identical to the previous state; these are not sent again. */
        int unchangedCount,
        /** Wall-clock time in milliseconds spent computing the diff. */
        long diffTimeMs
) {

    public DiffSet {
        creations = List.copyOf(creations);
        updates = List.copyOf(updates);
        deletions = Set.copyOf(deletions);
    }

    public boolean isEmpty() {
        return creations.isEmpty() && updates.isEmpty() && deletions.isEmpty();
    }

    /** Total number of changes that result in index calls. */
    public int changeCount() {
        return creations.size() + updates.size() + deletions.size();
    }
}
