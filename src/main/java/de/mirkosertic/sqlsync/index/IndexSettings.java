package de.mirkosertic.sqlsync.index;

import java.util.List;

/**
 * Static per-index settings applied once when an index is set up.
 */
public record IndexSettings(
        /** Attributes used for full text search, in ranking order; empty means all attributes. */
        List<String> searchableAttributes,
        boolean typoToleranceEnabled
) {
    public IndexSettings {
        searchableAttributes = List.copyOf(searchableAttributes);
    }

    public static IndexSettings defaults() {
        return new IndexSettings(List.of(), true);
    }
}
