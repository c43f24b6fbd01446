package de.mirkosertic.sqlsync.config;

import de.mirkosertic.sqlsync.index.IndexSettings;
import de.mirkosertic.sqlsync.sync.DispatchSettings;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Synchronization settings of one table, with the global defaults already applied.
 */
public record TableConfig(
        /** Database table name. */
        String name,
        /** Target index name. */
        String indexName,
        /** Expected primary key column; {@code null} to use the key reported by the database. */
        @Nullable String primaryKey,
        /** Columns to index; empty means all columns. */
        List<String> fieldsToIndex,
        List<String> searchableAttributes,
        boolean typoTolerance,
        long pollIntervalSeconds,
        int batchSize,
        int deleteBatchSize,
        int maxConcurrentBatches,
        long interBatchDelayMs,
        /** Text values are truncated to this length; {@code 0} disables truncation. */
        int maxTextLength
) {

    public TableConfig {
        fieldsToIndex = List.copyOf(fieldsToIndex);
        searchableAttributes = List.copyOf(searchableAttributes);
    }

    public DispatchSettings dispatchSettings() {
        return new DispatchSettings(batchSize, deleteBatchSize, maxConcurrentBatches, interBatchDelayMs);
    }

    public IndexSettings indexSettings() {
        return new IndexSettings(searchableAttributes, typoTolerance);
    }
}
