package de.mirkosertic.sqlsync.sync;

/**
 * Per-table batching and concurrency settings for one dispatch.
 */
public record DispatchSettings(
        /** Maximum number of documents per upsert call. */
        int batchSize,
        /** Maximum number of identifiers per delete call. */
        int deleteBatchSize,
        /** Maximum number of batch calls in flight at the same time. */
        int maxConcurrency,
        /** Pause between two consecutive batch submissions of the same worker slot. */
        long interBatchDelayMs
) {
    public DispatchSettings {
        if (batchSize < 1 || deleteBatchSize < 1 || maxConcurrency < 1 || interBatchDelayMs < 0) {
            throw new IllegalArgumentException("Invalid dispatch settings: batchSize=" + batchSize
                    + ", deleteBatchSize=" + deleteBatchSize + ", maxConcurrency=" + maxConcurrency
                    + ", interBatchDelayMs=" + interBatchDelayMs);
        }
    }
}
