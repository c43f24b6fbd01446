package de.mirkosertic.sqlsync.sync;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Aggregated outcome of dispatching one diff set.
 */
public record DispatchResult(
        CategoryCount creations,
        CategoryCount updates,
        CategoryCount deletions,
        /** Number of batches sent, including failed ones. */
        int batchCount,
        /** Keys of every batch that failed terminally or was not attempted. */
        List<NormalizedKey> failedKeys,
        /** Message of the first permanent failure, {@code null} if there was none. */
        @Nullable String permanentFailure
) {

    /**
     * Row counts of one diff category. Rows of skipped batches count as failed.
     */
    public record CategoryCount(long succeeded, long failed) {
        public static final CategoryCount NONE = new CategoryCount(0, 0);
    }

    public DispatchResult {
        failedKeys = List.copyOf(failedKeys);
    }

    public static DispatchResult empty() {
        return new DispatchResult(CategoryCount.NONE, CategoryCount.NONE, CategoryCount.NONE, 0, List.of(), null);
    }

    /**
     * Whether every batch was delivered, which is the precondition for committing new table state.
     */
    public boolean isSuccess() {
        return permanentFailure == null && creations.failed() == 0 && updates.failed() == 0
                && deletions.failed() == 0;
    }

    public boolean hasPermanentFailure() {
        return permanentFailure != null;
    }
}
