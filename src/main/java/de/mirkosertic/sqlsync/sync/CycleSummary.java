package de.mirkosertic.sqlsync.sync;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Outcome of one sync cycle of one table.
 */
public record CycleSummary(
        String table,
        String index,
        Outcome outcome,
        /** Schema classification of the cycle; {@code UNCHANGED} if the cycle failed before diffing. */
        SchemaChange.Kind schemaChange,
        long created,
        long updated,
        long deleted,
        long unchanged,
        long durationMs,
        /** Keys whose batches were not delivered. */
        List<NormalizedKey> failedKeys,
        @Nullable String error
) {

    public enum Outcome {
        /** Every change was delivered and the new state committed. */
        SUCCEEDED,
        /** The cycle failed; the last committed state is unchanged. */
        FAILED,
        /** Shutdown was requested before the cycle could finish; nothing was committed. */
        ABORTED
    }

    public CycleSummary {
        failedKeys = List.copyOf(failedKeys);
    }

    static CycleSummary failed(final String table, final String index, final SchemaChange.Kind schemaChange,
                               final long durationMs, final String error) {
        return new CycleSummary(table, index, Outcome.FAILED, schemaChange, 0, 0, 0, 0, durationMs, List.of(), error);
    }

    static CycleSummary aborted(final String table, final String index, final long durationMs) {
        return new CycleSummary(table, index, Outcome.ABORTED, SchemaChange.Kind.UNCHANGED, 0, 0, 0, 0, durationMs,
                List.of(), "Shutdown requested");
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCEEDED;
    }

    public long changeCount() {
        return created + updated + deleted;
    }
}
