package de.mirkosertic.sqlsync.sync;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of one index call after retries.
 */
public record IndexCallResult(
        Status status,
        /** Number of attempts made, {@code 0} if the call was never attempted. */
        int attempts,
        /** Message of the last failure, {@code null} on success. */
        @Nullable String failureMessage
) {

    public enum Status {
        SUCCEEDED,
        /** Transient failures exhausted the retry budget. */
        FAILED_TRANSIENT,
        /** Not retried; the cycle must fail. */
        FAILED_PERMANENT,
        /** Not attempted because an earlier call failed permanently. */
        SKIPPED
    }

    public static IndexCallResult succeeded(final int attempts) {
        return new IndexCallResult(Status.SUCCEEDED, attempts, null);
    }

    public static IndexCallResult skipped() {
        return new IndexCallResult(Status.SKIPPED, 0, "Skipped after a permanent failure");
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }
}
