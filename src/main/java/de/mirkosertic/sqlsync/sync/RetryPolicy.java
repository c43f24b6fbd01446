package de.mirkosertic.sqlsync.sync;

import java.util.Random;

/**
 * Bounded exponential backoff with jitter.
 * <p>
 * The nominal delay after the n-th failed attempt is {@code initialBackoffMs * 2^(n-1)}, capped at
 * {@code maxBackoffMs}. The actual delay is drawn uniformly from the upper half of the nominal delay.
 */
public record RetryPolicy(
        /** Total number of attempts including the first one. */
        int maxAttempts,
        long initialBackoffMs,
        long maxBackoffMs
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoffMs < 0 || maxBackoffMs < initialBackoffMs) {
            throw new IllegalArgumentException("Invalid backoff range " + initialBackoffMs + ".." + maxBackoffMs);
        }
    }

    /**
     * @param failedAttempts number of attempts that have failed so far, starting at 1
     */
    public long nominalBackoffMs(final int failedAttempts) {
        long delay = initialBackoffMs;
        for (int i = 1; i < failedAttempts && delay < maxBackoffMs; i++) {
            delay = delay * 2;
        }
        return Math.min(delay, maxBackoffMs);
    }

    public long backoffMs(final int failedAttempts, final Random random) {
        final long nominal = nominalBackoffMs(failedAttempts);
        final long half = nominal / 2;
        return half + (long) (random.nextDouble() * (nominal - half));
    }
}
