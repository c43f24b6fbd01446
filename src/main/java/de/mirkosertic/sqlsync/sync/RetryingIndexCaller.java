package de.mirkosertic.sqlsync.sync;

import de.mirkosertic.sqlsync.index.IndexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;

/**
 * Runs index calls in a bounded retry loop and reports the outcome as an {@link IndexCallResult}.
 * Transient failures are retried with {@link RetryPolicy} backoff, permanent failures are returned
 * after the first attempt.
 */
public class RetryingIndexCaller {

    private static final Logger logger = LoggerFactory.getLogger(RetryingIndexCaller.class);

    /**
     * A single attempt of an index call.
     */
    @FunctionalInterface
    public interface IndexCall {
        void run() throws IndexException;
    }

    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Random random;

    public RetryingIndexCaller(final RetryPolicy retryPolicy, final Sleeper sleeper, final Random random) {
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.random = random;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public IndexCallResult call(final String description, final IndexCall call) {
        int attempt = 1;
        while (true) {
            final IndexException failure;
            try {
                call.run();
                if (attempt > 1) {
                    logger.info("{} succeeded after {} attempts", description, attempt);
                }
                return IndexCallResult.succeeded(attempt);
            } catch (final IndexException e) {
                failure = e;
            } catch (final RuntimeException e) {
                logger.error("{} failed unexpectedly", description, e);
                return new IndexCallResult(IndexCallResult.Status.FAILED_PERMANENT, attempt, e.toString());
            }

            if (!failure.isTransient()) {
                logger.error("{} failed permanently (status {}): {}", description, failure.getStatus(),
                        failure.getMessage());
                return new IndexCallResult(IndexCallResult.Status.FAILED_PERMANENT, attempt, failure.getMessage());
            }
            if (attempt >= retryPolicy.maxAttempts()) {
                logger.warn("{} failed after {} attempts (status {}): {}", description, attempt,
                        failure.getStatus(), failure.getMessage());
                return new IndexCallResult(IndexCallResult.Status.FAILED_TRANSIENT, attempt, failure.getMessage());
            }

            final long delayMs = retryPolicy.backoffMs(attempt, random);
            logger.warn("{} attempt {}/{} failed (status {}): {}, retrying in {}ms", description, attempt,
                    retryPolicy.maxAttempts(), failure.getStatus(), failure.getMessage(), delayMs);
            try {
                sleeper.sleep(delayMs);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("{} interrupted during backoff", description);
                return new IndexCallResult(IndexCallResult.Status.FAILED_TRANSIENT, attempt, failure.getMessage());
            }
            attempt++;
        }
    }
}
