package de.mirkosertic.sqlsync.sync;

import de.mirkosertic.sqlsync.index.IndexException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RetryingIndexCaller Tests")
class RetryingIndexCallerTest {

    private final List<Long> sleeps = new CopyOnWriteArrayList<>();
    private final RetryingIndexCaller caller = new RetryingIndexCaller(
            new RetryPolicy(3, 100, 1_000), sleeps::add, new Random(7));

    @Test
    @DisplayName("Should succeed on the first attempt without sleeping")
    void shouldSucceedFirstAttempt() {
        final IndexCallResult result = caller.call("test", () -> { });

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Should retry transient failures until the call succeeds")
    void shouldRetryTransientFailures() {
        // Given
        final AtomicInteger calls = new AtomicInteger();

        // When
        final IndexCallResult result = caller.call("test", () -> {
            if (calls.incrementAndGet() < 3) {
                throw IndexException.transientFailure(503, "unavailable");
            }
        });

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(sleeps).hasSize(2);
        assertThat(sleeps.get(0)).isBetween(50L, 100L);
        assertThat(sleeps.get(1)).isBetween(100L, 200L);
    }

    @Test
    @DisplayName("Should report a transient failure after exhausting the attempts")
    void shouldExhaustAttempts() {
        final AtomicInteger calls = new AtomicInteger();

        final IndexCallResult result = caller.call("test", () -> {
            calls.incrementAndGet();
            throw IndexException.transientFailure(429, "throttled");
        });

        assertThat(result.status()).isEqualTo(IndexCallResult.Status.FAILED_TRANSIENT);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.failureMessage()).isEqualTo("throttled");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(sleeps)
                .as("No backoff after the last attempt")
                .hasSize(2);
    }

    @Test
    @DisplayName("Should not retry permanent failures")
    void shouldNotRetryPermanentFailures() {
        final AtomicInteger calls = new AtomicInteger();

        final IndexCallResult result = caller.call("test", () -> {
            calls.incrementAndGet();
            throw IndexException.permanentFailure(400, "bad document");
        });

        assertThat(result.status()).isEqualTo(IndexCallResult.Status.FAILED_PERMANENT);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("Should treat unexpected runtime exceptions as permanent")
    void shouldTreatRuntimeExceptionsAsPermanent() {
        final IndexCallResult result = caller.call("test", () -> {
            throw new IllegalStateException("boom");
        });

        assertThat(result.status()).isEqualTo(IndexCallResult.Status.FAILED_PERMANENT);
        assertThat(result.failureMessage()).contains("boom");
    }

    @Test
    @DisplayName("Should stop retrying when interrupted during backoff")
    void shouldStopWhenInterrupted() {
        final RetryingIndexCaller interrupting = new RetryingIndexCaller(new RetryPolicy(5, 10, 100),
                millis -> {
                    throw new InterruptedException();
                }, new Random(1));

        try {
            final IndexCallResult result = interrupting.call("test", () -> {
                throw IndexException.transientFailure(503, "unavailable");
            });

            assertThat(result.status()).isEqualTo(IndexCallResult.Status.FAILED_TRANSIENT);
            assertThat(result.attempts()).isEqualTo(1);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            // Clear the flag for the following tests
            Thread.interrupted();
        }
    }
}
