package de.mirkosertic.sqlsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed size thread pool with named threads, used for table cycles and for batch dispatch workers.
 */
public class SyncExecutorService {

    private static final Logger logger = LoggerFactory.getLogger(SyncExecutorService.class);

    private final String name;
    private final ThreadPoolExecutor executor;
    private final long shutdownTimeoutSeconds;

    public SyncExecutorService(final String name, final int threads, final long shutdownTimeoutSeconds) {
        this.name = name;
        this.shutdownTimeoutSeconds = shutdownTimeoutSeconds;

        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, name + "-" + threadCounter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threads,
                threads,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(10000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("Executor {} initialized with {} threads", name, threads);
    }

    public Future<?> submit(final Runnable task) {
        return executor.submit(task);
    }

    public <T> Future<T> submit(final Callable<T> task) {
        return executor.submit(task);
    }

    public void execute(final Runnable task) {
        executor.execute(task);
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    /**
     * Stop accepting tasks and wait for running ones to finish. Tasks still running after the
     * timeout are interrupted.
     */
    public void shutdown() {
        logger.info("Shutting down executor {}", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeoutSeconds, TimeUnit.SECONDS)) {
                logger.warn("Executor {} did not terminate within {}s, forcing shutdown", name,
                        shutdownTimeoutSeconds);
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for executor {} to terminate", name, e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
