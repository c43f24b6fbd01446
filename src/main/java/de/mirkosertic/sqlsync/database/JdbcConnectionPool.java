package de.mirkosertic.sqlsync.database;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded pool of JDBC connections shared by all table loops.
 * <p>
 * A connection is leased for one operation and returned right after; at most {@code maxSize}
 * connections exist at any time. Idle connections are validated before they are handed out again.
 */
public class JdbcConnectionPool implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(JdbcConnectionPool.class);

    private static final int VALIDATION_TIMEOUT_SECONDS = 2;

    private final String jdbcUrl;
    private final int maxSize;
    private final long acquireTimeoutMs;
    private final Semaphore permits;
    private final Deque<Connection> idle = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public JdbcConnectionPool(final String jdbcUrl, final int maxSize, final long acquireTimeoutMs) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Pool size must be at least 1");
        }
        this.jdbcUrl = jdbcUrl;
        this.maxSize = maxSize;
        this.acquireTimeoutMs = acquireTimeoutMs;
        this.permits = new Semaphore(maxSize, true);
        logger.info("Connection pool for {} initialized with at most {} connections", jdbcUrl, maxSize);
    }

    /**
     * A leased connection; closing the lease returns the connection to the pool.
     */
    public final class Lease implements AutoCloseable {

        private final Connection connection;
        private boolean broken;
        private boolean released;

        private Lease(final Connection connection) {
            this.connection = connection;
        }

        public Connection connection() {
            return connection;
        }

        /**
         * Mark the connection as unusable so it is closed instead of reused.
         */
        public void invalidate() {
            broken = true;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            release(connection, broken);
        }
    }

    /**
     * Lease a connection, waiting up to the acquire timeout for a free slot.
     *
     * @throws DatabaseConnectionException if no connection becomes available or a new one cannot be opened
     */
    public Lease acquire() throws DatabaseException {
        if (closed.get()) {
            throw new DatabaseConnectionException("Connection pool is closed");
        }
        try {
            if (!permits.tryAcquire(acquireTimeoutMs, TimeUnit.MILLISECONDS)) {
                throw new DatabaseConnectionException(
                        "Timed out after " + acquireTimeoutMs + "ms waiting for a database connection");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DatabaseConnectionException("Interrupted while waiting for a database connection", e);
        }

        try {
            Connection connection;
            while ((connection = idle.pollFirst()) != null) {
                if (isUsable(connection)) {
                    return new Lease(connection);
                }
                closeQuietly(connection);
            }
            return new Lease(DriverManager.getConnection(jdbcUrl));
        } catch (final SQLException e) {
            permits.release();
            throw DatabaseException.from("Cannot open connection to " + jdbcUrl, e);
        } catch (final RuntimeException e) {
            permits.release();
            throw e;
        }
    }

    private void release(final Connection connection, final boolean broken) {
        try {
            if (broken || closed.get()) {
                closeQuietly(connection);
            } else {
                idle.offerFirst(connection);
            }
        } finally {
            permits.release();
        }
    }

    private boolean isUsable(final Connection connection) {
        try {
            return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (final SQLException e) {
            logger.debug("Discarding pooled connection that failed validation", e);
            return false;
        }
    }

    private static void closeQuietly(final Connection connection) {
        try {
            connection.close();
        } catch (final SQLException e) {
            logger.warn("Error closing database connection", e);
        }
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getIdleCount() {
        return idle.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        Connection connection;
        while ((connection = idle.pollFirst()) != null) {
            closeQuietly(connection);
        }
        logger.info("Connection pool for {} closed", jdbcUrl);
    }
}
