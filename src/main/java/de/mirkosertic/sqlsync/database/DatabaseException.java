package de.mirkosertic.sqlsync.database;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;

/**
 * Failure of a database operation. Subclasses tell whether retrying later can help.
 * Wrapped {@link SQLException}s keep their SQL state and vendor error code.
 */
public abstract class DatabaseException extends Exception {

    /** SQLite result codes SQLITE_BUSY and SQLITE_LOCKED. */
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final String sqlState;
    private final int errorCode;

    protected DatabaseException(final String message, final Throwable cause) {
        super(message, cause);
        if (cause instanceof SQLException) {
            this.sqlState = ((SQLException) cause).getSQLState();
            this.errorCode = ((SQLException) cause).getErrorCode();
        } else {
            this.sqlState = null;
            this.errorCode = 0;
        }
    }

    public abstract boolean isTransient();

    public String getSqlState() {
        return sqlState;
    }

    public int getErrorCode() {
        return errorCode;
    }

    /**
     * Wrap a {@link SQLException} into a connection (transient) or query (permanent) failure.
     */
    public static DatabaseException from(final String message, final SQLException e) {
        if (isTransient(e)) {
            return new DatabaseConnectionException(message + ": " + e.getMessage(), e);
        }
        return new DatabaseQueryException(message + ": " + e.getMessage(), e);
    }

    static boolean isTransient(final SQLException e) {
        if (e instanceof SQLTransientException
                || e instanceof SQLRecoverableException
                || e instanceof SQLNonTransientConnectionException) {
            return true;
        }
        final String state = e.getSQLState();
        if (state != null && state.startsWith("08")) {
            // SQL state class 08: connection exception
            return true;
        }
        final int code = e.getErrorCode();
        return code == SQLITE_BUSY || code == SQLITE_LOCKED;
    }
}
