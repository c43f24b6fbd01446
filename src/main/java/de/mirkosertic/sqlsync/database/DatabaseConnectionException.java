package de.mirkosertic.sqlsync.database;

/**
 * The database could not be reached or was busy. The next cycle may succeed.
 */
public class DatabaseConnectionException extends DatabaseException {

    public DatabaseConnectionException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public DatabaseConnectionException(final String message) {
        super(message, null);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
