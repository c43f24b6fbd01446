package de.mirkosertic.sqlsync.database;

/**
 * A query was rejected, for example because the table was dropped. Retrying does not help until the
 * database changes.
 */
public class DatabaseQueryException extends DatabaseException {

    public DatabaseQueryException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public DatabaseQueryException(final String message) {
        super(message, null);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
