package de.mirkosertic.sqlsync.sync;

/**
 * Thrown when a table's primary key cannot be normalized: no key, a composite key, or a key
 * column type that is neither integer, text nor UUID. Retrying does not help.
 */
public class UnsupportedKeyTypeException extends Exception {

    public UnsupportedKeyTypeException(final String message) {
        super(message);
    }

    public UnsupportedKeyTypeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
