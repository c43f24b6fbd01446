package de.mirkosertic.sqlsync.index;

/**
 * Failure of an index operation, classified as transient (worth retrying) or permanent.
 */
public class IndexException extends Exception {

    /** Status used when the failure did not come with an HTTP status. */
    public static final int NO_STATUS = -1;

    private final boolean transientFailure;
    private final int status;

    private IndexException(final boolean transientFailure, final int status, final String message,
                           final Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
        this.status = status;
    }

    public static IndexException transientFailure(final int status, final String message, final Throwable cause) {
        return new IndexException(true, status, message, cause);
    }

    public static IndexException transientFailure(final int status, final String message) {
        return new IndexException(true, status, message, null);
    }

    public static IndexException permanentFailure(final int status, final String message, final Throwable cause) {
        return new IndexException(false, status, message, cause);
    }

    public static IndexException permanentFailure(final int status, final String message) {
        return new IndexException(false, status, message, null);
    }

    /**
     * Classify an HTTP status: timeouts, throttling and server errors are transient, other client
     * errors are permanent.
     */
    public static boolean isTransientStatus(final int status) {
        return status == 408 || status == 429 || status >= 500;
    }

    public boolean isTransient() {
        return transientFailure;
    }

    public int getStatus() {
        return status;
    }
}
