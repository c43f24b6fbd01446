package de.mirkosertic.sqlsync.sync;

/**
 * Identity and content hash of one synchronized row.
 */
public record RowFingerprint(
        /** The normalized primary key of the row. */
        NormalizedKey key,
        /** Hex encoded SHA-256 over the canonical encoding of all indexed non-key fields. */
        String contentHash
) {
}
