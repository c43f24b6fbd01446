package de.mirkosertic.sqlsync.sync;

import java.util.Map;

/**
 * A row fingerprint together with the document that is sent to the index.
 */
public record FingerprintedRow(
        RowFingerprint fingerprint,
        /** Index document, including the primary key field. */
        Map<String, Object> document
) {
    public NormalizedKey key() {
        return fingerprint.key();
    }
}
