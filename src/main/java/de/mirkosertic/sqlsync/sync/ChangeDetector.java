package de.mirkosertic.sqlsync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the diff between the last synchronized state of a table and its current rows.
 * <p>
 * Algorithm:
 * <ol>
 *   <li>Every current key missing from the previous state is a creation.</li>
 *   <li>Every current key with a different content hash is an update.</li>
 *   <li>Every previous key missing from the current rows is a deletion.</li>
 *   <li>Everything else is unchanged and is not sent again.</li>
 * </ol>
 * Only the previous fingerprints and the current rows are read, so the result depends on nothing else.
 */
public class ChangeDetector {

    private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

    /**
     * @param previousState fingerprints of the last successful cycle, empty for an initial load or a full
     *                      reindex
     * @param currentRows   all current rows of the table
     * @return the diff; never null
     */
    public DiffSet diff(final Map<NormalizedKey, RowFingerprint> previousState,
                        final Collection<FingerprintedRow> currentRows) {

        final long startTime = System.currentTimeMillis();

        final List<FingerprintedRow> creations = new ArrayList<>();
        final List<FingerprintedRow> updates = new ArrayList<>();
        final Set<NormalizedKey> seen = new HashSet<>();
        int unchangedCount = 0;

        for (final FingerprintedRow row : currentRows) {
            final NormalizedKey key = row.key();
            if (!seen.add(key)) {
                logger.warn("Duplicate primary key {} in current rows, keeping the first occurrence", key);
                continue;
            }
            final RowFingerprint previous = previousState.get(key);
            if (previous == null) {
                creations.add(row);
            } else if (!previous.contentHash().equals(row.fingerprint().contentHash())) {
                updates.add(row);
            } else {
                unchangedCount++;
            }
        }

        final Set<NormalizedKey> deletions = new HashSet<>();
        for (final NormalizedKey previousKey : previousState.keySet()) {
            if (!seen.contains(previousKey)) {
                deletions.add(previousKey);
            }
        }

        final long diffTimeMs = System.currentTimeMillis() - startTime;

        logger.debug("Diff computed in {}ms: create={}, update={}, delete={}, unchanged={}",
                diffTimeMs, creations.size(), updates.size(), deletions.size(), unchangedCount);

        return new DiffSet(creations, updates, deletions, unchangedCount, diffTimeMs);
    }
}
