package de.mirkosertic.sqlsync.sync;

import de.mirkosertic.sqlsync.config.TableConfig;
import de.mirkosertic.sqlsync.database.DatabaseAdapter;
import de.mirkosertic.sqlsync.database.DatabaseException;
import de.mirkosertic.sqlsync.index.IndexClient;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Synchronization loop of a single table.
 * <p>
 * Each {@link #tick()} runs one cycle: fetch schema and rows, classify the schema, diff the rows
 * against the last committed state, configure the index, dispatch the batches and commit. The state
 * is replaced only when every batch was delivered. A failed cycle leaves it untouched, so the next
 * cycle recomputes the same changes.
 * <p>
 * Shutdown requests are observed between phases. A dispatch that has started always runs to completion.
 */
public class TableSyncLoop {

    private static final Logger logger = LoggerFactory.getLogger(TableSyncLoop.class);
    private static final String ALL_ATTRIBUTES = "*";

    private final TableConfig table;
    private final DatabaseAdapter database;
    private final IndexClient indexClient;
    private final BatchDispatcher dispatcher;
    private final RetryingIndexCaller caller;
    private final SyncStateStore stateStore;
    private final CycleListener listener;
    private final SchemaTracker schemaTracker = new SchemaTracker();
    private final ChangeDetector changeDetector = new ChangeDetector();

    private final AtomicBoolean inFlight = new AtomicBoolean(false);
    private volatile boolean shutdownRequested = false;
    private volatile CyclePhase phase = CyclePhase.IDLE;
    private volatile TableSyncState state;

    public TableSyncLoop(final TableConfig table, final DatabaseAdapter database, final IndexClient indexClient,
                         final BatchDispatcher dispatcher, final RetryingIndexCaller caller,
                         final SyncStateStore stateStore, final CycleListener listener,
                         final TableSyncState initialState) {
        this.table = table;
        this.database = database;
        this.indexClient = indexClient;
        this.dispatcher = dispatcher;
        this.caller = caller;
        this.stateStore = stateStore;
        this.listener = listener;
        this.state = initialState;
    }

    public TableConfig getTable() {
        return table;
    }

    public CyclePhase getPhase() {
        return phase;
    }

    /**
     * The last committed state.
     */
    public TableSyncState getState() {
        return state;
    }

    /**
     * Ask the loop to stop at the next phase boundary. A cycle that is dispatching finishes first.
     */
    public void requestShutdown() {
        shutdownRequested = true;
    }

    /**
     * Run one cycle unless the previous one is still in flight.
     *
     * @return the summary of the cycle, or {@code null} if the tick was skipped
     */
    @Nullable
    public CycleSummary tick() {
        if (!inFlight.compareAndSet(false, true)) {
            logger.debug("Previous cycle of table {} still running, skipping tick", table.name());
            listener.onTickSkipped(table.name());
            return null;
        }
        try {
            final long start = System.currentTimeMillis();
            CycleSummary summary;
            try {
                summary = runCycle(start);
            } catch (final RuntimeException e) {
                // Nothing may escape a table loop, the scheduler would stop ticking it
                logger.error("Unexpected failure in cycle of table {}", table.name(), e);
                phase = CyclePhase.FAILED;
                summary = CycleSummary.failed(table.name(), table.indexName(), SchemaChange.Kind.UNCHANGED,
                        System.currentTimeMillis() - start, e.toString());
            }
            notifyListener(summary);
            return summary;
        } finally {
            // A failed cycle returns to idle once it is reported
            phase = CyclePhase.IDLE;
            inFlight.set(false);
        }
    }

    private CycleSummary runCycle(final long start) {
        if (shutdownRequested) {
            return aborted(start);
        }

        // Fetching
        phase = CyclePhase.FETCHING;
        SchemaSnapshot schema;
        final List<Map<String, Object>> rows;
        try {
            schema = database.getSchema(table.name());
            rows = database.getRows(table.name());
        } catch (final DatabaseException e) {
            if (e.isTransient()) {
                logger.warn("Cannot read table {}: {}", table.name(), e.getMessage());
            } else {
                logger.error("Cannot read table {}: {}", table.name(), e.getMessage());
            }
            return failed(start, SchemaChange.Kind.UNCHANGED, e.getMessage());
        }
        schema = schema.project(table.fieldsToIndex());
        final String configuredKey = table.primaryKey();
        if (configuredKey != null) {
            if (schema.primaryKeyColumns().isEmpty()) {
                schema = schema.withPrimaryKey(List.of(configuredKey));
            } else if (!schema.primaryKeyColumns().equals(List.of(configuredKey))) {
                final String message = "Configured primary key " + configuredKey + " of table " + table.name()
                        + " does not match the database key " + schema.primaryKeyColumns();
                logger.error(message);
                return failed(start, SchemaChange.Kind.UNCHANGED, message);
            }
        }

        if (shutdownRequested) {
            return aborted(start);
        }

        // Diffing
        phase = CyclePhase.DIFFING;
        final TableSyncState committed = state;
        final SchemaChange schemaChange = schemaTracker.classify(committed.schema(), schema);
        final RowHasher hasher;
        final List<FingerprintedRow> currentRows = new ArrayList<>(rows.size());
        try {
            hasher = RowHasher.forSchema(schema, table.maxTextLength());
            for (final Map<String, Object> row : rows) {
                final FingerprintedRow hashed = hasher.hash(row);
                if (hashed != null) {
                    currentRows.add(hashed);
                }
            }
        } catch (final UnsupportedKeyTypeException e) {
            logger.error("Cannot synchronize table {}: {}", table.name(), e.getMessage());
            return failed(start, schemaChange.kind(), e.getMessage());
        }
        final boolean fullReindex = schemaChange.requiresFullReindex();
        final Map<NormalizedKey, RowFingerprint> previous = fullReindex ? Map.of() : committed.fingerprints();
        final DiffSet diff = changeDetector.diff(previous, currentRows);

        if (shutdownRequested) {
            return aborted(start);
        }

        // Dispatching: index configuration strictly before any row batch
        phase = CyclePhase.DISPATCHING;
        final String primaryKey = hasher.primaryKeyColumn();
        if (fullReindex) {
            logger.info("Recreating index {} for table {} after {}", table.indexName(), table.name(),
                    schemaChange.kind());
            final IndexCallResult recreated = caller.call("recreate index " + table.indexName(), () -> {
                indexClient.recreateIndex(table.indexName(), primaryKey);
                indexClient.setupIndex(table.indexName(), primaryKey, table.indexSettings());
            });
            if (!recreated.isSuccess()) {
                return failed(start, schemaChange.kind(), recreated.failureMessage());
            }
        } else if (schemaChange.requiresIndexConfiguration()) {
            final IndexCallResult configured = caller.call("configure index " + table.indexName(),
                    () -> indexClient.configureIndex(table.indexName(), searchableAdditions(schemaChange),
                            schemaChange.removedColumns(), primaryKey));
            if (!configured.isSuccess()) {
                return failed(start, schemaChange.kind(), configured.failureMessage());
            }
        }

        final DispatchResult result = dispatcher.dispatch(table.indexName(), primaryKey, diff,
                table.dispatchSettings());
        if (!result.isSuccess()) {
            phase = CyclePhase.FAILED;
            final String error = result.hasPermanentFailure()
                    ? result.permanentFailure()
                    : result.failedKeys().size() + " rows could not be delivered";
            return new CycleSummary(table.name(), table.indexName(), CycleSummary.Outcome.FAILED,
                    schemaChange.kind(), result.creations().succeeded(), result.updates().succeeded(),
                    result.deletions().succeeded(), diff.unchangedCount(), System.currentTimeMillis() - start,
                    result.failedKeys(), error);
        }

        // Committing
        phase = CyclePhase.COMMITTING;
        commit(committed, schema, schemaChange, diff, currentRows);
        phase = CyclePhase.IDLE;
        return new CycleSummary(table.name(), table.indexName(), CycleSummary.Outcome.SUCCEEDED,
                schemaChange.kind(), result.creations().succeeded(), result.updates().succeeded(),
                result.deletions().succeeded(), diff.unchangedCount(), System.currentTimeMillis() - start,
                List.of(), null);
    }

    /**
     * Added columns that may become searchable. An explicit searchable attribute list limits them.
     */
    private Set<String> searchableAdditions(final SchemaChange schemaChange) {
        final List<String> searchable = table.searchableAttributes();
        if (searchable.isEmpty() || searchable.contains(ALL_ATTRIBUTES)) {
            return schemaChange.addedColumns();
        }
        final Set<String> allowed = new HashSet<>(schemaChange.addedColumns());
        allowed.retainAll(searchable);
        return allowed;
    }

    private void commit(final TableSyncState committed, final SchemaSnapshot schema, final SchemaChange schemaChange,
                        final DiffSet diff, final List<FingerprintedRow> currentRows) {
        final boolean changed = committed.isInitial() || !diff.isEmpty()
                || schemaChange.kind() != SchemaChange.Kind.UNCHANGED;

        final Map<NormalizedKey, RowFingerprint> fingerprints = new HashMap<>();
        for (final FingerprintedRow row : currentRows) {
            fingerprints.putIfAbsent(row.key(), row.fingerprint());
        }
        final long schemaVersion = schemaChange.kind() == SchemaChange.Kind.UNCHANGED
                ? committed.schemaVersion()
                : committed.schemaVersion() + 1;
        final TableSyncState next = new TableSyncState(schema, fingerprints, schemaVersion,
                System.currentTimeMillis());
        state = next;

        if (changed) {
            try {
                stateStore.save(table.name(), next);
            } catch (final IOException e) {
                // The index already holds the changes, only a restart would resend them
                logger.error("Cannot persist state of table {}", table.name(), e);
            }
        }
    }

    private CycleSummary failed(final long start, final SchemaChange.Kind schemaChange,
                                @Nullable final String error) {
        phase = CyclePhase.FAILED;
        return CycleSummary.failed(table.name(), table.indexName(), schemaChange, System.currentTimeMillis() - start,
                error == null ? "Unknown failure" : error);
    }

    private CycleSummary aborted(final long start) {
        phase = CyclePhase.IDLE;
        logger.info("Cycle of table {} aborted by shutdown", table.name());
        return CycleSummary.aborted(table.name(), table.indexName(), System.currentTimeMillis() - start);
    }

    private void notifyListener(final CycleSummary summary) {
        switch (summary.outcome()) {
            case SUCCEEDED:
                if (summary.changeCount() > 0 || summary.schemaChange() != SchemaChange.Kind.UNCHANGED) {
                    logger.info("Table {} synchronized in {}ms: {} created, {} updated, {} deleted, {} unchanged"
                                    + " (schema: {})", summary.table(), summary.durationMs(), summary.created(),
                            summary.updated(), summary.deleted(), summary.unchanged(), summary.schemaChange());
                } else {
                    logger.debug("Table {} unchanged ({} rows)", summary.table(), summary.unchanged());
                }
                break;
            case FAILED:
                logger.warn("Cycle of table {} failed after {}ms: {}", summary.table(), summary.durationMs(),
                        summary.error());
                break;
            default:
                break;
        }
        try {
            listener.onCycleCompleted(summary);
        } catch (final RuntimeException e) {
            logger.error("Cycle listener failed for table {}", table.name(), e);
        }
    }
}
