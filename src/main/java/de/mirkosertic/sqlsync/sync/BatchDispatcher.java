package de.mirkosertic.sqlsync.sync;

import de.mirkosertic.sqlsync.index.IndexClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Pushes a {@link DiffSet} to the index in bounded batches.
 * <p>
 * Creations, updates and deletions are split into separate batches; creations and updates become
 * upsert calls, deletions become delete calls. At most {@code maxConcurrency} worker slots take
 * batches from a shared queue, so no more than that many calls are in flight. Each slot pauses
 * {@code interBatchDelayMs} between its submissions.
 * <p>
 * A batch whose transient failures exhaust the retry budget is counted as failed while the other
 * batches continue. A permanent failure stops all slots from starting further batches.
 */
public class BatchDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(BatchDispatcher.class);

    enum Category {
        CREATE,
        UPDATE,
        DELETE
    }

    record Batch(Category category, List<NormalizedKey> keys, List<Map<String, Object>> documents) {

        int size() {
            return keys.size();
        }
    }

    private final IndexClient indexClient;
    private final SyncExecutorService executor;
    private final RetryingIndexCaller caller;
    private final Sleeper sleeper;

    public BatchDispatcher(final IndexClient indexClient, final SyncExecutorService executor,
                           final RetryingIndexCaller caller, final Sleeper sleeper) {
        this.indexClient = indexClient;
        this.executor = executor;
        this.caller = caller;
        this.sleeper = sleeper;
    }

    /**
     * Dispatch all changes of a diff set and wait until every batch has completed.
     *
     * @param index      target index name
     * @param primaryKey name of the primary key field in the documents
     */
    public DispatchResult dispatch(final String index, final String primaryKey, final DiffSet diff,
                                   final DispatchSettings settings) {
        if (diff.isEmpty()) {
            return DispatchResult.empty();
        }

        final List<Batch> batches = new ArrayList<>();
        batches.addAll(partitionRows(Category.CREATE, diff.creations(), settings.batchSize()));
        batches.addAll(partitionRows(Category.UPDATE, diff.updates(), settings.batchSize()));
        batches.addAll(partitionKeys(diff.deletions(), settings.deleteBatchSize()));

        final Queue<Batch> pending = new ConcurrentLinkedQueue<>(batches);
        final Tally tally = new Tally();
        final AtomicBoolean aborted = new AtomicBoolean(false);
        final int slots = Math.min(settings.maxConcurrency(), batches.size());

        logger.debug("Dispatching {} batches to index {} with {} worker slots", batches.size(), index, slots);

        final List<Future<?>> workers = new ArrayList<>(slots);
        for (int slot = 0; slot < slots; slot++) {
            workers.add(executor.submit(
                    () -> runSlot(index, primaryKey, pending, tally, aborted, settings.interBatchDelayMs())));
        }

        for (final Future<?> worker : workers) {
            try {
                awaitUninterruptibly(worker);
            } catch (final ExecutionException e) {
                logger.error("Dispatch worker for index {} failed", index, e.getCause());
                tally.permanentFailure("Dispatch worker failed: " + e.getCause());
            }
        }

        // Batches left behind by a worker that died are not delivered
        Batch leftover;
        while ((leftover = pending.poll()) != null) {
            tally.record(leftover, IndexCallResult.skipped());
        }

        final DispatchResult result = tally.toResult(batches.size());
        if (!result.isSuccess()) {
            logger.warn("Dispatch to index {} incomplete: {} failed keys, permanent failure: {}", index,
                    result.failedKeys().size(), result.permanentFailure());
        }
        return result;
    }

    private void runSlot(final String index, final String primaryKey, final Queue<Batch> pending,
                         final Tally tally, final AtomicBoolean aborted, final long interBatchDelayMs) {
        boolean first = true;
        Batch batch;
        while ((batch = pending.poll()) != null) {
            if (aborted.get()) {
                tally.record(batch, IndexCallResult.skipped());
                continue;
            }
            if (!first && interBatchDelayMs > 0) {
                try {
                    sleeper.sleep(interBatchDelayMs);
                } catch (final InterruptedException e) {
                    // Finish the remaining batches without throttling
                    Thread.currentThread().interrupt();
                }
            }
            first = false;

            final IndexCallResult result = send(index, primaryKey, batch);
            tally.record(batch, result);
            if (result.status() == IndexCallResult.Status.FAILED_PERMANENT) {
                aborted.set(true);
            }
        }
    }

    private IndexCallResult send(final String index, final String primaryKey, final Batch batch) {
        final String description = batch.category() + " batch of " + batch.size() + " for index " + index;
        if (batch.category() == Category.DELETE) {
            final List<String> documentIds = new ArrayList<>(batch.size());
            for (final NormalizedKey key : batch.keys()) {
                documentIds.add(key.toDocumentId());
            }
            return caller.call(description, () -> indexClient.deleteBatch(index, documentIds));
        }
        return caller.call(description, () -> indexClient.upsertBatch(index, primaryKey, batch.documents()));
    }

    static List<Batch> partitionRows(final Category category, final List<FingerprintedRow> rows,
                                     final int batchSize) {
        final List<Batch> batches = new ArrayList<>();
        for (int start = 0; start < rows.size(); start += batchSize) {
            final List<FingerprintedRow> slice = rows.subList(start, Math.min(rows.size(), start + batchSize));
            final List<NormalizedKey> keys = new ArrayList<>(slice.size());
            final List<Map<String, Object>> documents = new ArrayList<>(slice.size());
            for (final FingerprintedRow row : slice) {
                keys.add(row.key());
                documents.add(row.document());
            }
            batches.add(new Batch(category, keys, documents));
        }
        return batches;
    }

    static List<Batch> partitionKeys(final Collection<NormalizedKey> keys, final int batchSize) {
        final List<NormalizedKey> sorted = new ArrayList<>(keys);
        sorted.sort(null);
        final List<Batch> batches = new ArrayList<>();
        for (int start = 0; start < sorted.size(); start += batchSize) {
            final List<NormalizedKey> slice = new ArrayList<>(
                    sorted.subList(start, Math.min(sorted.size(), start + batchSize)));
            batches.add(new Batch(Category.DELETE, slice, List.of()));
        }
        return batches;
    }

    /**
     * Workers always run to completion and record their outcomes, so an interrupt only postpones
     * the wait and is restored afterwards.
     */
    private static void awaitUninterruptibly(final Future<?> worker) throws ExecutionException {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    worker.get();
                    return;
                } catch (final InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Thread-safe accumulator for batch outcomes.
     */
    private static final class Tally {

        private final Map<Category, LongAdder> succeeded = Map.of(
                Category.CREATE, new LongAdder(), Category.UPDATE, new LongAdder(), Category.DELETE, new LongAdder());
        private final Map<Category, LongAdder> failed = Map.of(
                Category.CREATE, new LongAdder(), Category.UPDATE, new LongAdder(), Category.DELETE, new LongAdder());
        private final Queue<NormalizedKey> failedKeys = new ConcurrentLinkedQueue<>();
        private final AtomicReference<String> permanentFailure = new AtomicReference<>();

        void record(final Batch batch, final IndexCallResult result) {
            if (result.isSuccess()) {
                succeeded.get(batch.category()).add(batch.size());
                return;
            }
            failed.get(batch.category()).add(batch.size());
            failedKeys.addAll(batch.keys());
            if (result.status() == IndexCallResult.Status.FAILED_PERMANENT) {
                permanentFailure(result.failureMessage());
            }
        }

        void permanentFailure(final String message) {
            permanentFailure.compareAndSet(null, message == null ? "unknown failure" : message);
        }

        DispatchResult toResult(final int batchCount) {
            final List<NormalizedKey> keys = new ArrayList<>(failedKeys);
            keys.sort(null);
            return new DispatchResult(
                    count(Category.CREATE),
                    count(Category.UPDATE),
                    count(Category.DELETE),
                    batchCount,
                    keys,
                    permanentFailure.get());
        }

        private DispatchResult.CategoryCount count(final Category category) {
            return new DispatchResult.CategoryCount(succeeded.get(category).sum(), failed.get(category).sum());
        }
    }
}
