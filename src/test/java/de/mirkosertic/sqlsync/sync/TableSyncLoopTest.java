package de.mirkosertic.sqlsync.sync;

import de.mirkosertic.sqlsync.config.TableConfig;
import de.mirkosertic.sqlsync.database.DatabaseAdapter;
import de.mirkosertic.sqlsync.database.DatabaseConnectionException;
import de.mirkosertic.sqlsync.index.IndexClient;
import de.mirkosertic.sqlsync.index.IndexException;
import de.mirkosertic.sqlsync.index.IndexSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static de.mirkosertic.sqlsync.sync.SyncTestData.row;
import static de.mirkosertic.sqlsync.sync.SyncTestData.schema;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("TableSyncLoop Tests")
class TableSyncLoopTest {

    private static final SchemaSnapshot USERS = schema("id", "id", "INTEGER", "name", "TEXT", "email", "TEXT");

    @TempDir
    Path stateDir;

    private DatabaseAdapter database;
    private IndexClient indexClient;
    private SyncExecutorService executor;
    private SyncStateStore stateStore;
    private RecordingListener listener;
    private TableSyncLoop loop;

    @BeforeEach
    void setUp() {
        database = mock(DatabaseAdapter.class);
        indexClient = mock(IndexClient.class);
        executor = new SyncExecutorService("loop-test", 2, 5);
        stateStore = new SyncStateStore(stateDir);
        listener = new RecordingListener();
        loop = newLoop(table(null));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private static TableConfig table(final String primaryKey) {
        return new TableConfig("users", "users-index", primaryKey, List.of(), List.of(), true,
                60, 100, 100, 2, 0, 0);
    }

    private TableSyncLoop newLoop(final TableConfig table) {
        final RetryingIndexCaller caller = new RetryingIndexCaller(new RetryPolicy(2, 1, 2), millis -> { },
                new Random(5));
        final BatchDispatcher dispatcher = new BatchDispatcher(indexClient, executor, caller, millis -> { });
        return new TableSyncLoop(table, database, indexClient, dispatcher, caller, stateStore, listener,
                stateStore.load(table.name()));
    }

    private void givenTable(final SchemaSnapshot schema, final List<Map<String, Object>> rows) throws Exception {
        when(database.getSchema("users")).thenReturn(schema);
        when(database.getRows("users")).thenReturn(rows);
    }

    private static List<Map<String, Object>> threeUsers() {
        return List.of(
                row("id", 1, "name", "alice", "email", "a@example.com"),
                row("id", 2, "name", "bob", "email", "b@example.com"),
                row("id", 3, "name", "carol", "email", "c@example.com"));
    }

    @Nested
    @DisplayName("Row changes")
    class RowChangeTests {

        @Test
        @DisplayName("Should send every row on the initial load and persist the state")
        @SuppressWarnings("unchecked")
        void shouldLoadInitially() throws Exception {
            // Given
            givenTable(USERS, threeUsers());

            // When
            final CycleSummary summary = loop.tick();

            // Then
            assertThat(summary).isNotNull();
            assertThat(summary.outcome()).isEqualTo(CycleSummary.Outcome.SUCCEEDED);
            assertThat(summary.created()).isEqualTo(3);

            final ArgumentCaptor<List<Map<String, Object>>> documents = ArgumentCaptor.forClass(List.class);
            verify(indexClient).upsertBatch(eq("users-index"), eq("id"), documents.capture());
            assertThat(documents.getValue()).extracting(document -> document.get("id"))
                    .containsExactly(1L, 2L, 3L);

            assertThat(loop.getState().fingerprints()).hasSize(3);
            assertThat(loop.getPhase()).isEqualTo(CyclePhase.IDLE);
            assertThat(Files.exists(stateStore.statePath("users"))).isTrue();
            assertThat(listener.completed).containsExactly(summary);
        }

        @Test
        @DisplayName("Should not call the index when nothing changed")
        void shouldBeIdempotent() throws Exception {
            givenTable(USERS, threeUsers());
            loop.tick();
            clearInvocations(indexClient);

            final CycleSummary second = loop.tick();

            assertThat(second.outcome()).isEqualTo(CycleSummary.Outcome.SUCCEEDED);
            assertThat(second.changeCount()).isZero();
            assertThat(second.unchanged()).isEqualTo(3);
            verifyNoInteractions(indexClient);
        }

        @Test
        @DisplayName("Should send updates and deletions only")
        void shouldSendOnlyChanges() throws Exception {
            // Given
            givenTable(USERS, threeUsers());
            loop.tick();
            clearInvocations(indexClient);

            // When: bob changes, carol is deleted
            when(database.getRows("users")).thenReturn(List.of(
                    row("id", 1, "name", "alice", "email", "a@example.com"),
                    row("id", 2, "name", "bob", "email", "bob@example.com")));
            final CycleSummary summary = loop.tick();

            // Then
            assertThat(summary.updated()).isEqualTo(1);
            assertThat(summary.deleted()).isEqualTo(1);
            assertThat(summary.unchanged()).isEqualTo(1);
            verify(indexClient).deleteBatch("users-index", List.of("3"));
            assertThat(loop.getState().fingerprints()).containsOnlyKeys(NormalizedKey.ofLong(1),
                    NormalizedKey.ofLong(2));
        }

        @Test
        @DisplayName("Should resume from the persisted state after a restart")
        void shouldResumeFromPersistedState() throws Exception {
            givenTable(USERS, threeUsers());
            loop.tick();
            clearInvocations(indexClient);

            final TableSyncLoop restarted = newLoop(table(null));
            final CycleSummary summary = restarted.tick();

            assertThat(summary.changeCount()).isZero();
            verifyNoInteractions(indexClient);
        }
    }

    @Nested
    @DisplayName("Schema changes")
    class SchemaChangeTests {

        @Test
        @DisplayName("Should configure the index before sending rows when a column is added")
        void shouldConfigureBeforeRowsOnColumnAdded() throws Exception {
            // Given
            givenTable(USERS, threeUsers());
            loop.tick();
            clearInvocations(indexClient);

            // When: a nullable column appears, filled in for one row
            final SchemaSnapshot withAge = schema("id", "id", "INTEGER", "name", "TEXT", "email", "TEXT",
                    "age", "INTEGER");
            givenTable(withAge, List.of(
                    row("id", 1, "name", "alice", "email", "a@example.com", "age", 30),
                    row("id", 2, "name", "bob", "email", "b@example.com", "age", null),
                    row("id", 3, "name", "carol", "email", "c@example.com", "age", null)));
            final CycleSummary summary = loop.tick();

            // Then
            final InOrder order = inOrder(indexClient);
            order.verify(indexClient).configureIndex("users-index", Set.of("age"), Set.of(), "id");
            order.verify(indexClient).upsertBatch(eq("users-index"), eq("id"), anyList());

            assertThat(summary.schemaChange()).isEqualTo(SchemaChange.Kind.COLUMNS_ADDED);
            assertThat(summary.updated())
                    .as("Rows without a value in the new column keep their fingerprint")
                    .isEqualTo(1);
            assertThat(summary.unchanged()).isEqualTo(2);
            assertThat(loop.getState().schemaVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should recreate the index and resend every row when the primary key changes")
        void shouldRecreateIndexOnPrimaryKeyChange() throws Exception {
            // Given
            givenTable(USERS, threeUsers());
            loop.tick();
            clearInvocations(indexClient);

            // When
            givenTable(schema("email", "id", "INTEGER", "name", "TEXT", "email", "TEXT"), threeUsers());
            final CycleSummary summary = loop.tick();

            // Then
            final InOrder order = inOrder(indexClient);
            order.verify(indexClient).recreateIndex("users-index", "email");
            order.verify(indexClient).setupIndex(eq("users-index"), eq("email"), any(IndexSettings.class));
            order.verify(indexClient).upsertBatch(eq("users-index"), eq("email"), anyList());
            verify(indexClient, never()).deleteBatch(anyString(), anyCollection());

            assertThat(summary.schemaChange()).isEqualTo(SchemaChange.Kind.PRIMARY_KEY_CHANGED);
            assertThat(summary.created()).isEqualTo(3);
            assertThat(summary.deleted()).isZero();
            assertThat(loop.getState().fingerprints()).containsOnlyKeys(NormalizedKey.ofText("a@example.com"),
                    NormalizedKey.ofText("b@example.com"), NormalizedKey.ofText("c@example.com"));
        }

        @Test
        @DisplayName("Should configure the index before sending rows when a column is removed")
        void shouldConfigureBeforeRowsOnColumnRemoved() throws Exception {
            // Given
            givenTable(USERS, threeUsers());
            loop.tick();
            clearInvocations(indexClient);

            // When
            givenTable(schema("id", "id", "INTEGER", "name", "TEXT"), List.of(
                    row("id", 1, "name", "alice"),
                    row("id", 2, "name", "bob"),
                    row("id", 3, "name", "carol")));
            final CycleSummary summary = loop.tick();

            // Then
            final InOrder order = inOrder(indexClient);
            order.verify(indexClient).configureIndex("users-index", Set.of(), Set.of("email"), "id");
            order.verify(indexClient).upsertBatch(eq("users-index"), eq("id"), anyList());
            verify(indexClient, never()).recreateIndex(anyString(), anyString());

            assertThat(summary.schemaChange()).isEqualTo(SchemaChange.Kind.COLUMNS_REMOVED);
            assertThat(summary.updated()).isEqualTo(3);
            assertThat(summary.created()).isZero();
            assertThat(summary.deleted()).isZero();
        }

        @Test
        @DisplayName("Should only add configured searchable attributes when columns are added")
        void shouldRespectConfiguredSearchableAttributes() throws Exception {
            // Given
            final TableSyncLoop restricted = newLoop(new TableConfig("users", "users-index", null, List.of(),
                    List.of("name", "bio"), true, 60, 100, 100, 2, 0, 0));
            givenTable(USERS, threeUsers());
            restricted.tick();
            clearInvocations(indexClient);

            // When
            givenTable(schema("id", "id", "INTEGER", "name", "TEXT", "email", "TEXT", "bio", "TEXT",
                    "age", "INTEGER"), threeUsers());
            restricted.tick();

            // Then
            verify(indexClient).configureIndex("users-index", Set.of("bio"), Set.of(), "id");
        }

        @Test
        @DisplayName("Should recreate the index and resend every row when a column type changes")
        void shouldRecreateIndexOnTypeChange() throws Exception {
            // Given
            givenTable(USERS, threeUsers());
            loop.tick();
            clearInvocations(indexClient);

            // When
            givenTable(schema("id", "id", "INTEGER", "name", "VARCHAR(100)", "email", "TEXT"), threeUsers());
            final CycleSummary summary = loop.tick();

            // Then
            final InOrder order = inOrder(indexClient);
            order.verify(indexClient).recreateIndex("users-index", "id");
            order.verify(indexClient).setupIndex(eq("users-index"), eq("id"), any(IndexSettings.class));
            order.verify(indexClient).upsertBatch(eq("users-index"), eq("id"), anyList());
            verify(indexClient, never()).deleteBatch(anyString(), anyCollection());
            verify(indexClient, never()).configureIndex(anyString(), any(), any(), anyString());

            assertThat(summary.schemaChange()).isEqualTo(SchemaChange.Kind.TYPES_CHANGED);
            assertThat(summary.created()).isEqualTo(3);
            assertThat(summary.updated()).isZero();
            assertThat(summary.deleted()).isZero();
            assertThat(summary.unchanged()).isZero();
            assertThat(loop.getState().schemaVersion()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should fail when the configured primary key differs from the database key")
        void shouldFailOnPrimaryKeyMismatch() throws Exception {
            final TableSyncLoop configured = newLoop(table("email"));
            givenTable(USERS, threeUsers());

            final CycleSummary summary = configured.tick();

            assertThat(summary.outcome()).isEqualTo(CycleSummary.Outcome.FAILED);
            assertThat(summary.error()).contains("email");
            verifyNoInteractions(indexClient);
        }

        @Test
        @DisplayName("Should use the configured primary key when the database reports none")
        void shouldUseConfiguredPrimaryKey() throws Exception {
            final TableSyncLoop configured = newLoop(table("id"));
            givenTable(schema(null, "id", "INTEGER", "name", "TEXT", "email", "TEXT"), threeUsers());

            final CycleSummary summary = configured.tick();

            assertThat(summary.outcome()).isEqualTo(CycleSummary.Outcome.SUCCEEDED);
            assertThat(summary.created()).isEqualTo(3);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should keep the committed state when a batch fails and resend on the next cycle")
        void shouldKeepStateOnDispatchFailure() throws Exception {
            // Given
            givenTable(USERS, threeUsers());
            loop.tick();
            final TableSyncState committed = loop.getState();
            when(database.getRows("users")).thenReturn(List.of(
                    row("id", 1, "name", "alice", "email", "a@example.com"),
                    row("id", 2, "name", "bob", "email", "b@example.com"),
                    row("id", 3, "name", "carol", "email", "c@example.com"),
                    row("id", 4, "name", "dave", "email", "d@example.com")));
            doThrow(IndexException.permanentFailure(400, "invalid document"))
                    .when(indexClient).upsertBatch(eq("users-index"), eq("id"), anyList());

            // When
            final CycleSummary failed = loop.tick();

            // Then
            assertThat(failed.outcome()).isEqualTo(CycleSummary.Outcome.FAILED);
            assertThat(failed.failedKeys()).containsExactly(NormalizedKey.ofLong(4));
            assertThat(loop.getState()).isSameAs(committed);
            assertThat(loop.getPhase())
                    .as("A failed cycle returns to idle")
                    .isEqualTo(CyclePhase.IDLE);

            // When the index recovers
            doNothing().when(indexClient).upsertBatch(eq("users-index"), eq("id"), anyList());
            final CycleSummary retried = loop.tick();

            // Then
            assertThat(retried.outcome()).isEqualTo(CycleSummary.Outcome.SUCCEEDED);
            assertThat(retried.created()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should fail the cycle without index calls when the database is unavailable")
        void shouldFailOnDatabaseError() throws Exception {
            when(database.getSchema("users")).thenThrow(new DatabaseConnectionException("connection refused"));

            final CycleSummary summary = loop.tick();

            assertThat(summary.outcome()).isEqualTo(CycleSummary.Outcome.FAILED);
            assertThat(summary.error()).contains("connection refused");
            assertThat(loop.getState().isInitial()).isTrue();
            verifyNoInteractions(indexClient);
        }

        @Test
        @DisplayName("Should fail when the index cannot be configured")
        void shouldFailWhenConfigurationFails() throws Exception {
            givenTable(USERS, threeUsers());
            loop.tick();
            doThrow(IndexException.permanentFailure(400, "invalid attribute"))
                    .when(indexClient).configureIndex(anyString(), any(), any(), anyString());
            clearInvocations(indexClient);

            givenTable(schema("id", "id", "INTEGER", "name", "TEXT"), List.of(row("id", 1, "name", "alice")));
            final CycleSummary summary = loop.tick();

            assertThat(summary.outcome()).isEqualTo(CycleSummary.Outcome.FAILED);
            assertThat(summary.schemaChange()).isEqualTo(SchemaChange.Kind.COLUMNS_REMOVED);
            verify(indexClient, never()).upsertBatch(anyString(), anyString(), anyList());
            verify(indexClient, never()).deleteBatch(anyString(), anyCollection());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Should skip a tick while the previous cycle is still running")
        void shouldSkipTickWhileInFlight() throws Exception {
            // Given: the first cycle blocks while fetching
            final CountDownLatch entered = new CountDownLatch(1);
            final CountDownLatch release = new CountDownLatch(1);
            when(database.getSchema("users")).thenAnswer(invocation -> {
                entered.countDown();
                release.await(10, TimeUnit.SECONDS);
                return USERS;
            });
            when(database.getRows("users")).thenReturn(threeUsers());
            final AtomicReference<CycleSummary> first = new AtomicReference<>();
            final Thread running = new Thread(() -> first.set(loop.tick()), "first-cycle");
            running.start();
            assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

            // When
            final CycleSummary skipped = loop.tick();
            release.countDown();
            running.join(10_000);

            // Then
            assertThat(skipped).isNull();
            assertThat(listener.skipped).containsExactly("users");
            assertThat(first.get().outcome()).isEqualTo(CycleSummary.Outcome.SUCCEEDED);
        }

        @Test
        @DisplayName("Should abort without touching database or index after shutdown was requested")
        void shouldAbortAfterShutdownRequest() {
            loop.requestShutdown();

            final CycleSummary summary = loop.tick();

            assertThat(summary.outcome()).isEqualTo(CycleSummary.Outcome.ABORTED);
            verifyNoInteractions(database, indexClient);
        }

        @Test
        @DisplayName("Should finish and commit a dispatch during which shutdown was requested")
        void shouldFinishDispatchDespiteShutdownRequest() throws Exception {
            // Given: shutdown arrives while the first batch is being delivered
            givenTable(USERS, threeUsers());
            doAnswer(invocation -> {
                loop.requestShutdown();
                return null;
            }).when(indexClient).upsertBatch(eq("users-index"), eq("id"), anyList());

            // When
            final CycleSummary summary = loop.tick();

            // Then
            assertThat(summary.outcome()).isEqualTo(CycleSummary.Outcome.SUCCEEDED);
            assertThat(summary.created()).isEqualTo(3);
            assertThat(loop.getState().fingerprints()).hasSize(3);
            assertThat(Files.exists(stateStore.statePath("users"))).isTrue();

            // The next cycle observes the request
            assertThat(loop.tick().outcome()).isEqualTo(CycleSummary.Outcome.ABORTED);
        }

        @Test
        @DisplayName("Should survive a failing listener")
        void shouldSurviveFailingListener() throws Exception {
            givenTable(USERS, threeUsers());
            final TableSyncLoop withBadListener = new TableSyncLoop(table(null), database, indexClient,
                    new BatchDispatcher(indexClient, executor,
                            new RetryingIndexCaller(new RetryPolicy(1, 0, 0), millis -> { }, new Random()),
                            millis -> { }),
                    new RetryingIndexCaller(new RetryPolicy(1, 0, 0), millis -> { }, new Random()),
                    SyncStateStore.disabled(), completed -> {
                        throw new IllegalStateException("listener broken");
                    }, TableSyncState.empty());

            final CycleSummary summary = withBadListener.tick();

            assertThat(summary.outcome()).isEqualTo(CycleSummary.Outcome.SUCCEEDED);
        }
    }

    private static final class RecordingListener implements CycleListener {

        final List<CycleSummary> completed = new CopyOnWriteArrayList<>();
        final List<String> skipped = new CopyOnWriteArrayList<>();

        @Override
        public void onCycleCompleted(final CycleSummary summary) {
            completed.add(summary);
        }

        @Override
        public void onTickSkipped(final String table) {
            skipped.add(table);
        }
    }
}
