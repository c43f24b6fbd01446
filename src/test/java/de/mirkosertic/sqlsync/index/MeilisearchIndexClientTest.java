package de.mirkosertic.sqlsync.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.handler.codec.http.HttpMethod;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("MeilisearchIndexClient Tests")
class MeilisearchIndexClientTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FakeMeilisearch fake;
    private DisposableServer server;
    private MeilisearchIndexClient client;

    @BeforeEach
    void setUp() {
        fake = new FakeMeilisearch();
        server = HttpServer.create()
                .host("localhost")
                .port(0)
                .handle((request, response) -> request.receive().aggregate().asString().defaultIfEmpty("")
                        .flatMap(body -> {
                            final FakeMeilisearch.Reply reply = fake.handle(request.method(), request.uri(), body,
                                    request.requestHeaders().get("Authorization"));
                            return response.status(reply.status())
                                    .header("Content-Type", "application/json")
                                    .sendString(Mono.just(reply.body()))
                                    .then();
                        }))
                .bindNow();
        client = newClient(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        client.close();
        server.disposeNow();
    }

    private MeilisearchIndexClient newClient(final Duration taskTimeout) {
        return new MeilisearchIndexClient("http://localhost:" + server.port() + "/", "master-key", 4,
                Duration.ofSeconds(5), taskTimeout, 5);
    }

    @Nested
    @DisplayName("Index setup")
    class SetupTests {

        @Test
        @DisplayName("Should create a missing index and apply its settings")
        void shouldCreateMissingIndex() throws Exception {
            // When
            client.setupIndex("users", "id", new IndexSettings(List.of("name", "email"), false));

            // Then
            assertThat(fake.indexes).containsEntry("users", "id");
            final JsonNode settings = MAPPER.readTree(fake.lastBody("PATCH /indexes/users/settings"));
            assertThat(settings.path("searchableAttributes").toString()).isEqualTo("[\"name\",\"email\"]");
            assertThat(settings.path("typoTolerance").path("enabled").asBoolean()).isFalse();
            assertThat(fake.requests)
                    .as("Every write waits for its task")
                    .anyMatch(request -> request.startsWith("GET /tasks/"));
            assertThat(fake.authorizations).containsOnly("Bearer master-key");
        }

        @Test
        @DisplayName("Should search all attributes when none are configured")
        void shouldSearchAllAttributesByDefault() throws Exception {
            fake.indexes.put("users", "id");

            client.setupIndex("users", "id", IndexSettings.defaults());

            final JsonNode settings = MAPPER.readTree(fake.lastBody("PATCH /indexes/users/settings"));
            assertThat(settings.path("searchableAttributes").toString()).isEqualTo("[\"*\"]");
            assertThat(fake.requests).noneMatch(request -> request.startsWith("POST /indexes "));
        }

        @Test
        @DisplayName("Should refuse an existing index with a different primary key")
        void shouldRejectPrimaryKeyMismatch() {
            fake.indexes.put("users", "email");

            assertThatThrownBy(() -> client.setupIndex("users", "id", IndexSettings.defaults()))
                    .isInstanceOfSatisfying(IndexException.class, e -> assertThat(e.isTransient()).isFalse())
                    .hasMessageContaining("email");
        }

        @Test
        @DisplayName("Should delete and create the index on recreate")
        void shouldRecreateIndex() throws Exception {
            fake.indexes.put("users", "id");

            client.recreateIndex("users", "email");

            assertThat(fake.indexes).containsEntry("users", "email");
            assertThat(fake.requests).filteredOn(request -> !request.startsWith("GET /tasks/"))
                    .extracting(request -> request.split(" ")[0] + " " + request.split(" ")[1])
                    .containsExactly("DELETE /indexes/users", "POST /indexes");
        }
    }

    @Nested
    @DisplayName("Field configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("Should leave an index that searches all attributes alone")
        void shouldSkipWildcardIndex() throws Exception {
            fake.searchableAttributes = "[\"*\"]";

            client.configureIndex("users", Set.of("age"), Set.of(), "id");

            assertThat(fake.requests).noneMatch(request -> request.startsWith("PUT "));
        }

        @Test
        @DisplayName("Should add and remove searchable attributes and keep the primary key")
        void shouldUpdateSearchableAttributes() throws Exception {
            fake.searchableAttributes = "[\"name\",\"email\"]";

            client.configureIndex("users", Set.of("city", "age"), Set.of("email"), "id");

            assertThat(fake.lastBody("PUT /indexes/users/settings/searchable-attributes"))
                    .isEqualTo("[\"name\",\"age\",\"city\",\"id\"]");
        }
    }

    @Nested
    @DisplayName("Documents")
    class DocumentTests {

        @Test
        @DisplayName("Should post documents with the primary key")
        void shouldUpsertDocuments() throws Exception {
            client.upsertBatch("users", "id", List.of(Map.of("id", 1, "name", "alice")));

            final JsonNode documents = MAPPER.readTree(fake.lastBody("POST /indexes/users/documents?primaryKey=id"));
            assertThat(documents.isArray()).isTrue();
            assertThat(documents.get(0).path("name").asText()).isEqualTo("alice");
        }

        @Test
        @DisplayName("Should delete documents by identifier")
        void shouldDeleteDocuments() throws Exception {
            client.deleteBatch("users", List.of("1", "2"));

            assertThat(fake.lastBody("POST /indexes/users/documents/delete-batch")).isEqualTo("[\"1\",\"2\"]");
        }

        @Test
        @DisplayName("Should not call the server for empty batches")
        void shouldSkipEmptyBatches() throws Exception {
            client.upsertBatch("users", "id", List.of());
            client.deleteBatch("users", List.of());

            assertThat(fake.requests).isEmpty();
        }
    }

    @Nested
    @DisplayName("Failure classification")
    class FailureTests {

        @Test
        @DisplayName("Should treat throttling and server errors as transient")
        void shouldClassifyServerErrorsAsTransient() {
            fake.documentStatus = 503;

            assertThatThrownBy(() -> client.upsertBatch("users", "id", List.of(Map.of("id", 1))))
                    .isInstanceOfSatisfying(IndexException.class, e -> {
                        assertThat(e.isTransient()).isTrue();
                        assertThat(e.getStatus()).isEqualTo(503);
                    });
        }

        @Test
        @DisplayName("Should treat rejected requests as permanent")
        void shouldClassifyClientErrorsAsPermanent() {
            fake.documentStatus = 400;

            assertThatThrownBy(() -> client.upsertBatch("users", "id", List.of(Map.of("id", 1))))
                    .isInstanceOfSatisfying(IndexException.class, e -> assertThat(e.isTransient()).isFalse());
        }

        @Test
        @DisplayName("Should classify failed tasks by their error type")
        void shouldClassifyFailedTasks() {
            fake.taskReply = "{\"status\":\"failed\",\"error\":{\"message\":\"invalid document id\","
                    + "\"type\":\"invalid_request\"}}";
            assertThatThrownBy(() -> client.upsertBatch("users", "id", List.of(Map.of("id", 1))))
                    .isInstanceOfSatisfying(IndexException.class, e -> assertThat(e.isTransient()).isFalse())
                    .hasMessageContaining("invalid document id");

            fake.taskReply = "{\"status\":\"failed\",\"error\":{\"message\":\"disk full\",\"type\":\"internal\"}}";
            assertThatThrownBy(() -> client.upsertBatch("users", "id", List.of(Map.of("id", 1))))
                    .isInstanceOfSatisfying(IndexException.class, e -> assertThat(e.isTransient()).isTrue());
        }

        @Test
        @DisplayName("Should give up waiting for a task after the task timeout")
        void shouldTimeOutWaitingForTask() {
            fake.taskReply = "{\"status\":\"processing\"}";
            final MeilisearchIndexClient impatient = newClient(Duration.ofMillis(50));
            try {
                assertThatThrownBy(() -> impatient.deleteBatch("users", List.of("1")))
                        .isInstanceOfSatisfying(IndexException.class, e -> assertThat(e.isTransient()).isTrue())
                        .hasMessageContaining("still processing");
            } finally {
                impatient.close();
            }
        }

        @Test
        @DisplayName("Should report an unreachable server as transient")
        void shouldReportUnreachableServer() {
            final int port = server.port();
            server.disposeNow();
            final MeilisearchIndexClient unreachable = new MeilisearchIndexClient("http://localhost:" + port,
                    null, 1, Duration.ofSeconds(2), Duration.ofSeconds(2), 5);
            try {
                assertThatThrownBy(() -> unreachable.deleteBatch("users", List.of("1")))
                        .isInstanceOfSatisfying(IndexException.class, e -> assertThat(e.isTransient()).isTrue());
            } finally {
                unreachable.close();
            }
        }
    }

    /**
     * Minimal in-memory imitation of the Meilisearch HTTP API.
     */
    static final class FakeMeilisearch {

        record Reply(int status, String body) {
        }

        final List<String> requests = new CopyOnWriteArrayList<>();
        final List<String> authorizations = new CopyOnWriteArrayList<>();
        final Map<String, String> indexes = new ConcurrentHashMap<>();
        final AtomicLong taskCounter = new AtomicLong();
        volatile String searchableAttributes = "[\"*\"]";
        volatile String taskReply = "{\"status\":\"succeeded\"}";
        volatile int documentStatus = 202;

        Reply handle(final HttpMethod method, final String uri, final String body, final String authorization) {
            requests.add(method.name() + " " + uri + " " + body);
            if (authorization != null) {
                authorizations.add(authorization);
            }

            if (uri.startsWith("/tasks/")) {
                return new Reply(200, taskReply);
            }
            if (HttpMethod.POST.equals(method) && "/indexes".equals(uri)) {
                try {
                    final JsonNode node = MAPPER.readTree(body);
                    indexes.put(node.path("uid").asText(), node.path("primaryKey").asText());
                } catch (final Exception e) {
                    return new Reply(400, "{\"message\":\"malformed\"}");
                }
                return task();
            }
            if (uri.contains("/documents")) {
                return documentStatus == 202 ? task() : new Reply(documentStatus, "{\"message\":\"rejected\"}");
            }
            if (uri.endsWith("/settings/searchable-attributes") && HttpMethod.GET.equals(method)) {
                return new Reply(200, searchableAttributes);
            }
            if (uri.startsWith("/indexes/") && !uri.contains("/settings")) {
                final String uid = uri.substring("/indexes/".length());
                if (HttpMethod.GET.equals(method)) {
                    final String primaryKey = indexes.get(uid);
                    return primaryKey == null
                            ? new Reply(404, "{\"code\":\"index_not_found\"}")
                            : new Reply(200, "{\"uid\":\"" + uid + "\",\"primaryKey\":\"" + primaryKey + "\"}");
                }
                if (HttpMethod.DELETE.equals(method)) {
                    return indexes.remove(uid) == null ? new Reply(404, "{\"code\":\"index_not_found\"}") : task();
                }
            }
            return task();
        }

        private Reply task() {
            return new Reply(202, "{\"taskUid\":" + taskCounter.incrementAndGet() + "}");
        }

        String lastBody(final String methodAndUri) {
            String last = null;
            for (final String request : requests) {
                if (request.startsWith(methodAndUri + " ")) {
                    last = request.substring(methodAndUri.length() + 1);
                }
            }
            assertThat(last).as("Request %s was sent", methodAndUri).isNotNull();
            return last;
        }
    }
}
