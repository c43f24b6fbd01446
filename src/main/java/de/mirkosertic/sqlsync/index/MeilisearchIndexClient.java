package de.mirkosertic.sqlsync.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.ByteBufFlux;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Index backend talking to a Meilisearch server over its HTTP API.
 * <p>
 * Meilisearch processes writes asynchronously: every write returns a task identifier. The client polls
 * the task until it succeeded or failed, so every operation has completed when the method returns.
 */
public class MeilisearchIndexClient implements IndexClient {

    private static final Logger logger = LoggerFactory.getLogger(MeilisearchIndexClient.class);

    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final String ALL_ATTRIBUTES = "*";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ConnectionProvider connectionProvider;
    private final HttpClient client;
    private final Duration requestTimeout;
    private final Duration taskTimeout;
    private final long taskPollIntervalMs;

    /**
     * Result of one HTTP exchange.
     */
    record Response(int status, String body) {
        boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }

    public MeilisearchIndexClient(final String host, @Nullable final String apiKey, final int maxConnections,
                                  final Duration requestTimeout, final Duration taskTimeout,
                                  final long taskPollIntervalMs) {
        this.connectionProvider = ConnectionProvider.create("meilisearch", maxConnections);
        this.requestTimeout = requestTimeout;
        this.taskTimeout = taskTimeout;
        this.taskPollIntervalMs = taskPollIntervalMs;
        this.client = HttpClient.create(connectionProvider)
                .baseUrl(stripTrailingSlash(host))
                .responseTimeout(requestTimeout)
                .keepAlive(true)
                .headers(headers -> {
                    if (apiKey != null && !apiKey.isBlank()) {
                        headers.add(HttpHeaderNames.AUTHORIZATION, "Bearer " + apiKey);
                    }
                });
        logger.info("Meilisearch client created for {}", host);
    }

    private static String stripTrailingSlash(final String host) {
        return host.endsWith("/") ? host.substring(0, host.length() - 1) : host;
    }

    @Override
    public void setupIndex(final String index, final String primaryKey, final IndexSettings settings)
            throws IndexException {
        final Response existing = request(HttpMethod.GET, indexPath(index), null);
        if (existing.status() == 404) {
            createIndex(index, primaryKey);
        } else {
            ensureSuccess("get index " + index, existing);
            final JsonNode configured = parse(existing.body()).path("primaryKey");
            if (!configured.isNull() && !configured.isMissingNode() && !configured.asText().equals(primaryKey)) {
                throw IndexException.permanentFailure(IndexException.NO_STATUS, "Index " + index
                        + " uses primary key " + configured.asText() + " but " + primaryKey + " was requested");
            }
        }

        final ObjectNode body = objectMapper.createObjectNode();
        final ArrayNode searchable = body.putArray("searchableAttributes");
        if (settings.searchableAttributes().isEmpty()) {
            searchable.add(ALL_ATTRIBUTES);
        } else {
            settings.searchableAttributes().forEach(searchable::add);
        }
        body.putObject("typoTolerance").put("enabled", settings.typoToleranceEnabled());
        awaitTask("update settings of " + index,
                request(HttpMethod.PATCH, indexPath(index) + "/settings", write(body)));
        logger.info("Index {} set up with primary key {}", index, primaryKey);
    }

    @Override
    public void configureIndex(final String index, final Set<String> fieldsToAdd, final Set<String> fieldsToRemove,
                               final String primaryKey) throws IndexException {
        final String path = indexPath(index) + "/settings/searchable-attributes";
        final Response current = request(HttpMethod.GET, path, null);
        ensureSuccess("get searchable attributes of " + index, current);

        final Set<String> attributes = new LinkedHashSet<>();
        parse(current.body()).forEach(node -> attributes.add(node.asText()));
        if (attributes.contains(ALL_ATTRIBUTES)) {
            // New fields are searchable automatically, removed fields disappear with the re-sent documents
            logger.debug("Index {} searches all attributes, no reconfiguration needed", index);
            return;
        }
        attributes.addAll(new TreeSet<>(fieldsToAdd));
        attributes.removeAll(fieldsToRemove);
        attributes.add(primaryKey);

        final ArrayNode body = objectMapper.createArrayNode();
        attributes.forEach(body::add);
        awaitTask("update searchable attributes of " + index, request(HttpMethod.PUT, path, write(body)));
        logger.info("Index {} fields reconfigured: added={}, removed={}", index, fieldsToAdd, fieldsToRemove);
    }

    @Override
    public void upsertBatch(final String index, final String primaryKey, final List<Map<String, Object>> documents)
            throws IndexException {
        if (documents.isEmpty()) {
            return;
        }
        final String path = indexPath(index) + "/documents?primaryKey="
                + URLEncoder.encode(primaryKey, StandardCharsets.UTF_8);
        final String body;
        try {
            body = objectMapper.writeValueAsString(documents);
        } catch (final JsonProcessingException e) {
            throw IndexException.permanentFailure(IndexException.NO_STATUS,
                    "Cannot serialize documents for " + index + ": " + e.getMessage(), e);
        }
        awaitTask("upsert " + documents.size() + " documents into " + index, request(HttpMethod.POST, path, body));
    }

    @Override
    public void deleteBatch(final String index, final Collection<String> documentIds) throws IndexException {
        if (documentIds.isEmpty()) {
            return;
        }
        final ArrayNode body = objectMapper.createArrayNode();
        documentIds.forEach(body::add);
        awaitTask("delete " + documentIds.size() + " documents from " + index,
                request(HttpMethod.POST, indexPath(index) + "/documents/delete-batch", write(body)));
    }

    @Override
    public void recreateIndex(final String index, final String primaryKey) throws IndexException {
        final Response deleted = request(HttpMethod.DELETE, indexPath(index), null);
        if (deleted.status() != 404) {
            awaitTask("delete index " + index, deleted);
        }
        createIndex(index, primaryKey);
        logger.info("Index {} recreated with primary key {}", index, primaryKey);
    }

    private void createIndex(final String index, final String primaryKey) throws IndexException {
        final ObjectNode body = objectMapper.createObjectNode();
        body.put("uid", index);
        body.put("primaryKey", primaryKey);
        awaitTask("create index " + index, request(HttpMethod.POST, "/indexes", write(body)));
        logger.info("Created index {} with primary key {}", index, primaryKey);
    }

    private static String indexPath(final String index) {
        return "/indexes/" + URLEncoder.encode(index, StandardCharsets.UTF_8);
    }

    Response request(final HttpMethod method, final String path, @Nullable final String body) throws IndexException {
        try {
            final HttpClient.RequestSender sender = client
                    .headers(headers -> {
                        if (body != null) {
                            headers.set(HttpHeaderNames.CONTENT_TYPE, JSON_CONTENT_TYPE);
                        }
                    })
                    .request(method)
                    .uri(path);
            final HttpClient.ResponseReceiver<?> receiver = body == null
                    ? sender
                    : sender.send(ByteBufFlux.fromString(Mono.just(body)));
            final Response response = receiver
                    .responseSingle((resp, bytes) -> bytes.asString(StandardCharsets.UTF_8)
                            .defaultIfEmpty("")
                            .map(text -> new Response(resp.status().code(), text)))
                    .block(requestTimeout.plusSeconds(1));
            if (response == null) {
                throw IndexException.transientFailure(IndexException.NO_STATUS,
                        method + " " + path + " returned no response");
            }
            return response;
        } catch (final RuntimeException e) {
            throw IndexException.transientFailure(IndexException.NO_STATUS,
                    method + " " + path + " failed: " + e.getMessage(), e);
        }
    }

    private void ensureSuccess(final String operation, final Response response) throws IndexException {
        if (response.isSuccess()) {
            return;
        }
        final String message = "Cannot " + operation + ": HTTP " + response.status() + " " + response.body();
        if (IndexException.isTransientStatus(response.status())) {
            throw IndexException.transientFailure(response.status(), message);
        }
        throw IndexException.permanentFailure(response.status(), message);
    }

    private void awaitTask(final String operation, final Response accepted) throws IndexException {
        ensureSuccess(operation, accepted);
        final JsonNode taskUid = parse(accepted.body()).path("taskUid");
        if (!taskUid.canConvertToLong()) {
            return;
        }

        final long deadline = System.currentTimeMillis() + taskTimeout.toMillis();
        while (true) {
            final Response response = request(HttpMethod.GET, "/tasks/" + taskUid.asLong(), null);
            ensureSuccess("get task " + taskUid.asLong(), response);
            final JsonNode task = parse(response.body());
            final String status = task.path("status").asText();
            switch (status) {
                case "succeeded":
                    return;
                case "failed":
                    final JsonNode error = task.path("error");
                    final String message = "Cannot " + operation + ": " + error.path("message").asText(status);
                    if ("internal".equals(error.path("type").asText())) {
                        throw IndexException.transientFailure(IndexException.NO_STATUS, message);
                    }
                    throw IndexException.permanentFailure(IndexException.NO_STATUS, message);
                case "canceled":
                    throw IndexException.transientFailure(IndexException.NO_STATUS,
                            "Cannot " + operation + ": task " + taskUid.asLong() + " was canceled");
                default:
                    break;
            }
            if (System.currentTimeMillis() >= deadline) {
                throw IndexException.transientFailure(IndexException.NO_STATUS, "Cannot " + operation
                        + ": task " + taskUid.asLong() + " still " + status + " after " + taskTimeout);
            }
            try {
                Thread.sleep(taskPollIntervalMs);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                throw IndexException.transientFailure(IndexException.NO_STATUS,
                        "Interrupted while waiting for task " + taskUid.asLong(), e);
            }
        }
    }

    private JsonNode parse(final String body) throws IndexException {
        if (body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (final JsonProcessingException e) {
            throw IndexException.transientFailure(IndexException.NO_STATUS,
                    "Unparseable response from Meilisearch: " + e.getMessage(), e);
        }
    }

    private String write(final JsonNode node) throws IndexException {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (final JsonProcessingException e) {
            throw IndexException.permanentFailure(IndexException.NO_STATUS, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        connectionProvider.disposeLater().block(requestTimeout);
        logger.info("Meilisearch client closed");
    }
}
