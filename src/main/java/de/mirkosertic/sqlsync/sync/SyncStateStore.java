package de.mirkosertic.sqlsync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Persists the committed {@link TableSyncState} of each table as {@code <directory>/<table>.json}.
 * <p>
 * Files are replaced atomically, so a crash while saving leaves the previous state readable. Without a
 * directory the store is disabled: nothing is saved and every table starts from an empty state.
 */
public class SyncStateStore {

    private static final Logger logger = LoggerFactory.getLogger(SyncStateStore.class);

    static final int FORMAT_VERSION = 1;

    private final ObjectMapper objectMapper = new ObjectMapper();
    @Nullable
    private final Path directory;

    public SyncStateStore(@Nullable final Path directory) {
        this.directory = directory;
    }

    public static SyncStateStore disabled() {
        return new SyncStateStore(null);
    }

    public boolean isEnabled() {
        return directory != null;
    }

    /**
     * Load the last committed state of a table.
     *
     * @return the persisted state, or an empty state if there is none or it cannot be read
     */
    public synchronized TableSyncState load(final String table) {
        if (directory == null) {
            return TableSyncState.empty();
        }
        final Path path = statePath(table);
        if (!Files.exists(path)) {
            logger.debug("No persisted state for table {} at {}", table, path);
            return TableSyncState.empty();
        }
        try {
            final TableSyncState state = fromJson(objectMapper.readTree(path.toFile()));
            logger.info("Loaded state of table {}: {} rows, schema version {}", table,
                    state.fingerprints().size(), state.schemaVersion());
            return state;
        } catch (final IOException | IllegalArgumentException e) {
            logger.error("Cannot read persisted state of table {} from {}, starting from scratch", table, path, e);
            return TableSyncState.empty();
        }
    }

    /**
     * Persist the committed state of a table, replacing the previous file atomically.
     */
    public synchronized void save(final String table, final TableSyncState state) throws IOException {
        if (directory == null) {
            return;
        }
        Files.createDirectories(directory);
        final Path target = statePath(table);
        final Path temp = Files.createTempFile(directory, fileName(table), ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), toJson(table, state));
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        logger.debug("Saved state of table {} to {}", table, target);
    }

    Path statePath(final String table) {
        if (directory == null) {
            throw new IllegalStateException("State persistence is disabled");
        }
        return directory.resolve(fileName(table) + ".json");
    }

    private static String fileName(final String table) {
        return table.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private ObjectNode toJson(final String table, final TableSyncState state) {
        final ObjectNode root = objectMapper.createObjectNode();
        root.put("formatVersion", FORMAT_VERSION);
        root.put("table", table);
        root.put("schemaVersion", state.schemaVersion());
        root.put("lastSuccessfulCycleMs", state.lastSuccessfulCycleMs());

        final SchemaSnapshot schema = state.schema();
        if (schema != null) {
            final ObjectNode schemaNode = root.putObject("schema");
            final ArrayNode columns = schemaNode.putArray("columns");
            for (final ColumnDefinition column : schema.columns()) {
                columns.addObject()
                        .put("name", column.name())
                        .put("type", column.declaredType())
                        .put("nullable", column.nullable());
            }
            final ArrayNode primaryKey = schemaNode.putArray("primaryKey");
            schema.primaryKeyColumns().forEach(primaryKey::add);
        }

        final ObjectNode fingerprints = root.putObject("fingerprints");
        state.fingerprints().keySet().stream().sorted().forEach(key ->
                fingerprints.put(key.toTaggedString(), state.fingerprints().get(key).contentHash()));
        return root;
    }

    private static TableSyncState fromJson(final JsonNode root) {
        final int version = root.path("formatVersion").asInt(-1);
        if (version != FORMAT_VERSION) {
            throw new IllegalArgumentException("Unsupported state format version " + version);
        }

        SchemaSnapshot schema = null;
        final JsonNode schemaNode = root.path("schema");
        if (schemaNode.isObject()) {
            final List<ColumnDefinition> columns = new ArrayList<>();
            for (final JsonNode column : schemaNode.path("columns")) {
                columns.add(new ColumnDefinition(column.path("name").asText(), column.path("type").asText(),
                        column.path("nullable").asBoolean(true)));
            }
            final List<String> primaryKey = new ArrayList<>();
            schemaNode.path("primaryKey").forEach(node -> primaryKey.add(node.asText()));
            schema = new SchemaSnapshot(columns, primaryKey);
        }

        final Map<NormalizedKey, RowFingerprint> fingerprints = new HashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> entries = root.path("fingerprints").fields();
        while (entries.hasNext()) {
            final Map.Entry<String, JsonNode> entry = entries.next();
            final NormalizedKey key = NormalizedKey.parse(entry.getKey());
            fingerprints.put(key, new RowFingerprint(key, entry.getValue().asText()));
        }

        return new TableSyncState(schema, fingerprints, root.path("schemaVersion").asLong(),
                root.path("lastSuccessfulCycleMs").asLong());
    }
}
