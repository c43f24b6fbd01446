package de.mirkosertic.sqlsync.config;

import de.mirkosertic.sqlsync.database.DatabaseAdapter;
import de.mirkosertic.sqlsync.database.DatabaseException;
import de.mirkosertic.sqlsync.sync.ColumnDefinition;
import de.mirkosertic.sqlsync.sync.RowHasher;
import de.mirkosertic.sqlsync.sync.SchemaSnapshot;
import de.mirkosertic.sqlsync.sync.UnsupportedKeyTypeException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Introspects a database and produces a configuration that synchronizes every table with a
 * supported single-column primary key. Other tables are skipped with a warning.
 */
public class ConfigGenerator {

    private static final Logger logger = LoggerFactory.getLogger(ConfigGenerator.class);

    private final DatabaseAdapter database;
    private final Yaml yaml;

    /**
     * Values that do not come from the database.
     */
    public record Options(
            String databaseType,
            String connectionString,
            String indexType,
            /** Meilisearch host, ignored for the Lucene backend. */
            @Nullable String meilisearchHost,
            @Nullable String meilisearchApiKey,
            long pollIntervalSeconds
    ) {
    }

    public ConfigGenerator(final DatabaseAdapter database) {
        this.database = database;
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    public Map<String, Object> generate(final Options options) throws DatabaseException {
        final Map<String, Object> databaseSection = new LinkedHashMap<>();
        databaseSection.put("type", options.databaseType());
        databaseSection.put("connection-string", options.connectionString());

        final Map<String, Object> indexSection = new LinkedHashMap<>();
        indexSection.put("type", options.indexType());
        if (ApplicationConfig.INDEX_TYPE_MEILISEARCH.equals(options.indexType())) {
            indexSection.put("host", options.meilisearchHost());
            if (options.meilisearchApiKey() != null) {
                indexSection.put("api-key", options.meilisearchApiKey());
            }
        }

        final Map<String, Object> syncSection = new LinkedHashMap<>();
        syncSection.put("poll-interval-seconds", options.pollIntervalSeconds());

        final List<Map<String, Object>> tables = new ArrayList<>();
        for (final String table : database.listTables()) {
            final SchemaSnapshot schema = database.getSchema(table);
            final RowHasher hasher;
            try {
                hasher = RowHasher.forSchema(schema, 0);
            } catch (final UnsupportedKeyTypeException e) {
                logger.warn("Skipping table {}: {}", table, e.getMessage());
                continue;
            }
            final List<String> fields = new ArrayList<>();
            for (final ColumnDefinition column : schema.columns()) {
                fields.add(column.name());
            }
            final Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", table);
            entry.put("index-name", table);
            entry.put("primary-key", hasher.primaryKeyColumn());
            entry.put("fields-to-index", fields);
            tables.add(entry);
        }
        logger.info("Generated configuration for {} tables", tables.size());

        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("database", databaseSection);
        root.put("index", indexSection);
        root.put("sync", syncSection);
        root.put("tables", tables);
        final Map<String, Object> document = new LinkedHashMap<>();
        document.put("sqlsync", root);
        return document;
    }

    public String render(final Map<String, Object> config) {
        return yaml.dump(config);
    }

    public void write(final Map<String, Object> config, final Path output) throws IOException {
        final Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (final Writer writer = Files.newBufferedWriter(output,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            yaml.dump(config, writer);
        }
        logger.info("Wrote configuration to {}", output);
    }
}
