package de.mirkosertic.sqlsync.config;

import de.mirkosertic.sqlsync.database.DatabaseAdapter;
import de.mirkosertic.sqlsync.sync.ColumnDefinition;
import de.mirkosertic.sqlsync.sync.SchemaSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ConfigGenerator Tests")
class ConfigGeneratorTest {

    @TempDir
    Path tempDir;

    private DatabaseAdapter database;
    private ConfigGenerator generator;

    @BeforeEach
    void setUp() throws Exception {
        database = mock(DatabaseAdapter.class);
        when(database.listTables()).thenReturn(List.of("users", "tags", "audit_log"));
        when(database.getSchema("users")).thenReturn(new SchemaSnapshot(List.of(
                new ColumnDefinition("id", "INTEGER", false),
                new ColumnDefinition("name", "TEXT", true)), List.of("id")));
        when(database.getSchema("tags")).thenReturn(new SchemaSnapshot(List.of(
                new ColumnDefinition("post_id", "INTEGER", false),
                new ColumnDefinition("tag", "TEXT", false)), List.of("post_id", "tag")));
        when(database.getSchema("audit_log")).thenReturn(new SchemaSnapshot(List.of(
                new ColumnDefinition("message", "TEXT", true)), List.of()));
        generator = new ConfigGenerator(database);
    }

    private static ConfigGenerator.Options options(final String indexType) {
        return new ConfigGenerator.Options("sqlite", "/data/app.db", indexType, "http://localhost:7700", null, 30);
    }

    @Test
    @DisplayName("Should generate entries only for tables with a single-column key")
    @SuppressWarnings("unchecked")
    void shouldSkipUnsupportedTables() throws Exception {
        // When
        final Map<String, Object> config = generator.generate(options(ApplicationConfig.INDEX_TYPE_LUCENE));

        // Then
        final Map<String, Object> root = (Map<String, Object>) config.get("sqlsync");
        final List<Map<String, Object>> tables = (List<Map<String, Object>>) root.get("tables");
        assertThat(tables).hasSize(1);
        assertThat(tables.get(0))
                .containsEntry("name", "users")
                .containsEntry("index-name", "users")
                .containsEntry("primary-key", "id")
                .containsEntry("fields-to-index", List.of("id", "name"));
        assertThat((Map<String, Object>) root.get("index"))
                .as("Lucene needs no host")
                .doesNotContainKey("host");
    }

    @Test
    @DisplayName("Should produce a file that loads and validates")
    void shouldRoundTripThroughApplicationConfig() throws Exception {
        // Given
        final Path output = tempDir.resolve("sync.yaml");

        // When
        generator.write(generator.generate(options(ApplicationConfig.INDEX_TYPE_MEILISEARCH)), output);
        final ApplicationConfig config = ApplicationConfig.load(output, name -> null);

        // Then
        config.validate();
        assertThat(config.getIndexType()).isEqualTo(ApplicationConfig.INDEX_TYPE_MEILISEARCH);
        assertThat(config.getMeilisearchHost()).isEqualTo("http://localhost:7700");
        assertThat(config.getTables()).singleElement()
                .satisfies(table -> {
                    assertThat(table.primaryKey()).isEqualTo("id");
                    assertThat(table.pollIntervalSeconds()).isEqualTo(30);
                });
    }

    @Test
    @DisplayName("Should render block style YAML")
    void shouldRenderBlockStyle() throws Exception {
        final String yaml = generator.render(generator.generate(options(ApplicationConfig.INDEX_TYPE_LUCENE)));

        assertThat(yaml).startsWith("sqlsync:\n").contains("  tables:\n").doesNotContain("{");
    }
}
