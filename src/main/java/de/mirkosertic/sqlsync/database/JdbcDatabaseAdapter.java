package de.mirkosertic.sqlsync.database;

import de.mirkosertic.sqlsync.sync.ColumnDefinition;
import de.mirkosertic.sqlsync.sync.SchemaSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Database adapter for any JDBC driver, reading the schema through {@link DatabaseMetaData}.
 */
public class JdbcDatabaseAdapter implements DatabaseAdapter {

    private static final Logger logger = LoggerFactory.getLogger(JdbcDatabaseAdapter.class);

    private static final String[] TABLE_TYPES = {"TABLE"};

    protected final JdbcConnectionPool pool;

    public JdbcDatabaseAdapter(final JdbcConnectionPool pool) {
        this.pool = pool;
    }

    @Override
    public List<String> listTables() throws DatabaseException {
        try (final JdbcConnectionPool.Lease lease = pool.acquire()) {
            try (final ResultSet rs = lease.connection().getMetaData().getTables(null, null, "%", TABLE_TYPES)) {
                final List<String> tables = new ArrayList<>();
                while (rs.next()) {
                    final String name = rs.getString(3);
                    if (includeTable(name)) {
                        tables.add(name);
                    }
                }
                tables.sort(null);
                return tables;
            } catch (final SQLException e) {
                throw failed(lease, "Cannot list tables", e);
            }
        }
    }

    /**
     * Whether a table reported by the driver is a user table.
     */
    protected boolean includeTable(final String tableName) {
        return true;
    }

    @Override
    public SchemaSnapshot getSchema(final String table) throws DatabaseException {
        try (final JdbcConnectionPool.Lease lease = pool.acquire()) {
            try {
                final DatabaseMetaData metaData = lease.connection().getMetaData();
                final List<ColumnDefinition> columns = readColumns(metaData, table);
                if (columns.isEmpty()) {
                    throw new DatabaseQueryException("Table " + table + " does not exist or has no columns");
                }
                return new SchemaSnapshot(columns, readPrimaryKey(metaData, table));
            } catch (final SQLException e) {
                throw failed(lease, "Cannot read schema of table " + table, e);
            }
        }
    }

    private List<ColumnDefinition> readColumns(final DatabaseMetaData metaData, final String table)
            throws SQLException {
        final List<Map.Entry<Integer, ColumnDefinition>> byPosition = new ArrayList<>();
        try (final ResultSet rs = metaData.getColumns(null, null, table, null)) {
            while (rs.next()) {
                // The table name argument is a pattern, '_' would match any character
                if (!table.equals(rs.getString(3))) {
                    continue;
                }
                final String name = rs.getString(4);
                final String typeName = rs.getString(6);
                final boolean nullable = rs.getInt(11) != DatabaseMetaData.columnNoNulls;
                final int position = rs.getInt(17);
                byPosition.add(Map.entry(position,
                        new ColumnDefinition(name, typeName == null ? "" : typeName, nullable)));
            }
        }
        // Stable sort keeps the driver order for drivers that do not report positions
        byPosition.sort(Map.Entry.comparingByKey());
        final List<ColumnDefinition> columns = new ArrayList<>(byPosition.size());
        for (final Map.Entry<Integer, ColumnDefinition> entry : byPosition) {
            columns.add(entry.getValue());
        }
        return columns;
    }

    private List<String> readPrimaryKey(final DatabaseMetaData metaData, final String table) throws SQLException {
        final List<Map.Entry<Integer, String>> keyColumns = new ArrayList<>();
        try (final ResultSet rs = metaData.getPrimaryKeys(null, null, table)) {
            while (rs.next()) {
                keyColumns.add(Map.entry(rs.getInt(5), rs.getString(4)));
            }
        }
        keyColumns.sort(Map.Entry.comparingByKey());
        final List<String> names = new ArrayList<>(keyColumns.size());
        for (final Map.Entry<Integer, String> entry : keyColumns) {
            names.add(entry.getValue());
        }
        return names;
    }

    @Override
    public List<Map<String, Object>> getRows(final String table) throws DatabaseException {
        try (final JdbcConnectionPool.Lease lease = pool.acquire()) {
            final Connection connection = lease.connection();
            final String sql = "SELECT * FROM " + quoteIdentifier(connection, table);
            final long startTime = System.currentTimeMillis();
            try (final Statement statement = connection.createStatement();
                 final ResultSet rs = statement.executeQuery(sql)) {
                final ResultSetMetaData rsMetaData = rs.getMetaData();
                final int columnCount = rsMetaData.getColumnCount();
                final String[] labels = new String[columnCount];
                for (int i = 0; i < columnCount; i++) {
                    labels[i] = rsMetaData.getColumnLabel(i + 1);
                }

                final List<Map<String, Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    final Map<String, Object> row = new LinkedHashMap<>();
                    for (int i = 0; i < columnCount; i++) {
                        row.put(labels[i], rs.getObject(i + 1));
                    }
                    rows.add(row);
                }
                logger.debug("Read {} rows from {} in {}ms", rows.size(), table,
                        System.currentTimeMillis() - startTime);
                return rows;
            } catch (final SQLException e) {
                throw failed(lease, "Cannot read rows of table " + table, e);
            }
        }
    }

    /**
     * Quote a table name with the driver's identifier quote string.
     */
    protected String quoteIdentifier(final Connection connection, final String identifier) throws DatabaseException {
        String quote;
        try {
            quote = connection.getMetaData().getIdentifierQuoteString();
        } catch (final SQLException e) {
            throw DatabaseException.from("Cannot read identifier quote string", e);
        }
        if (quote == null || quote.isBlank()) {
            quote = "\"";
        }
        quote = quote.trim();
        return quote + identifier.replace(quote, quote + quote) + quote;
    }

    /**
     * Translate a failure and drop the connection if the failure concerns the connection itself.
     */
    protected static DatabaseException failed(final JdbcConnectionPool.Lease lease, final String message,
                                              final SQLException e) {
        final DatabaseException translated = DatabaseException.from(message, e);
        if (translated.isTransient()) {
            lease.invalidate();
        }
        return translated;
    }

    @Override
    public void close() {
        pool.close();
    }
}
