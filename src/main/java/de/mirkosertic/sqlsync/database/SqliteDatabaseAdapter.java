package de.mirkosertic.sqlsync.database;

import de.mirkosertic.sqlsync.sync.ColumnDefinition;
import de.mirkosertic.sqlsync.sync.SchemaSnapshot;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * SQLite adapter. The schema is read with {@code PRAGMA table_info}, which reports the declared column
 * type and the position of each column inside the primary key.
 */
public class SqliteDatabaseAdapter extends JdbcDatabaseAdapter {

    private static final String JDBC_PREFIX = "jdbc:sqlite:";

    public SqliteDatabaseAdapter(final JdbcConnectionPool pool) {
        super(pool);
    }

    /**
     * Convert a connection string into a JDBC URL. Accepts {@code jdbc:sqlite:...}, {@code sqlite://path},
     * {@code sqlite:path} and plain file paths.
     */
    public static String toJdbcUrl(final String connectionString) {
        final String value = connectionString.trim();
        if (value.startsWith(JDBC_PREFIX)) {
            return value;
        }
        if (value.startsWith("sqlite://")) {
            return JDBC_PREFIX + value.substring("sqlite://".length());
        }
        if (value.startsWith("sqlite:")) {
            return JDBC_PREFIX + value.substring("sqlite:".length());
        }
        return JDBC_PREFIX + value;
    }

    @Override
    protected boolean includeTable(final String tableName) {
        return !tableName.startsWith("sqlite_");
    }

    @Override
    public SchemaSnapshot getSchema(final String table) throws DatabaseException {
        try (final JdbcConnectionPool.Lease lease = pool.acquire()) {
            final Connection connection = lease.connection();
            final String sql = "PRAGMA table_info(" + quoteIdentifier(connection, table) + ")";
            try (final Statement statement = connection.createStatement();
                 final ResultSet rs = statement.executeQuery(sql)) {
                final List<ColumnDefinition> columns = new ArrayList<>();
                final List<Map.Entry<Integer, String>> keyColumns = new ArrayList<>();
                while (rs.next()) {
                    final String name = rs.getString("name");
                    final String type = rs.getString("type");
                    final boolean notNull = rs.getInt("notnull") != 0;
                    final int keyPosition = rs.getInt("pk");
                    columns.add(new ColumnDefinition(name, type == null ? "" : type, !notNull));
                    if (keyPosition > 0) {
                        keyColumns.add(Map.entry(keyPosition, name));
                    }
                }
                if (columns.isEmpty()) {
                    throw new DatabaseQueryException("Table " + table + " does not exist");
                }
                keyColumns.sort(Map.Entry.comparingByKey());
                final List<String> primaryKey = new ArrayList<>(keyColumns.size());
                for (final Map.Entry<Integer, String> entry : keyColumns) {
                    primaryKey.add(entry.getValue());
                }
                return new SchemaSnapshot(columns, primaryKey);
            } catch (final SQLException e) {
                throw failed(lease, "Cannot read schema of table " + table, e);
            }
        }
    }
}
