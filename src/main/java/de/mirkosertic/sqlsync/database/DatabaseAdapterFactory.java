package de.mirkosertic.sqlsync.database;

import de.mirkosertic.sqlsync.config.ApplicationConfig;
import de.mirkosertic.sqlsync.config.ConfigurationException;

import java.util.Locale;

/**
 * Creates the database adapter for the configured database type.
 */
public final class DatabaseAdapterFactory {

    public static final String TYPE_SQLITE = "sqlite";
    public static final String TYPE_JDBC = "jdbc";

    private DatabaseAdapterFactory() {
    }

    public static DatabaseAdapter create(final ApplicationConfig config) throws ConfigurationException {
        return create(config.getDatabaseType(), config.getConnectionString(), config.getConnectionPoolSize(),
                config.getConnectionAcquireTimeoutMs());
    }

    public static DatabaseAdapter create(final String type, final String connectionString, final int poolSize,
                                         final long acquireTimeoutMs) throws ConfigurationException {
        switch (type.toLowerCase(Locale.ROOT)) {
            case TYPE_SQLITE:
                return new SqliteDatabaseAdapter(new JdbcConnectionPool(
                        SqliteDatabaseAdapter.toJdbcUrl(connectionString), poolSize, acquireTimeoutMs));
            case TYPE_JDBC:
                return new JdbcDatabaseAdapter(new JdbcConnectionPool(connectionString, poolSize, acquireTimeoutMs));
            default:
                throw new ConfigurationException("Unsupported database type: " + type);
        }
    }

    /**
     * Guess the database type from a connection string, used when generating a configuration.
     */
    public static String detectType(final String connectionString) {
        final String value = connectionString.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("jdbc:sqlite:") || value.startsWith("sqlite:") || !value.startsWith("jdbc:")) {
            return TYPE_SQLITE;
        }
        return TYPE_JDBC;
    }
}
