package de.mirkosertic.sqlsync.database;

import de.mirkosertic.sqlsync.sync.SchemaSnapshot;

import java.io.Closeable;
import java.util.List;
import java.util.Map;

/**
 * Read access to the tables of one database, implemented per database backend.
 * Implementations are shared by all table loops and must be safe for concurrent use.
 */
public interface DatabaseAdapter extends Closeable {

    /**
     * Names of all user tables.
     */
    List<String> listTables() throws DatabaseException;

    /**
     * Current columns and primary key of a table.
     *
     * @throws DatabaseQueryException if the table does not exist
     */
    SchemaSnapshot getSchema(String table) throws DatabaseException;

    /**
     * All rows of a table as column name to value maps, in column order.
     */
    List<Map<String, Object>> getRows(String table) throws DatabaseException;
}
