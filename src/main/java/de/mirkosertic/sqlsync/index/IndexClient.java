package de.mirkosertic.sqlsync.index;

import java.io.Closeable;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Write access to a search index backend.
 * <p>
 * Implementations must be safe for concurrent use: the dispatcher calls them from several worker
 * threads at once, for the same and for different indexes. Every operation completes before it returns.
 */
public interface IndexClient extends Closeable {

    /**
     * Create the index if needed and apply its static settings.
     */
    void setupIndex(String index, String primaryKey, IndexSettings settings) throws IndexException;

    /**
     * Update the field configuration after columns were added or removed.
     */
    void configureIndex(String index, Set<String> fieldsToAdd, Set<String> fieldsToRemove, String primaryKey)
            throws IndexException;

    /**
     * Insert or replace documents, identified by the value of their primary key field.
     */
    void upsertBatch(String index, String primaryKey, List<Map<String, Object>> documents) throws IndexException;

    /**
     * Delete documents by their identifier.
     */
    void deleteBatch(String index, Collection<String> documentIds) throws IndexException;

    /**
     * Drop all documents and field configuration and start over with the given primary key.
     */
    void recreateIndex(String index, String primaryKey) throws IndexException;
}
