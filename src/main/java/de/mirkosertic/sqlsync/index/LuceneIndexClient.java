package de.mirkosertic.sqlsync.index;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.DoublePoint;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.LongPoint;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Embedded index backend: one Lucene index directory per index name below a base path.
 * <p>
 * The document identifier is stored in the {@value #ID_FIELD} field and every update replaces the
 * document with the same identifier. The primary key field name and the configured field set are
 * kept in the commit user data. Every write call commits before it returns.
 */
public class LuceneIndexClient implements IndexClient {

    private static final Logger logger = LoggerFactory.getLogger(LuceneIndexClient.class);

    static final String ID_FIELD = "_id";
    static final String COMMIT_PRIMARY_KEY = "primary_key";
    static final String COMMIT_FIELDS = "fields";

    private final Path basePath;
    private final Analyzer analyzer = new StandardAnalyzer();
    private final Map<String, IndexHandle> indexes = new ConcurrentHashMap<>();

    private static final class IndexHandle {
        final Directory directory;
        final IndexWriter writer;

        IndexHandle(final Directory directory, final IndexWriter writer) {
            this.directory = directory;
            this.writer = writer;
        }
    }

    public LuceneIndexClient(final Path basePath) {
        this.basePath = basePath;
    }

    private IndexHandle handle(final String index) throws IndexException {
        final IndexHandle existing = indexes.get(index);
        if (existing != null) {
            return existing;
        }
        synchronized (indexes) {
            final IndexHandle again = indexes.get(index);
            if (again != null) {
                return again;
            }
            try {
                final Path path = basePath.resolve(index);
                if (!Files.exists(path)) {
                    Files.createDirectories(path);
                    logger.info("Created index directory: {}", path.toAbsolutePath());
                }
                final Directory directory = FSDirectory.open(path);
                final IndexWriterConfig config = new IndexWriterConfig(analyzer);
                config.setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
                final IndexWriter writer = new IndexWriter(directory, config);

                // Commit to ensure index files are created
                writer.commit();

                final IndexHandle handle = new IndexHandle(directory, writer);
                indexes.put(index, handle);
                logger.info("Lucene index {} opened at {}", index, path.toAbsolutePath());
                return handle;
            } catch (final IOException e) {
                throw IndexException.transientFailure(IndexException.NO_STATUS,
                        "Cannot open index " + index + ": " + e.getMessage(), e);
            }
        }
    }

    @Override
    public synchronized void setupIndex(final String index, final String primaryKey, final IndexSettings settings)
            throws IndexException {
        final IndexWriter writer = handle(index).writer;
        final Map<String, String> commitData = readCommitData(writer);
        final String configuredKey = commitData.get(COMMIT_PRIMARY_KEY);
        if (configuredKey != null && !configuredKey.equals(primaryKey)) {
            throw IndexException.permanentFailure(IndexException.NO_STATUS, "Index " + index
                    + " uses primary key " + configuredKey + " but " + primaryKey + " was requested");
        }
        if (!settings.searchableAttributes().isEmpty()) {
            commitData.put(COMMIT_FIELDS, String.join(",", settings.searchableAttributes()));
        }
        commitData.put(COMMIT_PRIMARY_KEY, primaryKey);
        commit(index, writer, commitData);
    }

    @Override
    public synchronized void configureIndex(final String index, final Set<String> fieldsToAdd,
                                            final Set<String> fieldsToRemove, final String primaryKey)
            throws IndexException {
        final IndexWriter writer = handle(index).writer;
        final Map<String, String> commitData = readCommitData(writer);
        final Set<String> fields = parseFields(commitData.get(COMMIT_FIELDS));
        fields.addAll(fieldsToAdd);
        fields.removeAll(fieldsToRemove);
        commitData.put(COMMIT_FIELDS, String.join(",", fields));
        commitData.put(COMMIT_PRIMARY_KEY, primaryKey);
        commit(index, writer, commitData);
        logger.info("Index {} fields reconfigured: added={}, removed={}", index, fieldsToAdd, fieldsToRemove);
    }

    @Override
    public void upsertBatch(final String index, final String primaryKey, final List<Map<String, Object>> documents)
            throws IndexException {
        final IndexWriter writer = handle(index).writer;
        try {
            for (final Map<String, Object> source : documents) {
                final Object keyValue = source.get(primaryKey);
                if (keyValue == null) {
                    throw IndexException.permanentFailure(IndexException.NO_STATUS,
                            "Document without primary key " + primaryKey);
                }
                final String id = keyValue.toString();
                writer.updateDocument(new Term(ID_FIELD, id), toLuceneDocument(id, source));
            }
            writer.commit();
        } catch (final IOException e) {
            throw IndexException.transientFailure(IndexException.NO_STATUS,
                    "Cannot write to index " + index + ": " + e.getMessage(), e);
        } catch (final AlreadyClosedException | IllegalArgumentException e) {
            throw IndexException.permanentFailure(IndexException.NO_STATUS,
                    "Index " + index + " rejected documents: " + e.getMessage(), e);
        }
        logger.debug("Upserted {} documents into {}", documents.size(), index);
    }

    @Override
    public void deleteBatch(final String index, final Collection<String> documentIds) throws IndexException {
        final IndexWriter writer = handle(index).writer;
        final Term[] terms = new Term[documentIds.size()];
        int i = 0;
        for (final String id : documentIds) {
            terms[i++] = new Term(ID_FIELD, id);
        }
        try {
            writer.deleteDocuments(terms);
            writer.commit();
        } catch (final IOException e) {
            throw IndexException.transientFailure(IndexException.NO_STATUS,
                    "Cannot delete from index " + index + ": " + e.getMessage(), e);
        } catch (final AlreadyClosedException e) {
            throw IndexException.permanentFailure(IndexException.NO_STATUS, "Index " + index + " is closed", e);
        }
        logger.debug("Deleted {} documents from {}", documentIds.size(), index);
    }

    @Override
    public synchronized void recreateIndex(final String index, final String primaryKey) throws IndexException {
        final IndexWriter writer = handle(index).writer;
        try {
            writer.deleteAll();
        } catch (final IOException e) {
            throw IndexException.transientFailure(IndexException.NO_STATUS,
                    "Cannot clear index " + index + ": " + e.getMessage(), e);
        }
        final Map<String, String> commitData = new HashMap<>();
        commitData.put(COMMIT_PRIMARY_KEY, primaryKey);
        commit(index, writer, commitData);
        logger.info("Index {} recreated with primary key {}", index, primaryKey);
    }

    /**
     * Convert an index document into a Lucene document. Text is analyzed and stored, numbers are
     * indexed as points and stored, booleans are indexed as exact terms.
     */
    static Document toLuceneDocument(final String id, final Map<String, Object> source) {
        final Document doc = new Document();
        doc.add(new StringField(ID_FIELD, id, Field.Store.YES));
        for (final Map.Entry<String, Object> entry : source.entrySet()) {
            final String name = entry.getKey();
            final Object value = entry.getValue();
            if (value == null || ID_FIELD.equals(name)) {
                continue;
            }
            if (value instanceof Long || value instanceof Integer) {
                final long longValue = ((Number) value).longValue();
                doc.add(new LongPoint(name, longValue));
                doc.add(new StoredField(name, longValue));
            } else if (value instanceof Double || value instanceof Float) {
                final double doubleValue = ((Number) value).doubleValue();
                doc.add(new DoublePoint(name, doubleValue));
                doc.add(new StoredField(name, doubleValue));
            } else if (value instanceof BigDecimal) {
                doc.add(new StringField(name, ((BigDecimal) value).toPlainString(), Field.Store.YES));
            } else if (value instanceof Boolean) {
                doc.add(new StringField(name, value.toString(), Field.Store.YES));
            } else {
                doc.add(new TextField(name, value.toString(), Field.Store.YES));
            }
        }
        return doc;
    }

    private Map<String, String> readCommitData(final IndexWriter writer) {
        final Map<String, String> commitData = new HashMap<>();
        final Iterable<Map.Entry<String, String>> live = writer.getLiveCommitData();
        if (live != null) {
            for (final Map.Entry<String, String> entry : live) {
                commitData.put(entry.getKey(), entry.getValue());
            }
        }
        return commitData;
    }

    private void commit(final String index, final IndexWriter writer, final Map<String, String> commitData)
            throws IndexException {
        try {
            writer.setLiveCommitData(commitData.entrySet());
            writer.commit();
        } catch (final IOException e) {
            throw IndexException.transientFailure(IndexException.NO_STATUS,
                    "Cannot commit index " + index + ": " + e.getMessage(), e);
        } catch (final AlreadyClosedException e) {
            throw IndexException.permanentFailure(IndexException.NO_STATUS, "Index " + index + " is closed", e);
        }
    }

    private static Set<String> parseFields(@Nullable final String fields) {
        final Set<String> result = new LinkedHashSet<>();
        if (fields != null && !fields.isEmpty()) {
            result.addAll(Arrays.asList(fields.split(",")));
        }
        return result;
    }

    /**
     * Number of documents in an index, including changes committed so far.
     */
    public long getDocumentCount(final String index) throws IndexException {
        try (final DirectoryReader reader = DirectoryReader.open(handle(index).writer)) {
            return reader.numDocs();
        } catch (final IOException e) {
            throw IndexException.transientFailure(IndexException.NO_STATUS, e.getMessage(), e);
        }
    }

    /**
     * Stored fields of one document, or {@code null} if no document has the identifier.
     */
    @Nullable
    public Map<String, Object> getDocument(final String index, final String id) throws IndexException {
        try (final DirectoryReader reader = DirectoryReader.open(handle(index).writer)) {
            final IndexSearcher searcher = new IndexSearcher(reader);
            final TopDocs topDocs = searcher.search(new TermQuery(new Term(ID_FIELD, id)), 1);
            if (topDocs.totalHits.value == 0) {
                return null;
            }
            final Document doc = searcher.storedFields().document(topDocs.scoreDocs[0].doc);
            final Map<String, Object> result = new LinkedHashMap<>();
            for (final IndexableField field : doc.getFields()) {
                if (ID_FIELD.equals(field.name())) {
                    continue;
                }
                final Number number = field.numericValue();
                result.put(field.name(), number != null ? number : field.stringValue());
            }
            return result;
        } catch (final IOException e) {
            throw IndexException.transientFailure(IndexException.NO_STATUS, e.getMessage(), e);
        }
    }

    /**
     * Commit user data of an index: primary key and configured fields.
     */
    public Map<String, String> getIndexConfiguration(final String index) throws IndexException {
        return readCommitData(handle(index).writer);
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (final Map.Entry<String, IndexHandle> entry : indexes.entrySet()) {
            try {
                entry.getValue().writer.close();
                entry.getValue().directory.close();
            } catch (final IOException e) {
                logger.error("Error closing index {}", entry.getKey(), e);
                if (failure == null) {
                    failure = e;
                }
            }
        }
        indexes.clear();
        analyzer.close();
        if (failure != null) {
            throw failure;
        }
    }
}
