package de.mirkosertic.sqlsync.sync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Classifies the difference between two schema snapshots of a table.
 * <p>
 * Precedence, highest first: primary key changed, columns removed, types changed, columns added,
 * unchanged. A missing previous snapshot classifies as unchanged; the initial load follows from the
 * empty fingerprint state of the table.
 */
public class SchemaTracker {

    private static final Logger logger = LoggerFactory.getLogger(SchemaTracker.class);

    public SchemaChange classify(@Nullable final SchemaSnapshot previous, final SchemaSnapshot current) {
        if (previous == null) {
            return SchemaChange.unchanged();
        }

        final Set<String> previousColumns = previous.columnNames();
        final Set<String> currentColumns = current.columnNames();

        final Set<String> added = new LinkedHashSet<>(currentColumns);
        added.removeAll(previousColumns);
        final Set<String> removed = new LinkedHashSet<>(previousColumns);
        removed.removeAll(currentColumns);

        final SchemaChange.Kind kind;
        if (primaryKeyChanged(previous, current)) {
            kind = SchemaChange.Kind.PRIMARY_KEY_CHANGED;
        } else if (!removed.isEmpty()) {
            kind = SchemaChange.Kind.COLUMNS_REMOVED;
        } else if (typesChanged(previous, current)) {
            kind = SchemaChange.Kind.TYPES_CHANGED;
        } else if (!added.isEmpty()) {
            kind = SchemaChange.Kind.COLUMNS_ADDED;
        } else {
            kind = SchemaChange.Kind.UNCHANGED;
        }

        if (kind != SchemaChange.Kind.UNCHANGED) {
            logger.info("Schema change detected: {} (added={}, removed={})", kind, added, removed);
        }
        return new SchemaChange(kind, added, removed);
    }

    private boolean primaryKeyChanged(final SchemaSnapshot previous, final SchemaSnapshot current) {
        if (!previous.primaryKeyColumns().equals(current.primaryKeyColumns())) {
            return true;
        }
        for (final String keyColumn : current.primaryKeyColumns()) {
            final ColumnDefinition before = previous.column(keyColumn);
            final ColumnDefinition after = current.column(keyColumn);
            if (before == null || after == null || !before.normalizedType().equals(after.normalizedType())) {
                return true;
            }
        }
        return false;
    }

    private boolean typesChanged(final SchemaSnapshot previous, final SchemaSnapshot current) {
        for (final ColumnDefinition column : current.columns()) {
            final ColumnDefinition before = previous.column(column.name());
            if (before != null && !before.normalizedType().equals(column.normalizedType())) {
                logger.debug("Column {} changed type from {} to {}", column.name(), before.declaredType(),
                        column.declaredType());
                return true;
            }
        }
        return false;
    }
}
