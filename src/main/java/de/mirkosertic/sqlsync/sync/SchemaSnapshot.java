package de.mirkosertic.sqlsync.sync;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable view of a table's columns and primary key at one point in time.
 */
public record SchemaSnapshot(
        /** Columns in their ordinal order. */
        List<ColumnDefinition> columns,
        /** Primary key columns in key sequence order; empty if the table has none. */
        List<String> primaryKeyColumns
) {

    public SchemaSnapshot {
        columns = List.copyOf(columns);
        primaryKeyColumns = List.copyOf(primaryKeyColumns);
    }

    public Set<String> columnNames() {
        final Set<String> names = new LinkedHashSet<>();
        for (final ColumnDefinition column : columns) {
            names.add(column.name());
        }
        return names;
    }

    @Nullable
    public ColumnDefinition column(final String name) {
        for (final ColumnDefinition column : columns) {
            if (column.name().equals(name)) {
                return column;
            }
        }
        return null;
    }

    /**
     * Restricts the snapshot to the given fields. Primary key columns are always kept.
     * An empty field collection keeps every column.
     */
    public SchemaSnapshot project(final Collection<String> fields) {
        if (fields.isEmpty()) {
            return this;
        }
        final List<ColumnDefinition> kept = new ArrayList<>();
        for (final ColumnDefinition column : columns) {
            if (fields.contains(column.name()) || primaryKeyColumns.contains(column.name())) {
                kept.add(column);
            }
        }
        return new SchemaSnapshot(kept, primaryKeyColumns);
    }

    /**
     * Same snapshot with the primary key replaced, used when the key is configured explicitly.
     */
    public SchemaSnapshot withPrimaryKey(final List<String> primaryKey) {
        return new SchemaSnapshot(columns, primaryKey);
    }
}
