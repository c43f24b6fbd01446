package de.mirkosertic.sqlsync.sync;

import java.util.Locale;

/**
 * One column of a table as reported by the database.
 */
public record ColumnDefinition(String name, String declaredType, boolean nullable) {

    /**
     * Declared type in upper case without surrounding whitespace, used when comparing snapshots.
     */
    public String normalizedType() {
        return declaredType == null ? "" : declaredType.trim().toUpperCase(Locale.ROOT);
    }
}
