package de.mirkosertic.sqlsync.sync;

import org.jspecify.annotations.Nullable;

import java.util.Objects;

/**
 * A primary key value in one canonical, comparable form.
 * <p>
 * Integer keys are held as signed 64-bit values, everything else as canonical text.
 * Integer keys sort before text keys.
 */
public record NormalizedKey(
        /** Whether this key carries an integer or a text value. */
        Kind kind,
        /** The integer value, {@code 0} for text keys. */
        long longValue,
        /** The text value, {@code null} for integer keys. */
        @Nullable String textValue
) implements Comparable<NormalizedKey> {

    public enum Kind {
        INTEGER,
        TEXT
    }

    private static final String INTEGER_PREFIX = "i:";
    private static final String TEXT_PREFIX = "s:";

    public NormalizedKey {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.TEXT) {
            Objects.requireNonNull(textValue, "textValue");
            longValue = 0;
        } else {
            textValue = null;
        }
    }

    public static NormalizedKey ofLong(final long value) {
        return new NormalizedKey(Kind.INTEGER, value, null);
    }

    public static NormalizedKey ofText(final String value) {
        return new NormalizedKey(Kind.TEXT, 0, value);
    }

    /**
     * The identifier under which the row is stored in the search index.
     */
    public String toDocumentId() {
        return kind == Kind.INTEGER ? Long.toString(longValue) : textValue;
    }

    /**
     * The value as it appears in the primary key field of an indexed document.
     */
    public Object toDocumentValue() {
        return kind == Kind.INTEGER ? (Object) longValue : textValue;
    }

    /**
     * Tagged string form used for persistence, reversible with {@link #parse(String)}.
     */
    public String toTaggedString() {
        return kind == Kind.INTEGER ? INTEGER_PREFIX + longValue : TEXT_PREFIX + textValue;
    }

    public static NormalizedKey parse(final String tagged) {
        if (tagged.startsWith(INTEGER_PREFIX)) {
            return ofLong(Long.parseLong(tagged.substring(INTEGER_PREFIX.length())));
        }
        if (tagged.startsWith(TEXT_PREFIX)) {
            return ofText(tagged.substring(TEXT_PREFIX.length()));
        }
        throw new IllegalArgumentException("Not a tagged key: " + tagged);
    }

    @Override
    public int compareTo(final NormalizedKey other) {
        if (kind != other.kind) {
            return kind.compareTo(other.kind);
        }
        if (kind == Kind.INTEGER) {
            return Long.compare(longValue, other.longValue);
        }
        return textValue.compareTo(other.textValue);
    }

    @Override
    public String toString() {
        return toDocumentId();
    }
}
