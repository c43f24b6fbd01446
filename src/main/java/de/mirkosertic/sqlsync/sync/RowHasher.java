package de.mirkosertic.sqlsync.sync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Turns raw database rows into index documents and content fingerprints.
 * <p>
 * Field values are first converted into index friendly types (long, double, decimal, boolean, text)
 * and then serialized into a canonical byte sequence that is hashed with SHA-256:
 * <ul>
 *   <li>fields are ordered by column name, each prefixed with its length-prefixed UTF-8 name</li>
 *   <li>every value carries a one byte type tag</li>
 *   <li>integers are written as 8 byte big-endian, floating point values as their IEEE-754 bit pattern,
 *       text and decimals as length-prefixed UTF-8</li>
 *   <li>a null value writes no entry at all, so it never collides with an empty string, zero or false</li>
 * </ul>
 * The primary key is excluded from the hash and normalized into a {@link NormalizedKey}.
 * Instances are immutable and safe for concurrent use.
 */
public class RowHasher {

    private static final Logger logger = LoggerFactory.getLogger(RowHasher.class);

    private static final byte TAG_INTEGER = 1;
    private static final byte TAG_FLOAT = 2;
    private static final byte TAG_TEXT = 3;
    private static final byte TAG_BOOLEAN = 4;
    private static final byte TAG_DECIMAL = 5;

    enum KeyType {
        INTEGER,
        TEXT,
        UUID,
        DYNAMIC
    }

    private final String primaryKeyColumn;
    private final KeyType keyType;
    /** Indexed non-key columns, sorted by name. */
    private final List<String> hashedColumns;
    private final int maxTextLength;

    RowHasher(final String primaryKeyColumn, final KeyType keyType, final Collection<String> indexedColumns,
              final int maxTextLength) {
        this.primaryKeyColumn = primaryKeyColumn;
        this.keyType = keyType;
        final List<String> columns = new ArrayList<>();
        for (final String column : indexedColumns) {
            if (!column.equals(primaryKeyColumn)) {
                columns.add(column);
            }
        }
        columns.sort(null);
        this.hashedColumns = List.copyOf(columns);
        this.maxTextLength = maxTextLength;
    }

    /**
     * Create a hasher for the given schema.
     *
     * @param schema        current schema, already projected to the indexed fields
     * @param maxTextLength text values longer than this are truncated; {@code 0} disables truncation
     * @throws UnsupportedKeyTypeException if the table has no key, a composite key or a key type that
     *                                     cannot be normalized
     */
    public static RowHasher forSchema(final SchemaSnapshot schema, final int maxTextLength)
            throws UnsupportedKeyTypeException {
        final List<String> keyColumns = schema.primaryKeyColumns();
        if (keyColumns.isEmpty()) {
            throw new UnsupportedKeyTypeException("Table has no primary key");
        }
        if (keyColumns.size() > 1) {
            throw new UnsupportedKeyTypeException("Composite primary keys are not supported: " + keyColumns);
        }
        final String keyColumn = keyColumns.get(0);
        final ColumnDefinition keyDefinition = schema.column(keyColumn);
        if (keyDefinition == null) {
            throw new UnsupportedKeyTypeException("Primary key column " + keyColumn + " does not exist");
        }
        return new RowHasher(keyColumn, keyTypeOf(keyDefinition), schema.columnNames(), maxTextLength);
    }

    static KeyType keyTypeOf(final ColumnDefinition column) throws UnsupportedKeyTypeException {
        final String type = column.normalizedType();
        if (type.isEmpty()) {
            // Untyped columns exist in SQLite, the value decides
            return KeyType.DYNAMIC;
        }
        if (type.contains("UUID") || type.contains("UNIQUEIDENTIFIER")) {
            return KeyType.UUID;
        }
        if (type.contains("INT") || type.contains("SERIAL")) {
            return KeyType.INTEGER;
        }
        if (type.contains("CHAR") || type.contains("TEXT") || type.contains("CLOB") || type.contains("STRING")) {
            return KeyType.TEXT;
        }
        throw new UnsupportedKeyTypeException(
                "Primary key column " + column.name() + " has unsupported type " + column.declaredType());
    }

    public String primaryKeyColumn() {
        return primaryKeyColumn;
    }

    /**
     * Fingerprint one row.
     *
     * @return the fingerprinted row, or {@code null} if the primary key value is null
     * @throws UnsupportedKeyTypeException if the key value cannot be normalized
     */
    @Nullable
    public FingerprintedRow hash(final Map<String, Object> row) throws UnsupportedKeyTypeException {
        final Object rawKey = row.get(primaryKeyColumn);
        if (rawKey == null) {
            logger.warn("Skipping row with null primary key {}", primaryKeyColumn);
            return null;
        }
        final NormalizedKey key = normalizeKey(rawKey);

        final Map<String, Object> document = new LinkedHashMap<>();
        document.put(primaryKeyColumn, key.toDocumentValue());

        final ByteArrayOutputStream canonical = new ByteArrayOutputStream(256);
        for (final String column : hashedColumns) {
            final Object value = toDocumentValue(row.get(column));
            document.put(column, value);
            if (value != null) {
                writeText(canonical, column);
                writeValue(canonical, value);
            }
        }

        return new FingerprintedRow(new RowFingerprint(key, sha256Hex(canonical.toByteArray())), document);
    }

    NormalizedKey normalizeKey(final Object value) throws UnsupportedKeyTypeException {
        switch (keyType) {
            case INTEGER:
                return NormalizedKey.ofLong(toLong(value));
            case UUID:
                return NormalizedKey.ofText(toUuid(value).toString());
            case TEXT:
                return NormalizedKey.ofText(value.toString());
            default:
                if (value instanceof UUID) {
                    return NormalizedKey.ofText(value.toString());
                }
                if (value instanceof String) {
                    return normalizeUntypedText((String) value);
                }
                if (value instanceof Number) {
                    return NormalizedKey.ofLong(toLong(value));
                }
                throw new UnsupportedKeyTypeException(
                        "Cannot normalize primary key value of type " + value.getClass().getName());
        }
    }

    /**
     * Only the canonical decimal form of an integer becomes an integer key, so "007", " 7" and "+7"
     * stay distinct from 7.
     */
    private static NormalizedKey normalizeUntypedText(final String value) {
        try {
            final long parsed = Long.parseLong(value);
            if (Long.toString(parsed).equals(value)) {
                return NormalizedKey.ofLong(parsed);
            }
        } catch (final NumberFormatException e) {
            logger.trace("Primary key value {} is not an integer, keeping it as text", value);
        }
        return NormalizedKey.ofText(value);
    }

    private static long toLong(final Object value) throws UnsupportedKeyTypeException {
        try {
            if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
                return ((Number) value).longValue();
            }
            if (value instanceof BigInteger) {
                return ((BigInteger) value).longValueExact();
            }
            if (value instanceof BigDecimal) {
                return ((BigDecimal) value).longValueExact();
            }
            if (value instanceof String) {
                return Long.parseLong(((String) value).trim());
            }
        } catch (final ArithmeticException | NumberFormatException e) {
            throw new UnsupportedKeyTypeException("Primary key value " + value + " is not a 64-bit integer", e);
        }
        throw new UnsupportedKeyTypeException(
                "Primary key value of type " + value.getClass().getName() + " is not an integer");
    }

    private static UUID toUuid(final Object value) throws UnsupportedKeyTypeException {
        if (value instanceof UUID) {
            return (UUID) value;
        }
        if (value instanceof byte[] && ((byte[]) value).length == 16) {
            final ByteBuffer buffer = ByteBuffer.wrap((byte[]) value);
            return new UUID(buffer.getLong(), buffer.getLong());
        }
        try {
            return UUID.fromString(value.toString().trim().toLowerCase(Locale.ROOT));
        } catch (final IllegalArgumentException e) {
            throw new UnsupportedKeyTypeException("Primary key value " + value + " is not a UUID", e);
        }
    }

    /**
     * Convert a JDBC value into the type that is stored in the index document.
     */
    @Nullable
    Object toDocumentValue(@Nullable final Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Double || value instanceof Float) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof BigInteger) {
            final BigInteger bigInteger = (BigInteger) value;
            return bigInteger.bitLength() < 64 ? (Object) bigInteger.longValue() : new BigDecimal(bigInteger);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros();
        }
        if (value instanceof Boolean) {
            return value;
        }
        if (value instanceof UUID) {
            return value.toString();
        }
        if (value instanceof byte[]) {
            return Base64.getEncoder().encodeToString((byte[]) value);
        }
        if (value instanceof java.sql.Timestamp) {
            return ((java.sql.Timestamp) value).toInstant().toString();
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate().toString();
        }
        if (value instanceof java.sql.Time) {
            return ((java.sql.Time) value).toLocalTime().toString();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return truncate(value.toString());
    }

    private String truncate(final String text) {
        if (maxTextLength > 0 && text.length() > maxTextLength) {
            int end = maxTextLength;
            // Never split a surrogate pair
            if (Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            return text.substring(0, end);
        }
        return text;
    }

    private static void writeValue(final ByteArrayOutputStream out, final Object value) {
        if (value instanceof Long) {
            out.write(TAG_INTEGER);
            out.writeBytes(ByteBuffer.allocate(Long.BYTES).putLong((Long) value).array());
        } else if (value instanceof Double) {
            out.write(TAG_FLOAT);
            out.writeBytes(ByteBuffer.allocate(Long.BYTES).putLong(Double.doubleToLongBits((Double) value)).array());
        } else if (value instanceof Boolean) {
            out.write(TAG_BOOLEAN);
            out.write((Boolean) value ? 1 : 0);
        } else if (value instanceof BigDecimal) {
            out.write(TAG_DECIMAL);
            writeText(out, ((BigDecimal) value).toPlainString());
        } else {
            out.write(TAG_TEXT);
            writeText(out, value.toString());
        }
    }

    private static void writeText(final ByteArrayOutputStream out, final String text) {
        final byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
        out.writeBytes(ByteBuffer.allocate(Integer.BYTES).putInt(bytes.length).array());
        out.writeBytes(bytes);
    }

    static String sha256Hex(final byte[] content) {
        final MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
        final byte[] hash = digest.digest(content);
        final StringBuilder hexString = new StringBuilder();
        for (final byte b : hash) {
            final String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
