package com.letably.database;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * One row of a query result, detached from the JDBC result set.
 *
 * <p>Column labels are stored lower-cased so lookups behave the same on PostgreSQL (which folds
 * unquoted labels to lower case) and H2 (which folds them to upper case unless configured
 * otherwise). Typed getters convert between the numeric and temporal representations the two
 * drivers return; every getter returns {@code null} for SQL NULL.
 */
public final class ResultRow {

    private final Map<String, Object> values;

    public ResultRow(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((label, value) -> copy.put(normalize(label), value));
        this.values = Collections.unmodifiableMap(copy);
    }

    /** Whether the row has a column with this label. */
    public boolean has(String column) {
        return values.containsKey(normalize(column));
    }

    /** Column labels in select order. */
    public Set<String> columns() {
        return values.keySet();
    }

    /**
     * Raw driver value.
     *
     * @throws IllegalArgumentException if the row has no such column
     */
    public Object get(String column) {
        String key = normalize(column);
        if (!values.containsKey(key)) {
            throw new IllegalArgumentException("No column '" + column + "' in row " + values.keySet());
        }
        return values.get(key);
    }

    public Long getLong(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(value.toString().trim());
    }

    public Integer getInt(String column) {
        Long value = getLong(column);
        return value == null ? null : Math.toIntExact(value);
    }

    /** Long value with SQL NULL read as zero; used for counts and sums. */
    public long getLongOrZero(String column) {
        Long value = getLong(column);
        return value == null ? 0L : value;
    }

    public String getString(String column) {
        Object value = get(column);
        return value == null ? null : value.toString();
    }

    public BigDecimal getBigDecimal(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number number) {
            return new BigDecimal(number.toString());
        }
        return new BigDecimal(value.toString().trim());
    }

    /** Decimal value with SQL NULL read as zero. */
    public BigDecimal getBigDecimalOrZero(String column) {
        BigDecimal value = getBigDecimal(column);
        return value == null ? BigDecimal.ZERO : value;
    }

    public LocalDate getLocalDate(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate();
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toLocalDateTime().toLocalDate();
        }
        if (value instanceof LocalDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime.toLocalDate();
        }
        return LocalDate.parse(value.toString().trim());
    }

    public Boolean getBoolean(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.intValue() != 0;
        }
        String text = value.toString().trim();
        return "t".equalsIgnoreCase(text) || "true".equalsIgnoreCase(text) || "1".equals(text);
    }

    /** Unmodifiable view of the row, lower-cased labels in select order. */
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ResultRow other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ResultRow" + values;
    }

    private static String normalize(String label) {
        return label.toLowerCase(Locale.ROOT);
    }
}
