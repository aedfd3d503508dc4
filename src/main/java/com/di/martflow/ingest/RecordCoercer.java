package com.di.martflow.ingest;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;

/**
 * Coerces raw CSV fields into declared staging values.
 *
 * <p>Rules:
 * <ul>
 *   <li>surrounding whitespace is trimmed; an empty field is NULL</li>
 *   <li>BIGINT: base-10 integer ({@code "2.0"} is rejected)</li>
 *   <li>DOUBLE: decimal or scientific notation, finite values only</li>
 *   <li>DATE: ISO {@code yyyy-MM-dd}</li>
 *   <li>TIMESTAMP: {@code yyyy-MM-dd HH:mm[:ss[.fraction]]}, the same with a {@code T}
 *       separator, or a bare date (midnight). Zone offsets are rejected.</li>
 * </ul>
 * Coerced values are {@link String}, {@link Long}, {@link Double}, {@link LocalDate} or
 * {@link LocalDateTime}.
 */
public final class RecordCoercer {

    private static final DateTimeFormatter TIMESTAMP_IN = new DateTimeFormatterBuilder()
            .appendPattern("uuuu-MM-dd HH:mm")
            .optionalStart()
            .appendLiteral(':')
            .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .optionalEnd()
            .optionalEnd()
            .toFormatter(Locale.ROOT);

    /** Canonical text handed to the engine's TIMESTAMP cast. */
    private static final DateTimeFormatter TIMESTAMP_OUT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss.SSSSSS", Locale.ROOT);

    private RecordCoercer() {
    }

    /**
     * Coerces a full record. {@code fields} must already be aligned with {@code columns}.
     *
     * @throws FieldCoercionException on the first field that violates its column
     */
    public static Object[] coerceRecord(List<ColumnSpec> columns, String[] fields) throws FieldCoercionException {
        Object[] values = new Object[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
            values[i] = coerce(columns.get(i), fields[i]);
        }
        return values;
    }

    public static Object coerce(ColumnSpec column, String raw) throws FieldCoercionException {
        String text = raw == null ? "" : raw.trim();
        if (text.isEmpty()) {
            if (column.required()) {
                throw new FieldCoercionException(column.name(), "required value is empty");
            }
            return null;
        }
        return switch (column.type()) {
            case VARCHAR -> text;
            case BIGINT -> checkSign(column, parseLong(column, text));
            case DOUBLE -> checkSign(column, parseDouble(column, text));
            case DATE -> parseDate(column, text);
            case TIMESTAMP -> parseTimestamp(column, text);
        };
    }

    /** Converts a coerced value into the text or number bound for the INSERT. */
    public static Object toBindValue(Object value) {
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).format(TIMESTAMP_OUT);
        }
        if (value instanceof LocalDate) {
            return value.toString();
        }
        return value;
    }

    private static Long parseLong(ColumnSpec column, String text) throws FieldCoercionException {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new FieldCoercionException(column.name(), "not an integer: '" + text + "'");
        }
    }

    private static Double parseDouble(ColumnSpec column, String text) throws FieldCoercionException {
        double d;
        try {
            d = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new FieldCoercionException(column.name(), "not a number: '" + text + "'");
        }
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            throw new FieldCoercionException(column.name(), "not a finite number: '" + text + "'");
        }
        return d;
    }

    private static <N extends Number> N checkSign(ColumnSpec column, N value) throws FieldCoercionException {
        if (column.nonNegative() && value.doubleValue() < 0) {
            throw new FieldCoercionException(column.name(), "negative value: " + value);
        }
        return value;
    }

    private static LocalDate parseDate(ColumnSpec column, String text) throws FieldCoercionException {
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new FieldCoercionException(column.name(), "not a date (yyyy-MM-dd): '" + text + "'");
        }
    }

    private static LocalDateTime parseTimestamp(ColumnSpec column, String text) throws FieldCoercionException {
        try {
            if (text.length() == 10) {
                return LocalDate.parse(text).atStartOfDay();
            }
            return LocalDateTime.parse(text.replace('T', ' '), TIMESTAMP_IN);
        } catch (DateTimeParseException e) {
            throw new FieldCoercionException(column.name(), "not a timestamp: '" + text + "'");
        }
    }
}
