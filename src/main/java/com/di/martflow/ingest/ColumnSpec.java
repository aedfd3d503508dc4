package com.di.martflow.ingest;

/**
 * One declared staging column.
 *
 * @param name        column name, also the expected CSV header (matched case-insensitively)
 * @param type        declared type
 * @param required    a NULL (empty) value makes the record malformed
 * @param nonNegative a negative numeric value makes the record malformed
 */
public record ColumnSpec(String name, ColumnType type, boolean required, boolean nonNegative) {

    public static ColumnSpec required(String name, ColumnType type) {
        return new ColumnSpec(name, type, true, false);
    }

    public static ColumnSpec optional(String name, ColumnType type) {
        return new ColumnSpec(name, type, false, false);
    }

    public ColumnSpec withNonNegative() {
        return new ColumnSpec(name, type, required, true);
    }
}
