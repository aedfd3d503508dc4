package com.di.martflow.ingest;

import java.util.List;

import static com.di.martflow.ingest.ColumnSpec.optional;
import static com.di.martflow.ingest.ColumnSpec.required;

/**
 * The three raw sources and their declared staging schemas. Every staging table also carries
 * {@link #SOURCE_ROW_COLUMN}, the 1-based data-row index, so "first seen" is explicit.
 */
public enum StagingSource {

    CUSTOMERS("customers", List.of(
            required("customer_id", ColumnType.VARCHAR),
            optional("name", ColumnType.VARCHAR),
            required("country", ColumnType.VARCHAR),
            optional("signup_date", ColumnType.DATE))),

    PRODUCTS("products", List.of(
            required("product_id", ColumnType.VARCHAR),
            required("name", ColumnType.VARCHAR),
            required("category", ColumnType.VARCHAR),
            optional("unit_price", ColumnType.DOUBLE).withNonNegative())),

    ORDERS("orders", List.of(
            required("order_id", ColumnType.VARCHAR),
            required("customer_id", ColumnType.VARCHAR),
            required("product_id", ColumnType.VARCHAR),
            required("order_timestamp", ColumnType.TIMESTAMP),
            optional("status", ColumnType.VARCHAR),
            required("quantity", ColumnType.BIGINT).withNonNegative(),
            required("unit_price", ColumnType.DOUBLE).withNonNegative()));

    public static final String STAGING_SCHEMA = "staging";
    public static final String SOURCE_ROW_COLUMN = "source_row";

    private final String sourceName;
    private final List<ColumnSpec> columns;

    StagingSource(String sourceName, List<ColumnSpec> columns) {
        this.sourceName = sourceName;
        this.columns = columns;
    }

    /** Short name used in config keys, logs and error messages ("orders"). */
    public String sourceName() {
        return sourceName;
    }

    public List<ColumnSpec> columns() {
        return columns;
    }

    public String tableName() {
        return sourceName;
    }

    public String qualifiedTable() {
        return STAGING_SCHEMA + "." + sourceName;
    }
}
