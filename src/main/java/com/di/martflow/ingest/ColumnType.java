package com.di.martflow.ingest;

import java.sql.Types;

/**
 * Declared staging column types. Dates and timestamps travel to the engine as canonical text
 * and are cast in the INSERT, so the driver only ever binds strings, longs and doubles.
 */
public enum ColumnType {

    VARCHAR("VARCHAR", Types.VARCHAR, "?"),
    BIGINT("BIGINT", Types.BIGINT, "?"),
    DOUBLE("DOUBLE", Types.DOUBLE, "?"),
    DATE("DATE", Types.VARCHAR, "CAST(? AS DATE)"),
    TIMESTAMP("TIMESTAMP", Types.VARCHAR, "CAST(? AS TIMESTAMP)");

    private final String sqlType;
    private final int bindType;
    private final String placeholder;

    ColumnType(String sqlType, int bindType, String placeholder) {
        this.sqlType = sqlType;
        this.bindType = bindType;
        this.placeholder = placeholder;
    }

    public String sqlType() {
        return sqlType;
    }

    /** JDBC type used when binding the (coerced) value or a NULL. */
    public int bindType() {
        return bindType;
    }

    /** Placeholder expression for this column in a parameterised INSERT. */
    public String placeholder() {
        return placeholder;
    }
}
