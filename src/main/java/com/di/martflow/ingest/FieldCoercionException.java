package com.di.martflow.ingest;

/** A single raw field could not be coerced into its declared column. */
public class FieldCoercionException extends Exception {

    private final String column;

    public FieldCoercionException(String column, String message) {
        super(message);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
