package com.di.martflow.exception;

/**
 * A raw record failed coercion into its declared staging schema. Thrown only under the
 * ABORT policy (or when the CSV stream itself cannot be tokenised).
 */
public class RecordMalformedException extends MartFlowException {

    private final String source;
    private final long recordIndex;
    private final String column;

    public RecordMalformedException(String source, long recordIndex, String column, String reason) {
        super(ErrorCategory.RECORD_MALFORMED, format(source, recordIndex, column, reason));
        this.source = source;
        this.recordIndex = recordIndex;
        this.column = column;
    }

    public RecordMalformedException(String source, long recordIndex, String column, String reason, Throwable cause) {
        super(ErrorCategory.RECORD_MALFORMED, format(source, recordIndex, column, reason), cause);
        this.source = source;
        this.recordIndex = recordIndex;
        this.column = column;
    }

    private static String format(String source, long recordIndex, String column, String reason) {
        return column == null
                ? String.format("Malformed record %d in source '%s': %s", recordIndex, source, reason)
                : String.format("Malformed record %d in source '%s', column '%s': %s", recordIndex, source, column, reason);
    }

    public String getSource() {
        return source;
    }

    /** 1-based data-row index (the header is not counted). */
    public long getRecordIndex() {
        return recordIndex;
    }

    /** Offending column, or null when the whole row is unusable. */
    public String getColumn() {
        return column;
    }
}
