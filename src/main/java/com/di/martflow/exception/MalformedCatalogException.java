package com.di.martflow.exception;

/** The catalog document cannot be read as a sequence of named blocks. */
public class MalformedCatalogException extends MartFlowException {

    private final int lineNumber;

    public MalformedCatalogException(int lineNumber, String reason) {
        super(ErrorCategory.CATALOG_ERROR,
                String.format("Malformed query catalog at line %d: %s", lineNumber, reason));
        this.lineNumber = lineNumber;
    }

    public MalformedCatalogException(String reason, Throwable cause) {
        super(ErrorCategory.CATALOG_ERROR, "Malformed query catalog: " + reason, cause);
        this.lineNumber = 0;
    }

    /** 1-based line number, or 0 when the document could not be read at all. */
    public int getLineNumber() {
        return lineNumber;
    }
}
