package com.di.martflow.exception;

/**
 * Two blocks of a catalog document share an identifier. Raised at load time, before any query
 * runs; the earlier definition is never overwritten.
 */
public class DuplicateQueryNameException extends MartFlowException {

    private final String queryName;
    private final int firstLine;
    private final int duplicateLine;

    public DuplicateQueryNameException(String queryName, int firstLine, int duplicateLine) {
        super(ErrorCategory.CATALOG_ERROR, String.format(
                "Duplicate query name '%s' at line %d (first defined at line %d)",
                queryName, duplicateLine, firstLine));
        this.queryName = queryName;
        this.firstLine = firstLine;
        this.duplicateLine = duplicateLine;
    }

    public String getQueryName() {
        return queryName;
    }

    public int getFirstLine() {
        return firstLine;
    }

    public int getDuplicateLine() {
        return duplicateLine;
    }
}
