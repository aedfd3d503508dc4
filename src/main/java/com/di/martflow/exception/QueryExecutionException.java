package com.di.martflow.exception;

/**
 * The engine rejected a catalog statement. Carries the engine's own diagnostic and the
 * category derived from it.
 */
public class QueryExecutionException extends MartFlowException {

    private final String queryName;
    private final String engineMessage;

    public QueryExecutionException(String queryName, String engineMessage, ErrorCategory category, Throwable cause) {
        super(category, String.format("Query '%s' failed: %s", queryName, engineMessage), cause);
        this.queryName = queryName;
        this.engineMessage = engineMessage;
    }

    public QueryExecutionException(String queryName, String engineMessage) {
        super(ErrorCategory.VALIDATION_ERROR, String.format("Query '%s' failed: %s", queryName, engineMessage));
        this.queryName = queryName;
        this.engineMessage = engineMessage;
    }

    public String getQueryName() {
        return queryName;
    }

    public String getEngineMessage() {
        return engineMessage;
    }
}
