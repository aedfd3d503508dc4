package com.di.martflow.exception;

import java.util.List;

/** The requested query name is not in the catalog. The message lists the valid names. */
public class QueryNotFoundException extends MartFlowException {

    private final String queryName;
    private final List<String> availableNames;

    public QueryNotFoundException(String queryName, List<String> availableNames) {
        super(ErrorCategory.QUERY_NOT_FOUND, String.format(
                "Query '%s' not found. Available: %s", queryName, String.join(", ", availableNames)));
        this.queryName = queryName;
        this.availableNames = List.copyOf(availableNames);
    }

    public String getQueryName() {
        return queryName;
    }

    public List<String> getAvailableNames() {
        return availableNames;
    }
}
