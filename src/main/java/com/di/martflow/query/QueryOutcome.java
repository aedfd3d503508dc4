package com.di.martflow.query;

import com.di.martflow.exception.ErrorCategory;
import lombok.Builder;
import lombok.Value;

/** Per-statement entry of a {@link QueryRunReport}: a result or the failure that replaced it. */
@Value
@Builder
public class QueryOutcome {
    String queryName;
    boolean succeeded;
    ExecutionResult result;
    String error;
    ErrorCategory errorCategory;

    public static QueryOutcome success(ExecutionResult result) {
        return QueryOutcome.builder()
                .queryName(result.getQueryName())
                .succeeded(true)
                .result(result)
                .build();
    }

    public static QueryOutcome failure(String queryName, Throwable error) {
        return QueryOutcome.builder()
                .queryName(queryName)
                .succeeded(false)
                .error(error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName())
                .errorCategory(ErrorCategory.categorize(error))
                .build();
    }
}
