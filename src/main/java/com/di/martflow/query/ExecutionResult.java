package com.di.martflow.query;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Result of one catalog statement: either the rows it produced or the engine's plan for it,
 * tagged by {@link #kind}.
 */
@Value
@Builder
public class ExecutionResult {

    public enum Kind { ROWS, PLAN }

    Kind kind;
    String queryName;

    /** Column labels in result order (ROWS only). */
    @Builder.Default
    List<String> columns = List.of();

    /** One map per row, column label → value, in result order (ROWS only). */
    @Builder.Default
    List<Map<String, Object>> rows = List.of();

    /** Engine plan text (PLAN only). */
    String plan;

    long elapsedMs;

    public int getRowCount() {
        return rows.size();
    }

    public boolean isPlan() {
        return kind == Kind.PLAN;
    }
}
