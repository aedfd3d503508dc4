package com.di.martflow.query;

import com.di.martflow.catalog.QueryCatalog;
import com.di.martflow.catalog.QueryDefinition;
import com.di.martflow.config.MartFlowProperties;
import com.di.martflow.exception.ErrorCategory;
import com.di.martflow.exception.QueryExecutionException;
import com.di.martflow.pipeline.PipelineState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs catalog statements against the warehouse.
 *
 * <p>Every statement, plan requests included, runs inside a transaction that is rolled back
 * afterwards, so nothing submitted from the catalog can change the warehouse.
 */
@Service
@Slf4j
public class QueryExecutor {

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final MartFlowProperties properties;

    public QueryExecutor(JdbcTemplate jdbc,
                         TransactionTemplate transactionTemplate,
                         MartFlowProperties properties) {
        this.jdbc = jdbc;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
    }

    /* ==================================================================== */
    /* Operations                                                            */
    /* ==================================================================== */

    /**
     * Executes the named statement and returns its rows.
     *
     * @throws com.di.martflow.exception.PreconditionNotMetException unless the state is READY
     * @throws com.di.martflow.exception.QueryNotFoundException      if the name is not in the catalog
     * @throws QueryExecutionException                                if the engine rejects the statement
     */
    public ExecutionResult run(PipelineState state, QueryCatalog catalog, String name) {
        state.requireReady("run " + name);
        return execute(catalog.get(name), false);
    }

    /** Asks the engine for the plan of the named statement instead of its rows. */
    public ExecutionResult explain(PipelineState state, QueryCatalog catalog, String name) {
        state.requireReady("explain " + name);
        return execute(catalog.get(name), true);
    }

    /**
     * Attempts every statement once, in document order. A failing statement is recorded against
     * its name and does not stop the rest.
     */
    public QueryRunReport runAll(PipelineState state, QueryCatalog catalog, boolean explain) {
        state.requireReady(explain ? "explain all" : "run all");
        List<QueryOutcome> outcomes = new ArrayList<>(catalog.size());
        for (QueryDefinition definition : catalog.definitions()) {
            outcomes.add(attempt(definition, explain));
        }
        QueryRunReport report = new QueryRunReport(outcomes);
        log.info("[QUERY] run-all finished: {} succeeded, {} failed {}",
                report.getSucceeded().size(), report.getFailed().size(), report.getFailed());
        return report;
    }

    /** Runs one definition and folds any failure into the outcome. */
    QueryOutcome attempt(QueryDefinition definition, boolean explain) {
        try {
            return QueryOutcome.success(execute(definition, explain));
        } catch (RuntimeException e) {
            log.error("[QUERY] '{}' failed [{}]: {}", definition.name(), ErrorCategory.categorize(e).getName(), e.getMessage());
            return QueryOutcome.failure(definition.name(), e);
        }
    }

    /* ==================================================================== */
    /* Internal                                                              */
    /* ==================================================================== */

    private ExecutionResult execute(QueryDefinition definition, boolean explain) {
        String name = definition.name();
        if (definition.isBlank()) {
            throw new QueryExecutionException(name, "empty statement");
        }
        String sql = explain ? explainPrefix() + definition.statementText() : definition.statementText();

        long t0 = System.nanoTime();
        try {
            ExecutionResult.ExecutionResultBuilder result = transactionTemplate.execute(status -> {
                status.setRollbackOnly();
                return jdbc.query(sql, explain ? planExtractor() : rowsExtractor());
            });
            long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
            ExecutionResult built = result.queryName(name).elapsedMs(elapsedMs).build();
            log.info("[QUERY] '{}' {} in {} ms{}", name, explain ? "explained" : "executed", elapsedMs,
                    explain ? "" : " (" + built.getRowCount() + " row(s))");
            return built;
        } catch (DataAccessException e) {
            throw new QueryExecutionException(name, engineMessage(e), ErrorCategory.categorize(e), e);
        }
    }

    private String explainPrefix() {
        return properties.getQuery().isExplainAnalyze() ? "EXPLAIN ANALYZE " : "EXPLAIN ";
    }

    private static ResultSetExtractor<ExecutionResult.ExecutionResultBuilder> rowsExtractor() {
        return rs -> {
            List<String> columns = columnLabels(rs.getMetaData());
            List<Map<String, Object>> rows = new ArrayList<>();
            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    row.put(columns.get(i), rs.getObject(i + 1));
                }
                rows.add(Collections.unmodifiableMap(row));
            }
            return ExecutionResult.builder()
                    .kind(ExecutionResult.Kind.ROWS)
                    .columns(List.copyOf(columns))
                    .rows(Collections.unmodifiableList(rows));
        };
    }

    /** DuckDB answers EXPLAIN with (explain_key, explain_value) rows; the plan is the last column. */
    private static ResultSetExtractor<ExecutionResult.ExecutionResultBuilder> planExtractor() {
        return rs -> {
            int planColumn = rs.getMetaData().getColumnCount();
            StringBuilder plan = new StringBuilder();
            while (rs.next()) {
                if (plan.length() > 0) {
                    plan.append('\n');
                }
                plan.append(rs.getString(planColumn));
            }
            return ExecutionResult.builder()
                    .kind(ExecutionResult.Kind.PLAN)
                    .plan(plan.toString());
        };
    }

    private static List<String> columnLabels(ResultSetMetaData meta) throws SQLException {
        List<String> labels = new ArrayList<>(meta.getColumnCount());
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            labels.add(meta.getColumnLabel(i));
        }
        return labels;
    }

    /** The engine's own diagnostic: the message of the innermost SQLException, if any. */
    static String engineMessage(Throwable e) {
        Throwable current = e;
        String message = e.getMessage();
        while (current != null) {
            if (current instanceof SQLException && current.getMessage() != null) {
                message = current.getMessage();
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return message;
    }
}
