package com.di.martflow.exception;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for pipeline logging, query reports and REST error bodies.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>Pipeline exceptions carry their own category; engine errors are found by walking the cause
 * chain to the first {@link SQLException}. To add a new category: add the enum constant (before
 * UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum ErrorCategory {

    SOURCE_UNAVAILABLE("Source unavailable", "A declared raw source cannot be located or opened"),
    RECORD_MALFORMED("Malformed record", "A raw record failed type coercion"),
    CATALOG_ERROR("Catalog error", "The query catalog document is malformed or has duplicate names"),
    QUERY_NOT_FOUND("Query not found", "The requested query name is not in the catalog"),
    PRECONDITION_NOT_MET("Precondition not met", "The warehouse is not in the state the operation requires"),
    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain the warehouse connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "The engine could not parse the statement"),
    SQL_SEMANTIC_ERROR("SQL semantic error", "The statement references unknown objects or mismatched types"),
    DATA_CONVERSION_ERROR("Data conversion error", "A value could not be converted at runtime"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    DATABASE_ERROR("Database error", "General database operation error"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        if (exception instanceof MartFlowException) {
            return ((MartFlowException) exception).getCategory();
        }
        SQLException sqlEx = findSqlException(exception);
        if (sqlEx != null) {
            return categorizeSqlException(sqlEx);
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    /**
     * Categorizes an engine error. DuckDB reports most errors without SQLState, prefixing the
     * message with its error class ("Parser Error: ...", "Binder Error: ...").
     */
    static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "parser error", "syntax error", "parse error")) return SQL_SYNTAX_ERROR;
            if (containsAny(lower, "binder error", "catalog error", "does not exist", "not found")) return SQL_SEMANTIC_ERROR;
            if (containsAny(lower, "conversion error", "invalid input", "could not convert", "out of range")) return DATA_CONVERSION_ERROR;
            if (containsAny(lower, "constraint error", "constraint", "unique", "foreign key")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "transaction", "rolled back", "conflict")) return TRANSACTION_ROLLBACK;
            if (containsAny(lower, "connection", "closed", "could not set lock", "io error")) return CONNECTION_ERROR;
        }
        return DATABASE_ERROR;
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "22", DATA_CONVERSION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK
    );

    private static SQLException findSqlException(Throwable t) {
        Throwable current = t;
        int depth = 0;
        while (current != null && depth++ < 16) {
            if (current instanceof SQLException) {
                return (SQLException) current;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    // --- Matcher helpers ---

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof org.springframework.dao.QueryTimeoutException
                || messageContains(t, "timeout", "timed out");
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof StackOverflowError
                || t instanceof java.io.IOException
                || t instanceof java.io.UncheckedIOException;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        return msg != null && containsAny(msg.toLowerCase(), keywords);
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
