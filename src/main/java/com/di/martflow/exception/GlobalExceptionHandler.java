package com.di.martflow.exception;

import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps pipeline failures to HTTP responses with a structured body.
 *
 * <table border="1">
 * <tr><th>Exception</th><th>Status</th></tr>
 * <tr><td>{@link QueryNotFoundException}</td><td>404</td></tr>
 * <tr><td>{@link PreconditionNotMetException}</td><td>409</td></tr>
 * <tr><td>{@link SourceUnavailableException}, {@link RecordMalformedException},
 *     {@link QueryExecutionException}</td><td>422</td></tr>
 * <tr><td>{@link DuplicateQueryNameException}, {@link MalformedCatalogException}</td><td>500</td></tr>
 * <tr><td>invalid request</td><td>400</td></tr>
 * <tr><td>anything else</td><td>500</td></tr>
 * </table>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(QueryNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleQueryNotFound(QueryNotFoundException e) {
        ErrorResponse body = buildErrorResponse(e, HttpStatus.NOT_FOUND);
        body.addDetail("queryName", e.getQueryName());
        body.addDetail("availableNames", e.getAvailableNames());
        logWarn("QUERY_NOT_FOUND", e);
        return respond(body);
    }

    @ExceptionHandler(PreconditionNotMetException.class)
    public ResponseEntity<ErrorResponse> handlePrecondition(PreconditionNotMetException e) {
        logWarn("PRECONDITION_NOT_MET", e);
        return respond(buildErrorResponse(e, HttpStatus.CONFLICT));
    }

    @ExceptionHandler(SourceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleSourceUnavailable(SourceUnavailableException e) {
        ErrorResponse body = buildErrorResponse(e, HttpStatus.UNPROCESSABLE_ENTITY);
        body.addDetail("source", e.getSource());
        body.addDetail("location", e.getLocation());
        logError("SOURCE_UNAVAILABLE", e);
        return respond(body);
    }

    @ExceptionHandler(RecordMalformedException.class)
    public ResponseEntity<ErrorResponse> handleRecordMalformed(RecordMalformedException e) {
        ErrorResponse body = buildErrorResponse(e, HttpStatus.UNPROCESSABLE_ENTITY);
        body.addDetail("source", e.getSource());
        body.addDetail("recordIndex", e.getRecordIndex());
        if (e.getColumn() != null) {
            body.addDetail("column", e.getColumn());
        }
        logError("RECORD_MALFORMED", e);
        return respond(body);
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ErrorResponse> handleQueryExecution(QueryExecutionException e) {
        ErrorResponse body = buildErrorResponse(e, HttpStatus.UNPROCESSABLE_ENTITY);
        body.addDetail("queryName", e.getQueryName());
        body.addDetail("engineMessage", e.getEngineMessage());
        logError("QUERY_EXECUTION", e);
        return respond(body);
    }

    @ExceptionHandler(DuplicateQueryNameException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateQueryName(DuplicateQueryNameException e) {
        ErrorResponse body = buildErrorResponse(e, HttpStatus.INTERNAL_SERVER_ERROR);
        body.addDetail("queryName", e.getQueryName());
        body.addDetail("firstLine", e.getFirstLine());
        body.addDetail("duplicateLine", e.getDuplicateLine());
        logError("CATALOG_DUPLICATE", e);
        return respond(body);
    }

    @ExceptionHandler(MalformedCatalogException.class)
    public ResponseEntity<ErrorResponse> handleMalformedCatalog(MalformedCatalogException e) {
        ErrorResponse body = buildErrorResponse(e, HttpStatus.INTERNAL_SERVER_ERROR);
        body.addDetail("lineNumber", e.getLineNumber());
        logError("CATALOG_MALFORMED", e);
        return respond(body);
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleValidation(Exception e) {
        logWarn("VALIDATION_EXCEPTION", e);
        return respond(buildErrorResponse(e, HttpStatus.BAD_REQUEST));
    }

    /** Catch-all. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logError("UNHANDLED_EXCEPTION", e);
        return respond(buildErrorResponse(e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    /* ------------------------------------------------------------------ */

    private void logError(String eventType, Throwable e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.error("[API] {} [{}] path={}: {}", eventType, category.getName(), getRequestPath(), e.getMessage(), e);
    }

    private void logWarn(String eventType, Throwable e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.warn("[API] {} [{}] path={}: {}", eventType, category.getName(), getRequestPath(), e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorResponse body) {
        return ResponseEntity.status(body.getStatus()).body(body);
    }

    ErrorResponse buildErrorResponse(Throwable exception, HttpStatus status) {
        ErrorCategory category = ErrorCategory.categorize(exception);
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName());
        response.setErrorCategory(category.name());
        response.setErrorCategoryName(category.getName());
        response.setPath(getRequestPath());
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = getRootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static Throwable getRootCause(Throwable exception) {
        Throwable cause = exception.getCause();
        if (cause == null || cause == exception) {
            return exception;
        }
        return getRootCause(cause);
    }

    private static String getRequestPath() {
        String path = MDC.get("requestPath");
        return path != null ? path : "/unknown";
    }

    /** Structured error body for API endpoints. */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryName;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
