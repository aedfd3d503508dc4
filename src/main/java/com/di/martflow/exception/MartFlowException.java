package com.di.martflow.exception;

/**
 * Base type for every pipeline error. Each subtype names one error kind and the
 * {@link ErrorCategory} it reports under.
 */
public abstract class MartFlowException extends RuntimeException {

    private final ErrorCategory category;

    protected MartFlowException(ErrorCategory category, String message) {
        super(message);
        this.category = category;
    }

    protected MartFlowException(ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
