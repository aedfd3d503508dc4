package com.di.martflow.exception;

/**
 * A declared raw source cannot be located, opened or matched against its declared columns.
 * Fatal: the run aborts before anything is staged.
 */
public class SourceUnavailableException extends MartFlowException {

    private final String source;
    private final String location;

    public SourceUnavailableException(String source, String location, String reason) {
        super(ErrorCategory.SOURCE_UNAVAILABLE,
                String.format("Source '%s' unavailable at '%s': %s", source, location, reason));
        this.source = source;
        this.location = location;
    }

    public SourceUnavailableException(String source, String location, String reason, Throwable cause) {
        super(ErrorCategory.SOURCE_UNAVAILABLE,
                String.format("Source '%s' unavailable at '%s': %s", source, location, reason), cause);
        this.source = source;
        this.location = location;
    }

    public String getSource() {
        return source;
    }

    public String getLocation() {
        return location;
    }
}
