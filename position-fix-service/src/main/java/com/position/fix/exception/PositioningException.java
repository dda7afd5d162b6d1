// com/position/fix/exception/PositioningException.java
package com.position.fix.exception;

import java.util.concurrent.CompletionException;

/**
 * Base class for every way a one-shot fix request can fail.
 */
public abstract class PositioningException extends RuntimeException {

    /**
     * Failure kinds surfaced to callers of a fix request.
     */
    public enum ErrorType {
        RESTRICTED("Restricted - location authorization insufficient or revoked"),
        TIMED_OUT("Timed out - no qualifying fix before the deadline"),
        CANCELLED("Cancelled - request aborted before a fix arrived"),
        PROVIDER_FAILURE("Provider failure - the location provider reported an error");

        private final String description;

        ErrorType(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final ErrorType errorType;

    protected PositioningException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    protected PositioningException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * Finds the positioning failure behind a future's completion error, looking through
     * {@link CompletionException} wrappers.
     *
     * @return the failure, or null if the error is not a positioning failure
     */
    public static PositioningException unwrap(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause instanceof PositioningException ? (PositioningException) cause : null;
    }
}
