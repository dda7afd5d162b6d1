package com.position.fix.exception;

/**
 * Wraps an error reported by the location provider. Terminal for every request pending at the
 * time it occurs.
 */
public class ProviderFailureException extends PositioningException {

    public ProviderFailureException(String message) {
        super(ErrorType.PROVIDER_FAILURE, message);
    }

    public ProviderFailureException(String message, Throwable cause) {
        super(ErrorType.PROVIDER_FAILURE, message, cause);
    }
}
