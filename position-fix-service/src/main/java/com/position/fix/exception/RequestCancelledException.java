package com.position.fix.exception;

/**
 * Thrown when a pending request was cancelled before a fix arrived.
 */
public class RequestCancelledException extends PositioningException {

    public RequestCancelledException(String message) {
        super(ErrorType.CANCELLED, message);
    }

    public RequestCancelledException(String message, Throwable cause) {
        super(ErrorType.CANCELLED, message, cause);
    }
}
