package com.position.fix.exception;

/**
 * Thrown when a request id is registered twice.
 */
public class DuplicateRequestIdException extends IllegalStateException {

    public DuplicateRequestIdException(String message) {
        super(message);
    }
}
