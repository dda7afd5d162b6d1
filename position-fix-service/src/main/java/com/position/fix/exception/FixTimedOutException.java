package com.position.fix.exception;

import java.time.Duration;

/**
 * Thrown when no qualifying sample arrived before a request's deadline.
 */
public class FixTimedOutException extends PositioningException {

    public FixTimedOutException(String message) {
        super(ErrorType.TIMED_OUT, message);
    }

    public static FixTimedOutException after(Duration timeout, double desiredAccuracy) {
        return new FixTimedOutException(
            "No fix better than " + desiredAccuracy + " m within " + timeout.toMillis() + " ms");
    }
}
