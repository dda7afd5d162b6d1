package com.position.fix.exception;

import com.position.fix.dto.AuthorizationStatus;

/**
 * Thrown when location authorization forbids producing a fix.
 */
public class LocationRestrictedException extends PositioningException {

    public LocationRestrictedException(String message) {
        super(ErrorType.RESTRICTED, message);
    }

    public LocationRestrictedException(String message, Throwable cause) {
        super(ErrorType.RESTRICTED, message, cause);
    }

    public static LocationRestrictedException forStatus(AuthorizationStatus status) {
        return new LocationRestrictedException("Location use is not authorized: " + status.getDescription());
    }
}
