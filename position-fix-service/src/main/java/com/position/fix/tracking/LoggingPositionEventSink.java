package com.position.fix.tracking;

import com.position.fix.dto.AuthorizationStatus;
import com.position.fix.dto.Sample;
import com.position.fix.exception.PositioningException;
import lombok.extern.slf4j.Slf4j;

/**
 * Event sink used when no broadcaster is wired in. Records events in the log only.
 */
@Slf4j
public class LoggingPositionEventSink implements PositionEventSink {

    @Override
    public void onSample(Sample sample) {
        log.debug("Sample accepted - accuracy: {} m, timestamp: {}", sample.horizontalAccuracy(), sample.timestamp());
    }

    @Override
    public void onAuthorizationChanged(AuthorizationStatus status) {
        log.info("Location authorization is now {}", status.getDescription());
    }

    @Override
    public void onError(PositioningException error) {
        log.warn("Location error - type: {}, message: {}", error.getErrorType(), error.getMessage());
    }
}
