package com.position.fix.tracking;

import com.position.fix.dto.AuthorizationStatus;
import com.position.fix.dto.Sample;
import com.position.fix.exception.PositioningException;

/**
 * Outbound boundary for continuous-tracking consumers and authorization or error observers.
 *
 * <p>The scheduler calls these methods outside its serialized turn, on its dispatch executor.
 */
public interface PositionEventSink {

    void onSample(Sample sample);

    void onAuthorizationChanged(AuthorizationStatus status);

    void onError(PositioningException error);
}
