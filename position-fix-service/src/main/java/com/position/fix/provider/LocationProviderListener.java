package com.position.fix.provider;

import com.position.fix.dto.AuthorizationStatus;
import com.position.fix.dto.Sample;

/**
 * Callbacks from a {@link LocationProvider}. Invoked on an unspecified thread.
 */
public interface LocationProviderListener {

    void onSample(Sample sample);

    void onProviderError(Throwable error);

    void onAuthorizationChanged(AuthorizationStatus status);
}
