// com/position/fix/provider/LocationProvider.java
package com.position.fix.provider;

import com.position.fix.dto.AuthorizationStatus;

/**
 * Adapter over the platform location source.
 *
 * <p>Only the scheduler calls the start and stop methods, always from within one of its serialized
 * turns. All four are idempotent: starting a running mode or stopping a stopped one has no
 * observable effect, except that {@link #startActive(double)} on a running active mode applies the
 * new accuracy hint.
 *
 * <p>Implementations deliver samples, failures and authorization changes to the registered
 * {@link LocationProviderListener} from any thread.
 */
public interface LocationProvider {

    /**
     * Starts significant-change monitoring.
     */
    void startLowPower();

    void stopLowPower();

    /**
     * Starts high-rate updates.
     *
     * @param accuracyHint horizontal accuracy in meters the consumer is interested in
     */
    void startActive(double accuracyHint);

    void stopActive();

    /**
     * Returns the authorization currently granted for location use.
     */
    AuthorizationStatus currentAuthorization();

    /**
     * Registers the single listener that receives provider callbacks, replacing any previous one.
     * A null listener detaches.
     */
    void setListener(LocationProviderListener listener);
}
