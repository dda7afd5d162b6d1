// com/position/fix/provider/PushLocationProvider.java
package com.position.fix.provider;

import com.position.fix.dto.AuthorizationStatus;
import com.position.fix.dto.ProviderModeResponse;
import com.position.fix.dto.Sample;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Location provider fed from outside the process.
 *
 * <p>A device gateway pushes readings, failures and authorization changes in through the
 * {@code publish*} methods and polls {@link #currentMode()} to learn which power mode the scheduler
 * currently wants its location hardware in. Start and stop calls only record the requested mode.
 */
@Slf4j
public class PushLocationProvider implements LocationProvider {

    private volatile LocationProviderListener listener;
    private volatile AuthorizationStatus authorization;

    private volatile boolean lowPowerRunning;
    private volatile boolean activeRunning;
    private volatile double activeAccuracyHint;

    public PushLocationProvider(AuthorizationStatus initialAuthorization) {
        this.authorization = Objects.requireNonNull(initialAuthorization, "initialAuthorization must not be null");
    }

    @Override
    public void startLowPower() {
        if (!lowPowerRunning) {
            lowPowerRunning = true;
            log.info("Low-power monitoring requested");
        }
    }

    @Override
    public void stopLowPower() {
        if (lowPowerRunning) {
            lowPowerRunning = false;
            log.info("Low-power monitoring released");
        }
    }

    @Override
    public void startActive(double accuracyHint) {
        if (!activeRunning || activeAccuracyHint != accuracyHint) {
            activeAccuracyHint = accuracyHint;
            activeRunning = true;
            log.info("Active updates requested with accuracy hint {} m", accuracyHint);
        }
    }

    @Override
    public void stopActive() {
        if (activeRunning) {
            activeRunning = false;
            log.info("Active updates released");
        }
    }

    @Override
    public AuthorizationStatus currentAuthorization() {
        return authorization;
    }

    @Override
    public void setListener(LocationProviderListener listener) {
        this.listener = listener;
    }

    /**
     * Delivers a reading to the registered listener. Readings arriving while nothing is listening
     * are dropped.
     */
    public void publishSample(Sample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        LocationProviderListener current = listener;
        if (current == null) {
            log.debug("Dropping sample with no listener attached: {}", sample);
            return;
        }
        current.onSample(sample);
    }

    public void publishFailure(Throwable error) {
        LocationProviderListener current = listener;
        if (current == null) {
            log.warn("Provider failure with no listener attached: {}", error != null ? error.getMessage() : null);
            return;
        }
        current.onProviderError(error);
    }

    /**
     * Records a new authorization status and notifies the listener if it changed.
     */
    public void publishAuthorization(AuthorizationStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        AuthorizationStatus previous = authorization;
        authorization = status;
        if (previous == status) {
            return;
        }
        log.info("Authorization changed from {} to {}", previous, status);
        LocationProviderListener current = listener;
        if (current != null) {
            current.onAuthorizationChanged(status);
        }
    }

    public ProviderModeResponse currentMode() {
        boolean active = activeRunning;
        return new ProviderModeResponse(lowPowerRunning, active, active ? activeAccuracyHint : null);
    }

    public boolean isLowPowerRunning() {
        return lowPowerRunning;
    }

    public boolean isActiveRunning() {
        return activeRunning;
    }
}
