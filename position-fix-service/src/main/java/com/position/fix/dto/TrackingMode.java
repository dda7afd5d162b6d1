package com.position.fix.dto;

/**
 * Provider state to fall back to when no one-shot request is pending but continuous-tracking
 * consumers still want samples.
 */
public enum TrackingMode {
    LOW_POWER(ProviderState.LOW_POWER),
    ACTIVE(ProviderState.ACTIVE);

    private final ProviderState providerState;

    TrackingMode(ProviderState providerState) {
        this.providerState = providerState;
    }

    public ProviderState getProviderState() {
        return providerState;
    }
}
