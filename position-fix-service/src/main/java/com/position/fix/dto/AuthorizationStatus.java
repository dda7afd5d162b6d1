package com.position.fix.dto;

/**
 * Location authorization as reported by the provider.
 */
public enum AuthorizationStatus {
    NOT_DETERMINED("Not Determined"),
    NOT_AVAILABLE("Not Available"),
    RESTRICTED("Restricted"),
    DENIED("Denied"),
    ALLOWED_WHEN_IN_USE("When In Use"),
    ALLOWED_ALWAYS("Allowed Always");

    private final String description;

    AuthorizationStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns true if this status forbids any use of location. Services switched off
     * device-wide count as forbidding, an undetermined status does not.
     */
    public boolean forbidsLocationUse() {
        return this == RESTRICTED || this == DENIED || this == NOT_AVAILABLE;
    }
}
