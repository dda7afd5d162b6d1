package com.position.fix.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Power mode the device gateway should run its location hardware in.
 *
 * @param lowPower whether significant-change monitoring is requested
 * @param active whether high-rate updates are requested
 * @param accuracyHint requested accuracy for high-rate updates, absent when not active
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProviderModeResponse(
    @JsonProperty("lowPower") boolean lowPower,
    @JsonProperty("active") boolean active,
    @JsonProperty("accuracyHint") Double accuracyHint) {
}
