package com.position.fix.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Snapshot of the scheduler for diagnostics.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SchedulerStatusResponse {

    @JsonProperty("providerState")
    private ProviderState providerState;

    @JsonProperty("pendingRequests")
    private int pendingRequests;

    @JsonProperty("authorization")
    private AuthorizationStatus authorization;

    @JsonProperty("continuousDemand")
    private boolean continuousDemand;

    @JsonProperty("latestSample")
    private Sample latestSample;
}
