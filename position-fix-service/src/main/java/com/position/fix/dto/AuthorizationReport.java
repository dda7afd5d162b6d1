package com.position.fix.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Authorization change pushed by the device gateway.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthorizationReport {

    @NotNull(message = "Authorization status is required")
    @JsonProperty("status")
    private AuthorizationStatus status;
}
