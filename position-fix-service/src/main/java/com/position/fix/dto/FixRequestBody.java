// com/position/fix/dto/FixRequestBody.java
package com.position.fix.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a one-shot position fix.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FixRequestBody {

    /**
     * Required horizontal accuracy in meters. A fix must be strictly more accurate.
     */
    @NotNull(message = "Desired accuracy is required")
    @Positive(message = "Desired accuracy must be positive")
    @JsonProperty("desiredAccuracy")
    private Double desiredAccuracy;

    /**
     * How long to wait for a qualifying fix. The configured default applies when absent.
     */
    @Positive(message = "Timeout must be positive")
    @JsonProperty("timeoutMs")
    private Long timeoutMs;
}
