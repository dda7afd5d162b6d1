package com.position.fix.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provider failure pushed by the device gateway.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FailureReport {

    @NotBlank(message = "Failure message is required")
    @Size(max = 500, message = "Failure message must be at most 500 characters")
    @JsonProperty("message")
    private String message;

    /**
     * Set when the platform rejected location access rather than failing to produce a fix.
     */
    @JsonProperty("accessDenied")
    private boolean accessDenied;
}
