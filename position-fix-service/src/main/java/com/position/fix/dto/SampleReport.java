// com/position/fix/dto/SampleReport.java
package com.position.fix.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A position reading pushed by the device gateway.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SampleReport {

    @NotNull(message = "Latitude is required")
    @DecimalMin(value = "-90.0", message = "Latitude must be at least -90")
    @DecimalMax(value = "90.0", message = "Latitude must be at most 90")
    @JsonProperty("latitude")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    @DecimalMin(value = "-180.0", message = "Longitude must be at least -180")
    @DecimalMax(value = "180.0", message = "Longitude must be at most 180")
    @JsonProperty("longitude")
    private Double longitude;

    /**
     * Horizontal accuracy in meters; zero or negative means the device has no fix yet.
     */
    @NotNull(message = "Horizontal accuracy is required")
    @JsonProperty("horizontalAccuracy")
    private Double horizontalAccuracy;

    /**
     * Reading time; the receive time is used when absent.
     */
    @JsonProperty("timestamp")
    private Instant timestamp;

    public Sample toSample(Instant receivedAt) {
        return Sample.of(latitude, longitude, horizontalAccuracy, timestamp != null ? timestamp : receivedAt);
    }
}
