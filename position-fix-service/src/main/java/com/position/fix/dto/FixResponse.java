// com/position/fix/dto/FixResponse.java
package com.position.fix.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of a one-shot fix request, either a position or an error description.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FixResponse {

    public static final String SUCCESS = "SUCCESS";
    public static final String ERROR = "ERROR";

    @JsonProperty("result")
    private String result;

    @JsonProperty("latitude")
    private Double latitude;

    @JsonProperty("longitude")
    private Double longitude;

    @JsonProperty("horizontalAccuracy")
    private Double horizontalAccuracy;

    @JsonProperty("timestamp")
    private Instant timestamp;

    @JsonProperty("errorType")
    private String errorType;

    @JsonProperty("message")
    private String message;

    public static FixResponse success(Sample sample) {
        return FixResponse.builder()
            .result(SUCCESS)
            .latitude(sample.coordinate().latitude())
            .longitude(sample.coordinate().longitude())
            .horizontalAccuracy(sample.horizontalAccuracy())
            .timestamp(sample.timestamp())
            .build();
    }

    public static FixResponse error(String errorType, String message) {
        return FixResponse.builder()
            .result(ERROR)
            .errorType(errorType)
            .message(message)
            .build();
    }
}
