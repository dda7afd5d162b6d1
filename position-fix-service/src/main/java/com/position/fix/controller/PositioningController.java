// com/position/fix/controller/PositioningController.java
package com.position.fix.controller;

import com.position.fix.dto.FixRequestBody;
import com.position.fix.dto.FixResponse;
import com.position.fix.dto.Sample;
import com.position.fix.dto.SchedulerStatusResponse;
import com.position.fix.exception.PositioningException;
import com.position.fix.service.PositioningService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * REST controller for one-shot position fixes.
 *
 * HTTP Status Code Mapping:
 * - 200 OK: a qualifying fix arrived
 * - 400 Bad Request: validation errors
 * - 403 Forbidden: location authorization forbids fixes
 * - 409 Conflict: the request was cancelled
 * - 502 Bad Gateway: the location provider failed
 * - 504 Gateway Timeout: no qualifying fix before the deadline
 */
@Slf4j
@RestController
@RequestMapping("/api/positioning")
@Validated
@RequiredArgsConstructor
@Tag(name = "Position Fix", description = "APIs for one-shot position fixes")
public class PositioningController {

    private final PositioningService positioningService;

    @PostMapping(value = "/fix", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Request a fix", description = "Waits for one position fix better than the desired accuracy")
    public CompletableFuture<ResponseEntity<FixResponse>> requestFix(@Valid @RequestBody FixRequestBody request) {
        CompletableFuture<Sample> fix = request.getTimeoutMs() != null
            ? positioningService.requestOneFix(request.getDesiredAccuracy(), Duration.ofMillis(request.getTimeoutMs()))
            : positioningService.requestOneFix(request.getDesiredAccuracy());

        return fix.handle((sample, error) -> {
            if (error == null) {
                return ResponseEntity.ok(FixResponse.success(sample));
            }
            return errorResponse(error);
        });
    }

    @DeleteMapping(value = "/fix", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Cancel pending fixes", description = "Cancels every pending fix request")
    public ResponseEntity<Map<String, Object>> cancelAll() {
        int cancelled = positioningService.cancelAllPending();
        return ResponseEntity.ok(Map.of("cancelled", cancelled));
    }

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Scheduler status", description = "Provider state, backlog and latest sample")
    public ResponseEntity<SchedulerStatusResponse> status() {
        return ResponseEntity.ok(positioningService.getStatus());
    }

    private ResponseEntity<FixResponse> errorResponse(Throwable error) {
        PositioningException failure = PositioningException.unwrap(error);
        if (failure == null) {
            log.error("Unexpected error while waiting for a fix", error);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(FixResponse.error("INTERNAL_ERROR", "An unexpected error occurred"));
        }
        log.debug("Fix request failed - type: {}, message: {}", failure.getErrorType(), failure.getMessage());
        return ResponseEntity.status(determineHttpStatus(failure.getErrorType()))
            .body(FixResponse.error(failure.getErrorType().name(), failure.getMessage()));
    }

    static HttpStatus determineHttpStatus(PositioningException.ErrorType errorType) {
        switch (errorType) {
            case RESTRICTED:
                return HttpStatus.FORBIDDEN;
            case TIMED_OUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            case CANCELLED:
                return HttpStatus.CONFLICT;
            case PROVIDER_FAILURE:
                return HttpStatus.BAD_GATEWAY;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
