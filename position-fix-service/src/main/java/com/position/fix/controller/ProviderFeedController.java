// com/position/fix/controller/ProviderFeedController.java
package com.position.fix.controller;

import com.position.fix.dto.AuthorizationReport;
import com.position.fix.dto.FailureReport;
import com.position.fix.dto.ProviderModeResponse;
import com.position.fix.dto.SampleReport;
import com.position.fix.exception.ProviderFailureException;
import com.position.fix.provider.PushLocationProvider;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Endpoints the device gateway uses to feed the push location provider and to learn which power
 * mode it should run in.
 */
@Slf4j
@RestController
@RequestMapping("/api/provider")
@Validated
@RequiredArgsConstructor
@Tag(name = "Provider Feed", description = "Device gateway feed for the location provider")
public class ProviderFeedController {

    private final PushLocationProvider locationProvider;
    private final Clock clock;

    @PostMapping(value = "/samples", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Push a sample", description = "Delivers one position reading to the scheduler")
    public ResponseEntity<Void> pushSample(@Valid @RequestBody SampleReport report) {
        locationProvider.publishSample(report.toSample(clock.instant()));
        return ResponseEntity.accepted().build();
    }

    @PostMapping(value = "/authorization", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Push an authorization change")
    public ResponseEntity<Void> pushAuthorization(@Valid @RequestBody AuthorizationReport report) {
        locationProvider.publishAuthorization(report.getStatus());
        return ResponseEntity.accepted().build();
    }

    @PostMapping(value = "/failures", consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Push a provider failure", description = "Fails every pending fix request")
    public ResponseEntity<Void> pushFailure(@Valid @RequestBody FailureReport report) {
        log.warn("Device gateway reported provider failure - accessDenied: {}, message: {}",
            report.isAccessDenied(), report.getMessage());
        if (report.isAccessDenied()) {
            locationProvider.publishFailure(new SecurityException(report.getMessage()));
        } else {
            locationProvider.publishFailure(new ProviderFailureException(report.getMessage()));
        }
        return ResponseEntity.accepted().build();
    }

    @GetMapping(value = "/mode", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Requested power mode", description = "Power mode the scheduler wants the device in")
    public ResponseEntity<ProviderModeResponse> mode() {
        return ResponseEntity.ok(locationProvider.currentMode());
    }
}
