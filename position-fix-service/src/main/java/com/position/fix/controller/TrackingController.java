package com.position.fix.controller;

import com.position.fix.tracking.TrackingDemandRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

/**
 * Registers and releases continuous-tracking demand.
 */
@RestController
@RequestMapping("/api/tracking")
@RequiredArgsConstructor
@Tag(name = "Continuous Tracking", description = "Continuous-tracking demand registration")
public class TrackingController {

    private final TrackingDemandRegistry trackingDemandRegistry;

    @PostMapping("/{consumerId}")
    @Operation(summary = "Start tracking for a consumer")
    public ResponseEntity<Void> startTracking(@PathVariable String consumerId) {
        boolean added = trackingDemandRegistry.startTracking(consumerId);
        return ResponseEntity.status(added ? HttpStatus.CREATED : HttpStatus.OK).build();
    }

    @DeleteMapping("/{consumerId}")
    @Operation(summary = "Stop tracking for a consumer")
    public ResponseEntity<Void> stopTracking(@PathVariable String consumerId) {
        boolean removed = trackingDemandRegistry.stopTracking(consumerId);
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @GetMapping
    @Operation(summary = "List tracking consumers")
    public ResponseEntity<Set<String>> consumers() {
        return ResponseEntity.ok(trackingDemandRegistry.getConsumers());
    }
}
