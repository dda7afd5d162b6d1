package com.position.fix.service;

import com.position.fix.dto.Sample;
import com.position.fix.dto.SchedulerStatusResponse;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Application-facing API for one-shot position fixes.
 */
public interface PositioningService {

    /**
     * Requests a fix strictly more accurate than {@code desiredAccuracy} within {@code timeout}.
     *
     * @param desiredAccuracy required horizontal accuracy in meters
     * @param timeout maximum wait
     * @return future completing with the fix or a {@link com.position.fix.exception.PositioningException}
     */
    CompletableFuture<Sample> requestOneFix(double desiredAccuracy, Duration timeout);

    /**
     * Same as {@link #requestOneFix(double, Duration)} with the configured default timeout.
     */
    CompletableFuture<Sample> requestOneFix(double desiredAccuracy);

    /**
     * Cancels all pending fix requests.
     *
     * @return the number of requests cancelled
     */
    int cancelAllPending();

    SchedulerStatusResponse getStatus();
}
