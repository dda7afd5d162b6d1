// com/position/fix/service/PositioningServiceImpl.java
package com.position.fix.service;

import com.position.fix.config.SchedulerProperties;
import com.position.fix.dto.Sample;
import com.position.fix.dto.SchedulerStatusResponse;
import com.position.fix.scheduler.OneShotRequestScheduler;
import com.position.fix.tracking.ContinuousDemand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Default {@link PositioningService} delegating to the one-shot request scheduler.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PositioningServiceImpl implements PositioningService {

    private final OneShotRequestScheduler scheduler;
    private final ContinuousDemand continuousDemand;
    private final SchedulerProperties schedulerProperties;

    @Override
    public CompletableFuture<Sample> requestOneFix(double desiredAccuracy, Duration timeout) {
        log.debug("Fix requested - desiredAccuracy: {}, timeout: {} ms", desiredAccuracy, timeout.toMillis());
        return scheduler.submit(desiredAccuracy, timeout);
    }

    @Override
    public CompletableFuture<Sample> requestOneFix(double desiredAccuracy) {
        return requestOneFix(desiredAccuracy, schedulerProperties.getOneShot().getDefaultTimeout());
    }

    @Override
    public int cancelAllPending() {
        int cancelled = scheduler.cancelAllPending();
        log.info("Cancelled {} pending fix requests", cancelled);
        return cancelled;
    }

    @Override
    public SchedulerStatusResponse getStatus() {
        return SchedulerStatusResponse.builder()
            .providerState(scheduler.getProviderState())
            .pendingRequests(scheduler.getPendingCount())
            .authorization(scheduler.getAuthorizationStatus())
            .continuousDemand(continuousDemand.hasContinuousDemand())
            .latestSample(scheduler.getLatestSample().orElse(null))
            .build();
    }
}
