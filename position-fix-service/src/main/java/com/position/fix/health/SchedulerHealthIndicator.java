// com/position/fix/health/SchedulerHealthIndicator.java
package com.position.fix.health;

import com.position.fix.dto.AuthorizationStatus;
import com.position.fix.scheduler.OneShotRequestScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the scheduler's provider state and backlog.
 *
 * <p>DOWN when location authorization forbids producing fixes, UP otherwise.
 */
@Slf4j
@Component("positionScheduler")
@RequiredArgsConstructor
public class SchedulerHealthIndicator implements HealthIndicator {

    private final OneShotRequestScheduler scheduler;

    @Override
    public Health health() {
        try {
            AuthorizationStatus authorization = scheduler.getAuthorizationStatus();
            Health.Builder builder = authorization.forbidsLocationUse() ? Health.down() : Health.up();
            return builder
                .withDetail("authorization", authorization.name())
                .withDetail("providerState", scheduler.getProviderState().name())
                .withDetail("pendingRequests", scheduler.getPendingCount())
                .withDetail("hasLatestSample", scheduler.getLatestSample().isPresent())
                .build();
        } catch (Exception e) {
            log.error("Error checking scheduler health", e);
            return Health.down().withDetail("error", e.getMessage()).build();
        }
    }
}
