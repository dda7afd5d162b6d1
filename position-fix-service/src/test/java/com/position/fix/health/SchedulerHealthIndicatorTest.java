// com/position/fix/health/SchedulerHealthIndicatorTest.java
package com.position.fix.health;

import com.position.fix.dto.AuthorizationStatus;
import com.position.fix.dto.ProviderState;
import com.position.fix.scheduler.OneShotRequestScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SchedulerHealthIndicator.
 */
@ExtendWith(MockitoExtension.class)
class SchedulerHealthIndicatorTest {

    @Mock
    private OneShotRequestScheduler scheduler;

    private SchedulerHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        healthIndicator = new SchedulerHealthIndicator(scheduler);
    }

    @Test
    void health_WhenAuthorized_ReturnsUpWithDetails() {
        // Given
        when(scheduler.getAuthorizationStatus()).thenReturn(AuthorizationStatus.ALLOWED_WHEN_IN_USE);
        when(scheduler.getProviderState()).thenReturn(ProviderState.ACTIVE);
        when(scheduler.getPendingCount()).thenReturn(2);
        when(scheduler.getLatestSample()).thenReturn(Optional.empty());

        // When
        Health health = healthIndicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
            .containsEntry("authorization", "ALLOWED_WHEN_IN_USE")
            .containsEntry("providerState", "ACTIVE")
            .containsEntry("pendingRequests", 2)
            .containsEntry("hasLatestSample", false);
    }

    @Test
    void health_WhenDenied_ReturnsDown() {
        // Given
        when(scheduler.getAuthorizationStatus()).thenReturn(AuthorizationStatus.DENIED);
        when(scheduler.getProviderState()).thenReturn(ProviderState.IDLE);
        when(scheduler.getPendingCount()).thenReturn(0);
        when(scheduler.getLatestSample()).thenReturn(Optional.empty());

        // When
        Health health = healthIndicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("authorization", "DENIED");
    }

    @Test
    void health_WhenSchedulerThrows_ReturnsDownWithError() {
        // Given
        when(scheduler.getAuthorizationStatus()).thenThrow(new IllegalStateException("lock poisoned"));

        // When
        Health health = healthIndicator.health();

        // Then
        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "lock poisoned");
    }
}
