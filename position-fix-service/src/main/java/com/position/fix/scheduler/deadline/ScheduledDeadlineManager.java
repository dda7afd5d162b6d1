// com/position/fix/scheduler/deadline/ScheduledDeadlineManager.java
package com.position.fix.scheduler.deadline;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link DeadlineManager} backed by a Spring {@link TaskScheduler}.
 */
@Slf4j
@RequiredArgsConstructor
public class ScheduledDeadlineManager implements DeadlineManager {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    @Override
    public DeadlineHandle schedule(Duration duration, Runnable onFire) {
        Objects.requireNonNull(duration, "duration must not be null");
        Objects.requireNonNull(onFire, "onFire must not be null");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("Deadline duration must be positive");
        }

        DeadlineHandle handle = new DeadlineHandle(onFire);
        ScheduledFuture<?> future = taskScheduler.schedule(() -> {
            try {
                handle.fire();
            } catch (RuntimeException e) {
                log.error("Deadline callback failed", e);
            }
        }, clock.instant().plus(duration));
        handle.onCancel(() -> future.cancel(false));

        log.debug("Armed deadline in {} ms", duration.toMillis());
        return handle;
    }
}
