package com.position.fix.scheduler.deadline;

import java.time.Duration;

/**
 * Schedules one-off deadline callbacks.
 *
 * <p>{@code onFire} runs at most once, no earlier than {@code duration} after scheduling, on a
 * thread owned by the implementation. Callers resynchronize onto their own serialization point.
 */
public interface DeadlineManager {

    DeadlineHandle schedule(Duration duration, Runnable onFire);

    /**
     * Cancels a scheduled deadline. Idempotent. If cancellation wins the race against firing,
     * {@code onFire} is never invoked.
     *
     * @return true if this call prevented the callback from running
     */
    default boolean cancel(DeadlineHandle handle) {
        return handle != null && handle.cancel();
    }
}
