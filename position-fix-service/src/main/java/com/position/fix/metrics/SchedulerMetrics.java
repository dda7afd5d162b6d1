// com/position/fix/metrics/SchedulerMetrics.java
package com.position.fix.metrics;

import com.position.fix.dto.ProviderState;
import com.position.fix.exception.PositioningException;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer instrumentation for the one-shot request scheduler.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code positioning.fix.resolved} counter, tagged with the outcome</li>
 *   <li>{@code positioning.fix.pending} gauge of registered requests</li>
 *   <li>{@code positioning.fix.time-to-fix} timer from submission to a qualifying sample</li>
 *   <li>{@code positioning.provider.transitions} counter, tagged with the target state</li>
 * </ul>
 */
@Slf4j
public class SchedulerMetrics {

    static final String RESOLVED = "positioning.fix.resolved";
    static final String PENDING = "positioning.fix.pending";
    static final String TIME_TO_FIX = "positioning.fix.time-to-fix";
    static final String TRANSITIONS = "positioning.provider.transitions";

    public static final String OUTCOME_COMPLETED = "completed";
    public static final String OUTCOME_CACHED = "cached";
    public static final String OUTCOME_EXPIRED = "expired";

    private final MeterRegistry meterRegistry;
    private final AtomicInteger pending = new AtomicInteger();
    private final Timer timeToFix;

    public SchedulerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        Gauge.builder(PENDING, pending, AtomicInteger::get)
            .description("One-shot fix requests waiting for a qualifying sample")
            .register(meterRegistry);
        this.timeToFix = Timer.builder(TIME_TO_FIX)
            .description("Time from submission until a qualifying sample resolved the request")
            .register(meterRegistry);
    }

    public void recordCompleted(Duration elapsed) {
        timeToFix.record(elapsed);
        increment(OUTCOME_COMPLETED);
    }

    public void recordCached() {
        increment(OUTCOME_CACHED);
    }

    public void recordExpired() {
        increment(OUTCOME_EXPIRED);
    }

    /**
     * Counts a request that failed for a reason other than its own deadline.
     */
    public void recordFailed(PositioningException.ErrorType errorType) {
        increment(errorType.name().toLowerCase(Locale.ROOT));
    }

    public void recordTransition(ProviderState target) {
        meterRegistry.counter(TRANSITIONS, "state", target.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void updatePending(int count) {
        pending.set(count);
    }

    private void increment(String outcome) {
        meterRegistry.counter(RESOLVED, "outcome", outcome).increment();
        log.debug("Fix request resolved - outcome: {}", outcome);
    }
}
