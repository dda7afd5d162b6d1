// com/position/fix/scheduler/OneShotRequestScheduler.java
package com.position.fix.scheduler;

import com.position.fix.config.SchedulerProperties;
import com.position.fix.dto.AuthorizationStatus;
import com.position.fix.dto.ProviderState;
import com.position.fix.dto.RequestStatus;
import com.position.fix.dto.Sample;
import com.position.fix.exception.FixTimedOutException;
import com.position.fix.exception.LocationRestrictedException;
import com.position.fix.exception.PositioningException;
import com.position.fix.exception.RequestCancelledException;
import com.position.fix.metrics.SchedulerMetrics;
import com.position.fix.provider.LocationProvider;
import com.position.fix.provider.LocationProviderListener;
import com.position.fix.provider.ProviderErrorMapper;
import com.position.fix.scheduler.deadline.DeadlineManager;
import com.position.fix.tracking.ContinuousDemand;
import com.position.fix.tracking.PositionEventSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Matches one-shot fix requests against the provider's sample stream and drives the provider's
 * power state from the aggregate demand.
 *
 * <p><strong>Serialization:</strong> every operation runs as one turn under a single lock. The
 * registry, the provider state, the latest sample and all provider start/stop calls are only
 * touched inside a turn, so resolving and removing a request is atomic and exactly one of sample
 * completion, deadline expiry and cancellation resolves it.
 *
 * <p><strong>Delivery:</strong> result futures and event sink notifications collected during a
 * turn are handed to the dispatch executor after the lock is released. No caller code runs while
 * the lock is held.
 *
 * <p><strong>Power state:</strong>
 * <ul>
 *   <li>ACTIVE while any one-shot request is pending, with low-power monitoring underneath</li>
 *   <li>the configured tracking mode while only continuous-tracking demand remains</li>
 *   <li>IDLE otherwise, and whenever authorization forbids location use</li>
 * </ul>
 */
@Slf4j
public class OneShotRequestScheduler implements LocationProviderListener {

    private final LocationProvider provider;
    private final DeadlineManager deadlineManager;
    private final ContinuousDemand continuousDemand;
    private final PositionEventSink eventSink;
    private final ProviderErrorMapper errorMapper;
    private final SchedulerMetrics metrics;
    private final Executor dispatcher;
    private final Clock clock;
    private final SchedulerProperties properties;

    private final ReentrantLock turnLock = new ReentrantLock();

    // Guarded by turnLock
    private final RequestRegistry registry = new RequestRegistry();
    private ProviderState providerState = ProviderState.IDLE;
    private AuthorizationStatus authorization;
    private Sample latestSample;
    private boolean lowPowerRunning;
    private boolean activeRunning;
    private double activeAccuracyHint = Double.NaN;
    private boolean shutDown;

    public OneShotRequestScheduler(LocationProvider provider,
                                   DeadlineManager deadlineManager,
                                   ContinuousDemand continuousDemand,
                                   PositionEventSink eventSink,
                                   ProviderErrorMapper errorMapper,
                                   SchedulerMetrics metrics,
                                   Executor dispatcher,
                                   Clock clock,
                                   SchedulerProperties properties) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.deadlineManager = Objects.requireNonNull(deadlineManager, "deadlineManager must not be null");
        this.continuousDemand = Objects.requireNonNull(continuousDemand, "continuousDemand must not be null");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink must not be null");
        this.errorMapper = Objects.requireNonNull(errorMapper, "errorMapper must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.authorization = provider.currentAuthorization();
    }

    /**
     * Attaches to the provider and the continuous-demand source, then applies the initial power
     * state.
     */
    public void start() {
        provider.setListener(this);
        continuousDemand.addDemandChangeListener(this::refreshProviderState);
        inTurn(deliveries -> {
            reconcileQuietly();
            return null;
        });
        log.info("One-shot request scheduler started - authorization: {}, provider state: {}",
            authorization, providerState);
    }

    /**
     * Cancels every pending request, stops the provider and detaches from it. Later submissions
     * fail with {@link RequestCancelledException}.
     */
    public void shutdown() {
        inTurn(deliveries -> {
            shutDown = true;
            int cancelled = cancelAllInTurn(new RequestCancelledException("Scheduler is shutting down"), deliveries);
            reconcileQuietly();
            log.info("One-shot request scheduler shut down - cancelled {} pending requests", cancelled);
            return null;
        });
        provider.setListener(null);
    }

    /**
     * Requests one fix strictly more accurate than {@code desiredAccuracy} within {@code timeout}.
     *
     * <p>The returned future completes exactly once: with the qualifying sample, or exceptionally
     * with a {@link PositioningException}. It is already completed when authorization forbids
     * location use or when a recent enough cached sample qualifies.
     *
     * @param desiredAccuracy required horizontal accuracy in meters, must be positive
     * @param timeout how long to wait, must be positive
     * @return the pending result
     * @throws IllegalArgumentException if a precondition is violated
     */
    public CompletableFuture<Sample> submit(double desiredAccuracy, Duration timeout) {
        if (!(desiredAccuracy > 0)) {
            throw new IllegalArgumentException("Desired accuracy must be a positive number");
        }
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }

        return inTurn(deliveries -> {
            if (shutDown) {
                return CompletableFuture.<Sample>failedFuture(
                    new RequestCancelledException("Scheduler is shut down"));
            }

            authorization = provider.currentAuthorization();
            if (authorization.forbidsLocationUse()) {
                log.warn("Rejecting fix request - authorization: {}", authorization);
                metrics.recordFailed(PositioningException.ErrorType.RESTRICTED);
                return CompletableFuture.<Sample>failedFuture(LocationRestrictedException.forStatus(authorization));
            }

            Instant now = clock.instant();
            if (isReusable(latestSample, desiredAccuracy, now)) {
                log.debug("Resolved fix request from cached sample - desiredAccuracy: {}, sampleAccuracy: {}",
                    desiredAccuracy, latestSample.horizontalAccuracy());
                metrics.recordCached();
                return CompletableFuture.completedFuture(latestSample);
            }

            FixRequest request = new FixRequest(UUID.randomUUID(), desiredAccuracy, timeout, now);
            registry.add(request);
            request.armDeadline(deadlineManager.schedule(timeout, () -> onDeadline(request.getId())));
            log.debug("Registered fix request - id: {}, desiredAccuracy: {}, timeout: {} ms, pending: {}",
                request.getId(), desiredAccuracy, timeout.toMillis(), registry.size());

            try {
                reconcileProviderState();
            } catch (RuntimeException e) {
                PositioningException mapped = errorMapper.map(e);
                log.error("Failed to start location provider for request {}", request.getId(), e);
                request.transitionTo(RequestStatus.CANCELLED);
                registry.remove(request.getId());
                metrics.recordFailed(mapped.getErrorType());
                // Release whatever part of the escalation did start
                reconcileQuietly();
                return CompletableFuture.<Sample>failedFuture(mapped);
            }
            return request.getResultSink().copy();
        });
    }

    /**
     * Callback variant of {@link #submit(double, Duration)}. The callback is invoked exactly once,
     * always on the dispatch executor.
     */
    public void submit(double desiredAccuracy, Duration timeout, FixCallback callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        submit(desiredAccuracy, timeout).whenCompleteAsync(
            (sample, error) -> callback.onResult(sample, error != null ? unwrap(error) : null),
            this::dispatch);
    }

    /**
     * Fails every pending request with {@code reason} and re-evaluates the provider state.
     *
     * @return the number of requests cancelled
     */
    public int cancelAll(PositioningException reason) {
        Objects.requireNonNull(reason, "reason must not be null");
        return inTurn(deliveries -> {
            int cancelled = cancelAllInTurn(reason, deliveries);
            reconcileQuietly();
            return cancelled;
        });
    }

    public int cancelAllPending() {
        return cancelAll(new RequestCancelledException("Pending fix requests were cancelled"));
    }

    @Override
    public void onSample(Sample sample) {
        Objects.requireNonNull(sample, "sample must not be null");
        inTurn(deliveries -> {
            latestSample = sample;
            Instant now = clock.instant();
            int resolved = 0;
            for (FixRequest request : registry.allPending()) {
                if (request.isExpiredAt(now)) {
                    expire(request, deliveries);
                    resolved++;
                } else if (request.isSatisfiedBy(sample)) {
                    complete(request, sample, now, deliveries);
                    resolved++;
                }
            }
            if (resolved > 0) {
                log.debug("Sample with accuracy {} m resolved {} requests, {} still pending",
                    sample.horizontalAccuracy(), resolved, registry.size());
            }
            deliveries.add(() -> eventSink.onSample(sample));
            reconcileQuietly();
            return null;
        });
    }

    /**
     * Expires the request if it is still pending. A request already resolved by a sample or a
     * cancellation is left alone.
     */
    public void onDeadline(UUID requestId) {
        inTurn(deliveries -> {
            Optional<FixRequest> request = registry.get(requestId).filter(FixRequest::isPending);
            if (request.isEmpty()) {
                log.debug("Ignoring deadline for already resolved request {}", requestId);
                return null;
            }
            expire(request.get(), deliveries);
            reconcileQuietly();
            return null;
        });
    }

    @Override
    public void onAuthorizationChanged(AuthorizationStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        inTurn(deliveries -> {
            authorization = status;
            if (status.forbidsLocationUse()) {
                int cancelled = cancelAllInTurn(LocationRestrictedException.forStatus(status), deliveries);
                log.warn("Location authorization revoked ({}) - failed {} pending requests", status, cancelled);
            }
            reconcileQuietly();
            deliveries.add(() -> eventSink.onAuthorizationChanged(status));
            return null;
        });
    }

    @Override
    public void onProviderError(Throwable error) {
        PositioningException mapped = errorMapper.map(error);
        inTurn(deliveries -> {
            int cancelled = cancelAllInTurn(mapped, deliveries);
            log.warn("Location provider error ({}) - failed {} pending requests: {}",
                mapped.getErrorType(), cancelled, mapped.getMessage());
            reconcileQuietly();
            deliveries.add(() -> eventSink.onError(mapped));
            return null;
        });
    }

    /**
     * Re-evaluates the provider state, for example after continuous-tracking demand changed.
     */
    public void refreshProviderState() {
        inTurn(deliveries -> {
            reconcileQuietly();
            return null;
        });
    }

    public ProviderState getProviderState() {
        return inTurn(deliveries -> providerState);
    }

    public int getPendingCount() {
        return inTurn(deliveries -> registry.size());
    }

    public Optional<Sample> getLatestSample() {
        return inTurn(deliveries -> Optional.ofNullable(latestSample));
    }

    public AuthorizationStatus getAuthorizationStatus() {
        return inTurn(deliveries -> authorization);
    }

    private <T> T inTurn(Function<List<Runnable>, T> body) {
        List<Runnable> deliveries = new ArrayList<>();
        turnLock.lock();
        try {
            T result = body.apply(deliveries);
            metrics.updatePending(registry.size());
            return result;
        } finally {
            turnLock.unlock();
            deliveries.forEach(this::dispatch);
        }
    }

    private void dispatch(Runnable delivery) {
        try {
            dispatcher.execute(delivery);
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch executor rejected a delivery, running it on the calling thread: {}", e.getMessage());
            delivery.run();
        }
    }

    private int cancelAllInTurn(PositioningException reason, List<Runnable> deliveries) {
        List<FixRequest> pending = registry.allPending();
        for (FixRequest request : pending) {
            fail(request, reason, deliveries);
        }
        return pending.size();
    }

    private void complete(FixRequest request, Sample sample, Instant now, List<Runnable> deliveries) {
        if (!request.transitionTo(RequestStatus.COMPLETED)) {
            return;
        }
        registry.remove(request.getId());
        metrics.recordCompleted(Duration.between(request.getSubmittedAt(), now));
        log.debug("Completed fix request {} with sample accuracy {} m", request.getId(), sample.horizontalAccuracy());
        deliveries.add(() -> request.deliver(sample, null));
    }

    private void expire(FixRequest request, List<Runnable> deliveries) {
        if (!request.transitionTo(RequestStatus.EXPIRED)) {
            return;
        }
        registry.remove(request.getId());
        metrics.recordExpired();
        log.debug("Fix request {} timed out after {} ms", request.getId(), request.getTimeout().toMillis());
        FixTimedOutException error = FixTimedOutException.after(request.getTimeout(), request.getDesiredAccuracy());
        deliveries.add(() -> request.deliver(null, error));
    }

    private void fail(FixRequest request, PositioningException reason, List<Runnable> deliveries) {
        if (!request.transitionTo(RequestStatus.CANCELLED)) {
            return;
        }
        registry.remove(request.getId());
        metrics.recordFailed(reason.getErrorType());
        deliveries.add(() -> request.deliver(null, reason));
    }

    private boolean isReusable(Sample sample, double desiredAccuracy, Instant now) {
        if (sample == null || !sample.satisfies(desiredAccuracy)) {
            return false;
        }
        Duration maxAge = properties.getOneShot().getMaxCachedSampleAge();
        if (maxAge == null || maxAge.isZero() || maxAge.isNegative()) {
            return false;
        }
        return !sample.timestamp().isBefore(now.minus(maxAge));
    }

    private ProviderState desiredState() {
        if (shutDown || authorization.forbidsLocationUse()) {
            return ProviderState.IDLE;
        }
        if (!registry.isEmpty()) {
            return ProviderState.ACTIVE;
        }
        if (continuousDemand.hasContinuousDemand()) {
            return properties.getTracking().getMode().getProviderState();
        }
        return ProviderState.IDLE;
    }

    /**
     * Brings the provider in line with {@link #desiredState()}. Escalation starts low-power
     * monitoring before active updates; de-escalation stops them in reverse order.
     *
     * <p>A failed start aborts the escalation. Every needed stop is attempted even if an earlier
     * one fails, and the running flags are cleared before each stop call, so they always describe
     * what was last requested from the provider. {@code providerState} is derived from those
     * flags. The first failure is rethrown once the state has been updated.
     */
    private void reconcileProviderState() {
        ProviderState target = desiredState();
        boolean needLowPower = target != ProviderState.IDLE;
        boolean needActive = target == ProviderState.ACTIVE;
        RuntimeException failure = null;

        try {
            if (needLowPower && !lowPowerRunning) {
                provider.startLowPower();
                lowPowerRunning = true;
            }
            if (needActive) {
                double hint = registry.strictestAccuracy().orElse(properties.getTracking().getActiveAccuracy());
                if (!activeRunning || Double.compare(hint, activeAccuracyHint) != 0) {
                    provider.startActive(hint);
                    activeRunning = true;
                    activeAccuracyHint = hint;
                }
            }
        } catch (RuntimeException e) {
            failure = e;
        }

        if (!needActive && activeRunning) {
            activeRunning = false;
            activeAccuracyHint = Double.NaN;
            failure = release(provider::stopActive, failure);
        }
        if (!needLowPower && lowPowerRunning) {
            lowPowerRunning = false;
            failure = release(provider::stopLowPower, failure);
        }

        ProviderState actual = activeRunning ? ProviderState.ACTIVE
            : lowPowerRunning ? ProviderState.LOW_POWER : ProviderState.IDLE;
        if (actual != providerState) {
            log.info("Provider state {} -> {} (pending: {}, continuous demand: {})",
                providerState, actual, registry.size(), continuousDemand.hasContinuousDemand());
            providerState = actual;
            metrics.recordTransition(actual);
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Reconciles the provider state and logs a provider failure instead of propagating it. Used
     * where the turn's requests are already resolved and the caller is a provider or deadline
     * thread.
     */
    private void reconcileQuietly() {
        try {
            reconcileProviderState();
        } catch (RuntimeException e) {
            log.error("Location provider failed while moving to {} - provider state is now {}",
                desiredState(), providerState, e);
        }
    }

    private static RuntimeException release(Runnable stop, RuntimeException earlier) {
        try {
            stop.run();
            return earlier;
        } catch (RuntimeException e) {
            if (earlier != null) {
                if (earlier != e) {
                    earlier.addSuppressed(e);
                }
                return earlier;
            }
            return e;
        }
    }

    private static PositioningException unwrap(Throwable error) {
        PositioningException failure = PositioningException.unwrap(error);
        return failure != null ? failure : new RequestCancelledException("Fix request ended unexpectedly", error);
    }
}
