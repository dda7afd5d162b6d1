// com/position/fix/scheduler/FixRequest.java
package com.position.fix.scheduler;

import com.position.fix.dto.RequestStatus;
import com.position.fix.dto.Sample;
import com.position.fix.exception.PositioningException;
import com.position.fix.scheduler.deadline.DeadlineHandle;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * One pending one-shot fix.
 *
 * <p>Status and deadline handle are only read or written inside a scheduler turn. The status moves
 * from PENDING to exactly one terminal value; the result future is completed by the scheduler
 * after the turn that set that value.
 */
@Getter
public class FixRequest {

    private final UUID id;
    private final double desiredAccuracy;
    private final Duration timeout;
    private final Instant submittedAt;
    private final Instant deadline;
    private final CompletableFuture<Sample> resultSink;

    private RequestStatus status = RequestStatus.PENDING;
    private DeadlineHandle deadlineHandle;

    public FixRequest(UUID id, double desiredAccuracy, Duration timeout, Instant submittedAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.desiredAccuracy = desiredAccuracy;
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.submittedAt = Objects.requireNonNull(submittedAt, "submittedAt must not be null");
        this.deadline = submittedAt.plus(timeout);
        this.resultSink = new CompletableFuture<>();
    }

    public boolean isPending() {
        return status == RequestStatus.PENDING;
    }

    public boolean isSatisfiedBy(Sample sample) {
        return sample != null && sample.satisfies(desiredAccuracy);
    }

    /**
     * Returns true once {@code now} has reached the deadline.
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(deadline);
    }

    void armDeadline(DeadlineHandle handle) {
        this.deadlineHandle = handle;
    }

    /**
     * Leaves PENDING for {@code terminal} and disarms the deadline.
     *
     * @return false if the request had already been resolved
     */
    boolean transitionTo(RequestStatus terminal) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        if (status.isTerminal()) {
            return false;
        }
        status = terminal;
        if (deadlineHandle != null) {
            deadlineHandle.cancel();
            deadlineHandle = null;
        }
        return true;
    }

    /**
     * Completes the result sink. Later completions are ignored by the future itself.
     */
    void deliver(Sample sample, PositioningException error) {
        if (error != null) {
            resultSink.completeExceptionally(error);
        } else {
            resultSink.complete(sample);
        }
    }

    @Override
    public String toString() {
        return "FixRequest{id=" + id + ", desiredAccuracy=" + desiredAccuracy
            + ", deadline=" + deadline + ", status=" + status + "}";
    }
}
