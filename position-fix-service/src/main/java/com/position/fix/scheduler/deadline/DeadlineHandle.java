// com/position/fix/scheduler/deadline/DeadlineHandle.java
package com.position.fix.scheduler.deadline;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation token for one scheduled deadline.
 *
 * <p>The handle moves from ARMED to exactly one of FIRED or CANCELLED. Whichever transition wins
 * decides the outcome; the loser is ignored.
 */
public class DeadlineHandle {

    public enum State {
        ARMED,
        FIRED,
        CANCELLED
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.ARMED);
    private final Runnable onFire;
    private volatile Runnable onCancel;

    public DeadlineHandle(Runnable onFire) {
        this.onFire = onFire;
    }

    /**
     * Runs the callback if the handle is still armed.
     *
     * @return true if the callback ran
     */
    public boolean fire() {
        if (!state.compareAndSet(State.ARMED, State.FIRED)) {
            return false;
        }
        onFire.run();
        return true;
    }

    /**
     * @return true if this call moved the handle out of ARMED
     */
    public boolean cancel() {
        if (!state.compareAndSet(State.ARMED, State.CANCELLED)) {
            return false;
        }
        Runnable hook = onCancel;
        if (hook != null) {
            hook.run();
        }
        return true;
    }

    /**
     * Attaches the action releasing the underlying timer. Runs immediately if the handle was
     * already cancelled.
     */
    void onCancel(Runnable hook) {
        this.onCancel = hook;
        if (state.get() == State.CANCELLED) {
            hook.run();
        }
    }

    public State getState() {
        return state.get();
    }

    public boolean isArmed() {
        return state.get() == State.ARMED;
    }
}
