package com.position.fix.scheduler;

import com.position.fix.scheduler.deadline.DeadlineHandle;
import com.position.fix.scheduler.deadline.DeadlineManager;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Deadline manager whose deadlines only fire when a test fires them.
 */
class ManualDeadlineManager implements DeadlineManager {

    private final List<DeadlineHandle> handles = new ArrayList<>();
    private final List<Duration> durations = new ArrayList<>();

    @Override
    public synchronized DeadlineHandle schedule(Duration duration, Runnable onFire) {
        DeadlineHandle handle = new DeadlineHandle(onFire);
        handles.add(handle);
        durations.add(duration);
        return handle;
    }

    synchronized DeadlineHandle handle(int index) {
        return handles.get(index);
    }

    synchronized Duration duration(int index) {
        return durations.get(index);
    }

    synchronized int scheduledCount() {
        return handles.size();
    }

    /**
     * Fires every deadline still armed.
     */
    void fireAll() {
        List<DeadlineHandle> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(handles);
        }
        snapshot.forEach(DeadlineHandle::fire);
    }

    synchronized long armedCount() {
        return handles.stream().filter(DeadlineHandle::isArmed).count();
    }
}
