// com/position/fix/tracking/TrackingDemandRegistry.java
package com.position.fix.tracking;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracks which consumers currently want continuous updates.
 *
 * <p>Fan-out of samples to those consumers happens downstream of the {@link PositionEventSink};
 * this registry only answers whether any demand exists and notifies listeners when the answer may
 * have changed.
 */
@Slf4j
public class TrackingDemandRegistry implements ContinuousDemand {

    private final Set<String> consumers = ConcurrentHashMap.newKeySet();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * @return false if the consumer was already registered
     */
    public boolean startTracking(String consumerId) {
        Objects.requireNonNull(consumerId, "consumerId must not be null");
        boolean added = consumers.add(consumerId);
        if (added) {
            log.info("Continuous tracking started for consumer '{}', {} active", consumerId, consumers.size());
            notifyListeners();
        }
        return added;
    }

    /**
     * @return false if the consumer was not registered
     */
    public boolean stopTracking(String consumerId) {
        Objects.requireNonNull(consumerId, "consumerId must not be null");
        boolean removed = consumers.remove(consumerId);
        if (removed) {
            log.info("Continuous tracking stopped for consumer '{}', {} active", consumerId, consumers.size());
            notifyListeners();
        }
        return removed;
    }

    public Set<String> getConsumers() {
        return Set.copyOf(consumers);
    }

    @Override
    public boolean hasContinuousDemand() {
        return !consumers.isEmpty();
    }

    @Override
    public void addDemandChangeListener(Runnable listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    private void notifyListeners() {
        for (Runnable listener : listeners) {
            listener.run();
        }
    }
}
