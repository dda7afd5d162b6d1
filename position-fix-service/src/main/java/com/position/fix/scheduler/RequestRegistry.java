// com/position/fix/scheduler/RequestRegistry.java
package com.position.fix.scheduler;

import com.position.fix.exception.DuplicateRequestIdException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.UUID;

/**
 * The set of pending one-shot requests, keyed by id.
 *
 * <p>Not thread-safe: the owning scheduler only touches it inside its serialized turns. Iteration
 * order is unspecified and nothing may depend on it.
 */
public class RequestRegistry {

    private final Map<UUID, FixRequest> pending = new HashMap<>();

    /**
     * @throws DuplicateRequestIdException if a request with the same id is already registered
     */
    public void add(FixRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (pending.containsKey(request.getId())) {
            throw new DuplicateRequestIdException("Request id already registered: " + request.getId());
        }
        pending.put(request.getId(), request);
    }

    public void remove(UUID id) {
        pending.remove(id);
    }

    public Optional<FixRequest> get(UUID id) {
        return Optional.ofNullable(pending.get(id));
    }

    /**
     * Returns a snapshot of the pending requests; later mutations are not reflected in it.
     */
    public List<FixRequest> allPending() {
        return List.copyOf(pending.values());
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    public int size() {
        return pending.size();
    }

    /**
     * Smallest desired accuracy among pending requests, empty when none are pending.
     */
    public OptionalDouble strictestAccuracy() {
        return pending.values().stream()
            .mapToDouble(FixRequest::getDesiredAccuracy)
            .min();
    }
}
