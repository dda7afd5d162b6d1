package com.position.fix.scheduler;

import com.position.fix.dto.Sample;
import com.position.fix.exception.PositioningException;

/**
 * Callback variant of a one-shot fix result. Invoked exactly once, asynchronously.
 */
@FunctionalInterface
public interface FixCallback {

    /**
     * @param sample the qualifying reading, null on failure
     * @param error the failure, null on success
     */
    void onResult(Sample sample, PositioningException error);
}
