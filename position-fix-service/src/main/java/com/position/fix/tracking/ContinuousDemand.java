package com.position.fix.tracking;

/**
 * Tells the scheduler whether continuous-tracking consumers still want samples.
 */
public interface ContinuousDemand {

    boolean hasContinuousDemand();

    /**
     * Registers an action to run whenever {@link #hasContinuousDemand()} may have changed.
     */
    void addDemandChangeListener(Runnable listener);
}
