package com.position.fix.dto;

/**
 * Power state the scheduler keeps the location provider in.
 */
public enum ProviderState {
    /** No provider activity. */
    IDLE,
    /** Significant-change monitoring only. */
    LOW_POWER,
    /** High-rate tracking, with low-power monitoring kept running underneath. */
    ACTIVE
}
