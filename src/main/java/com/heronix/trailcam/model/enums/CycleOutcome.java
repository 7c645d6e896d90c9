package com.heronix.trailcam.model.enums;

/**
 * Result classification of a synchronization cycle.
 */
public enum CycleOutcome {

    /**
     * Every device state was fetched
     */
    SUCCESS,

    /**
     * Snapshot published, but one or more devices kept stale data
     */
    PARTIAL,

    /**
     * Session or catalog failure; no snapshot was published
     */
    FAILED,

    /**
     * Cycle abandoned at a phase boundary during shutdown
     */
    CANCELLED
}
