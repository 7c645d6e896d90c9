package com.heronix.trailcam.model.enums;

/**
 * Phases of one synchronization cycle, in execution order.
 */
public enum CyclePhase {
    IDLE,
    ACQUIRING_SESSION,
    FETCHING_CATALOG,
    FETCHING_DEVICE_STATES,
    PUBLISHING
}
