package com.heronix.trailcam.model.enums;

/**
 * What started a synchronization cycle.
 */
public enum SyncTrigger {
    SCHEDULED,
    MANUAL
}
