package com.heronix.trailcam.model.enums;

/**
 * Presence of a camera in the account catalog.
 */
public enum DeviceStatus {

    /**
     * Camera was listed by the latest catalog fetch
     */
    ACTIVE,

    /**
     * Camera was absent from the latest catalog, or vanished between
     * catalog and state fetch. Kept so that referencing entities survive.
     */
    MISSING
}
