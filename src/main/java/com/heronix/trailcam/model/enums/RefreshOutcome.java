package com.heronix.trailcam.model.enums;

/**
 * Response to an out-of-band refresh request.
 */
public enum RefreshOutcome {

    /**
     * No cycle was running; a new one was started
     */
    STARTED,

    /**
     * A cycle is running; one follow-up cycle was queued behind it
     */
    QUEUED,

    /**
     * A follow-up cycle was already queued; this request joined it
     */
    COALESCED,

    /**
     * The coordinator is shutting down
     */
    REJECTED
}
