package com.heronix.trailcam.model.domain;

import java.time.Instant;

import lombok.Builder;
import lombok.Value;

/**
 * One camera inside a published {@link Snapshot}.
 */
@Value
@Builder(toBuilder = true)
public class DeviceEntry {

    Device device;

    /**
     * Null until the first successful state fetch
     */
    DeviceState state;

    MediaReference mediaReference;

    /**
     * Why the state of this entry is not from the cycle that produced it
     */
    DeviceError error;

    DeviceError mediaError;

    Instant lastSuccessAt;

    /**
     * True when the state shown is from an earlier cycle.
     */
    public boolean isStale() {
        return error != null;
    }
}
