package com.heronix.trailcam.model.domain;

import java.util.Optional;

/**
 * Outcome of a successful state fetch. A camera without photos has no media reference.
 */
public record DeviceFetchResult(DeviceState state, MediaReference mediaReference) {

    public Optional<MediaReference> media() {
        return Optional.ofNullable(mediaReference);
    }
}
