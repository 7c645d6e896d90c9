package com.heronix.trailcam.model.domain;

import java.time.Instant;

import com.heronix.trailcam.exception.ApiException;
import com.heronix.trailcam.exception.MediaFetchException;

/**
 * Error marker attached to a snapshot entry whose data could not be refreshed.
 */
public record DeviceError(Source source, String kind, String message, Instant occurredAt) {

    public enum Source {
        STATE_FETCH,
        MEDIA_FETCH,
        CATALOG
    }

    public static DeviceError of(ApiException e, Instant at) {
        return new DeviceError(Source.STATE_FETCH, e.getKind().name(), e.getMessage(), at);
    }

    public static DeviceError notInCatalog(Instant at) {
        return new DeviceError(Source.CATALOG, "NOT_IN_CATALOG", "Camera no longer listed for the account", at);
    }

    public static DeviceError of(MediaFetchException e, Instant at) {
        return new DeviceError(Source.MEDIA_FETCH, e.getKind().name(), e.getMessage(), at);
    }
}
