package com.heronix.trailcam.model.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Pre-signed URL of a camera's latest photo. The URL cannot be renewed; a
 * new one arrives with the next state fetch.
 */
public record MediaReference(String deviceId, String remoteUrl, Instant issuedAt, Instant expiresAt) {

    public static final Duration LIFETIME = Duration.ofDays(7);

    public static MediaReference issued(String deviceId, String remoteUrl, Instant issuedAt) {
        return new MediaReference(deviceId, remoteUrl, issuedAt, issuedAt.plus(LIFETIME));
    }

    /**
     * A reference is expired from {@code expiresAt} onwards.
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean sameUrl(MediaReference other) {
        return other != null && remoteUrl.equals(other.remoteUrl);
    }
}
