package com.heronix.trailcam.model.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Token set issued by the identity provider.
 *
 * Sessions are never mutated: a renewal produces a new instance which the
 * coordinator swaps in.
 */
public record Session(
        String accessToken,
        String idToken,
        String refreshToken,
        Instant issuedAt,
        Instant expiresAt,
        String accountId
) {

    /**
     * Check if the session can still be used for a full cycle.
     *
     * @param now    current time
     * @param margin time that must remain before expiry
     */
    public boolean isValidAt(Instant now, Duration margin) {
        return accessToken != null && now.isBefore(expiresAt.minus(margin));
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    public Session withAccountId(String accountId) {
        return new Session(accessToken, idToken, refreshToken, issuedAt, expiresAt, accountId);
    }

    @Override
    public String toString() {
        return "Session[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + ", accountId=" + accountId + "]";
    }
}
