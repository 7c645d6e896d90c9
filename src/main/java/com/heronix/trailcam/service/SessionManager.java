package com.heronix.trailcam.service;

import java.time.Clock;
import java.time.Duration;

import org.springframework.stereotype.Service;

import com.heronix.trailcam.adapter.CameraCloudAdapter;
import com.heronix.trailcam.config.TrailCamProperties;
import com.heronix.trailcam.exception.ApiException;
import com.heronix.trailcam.exception.AuthException;
import com.heronix.trailcam.model.domain.Credential;
import com.heronix.trailcam.model.domain.Session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Obtains and renews identity sessions.
 *
 * The manager holds no session itself; the caller owns the current session
 * and swaps in whatever this service returns.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionManager {

    private final CameraCloudAdapter adapter;
    private final CredentialStore credentialStore;
    private final TrailCamProperties properties;
    private final Clock clock;

    /**
     * Log in with the stored credential.
     */
    public Session authenticate() {
        return authenticate(credentialStore.get());
    }

    /**
     * Log in and attach the account id when the account lookup succeeds.
     */
    public Session authenticate(Credential credential) {
        Session session = adapter.authenticate(credential);
        log.info("Authenticated with {}, session valid until {}", adapter.getVendorName(), session.expiresAt());
        return withAccount(session);
    }

    /**
     * Return the session unchanged when it outlives the renewal margin,
     * otherwise a renewed one. A null session is authenticated from scratch.
     *
     * @throws AuthException with {@code REFRESH_REJECTED} when neither refresh
     *                       nor re-authentication succeeds
     */
    public Session ensureValid(Session session) {
        if (session == null) {
            return authenticate();
        }
        if (session.isValidAt(clock.instant(), renewalMargin())) {
            return session;
        }
        log.info("Session expires at {}, renewing", session.expiresAt());
        return renew(session);
    }

    /**
     * Renew regardless of expiry, after the camera API rejected the access token.
     */
    public Session forceRenew(Session session) {
        if (session == null) {
            return authenticate();
        }
        log.info("Access token rejected, forcing session renewal");
        return renew(session);
    }

    /**
     * Time that must remain on a session at the start of a cycle. Never
     * shorter than one poll interval so a session cannot lapse between cycles.
     */
    public Duration renewalMargin() {
        long margin = Math.max(properties.getIdentity().getSessionMarginSeconds(),
                properties.getPoll().getIntervalSeconds());
        return Duration.ofSeconds(margin);
    }

    public CameraCloudAdapter.ConnectionTestResult testConnection() {
        return adapter.testConnection(credentialStore.get());
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private Session renew(Session session) {
        AuthException refreshFailure = null;

        if (session.hasRefreshToken()) {
            try {
                Session renewed = adapter.refreshSession(session);
                log.info("Session refreshed, valid until {}", renewed.expiresAt());
                return renewed.accountId() != null ? renewed : withAccount(renewed);
            } catch (AuthException e) {
                log.warn("Session refresh failed ({}), re-authenticating", e.getKind());
                refreshFailure = e;
            }
        }

        try {
            return authenticate();
        } catch (AuthException e) {
            AuthException rejected = new AuthException(AuthException.Kind.REFRESH_REJECTED,
                    "Session renewal failed: " + e.getMessage(), e);
            if (refreshFailure != null) {
                rejected.addSuppressed(refreshFailure);
            }
            throw rejected;
        }
    }

    private Session withAccount(Session session) {
        try {
            return adapter.fetchAccountId(session)
                    .map(accountId -> {
                        log.info("Using account {}", accountId);
                        return session.withAccountId(accountId);
                    })
                    .orElse(session);
        } catch (ApiException e) {
            log.warn("Account lookup failed: {}", e.getMessage());
            return session;
        }
    }
}
