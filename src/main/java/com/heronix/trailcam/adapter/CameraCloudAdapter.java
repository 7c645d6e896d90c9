package com.heronix.trailcam.adapter;

import java.util.List;
import java.util.Optional;

import com.heronix.trailcam.model.domain.Credential;
import com.heronix.trailcam.model.domain.Device;
import com.heronix.trailcam.model.domain.DeviceFetchResult;
import com.heronix.trailcam.model.domain.Session;

/**
 * Interface for camera cloud vendors.
 *
 * Hides the vendor's identity provider, REST API and media storage behind
 * domain types so the synchronization core never sees wire formats.
 */
public interface CameraCloudAdapter {

    /**
     * Vendor name used in logs and status.
     */
    String getVendorName();

    // ========================================================================
    // IDENTITY
    // ========================================================================

    /**
     * Log in with the account credential.
     *
     * @throws com.heronix.trailcam.exception.AuthException on rejection or provider failure
     */
    Session authenticate(Credential credential);

    /**
     * Renew a session with its refresh token.
     *
     * @return a new session; the refresh token is carried over when the provider does not rotate it
     * @throws com.heronix.trailcam.exception.AuthException when renewal is refused
     */
    Session refreshSession(Session session);

    /**
     * Look up the vendor account id for an authenticated session.
     */
    Optional<String> fetchAccountId(Session session);

    /**
     * Verify the credential with a full login round-trip.
     */
    ConnectionTestResult testConnection(Credential credential);

    // ========================================================================
    // CAMERA API
    // ========================================================================

    /**
     * List the cameras registered to the account, in no particular order.
     *
     * @throws com.heronix.trailcam.exception.ApiException on failure
     */
    List<Device> listDevices(Session session);

    /**
     * Fetch telemetry, weather and the latest photo reference of one camera.
     *
     * @throws com.heronix.trailcam.exception.ApiException on failure
     */
    DeviceFetchResult fetchDeviceState(Session session, String deviceId);

    // ========================================================================
    // MEDIA
    // ========================================================================

    /**
     * Download photo bytes from a pre-signed URL.
     *
     * @throws com.heronix.trailcam.exception.MediaFetchException on failure
     */
    byte[] downloadMedia(String remoteUrl);

    // ========================================================================
    // RESULT TYPES
    // ========================================================================

    /**
     * Result of a connection test.
     */
    record ConnectionTestResult(
            boolean success,
            String message,
            String accountId,
            long responseTimeMs
    ) {
        public static ConnectionTestResult success(String message, String accountId, long responseTime) {
            return new ConnectionTestResult(true, message, accountId, responseTime);
        }

        public static ConnectionTestResult failure(String message) {
            return new ConnectionTestResult(false, message, null, 0);
        }
    }
}
