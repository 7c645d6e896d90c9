package com.heronix.trailcam.adapter.reveal;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.heronix.trailcam.adapter.CameraCloudAdapter;
import com.heronix.trailcam.config.TrailCamProperties;
import com.heronix.trailcam.exception.ApiException;
import com.heronix.trailcam.exception.AuthException;
import com.heronix.trailcam.model.domain.Credential;
import com.heronix.trailcam.model.domain.Device;
import com.heronix.trailcam.model.domain.DeviceFetchResult;
import com.heronix.trailcam.model.domain.Session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Adapter for Tactacam Reveal cellular cameras.
 *
 * Reveal authenticates through an AWS Cognito user pool and serves:
 * - Account
 * - Cameras (with status, usage and settings)
 * - Photos (with metadata, weather and a 7-day pre-signed URL)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RevealCameraAdapter implements CameraCloudAdapter {

    private final CognitoIdentityClient identityClient;
    private final RevealApiClient apiClient;
    private final PresignedMediaClient mediaClient;
    private final RevealResponseParser parser;
    private final TrailCamProperties properties;
    private final Clock clock;

    @Override
    public String getVendorName() {
        return "Tactacam Reveal";
    }

    @Override
    public Session authenticate(Credential credential) {
        return identityClient.initiatePasswordAuth(credential);
    }

    @Override
    public Session refreshSession(Session session) {
        return identityClient.initiateRefreshAuth(session);
    }

    @Override
    public Optional<String> fetchAccountId(Session session) {
        Map<String, Object> account = apiClient.getAccount(session);
        Object accountId = account.get("accountId");
        return Optional.ofNullable(accountId).map(Object::toString);
    }

    @Override
    public ConnectionTestResult testConnection(Credential credential) {
        log.info("Testing Reveal connection for: {}", credential.identifier());

        try {
            long startTime = System.currentTimeMillis();
            Session session = identityClient.initiatePasswordAuth(credential);
            String accountId = null;
            try {
                accountId = fetchAccountId(session).orElse(null);
            } catch (ApiException e) {
                log.warn("Account lookup failed during connection test: {}", e.getMessage());
            }
            long responseTime = System.currentTimeMillis() - startTime;

            return ConnectionTestResult.success("Authenticated as " + credential.identifier(), accountId, responseTime);

        } catch (AuthException e) {
            log.error("Reveal connection test failed: {}", e.getMessage());
            return ConnectionTestResult.failure(e.getKind() + ": " + e.getMessage());
        }
    }

    @Override
    public List<Device> listDevices(Session session) {
        List<Device> devices = new ArrayList<>();
        for (Map<String, Object> camera : apiClient.getCameras(session)) {
            devices.add(parser.toDevice(camera));
        }
        return devices;
    }

    @Override
    public DeviceFetchResult fetchDeviceState(Session session, String deviceId) {
        List<Map<String, Object>> photos = apiClient.getPhotos(session, deviceId,
                properties.getApi().getPhotoSampleSize());
        if (photos.isEmpty()) {
            log.debug("No photos found for camera {}", deviceId);
        }
        return parser.toDeviceState(deviceId, photos, clock.instant());
    }

    @Override
    public byte[] downloadMedia(String remoteUrl) {
        return mediaClient.download(remoteUrl);
    }
}
