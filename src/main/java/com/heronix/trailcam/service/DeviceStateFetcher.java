package com.heronix.trailcam.service;

import org.springframework.stereotype.Service;

import com.heronix.trailcam.adapter.CameraCloudAdapter;
import com.heronix.trailcam.model.domain.DeviceFetchResult;
import com.heronix.trailcam.model.domain.Session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches the current state of one camera.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceStateFetcher {

    private final CameraCloudAdapter adapter;

    /**
     * A camera without photos yields a state with no media reference.
     *
     * @throws com.heronix.trailcam.exception.ApiException with {@code NOT_FOUND}
     *         when the camera disappeared after the catalog fetch
     */
    public DeviceFetchResult fetchState(Session session, String deviceId) {
        DeviceFetchResult result = adapter.fetchDeviceState(session, deviceId);
        log.debug("Fetched state for camera {}: {} photos", deviceId, result.state().getTotalPhotoCount());
        return result;
    }
}
