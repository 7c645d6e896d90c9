package com.heronix.trailcam.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.heronix.trailcam.adapter.CameraCloudAdapter;
import com.heronix.trailcam.model.domain.Device;
import com.heronix.trailcam.model.domain.Session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Lists the cameras registered to the account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeviceCatalogFetcher {

    private final CameraCloudAdapter adapter;

    /**
     * Fetch the catalog with one entry per device id. When the vendor repeats
     * an id, the last occurrence wins.
     *
     * @throws com.heronix.trailcam.exception.ApiException on failure
     */
    public List<Device> listDevices(Session session) {
        List<Device> devices = adapter.listDevices(session);

        Map<String, Device> byId = new LinkedHashMap<>();
        for (Device device : devices) {
            byId.put(device.getDeviceId(), device);
        }
        if (byId.size() < devices.size()) {
            log.warn("Catalog repeated {} camera id(s)", devices.size() - byId.size());
        }
        return new ArrayList<>(byId.values());
    }
}
