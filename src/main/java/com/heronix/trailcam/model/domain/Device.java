package com.heronix.trailcam.model.domain;

import com.heronix.trailcam.model.enums.DeviceStatus;

import lombok.Builder;
import lombok.Value;

/**
 * A camera registered to the account. Identity is {@link #deviceId}; every
 * other field is refreshed from each catalog fetch.
 */
@Value
@Builder(toBuilder = true)
public class Device {

    String deviceId;

    String displayName;

    String locationLabel;

    String model;

    String hardwareVersion;

    String firmwareVersion;

    @Builder.Default
    DeviceStatus status = DeviceStatus.ACTIVE;

    DeviceDiagnostics diagnostics;

    public Device markMissing() {
        return status == DeviceStatus.MISSING ? this : toBuilder().status(DeviceStatus.MISSING).build();
    }
}
