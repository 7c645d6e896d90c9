package com.heronix.trailcam.model.domain;

import java.time.Instant;

import lombok.Builder;
import lombok.Value;

/**
 * Latest known telemetry of a camera. Always replaced as a whole so that
 * weather and telemetry come from the same fetch.
 */
@Value
@Builder
public class DeviceState {

    Integer batteryLevel;

    Double batteryLevelAvg;

    /**
     * Bars, 1 to 5
     */
    Integer signalStrength;

    Double signalStrengthAvg;

    GpsCoordinates gpsCoordinates;

    int totalPhotoCount;

    Instant lastPhotoTime;

    String lastPhotoFilename;

    WeatherSnapshot weather;

    Instant fetchedAt;
}
