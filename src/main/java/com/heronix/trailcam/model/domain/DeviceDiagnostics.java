package com.heronix.trailcam.model.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

/**
 * Hardware health reported in the camera catalog (storage, power, radio, settings).
 */
@Value
@Builder
public class DeviceDiagnostics {

    private static final Duration ONLINE_WINDOW = Duration.ofHours(24);
    private static final Duration MAX_UPTIME = Duration.ofDays(365);

    Long memoryUsedMb;

    Long memoryLimitMb;

    Instant lastTransmission;

    /**
     * "Backup" when running on internal batteries
     */
    String powerSource;

    Double internalVoltage;

    Double externalVoltage;

    boolean externalPower;

    String carrier;

    /**
     * Internal temperature in Celsius
     */
    Double cameraTemperature;

    ServingCell servingCell;

    String cameraMode;

    /**
     * All camera settings keyed by snake_case option name
     */
    @Builder.Default
    Map<String, String> settings = Map.of();

    Integer photosTaken;

    Integer storedPhotos;

    /**
     * SD card usage in percent, rounded to one decimal.
     */
    public Double getSdCardUsagePercent() {
        if (memoryUsedMb == null || memoryLimitMb == null || memoryLimitMb <= 0) {
            return null;
        }
        return Math.round(memoryUsedMb * 1000.0 / memoryLimitMb) / 10.0;
    }

    /**
     * A camera is online when it transmitted within the last 24 hours.
     */
    public boolean isOnlineAt(Instant now) {
        return lastTransmission != null
                && Duration.between(lastTransmission, now).compareTo(ONLINE_WINDOW) < 0;
    }

    /**
     * Hours since the last transmission, rounded to two decimals. Null when
     * unknown, in the future or more than a year ago.
     */
    public Double uptimeHoursAt(Instant now) {
        if (lastTransmission == null) {
            return null;
        }
        Duration since = Duration.between(lastTransmission, now);
        if (since.isNegative() || since.compareTo(MAX_UPTIME) > 0) {
            return null;
        }
        return Math.round(since.toMillis() / 36_000.0) / 100.0;
    }

    /**
     * Human readable recency of the last transmission.
     */
    public String connectionStatusAt(Instant now) {
        if (lastTransmission == null) {
            return "Unknown";
        }
        Duration since = Duration.between(lastTransmission, now);
        if (since.compareTo(Duration.ofHours(1)) < 0) {
            return "Recently Active";
        } else if (since.compareTo(Duration.ofHours(12)) < 0) {
            return "Active Today";
        } else if (since.compareTo(ONLINE_WINDOW) < 0) {
            return "Active Yesterday";
        } else if (since.compareTo(Duration.ofDays(7)) < 0) {
            return "Active This Week";
        }
        return "Inactive";
    }
}
