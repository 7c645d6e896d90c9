package com.heronix.trailcam.model.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Displayable entity for one camera, as consumed by the host automation platform.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CameraEntityDTO {

    private String cameraId;

    private String cameraName;

    private String location;

    /**
     * "active" or "missing"
     */
    private String status;

    /**
     * False only after sustained authentication failure
     */
    private boolean available;

    /**
     * True when the last cycle failed for this camera and values are carried over
     */
    private boolean stale;

    private String error;

    private String model;

    private String firmwareVersion;

    private String hardwareVersion;

    private Integer totalPhotos;

    private Integer batteryLevel;

    private Integer signalStrength;

    private Double averageBattery;

    private Double averageSignal;

    private Double temperature;

    /**
     * Weather condition label
     */
    private String weather;

    private String moonPhase;

    private String sunPhase;

    private Double windSpeed;

    private String windDirection;

    private Double windGust;

    private Double barometricPressure;

    private String pressureTendency;

    private Double temperatureRange12hMin;

    private Double temperatureRange12hMax;

    private Double temperatureDeparture24h;

    private String gpsCoordinates;

    private Instant lastPhotoTime;

    private String lastPhotoFilename;

    private boolean hasImage;

    private Instant imageExpiresAt;

    // Diagnostics

    private Double sdCardUsage;

    private Boolean online;

    private String connectionStatus;

    private Instant lastTransmission;

    private Boolean externalPower;

    private String powerSource;

    private Double internalVoltage;

    private Double externalVoltage;

    private String carrier;

    private Double cameraTemperature;

    private Double uptimeHours;

    /**
     * Network type and band, e.g. "FDD LTE - LTE BAND 4"
     */
    private String servingCell;

    private String networkType;

    private String cellBand;

    private Integer rssi;

    private Integer rsrp;

    private Integer rsrq;

    private String cellSignalQuality;

    private String cameraMode;

    private Integer photosTaken;

    private Integer storedPhotos;
}
