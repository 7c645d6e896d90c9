package com.heronix.trailcam.adapter.reveal;

import java.net.URI;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

import org.springframework.stereotype.Component;

import com.heronix.trailcam.config.TrailCamProperties;
import com.heronix.trailcam.exception.ApiException;
import com.heronix.trailcam.model.domain.Device;
import com.heronix.trailcam.model.domain.DeviceDiagnostics;
import com.heronix.trailcam.model.domain.DeviceFetchResult;
import com.heronix.trailcam.model.domain.DeviceState;
import com.heronix.trailcam.model.domain.GpsCoordinates;
import com.heronix.trailcam.model.domain.MediaReference;
import com.heronix.trailcam.model.domain.ServingCell;
import com.heronix.trailcam.model.domain.WeatherSnapshot;
import com.heronix.trailcam.model.enums.DeviceStatus;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Translates Reveal API payloads into domain objects.
 *
 * Field names vary between API versions (weatherRecord / weatherData /
 * weather, windSpeed / windDirection.speed), so lookups try each known alias.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RevealResponseParser {

    private static final DateTimeFormatter AMZ_DATE = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'");
    private static final String DEFAULT_MODEL = "Reveal Cell Cam";
    private static final String CAMERA_MODE_OPTION = "Camera Mode";
    private static final double EXTERNAL_POWER_THRESHOLD_VOLTS = 0.5;

    private final TrailCamProperties properties;

    // ========================================================================
    // CATALOG
    // ========================================================================

    public Device toDevice(Map<String, Object> camera) {
        String cameraId = toText(camera.get("cameraId"));
        if (cameraId == null || cameraId.isBlank()) {
            throw new ApiException(ApiException.Kind.MALFORMED, "Camera entry without cameraId");
        }

        return Device.builder()
                .deviceId(cameraId)
                .displayName(displayName(camera, cameraId))
                .locationLabel(toText(camera.get("cameraLocation")))
                .model(Objects.requireNonNullElse(toText(camera.get("cameraModel")), DEFAULT_MODEL))
                .hardwareVersion(toText(camera.get("hardwareVersion")))
                .firmwareVersion(toText(camera.get("firmwareVersion")))
                .status(DeviceStatus.ACTIVE)
                .diagnostics(toDiagnostics(camera))
                .build();
    }

    DeviceDiagnostics toDiagnostics(Map<String, Object> camera) {
        Map<String, Object> status = asMap(camera.get("status"));
        Map<String, Object> usage = asMap(camera.get("usage"));

        String powerSource = toText(status.get("voltagesource"));
        Double externalVoltage = toVoltage(status.get("voltageexternal"));
        boolean externalPower = (powerSource != null && !"Backup".equals(powerSource))
                || (externalVoltage != null && externalVoltage > EXTERNAL_POWER_THRESHOLD_VOLTS);

        Map<String, String> settings = settings(camera.get("settings"));
        Long lastTransmissionMs = toLong(status.get("lastTransmissionTimestamp"));

        return DeviceDiagnostics.builder()
                .memoryUsedMb(toLong(status.get("memory")))
                .memoryLimitMb(toLong(status.get("memoryLimit")))
                .lastTransmission(lastTransmissionMs != null ? Instant.ofEpochMilli(lastTransmissionMs) : null)
                .powerSource(powerSource)
                .internalVoltage(toVoltage(status.get("voltageinternal")))
                .externalVoltage(externalVoltage)
                .externalPower(externalPower)
                .carrier(carrier(status, camera))
                .cameraTemperature(toDouble(status.get("temperature")))
                .servingCell(ServingCell.parse(toText(status.get("servingCell"))))
                .cameraMode(settings.get(settingKey(CAMERA_MODE_OPTION)))
                .settings(settings)
                .photosTaken(toInteger(usage.get("photos")))
                .storedPhotos(toInteger(usage.get("storedPhotos")))
                .build();
    }

    // ========================================================================
    // DEVICE STATE
    // ========================================================================

    /**
     * Build the state of a camera from its photo page (newest first).
     */
    public DeviceFetchResult toDeviceState(String deviceId, List<Map<String, Object>> photos, Instant now) {
        if (photos.isEmpty()) {
            DeviceState empty = DeviceState.builder()
                    .totalPhotoCount(0)
                    .fetchedAt(now)
                    .build();
            return new DeviceFetchResult(empty, null);
        }

        Map<String, Object> latest = photos.get(0);
        Map<String, Object> metadata = asMap(latest.get("metadata"));
        List<Map<String, Object>> window = photos.subList(0, Math.min(photos.size(),
                properties.getApi().getAverageWindow()));

        DeviceState state = DeviceState.builder()
                .batteryLevel(toInteger(metadata.get("batteryLevel")))
                .batteryLevelAvg(average(window, "batteryLevel"))
                .signalStrength(toInteger(metadata.get("signal")))
                .signalStrengthAvg(average(window, "signal"))
                .gpsCoordinates(gps(latest))
                .totalPhotoCount(photos.size())
                .lastPhotoTime(toInstant(latest.get("photoDateUtc")))
                .lastPhotoFilename(toText(latest.get("filename")))
                .weather(toWeather(latest))
                .fetchedAt(now)
                .build();

        return new DeviceFetchResult(state, toMediaReference(deviceId, latest, now));
    }

    WeatherSnapshot toWeather(Map<String, Object> photo) {
        Map<String, Object> weather = firstMap(photo, "weatherRecord", "weatherData", "weather");
        if (weather.isEmpty()) {
            return null;
        }

        Map<String, Object> wind = asMap(weather.get("windDirection"));
        Map<String, Object> range = asMap(weather.get("temperatureRange12Hours"));
        Double windSpeed = toDouble(weather.get("windSpeed"));

        return WeatherSnapshot.builder()
                .temperature(toDouble(first(weather, "temperature", "currentTemp", "temp")))
                .conditions(toText(first(weather, "weatherLabel", "weather", "conditions")))
                .windSpeed(windSpeed != null ? windSpeed : toDouble(wind.get("speed")))
                .windDirection(toText(first(wind, "cardinalLabel", "direction")))
                .windGust(toDouble(weather.get("windGust")))
                .pressure(toDouble(first(weather, "barometricPressure", "pressure")))
                .pressureTendency(toText(weather.get("pressureTendency")))
                .moonPhase(toText(first(weather, "moonPhase", "moon_phase")))
                .sunPhase(toText(weather.get("sunPhase")))
                .tempMin12h(toDouble(range.get("min")))
                .tempMax12h(toDouble(range.get("max")))
                .tempDeparture24h(toDouble(weather.get("past24HoursTemperatureDeparture")))
                .build();
    }

    /**
     * The pre-signed URL carries its signing time in X-Amz-Date; without it
     * the fetch time is taken as issuance.
     */
    MediaReference toMediaReference(String deviceId, Map<String, Object> photo, Instant now) {
        String url = toText(photo.get("photoUrl"));
        if (url == null || url.isBlank()) {
            return null;
        }
        Instant signedAt = signingTime(url);
        return MediaReference.issued(deviceId, url, signedAt != null && !signedAt.isAfter(now) ? signedAt : now);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private String displayName(Map<String, Object> camera, String cameraId) {
        for (String key : List.of("cameraName", "cameraLocation", "name")) {
            String value = toText(camera.get(key));
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "Camera " + cameraId.substring(Math.max(0, cameraId.length() - 4));
    }

    private String carrier(Map<String, Object> status, Map<String, Object> camera) {
        if (status.get("eSim") instanceof List<?> sims) {
            for (Object sim : sims) {
                Map<String, Object> entry = asMap(sim);
                if (Integer.valueOf(1).equals(toInteger(entry.get("activeFlag")))) {
                    return toText(entry.get("carrier"));
                }
            }
        }
        return toText(camera.get("phoneCarrier"));
    }

    private Map<String, String> settings(Object value) {
        Map<String, String> settings = new LinkedHashMap<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                Map<String, Object> setting = asMap(item);
                String option = toText(setting.get("option"));
                String function = toText(setting.get("function"));
                if (option != null && function != null) {
                    settings.put(settingKey(option), function);
                }
            }
        }
        return settings;
    }

    private static String settingKey(String option) {
        return option.toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }

    private GpsCoordinates gps(Map<String, Object> photo) {
        Map<String, Object> location = asMap(photo.get("gpsLocation"));
        Double lat = toDouble(location.get("lat"));
        Double lon = toDouble(location.get("lon"));
        if (lat == null || lon == null) {
            Map<String, Object> metadata = asMap(photo.get("metadata"));
            lat = toDouble(metadata.get("gpsLatitude"));
            lon = toDouble(metadata.get("gpsLongitude"));
        }
        return lat != null && lon != null ? new GpsCoordinates(lat, lon) : null;
    }

    private Double average(List<Map<String, Object>> photos, String metadataKey) {
        List<Double> values = new ArrayList<>();
        for (Map<String, Object> photo : photos) {
            Double value = toDouble(asMap(photo.get("metadata")).get(metadataKey));
            if (value != null && value > 0) {
                values.add(value);
            }
        }
        OptionalDouble avg = values.stream().mapToDouble(Double::doubleValue).average();
        return avg.isPresent() ? Math.round(avg.getAsDouble() * 10.0) / 10.0 : null;
    }

    private Instant signingTime(String url) {
        try {
            String query = URI.create(url).getRawQuery();
            if (query == null) {
                return null;
            }
            for (String pair : query.split("&")) {
                if (pair.startsWith("X-Amz-Date=")) {
                    return LocalDateTime.parse(pair.substring("X-Amz-Date=".length()), AMZ_DATE)
                            .toInstant(ZoneOffset.UTC);
                }
            }
        } catch (IllegalArgumentException | DateTimeParseException e) {
            log.debug("Could not read signing time from photo URL: {}", e.getMessage());
        }
        return null;
    }

    private static Map<String, Object> firstMap(Map<String, Object> obj, String... keys) {
        for (String key : keys) {
            Map<String, Object> value = asMap(obj.get(key));
            if (!value.isEmpty()) {
                return value;
            }
        }
        return Map.of();
    }

    private static Object first(Map<String, Object> obj, String... keys) {
        for (String key : keys) {
            Object value = obj.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : Map.of();
    }

    private static String toText(Object value) {
        return value == null ? null : value.toString();
    }

    private static Double toDouble(Object value) {
        if (value == null) return null;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Integer toInteger(Object value) {
        Double number = toDouble(value);
        return number != null ? (int) Math.round(number) : null;
    }

    private static Long toLong(Object value) {
        if (value instanceof Number) return ((Number) value).longValue();
        Double number = toDouble(value);
        return number != null ? Math.round(number) : null;
    }

    /**
     * Voltages arrive as "12.4V" or "12.4".
     */
    private static Double toVoltage(Object value) {
        if (value == null) return null;
        return toDouble(value.toString().toLowerCase(Locale.ROOT).replace("v", ""));
    }

    /**
     * Epoch millis or ISO-8601; a timestamp without offset is taken as UTC.
     */
    static Instant toInstant(Object value) {
        if (value instanceof Number) {
            return Instant.ofEpochMilli(((Number) value).longValue());
        }
        if (value instanceof String text) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                return parseLocal(text);
            }
        }
        return null;
    }

    private static Instant parseLocal(String text) {
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp: {}", text);
            return null;
        }
    }
}
