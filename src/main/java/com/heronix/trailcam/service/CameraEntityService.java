package com.heronix.trailcam.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.heronix.trailcam.exception.CameraNotFoundException;
import com.heronix.trailcam.model.domain.Device;
import com.heronix.trailcam.model.domain.DeviceDiagnostics;
import com.heronix.trailcam.model.domain.DeviceEntry;
import com.heronix.trailcam.model.domain.DeviceState;
import com.heronix.trailcam.model.domain.ServingCell;
import com.heronix.trailcam.model.domain.WeatherSnapshot;
import com.heronix.trailcam.model.dto.CameraEntityDTO;

import lombok.RequiredArgsConstructor;

/**
 * Maps the published snapshot to camera entities for the host platform.
 */
@Service
@RequiredArgsConstructor
public class CameraEntityService {

    private final SyncCoordinator coordinator;
    private final MediaReferenceCache mediaCache;
    private final Clock clock;

    public List<CameraEntityDTO> listCameras() {
        boolean available = coordinator.isAvailable();
        Instant now = clock.instant();
        return coordinator.getSnapshot().entries().values().stream()
                .map(entry -> toEntity(entry, available, now))
                .toList();
    }

    public CameraEntityDTO getCamera(String cameraId) {
        DeviceEntry entry = coordinator.getSnapshot().get(cameraId)
                .orElseThrow(() -> new CameraNotFoundException(cameraId));
        return toEntity(entry, coordinator.isAvailable(), clock.instant());
    }

    /**
     * Latest cached photo of a camera.
     *
     * @return empty when the camera has no photo yet
     * @throws CameraNotFoundException for an unknown camera
     */
    public Optional<byte[]> getImage(String cameraId) {
        if (coordinator.getSnapshot().get(cameraId).isEmpty()) {
            throw new CameraNotFoundException(cameraId);
        }
        return mediaCache.cached(cameraId).map(MediaReferenceCache.CachedMedia::bytes);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private CameraEntityDTO toEntity(DeviceEntry entry, boolean available, Instant now) {
        Device device = entry.getDevice();
        CameraEntityDTO.CameraEntityDTOBuilder builder = CameraEntityDTO.builder()
                .cameraId(device.getDeviceId())
                .cameraName(device.getDisplayName())
                .location(device.getLocationLabel())
                .status(device.getStatus().name().toLowerCase(Locale.ROOT))
                .available(available)
                .stale(entry.isStale())
                .error(entry.getError() != null ? entry.getError().message() : null)
                .model(device.getModel())
                .firmwareVersion(device.getFirmwareVersion())
                .hardwareVersion(device.getHardwareVersion());

        DeviceState state = entry.getState();
        if (state != null) {
            builder.totalPhotos(state.getTotalPhotoCount())
                    .batteryLevel(state.getBatteryLevel())
                    .signalStrength(state.getSignalStrength())
                    .averageBattery(state.getBatteryLevelAvg())
                    .averageSignal(state.getSignalStrengthAvg())
                    .gpsCoordinates(state.getGpsCoordinates() != null ? state.getGpsCoordinates().format() : null)
                    .lastPhotoTime(state.getLastPhotoTime())
                    .lastPhotoFilename(state.getLastPhotoFilename());
            applyWeather(builder, state.getWeather());
        }

        mediaCache.cached(device.getDeviceId()).ifPresent(media -> builder
                .hasImage(true)
                .imageExpiresAt(media.reference().expiresAt()));

        applyDiagnostics(builder, device.getDiagnostics(), now);
        return builder.build();
    }

    private void applyWeather(CameraEntityDTO.CameraEntityDTOBuilder builder, WeatherSnapshot weather) {
        if (weather == null) {
            return;
        }
        builder.temperature(weather.getTemperature())
                .weather(weather.getConditions())
                .moonPhase(weather.getMoonPhase())
                .sunPhase(weather.getSunPhase())
                .windSpeed(weather.getWindSpeed())
                .windDirection(weather.getWindDirection())
                .windGust(weather.getWindGust())
                .barometricPressure(weather.getPressure())
                .pressureTendency(weather.getPressureTendency())
                .temperatureRange12hMin(weather.getTempMin12h())
                .temperatureRange12hMax(weather.getTempMax12h())
                .temperatureDeparture24h(weather.getTempDeparture24h());
    }

    private void applyDiagnostics(CameraEntityDTO.CameraEntityDTOBuilder builder, DeviceDiagnostics diagnostics,
                                  Instant now) {
        if (diagnostics == null) {
            return;
        }
        builder.sdCardUsage(diagnostics.getSdCardUsagePercent())
                .online(diagnostics.isOnlineAt(now))
                .connectionStatus(diagnostics.connectionStatusAt(now))
                .lastTransmission(diagnostics.getLastTransmission())
                .externalPower(diagnostics.isExternalPower())
                .powerSource(diagnostics.getPowerSource())
                .internalVoltage(diagnostics.getInternalVoltage())
                .externalVoltage(diagnostics.getExternalVoltage())
                .carrier(diagnostics.getCarrier())
                .cameraTemperature(diagnostics.getCameraTemperature())
                .uptimeHours(diagnostics.uptimeHoursAt(now))
                .cameraMode(diagnostics.getCameraMode())
                .photosTaken(diagnostics.getPhotosTaken())
                .storedPhotos(diagnostics.getStoredPhotos());
        applyServingCell(builder, diagnostics.getServingCell());
    }

    private void applyServingCell(CameraEntityDTO.CameraEntityDTOBuilder builder, ServingCell cell) {
        if (cell == null) {
            return;
        }
        builder.servingCell(cell.summary())
                .networkType(cell.networkType())
                .cellBand(cell.band())
                .rssi(cell.rssiDbm())
                .rsrp(cell.rsrpDbm())
                .rsrq(cell.rsrqDb())
                .cellSignalQuality(cell.signalQuality());
    }
}
