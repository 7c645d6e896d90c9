package com.heronix.trailcam.adapter.reveal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.trailcam.config.TrailCamProperties;
import com.heronix.trailcam.exception.ApiException;
import com.heronix.trailcam.model.domain.Device;
import com.heronix.trailcam.model.domain.DeviceDiagnostics;
import com.heronix.trailcam.model.domain.DeviceFetchResult;
import com.heronix.trailcam.model.domain.DeviceState;
import com.heronix.trailcam.model.domain.MediaReference;
import com.heronix.trailcam.model.domain.ServingCell;
import com.heronix.trailcam.model.domain.WeatherSnapshot;
import com.heronix.trailcam.model.enums.DeviceStatus;

class RevealResponseParserTest {

    private static final Instant NOW = Instant.parse("2025-08-26T22:00:00Z");

    private RevealResponseParser parser;
    private List<Map<String, Object>> cameras;
    private List<Map<String, Object>> photos;

    @BeforeEach
    void setUp() throws IOException {
        parser = new RevealResponseParser(new TrailCamProperties());
        cameras = fixture("cameras.json", "cameras");
        photos = fixture("photos.json", "photos");
    }

    @Test
    void toDevice_fullCatalogEntry_mapsIdentityAndDiagnostics() {
        Device device = parser.toDevice(cameras.get(0));

        assertThat(device.getDeviceId()).isEqualTo("CAM01");
        assertThat(device.getDisplayName()).isEqualTo("North Ridge");
        assertThat(device.getLocationLabel()).isEqualTo("Ridge Line");
        assertThat(device.getModel()).isEqualTo("Reveal X Pro");
        assertThat(device.getFirmwareVersion()).isEqualTo("3.1.7");
        assertThat(device.getStatus()).isEqualTo(DeviceStatus.ACTIVE);

        DeviceDiagnostics diagnostics = device.getDiagnostics();
        assertThat(diagnostics.getSdCardUsagePercent()).isEqualTo(25.0);
        assertThat(diagnostics.getLastTransmission()).isEqualTo(Instant.ofEpochMilli(1756243880000L));
        assertThat(diagnostics.getInternalVoltage()).isEqualTo(6.2);
        assertThat(diagnostics.getExternalVoltage()).isEqualTo(12.4);
        assertThat(diagnostics.isExternalPower()).isTrue();
        assertThat(diagnostics.getCarrier()).isEqualTo("T-Mobile");
        assertThat(diagnostics.getCameraMode()).isEqualTo("Photo");
        assertThat(diagnostics.getSettings()).containsKeys("camera_mode", "photo_resolution", "multi_shot");
        assertThat(diagnostics.getPhotosTaken()).isEqualTo(1834);
        assertThat(diagnostics.getStoredPhotos()).isEqualTo(212);
        assertThat(diagnostics.getCameraTemperature()).isEqualTo(21.5);
    }

    @Test
    void toDiagnostics_servingCellAndUptime_parsed() {
        DeviceDiagnostics diagnostics = parser.toDevice(cameras.get(0)).getDiagnostics();
        ServingCell cell = diagnostics.getServingCell();

        assertThat(cell.summary()).isEqualTo("FDD LTE - LTE BAND 4");
        assertThat(cell.operatorCode()).isEqualTo("311480");
        assertThat(cell.frequencyMhz()).isEqualTo(2350);
        assertThat(cell.rssiDbm()).isEqualTo(-79);
        assertThat(cell.rsrpDbm()).isEqualTo(221);
        assertThat(cell.rsrqDb()).isEqualTo(-15);
        assertThat(cell.signalQuality()).isEqualTo("Good");

        // last transmission 21:31:20, 28m40s before NOW
        assertThat(diagnostics.uptimeHoursAt(NOW)).isEqualTo(0.48);
        assertThat(diagnostics.uptimeHoursAt(Instant.parse("2024-08-26T21:31:20Z"))).isNull();
        assertThat(diagnostics.uptimeHoursAt(Instant.parse("2026-08-27T21:31:20Z"))).isNull();
    }

    @Test
    void servingCell_shortString_networkAndBandOnly() {
        ServingCell cell = ServingCell.parse("CAT-M1,310410,LTE BAND 12");

        assertThat(cell.summary()).isEqualTo("CAT-M1 - LTE BAND 12");
        assertThat(cell.rssiDbm()).isNull();
        assertThat(cell.signalQuality()).isNull();
        assertThat(ServingCell.parse("LTE")).isNull();
    }

    @Test
    void toDevice_sparseEntry_appliesFallbacks() {
        Device device = parser.toDevice(cameras.get(1));

        assertThat(device.getDisplayName()).isEqualTo("Camera 0002");
        assertThat(device.getModel()).isEqualTo("Reveal Cell Cam");
        assertThat(device.getDiagnostics().isExternalPower()).isFalse();
        assertThat(device.getDiagnostics().getCarrier()).isNull();
        assertThat(device.getDiagnostics().getSdCardUsagePercent()).isNull();
        assertThat(device.getDiagnostics().getServingCell()).isNull();
        assertThat(device.getDiagnostics().getCameraTemperature()).isNull();
    }

    @Test
    void toDevice_missingCameraId_malformed() {
        assertThatThrownBy(() -> parser.toDevice(Map.of("cameraName", "Nameless")))
                .isInstanceOfSatisfying(ApiException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ApiException.Kind.MALFORMED));
    }

    @Test
    void toDeviceState_photoPage_usesLatestPhotoAndAverages() {
        DeviceFetchResult result = parser.toDeviceState("CAM01", photos, NOW);
        DeviceState state = result.state();

        assertThat(state.getBatteryLevel()).isEqualTo(94);
        assertThat(state.getSignalStrength()).isEqualTo(4);
        assertThat(state.getBatteryLevelAvg()).isEqualTo(93.0);
        assertThat(state.getSignalStrengthAvg()).isEqualTo(4.0);
        assertThat(state.getTotalPhotoCount()).isEqualTo(3);
        assertThat(state.getLastPhotoTime()).isEqualTo(Instant.parse("2025-08-26T21:31:20Z"));
        assertThat(state.getLastPhotoFilename()).isEqualTo("CAM01_0003.JPG");
        assertThat(state.getGpsCoordinates().format()).isEqualTo("44.12346, -91.65432");
        assertThat(state.getFetchedAt()).isEqualTo(NOW);
    }

    @Test
    void toDeviceState_averageWindow_limitsPhotosConsidered() {
        TrailCamProperties properties = new TrailCamProperties();
        properties.getApi().setAverageWindow(1);
        parser = new RevealResponseParser(properties);

        DeviceState state = parser.toDeviceState("CAM01", photos, NOW).state();

        assertThat(state.getBatteryLevelAvg()).isEqualTo(94.0);
        assertThat(state.getTotalPhotoCount()).isEqualTo(3);
    }

    @Test
    void toDeviceState_largePage_countsEveryPhoto() {
        List<Map<String, Object>> page = new ArrayList<>(photos);
        for (int i = page.size(); i < 250; i++) {
            page.add(Map.of("filename", "CAM01_" + i + ".JPG", "metadata", Map.of("batteryLevel", 90)));
        }

        DeviceState state = parser.toDeviceState("CAM01", page, NOW).state();

        assertThat(state.getTotalPhotoCount()).isEqualTo(250);
        assertThat(new TrailCamProperties().getApi().getPhotoSampleSize()).isEqualTo(1000);
    }

    @Test
    void toInstant_timestampWithoutOffset_readAsUtc() {
        assertThat(RevealResponseParser.toInstant("2025-08-26T21:31:20"))
                .isEqualTo(Instant.parse("2025-08-26T21:31:20Z"));
        assertThat(RevealResponseParser.toInstant("2025-08-26T21:31:20Z"))
                .isEqualTo(Instant.parse("2025-08-26T21:31:20Z"));
        assertThat(RevealResponseParser.toInstant("yesterday")).isNull();
    }

    @Test
    void toDeviceState_photoTimeWithoutOffset_kept() {
        Map<String, Object> photo = Map.of("photoDateUtc", "2025-08-26T21:31:20",
                "metadata", Map.of("batteryLevel", 94));

        DeviceState state = parser.toDeviceState("CAM01", List.of(photo), NOW).state();

        assertThat(state.getLastPhotoTime()).isEqualTo(Instant.parse("2025-08-26T21:31:20Z"));
    }

    @Test
    void toDeviceState_noPhotos_stateWithoutMedia() {
        DeviceFetchResult result = parser.toDeviceState("CAM01", List.of(), NOW);

        assertThat(result.media()).isEmpty();
        assertThat(result.state().getTotalPhotoCount()).isZero();
        assertThat(result.state().getBatteryLevel()).isNull();
    }

    @Test
    void toWeather_nestedWindSpeed_read() {
        WeatherSnapshot weather = parser.toWeather(photos.get(0));

        assertThat(weather.getTemperature()).isEqualTo(61.5);
        assertThat(weather.getConditions()).isEqualTo("Partly Cloudy");
        assertThat(weather.getWindSpeed()).isEqualTo(7.2);
        assertThat(weather.getWindDirection()).isEqualTo("NW");
        assertThat(weather.getWindGust()).isEqualTo(12.0);
        assertThat(weather.getPressure()).isEqualTo(30.02);
        assertThat(weather.getMoonPhase()).isEqualTo("Waxing Crescent");
        assertThat(weather.getTempMin12h()).isEqualTo(54.0);
        assertThat(weather.getTempMax12h()).isEqualTo(78.0);
        assertThat(weather.getTempDeparture24h()).isEqualTo(-3.5);
    }

    @Test
    void toWeather_alternateFieldNames_read() {
        Map<String, Object> photo = Map.of("weatherData",
                Map.of("currentTemp", 48, "conditions", "Rain", "windSpeed", 3.0, "pressure", 29.8));

        WeatherSnapshot weather = parser.toWeather(photo);

        assertThat(weather.getTemperature()).isEqualTo(48.0);
        assertThat(weather.getConditions()).isEqualTo("Rain");
        assertThat(weather.getWindSpeed()).isEqualTo(3.0);
        assertThat(weather.getPressure()).isEqualTo(29.8);
    }

    @Test
    void toWeather_noWeatherBlock_null() {
        assertThat(parser.toWeather(photos.get(1))).isNull();
    }

    @Test
    void toMediaReference_signingTimeFromUrl_setsSevenDayExpiry() {
        MediaReference reference = parser.toMediaReference("CAM01", photos.get(0), NOW);

        assertThat(reference.issuedAt()).isEqualTo(Instant.parse("2025-08-26T21:35:00Z"));
        assertThat(reference.expiresAt()).isEqualTo(reference.issuedAt().plus(Duration.ofDays(7)));
        assertThat(reference.remoteUrl()).contains("X-Amz-Signature=abc%2Fdef");
    }

    @Test
    void toMediaReference_noSigningTime_usesFetchTime() {
        Map<String, Object> photo = Map.of("photoUrl", "https://cdn.example.com/p.jpg");

        MediaReference reference = parser.toMediaReference("CAM01", photo, NOW);

        assertThat(reference.issuedAt()).isEqualTo(NOW);
    }

    @Test
    void toMediaReference_noUrl_null() {
        assertThat(parser.toMediaReference("CAM01", photos.get(1), NOW)).isNull();
    }

    private List<Map<String, Object>> fixture(String name, String listField) throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/" + name)) {
            Map<String, Map<String, List<Map<String, Object>>>> body =
                    new ObjectMapper().readValue(in, new TypeReference<>() {});
            return body.get("response").get(listField);
        }
    }
}
