package com.heronix.trailcam.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import com.heronix.trailcam.adapter.CameraCloudAdapter;
import com.heronix.trailcam.config.TrailCamProperties;
import com.heronix.trailcam.exception.ApiException;
import com.heronix.trailcam.exception.AuthException;
import com.heronix.trailcam.exception.MediaFetchException;
import com.heronix.trailcam.model.domain.CycleReport;
import com.heronix.trailcam.model.domain.Device;
import com.heronix.trailcam.model.domain.DeviceEntry;
import com.heronix.trailcam.model.domain.DeviceError;
import com.heronix.trailcam.model.domain.DeviceFetchResult;
import com.heronix.trailcam.model.domain.DeviceState;
import com.heronix.trailcam.model.domain.MediaReference;
import com.heronix.trailcam.model.domain.Session;
import com.heronix.trailcam.model.domain.Snapshot;
import com.heronix.trailcam.model.enums.CycleOutcome;
import com.heronix.trailcam.model.enums.CyclePhase;
import com.heronix.trailcam.model.enums.DeviceStatus;
import com.heronix.trailcam.model.enums.RefreshOutcome;
import com.heronix.trailcam.model.enums.SyncTrigger;
import com.heronix.trailcam.model.event.SnapshotPublishedEvent;
import com.heronix.trailcam.model.event.SyncCycleFailedEvent;

@ExtendWith(MockitoExtension.class)
class SyncCoordinatorTest {

    private static final Instant NOW = Instant.parse("2025-08-26T22:00:00Z");
    private static final Session SESSION = new Session("access-1", "id-1", "refresh-1",
            NOW.minus(Duration.ofHours(1)), NOW.plus(Duration.ofHours(11)), "acct-1");

    @Mock private SessionManager sessionManager;
    @Mock private DeviceCatalogFetcher catalogFetcher;
    @Mock private DeviceStateFetcher stateFetcher;
    @Mock private MediaReferenceCache mediaCache;
    @Mock private ApplicationEventPublisher eventPublisher;
    @Mock private CameraCloudAdapter cloudAdapter;

    private TrailCamProperties properties;
    private SyncCoordinator coordinator;

    @BeforeEach
    void setUp() {
        properties = new TrailCamProperties();
        coordinator = coordinator(Runnable::run);
    }

    @Test
    void refreshNow_idle_runsCycleAndPublishesOneEntryPerDevice() {
        when(sessionManager.ensureValid(null)).thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION)).thenReturn(List.of(device("A"), device("B"), device("C")));
        when(stateFetcher.fetchState(eq(SESSION), any())).thenReturn(result(80, NOW));

        RefreshOutcome outcome = coordinator.refreshNow();

        Snapshot snapshot = coordinator.getSnapshot();
        assertThat(outcome).isEqualTo(RefreshOutcome.STARTED);
        assertThat(snapshot.entries()).containsOnlyKeys("A", "B", "C");
        assertThat(snapshot.entries().values()).noneMatch(DeviceEntry::isStale);
        assertThat(coordinator.isRunning()).isFalse();
        assertThat(coordinator.getPhase()).isEqualTo(CyclePhase.IDLE);
        verify(eventPublisher).publishEvent(any(SnapshotPublishedEvent.class));
    }

    @Test
    void runCycle_oneDeviceFails_othersFreshAndFailedKeepsPreviousState() {
        when(sessionManager.ensureValid(any())).thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION)).thenReturn(List.of(device("A"), device("B"), device("C")));
        when(stateFetcher.fetchState(SESSION, "A")).thenReturn(result(50, NOW), result(51, NOW));
        when(stateFetcher.fetchState(SESSION, "B"))
                .thenReturn(result(60, NOW))
                .thenThrow(new ApiException(ApiException.Kind.UNAVAILABLE, "HTTP 503"));
        when(stateFetcher.fetchState(SESSION, "C")).thenReturn(result(70, NOW), result(71, NOW));

        coordinator.runCycle(SyncTrigger.SCHEDULED);
        CycleReport report = coordinator.runCycle(SyncTrigger.SCHEDULED);

        Snapshot snapshot = coordinator.getSnapshot();
        assertThat(report.outcome()).isEqualTo(CycleOutcome.PARTIAL);
        assertThat(report.devicesFailed()).isEqualTo(1);
        assertThat(snapshot.size()).isEqualTo(3);
        assertThat(battery(snapshot, "A")).isEqualTo(51);
        assertThat(battery(snapshot, "C")).isEqualTo(71);
        assertThat(snapshot.get("A").orElseThrow().isStale()).isFalse();

        DeviceEntry b = snapshot.get("B").orElseThrow();
        assertThat(b.isStale()).isTrue();
        assertThat(b.getState().getBatteryLevel()).isEqualTo(60);
        assertThat(b.getError().kind()).isEqualTo("UNAVAILABLE");
        assertThat(b.getDevice().getStatus()).isEqualTo(DeviceStatus.ACTIVE);
    }

    @Test
    void runCycle_cam01FreshCam02Unavailable_cam02KeepsLastKnownValues() {
        Instant lastPhoto = Instant.parse("2025-08-26T21:31:20Z");
        Instant earlierPhoto = Instant.parse("2025-08-25T18:00:00Z");
        when(sessionManager.ensureValid(any())).thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION)).thenReturn(List.of(device("CAM01"), device("CAM02")));
        when(stateFetcher.fetchState(SESSION, "CAM01")).thenReturn(result(90, earlierPhoto), result(94, lastPhoto));
        when(stateFetcher.fetchState(SESSION, "CAM02"))
                .thenReturn(result(77, earlierPhoto))
                .thenThrow(new ApiException(ApiException.Kind.UNAVAILABLE, "Camera API error 503"));

        coordinator.runCycle(SyncTrigger.SCHEDULED);
        coordinator.runCycle(SyncTrigger.SCHEDULED);

        Snapshot snapshot = coordinator.getSnapshot();
        DeviceEntry cam01 = snapshot.get("CAM01").orElseThrow();
        assertThat(cam01.isStale()).isFalse();
        assertThat(cam01.getState().getBatteryLevel()).isEqualTo(94);
        assertThat(cam01.getState().getLastPhotoTime()).isEqualTo(lastPhoto);

        DeviceEntry cam02 = snapshot.get("CAM02").orElseThrow();
        assertThat(cam02.getState().getBatteryLevel()).isEqualTo(77);
        assertThat(cam02.getState().getLastPhotoTime()).isEqualTo(earlierPhoto);
        assertThat(cam02.getError()).isNotNull();
        assertThat(cam02.getError().kind()).isEqualTo("UNAVAILABLE");
    }

    @Test
    void runCycle_deviceFailsOnFirstCycle_presentWithoutState() {
        when(sessionManager.ensureValid(any())).thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION)).thenReturn(List.of(device("A")));
        when(stateFetcher.fetchState(SESSION, "A"))
                .thenThrow(new ApiException(ApiException.Kind.MALFORMED, "Expected array for photos"));

        coordinator.runCycle(SyncTrigger.SCHEDULED);

        DeviceEntry a = coordinator.getSnapshot().get("A").orElseThrow();
        assertThat(a.getState()).isNull();
        assertThat(a.isStale()).isTrue();
    }

    @Test
    void runCycle_stateNotFound_marksMissingForCycle() {
        when(sessionManager.ensureValid(any())).thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION)).thenReturn(List.of(device("A")));
        when(stateFetcher.fetchState(SESSION, "A"))
                .thenReturn(result(50, NOW))
                .thenThrow(new ApiException(ApiException.Kind.NOT_FOUND, "Not found: photos of A"))
                .thenReturn(result(52, NOW));

        coordinator.runCycle(SyncTrigger.SCHEDULED);
        coordinator.runCycle(SyncTrigger.SCHEDULED);
        DeviceEntry missing = coordinator.getSnapshot().get("A").orElseThrow();
        coordinator.runCycle(SyncTrigger.SCHEDULED);
        DeviceEntry back = coordinator.getSnapshot().get("A").orElseThrow();

        assertThat(missing.getDevice().getStatus()).isEqualTo(DeviceStatus.MISSING);
        assertThat(missing.getState().getBatteryLevel()).isEqualTo(50);
        assertThat(back.getDevice().getStatus()).isEqualTo(DeviceStatus.ACTIVE);
        assertThat(back.getState().getBatteryLevel()).isEqualTo(52);
    }

    @Test
    void runCycle_deviceDroppedFromCatalog_keptAsMissing() {
        when(sessionManager.ensureValid(any())).thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION))
                .thenReturn(List.of(device("A"), device("B")))
                .thenReturn(List.of(device("A")));
        when(stateFetcher.fetchState(eq(SESSION), any())).thenReturn(result(50, NOW));

        coordinator.runCycle(SyncTrigger.SCHEDULED);
        CycleReport report = coordinator.runCycle(SyncTrigger.SCHEDULED);

        DeviceEntry b = coordinator.getSnapshot().get("B").orElseThrow();
        assertThat(report.devicesTotal()).isEqualTo(1);
        assertThat(b.getDevice().getStatus()).isEqualTo(DeviceStatus.MISSING);
        assertThat(b.getState().getBatteryLevel()).isEqualTo(50);
        assertThat(b.isStale()).isTrue();
        assertThat(b.getError().source()).isEqualTo(DeviceError.Source.CATALOG);
        assertThat(coordinator.getSnapshot().get("A").orElseThrow().isStale()).isFalse();
        verify(stateFetcher, times(1)).fetchState(SESSION, "B");
    }

    @Test
    void runCycle_catalogUnauthorized_renewsOnceAndRetries() {
        Session renewed = new Session("access-2", "id-2", "refresh-1", NOW, NOW.plus(Duration.ofHours(12)), "acct-1");
        when(sessionManager.ensureValid(null)).thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION))
                .thenThrow(new ApiException(ApiException.Kind.UNAUTHORIZED, "Unauthorized fetching cameras"));
        when(sessionManager.forceRenew(SESSION)).thenReturn(renewed);
        when(catalogFetcher.listDevices(renewed)).thenReturn(List.of(device("A")));
        when(stateFetcher.fetchState(renewed, "A")).thenReturn(result(50, NOW));

        CycleReport report = coordinator.runCycle(SyncTrigger.SCHEDULED);

        assertThat(report.outcome()).isEqualTo(CycleOutcome.SUCCESS);
        assertThat(coordinator.getSession()).contains(renewed);
        verify(sessionManager, times(1)).forceRenew(SESSION);
    }

    @Test
    void runCycle_catalogUnauthorizedTwice_failsCycle() {
        Session renewed = new Session("access-2", "id-2", "refresh-1", NOW, NOW.plus(Duration.ofHours(12)), "acct-1");
        when(sessionManager.ensureValid(null)).thenReturn(SESSION);
        when(catalogFetcher.listDevices(any()))
                .thenThrow(new ApiException(ApiException.Kind.UNAUTHORIZED, "Unauthorized fetching cameras"));
        when(sessionManager.forceRenew(SESSION)).thenReturn(renewed);

        CycleReport report = coordinator.runCycle(SyncTrigger.SCHEDULED);

        assertThat(report.outcome()).isEqualTo(CycleOutcome.FAILED);
        assertThat(report.failedPhase()).isEqualTo(CyclePhase.FETCHING_CATALOG);
        verify(sessionManager, times(1)).forceRenew(SESSION);
        verify(stateFetcher, never()).fetchState(any(), any());
    }

    @Test
    void runCycle_sessionFailure_leavesSnapshotUntouchedAndPublishesFailure() {
        when(sessionManager.ensureValid(any()))
                .thenReturn(SESSION)
                .thenThrow(new AuthException(AuthException.Kind.PROVIDER_UNAVAILABLE, "Cognito timed out"));
        when(catalogFetcher.listDevices(SESSION)).thenReturn(List.of(device("A")));
        when(stateFetcher.fetchState(SESSION, "A")).thenReturn(result(50, NOW));

        coordinator.runCycle(SyncTrigger.SCHEDULED);
        Snapshot before = coordinator.getSnapshot();
        CycleReport report = coordinator.runCycle(SyncTrigger.SCHEDULED);

        assertThat(coordinator.getSnapshot()).isSameAs(before);
        assertThat(report.outcome()).isEqualTo(CycleOutcome.FAILED);
        assertThat(report.failedPhase()).isEqualTo(CyclePhase.ACQUIRING_SESSION);
        assertThat(coordinator.getLastReport()).contains(report);
        assertThat(coordinator.isAvailable()).isTrue();

        ArgumentCaptor<Object> events = ArgumentCaptor.forClass(Object.class);
        verify(eventPublisher, times(2)).publishEvent(events.capture());
        assertThat(events.getAllValues().get(0)).isInstanceOf(SnapshotPublishedEvent.class);
        assertThat(events.getAllValues().get(1)).isInstanceOfSatisfying(SyncCycleFailedEvent.class,
                event -> assertThat(event.cause()).isInstanceOf(AuthException.class));
    }

    @Test
    void isAvailable_falseAfterRepeatedSessionFailures_recoversOnSuccess() {
        when(sessionManager.ensureValid(any()))
                .thenThrow(new AuthException(AuthException.Kind.REFRESH_REJECTED, "rejected"))
                .thenThrow(new AuthException(AuthException.Kind.REFRESH_REJECTED, "rejected"))
                .thenThrow(new AuthException(AuthException.Kind.REFRESH_REJECTED, "rejected"))
                .thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION)).thenReturn(List.of());

        coordinator.runCycle(SyncTrigger.SCHEDULED);
        coordinator.runCycle(SyncTrigger.SCHEDULED);
        assertThat(coordinator.isAvailable()).isTrue();
        coordinator.runCycle(SyncTrigger.SCHEDULED);
        assertThat(coordinator.isAvailable()).isFalse();
        assertThat(coordinator.getSession()).isEmpty();

        coordinator.runCycle(SyncTrigger.SCHEDULED);
        assertThat(coordinator.isAvailable()).isTrue();
        assertThat(coordinator.getConsecutiveSessionFailures()).isZero();
    }

    @Test
    void runCycle_mediaDownloadFails_entryFreshWithMediaError() {
        MediaReference reference = MediaReference.issued("A", "https://s3.example/a.jpg", NOW);
        DeviceFetchResult withMedia = new DeviceFetchResult(state(50, NOW), reference);
        MediaFetchException forbidden = new MediaFetchException(MediaFetchException.Kind.FORBIDDEN, "HTTP 403");
        when(sessionManager.ensureValid(any())).thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION)).thenReturn(List.of(device("A")));
        when(stateFetcher.fetchState(SESSION, "A")).thenReturn(withMedia);
        when(mediaCache.getOrRefresh(eq("A"), eq(reference), any(BooleanSupplier.class)))
                .thenReturn(new MediaReferenceCache.MediaLookup(null, null, false, forbidden));

        CycleReport report = coordinator.runCycle(SyncTrigger.SCHEDULED);

        DeviceEntry a = coordinator.getSnapshot().get("A").orElseThrow();
        assertThat(report.outcome()).isEqualTo(CycleOutcome.SUCCESS);
        assertThat(a.isStale()).isFalse();
        assertThat(a.getMediaReference()).isEqualTo(reference);
        assertThat(a.getMediaError().kind()).isEqualTo("FORBIDDEN");
    }

    @Test
    void runCycle_unexpectedDeviceError_isolatedToDevice() {
        when(sessionManager.ensureValid(any())).thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION)).thenReturn(List.of(device("A"), device("B")));
        when(stateFetcher.fetchState(SESSION, "A")).thenThrow(new IllegalStateException("boom"));
        when(stateFetcher.fetchState(SESSION, "B")).thenReturn(result(50, NOW));

        CycleReport report = coordinator.runCycle(SyncTrigger.SCHEDULED);

        assertThat(report.outcome()).isEqualTo(CycleOutcome.PARTIAL);
        assertThat(coordinator.getSnapshot().get("A").orElseThrow().getError().kind()).isEqualTo("MALFORMED");
        assertThat(coordinator.getSnapshot().get("B").orElseThrow().isStale()).isFalse();
    }

    @Test
    void runCycle_devicesQueuedOnBoundedPool_timeoutCountsFromStart() throws Exception {
        ExecutorService devicePool = Executors.newSingleThreadExecutor();
        properties.getPoll().setDeviceTimeoutSeconds(1);
        coordinator = coordinator(Runnable::run, devicePool);

        when(sessionManager.ensureValid(any())).thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION)).thenReturn(List.of(device("A"), device("B"), device("C")));
        when(stateFetcher.fetchState(eq(SESSION), any())).thenAnswer(invocation -> {
            Thread.sleep(700);
            return result(80, NOW);
        });

        try {
            CycleReport report = coordinator.runCycle(SyncTrigger.SCHEDULED);

            assertThat(report.outcome()).isEqualTo(CycleOutcome.SUCCESS);
            assertThat(coordinator.getSnapshot().entries().values()).noneMatch(DeviceEntry::isStale);
        } finally {
            devicePool.shutdownNow();
        }
    }

    @Test
    void runCycle_slowDevice_timesOutAloneAndNeverWritesCacheLate() throws Exception {
        ExecutorService devicePool = Executors.newFixedThreadPool(2);
        MediaReferenceCache realCache = new MediaReferenceCache(cloudAdapter, Clock.fixed(NOW, ZoneOffset.UTC));
        properties.getPoll().setDeviceTimeoutSeconds(1);
        coordinator = new SyncCoordinator(sessionManager, catalogFetcher, stateFetcher, realCache, eventPublisher,
                properties, Clock.fixed(NOW, ZoneOffset.UTC), Runnable::run, devicePool);

        MediaReference slowPhoto = MediaReference.issued("SLOW", "https://s3.example/slow.jpg", NOW);
        when(sessionManager.ensureValid(any())).thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION)).thenReturn(List.of(device("SLOW"), device("FAST")));
        when(stateFetcher.fetchState(SESSION, "FAST")).thenReturn(result(90, NOW));
        when(stateFetcher.fetchState(SESSION, "SLOW")).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return new DeviceFetchResult(state(40, NOW), slowPhoto);
        });

        CycleReport report = coordinator.runCycle(SyncTrigger.SCHEDULED);
        Snapshot published = coordinator.getSnapshot();

        devicePool.shutdown();
        assertThat(devicePool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(report.outcome()).isEqualTo(CycleOutcome.PARTIAL);
        assertThat(published.get("FAST").orElseThrow().isStale()).isFalse();
        DeviceEntry slow = published.get("SLOW").orElseThrow();
        assertThat(slow.isStale()).isTrue();
        assertThat(slow.getError().message()).isEqualTo("State fetch timed out after 1s");

        assertThat(coordinator.getSnapshot()).isSameAs(published);
        assertThat(realCache.cached("SLOW")).isEmpty();
        verify(cloudAdapter, never()).downloadMedia(any());
    }

    @Test
    void refreshNow_duringCycle_queuesOneFollowUpWithoutOverlap() throws Exception {
        ExecutorService cycleThread = Executors.newSingleThreadExecutor();
        coordinator = coordinator(cycleThread);

        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        CountDownLatch firstEntered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        when(sessionManager.ensureValid(any())).thenReturn(SESSION);
        when(catalogFetcher.listDevices(SESSION)).thenAnswer(invocation -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            firstEntered.countDown();
            release.await(5, TimeUnit.SECONDS);
            active.decrementAndGet();
            return List.of();
        });

        assertThat(coordinator.refreshNow()).isEqualTo(RefreshOutcome.STARTED);
        assertThat(firstEntered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(coordinator.refreshNow()).isEqualTo(RefreshOutcome.QUEUED);
        assertThat(coordinator.refreshNow()).isEqualTo(RefreshOutcome.COALESCED);
        assertThat(coordinator.onTimer()).isFalse();

        release.countDown();
        cycleThread.shutdown();
        assertThat(cycleThread.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        verify(catalogFetcher, times(2)).listDevices(SESSION);
        assertThat(maxActive.get()).isEqualTo(1);
        assertThat(coordinator.isRunning()).isFalse();
        assertThat(coordinator.isRefreshPending()).isFalse();
    }

    @Test
    void shutdown_rejectsFurtherCycles() {
        coordinator.shutdown();

        assertThat(coordinator.refreshNow()).isEqualTo(RefreshOutcome.REJECTED);
        assertThat(coordinator.onTimer()).isFalse();
        verify(sessionManager, never()).ensureValid(any());
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private SyncCoordinator coordinator(Executor cycleExecutor) {
        return coordinator(cycleExecutor, Runnable::run);
    }

    private SyncCoordinator coordinator(Executor cycleExecutor, Executor deviceExecutor) {
        return new SyncCoordinator(sessionManager, catalogFetcher, stateFetcher, mediaCache, eventPublisher,
                properties, Clock.fixed(NOW, ZoneOffset.UTC), cycleExecutor, deviceExecutor);
    }

    private static Device device(String id) {
        return Device.builder()
                .deviceId(id)
                .displayName("Camera " + id)
                .locationLabel("Ridge")
                .model("Reveal X Pro")
                .build();
    }

    private static DeviceState state(int battery, Instant lastPhoto) {
        return DeviceState.builder()
                .batteryLevel(battery)
                .signalStrength(4)
                .totalPhotoCount(10)
                .lastPhotoTime(lastPhoto)
                .fetchedAt(NOW)
                .build();
    }

    private static DeviceFetchResult result(int battery, Instant lastPhoto) {
        return new DeviceFetchResult(state(battery, lastPhoto), null);
    }

    private static Integer battery(Snapshot snapshot, String id) {
        return snapshot.get(id).orElseThrow().getState().getBatteryLevel();
    }
}
