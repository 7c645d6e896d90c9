package com.heronix.trailcam.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.heronix.trailcam.config.TrailCamProperties;
import com.heronix.trailcam.exception.ApiException;
import com.heronix.trailcam.exception.AuthException;
import com.heronix.trailcam.exception.MediaFetchException;
import com.heronix.trailcam.model.domain.CycleReport;
import com.heronix.trailcam.model.domain.Device;
import com.heronix.trailcam.model.domain.DeviceEntry;
import com.heronix.trailcam.model.domain.DeviceError;
import com.heronix.trailcam.model.domain.DeviceFetchResult;
import com.heronix.trailcam.model.domain.Session;
import com.heronix.trailcam.model.domain.Snapshot;
import com.heronix.trailcam.model.dto.SyncStatusDTO;
import com.heronix.trailcam.model.enums.CyclePhase;
import com.heronix.trailcam.model.enums.RefreshOutcome;
import com.heronix.trailcam.model.enums.SyncTrigger;
import com.heronix.trailcam.model.event.SnapshotPublishedEvent;
import com.heronix.trailcam.model.event.SyncCycleFailedEvent;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs synchronization cycles and publishes the resulting snapshot.
 *
 * A cycle moves through ACQUIRING_SESSION, FETCHING_CATALOG,
 * FETCHING_DEVICE_STATES and PUBLISHING. Only the first two can fail the
 * cycle; per-camera failures keep that camera's previous state with an error
 * attached. The published snapshot is replaced in one step at PUBLISHING, so
 * an aborted or cancelled cycle leaves it untouched.
 *
 * At most one cycle runs at a time. Timer ticks that find a cycle running are
 * skipped; manual refreshes queue at most one follow-up cycle.
 */
@Service
@Slf4j
public class SyncCoordinator {

    private final SessionManager sessionManager;
    private final DeviceCatalogFetcher catalogFetcher;
    private final DeviceStateFetcher stateFetcher;
    private final MediaReferenceCache mediaCache;
    private final ApplicationEventPublisher eventPublisher;
    private final TrailCamProperties properties;
    private final Clock clock;
    private final Executor cycleExecutor;
    private final Executor deviceExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean pendingRefresh = new AtomicBoolean(false);
    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private final AtomicReference<Session> session = new AtomicReference<>();
    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.empty());
    private final AtomicReference<CyclePhase> phase = new AtomicReference<>(CyclePhase.IDLE);
    private final AtomicReference<CycleReport> lastReport = new AtomicReference<>();

    private final AtomicInteger consecutiveSessionFailures = new AtomicInteger();
    private final AtomicLong cycleCounter = new AtomicLong();

    public SyncCoordinator(SessionManager sessionManager,
                           DeviceCatalogFetcher catalogFetcher,
                           DeviceStateFetcher stateFetcher,
                           MediaReferenceCache mediaCache,
                           ApplicationEventPublisher eventPublisher,
                           TrailCamProperties properties,
                           Clock clock,
                           @Qualifier("syncCycleExecutor") Executor cycleExecutor,
                           @Qualifier("deviceFetchExecutor") Executor deviceExecutor) {
        this.sessionManager = sessionManager;
        this.catalogFetcher = catalogFetcher;
        this.stateFetcher = stateFetcher;
        this.mediaCache = mediaCache;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
        this.cycleExecutor = cycleExecutor;
        this.deviceExecutor = deviceExecutor;
    }

    // ========================================================================
    // TRIGGERS
    // ========================================================================

    /**
     * Start a scheduled cycle unless one is already running.
     *
     * @return true if a cycle was started, false if the tick was skipped
     */
    public boolean onTimer() {
        if (shuttingDown.get()) {
            return false;
        }
        if (!running.compareAndSet(false, true)) {
            log.debug("Sync cycle still running, skipping scheduled tick");
            return false;
        }
        return dispatch(SyncTrigger.SCHEDULED);
    }

    /**
     * Request an out-of-band cycle. If a cycle is running, exactly one
     * follow-up cycle is queued; further requests join that follow-up.
     */
    public RefreshOutcome refreshNow() {
        if (shuttingDown.get()) {
            return RefreshOutcome.REJECTED;
        }
        if (running.compareAndSet(false, true)) {
            return dispatch(SyncTrigger.MANUAL) ? RefreshOutcome.STARTED : RefreshOutcome.REJECTED;
        }
        if (pendingRefresh.compareAndSet(false, true)) {
            log.info("Sync cycle running, queued a refresh behind it");
            return RefreshOutcome.QUEUED;
        }
        return RefreshOutcome.COALESCED;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down sync coordinator");
        shuttingDown.set(true);
        pendingRefresh.set(false);
    }

    // ========================================================================
    // CYCLE
    // ========================================================================

    private boolean dispatch(SyncTrigger trigger) {
        try {
            cycleExecutor.execute(() -> runAndDrain(trigger));
            return true;
        } catch (RejectedExecutionException e) {
            log.error("Could not start sync cycle: {}", e.getMessage());
            running.set(false);
            return false;
        }
    }

    /**
     * Run a cycle, then any refresh queued while it was running. Holds the
     * running flag throughout.
     */
    private void runAndDrain(SyncTrigger trigger) {
        SyncTrigger next = trigger;
        while (true) {
            try {
                runCycle(next);
            } catch (RuntimeException e) {
                running.set(false);
                throw e;
            }
            next = SyncTrigger.MANUAL;

            if (pendingRefresh.getAndSet(false) && !shuttingDown.get()) {
                continue;
            }
            running.set(false);

            // a refresh may have queued itself between the check and the release
            if (pendingRefresh.get() && !shuttingDown.get() && running.compareAndSet(false, true)) {
                if (pendingRefresh.getAndSet(false)) {
                    continue;
                }
                running.set(false);
            }
            return;
        }
    }

    CycleReport runCycle(SyncTrigger trigger) {
        CycleContext ctx = new CycleContext(cycleCounter.incrementAndGet(), trigger, clock.instant());
        log.info("Starting {} sync cycle {}", trigger, ctx.cycleId);

        try {
            enter(ctx, CyclePhase.ACQUIRING_SESSION);
            Session active = acquireSession();

            enter(ctx, CyclePhase.FETCHING_CATALOG);
            List<Device> devices = fetchCatalog(ctx, active);

            enter(ctx, CyclePhase.FETCHING_DEVICE_STATES);
            Map<String, DeviceOutcome> outcomes = fetchStates(session.get(), devices);

            enter(ctx, CyclePhase.PUBLISHING);
            return publish(ctx, devices, outcomes);

        } catch (CycleCancelledException e) {
            CycleReport report = CycleReport.cancelled(ctx.cycleId, trigger, ctx.startedAt, clock.instant());
            lastReport.set(report);
            log.info("Sync cycle {} cancelled before {}", ctx.cycleId, e.getMessage());
            return report;
        } catch (AuthException e) {
            recordSessionFailure(e.isPermanent());
            return failCycle(ctx, e);
        } catch (ApiException e) {
            if (e.getKind() == ApiException.Kind.UNAUTHORIZED) {
                recordSessionFailure(true);
            }
            return failCycle(ctx, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error in sync cycle {}", ctx.cycleId, e);
            return failCycle(ctx, e);
        } finally {
            phase.set(CyclePhase.IDLE);
        }
    }

    private Session acquireSession() {
        Session current = session.get();
        Session valid = sessionManager.ensureValid(current);
        if (valid != current) {
            session.set(valid);
        }
        consecutiveSessionFailures.set(0);
        return valid;
    }

    /**
     * A rejected access token gets one forced renewal per cycle before the
     * catalog failure becomes fatal.
     */
    private List<Device> fetchCatalog(CycleContext ctx, Session active) {
        try {
            return catalogFetcher.listDevices(active);
        } catch (ApiException e) {
            if (e.getKind() != ApiException.Kind.UNAUTHORIZED) {
                throw e;
            }
            log.warn("Catalog request unauthorized in cycle {}, renewing session", ctx.cycleId);
            Session renewed = sessionManager.forceRenew(active);
            session.set(renewed);
            return catalogFetcher.listDevices(renewed);
        }
    }

    private Map<String, DeviceOutcome> fetchStates(Session active, List<Device> devices) {
        long timeoutSeconds = properties.getPoll().getDeviceTimeoutSeconds();
        List<DeviceTask> tasks = new ArrayList<>();

        for (Device device : devices) {
            DeviceTask task = new DeviceTask(active, device.getDeviceId(), timeoutSeconds);
            try {
                deviceExecutor.execute(task);
            } catch (RejectedExecutionException e) {
                task.reject(e);
            }
            tasks.add(task);
        }

        Map<String, DeviceOutcome> outcomes = new LinkedHashMap<>();
        for (DeviceTask task : tasks) {
            DeviceOutcome outcome = task.outcome.join();
            outcomes.put(outcome.deviceId(), outcome);
        }
        return outcomes;
    }

    private DeviceOutcome fetchDevice(DeviceTask task) {
        String deviceId = task.deviceId;
        DeviceFetchResult result;
        try {
            result = stateFetcher.fetchState(task.session, deviceId);
        } catch (ApiException e) {
            log.warn("State fetch failed for camera {}: {} ({})", deviceId, e.getMessage(), e.getKind());
            return DeviceOutcome.failed(deviceId, e);
        } catch (RuntimeException e) {
            log.warn("Unexpected error fetching camera {}", deviceId, e);
            return DeviceOutcome.failed(deviceId, new ApiException(ApiException.Kind.MALFORMED,
                    "Unexpected error: " + e.getMessage(), e));
        }

        if (task.isExpired()) {
            return new DeviceOutcome(deviceId, result, null, null);
        }
        MediaFetchException mediaError = result.media()
                .map(reference -> mediaCache.getOrRefresh(deviceId, reference, task::claim).error())
                .orElse(null);
        return new DeviceOutcome(deviceId, result, null, mediaError);
    }

    private CycleReport publish(CycleContext ctx, List<Device> devices, Map<String, DeviceOutcome> outcomes) {
        Instant now = clock.instant();
        Snapshot previous = snapshot.get();
        Map<String, DeviceEntry> entries = new LinkedHashMap<>();
        int failed = 0;

        for (Device device : devices) {
            DeviceOutcome outcome = outcomes.get(device.getDeviceId());
            DeviceEntry prior = previous.get(device.getDeviceId()).orElse(null);

            if (outcome.error() == null) {
                entries.put(device.getDeviceId(), freshEntry(device, outcome, now));
            } else {
                failed++;
                entries.put(device.getDeviceId(), staleEntry(device, prior, outcome.error(), now));
            }
        }

        // cameras dropped from the catalog stay visible as missing
        for (DeviceEntry prior : previous.entries().values()) {
            String deviceId = prior.getDevice().getDeviceId();
            if (!entries.containsKey(deviceId)) {
                log.info("Camera {} no longer in catalog, marking missing", deviceId);
                entries.put(deviceId, prior.toBuilder()
                        .device(prior.getDevice().markMissing())
                        .error(DeviceError.notInCatalog(now))
                        .build());
            }
        }

        Snapshot next = new Snapshot(ctx.cycleId, now, entries);
        snapshot.set(next);

        CycleReport report = CycleReport.completed(ctx.cycleId, ctx.trigger, ctx.startedAt, now,
                devices.size(), failed);
        lastReport.set(report);
        log.info("Sync cycle {} complete: {}", ctx.cycleId, report.message());

        eventPublisher.publishEvent(new SnapshotPublishedEvent(next, report));
        return report;
    }

    private DeviceEntry freshEntry(Device device, DeviceOutcome outcome, Instant now) {
        DeviceFetchResult result = outcome.result();
        return DeviceEntry.builder()
                .device(device)
                .state(result.state())
                .mediaReference(result.mediaReference())
                .mediaError(outcome.mediaError() != null ? DeviceError.of(outcome.mediaError(), now) : null)
                .lastSuccessAt(now)
                .build();
    }

    private DeviceEntry staleEntry(Device device, DeviceEntry prior, ApiException error, Instant now) {
        Device shown = error.getKind() == ApiException.Kind.NOT_FOUND ? device.markMissing() : device;
        DeviceEntry.DeviceEntryBuilder builder = prior != null ? prior.toBuilder() : DeviceEntry.builder();
        return builder
                .device(shown)
                .error(DeviceError.of(error, now))
                .build();
    }

    private CycleReport failCycle(CycleContext ctx, RuntimeException e) {
        CyclePhase failedPhase = ctx.phase;
        log.error("Sync cycle {} failed during {}: {}", ctx.cycleId, failedPhase, e.getMessage());

        CycleReport report = CycleReport.failed(ctx.cycleId, ctx.trigger, ctx.startedAt, clock.instant(),
                failedPhase, e.getMessage());
        lastReport.set(report);
        eventPublisher.publishEvent(new SyncCycleFailedEvent(report, e));
        return report;
    }

    private void recordSessionFailure(boolean discardSession) {
        int failures = consecutiveSessionFailures.incrementAndGet();
        if (discardSession) {
            session.set(null);
        }
        if (failures == properties.getPoll().getUnavailableAfterFailures()) {
            log.error("{} consecutive session failures, cameras now reported unavailable", failures);
        }
    }

    private void enter(CycleContext ctx, CyclePhase next) {
        if (shuttingDown.get()) {
            throw new CycleCancelledException(next);
        }
        ctx.phase = next;
        phase.set(next);
    }

    // ========================================================================
    // STATUS
    // ========================================================================

    public Snapshot getSnapshot() {
        return snapshot.get();
    }

    public CyclePhase getPhase() {
        return phase.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }

    public boolean isRefreshPending() {
        return pendingRefresh.get();
    }

    public Optional<CycleReport> getLastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public Optional<Session> getSession() {
        return Optional.ofNullable(session.get());
    }

    public int getConsecutiveSessionFailures() {
        return consecutiveSessionFailures.get();
    }

    /**
     * Cameras are reported unavailable only after repeated session failures;
     * a single failed cycle keeps showing the last known values.
     */
    public boolean isAvailable() {
        return consecutiveSessionFailures.get() < properties.getPoll().getUnavailableAfterFailures();
    }

    public SyncStatusDTO getStatus() {
        Snapshot current = snapshot.get();
        Session active = session.get();

        return SyncStatusDTO.builder()
                .phase(phase.get())
                .running(running.get())
                .refreshPending(pendingRefresh.get())
                .available(isAvailable())
                .consecutiveSessionFailures(consecutiveSessionFailures.get())
                .sessionActive(active != null && active.isValidAt(clock.instant(), Duration.ZERO))
                .sessionExpiresAt(active != null ? active.expiresAt() : null)
                .accountId(active != null ? active.accountId() : null)
                .snapshotCycleId(current.cycleId())
                .snapshotPublishedAt(current.publishedAt())
                .cameraCount(current.size())
                .lastCycle(lastReport.get())
                .pollIntervalSeconds(properties.getPoll().getIntervalSeconds())
                .build();
    }

    // ========================================================================
    // CYCLE TYPES
    // ========================================================================

    /**
     * Per-cycle bookkeeping, confined to the cycle thread.
     */
    private static final class CycleContext {
        private final long cycleId;
        private final SyncTrigger trigger;
        private final Instant startedAt;
        private CyclePhase phase = CyclePhase.IDLE;

        private CycleContext(long cycleId, SyncTrigger trigger, Instant startedAt) {
            this.cycleId = cycleId;
            this.trigger = trigger;
            this.startedAt = startedAt;
        }
    }

    private record DeviceOutcome(String deviceId, DeviceFetchResult result, ApiException error,
                                 MediaFetchException mediaError) {

        static DeviceOutcome failed(String deviceId, ApiException error) {
            return new DeviceOutcome(deviceId, null, error, null);
        }
    }

    private enum TaskState {
        RUNNING,
        CLAIMED,
        EXPIRED
    }

    /**
     * State fetch of one camera. The deadline is armed when the task starts
     * running, so time spent queued behind other cameras does not count. Once
     * expired, the task can no longer write the media cache or its outcome.
     */
    private final class DeviceTask implements Runnable {
        private final Session session;
        private final String deviceId;
        private final long timeoutSeconds;
        private final CompletableFuture<DeviceOutcome> outcome = new CompletableFuture<>();
        private final AtomicReference<TaskState> state = new AtomicReference<>(TaskState.RUNNING);

        private DeviceTask(Session session, String deviceId, long timeoutSeconds) {
            this.session = session;
            this.deviceId = deviceId;
            this.timeoutSeconds = timeoutSeconds;
        }

        @Override
        public void run() {
            CompletableFuture.delayedExecutor(timeoutSeconds, TimeUnit.SECONDS).execute(this::expire);
            DeviceOutcome result = fetchDevice(this);
            if (claim()) {
                outcome.complete(result);
            } else {
                log.debug("Dropped late result for camera {}", deviceId);
            }
        }

        /**
         * Take ownership of the outcome; false once the deadline has passed.
         */
        boolean claim() {
            return state.compareAndSet(TaskState.RUNNING, TaskState.CLAIMED) || state.get() == TaskState.CLAIMED;
        }

        boolean isExpired() {
            return state.get() == TaskState.EXPIRED;
        }

        void reject(RejectedExecutionException e) {
            state.set(TaskState.EXPIRED);
            log.warn("State fetch for camera {} rejected: {}", deviceId, e.getMessage());
            outcome.complete(DeviceOutcome.failed(deviceId, new ApiException(ApiException.Kind.UNAVAILABLE,
                    "State fetch rejected: " + e.getMessage(), e)));
        }

        private void expire() {
            if (state.compareAndSet(TaskState.RUNNING, TaskState.EXPIRED)) {
                log.warn("State fetch for camera {} timed out after {}s", deviceId, timeoutSeconds);
                outcome.complete(DeviceOutcome.failed(deviceId, new ApiException(ApiException.Kind.UNAVAILABLE,
                        "State fetch timed out after " + timeoutSeconds + "s")));
            }
        }
    }

    private static final class CycleCancelledException extends RuntimeException {
        private CycleCancelledException(CyclePhase phase) {
            super(phase.name());
        }
    }
}
