package com.heronix.trailcam.model.domain;

import java.time.Instant;

import com.heronix.trailcam.model.enums.CycleOutcome;
import com.heronix.trailcam.model.enums.CyclePhase;
import com.heronix.trailcam.model.enums.SyncTrigger;

/**
 * Summary of one synchronization cycle.
 *
 * @param failedPhase phase that aborted the cycle, null unless {@code FAILED}
 */
public record CycleReport(
        long cycleId,
        SyncTrigger trigger,
        CycleOutcome outcome,
        Instant startedAt,
        Instant completedAt,
        int devicesTotal,
        int devicesFailed,
        CyclePhase failedPhase,
        String message
) {

    public static CycleReport completed(long cycleId, SyncTrigger trigger, Instant startedAt, Instant completedAt,
                                        int total, int failed) {
        CycleOutcome outcome = failed == 0 ? CycleOutcome.SUCCESS : CycleOutcome.PARTIAL;
        String message = failed == 0
                ? "Synchronized " + total + " cameras"
                : "Synchronized " + (total - failed) + " of " + total + " cameras";
        return new CycleReport(cycleId, trigger, outcome, startedAt, completedAt, total, failed, null, message);
    }

    public static CycleReport failed(long cycleId, SyncTrigger trigger, Instant startedAt, Instant completedAt,
                                     CyclePhase phase, String message) {
        return new CycleReport(cycleId, trigger, CycleOutcome.FAILED, startedAt, completedAt, 0, 0, phase, message);
    }

    public static CycleReport cancelled(long cycleId, SyncTrigger trigger, Instant startedAt, Instant completedAt) {
        return new CycleReport(cycleId, trigger, CycleOutcome.CANCELLED, startedAt, completedAt, 0, 0, null,
                "Cycle cancelled during shutdown");
    }
}
