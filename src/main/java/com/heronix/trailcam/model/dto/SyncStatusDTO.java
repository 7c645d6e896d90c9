package com.heronix.trailcam.model.dto;

import java.time.Instant;

import com.heronix.trailcam.model.domain.CycleReport;
import com.heronix.trailcam.model.enums.CyclePhase;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Coordinator status for monitoring.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncStatusDTO {

    private CyclePhase phase;

    private boolean running;

    private boolean refreshPending;

    private boolean available;

    private int consecutiveSessionFailures;

    private boolean sessionActive;

    private Instant sessionExpiresAt;

    private String accountId;

    private long snapshotCycleId;

    private Instant snapshotPublishedAt;

    private int cameraCount;

    private CycleReport lastCycle;

    private long pollIntervalSeconds;
}
