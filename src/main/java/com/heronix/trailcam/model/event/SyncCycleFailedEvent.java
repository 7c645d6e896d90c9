package com.heronix.trailcam.model.event;

import com.heronix.trailcam.model.domain.CycleReport;

/**
 * Published when a cycle aborted on a session or catalog failure. The
 * previous snapshot remains in place.
 */
public record SyncCycleFailedEvent(CycleReport report, Throwable cause) {
}
