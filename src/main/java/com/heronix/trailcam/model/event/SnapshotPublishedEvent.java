package com.heronix.trailcam.model.event;

import com.heronix.trailcam.model.domain.CycleReport;
import com.heronix.trailcam.model.domain.Snapshot;

/**
 * Published after each cycle that replaced the snapshot.
 */
public record SnapshotPublishedEvent(Snapshot snapshot, CycleReport report) {
}
