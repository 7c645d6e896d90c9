package com.heronix.trailcam.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.trailcam.model.domain.CycleReport;
import com.heronix.trailcam.service.SyncCoordinator;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for camera synchronization.
 *
 * Reports UP while sessions can be obtained, even if the last cycle failed.
 * Reports DOWN after repeated session failures, when cameras are shown unavailable.
 */
@Component
@RequiredArgsConstructor
public class SyncHealthIndicator implements HealthIndicator {

    private final SyncCoordinator coordinator;

    @Override
    public Health health() {
        Health.Builder builder = coordinator.isAvailable() ? Health.up() : Health.down();

        builder.withDetail("phase", coordinator.getPhase())
                .withDetail("cameras", coordinator.getSnapshot().size())
                .withDetail("consecutive-session-failures", coordinator.getConsecutiveSessionFailures());

        coordinator.getLastReport().ifPresent(report -> addLastCycle(builder, report));
        return builder.build();
    }

    private void addLastCycle(Health.Builder builder, CycleReport report) {
        builder.withDetail("last-cycle", report.outcome())
                .withDetail("last-cycle-completed", report.completedAt())
                .withDetail("last-cycle-message", report.message());
    }
}
