package com.heronix.trailcam.service;

import java.util.concurrent.TimeUnit;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-interval timer for sync cycles.
 *
 * Ticks only hand off to the coordinator, which skips them while a cycle runs.
 */
@Component
@ConditionalOnProperty(prefix = "heronix.trailcam.poll", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SyncScheduler {

    private final SyncCoordinator coordinator;

    @Scheduled(fixedRateString = "${heronix.trailcam.poll.interval-seconds:300}",
            initialDelayString = "${heronix.trailcam.poll.initial-delay-seconds:10}",
            timeUnit = TimeUnit.SECONDS)
    public void tick() {
        if (coordinator.onTimer()) {
            return;
        }
        if (coordinator.isShuttingDown()) {
            log.debug("Sync coordinator shutting down, tick ignored");
        } else {
            log.info("Previous sync cycle still running, skipped this interval");
        }
    }
}
