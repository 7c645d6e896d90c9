package com.heronix.trailcam.controller.api;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.trailcam.adapter.CameraCloudAdapter;
import com.heronix.trailcam.model.dto.SyncStatusDTO;
import com.heronix.trailcam.model.enums.RefreshOutcome;
import com.heronix.trailcam.service.SessionManager;
import com.heronix.trailcam.service.SyncCoordinator;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for sync operations.
 */
@RestController
@RequestMapping("/api/v1/trailcam/sync")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Sync Operations", description = "APIs for triggering and monitoring camera synchronization")
public class SyncController {

    private final SyncCoordinator coordinator;
    private final SessionManager sessionManager;

    @PostMapping("/refresh")
    @Operation(summary = "Refresh now", description = "Start a sync cycle, or queue one behind the running cycle")
    @ApiResponse(responseCode = "202", description = "Cycle started or queued")
    @ApiResponse(responseCode = "503", description = "Coordinator shutting down")
    public ResponseEntity<RefreshResponse> refresh() {
        RefreshOutcome outcome = coordinator.refreshNow();
        log.info("Manual refresh requested: {}", outcome);

        if (outcome == RefreshOutcome.REJECTED) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(new RefreshResponse(outcome, "Sync coordinator is not accepting cycles"));
        }
        return ResponseEntity.accepted().body(new RefreshResponse(outcome, describe(outcome)));
    }

    @GetMapping("/status")
    @Operation(summary = "Get sync status")
    public ResponseEntity<SyncStatusDTO> getStatus() {
        return ResponseEntity.ok(coordinator.getStatus());
    }

    @PostMapping("/test-connection")
    @Operation(summary = "Test connection", description = "Log in with the configured account")
    public ResponseEntity<CameraCloudAdapter.ConnectionTestResult> testConnection() {
        log.info("Testing camera cloud connection");
        return ResponseEntity.ok(sessionManager.testConnection());
    }

    private static String describe(RefreshOutcome outcome) {
        return switch (outcome) {
            case STARTED -> "Sync cycle started";
            case QUEUED -> "Sync cycle queued behind the running cycle";
            case COALESCED -> "Sync cycle already queued";
            case REJECTED -> "Sync coordinator is not accepting cycles";
        };
    }

    public record RefreshResponse(RefreshOutcome outcome, String message) {}
}
