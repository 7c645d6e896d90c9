package com.heronix.trailcam.controller.api;

import java.util.List;

import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.trailcam.model.dto.CameraEntityDTO;
import com.heronix.trailcam.service.CameraEntityService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API exposing cameras of the latest snapshot as entities.
 */
@RestController
@RequestMapping("/api/v1/trailcam/cameras")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Cameras", description = "Camera entities from the latest sync cycle")
public class CameraController {

    private final CameraEntityService cameraService;

    @GetMapping
    @Operation(summary = "List cameras", description = "All cameras of the latest snapshot")
    public ResponseEntity<List<CameraEntityDTO>> listCameras() {
        log.debug("API: Listing cameras");
        return ResponseEntity.ok(cameraService.listCameras());
    }

    @GetMapping("/{cameraId}")
    @Operation(summary = "Get camera")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Camera found"),
        @ApiResponse(responseCode = "404", description = "Unknown camera")
    })
    public ResponseEntity<CameraEntityDTO> getCamera(@PathVariable String cameraId) {
        log.debug("API: Getting camera {}", cameraId);
        return ResponseEntity.ok(cameraService.getCamera(cameraId));
    }

    @GetMapping(value = "/{cameraId}/image", produces = MediaType.IMAGE_JPEG_VALUE)
    @Operation(summary = "Get latest photo", description = "Cached JPEG of the camera's latest photo")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Photo bytes"),
        @ApiResponse(responseCode = "404", description = "Unknown camera or no photo yet")
    })
    public ResponseEntity<byte[]> getImage(@PathVariable String cameraId) {
        return cameraService.getImage(cameraId)
                .map(bytes -> ResponseEntity.ok()
                        .contentType(MediaType.IMAGE_JPEG)
                        .cacheControl(CacheControl.noCache())
                        .body(bytes))
                .orElse(ResponseEntity.notFound().build());
    }
}
