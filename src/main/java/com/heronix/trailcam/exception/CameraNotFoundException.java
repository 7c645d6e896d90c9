package com.heronix.trailcam.exception;

/**
 * Exception thrown when a camera id is not part of the published snapshot.
 */
public class CameraNotFoundException extends RuntimeException {

    public CameraNotFoundException(String cameraId) {
        super("Camera not found: " + cameraId);
    }
}
