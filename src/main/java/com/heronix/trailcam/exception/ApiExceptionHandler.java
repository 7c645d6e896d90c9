package com.heronix.trailcam.exception;

import java.time.Instant;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps exceptions raised by the REST layer to JSON error responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    public record ErrorResponse(int status, String error, String message, Instant timestamp) {

        static ResponseEntity<ErrorResponse> of(HttpStatus status, String message) {
            return ResponseEntity.status(status)
                    .body(new ErrorResponse(status.value(), status.getReasonPhrase(), message, Instant.now()));
        }
    }

    @ExceptionHandler(CameraNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleCameraNotFound(CameraNotFoundException e) {
        log.debug("{}", e.getMessage());
        return ErrorResponse.of(HttpStatus.NOT_FOUND, e.getMessage());
    }
}
