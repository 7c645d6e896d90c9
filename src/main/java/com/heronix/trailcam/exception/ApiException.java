package com.heronix.trailcam.exception;

/**
 * Exception thrown when the remote camera API call fails.
 */
public class ApiException extends RuntimeException {

    public enum Kind {
        UNAUTHORIZED,
        NOT_FOUND,
        UNAVAILABLE,
        MALFORMED
    }

    private final Kind kind;

    public ApiException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ApiException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
