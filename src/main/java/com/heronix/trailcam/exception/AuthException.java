package com.heronix.trailcam.exception;

/**
 * Exception thrown when a session cannot be established or renewed.
 */
public class AuthException extends RuntimeException {

    public enum Kind {
        /** Identity provider rejected the identifier/secret pair */
        INVALID_CREDENTIAL,
        /** Identity provider unreachable or answered with a server error */
        PROVIDER_UNAVAILABLE,
        /** Identity provider is rate limiting this client */
        THROTTLED,
        /** Both refresh-token renewal and full re-authentication failed */
        REFRESH_REJECTED
    }

    private final Kind kind;

    public AuthException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AuthException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Whether the failure means the stored credential must not be reused.
     */
    public boolean isPermanent() {
        return kind == Kind.INVALID_CREDENTIAL || kind == Kind.REFRESH_REJECTED;
    }
}
