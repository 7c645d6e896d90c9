package com.heronix.trailcam.exception;

/**
 * Exception thrown when downloading a photo from its pre-signed URL fails.
 */
public class MediaFetchException extends RuntimeException {

    public enum Kind {
        NETWORK_ERROR,
        /** URL signature rejected, typically because it expired */
        FORBIDDEN,
        /** Object no longer exists at the URL */
        GONE
    }

    private final Kind kind;

    public MediaFetchException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public MediaFetchException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
