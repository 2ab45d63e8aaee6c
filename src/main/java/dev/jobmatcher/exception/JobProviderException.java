package dev.jobmatcher.exception;

import lombok.Getter;

/**
 * Failure reported by the external job provider. The {@link Reason} lets callers surface a
 * specific status instead of a generic error.
 */
@Getter
public class JobProviderException extends RuntimeException {

    public enum Reason {
        RATE_LIMITED,
        AUTHENTICATION,
        BAD_REQUEST,
        UNAVAILABLE
    }

    private final Reason reason;

    public JobProviderException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public JobProviderException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
