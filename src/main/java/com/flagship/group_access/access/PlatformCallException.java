package com.flagship.group_access.access;

import java.time.Duration;

/**
 * A call to the group platform failed.
 *
 * RETRYABLE covers rate limits, timeouts and platform-side errors. FATAL means the same call
 * cannot succeed later (no join request to approve, bot lost its admin rights).
 */
public class PlatformCallException extends RuntimeException {

    public enum Kind {
        RETRYABLE,
        FATAL
    }

    /** Platform reports the account as deleted or deactivated. */
    public static final String USER_DEACTIVATED = "USER_DEACTIVATED";

    private final Kind kind;
    private final String errorCode;
    private final Duration retryAfter;

    public PlatformCallException(Kind kind, String errorCode, String message, Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.errorCode = errorCode;
        this.retryAfter = retryAfter;
    }

    public static PlatformCallException retryable(String errorCode, String message, Duration retryAfter) {
        return new PlatformCallException(Kind.RETRYABLE, errorCode, message, retryAfter, null);
    }

    public static PlatformCallException fatal(String errorCode, String message) {
        return new PlatformCallException(Kind.FATAL, errorCode, message, null, null);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == Kind.RETRYABLE;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Wait requested by the platform, if any.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
