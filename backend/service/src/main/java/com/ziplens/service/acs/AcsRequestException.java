package com.ziplens.service.acs;

import com.ziplens.service.retry.ClassifiedFailure;
import com.ziplens.service.retry.RetryDecision;

public class AcsRequestException extends RuntimeException implements ClassifiedFailure {
    public enum Kind {
        TRANSIENT,
        RATE_LIMITED,
        CREDENTIAL,
        REJECTED
    }

    private final Kind kind;
    private final int statusCode;

    public AcsRequestException(Kind kind, int statusCode, String message) {
        this(kind, statusCode, message, null);
    }

    public AcsRequestException(Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static AcsRequestException forStatus(int statusCode) {
        if (statusCode == 401 || statusCode == 403) {
            return new AcsRequestException(Kind.CREDENTIAL, statusCode, "API key rejected (HTTP " + statusCode + ")");
        }
        if (statusCode == 429) {
            return new AcsRequestException(Kind.RATE_LIMITED, statusCode, "Rate limited by provider (HTTP 429)");
        }
        if (statusCode >= 400 && statusCode < 500) {
            return new AcsRequestException(Kind.REJECTED, statusCode, "Request rejected (HTTP " + statusCode + ")");
        }
        return new AcsRequestException(Kind.TRANSIENT, statusCode, "Provider call failed (HTTP " + statusCode + ")");
    }

    public Kind kind() {
        return kind;
    }

    /**
     * HTTP status, or 0 when the call never produced one.
     */
    public int statusCode() {
        return statusCode;
    }

    @Override
    public RetryDecision retryDecision() {
        return switch (kind) {
            case TRANSIENT -> RetryDecision.RETRY;
            case RATE_LIMITED -> RetryDecision.RETRY_AFTER_COOLDOWN;
            case CREDENTIAL, REJECTED -> RetryDecision.FAIL_FAST;
        };
    }
}
