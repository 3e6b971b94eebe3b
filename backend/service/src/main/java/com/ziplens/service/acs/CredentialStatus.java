package com.ziplens.service.acs;

public record CredentialStatus(Status status, int httpStatus, String message) {
    public enum Status {
        VALID,
        INVALID,
        RATE_LIMITED,
        ERROR
    }

    public static CredentialStatus fromHttpStatus(int httpStatus) {
        if (httpStatus >= 200 && httpStatus < 300) {
            return new CredentialStatus(Status.VALID, httpStatus, "API key is valid");
        }
        if (httpStatus == 401 || httpStatus == 403) {
            return new CredentialStatus(Status.INVALID, httpStatus, "API key is invalid or expired");
        }
        if (httpStatus == 429) {
            return new CredentialStatus(Status.RATE_LIMITED, httpStatus, "Rate limited, try again later");
        }
        return new CredentialStatus(Status.ERROR, httpStatus, "Unexpected HTTP status " + httpStatus);
    }
}
