package com.ziplens.service.retry;

public class RetryExhaustedException extends RuntimeException {
    private final int attempts;

    public RetryExhaustedException(int attempts, Throwable lastFailure) {
        super("Failed after " + attempts + " attempt" + (attempts == 1 ? "" : "s") + ": " + describe(lastFailure), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }

    private static String describe(Throwable failure) {
        if (failure == null) {
            return "unknown error";
        }
        return failure.getMessage() == null ? failure.getClass().getSimpleName() : failure.getMessage();
    }
}
