package com.ziplens.service.retry;

/**
 * Implemented by exceptions that know whether another attempt can help.
 */
public interface ClassifiedFailure {
    RetryDecision retryDecision();
}
