package com.ziplens.service.retry;

public enum RetryDecision {
    RETRY,
    RETRY_AFTER_COOLDOWN,
    FAIL_FAST
}
