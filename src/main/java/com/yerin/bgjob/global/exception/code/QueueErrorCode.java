package com.yerin.bgjob.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum QueueErrorCode implements ErrorCode {
    LOCK_NOT_OWNED("lock owned by different instance", "QUEUE-001"),
    LOCK_NOT_FOUND("lock does not exist", "QUEUE-002"),
    LOCK_CHANGED("lock changed concurrently", "QUEUE-003"),
    HEALTH_CHECK_FAILED("cache health check failed", "QUEUE-004");

    private final String message;
    private final String code;
}
