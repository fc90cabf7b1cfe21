package com.yerin.bgjob.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum CommonErrorCode implements ErrorCode {
    SERIALIZATION_FAILED("failed to serialize or deserialize data", "COMMON-001");

    private final String message;
    private final String code;
}
