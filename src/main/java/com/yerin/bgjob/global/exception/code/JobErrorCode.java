package com.yerin.bgjob.global.exception.code;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum JobErrorCode implements ErrorCode {
    JOB_NOT_FOUND("job not found", "JOB-001"),
    JOB_NOT_FAILED("only FAILED jobs can be replayed", "JOB-002"),
    HANDLER_NOT_FOUND("no handler registered for name", "JOB-003"),
    INVALID_TRIGGER("job must define exactly one of cron expression or interval", "JOB-004"),
    HANDLER_REQUIRED("job handler name is required", "JOB-005"),
    WORKER_ALREADY_RUNNING("worker pool already running", "JOB-006"),
    WORKER_NOT_RUNNING("worker pool not running", "JOB-007"),
    SCHEDULER_ALREADY_RUNNING("scheduler already running", "JOB-008"),
    SCHEDULER_NOT_RUNNING("scheduler not running", "JOB-009"),
    JOB_NOT_SCHEDULED("job is not scheduled", "JOB-010"),
    CONDITION_EVALUATION_FAILED("failed to evaluate job condition", "JOB-011");

    private final String message;
    private final String code;
}
