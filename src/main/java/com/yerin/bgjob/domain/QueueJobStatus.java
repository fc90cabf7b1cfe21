package com.yerin.bgjob.domain;

public enum QueueJobStatus {
    PENDING,
    PROCESSING,
    RETRYING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
