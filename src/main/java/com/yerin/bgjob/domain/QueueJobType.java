package com.yerin.bgjob.domain;

public enum QueueJobType {
    INTEGRATION,
    SCHEDULED,
    MANUAL,
    SYSTEM
}
