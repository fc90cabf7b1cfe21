package com.yerin.bgjob.domain;

public enum JobDirection {
    INBOUND,
    OUTBOUND,
    INTERNAL
}
