package com.yerin.bgjob.domain;

import java.time.Instant;

public record QueueEntry(String jobId, int priority, Instant enqueuedAt, String instanceId) {}
