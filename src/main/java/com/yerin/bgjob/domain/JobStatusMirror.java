package com.yerin.bgjob.domain;

import java.time.Instant;

/**
 * Cached copy of a queue job's status. The job store wins whenever the two disagree.
 */
public record JobStatusMirror(QueueJobStatus status, String instanceId, Instant updatedAt) {}
