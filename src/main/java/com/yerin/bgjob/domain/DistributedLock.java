package com.yerin.bgjob.domain;

import java.time.Duration;
import java.time.Instant;

/**
 * Cache-resident lock record; never persisted in the job store.
 */
public record DistributedLock(String jobId, String instanceId, Instant lockedAt, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isOwnedBy(String instance) {
        return instanceId != null && instanceId.equals(instance);
    }

    public DistributedLock extendedBy(Duration extra) {
        return new DistributedLock(jobId, instanceId, lockedAt, expiresAt.plus(extra));
    }
}
