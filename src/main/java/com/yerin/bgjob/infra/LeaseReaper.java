package com.yerin.bgjob.infra;

import com.yerin.bgjob.config.JobqProperties;
import com.yerin.bgjob.domain.JobStore;
import com.yerin.bgjob.domain.JobqMetrics;
import com.yerin.bgjob.domain.QueueJob;
import com.yerin.bgjob.domain.QueueJobStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Returns PROCESSING jobs whose claim lease ran out (the owning instance died mid-job)
 * to the queue, or fails them once they are out of retries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "jobq", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LeaseReaper {

    static final String LEASE_EXPIRED = "lease expired while processing";

    private final JobStore store;
    private final DistributedQueueManager queueManager;
    private final JobqMetrics metrics;
    private final JobqProperties props;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${jobq.reaper.interval-millis:30000}")
    public void reap() {
        Instant now = clock.instant();
        List<QueueJob> expired = store.findExpiredLeases(now, props.getReaper().getBatchSize());
        if (expired.isEmpty()) return;

        int handled = 0;
        for (QueueJob j : expired) {
            try {
                if (revert(j, now)) {
                    handled++;
                } else {
                    log.debug("[LeaseReaper] jobId={} changed since read, skipped", j.getId());
                }
            } catch (RuntimeException e) {
                log.warn("[LeaseReaper] failed to revert jobId={}, err={}", j.getId(), e.toString());
            }
        }
        metrics.incLeasesReaped(handled);
        log.info("[LeaseReaper] reaped={} (PROCESSING→PENDING/FAILED)", handled);
    }

    // 조건부 update 로만 되돌림, 다른 인스턴스의 reaper 나 새 워커와 경합해도 한 번만 반영
    private boolean revert(QueueJob j, Instant now) {
        if (j.canRetry()) {
            JobqProperties.Retry retry = props.getRetry();
            Duration wait = Backoff.expJitter(j.getRetryCount(),
                    retry.getBaseBackoff(), retry.getBackoffCap(), retry.getJitterRatio());
            if (!store.requeueExpiredLease(j.getId(), j.getRetryCount(), now, now.plus(wait))) {
                return false;
            }
            queueManager.setJobStatus(j.getId(), QueueJobStatus.PENDING);
            queueManager.enqueueJob(j.getId(), j.getPriority());
            return true;
        }
        if (!store.failExpiredLease(j.getId(), j.getRetryCount(), now, LEASE_EXPIRED)) {
            return false;
        }
        queueManager.setJobStatus(j.getId(), QueueJobStatus.FAILED);
        metrics.incDead();
        return true;
    }
}
