package com.yerin.bgjob.service;

import com.yerin.bgjob.domain.JobDirection;
import com.yerin.bgjob.domain.JobMetadata;
import com.yerin.bgjob.domain.JobStore;
import com.yerin.bgjob.domain.JobqMetrics;
import com.yerin.bgjob.domain.QueueJob;
import com.yerin.bgjob.domain.QueueJobStatus;
import com.yerin.bgjob.domain.QueueJobType;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.global.exception.code.JobErrorCode;
import com.yerin.bgjob.infra.DistributedQueueManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Producer contract: persists a pending queue job, then drops a hint into the shared queue.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EnqueueJobService {

    private final JobStore store;
    private final DistributedQueueManager queueManager;
    private final JobqMetrics metrics;

    public QueueJob createJob(String handler, String payload, int priority, int maxRetries, JobMetadata metadata) {
        return createJob(QueueJobType.MANUAL, JobDirection.INTERNAL, handler, payload, priority, maxRetries, metadata, null);
    }

    public QueueJob createJob(QueueJobType type, JobDirection direction, String handler, String payload,
                              int priority, int maxRetries, JobMetadata metadata, String createdBy) {
        QueueJob job = QueueJob.builder()
                .type(type == null ? QueueJobType.MANUAL : type)
                .direction(direction == null ? JobDirection.INTERNAL : direction)
                .handler(handler)
                .payload(payload)
                .status(QueueJobStatus.PENDING)
                .priority(priority)
                .maxRetries(Math.max(0, maxRetries))
                .retryCount(0)
                .metadata(metadata == null ? JobMetadata.empty() : metadata)
                .createdBy(createdBy)
                .build();
        return submit(job);
    }

    /**
     * Persists a fully built queue job as {@code PENDING} and enqueues its hint.
     */
    public QueueJob submit(QueueJob job) {
        if (job.getHandler() == null || job.getHandler().isBlank()) {
            throw new AppException(JobErrorCode.HANDLER_REQUIRED);
        }
        job.setStatus(QueueJobStatus.PENDING);
        if (job.getMetadata() == null) job.setMetadata(JobMetadata.empty());
        QueueJob saved = store.createQueueJob(job);

        // 힌트 실패는 무시, store 가 기준
        queueManager.enqueueJob(saved.getId(), saved.getPriority());
        metrics.incCreated();
        log.info("[Enqueue] created jobId={}, handler={}, type={}, priority={}",
                saved.getId(), saved.getHandler(), saved.getType(), saved.getPriority());
        return saved;
    }
}
