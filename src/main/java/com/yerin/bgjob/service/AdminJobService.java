package com.yerin.bgjob.service;

import com.yerin.bgjob.domain.JobStore;
import com.yerin.bgjob.domain.QueueJob;
import com.yerin.bgjob.domain.QueueJobStatus;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.global.exception.code.JobErrorCode;
import com.yerin.bgjob.infra.DistributedQueueManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AdminJobService {

    private final JobStore store;
    private final DistributedQueueManager queueManager;

    public QueueJob replay(String jobId) {
        QueueJob job = store.findQueueJob(jobId)
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));

        if (job.getStatus() != QueueJobStatus.FAILED) {
            throw new AppException(JobErrorCode.JOB_NOT_FAILED);
        }

        // 재시작 : 카운트 초기화 + 즉시 재처리 + 큐 재적재
        store.resetForReplay(jobId);
        queueManager.clearJobData(jobId);
        queueManager.enqueueJob(jobId, job.getPriority());
        log.info("[Admin] replayed jobId={}", jobId);
        return store.findQueueJob(jobId).orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND));
    }

    public Map<QueueJobStatus, Long> jobCounts() {
        return store.countByStatus();
    }
}
