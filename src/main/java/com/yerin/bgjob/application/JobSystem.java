package com.yerin.bgjob.application;

import com.yerin.bgjob.config.JobqProperties;
import com.yerin.bgjob.domain.JobStore;
import com.yerin.bgjob.domain.QueueJobStatus;
import com.yerin.bgjob.dto.JobSystemStatus;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.infra.DistributedQueueManager;
import com.yerin.bgjob.infra.JobScheduler;
import com.yerin.bgjob.infra.JobWorkerPool;
import com.yerin.bgjob.service.IntegrationJobCreator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Owns the queue manager, worker pool, scheduler and integration job creator for this
 * instance. Started and stopped with the application context.
 */
@Slf4j
@Getter
@Component
@RequiredArgsConstructor
public class JobSystem implements SmartLifecycle {

    private final DistributedQueueManager queueManager;
    private final JobWorkerPool workerPool;
    private final JobScheduler scheduler;
    private final IntegrationJobCreator integrationJobCreator;
    private final JobStore store;
    private final JobqProperties props;

    private volatile boolean running;

    @Override
    public synchronized void start() {
        if (running) return;
        log.info("[JobSystem] starting instance={}", queueManager.getInstanceId());

        if (queueManager.isDistributed()) {
            try {
                queueManager.healthCheck();
            } catch (AppException e) {
                // store claim 만으로도 처리는 계속 가능
                log.warn("[JobSystem] cache health check failed, coordination is best effort: {}", e.getMessage());
            }
        } else {
            log.warn("[JobSystem] no shared cache, running in single-instance mode");
        }

        workerPool.start();
        scheduler.start();
        running = true;
        log.info("[JobSystem] started instance={}, distributed={}", queueManager.getInstanceId(), queueManager.isDistributed());
    }

    @Override
    public synchronized void stop() {
        if (!running) return;
        log.info("[JobSystem] stopping instance={}", queueManager.getInstanceId());
        if (workerPool.isRunning()) {
            workerPool.stop();
        }
        if (scheduler.isRunning()) {
            scheduler.stop();
        }
        running = false;
        log.info("[JobSystem] stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return props.isEnabled();
    }

    public JobSystemStatus status() {
        Map<QueueJobStatus, Long> counts;
        try {
            counts = store.countByStatus();
        } catch (RuntimeException e) {
            log.warn("[JobSystem] failed to count jobs: {}", e.toString());
            counts = null;
        }
        return new JobSystemStatus(
                running,
                queueManager.getInstanceId(),
                queueManager.isDistributed(),
                workerPool.status(),
                scheduler.status(),
                counts
        );
    }
}
