package com.yerin.bgjob.infra;

import com.yerin.bgjob.application.JobExecution;
import com.yerin.bgjob.application.JobExecutor;
import com.yerin.bgjob.config.JobqProperties;
import com.yerin.bgjob.domain.JobHistory;
import com.yerin.bgjob.domain.JobStore;
import com.yerin.bgjob.domain.JobqMetrics;
import com.yerin.bgjob.domain.QueueJob;
import com.yerin.bgjob.domain.QueueJobStatus;
import com.yerin.bgjob.dto.WorkerPoolStatus;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.global.exception.code.JobErrorCode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fixed set of pollers that claim queue jobs from the store, lock them across instances,
 * run the handler inside a store transaction and record the outcome.
 */
@Slf4j
public class JobWorkerPool {

    private final JobStore store;
    private final DistributedQueueManager queueManager;
    private final JobExecutor executor;
    private final JobqMetrics metrics;
    private final Clock clock;
    private final JobqProperties.Worker workerProps;
    private final JobqProperties.Retry retryProps;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private ExecutorService workers;
    private CountDownLatch stopSignal;
    private volatile boolean running;

    public JobWorkerPool(JobStore store, DistributedQueueManager queueManager, JobExecutor executor,
                         JobqMetrics metrics, Clock clock, JobqProperties props) {
        this.store = store;
        this.queueManager = queueManager;
        this.executor = executor;
        this.metrics = metrics;
        this.clock = clock;
        this.workerProps = props.getWorker();
        this.retryProps = props.getRetry();
    }

    public synchronized void start() {
        if (running) {
            throw new AppException(JobErrorCode.WORKER_ALREADY_RUNNING);
        }
        int concurrency = Math.max(1, workerProps.getConcurrency());
        stopSignal = new CountDownLatch(1);
        workers = Executors.newFixedThreadPool(concurrency);
        running = true;

        for (int i = 1; i <= concurrency; i++) {
            final int workerNo = i;
            final CountDownLatch signal = stopSignal;
            workers.submit(() -> pollLoop(workerNo, signal));
        }
        log.info("[Worker] started {} workers instance={}, distributed={}",
                concurrency, queueManager.getInstanceId(), queueManager.isDistributed());
    }

    /**
     * Signals the pollers and waits for in-flight jobs up to the shutdown timeout. Running
     * handlers are not interrupted.
     */
    public synchronized void stop() {
        if (!running) {
            throw new AppException(JobErrorCode.WORKER_NOT_RUNNING);
        }
        running = false;
        stopSignal.countDown();
        workers.shutdown();
        try {
            long timeoutMillis = workerProps.getShutdownTimeout().toMillis();
            if (!workers.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("[Worker] workers still busy after {} ms, leaving them to finish", timeoutMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Worker] interrupted while waiting for workers to stop");
        }
        log.info("[Worker] stopped instance={}", queueManager.getInstanceId());
    }

    public boolean isRunning() {
        return running;
    }

    public WorkerPoolStatus status() {
        return new WorkerPoolStatus(
                running,
                workerProps.getConcurrency(),
                queueManager.getInstanceId(),
                queueManager.isDistributed(),
                processed.get(),
                succeeded.get(),
                failed.get()
        );
    }

    private void pollLoop(int workerNo, CountDownLatch signal) {
        log.debug("[Worker] worker-{} polling every {}", workerNo, workerProps.getPollInterval());
        while (signal.getCount() > 0) {
            boolean worked = false;
            try {
                worked = processNextJob(workerNo);
            } catch (RuntimeException e) {
                log.warn("[Worker] poll loop error worker-{}: {}", workerNo, e.toString());
            }
            if (worked) continue; // drain while there is work

            try {
                if (signal.await(workerProps.getPollInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.debug("[Worker] worker-{} exited", workerNo);
    }

    /**
     * One poll cycle: claim, lock, execute and record a single job.
     *
     * @return true if a job was executed
     */
    public boolean processNextJob(int workerNo) {
        String workerId = queueManager.getInstanceId() + "-worker-" + workerNo;
        Instant now = clock.instant();
        Instant leaseUntil = now.plus(queueManager.getDefaultLockTimeout());

        Optional<QueueJob> claimed = queueManager.dequeueJob()
                .flatMap(hinted -> store.claimJob(hinted, workerId, now, leaseUntil))
                .or(() -> store.claimNextPendingJob(workerId, now, leaseUntil));
        if (claimed.isEmpty()) {
            return false;
        }

        QueueJob job = claimed.get();
        if (!queueManager.acquireLock(job.getId())) {
            // 다른 인스턴스가 잡고 있음. store lease 만료 후 다시 집힘
            metrics.incLockContended();
            log.info("[Worker] lock busy, abandoning jobId={}, worker={}", job.getId(), workerId);
            return false;
        }

        try {
            execute(job, workerId, leaseUntil);
        } finally {
            try {
                queueManager.releaseLock(job.getId());
            } catch (RuntimeException e) {
                log.error("[Worker] failed to release lock jobId={}, err={}", job.getId(), e.toString());
            }
        }
        return true;
    }

    private void execute(QueueJob job, String workerId, Instant leaseUntil) {
        String jobId = job.getId();
        store.updateQueueJobStatus(jobId, QueueJobStatus.PROCESSING, null, null);
        queueManager.setJobStatus(jobId, QueueJobStatus.PROCESSING);
        processed.incrementAndGet();
        log.info("[Worker] processing jobId={}, handler={}, priority={}, attempt={}",
                jobId, job.getHandler(), job.getPriority(), job.getRetryCount());

        Instant startedAt = clock.instant();
        long start = System.nanoTime();
        Throwable failure = null;
        String output = null;
        try {
            output = runHandler(job, workerId, leaseUntil);
        } catch (HandlerFailure e) {
            failure = e.getCause();
        } catch (Throwable t) {
            // Error 포함, 워커 스레드는 죽지 않음
            failure = t;
        } finally {
            metrics.handlerTimer(String.valueOf(job.getHandler())).record(Duration.ofNanos(System.nanoTime() - start));
        }

        JobHistory.JobHistoryBuilder history = JobHistory.builder()
                .jobId(jobId)
                .executionId(UUID.randomUUID().toString())
                .startedAt(startedAt)
                .retryAttempt(job.getRetryCount())
                .executedBy(workerId)
                .inputData(job.getPayload())
                .metadata(job.getMetadata());

        if (failure == null) {
            onSuccess(job, output, history);
        } else {
            onFailure(job, failure, history);
        }
    }

    private String runHandler(QueueJob job, String workerId, Instant leaseUntil) {
        AtomicReference<Instant> lease = new AtomicReference<>(leaseUntil);
        return store.inTransaction(tx -> {
            JobExecution execution = JobExecution.builder()
                    .jobId(job.getId())
                    .handlerName(job.getHandler())
                    .payload(job.getPayload())
                    .metadata(job.getMetadata())
                    .retryAttempt(job.getRetryCount())
                    .executedBy(workerId)
                    .transaction(tx)
                    .lockExtender(extra -> {
                        queueManager.extendLock(job.getId(), extra);
                        store.extendLease(job.getId(), workerId, lease.updateAndGet(l -> l.plus(extra)));
                    })
                    .build();
            try {
                return executor.execute(job.getHandler(), execution);
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new HandlerFailure(e);
            }
        });
    }

    private void onSuccess(QueueJob job, String output, JobHistory.JobHistoryBuilder history) {
        String jobId = job.getId();
        Instant finishedAt = clock.instant();
        store.updateQueueJobStatus(jobId, QueueJobStatus.COMPLETED, output, null);
        queueManager.setJobStatus(jobId, QueueJobStatus.COMPLETED);
        writeHistory(history
                .status(QueueJobStatus.COMPLETED)
                .result(JobHistory.RESULT_SUCCESS)
                .outputData(output)
                .completedAt(finishedAt));
        succeeded.incrementAndGet();
        metrics.incSucceeded();
        queueManager.clearJobData(jobId);
        log.info("[Worker] completed jobId={}", jobId);
    }

    private void onFailure(QueueJob job, Throwable failure, JobHistory.JobHistoryBuilder history) {
        String jobId = job.getId();
        String error = describe(failure);
        Instant finishedAt = clock.instant();
        failed.incrementAndGet();
        metrics.incFailed();
        writeHistory(history
                .status(QueueJobStatus.FAILED)
                .result("Error: " + error)
                .errorMessage(error)
                .completedAt(finishedAt));

        if (job.canRetry()) {
            int retryCount = store.incrementRetryCount(jobId);
            store.updateQueueJobStatus(jobId, QueueJobStatus.RETRYING, null, error);
            queueManager.setJobStatus(jobId, QueueJobStatus.RETRYING);

            int priority = job.getPriority() - 1;
            Duration wait = Backoff.expJitter(retryCount - 1,
                    retryProps.getBaseBackoff(), retryProps.getBackoffCap(), retryProps.getJitterRatio());
            store.requeue(jobId, priority, finishedAt.plus(wait));
            queueManager.enqueueJob(jobId, priority);
            metrics.incRetried();
            log.info("[Worker] retry {}/{} reserved jobId={} after {} ms, err={}",
                    retryCount, job.getMaxRetries(), jobId, wait.toMillis(), error);
        } else {
            store.updateQueueJobStatus(jobId, QueueJobStatus.FAILED, null, error);
            queueManager.setJobStatus(jobId, QueueJobStatus.FAILED);
            metrics.incDead();
            log.warn("[Worker] jobId={} failed permanently after {} attempts, err={}",
                    jobId, job.getRetryCount() + 1, error);
        }
    }

    private void writeHistory(JobHistory.JobHistoryBuilder history) {
        JobHistory row = history.build();
        row.setDurationMs(Duration.between(row.getStartedAt(), row.getCompletedAt()).toMillis());
        try {
            store.createJobHistory(row);
        } catch (RuntimeException e) {
            log.error("[Worker] failed to write history jobId={}, err={}", row.getJobId(), e.toString());
        }
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getName() : message;
    }

    /**
     * Carries a checked handler exception out of the transaction callback.
     */
    private static class HandlerFailure extends RuntimeException {
        HandlerFailure(Exception cause) {
            super(cause);
        }
    }
}
