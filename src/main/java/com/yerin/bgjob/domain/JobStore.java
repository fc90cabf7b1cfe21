package com.yerin.bgjob.domain;

import org.springframework.transaction.support.TransactionCallback;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable system of record for scheduled jobs, queue jobs and execution history.
 * <p>
 * {@link #claimNextPendingJob} and {@link #claimJob} are the serialization point between
 * workers: a pending job can be claimed by at most one worker until its lease runs out.
 */
public interface JobStore {

    QueueJob createQueueJob(QueueJob job);

    Optional<QueueJob> findQueueJob(String id);

    Optional<QueueJob> claimNextPendingJob(String workerId, Instant now, Instant leaseUntil);

    Optional<QueueJob> claimJob(String id, String workerId, Instant now, Instant leaseUntil);

    boolean extendLease(String id, String workerId, Instant leaseUntil);

    /**
     * Sets the status; {@code PROCESSING} stamps {@code startedAt}, terminal states stamp
     * {@code completedAt} and drop the lease.
     */
    void updateQueueJobStatus(String id, QueueJobStatus status, String output, String error);

    int incrementRetryCount(String id);

    /**
     * Puts a job back to {@code PENDING} with a new priority, claimable from {@code notBefore}.
     */
    void requeue(String id, int priority, Instant notBefore);

    /**
     * Resets a failed job for another full round of attempts.
     */
    void resetForReplay(String id);

    List<QueueJob> findExpiredLeases(Instant now, int limit);

    /**
     * Puts a {@code PROCESSING} job whose lease ran out back to {@code PENDING} with one more
     * retry counted, provided it is still in the state the caller read.
     *
     * @return false when the lease was renewed, the job moved on, or another reaper got there first
     */
    boolean requeueExpiredLease(String id, int expectedRetryCount, Instant now, Instant notBefore);

    /**
     * Fails a {@code PROCESSING} job whose lease ran out, under the same guard as
     * {@link #requeueExpiredLease}.
     */
    boolean failExpiredLease(String id, int expectedRetryCount, Instant now, String error);

    Map<QueueJobStatus, Long> countByStatus();

    JobHistory createJobHistory(JobHistory history);

    List<JobHistory> findHistory(String jobId);

    int deleteHistoryBefore(Instant cutoff);

    List<ScheduledJob> findActiveScheduledJobs();

    Optional<ScheduledJob> findScheduledJob(String id);

    /**
     * Claims one firing: stamps {@code lastRunAt}, {@code nextRunAt} and increments
     * {@code executionCount}, only if the count is still {@code expectedCount}. Exactly one
     * instance wins a given firing.
     *
     * @return false when another instance already recorded this firing
     */
    boolean claimScheduledFiring(String jobId, int expectedCount, Instant lastRunAt, Instant nextRunAt);

    /**
     * Evaluates a boolean SQL predicate against the store.
     */
    boolean evaluateCondition(String condition);

    <T> T inTransaction(TransactionCallback<T> callback);
}
