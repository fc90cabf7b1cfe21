package com.yerin.bgjob.infra;

import com.yerin.bgjob.domain.JobHistory;
import com.yerin.bgjob.domain.JobStore;
import com.yerin.bgjob.domain.QueueJob;
import com.yerin.bgjob.domain.QueueJobStatus;
import com.yerin.bgjob.domain.ScheduledJob;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.global.exception.code.JobErrorCode;
import com.yerin.bgjob.repository.JobHistoryRepository;
import com.yerin.bgjob.repository.QueueJobRepository;
import com.yerin.bgjob.repository.ScheduledJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
public class JpaJobStore implements JobStore {

    private static final int CLAIM_CANDIDATES = 10;

    private final QueueJobRepository queueJobRepository;
    private final JobHistoryRepository historyRepository;
    private final ScheduledJobRepository scheduledJobRepository;
    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate tx;
    private final Clock clock;

    public JpaJobStore(QueueJobRepository queueJobRepository,
                       JobHistoryRepository historyRepository,
                       ScheduledJobRepository scheduledJobRepository,
                       JdbcTemplate jdbcTemplate,
                       PlatformTransactionManager txManager,
                       Clock clock) {
        this.queueJobRepository = queueJobRepository;
        this.historyRepository = historyRepository;
        this.scheduledJobRepository = scheduledJobRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.tx = new TransactionTemplate(txManager);
        this.clock = clock;
    }

    @Override
    @Transactional
    public QueueJob createQueueJob(QueueJob job) {
        if (job.getStatus() == null) job.setStatus(QueueJobStatus.PENDING);
        return queueJobRepository.save(job);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<QueueJob> findQueueJob(String id) {
        return queueJobRepository.findById(id);
    }

    @Override
    @Transactional
    public Optional<QueueJob> claimNextPendingJob(String workerId, Instant now, Instant leaseUntil) {
        List<QueueJob> candidates = queueJobRepository.findClaimCandidates(now, PageRequest.of(0, CLAIM_CANDIDATES));
        for (QueueJob candidate : candidates) {
            // 조건부 update 로 원자적 선점, 0 이면 다른 워커가 가져감
            if (queueJobRepository.claimIfPending(candidate.getId(), workerId, now, leaseUntil) == 1) {
                return queueJobRepository.findById(candidate.getId());
            }
            log.debug("[JobStore] lost claim race jobId={}, worker={}", candidate.getId(), workerId);
        }
        return Optional.empty();
    }

    @Override
    @Transactional
    public Optional<QueueJob> claimJob(String id, String workerId, Instant now, Instant leaseUntil) {
        if (queueJobRepository.claimIfPending(id, workerId, now, leaseUntil) == 1) {
            return queueJobRepository.findById(id);
        }
        return Optional.empty();
    }

    // 핸들러 트랜잭션이 롤백돼도 연장은 남아야 함
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean extendLease(String id, String workerId, Instant leaseUntil) {
        return queueJobRepository.extendLeaseIfClaimed(id, workerId, leaseUntil) == 1;
    }

    @Override
    @Transactional
    public void updateQueueJobStatus(String id, QueueJobStatus status, String output, String error) {
        QueueJob job = require(id);
        Instant now = clock.instant();
        job.setStatus(status);
        if (status == QueueJobStatus.PROCESSING) {
            job.setStartedAt(now);
        }
        if (status.isTerminal()) {
            job.setCompletedAt(now);
            job.setLeaseUntil(null);
            job.setClaimedBy(null);
        }
        if (output != null) job.setResult(output);
        if (error != null) job.setLastError(error);
        queueJobRepository.save(job);
    }

    @Override
    @Transactional
    public int incrementRetryCount(String id) {
        if (queueJobRepository.incrementRetryCount(id) == 0) {
            throw new AppException(JobErrorCode.JOB_NOT_FOUND);
        }
        return require(id).getRetryCount();
    }

    @Override
    @Transactional
    public void requeue(String id, int priority, Instant notBefore) {
        QueueJob job = require(id);
        job.setStatus(QueueJobStatus.PENDING);
        job.setPriority(priority);
        job.setScheduledAt(notBefore);
        job.setLeaseUntil(null);
        job.setClaimedBy(null);
        queueJobRepository.save(job);
    }

    @Override
    @Transactional
    public void resetForReplay(String id) {
        QueueJob job = require(id);
        job.setStatus(QueueJobStatus.PENDING);
        job.setRetryCount(0);
        job.setScheduledAt(null);
        job.setCompletedAt(null);
        job.setLeaseUntil(null);
        job.setClaimedBy(null);
        queueJobRepository.save(job);
    }

    @Override
    @Transactional(readOnly = true)
    public List<QueueJob> findExpiredLeases(Instant now, int limit) {
        return queueJobRepository.findByStatusAndLeaseUntilLessThanEqualOrderByLeaseUntilAsc(
                QueueJobStatus.PROCESSING, now, PageRequest.of(0, limit));
    }

    @Override
    @Transactional
    public boolean requeueExpiredLease(String id, int expectedRetryCount, Instant now, Instant notBefore) {
        return queueJobRepository.requeueIfLeaseExpired(id, expectedRetryCount, now, notBefore) == 1;
    }

    @Override
    @Transactional
    public boolean failExpiredLease(String id, int expectedRetryCount, Instant now, String error) {
        return queueJobRepository.failIfLeaseExpired(id, expectedRetryCount, now, error) == 1;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<QueueJobStatus, Long> countByStatus() {
        Map<QueueJobStatus, Long> counts = new EnumMap<>(QueueJobStatus.class);
        for (QueueJobStatus s : QueueJobStatus.values()) {
            counts.put(s, queueJobRepository.countByStatus(s));
        }
        return counts;
    }

    @Override
    @Transactional
    public JobHistory createJobHistory(JobHistory history) {
        return historyRepository.save(history);
    }

    @Override
    @Transactional(readOnly = true)
    public List<JobHistory> findHistory(String jobId) {
        return historyRepository.findByJobIdOrderByStartedAtAsc(jobId);
    }

    @Override
    @Transactional
    public int deleteHistoryBefore(Instant cutoff) {
        return historyRepository.deleteStartedBefore(cutoff);
    }

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledJob> findActiveScheduledJobs() {
        return scheduledJobRepository.findByActiveTrueAndEnabledTrueOrderByPriorityDesc();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ScheduledJob> findScheduledJob(String id) {
        return scheduledJobRepository.findById(id);
    }

    @Override
    @Transactional
    public boolean claimScheduledFiring(String jobId, int expectedCount, Instant lastRunAt, Instant nextRunAt) {
        return scheduledJobRepository.recordFiring(jobId, expectedCount, lastRunAt, nextRunAt) == 1;
    }

    @Override
    public boolean evaluateCondition(String condition) {
        try {
            Integer result = jdbcTemplate.queryForObject(
                    "SELECT CASE WHEN (" + condition + ") THEN 1 ELSE 0 END", Integer.class);
            return result != null && result == 1;
        } catch (DataAccessException e) {
            throw new AppException(JobErrorCode.CONDITION_EVALUATION_FAILED.withDetail(
                    "failed to evaluate condition: " + e.getMostSpecificCause().getMessage()), e);
        }
    }

    @Override
    public <T> T inTransaction(TransactionCallback<T> callback) {
        return tx.execute(callback);
    }

    private QueueJob require(String id) {
        return queueJobRepository.findById(id)
                .orElseThrow(() -> new AppException(JobErrorCode.JOB_NOT_FOUND.withDetail("queue job not found: " + id)));
    }
}
