package com.yerin.bgjob.infra;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgjob.config.JobqProperties;
import com.yerin.bgjob.domain.CoordinationCache;
import com.yerin.bgjob.domain.DistributedLock;
import com.yerin.bgjob.domain.JobStatusMirror;
import com.yerin.bgjob.domain.QueueEntry;
import com.yerin.bgjob.domain.QueueJobStatus;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.global.exception.code.CommonErrorCode;
import com.yerin.bgjob.global.exception.code.QueueErrorCode;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Best-effort cross-instance coordination over a {@link CoordinationCache}: queue hints,
 * ownership-checked TTL locks and a status mirror. The job store stays the system of
 * record; nothing here is durable.
 */
@Slf4j
public class DistributedQueueManager {

    public static final String JOB_QUEUE_KEY = "job:queue";
    public static final String PENDING_KEY = JOB_QUEUE_KEY + ":pending";
    public static final String HEALTH_KEY_PREFIX = JOB_QUEUE_KEY + ":health:";
    public static final String LOCK_KEY_PREFIX = "job:lock:";
    public static final String STATUS_KEY_PREFIX = "job:status:";

    static final Duration QUEUE_ENTRY_TTL = Duration.ofHours(24);
    static final Duration STATUS_TTL = Duration.ofHours(1);
    static final Duration HEALTH_TTL = Duration.ofSeconds(10);

    // higher priority first, then FIFO (epoch millis stay below this)
    private static final double PRIORITY_WEIGHT = 1e13;

    private final CoordinationCache cache;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    @Getter
    private final String instanceId;
    @Getter
    private final Duration defaultLockTimeout;
    private final Duration lockRetryDelay;
    private final int maxLockAttempts;

    public DistributedQueueManager(CoordinationCache cache, ObjectMapper objectMapper, Clock clock,
                                   String instanceId, JobqProperties.Lock lockProps) {
        this.cache = cache;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.instanceId = instanceId;
        this.defaultLockTimeout = lockProps.getTimeout();
        this.lockRetryDelay = lockProps.getRetryDelay();
        this.maxLockAttempts = Math.max(1, lockProps.getMaxAttempts());
    }

    public boolean isDistributed() {
        return cache.isDistributed();
    }

    public void enqueueJob(String jobId, int priority) {
        long start = System.nanoTime();
        Instant now = clock.instant();
        try {
            QueueEntry entry = new QueueEntry(jobId, priority, now, instanceId);
            cache.put(JOB_QUEUE_KEY + ":" + jobId, write(entry), QUEUE_ENTRY_TTL);
            cache.offer(PENDING_KEY, jobId, -priority * PRIORITY_WEIGHT + now.toEpochMilli(), QUEUE_ENTRY_TTL);
            log.info("[QueueManager] enqueued jobId={}, priority={}", jobId, priority);
        } catch (RuntimeException e) {
            // job store stays authoritative; pollers still find the job
            log.warn("[QueueManager] enqueue failed jobId={}, err={}", jobId, e.toString());
        } finally {
            log.debug("[QueueManager] enqueue jobId={} took {}µs", jobId, (System.nanoTime() - start) / 1000);
        }
    }

    /**
     * Pops one pending hint. Ordering is advisory; the store's claim decides.
     */
    public Optional<String> dequeueJob() {
        try {
            Optional<String> jobId = cache.poll(PENDING_KEY);
            jobId.ifPresent(id -> log.debug("[QueueManager] dequeued jobId={}", id));
            return jobId;
        } catch (RuntimeException e) {
            log.warn("[QueueManager] dequeue failed, err={}", e.toString());
            return Optional.empty();
        }
    }

    public boolean acquireLock(String jobId) {
        return acquireLock(jobId, defaultLockTimeout);
    }

    /**
     * Tries a bounded number of times, backing off linearly, to create the lock record.
     * An expired record found on the way is removed and the attempt repeated.
     */
    public boolean acquireLock(String jobId, Duration timeout) {
        Duration ttl = (timeout == null || timeout.isZero() || timeout.isNegative()) ? defaultLockTimeout : timeout;
        String key = LOCK_KEY_PREFIX + jobId;

        for (int attempt = 1; attempt <= maxLockAttempts; attempt++) {
            Instant now = clock.instant();
            try {
                DistributedLock lock = new DistributedLock(jobId, instanceId, now, now.plus(ttl));
                if (cache.putIfAbsent(key, write(lock), ttl)) {
                    log.info("[QueueManager] acquired lock jobId={}, instance={}", jobId, instanceId);
                    return true;
                }

                Optional<String> raw = cache.get(key);
                if (raw.isEmpty()) {
                    continue; // expired between the two calls
                }
                DistributedLock existing = readLockOrNull(raw.get());
                if (existing == null || existing.isExpired(now)) {
                    if (cache.deleteIfEquals(key, raw.get())) {
                        log.info("[QueueManager] removed expired lock jobId={}, owner={}",
                                jobId, existing == null ? "?" : existing.instanceId());
                    }
                    continue;
                }
                log.debug("[QueueManager] lock held jobId={}, owner={}, expiresAt={}",
                        jobId, existing.instanceId(), existing.expiresAt());
            } catch (RuntimeException e) {
                log.warn("[QueueManager] lock attempt {} failed jobId={}, err={}", attempt, jobId, e.toString());
            }

            if (attempt < maxLockAttempts && !pause(lockRetryDelay.multipliedBy(attempt))) {
                return false;
            }
        }
        return false;
    }

    /**
     * Deletes the lock if this instance owns it. An absent lock is not an error.
     *
     * @throws AppException {@link QueueErrorCode#LOCK_NOT_OWNED} when another instance holds it
     */
    public void releaseLock(String jobId) {
        String key = LOCK_KEY_PREFIX + jobId;
        Optional<String> raw = cache.get(key);
        if (raw.isEmpty()) {
            log.debug("[QueueManager] no lock to release jobId={}", jobId);
            return;
        }

        DistributedLock lock = readLock(raw.get());
        if (!lock.isOwnedBy(instanceId)) {
            log.warn("[QueueManager] refused to release lock jobId={} owned by {}", jobId, lock.instanceId());
            throw new AppException(QueueErrorCode.LOCK_NOT_OWNED);
        }
        if (!cache.deleteIfEquals(key, raw.get()) && cache.exists(key)) {
            throw new AppException(QueueErrorCode.LOCK_CHANGED);
        }
        log.info("[QueueManager] released lock jobId={}", jobId);
    }

    /**
     * Pushes the expiry of a lock this instance owns further out.
     *
     * @throws AppException when the lock is missing, expired or owned by another instance
     */
    public void extendLock(String jobId, Duration extra) {
        if (!cache.isDistributed()) return;

        String key = LOCK_KEY_PREFIX + jobId;
        String raw = cache.get(key).orElseThrow(() -> new AppException(QueueErrorCode.LOCK_NOT_FOUND));
        DistributedLock lock = readLock(raw);
        if (!lock.isOwnedBy(instanceId)) {
            throw new AppException(QueueErrorCode.LOCK_NOT_OWNED);
        }

        DistributedLock extended = lock.extendedBy(extra);
        Duration ttl = Duration.between(clock.instant(), extended.expiresAt());
        if (ttl.isNegative() || ttl.isZero()) {
            throw new AppException(QueueErrorCode.LOCK_NOT_FOUND.withDetail("lock already expired"));
        }
        if (!cache.replaceIfEquals(key, raw, write(extended), ttl)) {
            throw new AppException(QueueErrorCode.LOCK_CHANGED);
        }
        log.debug("[QueueManager] extended lock jobId={} by {}", jobId, extra);
    }

    public Optional<DistributedLock> getLock(String jobId) {
        return cache.get(LOCK_KEY_PREFIX + jobId).map(this::readLock);
    }

    public void setJobStatus(String jobId, QueueJobStatus status) {
        try {
            JobStatusMirror mirror = new JobStatusMirror(status, instanceId, clock.instant());
            cache.put(STATUS_KEY_PREFIX + jobId, write(mirror), STATUS_TTL);
        } catch (RuntimeException e) {
            log.warn("[QueueManager] status mirror write failed jobId={}, status={}, err={}", jobId, status, e.toString());
        }
    }

    public Optional<JobStatusMirror> getJobStatus(String jobId) {
        return cache.get(STATUS_KEY_PREFIX + jobId).map(raw -> read(raw, JobStatusMirror.class));
    }

    public void clearJobData(String jobId) {
        for (String key : new String[]{LOCK_KEY_PREFIX + jobId, STATUS_KEY_PREFIX + jobId, JOB_QUEUE_KEY + ":" + jobId}) {
            try {
                cache.delete(key);
            } catch (RuntimeException e) {
                log.warn("[QueueManager] failed to clear key={}, err={}", key, e.toString());
            }
        }
        log.debug("[QueueManager] cleared cache data jobId={}", jobId);
    }

    /**
     * Write, read and delete round trip against the cache.
     *
     * @throws AppException {@link QueueErrorCode#HEALTH_CHECK_FAILED} on any failure
     */
    public void healthCheck() {
        String key = HEALTH_KEY_PREFIX + instanceId;
        String value = clock.instant().toString();
        try {
            cache.put(key, value, HEALTH_TTL);
            String read = cache.get(key).orElseThrow(() ->
                    new AppException(QueueErrorCode.HEALTH_CHECK_FAILED.withDetail("health check read returned nothing")));
            if (!value.equals(read)) {
                throw new AppException(QueueErrorCode.HEALTH_CHECK_FAILED.withDetail("health check read mismatch"));
            }
            cache.delete(key);
        } catch (AppException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AppException(QueueErrorCode.HEALTH_CHECK_FAILED.withDetail("health check failed: " + e.getMessage()), e);
        }
    }

    private boolean pause(Duration d) {
        try {
            Thread.sleep(d.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private DistributedLock readLock(String raw) {
        return read(raw, DistributedLock.class);
    }

    private DistributedLock readLockOrNull(String raw) {
        try {
            return readLock(raw);
        } catch (AppException e) {
            log.warn("[QueueManager] unreadable lock record, treating as expired: {}", raw);
            return null;
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AppException(CommonErrorCode.SERIALIZATION_FAILED, e);
        }
    }

    private <T> T read(String raw, Class<T> type) {
        try {
            return objectMapper.readValue(raw, type);
        } catch (JsonProcessingException e) {
            throw new AppException(CommonErrorCode.SERIALIZATION_FAILED, e);
        }
    }
}
