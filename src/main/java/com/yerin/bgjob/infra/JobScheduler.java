package com.yerin.bgjob.infra;

import com.yerin.bgjob.config.JobqProperties;
import com.yerin.bgjob.domain.JobDirection;
import com.yerin.bgjob.domain.JobMetadata;
import com.yerin.bgjob.domain.JobStore;
import com.yerin.bgjob.domain.JobqMetrics;
import com.yerin.bgjob.domain.QueueJob;
import com.yerin.bgjob.domain.QueueJobType;
import com.yerin.bgjob.domain.ScheduledJob;
import com.yerin.bgjob.domain.Trigger;
import com.yerin.bgjob.dto.SchedulerStatus;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.global.exception.code.JobErrorCode;
import com.yerin.bgjob.service.EnqueueJobService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Keeps one timer entry per active scheduled job and turns each firing into a queue job.
 * A reconciliation pass at a fixed interval re-reads the definitions so edits made
 * elsewhere are picked up without a restart.
 */
@Slf4j
public class JobScheduler {

    static final String SOURCE = "scheduler";

    // 발화 시각과 저장된 nextRunAt 사이 허용 오차
    static final Duration FIRE_TOLERANCE = Duration.ofMillis(500);

    private final JobStore store;
    private final EnqueueJobService enqueueJobService;
    private final JobqMetrics metrics;
    private final Clock clock;
    private final JobqProperties.Scheduler props;
    private final ZoneId zone;

    private final Map<String, ScheduledFuture<?>> entries = new ConcurrentHashMap<>();
    private ThreadPoolTaskScheduler taskScheduler;
    private ScheduledFuture<?> reconcileLoop;
    private volatile boolean running;

    public JobScheduler(JobStore store, EnqueueJobService enqueueJobService, JobqMetrics metrics,
                        Clock clock, JobqProperties.Scheduler props) {
        this.store = store;
        this.enqueueJobService = enqueueJobService;
        this.metrics = metrics;
        this.clock = clock;
        this.props = props;
        this.zone = ZoneId.of(props.getZone());
    }

    public synchronized void start() {
        if (running) {
            throw new AppException(JobErrorCode.SCHEDULER_ALREADY_RUNNING);
        }
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(Math.max(1, props.getPoolSize()));
        taskScheduler.setThreadNamePrefix("bgjob-scheduler-");
        taskScheduler.setClock(clock);
        taskScheduler.setErrorHandler(t -> log.error("[Scheduler] task failed: {}", t.toString(), t));
        taskScheduler.initialize();
        running = true;

        reconcileSafely();
        reconcileLoop = taskScheduler.scheduleWithFixedDelay(this::reconcileSafely,
                clock.instant().plus(props.getCheckInterval()), props.getCheckInterval());
        log.info("[Scheduler] started, checking every {}, zone={}", props.getCheckInterval(), zone);
    }

    public synchronized void stop() {
        if (!running) {
            throw new AppException(JobErrorCode.SCHEDULER_NOT_RUNNING);
        }
        running = false;
        if (reconcileLoop != null) {
            reconcileLoop.cancel(false);
        }
        entries.values().forEach(f -> f.cancel(false));
        entries.clear();
        taskScheduler.shutdown();
        log.info("[Scheduler] stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Loads every active, enabled definition and (re)schedules it. Entries for jobs that
     * are no longer active are cancelled.
     */
    public void reconcile() {
        requireRunning();
        List<ScheduledJob> active = store.findActiveScheduledJobs();
        Set<String> seen = new HashSet<>();
        for (ScheduledJob job : active) {
            seen.add(job.getId());
            try {
                addJob(job);
            } catch (RuntimeException e) {
                log.error("[Scheduler] failed to schedule job={}, err={}", job.getName(), e.toString());
                unschedule(job.getId());
            }
        }
        for (String id : Set.copyOf(entries.keySet())) {
            if (!seen.contains(id)) {
                unschedule(id);
                log.info("[Scheduler] unscheduled inactive jobId={}", id);
            }
        }
        log.debug("[Scheduler] reconciled active={}, scheduled={}", active.size(), entries.size());
    }

    /**
     * Schedules the definition, replacing any existing entry.
     *
     * @return false when the job is gated or misconfigured and was left unscheduled
     */
    public boolean addJob(ScheduledJob job) {
        requireRunning();
        Instant now = clock.instant();

        Optional<String> gate = job.gatingReason(now);
        if (gate.isPresent()) {
            if (unschedule(job.getId())) {
                log.info("[Scheduler] unscheduled job={}: {}", job.getName(), gate.get());
            }
            return false;
        }
        if (job.getHandler() == null || job.getHandler().isBlank()) {
            log.warn("[Scheduler] job={} has no handler, skipped", job.getName());
            unschedule(job.getId());
            return false;
        }

        Trigger trigger;
        try {
            trigger = job.trigger();
        } catch (AppException e) {
            log.warn("[Scheduler] job={} has an invalid trigger, skipped: {}", job.getName(), e.getMessage());
            unschedule(job.getId());
            return false;
        }

        entries.compute(job.getId(), (id, previous) -> {
            if (previous != null) previous.cancel(false);
            return schedule(job, trigger, now);
        });
        log.debug("[Scheduler] scheduled job={} ({}) trigger={}", job.getName(), job.getId(), trigger);
        return true;
    }

    public void removeJob(String jobId) {
        if (!unschedule(jobId)) {
            throw new AppException(JobErrorCode.JOB_NOT_SCHEDULED);
        }
        log.info("[Scheduler] removed jobId={}", jobId);
    }

    public int getScheduledJobCount() {
        return entries.size();
    }

    public boolean isScheduled(String jobId) {
        return entries.containsKey(jobId);
    }

    public SchedulerStatus status() {
        return new SchedulerStatus(running, entries.size(), Set.copyOf(entries.keySet()), props.getCheckInterval());
    }

    /**
     * One firing. The definition is re-read so counters and flags edited since scheduling
     * are respected, and a firing whose {@code nextRunAt} already lies ahead is skipped.
     * The queue job is created only by the instance whose conditional firing record wins.
     */
    public void executeScheduledJob(String jobId) {
        Instant now = clock.instant();
        Optional<ScheduledJob> found = store.findScheduledJob(jobId);
        if (found.isEmpty() || !found.get().isActive() || !found.get().isEnabled()) {
            log.info("[Scheduler] jobId={} missing or disabled, unscheduling", jobId);
            unschedule(jobId);
            return;
        }
        ScheduledJob job = found.get();

        if (job.getNextRunAt() != null && job.getNextRunAt().isAfter(now.plus(FIRE_TOLERANCE))) {
            log.debug("[Scheduler] job={} not due until {}, skipping", job.getName(), job.getNextRunAt());
            return;
        }

        String condition = job.getCondition();
        if (condition != null && !condition.isBlank()) {
            try {
                if (!store.evaluateCondition(condition)) {
                    log.info("[Scheduler] condition not met for job={}, skipping", job.getName());
                    return;
                }
            } catch (RuntimeException e) {
                log.warn("[Scheduler] condition failed for job={}, skipping: {}", job.getName(), e.getMessage());
                return;
            }
        }

        Optional<String> gate = job.gatingReason(now);
        if (gate.isPresent()) {
            log.info("[Scheduler] job={} {}, unscheduling", job.getName(), gate.get());
            unschedule(jobId);
            return;
        }

        Instant nextRunAt = job.trigger().nextRunAfter(now, zone);
        if (!store.claimScheduledFiring(jobId, job.getExecutionCount(), now, nextRunAt)) {
            log.debug("[Scheduler] firing of job={} already recorded by another instance", job.getName());
            return;
        }

        int executionCount = job.getExecutionCount() + 1;
        JobMetadata metadata = job.getMetadata().toBuilder()
                .source(SOURCE)
                .scheduledJobId(job.getId())
                .scheduledJobName(job.getName())
                .executionCount(executionCount)
                .build();
        QueueJob queued = enqueueJobService.createJob(QueueJobType.SCHEDULED, JobDirection.INTERNAL,
                job.getHandler(), null, job.getPriority(), job.getMaxRetries(), metadata, SOURCE);
        metrics.incScheduledFired();
        log.info("[Scheduler] created queue jobId={} for job={} (run #{}, next {})",
                queued.getId(), job.getName(), executionCount, nextRunAt);
    }

    private ScheduledFuture<?> schedule(ScheduledJob job, Trigger trigger, Instant now) {
        String jobId = job.getId();
        Runnable task = () -> fire(jobId);
        if (trigger instanceof Trigger.Cron cron) {
            return taskScheduler.schedule(task, new CronTrigger(cron.expression(), zone));
        }
        Trigger.Interval interval = (Trigger.Interval) trigger;
        return taskScheduler.scheduleAtFixedRate(task, firstIntervalRun(job, interval, now), interval.period());
    }

    /**
     * A future {@code nextRunAt} wins so that rescheduling never pushes a run back.
     * Never-run jobs wait one interval; overdue ones fire right away.
     */
    static Instant firstIntervalRun(ScheduledJob job, Trigger.Interval interval, Instant now) {
        Instant next = job.getNextRunAt();
        if (next != null && next.isAfter(now)) {
            return next;
        }
        if (next == null && job.getLastRunAt() == null) {
            return now.plus(interval.period());
        }
        return now;
    }

    private void fire(String jobId) {
        try {
            executeScheduledJob(jobId);
        } catch (RuntimeException e) {
            log.error("[Scheduler] firing failed jobId={}, err={}", jobId, e.toString());
        }
    }

    private void reconcileSafely() {
        try {
            reconcile();
        } catch (RuntimeException e) {
            log.error("[Scheduler] reconciliation failed: {}", e.toString());
        }
    }

    private boolean unschedule(String jobId) {
        ScheduledFuture<?> future = entries.remove(jobId);
        if (future == null) return false;
        future.cancel(false);
        return true;
    }

    private void requireRunning() {
        if (!running) {
            throw new AppException(JobErrorCode.SCHEDULER_NOT_RUNNING);
        }
    }
}
