package com.yerin.bgjob.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * A recurring job definition. Edited outside the job system; the scheduler only
 * touches {@code lastRunAt}, {@code nextRunAt} and {@code executionCount}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Entity
@Table(name = "jobs")
@DynamicUpdate
public class ScheduledJob {

    @Id
    @Column(length = 36)
    private String id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "text")
    private String description;

    @Column(length = 200)
    private String handler;

    @Column(name = "cron_expression", length = 120)
    private String cronExpression;

    @Column(name = "interval_seconds")
    private Long intervalSeconds;

    @Column(name = "start_at")
    private Instant startAt;

    @Column(name = "end_at")
    private Instant endAt;

    // null or 0 means unlimited
    @Column(name = "max_executions")
    private Integer maxExecutions;

    @Column(name = "execution_count", nullable = false)
    private int executionCount;

    @Column(nullable = false)
    private boolean enabled;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "job_condition", columnDefinition = "text")
    private String condition;

    @Column(nullable = false)
    private int priority;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Convert(converter = JobMetadataConverter.class)
    @Column(columnDefinition = "text")
    @Builder.Default
    private JobMetadata metadata = JobMetadata.empty();

    @Column(name = "last_run_at")
    private Instant lastRunAt;

    @Column(name = "next_run_at")
    private Instant nextRunAt;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * @throws com.yerin.bgjob.global.exception.AppException if neither or both trigger columns are set
     */
    public Trigger trigger() {
        return Trigger.fromColumns(cronExpression, intervalSeconds);
    }

    public void setTrigger(Trigger trigger) {
        this.cronExpression = cronColumn(trigger);
        this.intervalSeconds = intervalColumn(trigger);
    }

    private static String cronColumn(Trigger trigger) {
        return trigger instanceof Trigger.Cron cron ? cron.expression() : null;
    }

    private static Long intervalColumn(Trigger trigger) {
        return trigger instanceof Trigger.Interval interval ? interval.period().toSeconds() : null;
    }

    public boolean hasReachedMaxExecutions() {
        return maxExecutions != null && maxExecutions > 0 && executionCount >= maxExecutions;
    }

    /**
     * Reason this definition must not fire at {@code now}, if any.
     */
    public Optional<String> gatingReason(Instant now) {
        if (startAt != null && startAt.isAfter(now)) {
            return Optional.of("not yet started (starts at " + startAt + ")");
        }
        if (endAt != null && endAt.isBefore(now)) {
            return Optional.of("ended at " + endAt);
        }
        if (hasReachedMaxExecutions()) {
            return Optional.of("reached max executions (" + maxExecutions + ")");
        }
        return Optional.empty();
    }

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (id == null) id = UUID.randomUUID().toString();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (metadata == null) metadata = JobMetadata.empty();
    }

    @PreUpdate
    void preUpdate() { updatedAt = Instant.now(); }

    public static class ScheduledJobBuilder {
        public ScheduledJobBuilder trigger(Trigger trigger) {
            this.cronExpression = cronColumn(trigger);
            this.intervalSeconds = intervalColumn(trigger);
            return this;
        }
    }
}
