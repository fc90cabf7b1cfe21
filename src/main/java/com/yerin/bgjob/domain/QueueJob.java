package com.yerin.bgjob.domain;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.DynamicUpdate;

import java.time.Instant;
import java.util.UUID;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Entity
@Table(name = "queue_jobs", indexes = {
        @Index(name = "ix_queue_jobs_claim", columnList = "status, priority, created_at"),
        @Index(name = "ix_queue_jobs_lease", columnList = "status, lease_until")
})
@DynamicUpdate
public class QueueJob {

    @Id
    @Column(length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private QueueJobType type;

    @Enumerated(EnumType.STRING)
    @Column(length = 30)
    private JobDirection direction;

    @Column(nullable = false, length = 200)
    private String handler;

    @Column(columnDefinition = "text")
    private String payload;

    @Column(columnDefinition = "text")
    private String result;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private QueueJobStatus status;

    @Column(nullable = false)
    private int priority;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "scheduled_at")
    private Instant scheduledAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "claimed_by", length = 200)
    private String claimedBy;

    @Column(name = "lease_until")
    private Instant leaseUntil;

    @Column(name = "parent_job_id", length = 36)
    private String parentJobId;

    @Convert(converter = JobMetadataConverter.class)
    @Column(columnDefinition = "text")
    @Builder.Default
    private JobMetadata metadata = JobMetadata.empty();

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    @PrePersist
    void prePersist() {
        Instant now = Instant.now();
        if (id == null) id = UUID.randomUUID().toString();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
        if (status == null) status = QueueJobStatus.PENDING;
        if (type == null) type = QueueJobType.MANUAL;
        if (metadata == null) metadata = JobMetadata.empty();
    }

    @PreUpdate
    void preUpdate() { updatedAt = Instant.now(); }
}
