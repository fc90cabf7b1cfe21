package com.yerin.bgjob.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One row per execution attempt of a queue job. Written once, never updated.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "job_history", indexes = {
        @Index(name = "ix_job_history_job", columnList = "job_id"),
        @Index(name = "ix_job_history_started", columnList = "started_at")
})
public class JobHistory {

    public static final String RESULT_SUCCESS = "Success";

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "job_id", nullable = false, length = 36)
    private String jobId;

    @Column(name = "execution_id", nullable = false, length = 36)
    private String executionId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private QueueJobStatus status;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private long durationMs;

    @Column(columnDefinition = "text")
    private String result;

    @Column(name = "error_message", columnDefinition = "text")
    private String errorMessage;

    @Column(name = "retry_attempt", nullable = false)
    private int retryAttempt;

    @Column(name = "executed_by", length = 200)
    private String executedBy;

    @Column(name = "input_data", columnDefinition = "text")
    private String inputData;

    @Column(name = "output_data", columnDefinition = "text")
    private String outputData;

    @Convert(converter = JobMetadataConverter.class)
    @Column(columnDefinition = "text")
    private JobMetadata metadata;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public boolean isSuccess() {
        return RESULT_SUCCESS.equals(result);
    }

    @PrePersist
    void prePersist() {
        if (id == null) id = UUID.randomUUID().toString();
        if (executionId == null) executionId = UUID.randomUUID().toString();
        if (createdAt == null) createdAt = Instant.now();
        if (metadata == null) metadata = JobMetadata.empty();
    }
}
