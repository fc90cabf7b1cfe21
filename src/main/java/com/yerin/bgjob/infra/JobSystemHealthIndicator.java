package com.yerin.bgjob.infra;

import com.yerin.bgjob.application.JobSystem;
import com.yerin.bgjob.config.JobqProperties;
import com.yerin.bgjob.dto.JobSystemStatus;
import com.yerin.bgjob.global.exception.AppException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JobSystemHealthIndicator implements HealthIndicator {

    private final JobSystem jobSystem;
    private final JobqProperties props;

    @Override
    public Health health() {
        if (!props.isEnabled()) {
            return Health.up().withDetail("enabled", false).build();
        }

        JobSystemStatus status = jobSystem.status();
        Health.Builder builder = status.running() ? Health.up() : Health.down();
        builder.withDetail("instanceId", status.instanceId())
                .withDetail("distributed", status.distributed())
                .withDetail("workerPool", status.workerPool())
                .withDetail("scheduler", status.scheduler());
        if (status.jobCounts() != null) {
            builder.withDetail("jobCounts", status.jobCounts());
        }

        if (status.distributed()) {
            try {
                jobSystem.getQueueManager().healthCheck();
                builder.withDetail("cache", "UP");
            } catch (AppException e) {
                builder.withDetail("cache", "DOWN: " + e.getMessage());
            }
        }
        return builder.build();
    }
}
