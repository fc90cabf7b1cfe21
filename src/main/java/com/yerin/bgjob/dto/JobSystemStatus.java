package com.yerin.bgjob.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.yerin.bgjob.domain.QueueJobStatus;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSystemStatus(
        boolean running,
        String instanceId,
        boolean distributed,
        WorkerPoolStatus workerPool,
        SchedulerStatus scheduler,
        Map<QueueJobStatus, Long> jobCounts
) {
}
