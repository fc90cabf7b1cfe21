package com.yerin.bgjob.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Duration;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SchedulerStatus(
        boolean running,
        int scheduledJobCount,
        Set<String> scheduledJobIds,
        Duration checkInterval
) {
}
