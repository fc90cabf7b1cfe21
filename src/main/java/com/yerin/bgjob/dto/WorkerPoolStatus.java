package com.yerin.bgjob.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerPoolStatus(
        boolean running,
        int workerCount,
        String instanceId,
        boolean distributed,
        long processed,
        long succeeded,
        long failed
) {
}
