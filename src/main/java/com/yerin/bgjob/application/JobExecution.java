package com.yerin.bgjob.application;

import com.yerin.bgjob.domain.JobMetadata;
import lombok.Builder;
import lombok.Getter;
import org.springframework.transaction.TransactionStatus;

import java.time.Duration;
import java.util.function.Consumer;

@Getter
@Builder
public class JobExecution {
    private final String jobId;
    private final String handlerName;
    private final String payload;
    private final JobMetadata metadata;
    private final int retryAttempt;
    private final String executedBy;
    private final TransactionStatus transaction;
    private final Consumer<Duration> lockExtender;

    /**
     * Keeps the distributed lock and the store lease alive for handlers that outlive the
     * lock timeout.
     */
    public void extendLock(Duration extra) {
        if (lockExtender != null) lockExtender.accept(extra);
    }
}
