package com.yerin.bgjob.infra;

import com.yerin.bgjob.config.JobqProperties;
import com.yerin.bgjob.domain.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "jobq", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HistoryPurger {

    private final JobStore store;
    private final JobqProperties props;
    private final Clock clock;

    @Scheduled(cron = "${jobq.history.purge-cron:0 30 3 * * *}")
    public void purge() {
        Instant cutoff = clock.instant().minus(Duration.ofDays(props.getHistory().getRetentionDays()));
        int deleted = store.deleteHistoryBefore(cutoff);
        log.info("[HistoryPurger] deleted {} history rows older than {}", deleted, cutoff);
    }
}
