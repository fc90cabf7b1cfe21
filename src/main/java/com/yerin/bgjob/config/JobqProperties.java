package com.yerin.bgjob.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "jobq")
public class JobqProperties {

    private boolean enabled = true;

    /** Name of this instance; worker ids are derived from it. Generated when blank. */
    private String instanceName;

    private Worker worker = new Worker();
    private Retry retry = new Retry();
    private Lock lock = new Lock();
    private Scheduler scheduler = new Scheduler();
    private Cache cache = new Cache();
    private Reaper reaper = new Reaper();
    private History history = new History();

    @Getter
    @Setter
    public static class Worker {
        private int concurrency = 5;
        private Duration pollInterval = Duration.ofSeconds(5);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxRetries = 3;
        private Duration baseBackoff = Duration.ofSeconds(1);
        private Duration backoffCap = Duration.ofMinutes(1);
        private double jitterRatio = 0.2;
    }

    @Getter
    @Setter
    public static class Lock {
        private Duration timeout = Duration.ofMinutes(5);
        private Duration retryDelay = Duration.ofMillis(100);
        private int maxAttempts = 3;
    }

    @Getter
    @Setter
    public static class Scheduler {
        private Duration checkInterval = Duration.ofSeconds(60);
        private int poolSize = 4;
        private String zone = "UTC";
    }

    @Getter
    @Setter
    public static class Cache {
        /** Use Redis for cross-instance coordination; single-instance mode otherwise. */
        private boolean enabled = true;
    }

    @Getter
    @Setter
    public static class Reaper {
        private long intervalMillis = 30000;
        private int batchSize = 100;
    }

    @Getter
    @Setter
    public static class History {
        private int retentionDays = 90;
        private String purgeCron = "0 30 3 * * *";
    }
}
