package com.yerin.bgjob.domain;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

@Component
public class JobqMetrics {

    private final MeterRegistry registry;

    private final Counter jobCreated;
    private final Counter jobSucceeded;
    private final Counter jobFailed;
    private final Counter jobRetried;
    private final Counter jobDead;
    private final Counter lockContended;
    private final Counter scheduledFired;
    private final Counter leasesReaped;

    public JobqMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.jobCreated    = Counter.builder("bgjob_jobs_created_total")
                .description("queue jobs created").register(registry);
        this.jobSucceeded  = Counter.builder("bgjob_jobs_succeeded_total")
                .description("queue jobs completed").register(registry);
        this.jobFailed     = Counter.builder("bgjob_jobs_failed_total")
                .description("handler attempts that failed").register(registry);
        this.jobRetried    = Counter.builder("bgjob_jobs_retried_total")
                .description("queue jobs re-queued for retry").register(registry);
        this.jobDead       = Counter.builder("bgjob_jobs_dead_total")
                .description("queue jobs failed permanently").register(registry);
        this.lockContended = Counter.builder("bgjob_lock_contended_total")
                .description("claimed jobs abandoned because the distributed lock was held").register(registry);
        this.scheduledFired = Counter.builder("bgjob_scheduled_fired_total")
                .description("scheduled job firings that produced a queue job").register(registry);
        this.leasesReaped  = Counter.builder("bgjob_leases_reaped_total")
                .description("processing jobs returned after lease expiry").register(registry);
    }

    public void incCreated()       { jobCreated.increment(); }
    public void incSucceeded()     { jobSucceeded.increment(); }
    public void incFailed()        { jobFailed.increment(); }
    public void incRetried()       { jobRetried.increment(); }
    public void incDead()          { jobDead.increment(); }
    public void incLockContended() { lockContended.increment(); }
    public void incScheduledFired() { scheduledFired.increment(); }
    public void incLeasesReaped(int n) { leasesReaped.increment(n); }

    // handler 태그가 붙은 타이머
    public Timer handlerTimer(String handler) {
        return Timer.builder("bgjob_handler_duration_seconds")
                .description("handler duration by handler name")
                .tag("handler", handler)
                .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                .register(registry);
    }
}
