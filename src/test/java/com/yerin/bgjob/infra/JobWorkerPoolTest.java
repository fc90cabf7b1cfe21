package com.yerin.bgjob.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgjob.application.JobExecution;
import com.yerin.bgjob.application.JobHandler;
import com.yerin.bgjob.application.JobHandlerRegistry;
import com.yerin.bgjob.config.JobqProperties;
import com.yerin.bgjob.domain.CoordinationCache;
import com.yerin.bgjob.domain.JobHistory;
import com.yerin.bgjob.domain.JobMetadata;
import com.yerin.bgjob.domain.JobqMetrics;
import com.yerin.bgjob.domain.QueueJob;
import com.yerin.bgjob.domain.QueueJobStatus;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.global.exception.code.JobErrorCode;
import com.yerin.bgjob.service.EnqueueJobService;
import com.yerin.bgjob.support.InMemoryCoordinationCache;
import com.yerin.bgjob.support.InMemoryJobStore;
import com.yerin.bgjob.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

@DisplayName("워커 풀: 선점/락/실행/재시도 테스트")
public class JobWorkerPoolTest {

    MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    InMemoryJobStore store = new InMemoryJobStore(clock);
    InMemoryCoordinationCache cache = new InMemoryCoordinationCache(clock);
    ObjectMapper om = new ObjectMapper().findAndRegisterModules();
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    JobqMetrics metrics = new JobqMetrics(registry);
    JobqProperties props = props();

    List<JobHandler> handlers = new ArrayList<>();
    DistributedQueueManager queueManager = manager(cache, "instance-a");
    EnqueueJobService enqueue = new EnqueueJobService(store, queueManager, metrics);
    JobWorkerPool pool;

    private static JobqProperties props() {
        JobqProperties p = new JobqProperties();
        p.getRetry().setBaseBackoff(Duration.ZERO);
        p.getRetry().setJitterRatio(0.0);
        p.getLock().setRetryDelay(Duration.ofMillis(1));
        p.getWorker().setPollInterval(Duration.ofMillis(50));
        p.getWorker().setShutdownTimeout(Duration.ofSeconds(2));
        p.getWorker().setConcurrency(2);
        return p;
    }

    private DistributedQueueManager manager(CoordinationCache c, String instanceId) {
        return new DistributedQueueManager(c, om, clock, instanceId, props.getLock());
    }

    private JobWorkerPool pool() {
        return pool(queueManager);
    }

    private JobWorkerPool pool(DistributedQueueManager qm) {
        pool = new JobWorkerPool(store, qm, new JobHandlerRegistry(handlers), metrics, clock, props);
        return pool;
    }

    private void handler(String name, HandlerBody body) {
        handlers.add(new JobHandler() {
            @Override public String name() { return name; }
            @Override public String handle(JobExecution execution) throws Exception { return body.run(execution); }
        });
    }

    interface HandlerBody {
        String run(JobExecution execution) throws Exception;
    }

    @AfterEach
    void tearDown() {
        if (pool != null && pool.isRunning()) pool.stop();
    }

    @Test
    @DisplayName("maxRetries=n 이고 n+1번 실패하면 FAILED, 히스토리 n+1건")
    void exhausting_retries_fails_the_job() {
        handler("always_fail", e -> { throw new IllegalStateException("boom"); });
        JobWorkerPool sut = pool();
        QueueJob job = enqueue.createJob("always_fail", "{}", 5, 2, JobMetadata.empty());

        for (int i = 0; i < 3; i++) {
            assertThat(sut.processNextJob(1)).isTrue();
        }
        assertThat(sut.processNextJob(1)).isFalse();

        QueueJob done = store.findQueueJob(job.getId()).orElseThrow();
        assertThat(done.getStatus()).isEqualTo(QueueJobStatus.FAILED);
        assertThat(done.getRetryCount()).isEqualTo(2);
        assertThat(done.getLastError()).isEqualTo("boom");
        assertThat(done.getCompletedAt()).isNotNull();
        assertThat(done.getPriority()).isEqualTo(3);

        List<JobHistory> history = store.findHistory(job.getId());
        assertThat(history).hasSize(3);
        assertThat(history).extracting(JobHistory::getRetryAttempt).containsExactly(0, 1, 2);
        assertThat(history).allSatisfy(h -> {
            assertThat(h.getStatus()).isEqualTo(QueueJobStatus.FAILED);
            assertThat(h.getResult()).isEqualTo("Error: boom");
            assertThat(h.getExecutedBy()).isEqualTo("instance-a-worker-1");
        });
        assertThat(registry.find("bgjob_jobs_dead_total").counter().count()).isEqualTo(1.0);
        assertThat(registry.find("bgjob_jobs_retried_total").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("실패, 실패, 성공 → COMPLETED, 히스토리 3건 마지막은 Success")
    void fail_fail_succeed_completes() {
        AtomicInteger calls = new AtomicInteger();
        handler("flaky", e -> {
            if (calls.incrementAndGet() < 3) throw new Exception("transient " + calls.get());
            return "ok";
        });
        JobWorkerPool sut = pool();
        QueueJob job = enqueue.createJob("flaky", "{}", 5, 3, JobMetadata.empty());

        while (sut.processNextJob(1)) {
            // drain
        }

        QueueJob done = store.findQueueJob(job.getId()).orElseThrow();
        assertThat(done.getStatus()).isEqualTo(QueueJobStatus.COMPLETED);
        assertThat(done.getResult()).isEqualTo("ok");
        assertThat(done.getRetryCount()).isEqualTo(2);

        List<JobHistory> history = store.findHistory(job.getId());
        assertThat(history).hasSize(3);
        assertThat(history.get(0).getErrorMessage()).isEqualTo("transient 1");
        assertThat(history.get(2).isSuccess()).isTrue();
        assertThat(history.get(2).getOutputData()).isEqualTo("ok");
        assertThat(queueManager.getJobStatus(job.getId())).isEmpty();
    }

    @Test
    @DisplayName("핸들러가 Error 를 던져도 워커는 살아남고 트랜잭션은 롤백")
    void handler_error_is_converted_to_failure() {
        handler("explode", e -> { throw new StackOverflowError("deep"); });
        handler("fine", e -> "done");
        JobWorkerPool sut = pool();
        QueueJob bad = enqueue.createJob("explode", null, 9, 0, JobMetadata.empty());
        QueueJob good = enqueue.createJob("fine", null, 1, 0, JobMetadata.empty());

        assertThatCode(() -> sut.processNextJob(1)).doesNotThrowAnyException();
        assertThat(sut.processNextJob(1)).isTrue();

        assertThat(store.rollbacks()).isEqualTo(1);
        assertThat(store.findQueueJob(bad.getId()).orElseThrow().getStatus()).isEqualTo(QueueJobStatus.FAILED);
        assertThat(store.findQueueJob(bad.getId()).orElseThrow().getLastError()).isEqualTo("deep");
        assertThat(store.findQueueJob(good.getId()).orElseThrow().getStatus()).isEqualTo(QueueJobStatus.COMPLETED);
    }

    @Test
    @DisplayName("등록되지 않은 핸들러는 실패로 처리")
    void unknown_handler_is_a_failure() {
        JobWorkerPool sut = pool();
        QueueJob job = enqueue.createJob("nobody", null, 1, 0, JobMetadata.empty());

        sut.processNextJob(1);

        QueueJob done = store.findQueueJob(job.getId()).orElseThrow();
        assertThat(done.getStatus()).isEqualTo(QueueJobStatus.FAILED);
        assertThat(done.getLastError()).contains("nobody");
    }

    @Test
    @DisplayName("캐시 없이도 PENDING → PROCESSING → COMPLETED")
    void works_without_a_cache() {
        AtomicReference<QueueJobStatus> seen = new AtomicReference<>();
        List<String> ids = new ArrayList<>();
        handler("echo", e -> {
            seen.set(store.findQueueJob(e.getJobId()).orElseThrow().getStatus());
            ids.add(e.getJobId());
            return e.getPayload();
        });
        DistributedQueueManager solo = manager(new NoOpCoordinationCache(), "solo");
        JobWorkerPool sut = pool(solo);
        QueueJob job = new EnqueueJobService(store, solo, metrics).createJob("echo", "hello", 1, 3, JobMetadata.empty());
        assertThat(store.findQueueJob(job.getId()).orElseThrow().getStatus()).isEqualTo(QueueJobStatus.PENDING);

        assertThat(sut.processNextJob(1)).isTrue();

        assertThat(seen.get()).isEqualTo(QueueJobStatus.PROCESSING);
        assertThat(ids).containsExactly(job.getId());
        QueueJob done = store.findQueueJob(job.getId()).orElseThrow();
        assertThat(done.getStatus()).isEqualTo(QueueJobStatus.COMPLETED);
        assertThat(done.getResult()).isEqualTo("hello");
        assertThat(done.getStartedAt()).isNotNull();
        assertThat(done.getClaimedBy()).isNull();
    }

    @Test
    @DisplayName("다른 인스턴스가 락을 잡고 있으면 포기, lease 만료 후 다시 처리")
    void lock_contention_abandons_until_lease_expires() {
        AtomicInteger calls = new AtomicInteger();
        handler("count", e -> String.valueOf(calls.incrementAndGet()));
        JobWorkerPool sut = pool();
        QueueJob job = enqueue.createJob("count", null, 1, 0, JobMetadata.empty());
        assertThat(manager(cache, "instance-b").acquireLock(job.getId())).isTrue();

        assertThat(sut.processNextJob(1)).isFalse();

        QueueJob abandoned = store.findQueueJob(job.getId()).orElseThrow();
        assertThat(abandoned.getStatus()).isEqualTo(QueueJobStatus.PENDING);
        assertThat(abandoned.getClaimedBy()).isEqualTo("instance-a-worker-1");
        assertThat(calls.get()).isZero();
        assertThat(registry.find("bgjob_lock_contended_total").counter().count()).isEqualTo(1.0);
        assertThat(sut.processNextJob(1)).isFalse();

        clock.advance(Duration.ofMinutes(5));

        assertThat(sut.processNextJob(1)).isTrue();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(store.findQueueJob(job.getId()).orElseThrow().getStatus()).isEqualTo(QueueJobStatus.COMPLETED);
    }

    @Test
    @DisplayName("재시도는 백오프 시각 전에는 선점되지 않음")
    void retry_waits_for_backoff() {
        props.getRetry().setBaseBackoff(Duration.ofSeconds(2));
        AtomicInteger calls = new AtomicInteger();
        handler("once_fail", e -> {
            if (calls.incrementAndGet() == 1) throw new IllegalStateException("first");
            return "second";
        });
        JobWorkerPool sut = pool();
        QueueJob job = enqueue.createJob("once_fail", null, 4, 1, JobMetadata.empty());

        assertThat(sut.processNextJob(1)).isTrue();
        QueueJob retrying = store.findQueueJob(job.getId()).orElseThrow();
        assertThat(retrying.getStatus()).isEqualTo(QueueJobStatus.PENDING);
        assertThat(retrying.getScheduledAt()).isEqualTo(clock.instant().plusSeconds(2));
        assertThat(retrying.getPriority()).isEqualTo(3);

        assertThat(sut.processNextJob(1)).isFalse();
        clock.advance(Duration.ofSeconds(2));
        assertThat(sut.processNextJob(1)).isTrue();
        assertThat(store.findQueueJob(job.getId()).orElseThrow().getStatus()).isEqualTo(QueueJobStatus.COMPLETED);
    }

    @Test
    @DisplayName("우선순위가 높은 작업부터 처리")
    void higher_priority_first() {
        List<String> order = new CopyOnWriteArrayList<>();
        handler("record", e -> { order.add(e.getPayload()); return null; });
        JobWorkerPool sut = pool();
        enqueue.createJob("record", "low", 1, 0, JobMetadata.empty());
        enqueue.createJob("record", "high", 9, 0, JobMetadata.empty());
        enqueue.createJob("record", "mid", 5, 0, JobMetadata.empty());

        while (sut.processNextJob(1)) {
            // drain
        }

        assertThat(order).containsExactly("high", "mid", "low");
    }

    @Test
    @DisplayName("핸들러에서 락 연장 시 락 만료와 lease 가 함께 늘어남")
    void handler_can_extend_the_lock() {
        AtomicReference<Instant> lockExpiry = new AtomicReference<>();
        AtomicReference<Instant> lease = new AtomicReference<>();
        handler("long", e -> {
            e.extendLock(Duration.ofMinutes(10));
            lockExpiry.set(queueManager.getLock(e.getJobId()).orElseThrow().expiresAt());
            lease.set(store.findQueueJob(e.getJobId()).orElseThrow().getLeaseUntil());
            return "ok";
        });
        JobWorkerPool sut = pool();
        enqueue.createJob("long", null, 1, 0, JobMetadata.empty());

        sut.processNextJob(1);

        Instant expected = clock.instant().plus(Duration.ofMinutes(15));
        assertThat(lockExpiry.get()).isEqualTo(expected);
        assertThat(lease.get()).isEqualTo(expected);
    }

    @Test
    @DisplayName("start/stop 상태 전이와 중복 호출 에러")
    void lifecycle() {
        handler("bg", e -> "ok");
        JobWorkerPool sut = pool();
        QueueJob job = enqueue.createJob("bg", null, 1, 0, JobMetadata.empty());

        sut.start();
        assertThat(sut.isRunning()).isTrue();
        assertThatThrownBy(sut::start)
                .isInstanceOf(AppException.class)
                .extracting(e -> ((AppException) e).getErrorCode())
                .isEqualTo(JobErrorCode.WORKER_ALREADY_RUNNING);

        Awaitility.await()
                .atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertThat(store.findQueueJob(job.getId()).orElseThrow().getStatus())
                        .isEqualTo(QueueJobStatus.COMPLETED));
        assertThat(sut.status().succeeded()).isEqualTo(1);
        assertThat(sut.status().workerCount()).isEqualTo(2);

        sut.stop();
        assertThat(sut.isRunning()).isFalse();
        assertThatThrownBy(sut::stop)
                .isInstanceOf(AppException.class)
                .extracting(e -> ((AppException) e).getErrorCode())
                .isEqualTo(JobErrorCode.WORKER_NOT_RUNNING);
    }
}
