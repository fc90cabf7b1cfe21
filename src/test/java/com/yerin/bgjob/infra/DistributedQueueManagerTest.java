package com.yerin.bgjob.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgjob.config.JobqProperties;
import com.yerin.bgjob.domain.DistributedLock;
import com.yerin.bgjob.domain.QueueJobStatus;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.global.exception.code.QueueErrorCode;
import com.yerin.bgjob.support.InMemoryCoordinationCache;
import com.yerin.bgjob.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("분산 큐 매니저: 락/큐/상태 미러 테스트")
public class DistributedQueueManagerTest {

    MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
    InMemoryCoordinationCache cache = new InMemoryCoordinationCache(clock);
    ObjectMapper om = new ObjectMapper().findAndRegisterModules();

    DistributedQueueManager a = manager("instance-a");
    DistributedQueueManager b = manager("instance-b");

    private DistributedQueueManager manager(String instanceId) {
        JobqProperties.Lock lock = new JobqProperties.Lock();
        lock.setRetryDelay(Duration.ofMillis(1));
        return new DistributedQueueManager(cache, om, clock, instanceId, lock);
    }

    @Test
    @DisplayName("락은 한 인스턴스만 획득")
    void only_one_instance_holds_the_lock() {
        assertThat(a.acquireLock("job-1")).isTrue();
        assertThat(b.acquireLock("job-1")).isFalse();

        DistributedLock lock = a.getLock("job-1").orElseThrow();
        assertThat(lock.instanceId()).isEqualTo("instance-a");
        assertThat(lock.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(5)));
    }

    @Test
    @DisplayName("다른 인스턴스는 해제/연장 불가")
    void foreign_instance_cannot_release_or_extend() {
        a.acquireLock("job-1");

        assertThatThrownBy(() -> b.releaseLock("job-1"))
                .isInstanceOf(AppException.class)
                .extracting(e -> ((AppException) e).getErrorCode())
                .isEqualTo(QueueErrorCode.LOCK_NOT_OWNED);
        assertThatThrownBy(() -> b.extendLock("job-1", Duration.ofMinutes(1)))
                .isInstanceOf(AppException.class)
                .extracting(e -> ((AppException) e).getErrorCode())
                .isEqualTo(QueueErrorCode.LOCK_NOT_OWNED);

        assertThat(a.getLock("job-1")).isPresent();
    }

    @Test
    @DisplayName("만료된 락은 해제 없이 다른 인스턴스가 획득")
    void expired_lock_is_acquirable_without_release() {
        assertThat(a.acquireLock("job-1", Duration.ofSeconds(10))).isTrue();

        clock.advance(Duration.ofSeconds(11));

        assertThat(b.acquireLock("job-1")).isTrue();
        assertThat(b.getLock("job-1").orElseThrow().isOwnedBy("instance-b")).isTrue();
    }

    @Test
    @DisplayName("캐시에 남아있는 만료 레코드는 정리 후 획득")
    void stale_record_past_expiry_is_replaced() throws Exception {
        // 캐시 TTL 보다 expiresAt 이 먼저 지난 레코드
        Instant past = clock.instant().minusSeconds(60);
        String stale = om.writeValueAsString(new DistributedLock("job-1", "instance-a", past, past.plusSeconds(1)));
        cache.put(DistributedQueueManager.LOCK_KEY_PREFIX + "job-1", stale, Duration.ofHours(1));

        assertThat(b.acquireLock("job-1")).isTrue();
        assertThat(b.getLock("job-1").orElseThrow().instanceId()).isEqualTo("instance-b");
    }

    @Test
    @DisplayName("소유자 해제 후 재획득 가능, 없는 락 해제는 no-op")
    void release_then_reacquire() {
        a.acquireLock("job-1");
        a.releaseLock("job-1");

        assertThat(a.getLock("job-1")).isEmpty();
        assertThatCode(() -> a.releaseLock("job-1")).doesNotThrowAnyException();
        assertThat(b.acquireLock("job-1")).isTrue();
    }

    @Test
    @DisplayName("연장은 만료 시각을 뒤로 미룸, 없는 락 연장은 에러")
    void extend_pushes_expiry() {
        a.acquireLock("job-1", Duration.ofMinutes(1));
        Instant before = a.getLock("job-1").orElseThrow().expiresAt();

        a.extendLock("job-1", Duration.ofMinutes(2));

        assertThat(a.getLock("job-1").orElseThrow().expiresAt()).isEqualTo(before.plus(Duration.ofMinutes(2)));
        clock.advance(Duration.ofMinutes(2));
        assertThat(b.acquireLock("job-1")).isFalse();

        assertThatThrownBy(() -> a.extendLock("job-2", Duration.ofMinutes(1)))
                .isInstanceOf(AppException.class)
                .extracting(e -> ((AppException) e).getErrorCode())
                .isEqualTo(QueueErrorCode.LOCK_NOT_FOUND);
    }

    @Test
    @DisplayName("우선순위 높은 순, 같으면 먼저 들어온 순으로 dequeue")
    void dequeue_orders_by_priority_then_fifo() {
        a.enqueueJob("low", 1);
        clock.advance(Duration.ofMillis(5));
        a.enqueueJob("high-1", 9);
        clock.advance(Duration.ofMillis(5));
        a.enqueueJob("high-2", 9);

        assertThat(b.dequeueJob()).contains("high-1");
        assertThat(b.dequeueJob()).contains("high-2");
        assertThat(b.dequeueJob()).contains("low");
        assertThat(b.dequeueJob()).isEmpty();
    }

    @Test
    @DisplayName("상태 미러 기록/조회, clearJobData 는 멱등")
    void status_mirror_and_clear() {
        a.acquireLock("job-1");
        a.enqueueJob("job-1", 3);
        a.setJobStatus("job-1", QueueJobStatus.PROCESSING);

        var mirror = b.getJobStatus("job-1").orElseThrow();
        assertThat(mirror.status()).isEqualTo(QueueJobStatus.PROCESSING);
        assertThat(mirror.instanceId()).isEqualTo("instance-a");

        a.clearJobData("job-1");
        a.clearJobData("job-1");

        assertThat(a.getJobStatus("job-1")).isEmpty();
        assertThat(a.getLock("job-1")).isEmpty();
        assertThat(cache.exists(DistributedQueueManager.JOB_QUEUE_KEY + ":job-1")).isFalse();
    }

    @Test
    @DisplayName("캐시 장애: enqueue/dequeue 는 조용히 실패, health check 는 에러")
    void cache_outage() {
        cache.setAvailable(false);

        assertThatCode(() -> a.enqueueJob("job-1", 1)).doesNotThrowAnyException();
        assertThat(a.dequeueJob()).isEmpty();
        assertThat(a.acquireLock("job-1")).isFalse();
        assertThatThrownBy(a::healthCheck)
                .isInstanceOf(AppException.class)
                .extracting(e -> ((AppException) e).getErrorCode().getCode())
                .isEqualTo(QueueErrorCode.HEALTH_CHECK_FAILED.getCode());

        cache.setAvailable(true);
        assertThatCode(a::healthCheck).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("캐시 없음(단일 인스턴스 모드): 모든 연산이 에러 없이 통과")
    void degraded_mode_never_errors() {
        JobqProperties.Lock lock = new JobqProperties.Lock();
        DistributedQueueManager solo = new DistributedQueueManager(new NoOpCoordinationCache(), om, clock, "solo", lock);

        assertThat(solo.isDistributed()).isFalse();
        assertThatCode(() -> solo.enqueueJob("job-1", 5)).doesNotThrowAnyException();
        assertThat(solo.dequeueJob()).isEmpty();
        assertThat(solo.acquireLock("job-1")).isTrue();
        assertThat(solo.acquireLock("job-1")).isTrue();
        assertThatCode(() -> solo.extendLock("job-1", Duration.ofMinutes(1))).doesNotThrowAnyException();
        assertThatCode(() -> solo.releaseLock("job-1")).doesNotThrowAnyException();
        solo.setJobStatus("job-1", QueueJobStatus.COMPLETED);
        assertThat(solo.getJobStatus("job-1")).isEmpty();
    }

    @Test
    @DisplayName("health check 키는 인스턴스별, 다른 인스턴스의 진행 중 점검 값을 건드리지 않음")
    void health_check_key_is_per_instance() {
        String foreignKey = DistributedQueueManager.HEALTH_KEY_PREFIX + "instance-b";
        cache.put(foreignKey, "in-flight", Duration.ofSeconds(10));

        assertThatCode(a::healthCheck).doesNotThrowAnyException();

        assertThat(cache.get(foreignKey)).contains("in-flight");
        assertThat(cache.exists(DistributedQueueManager.HEALTH_KEY_PREFIX + "instance-a")).isFalse();
    }
}
