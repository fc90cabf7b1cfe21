package com.yerin.bgjob.infra;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgjob.config.JobqProperties;
import com.yerin.bgjob.domain.QueueJobStatus;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.support.IntegrationTestBase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest(properties = "jobq.enabled=false")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@DisplayName("Redis 조정: 락 경합/큐/헬스 체크")
class RedisCoordinationIT extends IntegrationTestBase {

    @Autowired StringRedisTemplate redis;
    @Autowired ObjectMapper objectMapper;

    DistributedQueueManager a;
    DistributedQueueManager b;

    @BeforeEach
    void setUp() {
        redis.getConnectionFactory().getConnection().serverCommands().flushAll();
        a = manager("instance-a");
        b = manager("instance-b");
    }

    private DistributedQueueManager manager(String instanceId) {
        JobqProperties.Lock lock = new JobqProperties.Lock();
        lock.setRetryDelay(Duration.ofMillis(10));
        return new DistributedQueueManager(new RedisCoordinationCache(redis), objectMapper, Clock.systemUTC(), instanceId, lock);
    }

    @Test
    @DisplayName("health check 통과")
    void health_check() {
        assertThat(a.isDistributed()).isTrue();
        assertThatCode(a::healthCheck).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("동시에 8개 인스턴스가 같은 락을 노려도 하나만 획득")
    void only_one_winner_under_contention() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tries = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                DistributedQueueManager m = manager("instance-" + i);
                tries.add(() -> m.acquireLock("contended"));
            }
            long winners = 0;
            for (Future<Boolean> f : pool.invokeAll(tries)) {
                if (f.get()) winners++;
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("락 TTL 이 지나면 다른 인스턴스가 획득")
    void lock_expires_by_ttl() throws Exception {
        assertThat(a.acquireLock("job-ttl", Duration.ofMillis(300))).isTrue();
        assertThat(b.acquireLock("job-ttl")).isFalse();

        Thread.sleep(500);

        assertThat(b.acquireLock("job-ttl")).isTrue();
    }

    @Test
    @DisplayName("연장/해제는 소유자만, 큐는 우선순위 순")
    void extend_release_and_queue() {
        a.acquireLock("job-1", Duration.ofSeconds(5));
        a.extendLock("job-1", Duration.ofSeconds(30));
        assertThat(redis.getExpire(DistributedQueueManager.LOCK_KEY_PREFIX + "job-1")).isGreaterThan(20L);

        assertThatThrownBy(() -> b.releaseLock("job-1")).isInstanceOf(AppException.class);
        a.releaseLock("job-1");
        assertThat(a.getLock("job-1")).isEmpty();

        a.enqueueJob("p1", 1);
        a.enqueueJob("p9", 9);
        assertThat(b.dequeueJob()).contains("p9");
        assertThat(b.dequeueJob()).contains("p1");
        assertThat(b.dequeueJob()).isEmpty();

        a.setJobStatus("p9", QueueJobStatus.COMPLETED);
        assertThat(b.getJobStatus("p9").orElseThrow().status()).isEqualTo(QueueJobStatus.COMPLETED);
    }
}
