package com.yerin.bgjob.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgjob.application.JobExecutor;
import com.yerin.bgjob.domain.JobStore;
import com.yerin.bgjob.domain.JobqMetrics;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.infra.DistributedQueueManager;
import com.yerin.bgjob.infra.InstanceId;
import com.yerin.bgjob.infra.JobScheduler;
import com.yerin.bgjob.infra.JobWorkerPool;
import com.yerin.bgjob.infra.NoOpCoordinationCache;
import com.yerin.bgjob.infra.RedisCoordinationCache;
import com.yerin.bgjob.service.EnqueueJobService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

@Slf4j
@Configuration
@EnableConfigurationProperties(JobqProperties.class)
public class JobSystemConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Redis-backed when enabled and reachable; otherwise single-instance mode.
     */
    @Bean
    public DistributedQueueManager distributedQueueManager(ObjectProvider<StringRedisTemplate> redis,
                                                           ObjectMapper objectMapper,
                                                           Clock clock,
                                                           JobqProperties props) {
        String instanceId = props.getInstanceName() == null || props.getInstanceName().isBlank()
                ? InstanceId.generate()
                : props.getInstanceName();

        StringRedisTemplate template = props.getCache().isEnabled() ? redis.getIfAvailable() : null;
        if (template != null) {
            DistributedQueueManager manager = new DistributedQueueManager(
                    new RedisCoordinationCache(template), objectMapper, clock, instanceId, props.getLock());
            try {
                manager.healthCheck();
                log.info("[JobSystem] distributed mode instance={}", instanceId);
                return manager;
            } catch (AppException e) {
                log.warn("[JobSystem] redis unreachable, falling back to single-instance mode: {}", e.getMessage());
            }
        } else {
            log.warn("[JobSystem] cache disabled, single-instance mode instance={}", instanceId);
        }
        return new DistributedQueueManager(new NoOpCoordinationCache(), objectMapper, clock, instanceId, props.getLock());
    }

    @Bean
    public JobWorkerPool jobWorkerPool(JobStore store, DistributedQueueManager queueManager, JobExecutor executor,
                                       JobqMetrics metrics, Clock clock, JobqProperties props) {
        return new JobWorkerPool(store, queueManager, executor, metrics, clock, props);
    }

    @Bean
    public JobScheduler jobScheduler(JobStore store, EnqueueJobService enqueueJobService, JobqMetrics metrics,
                                     Clock clock, JobqProperties props) {
        return new JobScheduler(store, enqueueJobService, metrics, clock, props.getScheduler());
    }
}
