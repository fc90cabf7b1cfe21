package com.yerin.bgjob.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.bgjob.config.JobqProperties;
import com.yerin.bgjob.domain.JobDirection;
import com.yerin.bgjob.domain.JobMetadata;
import com.yerin.bgjob.domain.QueueJob;
import com.yerin.bgjob.domain.QueueJobType;
import com.yerin.bgjob.global.exception.AppException;
import com.yerin.bgjob.global.exception.code.CommonErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns messages arriving on (or leaving through) integration channels into queue jobs.
 * The payload is wrapped as {@code {"Topic": ..., "Payload": ...}} so handlers see the
 * channel topic alongside the raw message.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntegrationJobCreator {

    public static final String SOURCE = "integration";
    static final int DEFAULT_PRIORITY = 5;
    static final int HTTP_PRIORITY = 7;

    private final EnqueueJobService enqueueJobService;
    private final ObjectMapper objectMapper;
    private final JobqProperties props;

    public QueueJob createJobFromMessage(String topic, Object payload, String handler, String method,
                                         String protocol, JobDirection direction, int priority) {
        log.debug("[Integration] message topic={}, handler={}, method={}, protocol={}, direction={}",
                topic, handler, method, protocol, direction);

        Map<String, String> wrapped = new LinkedHashMap<>();
        wrapped.put("Topic", topic);
        wrapped.put("Payload", raw(payload));

        JobMetadata metadata = JobMetadata.builder()
                .source(SOURCE)
                .topic(topic)
                .protocol(protocol)
                .method(method)
                .uuid(handler + "-" + System.nanoTime())
                .build();

        QueueJob job = enqueueJobService.createJob(
                QueueJobType.INTEGRATION, direction, handler, write(wrapped),
                priority, props.getRetry().getMaxRetries(), metadata, SOURCE);
        log.info("[Integration] created jobId={} for topic={} (handler={}, direction={})",
                job.getId(), topic, handler, direction);
        return job;
    }

    public QueueJob createInboundJob(String topic, Object payload, String handler, String protocol, String method) {
        return createJobFromMessage(topic, payload, handler, method, protocol, JobDirection.INBOUND, DEFAULT_PRIORITY);
    }

    public QueueJob createOutboundJob(String topic, Object payload, String handler, String protocol, String method) {
        return createJobFromMessage(topic, payload, handler, method, protocol, JobDirection.OUTBOUND, DEFAULT_PRIORITY);
    }

    public QueueJob createJobFromSignalRMessage(String topic, Object payload, String handler) {
        return createInboundJob(topic, payload, handler, "signalr", "websocket");
    }

    public QueueJob createJobFromKafkaMessage(String topic, Object payload, String handler, JobDirection direction) {
        return createJobFromMessage(topic, payload, handler, "publish", "kafka", direction, DEFAULT_PRIORITY);
    }

    public QueueJob createJobFromMqttMessage(String topic, Object payload, String handler, JobDirection direction) {
        return createJobFromMessage(topic, payload, handler, "publish", "mqtt", direction, DEFAULT_PRIORITY);
    }

    public QueueJob createJobFromActiveMqMessage(String topic, Object payload, String handler, JobDirection direction) {
        return createJobFromMessage(topic, payload, handler, "send", "activemq", direction, DEFAULT_PRIORITY);
    }

    public QueueJob createJobFromHttpRequest(String endpoint, Object payload, String handler, String method,
                                             JobDirection direction) {
        return createJobFromMessage(endpoint, payload, handler, method, "http", direction, HTTP_PRIORITY);
    }

    /**
     * Creates each job independently; failures are logged and skipped.
     *
     * @return ids of the jobs that were created
     */
    public List<String> batchCreateJobs(List<QueueJob> jobs) {
        List<String> created = new ArrayList<>(jobs.size());
        for (QueueJob job : jobs) {
            try {
                created.add(enqueueJobService.submit(job).getId());
            } catch (RuntimeException e) {
                log.error("[Integration] failed to create job in batch handler={}, err={}", job.getHandler(), e.toString());
            }
        }
        log.info("[Integration] batch created {}/{} jobs", created.size(), jobs.size());
        return created;
    }

    private String raw(Object payload) {
        if (payload == null) return null;
        if (payload instanceof String s) return s;
        if (payload instanceof byte[] bytes) return new String(bytes, StandardCharsets.UTF_8);
        return write(payload);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AppException(CommonErrorCode.SERIALIZATION_FAILED, e);
        }
    }
}
