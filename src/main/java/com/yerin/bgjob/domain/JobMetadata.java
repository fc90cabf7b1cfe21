package com.yerin.bgjob.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable string-keyed metadata attached to queue jobs, scheduled jobs and history rows.
 * <p>
 * The constants name the keys the job system itself reads and writes. Any other key is
 * carried through untouched.
 */
@EqualsAndHashCode
public final class JobMetadata {

    public static final String SOURCE = "source";
    public static final String CORRELATION_ID = "correlation_id";
    public static final String TOPIC = "topic";
    public static final String PROTOCOL = "protocol";
    public static final String METHOD = "method";
    public static final String UUID = "uuid";
    public static final String QUEUE_NAME = "queue_name";
    public static final String SCHEDULED_JOB_ID = "scheduled_job_id";
    public static final String SCHEDULED_JOB_NAME = "scheduled_job_name";
    public static final String EXECUTION_COUNT = "execution_count";

    private static final JobMetadata EMPTY = new JobMetadata(Map.of());

    private final Map<String, String> entries;

    private JobMetadata(Map<String, String> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static JobMetadata empty() {
        return EMPTY;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static JobMetadata of(Map<String, String> entries) {
        if (entries == null || entries.isEmpty()) return EMPTY;
        Map<String, String> copy = new LinkedHashMap<>();
        entries.forEach((k, v) -> {
            if (k != null && v != null) copy.put(k, v);
        });
        return new JobMetadata(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonValue
    public Map<String, String> asMap() {
        return entries;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public JobMetadata with(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(entries);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new JobMetadata(copy);
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.entries.putAll(entries);
        return b;
    }

    public Optional<String> getSource() {
        return get(SOURCE);
    }

    public Optional<String> getCorrelationId() {
        return get(CORRELATION_ID);
    }

    public Optional<String> getTopic() {
        return get(TOPIC);
    }

    public Optional<String> getScheduledJobId() {
        return get(SCHEDULED_JOB_ID);
    }

    public Optional<Integer> getExecutionCount() {
        return get(EXECUTION_COUNT).map(Integer::valueOf);
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    public static final class Builder {
        private final Map<String, String> entries = new LinkedHashMap<>();

        private Builder() {}

        public Builder put(String key, String value) {
            if (key != null && value != null) entries.put(key, value);
            return this;
        }

        public Builder putAll(JobMetadata other) {
            if (other != null) entries.putAll(other.entries);
            return this;
        }

        public Builder source(String source) { return put(SOURCE, source); }
        public Builder correlationId(String id) { return put(CORRELATION_ID, id); }
        public Builder topic(String topic) { return put(TOPIC, topic); }
        public Builder protocol(String protocol) { return put(PROTOCOL, protocol); }
        public Builder method(String method) { return put(METHOD, method); }
        public Builder uuid(String uuid) { return put(UUID, uuid); }
        public Builder scheduledJobId(String id) { return put(SCHEDULED_JOB_ID, id); }
        public Builder scheduledJobName(String name) { return put(SCHEDULED_JOB_NAME, name); }
        public Builder executionCount(int count) { return put(EXECUTION_COUNT, Integer.toString(count)); }

        public JobMetadata build() {
            return entries.isEmpty() ? EMPTY : new JobMetadata(entries);
        }
    }
}
