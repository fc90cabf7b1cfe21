package com.yerin.bgjob.domain;

import java.time.Duration;
import java.util.Optional;

/**
 * Shared TTL key/value store used for cross-instance coordination. Every operation is
 * atomic per key; nothing spans keys.
 */
public interface CoordinationCache {

    /**
     * False for the stand-in used when no shared cache is configured.
     */
    boolean isDistributed();

    void put(String key, String value, Duration ttl);

    boolean putIfAbsent(String key, String value, Duration ttl);

    Optional<String> get(String key);

    boolean exists(String key);

    void delete(String key);

    /**
     * Deletes the key only while it still holds {@code expected}.
     */
    boolean deleteIfEquals(String key, String expected);

    /**
     * Replaces the value only while the key still holds {@code expected}.
     */
    boolean replaceIfEquals(String key, String expected, String value, Duration ttl);

    /**
     * Adds a member to a sorted set; lowest score is polled first.
     */
    void offer(String key, String member, double score, Duration ttl);

    Optional<String> poll(String key);
}
