package com.yerin.bgjob.infra;

import com.yerin.bgjob.domain.CoordinationCache;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;

/**
 * Stand-in used when no shared cache is configured: writes succeed and are dropped,
 * reads find nothing. The job store's claim keeps single-instance processing correct.
 */
@Slf4j
public class NoOpCoordinationCache implements CoordinationCache {

    @Override
    public boolean isDistributed() {
        return false;
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        log.trace("[NoOpCache] put key={}", key);
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        return true;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.empty();
    }

    @Override
    public boolean exists(String key) {
        return false;
    }

    @Override
    public void delete(String key) {
    }

    @Override
    public boolean deleteIfEquals(String key, String expected) {
        return true;
    }

    @Override
    public boolean replaceIfEquals(String key, String expected, String value, Duration ttl) {
        return true;
    }

    @Override
    public void offer(String key, String member, double score, Duration ttl) {
        log.trace("[NoOpCache] offer key={}, member={}", key, member);
    }

    @Override
    public Optional<String> poll(String key) {
        return Optional.empty();
    }
}
