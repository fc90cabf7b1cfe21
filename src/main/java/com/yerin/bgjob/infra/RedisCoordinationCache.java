package com.yerin.bgjob.infra;

import com.yerin.bgjob.domain.CoordinationCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Slf4j
@RequiredArgsConstructor
public class RedisCoordinationCache implements CoordinationCache {

    private static final RedisScript<Long> DELETE_IF_EQUALS = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
              return redis.call('del', KEYS[1])
            end
            return 0
            """, Long.class);

    private static final RedisScript<Long> REPLACE_IF_EQUALS = new DefaultRedisScript<>("""
            if redis.call('get', KEYS[1]) == ARGV[1] then
              redis.call('set', KEYS[1], ARGV[2], 'PX', ARGV[3])
              return 1
            end
            return 0
            """, Long.class);

    private final StringRedisTemplate redis;

    @Override
    public boolean isDistributed() {
        return true;
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        redis.opsForValue().set(key, value, ttl);
    }

    @Override
    public boolean putIfAbsent(String key, String value, Duration ttl) {
        return Boolean.TRUE.equals(redis.opsForValue().setIfAbsent(key, value, ttl));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(redis.hasKey(key));
    }

    @Override
    public void delete(String key) {
        redis.delete(key);
    }

    @Override
    public boolean deleteIfEquals(String key, String expected) {
        Long n = redis.execute(DELETE_IF_EQUALS, List.of(key), expected);
        return n != null && n > 0;
    }

    @Override
    public boolean replaceIfEquals(String key, String expected, String value, Duration ttl) {
        long ttlMillis = Math.max(1, ttl.toMillis());
        Long n = redis.execute(REPLACE_IF_EQUALS, List.of(key), expected, value, Long.toString(ttlMillis));
        return n != null && n > 0;
    }

    @Override
    public void offer(String key, String member, double score, Duration ttl) {
        redis.opsForZSet().add(key, member, score);
        redis.expire(key, ttl);
        log.debug("[RedisCache] ZADD key={}, member={}, score={}", key, member, score);
    }

    @Override
    public Optional<String> poll(String key) {
        ZSetOperations.TypedTuple<String> head = redis.opsForZSet().popMin(key);
        return head == null ? Optional.empty() : Optional.ofNullable(head.getValue());
    }
}
