package com.example.usagemeter.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

/**
 * {@link CounterStore} on Redis. The two mutating operations run as Lua scripts so that Redis
 * executes each one atomically; no read-then-write happens on the client side.
 */
@Component
public class RedisCounterStore implements CounterStore {

    private static final Logger log = LoggerFactory.getLogger(RedisCounterStore.class);

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<List> fixedWindowScript;
    private final DefaultRedisScript<List> slidingWindowScript;

    @Autowired
    public RedisCounterStore(
            StringRedisTemplate redisTemplate,
            @Qualifier("fixedWindowScript") DefaultRedisScript<List> fixedWindowScript,
            @Qualifier("slidingWindowScript") DefaultRedisScript<List> slidingWindowScript
    ) {
        this.redisTemplate = redisTemplate;
        this.fixedWindowScript = fixedWindowScript;
        this.slidingWindowScript = slidingWindowScript;
    }

    @Override
    public CounterSnapshot incrementWithExpiry(String key, long ttlSeconds) {
        List<?> result = runScript(fixedWindowScript, key, Long.toString(ttlSeconds));
        return new CounterSnapshot(toLong(result.get(0)), toLong(result.get(1)));
    }

    @Override
    public SlidingWindowSnapshot acquireSlidingWindow(String key, long nowMillis, long windowMillis, long limit,
                                                      String member) {
        List<?> result = runScript(slidingWindowScript, key,
                Long.toString(nowMillis), Long.toString(windowMillis), Long.toString(limit), member);
        if (result.size() < 3) {
            log.error("Unexpected sliding window script result for key {}: {}", key, result);
            throw new StoreUnavailableException("Unexpected sliding window script result for key " + key);
        }
        return new SlidingWindowSnapshot(toLong(result.get(0)) == 1L, toLong(result.get(1)), toLong(result.get(2)));
    }

    @Override
    public OptionalLong get(String key) {
        try {
            String value = redisTemplate.opsForValue().get(key);
            return value == null ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(value));
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Redis read failed for key " + key, ex);
        } catch (NumberFormatException ex) {
            throw new StoreUnavailableException("Counter " + key + " does not hold an integer", ex);
        }
    }

    @Override
    public long ttlMillis(String key) {
        try {
            Long ttl = redisTemplate.getExpire(key, TimeUnit.MILLISECONDS);
            return ttl == null ? -2L : ttl;
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Redis TTL lookup failed for key " + key, ex);
        }
    }

    @Override
    public void remove(String key) {
        try {
            redisTemplate.delete(key);
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Redis delete failed for key " + key, ex);
        }
    }

    @Override
    public long countSlidingWindow(String key, long nowMillis, long windowMillis) {
        try {
            Long count = redisTemplate.opsForZSet().count(key, nowMillis - windowMillis + 1, Double.POSITIVE_INFINITY);
            return count == null ? 0L : count;
        } catch (DataAccessException ex) {
            throw new StoreUnavailableException("Redis window count failed for key " + key, ex);
        }
    }

    private List<?> runScript(DefaultRedisScript<List> script, String key, String... args) {
        Object result;
        try {
            result = redisTemplate.execute(script, Collections.singletonList(key), (Object[]) args);
        } catch (RedisConnectionFailureException ex) {
            log.warn("Redis connection failure while running counter script for key {}", key, ex);
            throw new StoreUnavailableException("Redis connection failure for key " + key, ex);
        } catch (DataAccessException ex) {
            // Script errors, timeouts and other Redis-side failures.
            log.error("Redis data access error while running counter script for key {}", key, ex);
            throw new StoreUnavailableException("Redis script failed for key " + key, ex);
        }

        if (!(result instanceof List<?> listResult) || listResult.size() < 2) {
            log.error("Unexpected Lua script result for key {}: {}", key, result);
            throw new StoreUnavailableException("Unexpected counter script result for key " + key);
        }
        return listResult;
    }

    private long toLong(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }
}
