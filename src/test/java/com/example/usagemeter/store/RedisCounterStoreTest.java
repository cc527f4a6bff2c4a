package com.example.usagemeter.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;

import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisCounterStoreTest {

    private static final String KEY = "rate_limiter:t1:upload:60s";

    private StringRedisTemplate redisTemplate;
    private DefaultRedisScript<List> fixedWindowScript;
    private DefaultRedisScript<List> slidingWindowScript;
    private RedisCounterStore store;

    @BeforeEach
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        fixedWindowScript = script("lua/fixed_window.lua");
        slidingWindowScript = script("lua/sliding_window.lua");
        store = new RedisCounterStore(redisTemplate, fixedWindowScript, slidingWindowScript);
    }

    private static DefaultRedisScript<List> script(String path) {
        DefaultRedisScript<List> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource(path));
        script.setResultType(List.class);
        return script;
    }

    // ===== Scripts =====

    @Test
    void shouldRunFixedWindowScriptWithTtlArgument() {
        when(redisTemplate.execute(eq(fixedWindowScript), eq(List.of(KEY)), eq("60")))
                .thenReturn(List.of(3L, 42_000L));

        CounterSnapshot snapshot = store.incrementWithExpiry(KEY, 60);

        assertEquals(3, snapshot.getCount());
        assertEquals(42_000, snapshot.getTtlMillis());
    }

    @Test
    void shouldParseSlidingWindowScriptResult() {
        when(redisTemplate.execute(eq(slidingWindowScript), eq(List.of(KEY)),
                eq("1000"), eq("60000"), eq("5"), eq("1000:abc")))
                .thenReturn(List.of(0L, 5L, 400L));

        SlidingWindowSnapshot snapshot = store.acquireSlidingWindow(KEY, 1000, 60_000, 5, "1000:abc");

        assertFalse(snapshot.isAdmitted());
        assertEquals(5, snapshot.getCount());
        assertEquals(400, snapshot.getOldestMillis());
    }

    @Test
    void shouldShipBothLuaScriptsOnTheClasspath() {
        assertTrue(new ClassPathResource("lua/fixed_window.lua").exists());
        assertTrue(new ClassPathResource("lua/sliding_window.lua").exists());
    }

    // ===== Failures =====

    @Test
    void shouldTranslateConnectionFailure() {
        when(redisTemplate.execute(eq(fixedWindowScript), eq(List.of(KEY)), eq("60")))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class,
                () -> store.incrementWithExpiry(KEY, 60));
        assertInstanceOf(RedisConnectionFailureException.class, ex.getCause());
    }

    @Test
    void shouldTranslateTimeouts() {
        when(redisTemplate.execute(eq(fixedWindowScript), eq(List.of(KEY)), eq("60")))
                .thenThrow(new QueryTimeoutException("timed out"));

        assertThrows(StoreUnavailableException.class, () -> store.incrementWithExpiry(KEY, 60));
    }

    @Test
    void shouldRejectMalformedScriptResult() {
        when(redisTemplate.execute(eq(fixedWindowScript), eq(List.of(KEY)), eq("60"))).thenReturn(null);

        assertThrows(StoreUnavailableException.class, () -> store.incrementWithExpiry(KEY, 60));
    }

    // ===== Plain commands =====

    @Test
    @SuppressWarnings("unchecked")
    void shouldReadCounterValue() {
        ValueOperations<String, String> ops = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(ops);
        when(ops.get(KEY)).thenReturn("7");
        when(ops.get("missing")).thenReturn(null);

        assertEquals(OptionalLong.of(7), store.get(KEY));
        assertEquals(OptionalLong.empty(), store.get("missing"));
    }

    @Test
    void shouldReportMissingTtlAsNegative() {
        when(redisTemplate.getExpire(KEY, TimeUnit.MILLISECONDS)).thenReturn(null);
        when(redisTemplate.getExpire("live", TimeUnit.MILLISECONDS)).thenReturn(1500L);

        assertTrue(store.ttlMillis(KEY) < 0);
        assertEquals(1500, store.ttlMillis("live"));
    }

    @Test
    void shouldDeleteOnRemove() {
        store.remove(KEY);

        verify(redisTemplate).delete(KEY);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldCountOnlyEntriesInsideTheWindow() {
        ZSetOperations<String, String> ops = mock(ZSetOperations.class);
        when(redisTemplate.opsForZSet()).thenReturn(ops);
        when(ops.count(KEY, 40_001, Double.POSITIVE_INFINITY)).thenReturn(4L);

        assertEquals(4, store.countSlidingWindow(KEY, 100_000, 60_000));
    }
}
