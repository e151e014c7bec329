package com.synos.anomaly.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

final class FalsePositiveTrackerTest {

    private HashOperations<String, Object, Object> hashOperations;
    private FalsePositiveTracker tracker;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        StringRedisTemplate redisTemplate = mock(StringRedisTemplate.class);
        hashOperations = mock(HashOperations.class);
        when(redisTemplate.<Object, Object>opsForHash()).thenReturn(hashOperations);
        tracker = new FalsePositiveTracker(redisTemplate);
    }

    @Test
    void incrementsSharedCounter() {
        when(hashOperations.increment(FalsePositiveTracker.HASH_KEY, "cpu_performance", 1L)).thenReturn(4L);

        assertEquals(4L, tracker.increment("cpu_performance"));
    }

    @Test
    void readsAndSumsCounters() {
        when(hashOperations.get(FalsePositiveTracker.HASH_KEY, "cpu_performance")).thenReturn("3");
        when(hashOperations.entries(FalsePositiveTracker.HASH_KEY))
                .thenReturn(Map.of("cpu_performance", "3", "login_security", "2"));

        assertEquals(3L, tracker.getCount("cpu_performance"));
        assertEquals(0L, tracker.getCount("unknown"));
        assertEquals(5L, tracker.getTotal());
    }

    @Test
    void redisOutageCountsAsZero() {
        RedisConnectionFailureException outage = new RedisConnectionFailureException("connection refused");
        when(hashOperations.get(FalsePositiveTracker.HASH_KEY, "cpu_performance")).thenThrow(outage);
        when(hashOperations.increment(FalsePositiveTracker.HASH_KEY, "cpu_performance", 1L)).thenThrow(outage);
        when(hashOperations.entries(FalsePositiveTracker.HASH_KEY)).thenThrow(outage);

        assertEquals(0L, tracker.getCount("cpu_performance"));
        assertEquals(0L, tracker.increment("cpu_performance"));
        assertEquals(0L, tracker.getTotal());
    }
}
