package com.synos.anomaly.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * false positive 카운터 (Redis hash, 여러 인스턴스가 공유)
 * key = "metricName_anomalyType"
 * Redis 장애 시 카운트 0으로 간주
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FalsePositiveTracker {

    static final String HASH_KEY = "anomaly:false_positives";

    private final StringRedisTemplate redisTemplate;

    public long increment(String key) {
        try {
            Long count = redisTemplate.opsForHash().increment(HASH_KEY, key, 1);
            return count != null ? count : 0L;
        } catch (Exception e) {
            log.warn("false positive 카운터 증가 실패: key={}, error={}", key, e.getMessage());
            return 0L;
        }
    }

    public long getCount(String key) {
        try {
            Object value = redisTemplate.opsForHash().get(HASH_KEY, key);
            return value != null ? Long.parseLong(value.toString()) : 0L;
        } catch (Exception e) {
            log.warn("false positive 카운터 조회 실패: key={}, error={}", key, e.getMessage());
            return 0L;
        }
    }

    public long getTotal() {
        try {
            Map<Object, Object> entries = redisTemplate.opsForHash().entries(HASH_KEY);
            long total = 0;
            for (Object value : entries.values()) {
                total += Long.parseLong(value.toString());
            }
            return total;
        } catch (Exception e) {
            log.warn("false positive 카운터 합계 조회 실패: error={}", e.getMessage());
            return 0L;
        }
    }
}
