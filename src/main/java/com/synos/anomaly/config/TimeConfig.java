package com.synos.anomaly.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    // baseline 만료, 기본 timestamp 계산에 사용 (테스트에서는 고정 Clock으로 대체)
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
