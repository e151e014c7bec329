package com.synos.anomaly.service;

import com.synos.anomaly.client.PrometheusClient;
import com.synos.anomaly.config.AnomalyDetectorProperties;
import com.synos.anomaly.model.MetricPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Prometheus에서 설정된 PromQL을 주기적으로 조회해 이상탐지 파이프라인으로 전달
 */
@Service
@Slf4j
@ConditionalOnProperty(prefix = "anomaly.collector.prometheus", name = "enabled", havingValue = "true")
public class PrometheusMetricCollector {

    private static final String DEFAULT_SOURCE = "prometheus";

    private final PrometheusClient prometheusClient;
    private final AnomalyDetectionService anomalyDetectionService;
    private final AnomalyDetectorProperties.Prometheus config;
    private final Clock clock;

    public PrometheusMetricCollector(PrometheusClient prometheusClient,
                                     AnomalyDetectionService anomalyDetectionService,
                                     AnomalyDetectorProperties properties,
                                     Clock clock) {
        this.prometheusClient = prometheusClient;
        this.anomalyDetectionService = anomalyDetectionService;
        this.config = properties.getCollector().getPrometheus();
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${anomaly.collector.prometheus.interval-ms:10000}")
    public void collect() {
        for (Map.Entry<String, String> query : config.getQueries().entrySet()) {
            try {
                List<MetricPoint> points = fetch(query.getKey(), query.getValue());
                int anomalies = 0;
                for (MetricPoint point : points) {
                    anomalies += anomalyDetectionService.ingest(point).size();
                }
                log.debug("Prometheus 수집 완료: metric={}, series={}, anomalies={}",
                        query.getKey(), points.size(), anomalies);
            } catch (Exception e) {
                // 한 쿼리 실패가 다른 쿼리 수집을 막지 않음
                log.warn("Prometheus 수집 실패: metric={}, error={}", query.getKey(), e.getMessage());
            }
        }
    }

    List<MetricPoint> fetch(String metricName, String promql) {
        PrometheusClient.PrometheusResponse response = prometheusClient.query(promql).block();
        List<MetricPoint> points = new ArrayList<>();
        if (response == null || response.getData() == null || response.getData().getResult() == null) {
            return points;
        }

        for (PrometheusClient.PrometheusResponse.QueryData.Result result : response.getData().getResult()) {
            List<Object> value = result.getValue();
            if (value == null || value.size() < 2) {
                continue;
            }
            double parsed;
            try {
                parsed = Double.parseDouble(value.get(1).toString());
            } catch (NumberFormatException e) {
                log.debug("Prometheus 값 파싱 실패: metric={}, value={}", metricName, value.get(1));
                continue;
            }
            if (!Double.isFinite(parsed)) {
                continue;
            }

            Map<String, String> labels = result.getMetric() != null ? result.getMetric() : Map.of();
            points.add(MetricPoint.builder()
                    .timestamp(toTimestamp(value.get(0)))
                    .metricName(metricName)
                    .value(parsed)
                    .source(resolveSource(labels))
                    .metadata(new HashMap<>(labels))
                    .build());
        }
        return points;
    }

    /**
     * instance(포트 제외) -> node -> pod 순서로 source 결정
     */
    static String resolveSource(Map<String, String> labels) {
        String instance = labels.get("instance");
        if (instance != null && !instance.isBlank()) {
            return instance.contains(":") ? instance.split(":")[0] : instance;
        }
        if (labels.get("node") != null && !labels.get("node").isBlank()) {
            return labels.get("node");
        }
        if (labels.get("pod") != null && !labels.get("pod").isBlank()) {
            return labels.get("pod");
        }
        return DEFAULT_SOURCE;
    }

    private LocalDateTime toTimestamp(Object epochSeconds) {
        try {
            double seconds = Double.parseDouble(epochSeconds.toString());
            long millis = (long) (seconds * 1000);
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), clock.getZone());
        } catch (NumberFormatException e) {
            log.debug("Prometheus timestamp 파싱 실패, 현재 시각 사용: {}", epochSeconds);
            return LocalDateTime.now(clock);
        }
    }
}
