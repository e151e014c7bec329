package com.synos.anomaly.service;

import com.synos.anomaly.config.AnomalyDetectorProperties;
import com.synos.anomaly.model.AnomalyDetection;
import com.synos.anomaly.model.AnomalySeverity;
import com.synos.anomaly.model.AnomalyType;
import com.synos.anomaly.model.BaselineProfile;
import com.synos.anomaly.model.MetricPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 도메인 휴리스틱 기반 이상탐지 (network / performance / security)
 */
@Service
@Slf4j
public class DomainHeuristicDetector {

    private static final List<String> PERFORMANCE_KEYWORDS = List.of("cpu", "memory", "disk", "latency");
    private static final List<String> SECURITY_KEYWORDS = List.of("failed_login", "privilege", "suspicious");

    private final AnomalyDetectorProperties.Heuristics config;

    public DomainHeuristicDetector(AnomalyDetectorProperties properties) {
        this.config = properties.getHeuristics();
    }

    /**
     * @param baseline null 가능
     */
    public List<AnomalyDetection> detect(MetricPoint point, BaselineProfile baseline) {
        List<AnomalyDetection> anomalies = new ArrayList<>();
        String name = point.getMetricName().toLowerCase(Locale.ROOT);

        if (name.contains("network")) {
            detectNetworkAnomaly(point, name, baseline, anomalies);
        }
        if (PERFORMANCE_KEYWORDS.stream().anyMatch(name::contains)) {
            detectPerformanceAnomaly(point, name, baseline, anomalies);
        }
        if (SECURITY_KEYWORDS.stream().anyMatch(name::contains)) {
            detectSecurityAnomaly(point, name, baseline, anomalies);
        }
        return anomalies;
    }

    // connection 수 급증
    private void detectNetworkAnomaly(MetricPoint point, String name, BaselineProfile baseline,
                                      List<AnomalyDetection> anomalies) {
        if (!name.contains("connection_count") || baseline == null || baseline.getStd() <= 0) {
            return;
        }
        double threshold = baseline.getMean() + config.getConnectionSpikeSigma() * baseline.getStd();
        if (point.getValue() <= threshold) {
            return;
        }
        anomalies.add(build(point, "network", AnomalyType.NETWORK, AnomalySeverity.HIGH,
                baseline.getMean(),
                (point.getValue() - baseline.getMean()) / baseline.getStd(),
                0.9,
                String.format("Unusual spike in network connections: %.0f", point.getValue()),
                List.of("Check for DDoS attack", "Verify network configuration")));
    }

    // CPU 포화
    private void detectPerformanceAnomaly(MetricPoint point, String name, BaselineProfile baseline,
                                          List<AnomalyDetection> anomalies) {
        if (!name.contains("cpu") || point.getValue() <= config.getCpuCriticalPercent()) {
            return;
        }
        anomalies.add(build(point, "performance", AnomalyType.PERFORMANCE, AnomalySeverity.CRITICAL,
                baseline != null ? baseline.getMean() : 50.0,
                point.getValue() / 100.0,
                0.95,
                String.format("Critical CPU usage: %.1f%%", point.getValue()),
                List.of("Identify resource-intensive processes", "Scale up resources")));
    }

    // 로그인 실패 급증
    private void detectSecurityAnomaly(MetricPoint point, String name, BaselineProfile baseline,
                                       List<AnomalyDetection> anomalies) {
        if (!name.contains("failed_login") || point.getValue() <= config.getFailedLoginThreshold()) {
            return;
        }
        anomalies.add(build(point, "security", AnomalyType.SECURITY, AnomalySeverity.HIGH,
                baseline != null ? baseline.getMean() : 0.0,
                point.getValue(),
                0.9,
                String.format("High number of failed login attempts: %.0f", point.getValue()),
                List.of("Investigate potential brute force attack", "Enable account lockout")));
    }

    private AnomalyDetection build(MetricPoint point, String domain, AnomalyType type, AnomalySeverity severity,
                                   double expected, double deviation, double confidence, String description,
                                   List<String> remediation) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("domain", domain);
        log.debug("도메인 휴리스틱 탐지: domain={}, metric={}, value={}", domain, point.getMetricName(), point.getValue());
        return AnomalyDetection.builder()
                .id(AnomalyDetection.newId(domain))
                .timestamp(point.getTimestamp())
                .anomalyType(type)
                .severity(severity)
                .metricName(point.getMetricName())
                .source(point.getSource())
                .observedValue(point.getValue())
                .expectedValue(expected)
                .deviationScore(deviation)
                .confidence(confidence)
                .description(description)
                .context(context)
                .remediationSuggestions(new ArrayList<>(remediation))
                .build();
    }
}
