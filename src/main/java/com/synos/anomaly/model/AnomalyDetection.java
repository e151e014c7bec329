package com.synos.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 탐지된 이상 한 건
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyDetection {

    private String id;

    private LocalDateTime timestamp;

    private AnomalyType anomalyType;

    private AnomalySeverity severity;

    private String metricName;

    private String source;

    private double observedValue;

    private double expectedValue;

    private double deviationScore;

    private double confidence;

    private String description;

    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    private double falsePositiveProbability;

    @Builder.Default
    private List<String> remediationSuggestions = new ArrayList<>();

    public static String newId(String method) {
        return method + "_anomaly_" + UUID.randomUUID();
    }

    /**
     * false positive 카운터 키: "metricName_type"
     */
    public String falsePositiveKey() {
        return metricName + "_" + anomalyType.value();
    }
}
