package com.synos.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * 메트릭/소스/윈도우 단위의 통계 baseline
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaselineProfile {

    private String metricName;

    private String source;

    private TimeWindow timeWindow;

    private double mean;

    private double std;

    private double median;

    // median absolute deviation
    private double mad;

    // 5, 25, 75, 95 percentile
    @Builder.Default
    private Map<Integer, Double> percentiles = new TreeMap<>();

    private double minValue;

    private double maxValue;

    private int sampleCount;

    private LocalDateTime lastUpdated;

    @Builder.Default
    private Map<String, Double> seasonalPatterns = new HashMap<>();

    public double percentile(int p) {
        Double value = percentiles.get(p);
        if (value == null) {
            throw new IllegalStateException("Percentile " + p + " not computed for " + metricName);
        }
        return value;
    }

    public String key() {
        return metricName + "_" + source + "_" + timeWindow.key();
    }
}
