package com.synos.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * 단일 메트릭 관측값
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricPoint {

    private LocalDateTime timestamp;

    private String metricName;

    private double value;

    private String source;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    /**
     * history/baseline 키: "metricName_source"
     */
    public String seriesKey() {
        return metricName + "_" + source;
    }
}
