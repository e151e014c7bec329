package com.synos.anomaly.entity;

import com.synos.anomaly.model.AnomalySeverity;
import com.synos.anomaly.model.AnomalyType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 이상탐지 결과 엔티티
 */
@Entity
@Table(name = "anomaly_detections", indexes = {
    @Index(name = "idx_anomaly_timestamp", columnList = "timestamp"),
    @Index(name = "idx_anomaly_metric_timestamp", columnList = "metric_name, timestamp"),
    @Index(name = "idx_anomaly_severity", columnList = "severity"),
    @Index(name = "idx_anomaly_type", columnList = "anomaly_type")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyRecord {

    @Id
    @Column(length = 100)
    private String id;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "anomaly_type", nullable = false, length = 20)
    private AnomalyType anomalyType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AnomalySeverity severity;

    @Column(name = "metric_name", nullable = false, length = 200)
    private String metricName;

    @Column(length = 200)
    private String source;

    @Column(name = "observed_value", nullable = false)
    private Double observedValue;

    @Column(name = "expected_value", nullable = false)
    private Double expectedValue;

    @Column(name = "deviation_score", nullable = false)
    private Double deviationScore;

    @Column(nullable = false)
    private Double confidence;

    @Column(length = 2000)
    private String description;

    @Column(columnDefinition = "TEXT")
    private String context; // JSON 문자열

    @Column(columnDefinition = "TEXT")
    private String remediation; // JSON 배열 문자열

    @Column(name = "false_positive_probability")
    private Double falsePositiveProbability;

    @Column(name = "false_positive", nullable = false)
    private Boolean falsePositive = false;

    @Column(nullable = false)
    private Boolean acknowledged = false;
}
