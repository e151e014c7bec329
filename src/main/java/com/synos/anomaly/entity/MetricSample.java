package com.synos.anomaly.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 수집된 메트릭 원본 (ML 학습 데이터로 재사용)
 */
@Entity
@Table(name = "metrics", indexes = {
    @Index(name = "idx_metrics_timestamp", columnList = "timestamp"),
    @Index(name = "idx_metrics_name_timestamp", columnList = "metric_name, timestamp")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetricSample {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDateTime timestamp;

    @Column(name = "metric_name", nullable = false, length = 200)
    private String metricName;

    @Column(name = "metric_value", nullable = false)
    private Double value;

    @Column(nullable = false, length = 200)
    private String source;

    @Column(columnDefinition = "TEXT")
    private String metadata; // JSON 문자열
}
