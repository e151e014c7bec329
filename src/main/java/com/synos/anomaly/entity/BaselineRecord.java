package com.synos.anomaly.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * baseline 영속화 (key = "metric_source_window")
 */
@Entity
@Table(name = "baselines")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BaselineRecord {

    @Id
    @Column(name = "baseline_key", length = 450)
    private String key;

    @Column(name = "metric_name", nullable = false, length = 200)
    private String metricName;

    @Column(nullable = false, length = 200)
    private String source;

    @Column(name = "time_window", nullable = false, length = 20)
    private String timeWindow;

    @Column(name = "mean_val", nullable = false)
    private Double mean;

    @Column(name = "std_val", nullable = false)
    private Double std;

    @Column(name = "median_val", nullable = false)
    private Double median;

    @Column(name = "mad_val", nullable = false)
    private Double mad;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String percentiles; // {"5":..,"25":..,"75":..,"95":..}

    @Column(name = "min_val", nullable = false)
    private Double minValue;

    @Column(name = "max_val", nullable = false)
    private Double maxValue;

    @Column(name = "sample_count", nullable = false)
    private Integer sampleCount;

    @Column(name = "last_updated", nullable = false)
    private LocalDateTime lastUpdated;

    @Column(name = "seasonal_patterns", columnDefinition = "TEXT")
    private String seasonalPatterns;
}
