package com.synos.anomaly.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 학습된 ML 모델 (Java 직렬화된 scorer/scaler)
 */
@Entity
@Table(name = "ml_models")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MlModelRecord {

    @Id
    @Column(name = "model_name", length = 200)
    private String modelName;

    @Column(name = "model_type", nullable = false, length = 50)
    private String modelType;

    @Column(name = "metric_patterns", nullable = false, columnDefinition = "TEXT")
    private String metricPatterns; // JSON 배열

    @Column(name = "feature_names", nullable = false, columnDefinition = "TEXT")
    private String featureNames; // JSON 배열

    @Column(name = "model_data", length = 100_000_000)
    private byte[] modelData;

    @Column(name = "scaler_data", length = 10_000_000)
    private byte[] scalerData;

    @Column(name = "training_accuracy")
    private Double trainingAccuracy;

    @Column(name = "last_trained")
    private LocalDateTime lastTrained;

    @Column(name = "feature_importance", columnDefinition = "TEXT")
    private String featureImportance; // JSON 객체
}
