package com.synos.anomaly.dto;

import com.synos.anomaly.ml.DetectionModel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 학습된 모델 정보 (scorer/scaler 제외)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelSummary {

    private String modelName;

    private String modelType;

    private List<String> metricPatterns;

    private List<String> featureNames;

    private double trainingAccuracy;

    private LocalDateTime lastTrained;

    private Map<String, Double> featureImportance;

    public static ModelSummary from(DetectionModel model) {
        return ModelSummary.builder()
                .modelName(model.getModelName())
                .modelType(model.getModelType())
                .metricPatterns(model.getMetricPatterns())
                .featureNames(model.getFeatureNames())
                .trainingAccuracy(model.getTrainingAccuracy())
                .lastTrained(model.getLastTrained())
                .featureImportance(model.getFeatureImportance())
                .build();
    }
}
