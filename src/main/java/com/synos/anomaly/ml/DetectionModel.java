package com.synos.anomaly.ml;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * metric type 단위로 학습된 모델
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionModel {

    public static final String ISOLATION_FOREST = "isolation_forest";
    public static final String RANDOM_FOREST = "random_forest";

    private String modelType;

    private String modelName;

    @Builder.Default
    private List<String> metricPatterns = new ArrayList<>();

    // scorer 입력 순서 (정렬된 이름)
    @Builder.Default
    private List<String> featureNames = new ArrayList<>();

    private FeatureScaler scaler;

    private AnomalyScorer scorer;

    private double trainingAccuracy;

    private LocalDateTime lastTrained;

    @Builder.Default
    private Map<String, Double> featureImportance = new LinkedHashMap<>();

    /**
     * 메트릭 이름이 패턴을 포함하거나, 이름으로 분류한 metric type이 패턴과 같으면 적용 대상
     */
    public boolean appliesTo(String metricName) {
        String metricType = MetricTypeClassifier.classify(metricName);
        for (String pattern : metricPatterns) {
            if (metricName.contains(pattern) || metricType.equals(pattern)) {
                return true;
            }
        }
        return false;
    }

    public double score(Map<String, Double> features) {
        double[] row = new double[featureNames.size()];
        for (int i = 0; i < row.length; i++) {
            row[i] = features.getOrDefault(featureNames.get(i), 0.0);
        }
        return scorer.score(scaler.transform(row));
    }
}
