package com.synos.anomaly.ml;

import com.synos.anomaly.model.MetricPoint;

import java.util.Map;

/**
 * metric type별 추가 feature 추출기
 */
@FunctionalInterface
public interface FeatureExtractor {

    Map<String, Double> extract(MetricPoint point);
}
