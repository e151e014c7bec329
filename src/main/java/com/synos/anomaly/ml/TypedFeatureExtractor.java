package com.synos.anomaly.ml;

/**
 * Spring bean으로 등록되는 extractor. 시작 시 metricType()에 자동 등록된다.
 */
public interface TypedFeatureExtractor extends FeatureExtractor {

    String metricType();
}
