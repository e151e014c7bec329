package com.synos.anomaly.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.synos.anomaly.config.AnomalyDetectorProperties;
import com.synos.anomaly.model.AnomalyDetection;
import com.synos.anomaly.model.AnomalySeverity;
import com.synos.anomaly.model.AnomalyType;
import com.synos.anomaly.model.BaselineProfile;
import com.synos.anomaly.model.MetricPoint;
import com.synos.anomaly.model.TimeWindow;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.junit.jupiter.api.Test;

final class StatisticalAnomalyDetectorTest {

    private final StatisticalAnomalyDetector detector = new StatisticalAnomalyDetector(new AnomalyDetectorProperties());

    @Test
    void normalValueProducesNothing() {
        assertTrue(detector.detect(point(51.0), baseline()).isEmpty());
    }

    @Test
    void moderateOutlierFiresAllMethodsAndKeepsFirstOnTie() {
        Optional<AnomalyDetection> result = detector.detect(point(68.0), baseline());

        assertTrue(result.isPresent());
        AnomalyDetection anomaly = result.get();
        assertEquals(AnomalyType.STATISTICAL, anomaly.getAnomalyType());
        assertEquals(AnomalySeverity.MEDIUM, anomaly.getSeverity());
        assertTrue(anomaly.getId().startsWith("z_score_anomaly_"));
        assertEquals(3.6, anomaly.getDeviationScore(), 1e-9);
        assertEquals(0.72, anomaly.getConfidence(), 1e-9);
        assertEquals(50.0, anomaly.getExpectedValue(), 0.0);

        @SuppressWarnings("unchecked")
        Map<String, Double> methods = (Map<String, Double>) anomaly.getContext().get("statistical_methods");
        assertEquals(4, methods.size());
        assertEquals(1.0, methods.get(StatisticalAnomalyDetector.IQR), 1e-9);
        assertTrue(methods.containsKey(StatisticalAnomalyDetector.MODIFIED_Z_SCORE));
        assertTrue(methods.containsKey(StatisticalAnomalyDetector.GRUBBS_TEST));
    }

    @Test
    void extremeOutlierIsHigh() {
        AnomalyDetection anomaly = detector.detect(point(75.0), baseline()).orElseThrow();

        assertEquals(AnomalySeverity.HIGH, anomaly.getSeverity());
        assertTrue(anomaly.getId().startsWith("z_score_anomaly_"));
        assertEquals(1.0, anomaly.getConfidence(), 1e-9);
    }

    @Test
    void onlyIqrFiresJustOutsideTheFence() {
        AnomalyDetection anomaly = detector.detect(point(63.0), baseline()).orElseThrow();

        assertTrue(anomaly.getId().startsWith("iqr_anomaly_"));
        assertEquals(50.0, anomaly.getExpectedValue(), 1e-9);
        assertEquals(1.0 / 6.0, anomaly.getDeviationScore(), 1e-9);
        @SuppressWarnings("unchecked")
        Map<String, Double> methods = (Map<String, Double>) anomaly.getContext().get("statistical_methods");
        assertEquals(1, methods.size());
    }

    @Test
    void lowValuesAreMeasuredAgainstTheLowerFence() {
        AnomalyDetection anomaly = detector.detect(point(35.0), baseline()).orElseThrow();

        @SuppressWarnings("unchecked")
        Map<String, Double> methods = (Map<String, Double>) anomaly.getContext().get("statistical_methods");
        // lower fence 47 - 9 = 38
        assertEquals(0.5, methods.get(StatisticalAnomalyDetector.IQR), 1e-9);
    }

    @Test
    void degenerateBaselineNeverFires() {
        BaselineProfile flat = baseline();
        flat.setStd(0.0);
        flat.setMad(0.0);
        Map<Integer, Double> percentiles = new TreeMap<>(Map.of(5, 50.0, 25, 50.0, 75, 50.0, 95, 50.0));
        flat.setPercentiles(percentiles);

        assertTrue(detector.detect(point(1000.0), flat).isEmpty());
    }

    @Test
    void grubbsNeedsEnoughSamples() {
        BaselineProfile small = baseline();
        small.setSampleCount(6);

        assertFalse(detector.grubbsTestDetection(point(75.0), small).isPresent());
        assertTrue(detector.zScoreDetection(point(75.0), small).isPresent());
    }

    private static MetricPoint point(double value) {
        return MetricPoint.builder()
                .timestamp(LocalDateTime.of(2024, 1, 3, 12, 0))
                .metricName("request_latency_ms")
                .source("api-1")
                .value(value)
                .build();
    }

    private static BaselineProfile baseline() {
        return BaselineProfile.builder()
                .metricName("request_latency_ms")
                .source("api-1")
                .timeWindow(TimeWindow.HOURLY)
                .mean(50.0)
                .std(5.0)
                .median(50.0)
                .mad(3.0)
                .percentiles(new TreeMap<>(Map.of(5, 42.0, 25, 47.0, 75, 53.0, 95, 58.0)))
                .minValue(35.0)
                .maxValue(65.0)
                .sampleCount(100)
                .lastUpdated(LocalDateTime.of(2024, 1, 3, 11, 30))
                .build();
    }
}
