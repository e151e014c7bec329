package com.synos.anomaly.service;

import com.synos.anomaly.config.AnomalyDetectorProperties;
import com.synos.anomaly.model.AnomalyDetection;
import com.synos.anomaly.model.AnomalySeverity;
import com.synos.anomaly.model.AnomalyType;
import com.synos.anomaly.model.BaselineProfile;
import com.synos.anomaly.model.MetricPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * 통계 기반 이상탐지
 * z-score, IQR, modified z-score(MAD), Grubbs test 중 가장 심각한 결과 하나를 반환
 */
@Service
public class StatisticalAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(StatisticalAnomalyDetector.class);

    public static final String Z_SCORE = "z_score";
    public static final String IQR = "iqr";
    public static final String MODIFIED_Z_SCORE = "modified_z_score";
    public static final String GRUBBS_TEST = "grubbs_test";

    // modified z-score 상수 (정규분포에서 MAD -> sigma 보정)
    private static final double MODIFIED_Z_FACTOR = 0.6745;

    private final AnomalyDetectorProperties.Statistical config;

    // 실행 순서 = 동률일 때 우선순위
    private final Map<String, BiFunction<MetricPoint, BaselineProfile, Optional<AnomalyDetection>>> methods =
            new LinkedHashMap<>();

    public StatisticalAnomalyDetector(AnomalyDetectorProperties properties) {
        this.config = properties.getStatistical();
        methods.put(Z_SCORE, this::zScoreDetection);
        methods.put(IQR, this::iqrDetection);
        methods.put(MODIFIED_Z_SCORE, this::modifiedZScoreDetection);
        methods.put(GRUBBS_TEST, this::grubbsTestDetection);
    }

    /**
     * @return 가장 심각한 탐지 결과 (context.statistical_methods에 발동한 방법별 deviation 포함)
     */
    public Optional<AnomalyDetection> detect(MetricPoint point, BaselineProfile baseline) {
        List<AnomalyDetection> detections = new ArrayList<>();
        Map<String, Double> fired = new LinkedHashMap<>();

        for (Map.Entry<String, BiFunction<MetricPoint, BaselineProfile, Optional<AnomalyDetection>>> method
                : methods.entrySet()) {
            try {
                Optional<AnomalyDetection> detection = method.getValue().apply(point, baseline);
                if (detection.isPresent()) {
                    detections.add(detection.get());
                    fired.put(method.getKey(), detection.get().getDeviationScore());
                }
            } catch (Exception e) {
                log.debug("통계 탐지 실패: method={}, metric={}, error={}",
                        method.getKey(), point.getMetricName(), e.getMessage());
            }
        }

        if (detections.isEmpty()) {
            return Optional.empty();
        }

        AnomalyDetection best = detections.get(0);
        for (AnomalyDetection detection : detections) {
            if (detection.getSeverity().getLevel() > best.getSeverity().getLevel()) {
                best = detection;
            }
        }
        best.getContext().put("statistical_methods", fired);
        return Optional.of(best);
    }

    Optional<AnomalyDetection> zScoreDetection(MetricPoint point, BaselineProfile baseline) {
        if (baseline.getStd() <= 0) {
            return Optional.empty();
        }
        double z = Math.abs(point.getValue() - baseline.getMean()) / baseline.getStd();
        if (z <= config.getZScoreThreshold()) {
            return Optional.empty();
        }
        return Optional.of(build(point, Z_SCORE,
                z > config.getZScoreHigh() ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM,
                baseline.getMean(), z, Math.min(1.0, z / 5.0),
                String.format("Z-score anomaly: %.2f standard deviations from mean", z)));
    }

    Optional<AnomalyDetection> iqrDetection(MetricPoint point, BaselineProfile baseline) {
        double q1 = baseline.percentile(25);
        double q3 = baseline.percentile(75);
        double iqr = q3 - q1;
        if (iqr <= 0) {
            return Optional.empty();
        }

        double lower = q1 - config.getIqrMultiplier() * iqr;
        double upper = q3 + config.getIqrMultiplier() * iqr;
        double value = point.getValue();
        if (value >= lower && value <= upper) {
            return Optional.empty();
        }

        double deviation = value < lower ? (lower - value) / iqr : (value - upper) / iqr;
        return Optional.of(build(point, IQR,
                deviation > config.getIqrHigh() ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM,
                (q1 + q3) / 2.0, deviation, Math.min(1.0, deviation / 3.0),
                String.format("IQR anomaly: value %.2f outside [%.2f, %.2f]", value, lower, upper)));
    }

    Optional<AnomalyDetection> modifiedZScoreDetection(MetricPoint point, BaselineProfile baseline) {
        if (baseline.getMad() <= 0) {
            return Optional.empty();
        }
        double modifiedZ = MODIFIED_Z_FACTOR * (point.getValue() - baseline.getMedian()) / baseline.getMad();
        double absZ = Math.abs(modifiedZ);
        if (absZ <= config.getModifiedZThreshold()) {
            return Optional.empty();
        }
        return Optional.of(build(point, MODIFIED_Z_SCORE,
                absZ > config.getModifiedZHigh() ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM,
                baseline.getMedian(), absZ, Math.min(1.0, absZ / 6.0),
                String.format("Modified Z-score anomaly: %.2f", modifiedZ)));
    }

    Optional<AnomalyDetection> grubbsTestDetection(MetricPoint point, BaselineProfile baseline) {
        int n = baseline.getSampleCount();
        if (baseline.getStd() <= 0 || n < config.getGrubbsMinSamples()) {
            return Optional.empty();
        }
        double z = Math.abs(point.getValue() - baseline.getMean()) / baseline.getStd();
        double critical = BaselineStatistics.grubbsCritical(n, config.getGrubbsAlpha());
        if (z <= critical) {
            return Optional.empty();
        }
        return Optional.of(build(point, GRUBBS_TEST,
                z > config.getGrubbsHighFactor() * critical ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM,
                baseline.getMean(), z, Math.min(1.0, z / (2.0 * critical)),
                String.format("Grubbs test anomaly: G=%.2f > critical %.2f", z, critical)));
    }

    private AnomalyDetection build(MetricPoint point, String method, AnomalySeverity severity,
                                   double expected, double deviation, double confidence, String description) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("method", method);
        return AnomalyDetection.builder()
                .id(AnomalyDetection.newId(method))
                .timestamp(point.getTimestamp())
                .anomalyType(AnomalyType.STATISTICAL)
                .severity(severity)
                .metricName(point.getMetricName())
                .source(point.getSource())
                .observedValue(point.getValue())
                .expectedValue(expected)
                .deviationScore(deviation)
                .confidence(confidence)
                .description(description)
                .context(context)
                .build();
    }
}
