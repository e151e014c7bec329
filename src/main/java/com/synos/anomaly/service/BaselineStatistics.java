package com.synos.anomaly.service;

import com.synos.anomaly.model.BaselineProfile;
import com.synos.anomaly.model.MetricPoint;
import org.apache.commons.math3.distribution.TDistribution;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * baseline 통계 계산 유틸리티
 * percentile은 최근접 순위 사이 선형 보간 (R-7, numpy 기본값과 동일)
 */
public final class BaselineStatistics {

    public static final int[] PERCENTILES = {5, 25, 75, 95};

    public static final String HOURLY_PATTERN = "hourly_pattern_strength";
    public static final String DAILY_PATTERN = "daily_pattern_strength";

    private static final double EPSILON = 1e-8;
    private static final int MIN_GROUP_SIZE = 3;
    private static final int MIN_HOURS = 12;
    private static final int MIN_DAYS = 5;

    // Grubbs 임계값 캐시: key = "n:alpha"
    private static final Map<String, Double> GRUBBS_CACHE = new ConcurrentHashMap<>();

    private BaselineStatistics() {
    }

    /**
     * 값 목록으로 baseline 통계 계산 (metricName/source/window/lastUpdated는 호출자가 설정)
     */
    public static BaselineProfile summarize(double[] values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("baseline requires at least one value");
        }

        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        double median = percentile(values, 50);

        Map<Integer, Double> percentiles = new TreeMap<>();
        for (int p : PERCENTILES) {
            percentiles.put(p, percentile(values, p));
        }

        return BaselineProfile.builder()
                .mean(stats.getMean())
                // 표본 표준편차, n == 1 이면 0
                .std(values.length > 1 ? stats.getStandardDeviation() : 0.0)
                .median(median)
                .mad(medianAbsoluteDeviation(values, median))
                .percentiles(percentiles)
                .minValue(stats.getMin())
                .maxValue(stats.getMax())
                .sampleCount(values.length)
                .build();
    }

    /**
     * @param p (0, 100]
     */
    public static double percentile(double[] values, double p) {
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, p);
    }

    public static double medianAbsoluteDeviation(double[] values, double median) {
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        return percentile(deviations, 50);
    }

    /**
     * 시간대/요일별 계절성 강도
     * 그룹 평균들의 분산 / 그룹 평균들의 평균
     */
    public static Map<String, Double> seasonalPatterns(List<MetricPoint> points, int minSamples) {
        Map<String, Double> patterns = new LinkedHashMap<>();
        if (points.size() < minSamples) {
            return patterns;
        }

        Map<Integer, List<Double>> hourly = new TreeMap<>();
        Map<Integer, List<Double>> daily = new TreeMap<>();
        for (MetricPoint point : points) {
            hourly.computeIfAbsent(point.getTimestamp().getHour(), k -> new ArrayList<>()).add(point.getValue());
            daily.computeIfAbsent(point.getTimestamp().getDayOfWeek().getValue() - 1, k -> new ArrayList<>())
                    .add(point.getValue());
        }

        Double hourlyStrength = patternStrength(hourly, MIN_HOURS);
        if (hourlyStrength != null) {
            patterns.put(HOURLY_PATTERN, hourlyStrength);
        }
        Double dailyStrength = patternStrength(daily, MIN_DAYS);
        if (dailyStrength != null) {
            patterns.put(DAILY_PATTERN, dailyStrength);
        }
        return patterns;
    }

    private static Double patternStrength(Map<Integer, List<Double>> groups, int minGroups) {
        double[] groupMeans = groups.values().stream()
                .filter(values -> values.size() >= MIN_GROUP_SIZE)
                .mapToDouble(values -> values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0))
                .toArray();
        if (groupMeans.length < minGroups) {
            return null;
        }
        double overallMean = new Mean().evaluate(groupMeans);
        double variance = new Variance().evaluate(groupMeans);
        return variance / (overallMean + EPSILON);
    }

    /**
     * 양측 Grubbs 임계값
     * G = ((n-1)/sqrt(n)) * sqrt(t^2 / (n-2+t^2)), t = t_{1-alpha/(2n), n-2}
     */
    public static double grubbsCritical(int n, double alpha) {
        if (n < 3) {
            throw new IllegalArgumentException("Grubbs test requires n >= 3, got " + n);
        }
        return GRUBBS_CACHE.computeIfAbsent(n + ":" + alpha, key -> {
            double t = new TDistribution(n - 2).inverseCumulativeProbability(1 - alpha / (2.0 * n));
            double t2 = t * t;
            return ((n - 1) / Math.sqrt(n)) * Math.sqrt(t2 / (n - 2 + t2));
        });
    }
}
