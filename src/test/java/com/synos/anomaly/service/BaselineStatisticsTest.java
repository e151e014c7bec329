package com.synos.anomaly.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.synos.anomaly.model.BaselineProfile;
import com.synos.anomaly.model.MetricPoint;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class BaselineStatisticsTest {

    @Test
    void summarizesValuesWithLinearPercentiles() {
        double[] values = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10};

        BaselineProfile profile = BaselineStatistics.summarize(values);

        assertEquals(5.5, profile.getMean(), 1e-9);
        assertEquals(3.0276503540974917, profile.getStd(), 1e-9);
        assertEquals(5.5, profile.getMedian(), 1e-9);
        assertEquals(2.5, profile.getMad(), 1e-9);
        assertEquals(1.45, profile.percentile(5), 1e-9);
        assertEquals(3.25, profile.percentile(25), 1e-9);
        assertEquals(7.75, profile.percentile(75), 1e-9);
        assertEquals(9.55, profile.percentile(95), 1e-9);
        assertEquals(1.0, profile.getMinValue(), 0.0);
        assertEquals(10.0, profile.getMaxValue(), 0.0);
        assertEquals(10, profile.getSampleCount());
    }

    @Test
    void singleValueHasZeroSpread() {
        BaselineProfile profile = BaselineStatistics.summarize(new double[]{42.0});

        assertEquals(42.0, profile.getMean(), 0.0);
        assertEquals(0.0, profile.getStd(), 0.0);
        assertEquals(0.0, profile.getMad(), 0.0);
        assertEquals(42.0, profile.percentile(95), 0.0);
    }

    @Test
    void rejectsEmptyInput() {
        assertThrows(IllegalArgumentException.class, () -> BaselineStatistics.summarize(new double[0]));
    }

    @Test
    void grubbsCriticalValueMatchesPublishedTable() {
        // alpha = 0.05 two-sided
        assertEquals(2.708, BaselineStatistics.grubbsCritical(20, 0.05), 1e-3);
        assertEquals(2.0199, BaselineStatistics.grubbsCritical(7, 0.05), 1e-3);
        assertThrows(IllegalArgumentException.class, () -> BaselineStatistics.grubbsCritical(2, 0.05));
    }

    @Test
    void detectsHourlyPatternButNotDailyWithFewDays() {
        LocalDateTime monday = LocalDateTime.of(2024, 1, 1, 0, 0);
        List<MetricPoint> points = new ArrayList<>();
        for (int day = 0; day < 3; day++) {
            for (int hour = 0; hour < 24; hour++) {
                points.add(MetricPoint.builder()
                        .timestamp(monday.plusDays(day).withHour(hour))
                        .metricName("cpu_usage")
                        .source("node-1")
                        .value(hour)
                        .build());
            }
        }

        Map<String, Double> patterns = BaselineStatistics.seasonalPatterns(points, 50);

        // sample variance of 0..23 is 50, mean is 11.5
        assertEquals(50.0 / 11.5, patterns.get(BaselineStatistics.HOURLY_PATTERN), 1e-6);
        assertFalse(patterns.containsKey(BaselineStatistics.DAILY_PATTERN));
    }

    @Test
    void detectsDailyPatternAcrossAFullWeek() {
        LocalDateTime monday = LocalDateTime.of(2024, 1, 1, 0, 0);
        List<MetricPoint> points = new ArrayList<>();
        for (int day = 0; day < 7; day++) {
            for (int hour = 0; hour < 24; hour += 3) {
                points.add(MetricPoint.builder()
                        .timestamp(monday.plusDays(day).withHour(hour))
                        .metricName("login_count")
                        .source("node-1")
                        .value(10.0 * (day + 1))
                        .build());
            }
        }

        Map<String, Double> patterns = BaselineStatistics.seasonalPatterns(points, 50);

        // daily means 10..70: sample variance 2800/6, mean 40
        assertEquals((2800.0 / 6.0) / 40.0, patterns.get(BaselineStatistics.DAILY_PATTERN), 1e-6);
        // only 8 distinct hours
        assertFalse(patterns.containsKey(BaselineStatistics.HOURLY_PATTERN));
    }

    @Test
    void skipsSeasonalAnalysisForSmallWindows() {
        List<MetricPoint> points = new ArrayList<>();
        for (int i = 0; i < 49; i++) {
            points.add(MetricPoint.builder()
                    .timestamp(LocalDateTime.of(2024, 1, 1, 0, 0).plusHours(i))
                    .metricName("m")
                    .source("s")
                    .value(i)
                    .build());
        }

        assertTrue(BaselineStatistics.seasonalPatterns(points, 50).isEmpty());
    }
}
