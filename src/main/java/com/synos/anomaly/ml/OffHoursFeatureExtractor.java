package com.synos.anomaly.ml;

import com.synos.anomaly.model.MetricPoint;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.util.Map;

/**
 * 보안 메트릭용: 업무 시간 외(22시~6시, 주말) 발생 여부
 */
@Component
public class OffHoursFeatureExtractor implements TypedFeatureExtractor {

    private static final int WORK_START_HOUR = 6;
    private static final int WORK_END_HOUR = 22;

    @Override
    public String metricType() {
        return "security";
    }

    @Override
    public Map<String, Double> extract(MetricPoint point) {
        int hour = point.getTimestamp().getHour();
        DayOfWeek day = point.getTimestamp().getDayOfWeek();
        boolean offHours = hour < WORK_START_HOUR || hour >= WORK_END_HOUR
                || day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
        return Map.of("off_hours", offHours ? 1.0 : 0.0);
    }
}
