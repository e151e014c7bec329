package com.synos.anomaly.ml;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 메트릭 이름 키워드로 metric type 분류 (먼저 매칭된 type 우선)
 */
public final class MetricTypeClassifier {

    public static final String GENERIC = "generic";

    private static final Map<String, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put("network", List.of("network", "connection", "bandwidth"));
        KEYWORDS.put("performance", List.of("cpu", "memory", "disk", "performance"));
        KEYWORDS.put("security", List.of("security", "login", "auth", "privilege"));
        KEYWORDS.put("process", List.of("process", "thread", "pid"));
        KEYWORDS.put("filesystem", List.of("file", "directory", "filesystem"));
    }

    private MetricTypeClassifier() {
    }

    public static String classify(String metricName) {
        if (metricName == null) {
            return GENERIC;
        }
        String lower = metricName.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (lower.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return GENERIC;
    }
}
