package com.synos.anomaly.ml;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

final class MetricTypeClassifierTest {

    @Test
    void classifiesByFirstMatchingKeyword() {
        assertEquals("network", MetricTypeClassifier.classify("network_connection_count"));
        assertEquals("performance", MetricTypeClassifier.classify("cpu_usage_percent"));
        assertEquals("performance", MetricTypeClassifier.classify("Memory_Used_Bytes"));
        assertEquals("security", MetricTypeClassifier.classify("failed_login_attempts"));
        assertEquals("process", MetricTypeClassifier.classify("thread_count"));
        assertEquals("filesystem", MetricTypeClassifier.classify("open_file_handles"));
        // "connection" wins over "disk"
        assertEquals("network", MetricTypeClassifier.classify("disk_connection_errors"));
    }

    @Test
    void fallsBackToGeneric() {
        assertEquals(MetricTypeClassifier.GENERIC, MetricTypeClassifier.classify("queue_depth"));
        assertEquals(MetricTypeClassifier.GENERIC, MetricTypeClassifier.classify(null));
    }
}
