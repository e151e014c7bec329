package com.synos.anomaly.controller;

import com.synos.anomaly.dto.IngestResponse;
import com.synos.anomaly.dto.MetricPointRequest;
import com.synos.anomaly.model.AnomalyDetection;
import com.synos.anomaly.service.AnomalyDetectionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 메트릭 수집 API 컨트롤러
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
@Validated
@Slf4j
public class MetricsController {

    private final AnomalyDetectionService anomalyDetectionService;

    /**
     * 메트릭 단건 수집
     * POST /api/metrics
     */
    @PostMapping
    public ResponseEntity<IngestResponse> ingest(@Valid @RequestBody MetricPointRequest request) {
        List<AnomalyDetection> anomalies = anomalyDetectionService.ingest(request);
        if (!anomalies.isEmpty()) {
            log.debug("메트릭 수집: metric={}, source={}, anomalies={}",
                    request.getMetricName(), request.getSource(), anomalies.size());
        }
        return ResponseEntity.ok(IngestResponse.of(anomalies));
    }

    /**
     * 메트릭 일괄 수집 (순서대로 처리)
     * POST /api/metrics/batch
     */
    @PostMapping("/batch")
    public ResponseEntity<IngestResponse> ingestBatch(@RequestBody List<@Valid MetricPointRequest> requests) {
        List<AnomalyDetection> anomalies = anomalyDetectionService.ingestBatch(requests);
        log.debug("메트릭 일괄 수집: points={}, anomalies={}", requests.size(), anomalies.size());
        return ResponseEntity.ok(IngestResponse.of(anomalies));
    }
}
