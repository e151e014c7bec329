package com.synos.anomaly.controller;

import com.synos.anomaly.dto.AnomalyStatistics;
import com.synos.anomaly.entity.AnomalyRecord;
import com.synos.anomaly.model.AnomalyDetection;
import com.synos.anomaly.model.AnomalySeverity;
import com.synos.anomaly.model.AnomalyType;
import com.synos.anomaly.service.AnomalyDetectionService;
import com.synos.anomaly.service.AnomalyRecordService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * 이상탐지 결과 API 컨트롤러
 */
@RestController
@RequestMapping("/api/anomalies")
@RequiredArgsConstructor
public class AnomalyController {

    private final AnomalyDetectionService anomalyDetectionService;
    private final AnomalyRecordService anomalyRecordService;

    /**
     * 저장된 이상탐지 이력 조회
     * GET /api/anomalies?severity=&type=&acknowledged=&limit=&offset=
     */
    @GetMapping
    public ResponseEntity<List<AnomalyDetection>> getAnomalies(
            @RequestParam(required = false) Boolean acknowledged,
            @RequestParam(required = false) String severity,
            @RequestParam(required = false) String type,
            @RequestParam(defaultValue = "100") int limit,
            @RequestParam(defaultValue = "0") int offset
    ) {
        // 잘못된 값은 IllegalArgumentException -> 400
        AnomalySeverity severityEnum = AnomalySeverity.fromString(severity);
        AnomalyType typeEnum = AnomalyType.fromString(type);

        Page<AnomalyRecord> page = anomalyRecordService.getAnomalies(acknowledged, severityEnum, typeEnum, limit, offset);
        return ResponseEntity.ok(page.getContent().stream()
                .map(anomalyRecordService::toDetection)
                .toList());
    }

    /**
     * 최근 탐지 결과 (메모리)
     * GET /api/anomalies/recent?limit=50
     */
    @GetMapping("/recent")
    public ResponseEntity<List<AnomalyDetection>> getRecent(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(anomalyDetectionService.getRecentAnomalies(limit));
    }

    /**
     * GET /api/anomalies/statistics
     */
    @GetMapping("/statistics")
    public ResponseEntity<AnomalyStatistics> getStatistics() {
        return ResponseEntity.ok(anomalyDetectionService.getStatistics());
    }

    /**
     * GET /api/anomalies/:id
     */
    @GetMapping("/{id}")
    public ResponseEntity<AnomalyDetection> getAnomaly(@PathVariable String id) {
        return ResponseEntity.ok(anomalyDetectionService.getAnomaly(id));
    }

    /**
     * false positive 표시
     * PUT /api/anomalies/:id/false-positive
     */
    @PutMapping("/{id}/false-positive")
    public ResponseEntity<AnomalyDetection> markFalsePositive(@PathVariable String id) {
        return ResponseEntity.ok(anomalyDetectionService.markFalsePositive(id));
    }

    /**
     * 확인 처리
     * PUT /api/anomalies/:id/acknowledge
     */
    @PutMapping("/{id}/acknowledge")
    public ResponseEntity<AnomalyDetection> acknowledge(@PathVariable String id) {
        return ResponseEntity.ok(anomalyDetectionService.acknowledge(id));
    }
}
