package com.synos.anomaly.controller;

import com.synos.anomaly.dto.ModelSummary;
import com.synos.anomaly.dto.TrainingResult;
import com.synos.anomaly.service.AnomalyDetectionService;
import com.synos.anomaly.service.MlAnomalyDetector;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Comparator;
import java.util.List;

/**
 * ML 모델 API 컨트롤러
 */
@RestController
@RequestMapping("/api/models")
@RequiredArgsConstructor
public class ModelController {

    private final AnomalyDetectionService anomalyDetectionService;
    private final MlAnomalyDetector mlAnomalyDetector;

    /**
     * 저장된 메트릭으로 학습
     * POST /api/models/train
     */
    @PostMapping("/train")
    public ResponseEntity<TrainingResult> train() {
        return ResponseEntity.ok(anomalyDetectionService.trainMlModels());
    }

    /**
     * GET /api/models
     */
    @GetMapping
    public ResponseEntity<List<ModelSummary>> getModels() {
        return ResponseEntity.ok(mlAnomalyDetector.getModels().stream()
                .map(ModelSummary::from)
                .sorted(Comparator.comparing(ModelSummary::getModelName))
                .toList());
    }
}
