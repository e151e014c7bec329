package com.synos.anomaly.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.synos.anomaly.entity.MlModelRecord;
import com.synos.anomaly.ml.AnomalyScorer;
import com.synos.anomaly.ml.DetectionModel;
import com.synos.anomaly.ml.FeatureScaler;
import com.synos.anomaly.ml.ModelSerializer;
import com.synos.anomaly.repository.MlModelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * ml_models 테이블 저장/복원 (scorer, scaler는 Java 직렬화)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MlModelStore {

    private final MlModelRepository mlModelRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public void save(DetectionModel model) {
        try {
            MlModelRecord record = new MlModelRecord();
            record.setModelName(model.getModelName());
            record.setModelType(model.getModelType());
            record.setMetricPatterns(objectMapper.writeValueAsString(model.getMetricPatterns()));
            record.setFeatureNames(objectMapper.writeValueAsString(model.getFeatureNames()));
            record.setModelData(ModelSerializer.serialize(model.getScorer()));
            record.setScalerData(ModelSerializer.serialize(model.getScaler()));
            record.setTrainingAccuracy(model.getTrainingAccuracy());
            record.setLastTrained(model.getLastTrained());
            record.setFeatureImportance(objectMapper.writeValueAsString(model.getFeatureImportance()));
            mlModelRepository.save(record);
            log.debug("ML 모델 저장: name={}", model.getModelName());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize model metadata: " + model.getModelName(), e);
        }
    }

    /**
     * 저장된 모든 모델 복원 (복원 실패한 모델은 건너뜀)
     */
    @Transactional(readOnly = true)
    public List<DetectionModel> loadAll() {
        List<DetectionModel> models = new ArrayList<>();
        for (MlModelRecord record : mlModelRepository.findAll()) {
            try {
                models.add(DetectionModel.builder()
                        .modelName(record.getModelName())
                        .modelType(record.getModelType())
                        .metricPatterns(objectMapper.readValue(record.getMetricPatterns(),
                                new TypeReference<ArrayList<String>>() {}))
                        .featureNames(objectMapper.readValue(record.getFeatureNames(),
                                new TypeReference<ArrayList<String>>() {}))
                        .scorer(ModelSerializer.deserialize(record.getModelData(), AnomalyScorer.class))
                        .scaler(ModelSerializer.deserialize(record.getScalerData(), FeatureScaler.class))
                        .trainingAccuracy(record.getTrainingAccuracy() != null ? record.getTrainingAccuracy() : 0.0)
                        .lastTrained(record.getLastTrained())
                        .featureImportance(record.getFeatureImportance() != null
                                ? objectMapper.readValue(record.getFeatureImportance(),
                                        new TypeReference<LinkedHashMap<String, Double>>() {})
                                : new LinkedHashMap<>())
                        .build());
            } catch (Exception e) {
                log.warn("ML 모델 복원 실패: name={}, error={}", record.getModelName(), e.getMessage());
            }
        }
        return models;
    }
}
