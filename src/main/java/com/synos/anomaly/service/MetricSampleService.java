package com.synos.anomaly.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.synos.anomaly.config.AnomalyDetectorProperties;
import com.synos.anomaly.entity.AnomalyRecord;
import com.synos.anomaly.entity.MetricSample;
import com.synos.anomaly.ml.MetricTypeClassifier;
import com.synos.anomaly.model.MetricPoint;
import com.synos.anomaly.model.TrainingSample;
import com.synos.anomaly.repository.AnomalyRecordRepository;
import com.synos.anomaly.repository.MetricSampleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.*;

/**
 * metrics 테이블 저장 및 ML 학습 데이터 구성
 */
@Service
@Slf4j
public class MetricSampleService {

    private final MetricSampleRepository metricSampleRepository;
    private final AnomalyRecordRepository anomalyRecordRepository;
    private final ObjectMapper objectMapper;
    private final AnomalyDetectorProperties.Ml config;

    public MetricSampleService(MetricSampleRepository metricSampleRepository,
                               AnomalyRecordRepository anomalyRecordRepository,
                               ObjectMapper objectMapper,
                               AnomalyDetectorProperties properties) {
        this.metricSampleRepository = metricSampleRepository;
        this.anomalyRecordRepository = anomalyRecordRepository;
        this.objectMapper = objectMapper;
        this.config = properties.getMl();
    }

    @Transactional
    public MetricSample storeMetric(MetricPoint point) {
        MetricSample sample = new MetricSample();
        sample.setTimestamp(point.getTimestamp());
        sample.setMetricName(point.getMetricName());
        sample.setValue(point.getValue());
        sample.setSource(point.getSource());
        try {
            sample.setMetadata(objectMapper.writeValueAsString(point.getMetadata()));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize metric metadata to JSON: metric={}", point.getMetricName(), e);
            sample.setMetadata("{}");
        }
        return metricSampleRepository.save(sample);
    }

    /**
     * 최근 메트릭을 읽어 라벨링
     * 같은 메트릭의 (false positive가 아닌) 이상이 label-window-seconds 이내에 있으면 anomaly = true
     */
    @Transactional(readOnly = true)
    public List<TrainingSample> loadTrainingData() {
        List<MetricSample> samples = metricSampleRepository.findAllByOrderByTimestampDesc(
                PageRequest.of(0, config.getTrainingLimit()));
        if (samples.isEmpty()) {
            return List.of();
        }

        LocalDateTime oldest = samples.get(samples.size() - 1).getTimestamp();
        LocalDateTime newest = samples.get(0).getTimestamp();
        long window = config.getLabelWindowSeconds();

        // 메트릭별 이상 시각
        Map<String, TreeSet<LocalDateTime>> anomalyTimes = new HashMap<>();
        for (AnomalyRecord record : anomalyRecordRepository.findByTimestampBetweenAndFalsePositiveFalse(
                oldest.minusSeconds(window), newest.plusSeconds(window))) {
            anomalyTimes.computeIfAbsent(record.getMetricName(), k -> new TreeSet<>()).add(record.getTimestamp());
        }

        List<TrainingSample> trainingData = new ArrayList<>(samples.size());
        int anomalies = 0;
        for (MetricSample sample : samples) {
            MetricPoint point = MetricPoint.builder()
                    .timestamp(sample.getTimestamp())
                    .metricName(sample.getMetricName())
                    .value(sample.getValue())
                    .source(sample.getSource())
                    .metadata(readMetadata(sample))
                    .build();

            boolean anomaly = false;
            TreeSet<LocalDateTime> times = anomalyTimes.get(sample.getMetricName());
            if (times != null) {
                LocalDateTime nearest = times.ceiling(sample.getTimestamp().minusSeconds(window));
                anomaly = nearest != null && !nearest.isAfter(sample.getTimestamp().plusSeconds(window));
            }
            if (anomaly) {
                anomalies++;
            }
            trainingData.add(new TrainingSample(point, MetricTypeClassifier.classify(sample.getMetricName()), anomaly));
        }

        log.info("학습 데이터 로드: samples={}, anomalies={}", trainingData.size(), anomalies);
        return trainingData;
    }

    private Map<String, Object> readMetadata(MetricSample sample) {
        if (sample.getMetadata() == null || sample.getMetadata().isBlank()) {
            return new HashMap<>();
        }
        try {
            return objectMapper.readValue(sample.getMetadata(), new TypeReference<HashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.debug("metadata 파싱 실패: id={}, error={}", sample.getId(), e.getMessage());
            return new HashMap<>();
        }
    }
}
