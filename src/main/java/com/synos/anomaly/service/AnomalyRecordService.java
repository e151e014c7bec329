package com.synos.anomaly.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.synos.anomaly.entity.AnomalyRecord;
import com.synos.anomaly.exception.AnomalyNotFoundException;
import com.synos.anomaly.model.AnomalyDetection;
import com.synos.anomaly.model.AnomalySeverity;
import com.synos.anomaly.model.AnomalyType;
import com.synos.anomaly.repository.AnomalyRecordRepository;
import com.synos.anomaly.repository.OffsetPageRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * anomaly_detections 테이블 저장/조회
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AnomalyRecordService {

    private final AnomalyRecordRepository anomalyRecordRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public AnomalyRecord save(AnomalyDetection anomaly) {
        AnomalyRecord record = new AnomalyRecord();
        record.setId(anomaly.getId());
        record.setTimestamp(anomaly.getTimestamp());
        record.setAnomalyType(anomaly.getAnomalyType());
        record.setSeverity(anomaly.getSeverity());
        record.setMetricName(anomaly.getMetricName());
        record.setSource(anomaly.getSource());
        record.setObservedValue(anomaly.getObservedValue());
        record.setExpectedValue(anomaly.getExpectedValue());
        record.setDeviationScore(anomaly.getDeviationScore());
        record.setConfidence(anomaly.getConfidence());
        record.setDescription(truncate(anomaly.getDescription(), 2000));
        record.setFalsePositiveProbability(anomaly.getFalsePositiveProbability());
        record.setFalsePositive(false);
        record.setAcknowledged(false);

        // context, remediation을 JSON 문자열로 변환
        try {
            record.setContext(objectMapper.writeValueAsString(anomaly.getContext()));
            record.setRemediation(objectMapper.writeValueAsString(anomaly.getRemediationSuggestions()));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize anomaly context to JSON: id={}", anomaly.getId(), e);
            record.setContext("{}");
            record.setRemediation("[]");
        }

        return anomalyRecordRepository.save(record);
    }

    /**
     * 이상탐지 이력 조회 (필터링 및 페이지네이션)
     */
    @Transactional(readOnly = true)
    public Page<AnomalyRecord> getAnomalies(
            Boolean acknowledged,
            AnomalySeverity severity,
            AnomalyType type,
            int limit,
            int offset
    ) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + offset);
        }
        Pageable pageable = new OffsetPageRequest(offset, limit, Sort.by(Sort.Direction.DESC, "timestamp"));

        // 필터링 조건에 따라 다른 쿼리 실행
        if (acknowledged != null && severity != null && type != null) {
            return anomalyRecordRepository.findByAcknowledgedAndSeverityAndAnomalyType(acknowledged, severity, type, pageable);
        } else if (acknowledged != null && severity != null) {
            return anomalyRecordRepository.findByAcknowledgedAndSeverity(acknowledged, severity, pageable);
        } else if (acknowledged != null && type != null) {
            return anomalyRecordRepository.findByAcknowledgedAndAnomalyType(acknowledged, type, pageable);
        } else if (severity != null && type != null) {
            return anomalyRecordRepository.findBySeverityAndAnomalyType(severity, type, pageable);
        } else if (acknowledged != null) {
            return anomalyRecordRepository.findByAcknowledged(acknowledged, pageable);
        } else if (severity != null) {
            return anomalyRecordRepository.findBySeverity(severity, pageable);
        } else if (type != null) {
            return anomalyRecordRepository.findByAnomalyType(type, pageable);
        } else {
            return anomalyRecordRepository.findAll(pageable);
        }
    }

    @Transactional(readOnly = true)
    public Optional<AnomalyRecord> getById(String id) {
        return anomalyRecordRepository.findById(id);
    }

    @Transactional
    public AnomalyRecord markFalsePositive(String id) {
        AnomalyRecord record = anomalyRecordRepository.findById(id)
                .orElseThrow(() -> new AnomalyNotFoundException(id));
        record.setFalsePositive(true);
        return anomalyRecordRepository.save(record);
    }

    @Transactional
    public AnomalyRecord acknowledge(String id) {
        AnomalyRecord record = anomalyRecordRepository.findById(id)
                .orElseThrow(() -> new AnomalyNotFoundException(id));
        record.setAcknowledged(true);
        return anomalyRecordRepository.save(record);
    }

    /**
     * 저장된 레코드 -> 탐지 결과 (API 응답용)
     */
    public AnomalyDetection toDetection(AnomalyRecord record) {
        Map<String, Object> context = new LinkedHashMap<>();
        List<String> remediation = new ArrayList<>();
        try {
            if (record.getContext() != null) {
                context = objectMapper.readValue(record.getContext(), new TypeReference<LinkedHashMap<String, Object>>() {});
            }
            if (record.getRemediation() != null) {
                remediation = objectMapper.readValue(record.getRemediation(), new TypeReference<ArrayList<String>>() {});
            }
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse anomaly JSON columns: id={}, error={}", record.getId(), e.getMessage());
        }

        return AnomalyDetection.builder()
                .id(record.getId())
                .timestamp(record.getTimestamp())
                .anomalyType(record.getAnomalyType())
                .severity(record.getSeverity())
                .metricName(record.getMetricName())
                .source(record.getSource())
                .observedValue(record.getObservedValue())
                .expectedValue(record.getExpectedValue())
                .deviationScore(record.getDeviationScore())
                .confidence(record.getConfidence())
                .description(record.getDescription())
                .context(context)
                .falsePositiveProbability(record.getFalsePositiveProbability() != null
                        ? record.getFalsePositiveProbability() : 0.0)
                .remediationSuggestions(remediation)
                .build();
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
