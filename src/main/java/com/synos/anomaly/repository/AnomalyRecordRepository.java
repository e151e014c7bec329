package com.synos.anomaly.repository;

import com.synos.anomaly.entity.AnomalyRecord;
import com.synos.anomaly.model.AnomalySeverity;
import com.synos.anomaly.model.AnomalyType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface AnomalyRecordRepository extends JpaRepository<AnomalyRecord, String> {

    // 확인 여부로 필터링
    Page<AnomalyRecord> findByAcknowledged(Boolean acknowledged, Pageable pageable);

    // 심각도로 필터링
    Page<AnomalyRecord> findBySeverity(AnomalySeverity severity, Pageable pageable);

    // 유형으로 필터링
    Page<AnomalyRecord> findByAnomalyType(AnomalyType anomalyType, Pageable pageable);

    Page<AnomalyRecord> findByAcknowledgedAndSeverity(Boolean acknowledged, AnomalySeverity severity, Pageable pageable);

    Page<AnomalyRecord> findByAcknowledgedAndAnomalyType(Boolean acknowledged, AnomalyType anomalyType, Pageable pageable);

    Page<AnomalyRecord> findBySeverityAndAnomalyType(AnomalySeverity severity, AnomalyType anomalyType, Pageable pageable);

    Page<AnomalyRecord> findByAcknowledgedAndSeverityAndAnomalyType(
            Boolean acknowledged,
            AnomalySeverity severity,
            AnomalyType anomalyType,
            Pageable pageable
    );

    // 학습 데이터 라벨링: 구간 내 (false positive 제외) 이상 목록
    List<AnomalyRecord> findByTimestampBetweenAndFalsePositiveFalse(LocalDateTime from, LocalDateTime to);
}
