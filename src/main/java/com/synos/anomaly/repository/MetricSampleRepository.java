package com.synos.anomaly.repository;

import com.synos.anomaly.entity.MetricSample;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface MetricSampleRepository extends JpaRepository<MetricSample, Long> {

    // 학습 데이터: 최신순
    List<MetricSample> findAllByOrderByTimestampDesc(Pageable pageable);
}
