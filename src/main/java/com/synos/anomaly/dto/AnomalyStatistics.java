package com.synos.anomaly.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyStatistics {

    // 최근 탐지 버퍼 기준
    private int totalAnomalies;

    // severity 이름 (HIGH 등) -> 건수
    private Map<String, Long> severityDistribution;

    // anomaly type 값 (statistical 등) -> 건수
    private Map<String, Long> typeDistribution;

    private int baselinesCount;

    private int mlModelsCount;

    private double falsePositiveRate;
}
