package com.synos.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ML 학습용 샘플 (저장된 메트릭 + 이상 여부 라벨)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrainingSample {

    private MetricPoint point;

    private String metricType;

    private boolean anomaly;
}
