package com.synos.anomaly.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 메트릭 수집 요청 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricPointRequest {

    // 없으면 서버 시각 사용
    private LocalDateTime timestamp;

    @NotBlank(message = "metric_name is required")
    private String metricName;

    @NotNull(message = "value is required")
    private Double value;

    @NotBlank(message = "source is required")
    private String source;

    private Map<String, Object> metadata;
}
