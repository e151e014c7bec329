package com.synos.anomaly.dto;

import com.synos.anomaly.model.AnomalyDetection;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 메트릭 수집 응답 DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestResponse {

    private String status;

    private int anomaliesDetected;

    private List<AnomalyDetection> anomalies;

    public static IngestResponse of(List<AnomalyDetection> anomalies) {
        return new IngestResponse("success", anomalies.size(), anomalies);
    }
}
