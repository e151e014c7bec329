package com.synos.anomaly.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.synos.anomaly.config.JacksonConfig;
import com.synos.anomaly.dto.MetricPointRequest;
import com.synos.anomaly.entity.AnomalyRecord;
import com.synos.anomaly.exception.AnomalyNotFoundException;
import com.synos.anomaly.model.AnomalyDetection;
import com.synos.anomaly.model.AnomalySeverity;
import com.synos.anomaly.model.AnomalyType;
import com.synos.anomaly.model.TimeWindow;
import com.synos.anomaly.service.AnomalyDetectionService;
import com.synos.anomaly.service.AnomalyRecordService;
import com.synos.anomaly.service.MetricBaselineService;
import com.synos.anomaly.service.MlAnomalyDetector;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.http.MediaType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = {
        MetricsController.class,
        AnomalyController.class,
        BaselineController.class,
        ModelController.class
})
@Import(JacksonConfig.class)
class ApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnomalyDetectionService anomalyDetectionService;

    @MockBean
    private AnomalyRecordService anomalyRecordService;

    @MockBean
    private MetricBaselineService baselineService;

    @MockBean
    private MlAnomalyDetector mlAnomalyDetector;

    @MockBean
    private SimpMessagingTemplate messagingTemplate;

    @Test
    void ingestReturnsDetectedAnomalies() throws Exception {
        when(anomalyDetectionService.ingest(any(MetricPointRequest.class))).thenReturn(List.of(detection("a1")));

        mockMvc.perform(post("/api/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"metric_name\":\"cpu_usage_percent\",\"value\":97.5,\"source\":\"node-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.anomalies_detected").value(1))
                .andExpect(jsonPath("$.anomalies[0].id").value("a1"))
                .andExpect(jsonPath("$.anomalies[0].severity").value("HIGH"))
                .andExpect(jsonPath("$.anomalies[0].anomaly_type").value("statistical"));
    }

    @Test
    void ingestRejectsMissingFields() throws Exception {
        mockMvc.perform(post("/api/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"metric_name\":\"\",\"value\":1.0,\"source\":\"node-1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));

        mockMvc.perform(post("/api/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"metric_name\":\"cpu_usage_percent\",\"source\":\"node-1\"}"))
                .andExpect(status().isBadRequest());

        verify(anomalyDetectionService, never()).ingest(any(MetricPointRequest.class));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"metric_name\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void unknownAnomalyIsNotFound() throws Exception {
        when(anomalyDetectionService.getAnomaly("missing")).thenThrow(new AnomalyNotFoundException("missing"));
        when(anomalyDetectionService.markFalsePositive("missing")).thenThrow(new AnomalyNotFoundException("missing"));

        mockMvc.perform(get("/api/anomalies/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Anomaly not found: missing"));
        mockMvc.perform(put("/api/anomalies/missing/false-positive"))
                .andExpect(status().isNotFound());
    }

    @Test
    void falsePositiveFeedbackReturnsAnomaly() throws Exception {
        when(anomalyDetectionService.markFalsePositive("a1")).thenReturn(detection("a1"));

        mockMvc.perform(put("/api/anomalies/a1/false-positive"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("a1"));
    }

    @Test
    void historyFiltersAreParsed() throws Exception {
        AnomalyRecord record = new AnomalyRecord();
        record.setId("a1");
        Page<AnomalyRecord> page = new PageImpl<>(List.of(record));
        when(anomalyRecordService.getAnomalies(isNull(), eq(AnomalySeverity.HIGH), eq(AnomalyType.SECURITY),
                eq(20), eq(0))).thenReturn(page);
        when(anomalyRecordService.toDetection(record)).thenReturn(detection("a1"));

        mockMvc.perform(get("/api/anomalies").param("severity", "high").param("type", "security").param("limit", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("a1"));
    }

    @Test
    void unknownSeverityIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/anomalies").param("severity", "urgent"))
                .andExpect(status().isBadRequest());

        verify(anomalyRecordService, never()).getAnomalies(any(), any(), any(), anyInt(), anyInt());
    }

    @Test
    void missingBaselineIsNotFound() throws Exception {
        when(baselineService.getBaseline("cpu_usage_percent", "node-1", TimeWindow.HOURLY))
                .thenReturn(Optional.empty());

        mockMvc.perform(get("/api/baselines").param("metric", "cpu_usage_percent").param("source", "node-1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Baseline not found"));
    }

    @Test
    void baselineLookupNeedsMetricAndSource() throws Exception {
        mockMvc.perform(get("/api/baselines").param("metric", "cpu_usage_percent"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(baselineService);
    }

    private static AnomalyDetection detection(String id) {
        return AnomalyDetection.builder()
                .id(id)
                .timestamp(LocalDateTime.of(2024, 1, 3, 12, 0))
                .anomalyType(AnomalyType.STATISTICAL)
                .severity(AnomalySeverity.HIGH)
                .metricName("cpu_usage_percent")
                .source("node-1")
                .observedValue(97.5)
                .expectedValue(50.0)
                .deviationScore(5.1)
                .confidence(0.9)
                .description("cpu spike")
                .build();
    }
}
