package com.synos.anomaly.repository;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.synos.anomaly.config.AnomalyDetectorProperties;
import com.synos.anomaly.config.JacksonConfig;
import com.synos.anomaly.entity.AnomalyRecord;
import com.synos.anomaly.entity.MlModelRecord;
import com.synos.anomaly.exception.AnomalyNotFoundException;
import com.synos.anomaly.ml.DetectionModel;
import com.synos.anomaly.ml.FeatureScaler;
import com.synos.anomaly.ml.IsolationForestScorer;
import com.synos.anomaly.ml.RandomForestScorer;
import com.synos.anomaly.model.AnomalyDetection;
import com.synos.anomaly.model.AnomalySeverity;
import com.synos.anomaly.model.AnomalyType;
import com.synos.anomaly.model.MetricPoint;
import com.synos.anomaly.model.TrainingSample;
import com.synos.anomaly.service.AnomalyRecordService;
import com.synos.anomaly.service.MetricSampleService;
import com.synos.anomaly.service.MlModelStore;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.Page;

@DataJpaTest
class AnomalyPersistenceTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2024, 1, 3, 12, 0);

    @Autowired
    private AnomalyRecordRepository anomalyRecordRepository;

    @Autowired
    private MetricSampleRepository metricSampleRepository;

    @Autowired
    private MlModelRepository mlModelRepository;

    private AnomalyRecordService recordService;
    private MetricSampleService sampleService;
    private MlModelStore modelStore;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
        recordService = new AnomalyRecordService(anomalyRecordRepository, objectMapper);
        sampleService = new MetricSampleService(
                metricSampleRepository, anomalyRecordRepository, objectMapper, new AnomalyDetectorProperties());
        modelStore = new MlModelStore(mlModelRepository, objectMapper);
    }

    @Test
    void storedAnomalyKeepsContextAndRemediation() {
        AnomalyDetection detection = anomaly("statistical_anomaly_1", "cpu_usage_percent",
                AnomalyType.STATISTICAL, AnomalySeverity.HIGH, T0);
        detection.getContext().put("statistical_methods", List.of("z_score", "iqr"));
        detection.getRemediationSuggestions().add("Check recent deployments");
        recordService.save(detection);

        AnomalyDetection loaded = recordService.toDetection(recordService.getById("statistical_anomaly_1").orElseThrow());

        assertEquals(AnomalySeverity.HIGH, loaded.getSeverity());
        assertEquals(List.of("z_score", "iqr"), loaded.getContext().get("statistical_methods"));
        assertEquals(List.of("Check recent deployments"), loaded.getRemediationSuggestions());
        assertEquals(80.0, loaded.getObservedValue(), 0.0);
    }

    @Test
    void filtersCombineAndPageNewestFirst() {
        recordService.save(anomaly("a1", "cpu_usage_percent", AnomalyType.STATISTICAL, AnomalySeverity.HIGH, T0));
        recordService.save(anomaly("a2", "cpu_usage_percent", AnomalyType.PERFORMANCE, AnomalySeverity.HIGH,
                T0.plusMinutes(1)));
        recordService.save(anomaly("a3", "failed_login_count", AnomalyType.SECURITY, AnomalySeverity.CRITICAL,
                T0.plusMinutes(2)));
        recordService.acknowledge("a3");

        Page<AnomalyRecord> all = recordService.getAnomalies(null, null, null, 10, 0);
        assertEquals(List.of("a3", "a2", "a1"), all.map(AnomalyRecord::getId).getContent());

        Page<AnomalyRecord> high = recordService.getAnomalies(false, AnomalySeverity.HIGH, null, 10, 0);
        assertEquals(2, high.getTotalElements());

        Page<AnomalyRecord> highPerformance =
                recordService.getAnomalies(null, AnomalySeverity.HIGH, AnomalyType.PERFORMANCE, 10, 0);
        assertEquals(List.of("a2"), highPerformance.map(AnomalyRecord::getId).getContent());

        Page<AnomalyRecord> acknowledged = recordService.getAnomalies(true, null, null, 10, 0);
        assertEquals(List.of("a3"), acknowledged.map(AnomalyRecord::getId).getContent());

        Page<AnomalyRecord> secondPage = recordService.getAnomalies(null, null, null, 2, 2);
        assertEquals(List.of("a1"), secondPage.map(AnomalyRecord::getId).getContent());

        Page<AnomalyRecord> skipOne = recordService.getAnomalies(null, null, null, 2, 1);
        assertEquals(List.of("a2", "a1"), skipOne.map(AnomalyRecord::getId).getContent());
        assertEquals(3, skipOne.getTotalElements());

        assertThrows(IllegalArgumentException.class, () -> recordService.getAnomalies(null, null, null, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> recordService.getAnomalies(null, null, null, 10, -1));
    }

    @Test
    void feedbackOnUnknownAnomalyFails() {
        assertThrows(AnomalyNotFoundException.class, () -> recordService.markFalsePositive("missing"));
        assertThrows(AnomalyNotFoundException.class, () -> recordService.acknowledge("missing"));
    }

    @Test
    void trainingSamplesAreLabeledByNearbyConfirmedAnomalies() {
        sampleService.storeMetric(point("cpu_usage_percent", 40.0, T0));
        sampleService.storeMetric(point("cpu_usage_percent", 95.0, T0.plusSeconds(30)));
        sampleService.storeMetric(point("cpu_usage_percent", 92.0, T0.plusMinutes(5)));
        sampleService.storeMetric(point("memory_usage_percent", 60.0, T0.plusSeconds(40)));

        recordService.save(anomaly("hit", "cpu_usage_percent", AnomalyType.STATISTICAL, AnomalySeverity.HIGH,
                T0.plusSeconds(40)));
        recordService.save(anomaly("dismissed", "cpu_usage_percent", AnomalyType.STATISTICAL,
                AnomalySeverity.HIGH, T0.plusMinutes(5)));
        recordService.markFalsePositive("dismissed");

        List<TrainingSample> samples = sampleService.loadTrainingData();

        assertEquals(4, samples.size());
        // 최신순
        assertEquals(T0.plusMinutes(5), samples.get(0).getPoint().getTimestamp());
        assertFalse(samples.get(0).isAnomaly());
        assertFalse(samples.get(1).isAnomaly());
        assertEquals("memory_usage_percent", samples.get(1).getPoint().getMetricName());
        assertTrue(samples.get(2).isAnomaly());
        assertTrue(samples.get(3).isAnomaly());
        assertEquals("worker-1", samples.get(3).getPoint().getMetadata().get("node"));
    }

    @Test
    void emptyMetricTableGivesNoTrainingData() {
        assertTrue(sampleService.loadTrainingData().isEmpty());
    }

    @Test
    void storedModelScoresLikeTheOriginal() {
        Random random = new Random(11);
        double[][] data = new double[200][3];
        for (double[] row : data) {
            for (int c = 0; c < row.length; c++) {
                row[c] = random.nextGaussian();
            }
        }
        FeatureScaler scaler = FeatureScaler.standard(data);
        DetectionModel model = DetectionModel.builder()
                .modelType(DetectionModel.ISOLATION_FOREST)
                .modelName("isolation_forest_performance")
                .metricPatterns(new ArrayList<>(List.of("performance")))
                .featureNames(new ArrayList<>(List.of("hour", "value", "z_score")))
                .scaler(scaler)
                .scorer(IsolationForestScorer.fit(scaler.transform(data), 0.05, 0.7))
                .lastTrained(T0)
                .build();
        modelStore.save(model);

        MlModelRecord broken = new MlModelRecord();
        broken.setModelName("broken");
        broken.setModelType(DetectionModel.RANDOM_FOREST);
        broken.setMetricPatterns("[\"network\"]");
        broken.setFeatureNames("[]");
        broken.setModelData(new byte[] {1, 2, 3});
        broken.setScalerData(new byte[] {4, 5, 6});
        mlModelRepository.save(broken);

        List<DetectionModel> restored = modelStore.loadAll();

        assertEquals(1, restored.size());
        DetectionModel loaded = restored.get(0);
        assertEquals("isolation_forest_performance", loaded.getModelName());
        assertEquals(List.of("hour", "value", "z_score"), loaded.getFeatureNames());
        assertTrue(loaded.appliesTo("cpu_usage_percent"));
        Map<String, Double> features = Map.of("hour", 6.0, "value", 4.0, "z_score", -5.0);
        assertEquals(model.score(features), loaded.score(features), 1e-12);
    }

    @Test
    void storedRandomForestKeepsPosteriorAndImportance() {
        Random random = new Random(5);
        double[][] data = new double[200][2];
        int[] labels = new int[data.length];
        for (int i = 0; i < data.length; i++) {
            data[i][0] = random.nextGaussian();
            data[i][1] = random.nextGaussian();
            labels[i] = data[i][0] > 1.0 ? 1 : 0;
        }
        List<String> featureNames = List.of("value", "z_score");
        FeatureScaler scaler = FeatureScaler.robust(data);
        RandomForestScorer scorer = RandomForestScorer.fit(scaler.transform(data), labels, featureNames, 50, 42L);
        DetectionModel model = DetectionModel.builder()
                .modelType(DetectionModel.RANDOM_FOREST)
                .modelName("random_forest_performance")
                .metricPatterns(new ArrayList<>(List.of("performance")))
                .featureNames(new ArrayList<>(featureNames))
                .scaler(scaler)
                .scorer(scorer)
                .trainingAccuracy(0.95)
                .lastTrained(T0)
                .featureImportance(scorer.featureImportance())
                .build();
        modelStore.save(model);

        DetectionModel loaded = modelStore.loadAll().get(0);

        assertEquals(DetectionModel.RANDOM_FOREST, loaded.getModelType());
        assertEquals(0.95, loaded.getTrainingAccuracy(), 0.0);
        assertEquals(model.getFeatureImportance().keySet(), loaded.getFeatureImportance().keySet());
        for (Map<String, Double> features : List.of(
                Map.of("value", 3.0, "z_score", 0.0),
                Map.of("value", -1.0, "z_score", 0.5))) {
            assertEquals(model.score(features), loaded.score(features), 1e-12);
        }
    }

    private static AnomalyDetection anomaly(String id, String metric, AnomalyType type,
                                            AnomalySeverity severity, LocalDateTime timestamp) {
        return AnomalyDetection.builder()
                .id(id)
                .timestamp(timestamp)
                .anomalyType(type)
                .severity(severity)
                .metricName(metric)
                .source("node-1")
                .observedValue(80.0)
                .expectedValue(50.0)
                .deviationScore(4.2)
                .confidence(0.8)
                .description("test anomaly")
                .build();
    }

    private static MetricPoint point(String metric, double value, LocalDateTime timestamp) {
        return MetricPoint.builder()
                .timestamp(timestamp)
                .metricName(metric)
                .value(value)
                .source("node-1")
                .metadata(new HashMap<>(Map.of("node", "worker-1")))
                .build();
    }
}
