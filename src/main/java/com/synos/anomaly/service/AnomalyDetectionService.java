package com.synos.anomaly.service;

import com.synos.anomaly.config.AnomalyDetectorProperties;
import com.synos.anomaly.dto.AnomalyStatistics;
import com.synos.anomaly.dto.MetricPointRequest;
import com.synos.anomaly.dto.ModelSummary;
import com.synos.anomaly.dto.TrainingResult;
import com.synos.anomaly.entity.AnomalyRecord;
import com.synos.anomaly.exception.AnomalyNotFoundException;
import com.synos.anomaly.ml.DetectionModel;
import com.synos.anomaly.model.AnomalyDetection;
import com.synos.anomaly.model.BaselineProfile;
import com.synos.anomaly.model.MetricPoint;
import com.synos.anomaly.model.TrainingSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;

/**
 * 이상탐지 서비스
 * 통계 / ML / 도메인 휴리스틱 탐지를 조합하고 결과를 저장, 기록, 전파
 */
@Service
public class AnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetectionService.class);

    // false positive 확률 계산 상수
    private static final double BASE_FALSE_POSITIVE = 0.1;
    private static final double MAX_FALSE_POSITIVE = 0.9;

    private final AnomalyDetectorProperties properties;
    private final MetricBaselineService baselineService;
    private final StatisticalAnomalyDetector statisticalDetector;
    private final MlAnomalyDetector mlDetector;
    private final DomainHeuristicDetector heuristicDetector;
    private final FalsePositiveTracker falsePositiveTracker;
    private final AnomalyRecordService anomalyRecordService;
    private final MetricSampleService metricSampleService;
    private final MlModelStore mlModelStore;
    private final AnomalyNotificationService notificationService;
    private final Clock clock;

    // 최근 탐지 결과 (오래된 것부터 제거)
    private final Deque<AnomalyDetection> recentAnomalies = new ArrayDeque<>();

    public AnomalyDetectionService(AnomalyDetectorProperties properties,
                                   MetricBaselineService baselineService,
                                   StatisticalAnomalyDetector statisticalDetector,
                                   MlAnomalyDetector mlDetector,
                                   DomainHeuristicDetector heuristicDetector,
                                   FalsePositiveTracker falsePositiveTracker,
                                   AnomalyRecordService anomalyRecordService,
                                   MetricSampleService metricSampleService,
                                   MlModelStore mlModelStore,
                                   AnomalyNotificationService notificationService,
                                   Clock clock) {
        this.properties = properties;
        this.baselineService = baselineService;
        this.statisticalDetector = statisticalDetector;
        this.mlDetector = mlDetector;
        this.heuristicDetector = heuristicDetector;
        this.falsePositiveTracker = falsePositiveTracker;
        this.anomalyRecordService = anomalyRecordService;
        this.metricSampleService = metricSampleService;
        this.mlModelStore = mlModelStore;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    /**
     * 저장된 baseline과 ML 모델을 메모리로 복원
     */
    @EventListener(ApplicationReadyEvent.class)
    public void restoreState() {
        try {
            baselineService.restoreBaselines();
        } catch (Exception e) {
            log.error("baseline 복원 중 에러 발생", e);
        }
        try {
            List<DetectionModel> models = mlModelStore.loadAll();
            models.forEach(mlDetector::putModel);
            log.info("ML 모델 복원 완료: {}개", models.size());
        } catch (Exception e) {
            log.error("ML 모델 복원 중 에러 발생", e);
        }
    }

    public List<AnomalyDetection> ingest(MetricPointRequest request) {
        return ingest(toPoint(request));
    }

    public List<AnomalyDetection> ingestBatch(List<MetricPointRequest> requests) {
        // 전체를 먼저 검증해서 일부만 처리되는 일이 없도록 함
        List<MetricPoint> points = requests.stream().map(this::toPoint).toList();
        List<AnomalyDetection> anomalies = new ArrayList<>();
        for (MetricPoint point : points) {
            anomalies.addAll(ingest(point));
        }
        return anomalies;
    }

    /**
     * 메트릭 한 건 처리: 저장 -> 탐지 -> 결과 처리 -> history 반영
     */
    public List<AnomalyDetection> ingest(MetricPoint point) {
        try {
            metricSampleService.storeMetric(point);
        } catch (Exception e) {
            log.warn("메트릭 저장 실패: metric={}, source={}, error={}",
                    point.getMetricName(), point.getSource(), e.getMessage());
        }

        List<AnomalyDetection> anomalies = detectAnomalies(point);
        for (AnomalyDetection anomaly : anomalies) {
            processAnomaly(anomaly);
        }

        baselineService.addMetricPoint(point);
        return anomalies;
    }

    /**
     * 통계(stale하지 않은 hourly baseline) -> ML -> 도메인 휴리스틱 순서로 탐지
     */
    public List<AnomalyDetection> detectAnomalies(MetricPoint point) {
        List<AnomalyDetection> anomalies = new ArrayList<>();
        BaselineProfile baseline = baselineService
                .getBaseline(point.getMetricName(), point.getSource())
                .orElse(null);

        if (baseline != null && !baselineService.isBaselineStale(baseline)) {
            statisticalDetector.detect(point, baseline).ifPresent(anomalies::add);
        }

        try {
            mlDetector.detectAnomaly(point, baseline).ifPresent(anomalies::add);
        } catch (Exception e) {
            log.debug("ML 탐지 실패: metric={}, error={}", point.getMetricName(), e.getMessage());
        }

        anomalies.addAll(heuristicDetector.detect(point, baseline));
        return anomalies;
    }

    void processAnomaly(AnomalyDetection anomaly) {
        anomaly.setFalsePositiveProbability(calculateFalsePositiveProbability(anomaly));

        try {
            anomalyRecordService.save(anomaly);
        } catch (Exception e) {
            log.warn("이상탐지 결과 저장 실패: id={}, error={}", anomaly.getId(), e.getMessage());
        }

        synchronized (recentAnomalies) {
            recentAnomalies.addLast(anomaly);
            while (recentAnomalies.size() > properties.getRecentCapacity()) {
                recentAnomalies.removeFirst();
            }
        }

        logAnomaly(anomaly);
        notificationService.sendAnomalyNotification(anomaly);
    }

    double calculateFalsePositiveProbability(AnomalyDetection anomaly) {
        double probability = BASE_FALSE_POSITIVE;

        long history = falsePositiveTracker.getCount(anomaly.falsePositiveKey());
        if (history > 5) {
            probability += 0.3;
        } else if (history > 2) {
            probability += 0.1;
        }

        // confidence가 낮을수록 false positive 가능성 증가
        probability += (1.0 - anomaly.getConfidence()) * 0.2;
        return Math.min(MAX_FALSE_POSITIVE, probability);
    }

    private void logAnomaly(AnomalyDetection anomaly) {
        String message = String.format("[%s] %s anomaly: metric=%s, source=%s, observed=%.4f, expected=%.4f - %s",
                anomaly.getSeverity(), anomaly.getAnomalyType().value(), anomaly.getMetricName(),
                anomaly.getSource(), anomaly.getObservedValue(), anomaly.getExpectedValue(),
                anomaly.getDescription());
        switch (anomaly.getSeverity()) {
            case CRITICAL, HIGH -> log.error(message);
            case MEDIUM -> log.warn(message);
            default -> log.info(message);
        }
    }

    /**
     * false positive 표시: 카운터 증가 + 레코드 갱신
     */
    public AnomalyDetection markFalsePositive(String anomalyId) {
        AnomalyRecord record = anomalyRecordService.markFalsePositive(anomalyId);
        AnomalyDetection anomaly = anomalyRecordService.toDetection(record);
        long count = falsePositiveTracker.increment(anomaly.falsePositiveKey());
        log.info("false positive 표시: id={}, key={}, count={}", anomalyId, anomaly.falsePositiveKey(), count);
        return anomaly;
    }

    public AnomalyDetection acknowledge(String anomalyId) {
        AnomalyRecord record = anomalyRecordService.acknowledge(anomalyId);
        log.info("이상탐지 확인 처리: id={}", anomalyId);
        return anomalyRecordService.toDetection(record);
    }

    public AnomalyDetection getAnomaly(String anomalyId) {
        return anomalyRecordService.getById(anomalyId)
                .map(anomalyRecordService::toDetection)
                .orElseThrow(() -> new AnomalyNotFoundException(anomalyId));
    }

    /**
     * @return 최근 limit개 (오래된 것부터)
     */
    public List<AnomalyDetection> getRecentAnomalies(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        synchronized (recentAnomalies) {
            List<AnomalyDetection> all = new ArrayList<>(recentAnomalies);
            return new ArrayList<>(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    public AnomalyStatistics getStatistics() {
        List<AnomalyDetection> snapshot;
        synchronized (recentAnomalies) {
            snapshot = new ArrayList<>(recentAnomalies);
        }

        Map<String, Long> severityDistribution = new TreeMap<>();
        Map<String, Long> typeDistribution = new TreeMap<>();
        for (AnomalyDetection anomaly : snapshot) {
            severityDistribution.merge(anomaly.getSeverity().name(), 1L, Long::sum);
            typeDistribution.merge(anomaly.getAnomalyType().value(), 1L, Long::sum);
        }

        return AnomalyStatistics.builder()
                .totalAnomalies(snapshot.size())
                .severityDistribution(severityDistribution)
                .typeDistribution(typeDistribution)
                .baselinesCount(baselineService.baselineCount())
                .mlModelsCount(mlDetector.modelCount())
                .falsePositiveRate((double) falsePositiveTracker.getTotal() / Math.max(1, snapshot.size()))
                .build();
    }

    /**
     * 저장된 메트릭으로 ML 모델 학습 후 저장
     */
    public TrainingResult trainMlModels() {
        List<TrainingSample> trainingData = metricSampleService.loadTrainingData();
        if (trainingData.size() <= properties.getMl().getMinTrainingSamples()) {
            log.warn("ML 학습 건너뜀: 학습 데이터 {}개", trainingData.size());
            return new TrainingResult("skipped", trainingData.size(), List.of());
        }

        List<DetectionModel> models = mlDetector.trainModels(trainingData);
        List<ModelSummary> summaries = new ArrayList<>();
        for (DetectionModel model : models) {
            try {
                mlModelStore.save(model);
            } catch (Exception e) {
                log.error("ML 모델 저장 실패: name={}", model.getModelName(), e);
            }
            summaries.add(ModelSummary.from(model));
        }
        log.info("ML 학습 완료: samples={}, models={}", trainingData.size(), models.size());
        return new TrainingResult("trained", trainingData.size(), summaries);
    }

    /**
     * 주기적 재학습 (anomaly.ml.scheduled-training=true 일 때만)
     */
    @Scheduled(fixedDelayString = "${anomaly.ml.training-interval-ms:3600000}",
            initialDelayString = "${anomaly.ml.training-interval-ms:3600000}")
    public void scheduledTraining() {
        if (!properties.getMl().isScheduledTraining()) {
            return;
        }
        try {
            trainMlModels();
        } catch (Exception e) {
            log.error("주기적 ML 학습 실패", e);
        }
    }

    MetricPoint toPoint(MetricPointRequest request) {
        if (request.getMetricName() == null || request.getMetricName().isBlank()) {
            throw new IllegalArgumentException("metric_name is required");
        }
        if (request.getSource() == null || request.getSource().isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
        if (request.getValue() == null || !Double.isFinite(request.getValue())) {
            throw new IllegalArgumentException("value must be a finite number");
        }
        return MetricPoint.builder()
                .timestamp(request.getTimestamp() != null ? request.getTimestamp() : LocalDateTime.now(clock))
                .metricName(request.getMetricName())
                .value(request.getValue())
                .source(request.getSource())
                .metadata(request.getMetadata() != null ? new HashMap<>(request.getMetadata()) : new HashMap<>())
                .build();
    }
}
