package com.synos.anomaly.service;

import com.synos.anomaly.config.AnomalyDetectorProperties;
import com.synos.anomaly.ml.DetectionModel;
import com.synos.anomaly.ml.FeatureExtractor;
import com.synos.anomaly.ml.FeatureScaler;
import com.synos.anomaly.ml.IsolationForestScorer;
import com.synos.anomaly.ml.MetricTypeClassifier;
import com.synos.anomaly.ml.RandomForestScorer;
import com.synos.anomaly.ml.TypedFeatureExtractor;
import com.synos.anomaly.model.AnomalyDetection;
import com.synos.anomaly.model.AnomalySeverity;
import com.synos.anomaly.model.AnomalyType;
import com.synos.anomaly.model.BaselineProfile;
import com.synos.anomaly.model.MetricPoint;
import com.synos.anomaly.model.TrainingSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * ML 기반 이상탐지
 * metric type별로 Isolation Forest(비지도)와 Random Forest(지도, 라벨이 있을 때)를 학습
 */
@Service
@Slf4j
public class MlAnomalyDetector {

    private static final double LOG_FLOOR = 1e-8;

    private final AnomalyDetectorProperties.Ml config;
    private final Clock clock;

    private final Map<String, DetectionModel> models = new ConcurrentHashMap<>();
    private final Map<String, FeatureExtractor> featureExtractors = new ConcurrentHashMap<>();

    public MlAnomalyDetector(AnomalyDetectorProperties properties,
                             List<TypedFeatureExtractor> extractors,
                             Clock clock) {
        this.config = properties.getMl();
        this.clock = clock;
        for (TypedFeatureExtractor extractor : extractors) {
            registerFeatureExtractor(extractor.metricType(), extractor);
        }
    }

    public void registerFeatureExtractor(String metricType, FeatureExtractor extractor) {
        featureExtractors.put(metricType, extractor);
        log.debug("feature extractor 등록: metricType={}", metricType);
    }

    /**
     * metric type별 모델 학습
     * @return 이번에 학습된 모델 목록
     */
    public List<DetectionModel> trainModels(List<TrainingSample> trainingData) {
        if (trainingData.size() <= config.getMinTrainingSamples()) {
            log.warn("ML 학습 데이터 부족: {}개 ({}개 초과 필요)", trainingData.size(), config.getMinTrainingSamples());
            return List.of();
        }

        Map<String, List<TrainingSample>> groups = new TreeMap<>();
        for (TrainingSample sample : trainingData) {
            groups.computeIfAbsent(sample.getMetricType(), k -> new ArrayList<>()).add(sample);
        }

        List<DetectionModel> trained = new ArrayList<>();
        for (Map.Entry<String, List<TrainingSample>> group : groups.entrySet()) {
            if (group.getValue().size() < config.getMinGroupSamples()) {
                log.debug("학습 건너뜀: metricType={}, samples={}", group.getKey(), group.getValue().size());
                continue;
            }
            trained.addAll(trainModelGroup(group.getKey(), group.getValue()));
        }
        return trained;
    }

    private List<DetectionModel> trainModelGroup(String metricType, List<TrainingSample> samples) {
        List<DetectionModel> trained = new ArrayList<>();
        try {
            List<Map<String, Double>> rows = new ArrayList<>(samples.size());
            SortedSet<String> names = new TreeSet<>();
            for (TrainingSample sample : samples) {
                Map<String, Double> features = extractFeatures(sample.getPoint(), metricType);
                rows.add(features);
                names.addAll(features.keySet());
            }
            List<String> featureNames = new ArrayList<>(names);
            double[][] matrix = toMatrix(rows, featureNames);

            FeatureScaler scaler = FeatureScaler.standard(matrix);
            IsolationForestScorer forest = IsolationForestScorer.fit(
                    scaler.transform(matrix), config.getContamination(), config.getScoreThreshold());

            DetectionModel isolation = DetectionModel.builder()
                    .modelType(DetectionModel.ISOLATION_FOREST)
                    .modelName(DetectionModel.ISOLATION_FOREST + "_" + metricType)
                    .metricPatterns(List.of(metricType))
                    .featureNames(featureNames)
                    .scaler(scaler)
                    .scorer(forest)
                    .trainingAccuracy(1.0 - config.getContamination())
                    .lastTrained(LocalDateTime.now(clock))
                    .build();
            models.put(isolation.getModelName(), isolation);
            trained.add(isolation);

            int[] labels = samples.stream().mapToInt(s -> s.isAnomaly() ? 1 : 0).toArray();
            if (hasBothClasses(labels)) {
                DetectionModel supervised = trainSupervisedModel(metricType, matrix, labels, featureNames);
                if (supervised != null) {
                    trained.add(supervised);
                }
            }

            log.info("ML 모델 학습 완료: metricType={}, samples={}, features={}",
                    metricType, samples.size(), featureNames);
        } catch (Exception e) {
            log.error("ML 모델 학습 실패: metricType={}", metricType, e);
        }
        return trained;
    }

    private DetectionModel trainSupervisedModel(String metricType, double[][] matrix, int[] labels,
                                                List<String> featureNames) {
        try {
            // seed 고정 셔플 후 train/test 분할
            List<Integer> indices = new ArrayList<>();
            for (int i = 0; i < matrix.length; i++) {
                indices.add(i);
            }
            Collections.shuffle(indices, new Random(config.getSeed()));
            int testSize = Math.max(1, (int) Math.round(matrix.length * config.getTestFraction()));
            List<Integer> testIdx = indices.subList(0, testSize);
            List<Integer> trainIdx = indices.subList(testSize, indices.size());

            double[][] xTrain = select(matrix, trainIdx);
            int[] yTrain = select(labels, trainIdx);
            if (!hasBothClasses(yTrain)) {
                log.warn("지도학습 건너뜀: 학습 분할에 한 가지 라벨만 존재 (metricType={})", metricType);
                return null;
            }

            FeatureScaler scaler = FeatureScaler.robust(xTrain);
            RandomForestScorer scorer = RandomForestScorer.fit(
                    scaler.transform(xTrain), yTrain, featureNames, config.getTrees(), config.getSeed());

            int correct = 0;
            for (int i : testIdx) {
                if (scorer.predict(scaler.transform(matrix[i])) == labels[i]) {
                    correct++;
                }
            }
            double accuracy = (double) correct / testIdx.size();

            DetectionModel model = DetectionModel.builder()
                    .modelType(DetectionModel.RANDOM_FOREST)
                    .modelName(DetectionModel.RANDOM_FOREST + "_" + metricType)
                    .metricPatterns(List.of(metricType))
                    .featureNames(featureNames)
                    .scaler(scaler)
                    .scorer(scorer)
                    .trainingAccuracy(accuracy)
                    .lastTrained(LocalDateTime.now(clock))
                    .featureImportance(scorer.featureImportance())
                    .build();
            models.put(model.getModelName(), model);
            log.info("지도학습 모델 학습 완료: metricType={}, accuracy={}", metricType, String.format("%.3f", accuracy));
            return model;
        } catch (Exception e) {
            log.error("지도학습 모델 학습 실패: metricType={}", metricType, e);
            return null;
        }
    }

    /**
     * 적용 가능한 모델로 점수를 계산하고 최대 점수가 임계값을 넘으면 이상으로 판단
     */
    public Optional<AnomalyDetection> detectAnomaly(MetricPoint point, BaselineProfile baseline) {
        List<DetectionModel> applicable = models.values().stream()
                .filter(model -> model.appliesTo(point.getMetricName()))
                .sorted(Comparator.comparing(DetectionModel::getModelName))
                .toList();
        if (applicable.isEmpty()) {
            return Optional.empty();
        }

        Map<String, Double> features = extractFeatures(point, null);
        if (baseline != null) {
            features.putAll(baselineFeatures(point, baseline));
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (DetectionModel model : applicable) {
            try {
                double score = model.score(features);
                scores.put(model.getModelName(), Math.max(0.0, Math.min(1.0, score)));
            } catch (Exception e) {
                log.debug("모델 점수 계산 실패: model={}, error={}", model.getModelName(), e.getMessage());
            }
        }
        if (scores.isEmpty()) {
            return Optional.empty();
        }

        double maxScore = Collections.max(scores.values());
        double avgScore = scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        if (maxScore <= config.getScoreThreshold()) {
            return Optional.empty();
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("model_scores", scores);
        context.put("baseline_available", baseline != null);

        return Optional.of(AnomalyDetection.builder()
                .id(AnomalyDetection.newId("ml"))
                .timestamp(point.getTimestamp())
                .anomalyType(AnomalyType.BEHAVIORAL)
                .severity(determineSeverity(maxScore))
                .metricName(point.getMetricName())
                .source(point.getSource())
                .observedValue(point.getValue())
                .expectedValue(baseline != null ? baseline.getMean() : point.getValue())
                .deviationScore(maxScore)
                .confidence(avgScore)
                .description(String.format("ML anomaly detected with score %.2f", maxScore))
                .context(context)
                .build());
    }

    AnomalySeverity determineSeverity(double score) {
        if (score >= 0.9) {
            return AnomalySeverity.CRITICAL;
        } else if (score >= 0.8) {
            return AnomalySeverity.HIGH;
        } else if (score >= 0.7) {
            return AnomalySeverity.MEDIUM;
        }
        return AnomalySeverity.LOW;
    }

    /**
     * 기본 feature + metric type별 추가 feature
     * @param metricType null이면 메트릭 이름으로 분류
     */
    Map<String, Double> extractFeatures(MetricPoint point, String metricType) {
        Map<String, Double> features = new TreeMap<>();
        features.put("value", point.getValue());
        features.put("hour_of_day", (double) point.getTimestamp().getHour());
        // Monday = 0
        features.put("day_of_week", (double) (point.getTimestamp().getDayOfWeek().getValue() - 1));
        features.put("value_log", Math.log(Math.max(Math.abs(point.getValue()), LOG_FLOOR)));

        String type = metricType != null
                ? metricType
                : MetricTypeClassifier.classify(point.getMetricName());
        FeatureExtractor extractor = featureExtractors.get(type);
        if (extractor != null) {
            features.putAll(extractor.extract(point));
        }
        return features;
    }

    private Map<String, Double> baselineFeatures(MetricPoint point, BaselineProfile baseline) {
        Map<String, Double> features = new HashMap<>();
        double deviation = Math.abs(point.getValue() - baseline.getMean());
        features.put("deviation_from_mean", deviation);
        features.put("z_score", deviation / (baseline.getStd() + LOG_FLOOR));
        features.put("percentile_position", percentilePosition(point.getValue(), baseline));
        return features;
    }

    private double percentilePosition(double value, BaselineProfile baseline) {
        if (value <= baseline.percentile(5)) {
            return 0.05;
        } else if (value <= baseline.percentile(25)) {
            return 0.25;
        } else if (value <= baseline.percentile(75)) {
            return 0.75;
        } else if (value <= baseline.percentile(95)) {
            return 0.95;
        }
        return 0.99;
    }

    public void putModel(DetectionModel model) {
        models.put(model.getModelName(), model);
    }

    public Collection<DetectionModel> getModels() {
        return Collections.unmodifiableCollection(models.values());
    }

    public int modelCount() {
        return models.size();
    }

    private static double[][] toMatrix(List<Map<String, Double>> rows, List<String> featureNames) {
        double[][] matrix = new double[rows.size()][featureNames.size()];
        for (int r = 0; r < rows.size(); r++) {
            for (int c = 0; c < featureNames.size(); c++) {
                matrix[r][c] = rows.get(r).getOrDefault(featureNames.get(c), 0.0);
            }
        }
        return matrix;
    }

    private static boolean hasBothClasses(int[] labels) {
        boolean zero = false;
        boolean one = false;
        for (int label : labels) {
            zero |= label == 0;
            one |= label == 1;
        }
        return zero && one;
    }

    private static double[][] select(double[][] matrix, List<Integer> indices) {
        double[][] result = new double[indices.size()][];
        for (int i = 0; i < indices.size(); i++) {
            result[i] = matrix[indices.get(i)];
        }
        return result;
    }

    private static int[] select(int[] labels, List<Integer> indices) {
        int[] result = new int[indices.size()];
        for (int i = 0; i < indices.size(); i++) {
            result[i] = labels[indices.get(i)];
        }
        return result;
    }
}
