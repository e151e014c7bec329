package com.synos.anomaly.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.synos.anomaly.config.AnomalyDetectorProperties;
import com.synos.anomaly.entity.BaselineRecord;
import com.synos.anomaly.model.BaselineProfile;
import com.synos.anomaly.model.MetricPoint;
import com.synos.anomaly.model.TimeWindow;
import com.synos.anomaly.repository.BaselineRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 메트릭 baseline 관리 서비스
 * 메트릭/소스별 history를 유지하고 시간 윈도우(hourly/daily/weekly)별 통계 baseline을 계산
 */
@Service
@Slf4j
public class MetricBaselineService {

    // 메트릭별 히스토리: key = "metric_source"
    private final Map<String, Deque<MetricPoint>> metricHistory = new ConcurrentHashMap<>();

    // 누적 추가 개수 (history 상한과 무관하게 갱신 주기 판단)
    private final Map<String, AtomicLong> addedCounts = new ConcurrentHashMap<>();

    // baseline: key = "metric_source_window"
    private final Map<String, BaselineProfile> baselines = new ConcurrentHashMap<>();

    private final AnomalyDetectorProperties.Baseline config;
    private final BaselineRepository baselineRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MetricBaselineService(AnomalyDetectorProperties properties,
                                 BaselineRepository baselineRepository,
                                 ObjectMapper objectMapper,
                                 Clock clock) {
        this.config = properties.getBaseline();
        this.baselineRepository = baselineRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * history에 값을 추가하고 누적 update-every개마다 baseline 갱신
     */
    public void addMetricPoint(MetricPoint point) {
        String key = point.seriesKey();
        Deque<MetricPoint> history = metricHistory.computeIfAbsent(key, k -> new ArrayDeque<>());

        synchronized (history) {
            history.addLast(point);
            // 최대 크기 제한
            if (history.size() > config.getHistorySize()) {
                history.removeFirst();
            }
        }

        long added = addedCounts.computeIfAbsent(key, k -> new AtomicLong()).incrementAndGet();
        if (added % config.getUpdateEvery() == 0) {
            updateBaseline(point.getMetricName(), point.getSource());
        }
    }

    /**
     * 모든 윈도우의 baseline 재계산
     * history가 min-history 미만이면 아무것도 하지 않음
     */
    public void updateBaseline(String metricName, String source) {
        Deque<MetricPoint> history = metricHistory.get(metricName + "_" + source);
        if (history == null) {
            return;
        }

        List<MetricPoint> snapshot;
        synchronized (history) {
            snapshot = new ArrayList<>(history);
        }
        if (snapshot.size() < config.getMinHistory()) {
            return;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        for (TimeWindow window : TimeWindow.values()) {
            LocalDateTime cutoff = now.minus(window.getDuration().multipliedBy(config.getWindowPeriods()));
            List<MetricPoint> windowPoints = snapshot.stream()
                    .filter(p -> !p.getTimestamp().isBefore(cutoff))
                    .toList();

            if (windowPoints.size() < config.getMinWindowSamples()) {
                continue;
            }

            double[] values = windowPoints.stream().mapToDouble(MetricPoint::getValue).toArray();
            BaselineProfile baseline = BaselineStatistics.summarize(values);
            baseline.setMetricName(metricName);
            baseline.setSource(source);
            baseline.setTimeWindow(window);
            baseline.setLastUpdated(now);
            baseline.setSeasonalPatterns(
                    BaselineStatistics.seasonalPatterns(windowPoints, config.getSeasonalMinSamples()));

            baselines.put(baseline.key(), baseline);
            persistBaseline(baseline);
            log.debug("baseline 갱신: key={}, samples={}, mean={}, std={}",
                    baseline.key(), baseline.getSampleCount(), baseline.getMean(), baseline.getStd());
        }
    }

    public Optional<BaselineProfile> getBaseline(String metricName, String source) {
        return getBaseline(metricName, source, TimeWindow.HOURLY);
    }

    public Optional<BaselineProfile> getBaseline(String metricName, String source, TimeWindow window) {
        return Optional.ofNullable(baselines.get(metricName + "_" + source + "_" + window.key()));
    }

    public Collection<BaselineProfile> getAllBaselines() {
        return Collections.unmodifiableCollection(baselines.values());
    }

    public int baselineCount() {
        return baselines.size();
    }

    /**
     * 마지막 갱신 후 윈도우 길이의 2배가 지났으면 stale
     */
    public boolean isBaselineStale(BaselineProfile baseline) {
        Duration age = Duration.between(baseline.getLastUpdated(), LocalDateTime.now(clock));
        return age.compareTo(baseline.getTimeWindow().getDuration().multipliedBy(2)) > 0;
    }

    /**
     * 알려진 모든 메트릭/소스의 baseline 주기적 갱신
     */
    @Scheduled(fixedDelayString = "${anomaly.baseline.refresh-interval-ms:300000}",
            initialDelayString = "${anomaly.baseline.refresh-interval-ms:300000}")
    public void scheduledRefresh() {
        refreshAll();
    }

    /**
     * @return 갱신을 시도한 키 개수
     */
    public int refreshAll() {
        int refreshed = 0;
        for (Map.Entry<String, Deque<MetricPoint>> entry : metricHistory.entrySet()) {
            MetricPoint last;
            synchronized (entry.getValue()) {
                last = entry.getValue().peekLast();
            }
            if (last == null) {
                continue;
            }
            try {
                updateBaseline(last.getMetricName(), last.getSource());
                refreshed++;
            } catch (Exception e) {
                log.error("baseline 주기 갱신 실패: key={}", entry.getKey(), e);
            }
        }
        log.debug("baseline 주기 갱신 완료: {}개 키", refreshed);
        return refreshed;
    }

    /**
     * 저장된 baseline을 메모리로 복원
     * @return 복원된 개수
     */
    public int restoreBaselines() {
        int restored = 0;
        for (BaselineRecord record : baselineRepository.findAll()) {
            try {
                BaselineProfile baseline = fromRecord(record);
                baselines.put(baseline.key(), baseline);
                restored++;
            } catch (Exception e) {
                log.warn("baseline 복원 실패: key={}, error={}", record.getKey(), e.getMessage());
            }
        }
        log.info("baseline 복원 완료: {}개", restored);
        return restored;
    }

    /**
     * 히스토리 초기화 (테스트용 또는 메트릭 제거 시)
     */
    public void clearHistory(String metricName, String source) {
        metricHistory.remove(metricName + "_" + source);
        addedCounts.remove(metricName + "_" + source);
    }

    int historySize(String metricName, String source) {
        Deque<MetricPoint> history = metricHistory.get(metricName + "_" + source);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return history.size();
        }
    }

    private void persistBaseline(BaselineProfile baseline) {
        try {
            baselineRepository.save(toRecord(baseline));
        } catch (Exception e) {
            // 저장 실패해도 메모리 baseline은 유지
            log.warn("baseline 저장 실패: key={}, error={}", baseline.key(), e.getMessage());
        }
    }

    private BaselineRecord toRecord(BaselineProfile baseline) throws JsonProcessingException {
        BaselineRecord record = new BaselineRecord();
        record.setKey(baseline.key());
        record.setMetricName(baseline.getMetricName());
        record.setSource(baseline.getSource());
        record.setTimeWindow(baseline.getTimeWindow().key());
        record.setMean(baseline.getMean());
        record.setStd(baseline.getStd());
        record.setMedian(baseline.getMedian());
        record.setMad(baseline.getMad());
        record.setPercentiles(objectMapper.writeValueAsString(baseline.getPercentiles()));
        record.setMinValue(baseline.getMinValue());
        record.setMaxValue(baseline.getMaxValue());
        record.setSampleCount(baseline.getSampleCount());
        record.setLastUpdated(baseline.getLastUpdated());
        record.setSeasonalPatterns(objectMapper.writeValueAsString(baseline.getSeasonalPatterns()));
        return record;
    }

    private BaselineProfile fromRecord(BaselineRecord record) throws JsonProcessingException {
        Map<Integer, Double> percentiles = new TreeMap<>(objectMapper.readValue(
                record.getPercentiles(), new TypeReference<Map<Integer, Double>>() {}));
        Map<String, Double> seasonal = record.getSeasonalPatterns() != null
                ? objectMapper.readValue(record.getSeasonalPatterns(), new TypeReference<Map<String, Double>>() {})
                : new HashMap<>();

        return BaselineProfile.builder()
                .metricName(record.getMetricName())
                .source(record.getSource())
                .timeWindow(TimeWindow.fromString(record.getTimeWindow()))
                .mean(record.getMean())
                .std(record.getStd())
                .median(record.getMedian())
                .mad(record.getMad())
                .percentiles(percentiles)
                .minValue(record.getMinValue())
                .maxValue(record.getMaxValue())
                .sampleCount(record.getSampleCount())
                .lastUpdated(record.getLastUpdated())
                .seasonalPatterns(seasonal)
                .build();
    }
}
