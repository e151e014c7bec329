package com.synos.anomaly.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 이상탐지 엔진 설정 (prefix = "anomaly")
 */
@Data
@Validated
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyDetectorProperties {

    /** 최근 이상탐지 결과를 메모리에 유지할 개수 */
    @Min(1)
    private int recentCapacity = 1000;

    @Valid
    private Baseline baseline = new Baseline();

    @Valid
    private Statistical statistical = new Statistical();

    @Valid
    private Ml ml = new Ml();

    @Valid
    private Heuristics heuristics = new Heuristics();

    @Valid
    private Collector collector = new Collector();

    @Data
    public static class Baseline {

        /** 메트릭/소스별 history 최대 길이 (오래된 값부터 제거) */
        @Min(1)
        private int historySize = 10000;

        /** history가 이 개수의 배수가 될 때마다 baseline 갱신 */
        @Min(1)
        private int updateEvery = 100;

        /** baseline 계산에 필요한 최소 history */
        @Min(2)
        private int minHistory = 30;

        /** 윈도우별 최소 샘플 수 (미만이면 해당 윈도우는 건너뜀) */
        @Min(1)
        private int minWindowSamples = 10;

        /** 윈도우 길이 x periods 만큼의 데이터를 사용 */
        @Min(1)
        private int windowPeriods = 7;

        /** 계절성 분석 최소 샘플 수 */
        @Min(1)
        private int seasonalMinSamples = 50;

        /** 주기적 baseline 갱신 간격 (ms) */
        @Min(1000)
        private long refreshIntervalMs = 300_000;
    }

    @Data
    public static class Statistical {

        private double zScoreThreshold = 3.0;
        private double zScoreHigh = 4.0;

        private double iqrMultiplier = 1.5;
        private double iqrHigh = 2.0;

        private double modifiedZThreshold = 3.5;
        private double modifiedZHigh = 5.0;

        @DecimalMin("0.0001")
        @DecimalMax("0.5")
        private double grubbsAlpha = 0.05;

        @Min(3)
        private int grubbsMinSamples = 7;

        private double grubbsHighFactor = 1.5;
    }

    @Data
    public static class Ml {

        /** 전체 학습 데이터가 이 개수를 넘어야 학습 */
        @Min(1)
        private int minTrainingSamples = 100;

        /** metric type 그룹별 최소 샘플 수 */
        @Min(1)
        private int minGroupSamples = 50;

        /** 학습 시 읽어오는 최근 메트릭 개수 */
        @Min(1)
        private int trainingLimit = 10000;

        /** metric과 anomaly를 같은 사건으로 볼 시간 간격 (초) */
        @Min(0)
        private long labelWindowSeconds = 60;

        @DecimalMin("0.001")
        @DecimalMax("0.5")
        private double contamination = 0.05;

        @Min(1)
        private int trees = 100;

        @DecimalMin("0.05")
        @DecimalMax("0.9")
        private double testFraction = 0.2;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double scoreThreshold = 0.7;

        private long seed = 42L;

        /** 주기적 재학습 여부 */
        private boolean scheduledTraining = false;

        private long trainingIntervalMs = 3_600_000;
    }

    @Data
    public static class Heuristics {

        /** connection_count 급증 판단 기준 (baseline 평균 + n sigma) */
        private double connectionSpikeSigma = 5.0;

        private double cpuCriticalPercent = 95.0;

        private double failedLoginThreshold = 10.0;
    }

    @Data
    public static class Collector {

        @Valid
        private Prometheus prometheus = new Prometheus();
    }

    @Data
    public static class Prometheus {

        private boolean enabled = false;

        private String baseUrl = "http://localhost:9090";

        private long intervalMs = 10_000;

        /** metricName -> PromQL */
        private Map<String, String> queries = new LinkedHashMap<>();
    }
}
