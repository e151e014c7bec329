package com.synos.anomaly.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.synos.anomaly.config.AnomalyDetectorProperties;
import lombok.Data;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Prometheus API 클라이언트 (instant query)
 */
@Component
@ConditionalOnProperty(prefix = "anomaly.collector.prometheus", name = "enabled", havingValue = "true")
public class PrometheusClient {

    private static final Logger log = LoggerFactory.getLogger(PrometheusClient.class);
    private final WebClient webClient;
    private final String baseUrl;

    public PrometheusClient(WebClient.Builder builder, AnomalyDetectorProperties properties) {
        this.baseUrl = properties.getCollector().getPrometheus().getBaseUrl();
        this.webClient = builder
                .baseUrl(baseUrl)
                .build();
        log.info("PrometheusClient 초기화 완료. Base URL: {}", baseUrl);
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrometheusResponse {
        private String status;
        private QueryData data;

        @Data
        @JsonIgnoreProperties(ignoreUnknown = true)
        public static class QueryData {
            // 전역 snake_case 설정과 무관하게 Prometheus 필드명 사용
            @JsonProperty("resultType")
            private String resultType;
            private List<Result> result;

            @Data
            @JsonIgnoreProperties(ignoreUnknown = true)
            public static class Result {
                private Map<String, String> metric;
                private List<Object> value; // [timestamp, value]
            }
        }
    }

    /**
     * Instant Query 실행
     */
    public Mono<PrometheusResponse> query(String promql) {
        log.debug("Prometheus instant query: {}", promql);
        // queryParam은 PromQL의 중괄호를 URI 템플릿 변수로 해석하므로 직접 인코딩
        URI uri = URI.create(baseUrl + "/api/v1/query?query="
                + URLEncoder.encode(promql, StandardCharsets.UTF_8).replace("+", "%20"));
        return webClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(PrometheusResponse.class)
                .timeout(Duration.ofSeconds(10))
                .doOnError(error -> log.error("Prometheus query 실패: {}", promql, error));
    }
}
