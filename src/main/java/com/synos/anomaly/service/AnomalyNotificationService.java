package com.synos.anomaly.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.synos.anomaly.model.AnomalyDetection;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 이상탐지 알림 서비스
 * 탐지 결과를 STOMP /topic/anomalies 로 브로드캐스트
 */
@Service
public class AnomalyNotificationService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyNotificationService.class);

    public static final String ANOMALY_TOPIC = "/topic/anomalies";

    private final SimpMessagingTemplate messagingTemplate;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean isShuttingDown = new AtomicBoolean(false);

    public AnomalyNotificationService(SimpMessagingTemplate messagingTemplate, ObjectMapper objectMapper) {
        this.messagingTemplate = messagingTemplate;
        this.objectMapper = objectMapper;
    }

    @PreDestroy
    public void shutdown() {
        isShuttingDown.set(true);
        log.info("AnomalyNotificationService 종료 중 - 새로운 알림 전송 중단");
    }

    public void sendAnomalyNotification(AnomalyDetection anomaly) {
        // 애플리케이션 종료 중이면 알림 전송 중단
        if (isShuttingDown.get()) {
            log.debug("애플리케이션 종료 중 - 알림 전송 건너뜀: id={}", anomaly.getId());
            return;
        }

        try {
            // snake_case JSON 형태로 변환해서 전송
            Map<String, Object> payload = objectMapper.convertValue(anomaly, new TypeReference<Map<String, Object>>() {});
            payload.put("type", "anomaly_notification");
            messagingTemplate.convertAndSend(ANOMALY_TOPIC, payload);
            log.debug("이상탐지 알림 전송: id={}, metric={}, severity={}",
                    anomaly.getId(), anomaly.getMetricName(), anomaly.getSeverity());
        } catch (Exception e) {
            log.warn("이상탐지 알림 전송 실패: id={}, error={}", anomaly.getId(),
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }
}
