package com.synos.anomaly.controller;

import com.synos.anomaly.exception.AnomalyNotFoundException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 전역 예외 핸들러
 * 에러 응답 형식: {status: "error", message, error}
 * 서버 에러는 /topic/errors 로 실시간 알림 전송
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final SimpMessagingTemplate messagingTemplate;

    public GlobalExceptionHandler(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    @ExceptionHandler(AnomalyNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(AnomalyNotFoundException e) {
        log.debug("이상탐지 결과 없음: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("Anomaly not found", e.getMessage()));
    }

    /**
     * JSON 파싱 에러 처리 (400 Bad Request)
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException e) {
        log.warn("JSON 파싱 에러 발생: {}", e.getMessage());
        sendErrorNotification("JSON 파싱 에러", "Invalid JSON format: " + e.getMessage(), "BAD_REQUEST");
        return ResponseEntity.badRequest().body(error("Invalid JSON format", e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String details = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("요청 검증 실패: {}", details);
        return ResponseEntity.badRequest().body(error("Invalid request", details));
    }

    @ExceptionHandler({
            HandlerMethodValidationException.class,
            ConstraintViolationException.class,
            MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        log.warn("잘못된 요청: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error("Invalid request", e.getMessage()));
    }

    /**
     * 일반 예외 처리
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("예기치 않은 에러 발생", e);
        sendErrorNotification("서버 에러", "Internal server error: " + e.getMessage(), "INTERNAL_SERVER_ERROR");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error("Internal server error", e.getMessage()));
    }

    private Map<String, Object> error(String message, String detail) {
        Map<String, Object> error = new HashMap<>();
        error.put("status", "error");
        error.put("message", message);
        error.put("error", detail);
        return error;
    }

    /**
     * 프론트엔드로 에러 알림 전송 (이상탐지 알림과 별개)
     */
    private void sendErrorNotification(String title, String message, String type) {
        try {
            Map<String, Object> errorNotification = new HashMap<>();
            errorNotification.put("type", "error_notification");
            errorNotification.put("title", title);
            errorNotification.put("message", message);
            errorNotification.put("error_type", type);
            errorNotification.put("timestamp", LocalDateTime.now().toString());
            errorNotification.put("severity", "error");

            messagingTemplate.convertAndSend("/topic/errors", errorNotification);
            log.debug("에러 알림 전송: {}", title);
        } catch (Exception ex) {
            log.warn("에러 알림 전송 실패", ex);
        }
    }
}
