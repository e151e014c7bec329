package com.synos.anomaly.exception;

/**
 * 존재하지 않는 이상탐지 id 요청 (404)
 */
public class AnomalyNotFoundException extends RuntimeException {

    public AnomalyNotFoundException(String id) {
        super("Anomaly not found: " + id);
    }
}
