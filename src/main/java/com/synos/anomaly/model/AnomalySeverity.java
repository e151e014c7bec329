package com.synos.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * 이상탐지 심각도 (level이 클수록 심각)
 */
public enum AnomalySeverity {
    LOW(1),
    MEDIUM(2),
    HIGH(3),
    CRITICAL(4);

    private final int level;

    AnomalySeverity(int level) {
        this.level = level;
    }

    public int getLevel() {
        return level;
    }

    @JsonCreator
    public static AnomalySeverity fromString(String value) {
        if (value == null) {
            return null;
        }
        for (AnomalySeverity severity : values()) {
            if (severity.name().equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown AnomalySeverity: " + value);
    }
}
