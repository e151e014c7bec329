package com.synos.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AnomalyType {
    STATISTICAL,
    BEHAVIORAL,
    TEMPORAL,
    NETWORK,
    PROCESS,
    FILESYSTEM,
    PERFORMANCE,
    SECURITY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AnomalyType fromString(String value) {
        if (value == null) {
            return null;
        }
        for (AnomalyType type : values()) {
            if (type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown AnomalyType: " + value);
    }
}
