package com.synos.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.util.Locale;

/**
 * baseline 집계 단위
 */
public enum TimeWindow {
    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7));

    private final Duration duration;

    TimeWindow(Duration duration) {
        this.duration = duration;
    }

    public Duration getDuration() {
        return duration;
    }

    @JsonValue
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TimeWindow fromString(String value) {
        if (value == null) {
            return null;
        }
        for (TimeWindow window : values()) {
            if (window.name().equalsIgnoreCase(value)) {
                return window;
            }
        }
        throw new IllegalArgumentException("Unknown TimeWindow: " + value);
    }
}
