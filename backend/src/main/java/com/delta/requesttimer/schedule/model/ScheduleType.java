package com.delta.requesttimer.schedule.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScheduleType {
    INTERVAL("interval"),
    CRON("cron");

    private final String value;

    ScheduleType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Returns null for values that name no schedule type so callers can report the raw input.
     */
    @JsonCreator
    public static ScheduleType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ScheduleType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
