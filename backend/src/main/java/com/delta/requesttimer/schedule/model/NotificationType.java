package com.delta.requesttimer.schedule.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationType {
    FIRST_SUCCESS("first_success"),
    RESPONSE_CHANGED("response_changed"),
    UNCHANGED("success_no_change"),
    FAILURE("failure"),
    RECOVERY("recovery");

    private final String wireName;

    NotificationType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
