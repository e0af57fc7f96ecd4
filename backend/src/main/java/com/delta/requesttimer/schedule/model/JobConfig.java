package com.delta.requesttimer.schedule.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Validated request and schedule settings of one job. Replaced as a whole on update.
 *
 * <p>{@code body} is null when no body is sent, a text node for verbatim bodies and an
 * object node for structured JSON bodies.
 */
public record JobConfig(
    String id,
    String name,
    String url,
    String method,
    Map<String, String> headers,
    JsonNode body,
    ScheduleType scheduleType,
    Long intervalSeconds,
    String cronExpression,
    int timeoutSeconds,
    int retryCount,
    int retryDelaySeconds,
    boolean enabled
) {
    public JobConfig {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}
