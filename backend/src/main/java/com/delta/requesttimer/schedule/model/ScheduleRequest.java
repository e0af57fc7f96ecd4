package com.delta.requesttimer.schedule.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Job definition as submitted over the control API. Omitted timeout and retry fields take the
 * global HTTP defaults; omitted {@code enabled} means enabled.
 */
public record ScheduleRequest(
    String id,
    String name,
    String url,
    String method,
    Map<String, String> headers,
    JsonNode body,
    String scheduleType,
    Long intervalSeconds,
    String cronExpression,
    Integer timeoutSeconds,
    Integer retryCount,
    Integer retryDelaySeconds,
    Boolean enabled
) {
}
