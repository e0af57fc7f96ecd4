package com.delta.requesttimer.schedule.service;

import com.delta.requesttimer.config.TimerProperties;
import com.delta.requesttimer.schedule.model.JobConfig;
import com.delta.requesttimer.schedule.model.ScheduleRequest;
import com.delta.requesttimer.schedule.model.ScheduleType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link JobConfig} values from configuration entries and API requests, filling omitted
 * timeout and retry settings from the global HTTP defaults. The result is not validated here.
 */
@Component
public class JobConfigFactory {
    private final TimerProperties properties;
    private final ObjectMapper objectMapper;

    public JobConfigFactory(TimerProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public JobConfig fromDefinition(TimerProperties.ScheduleDefinition definition) {
        JsonNode body = null;
        if (definition.getJsonBody() != null) {
            body = objectMapper.valueToTree(definition.getJsonBody());
        } else if (definition.getBody() != null) {
            body = TextNode.valueOf(definition.getBody());
        }
        return build(
            definition.getId(),
            definition.getName(),
            definition.getUrl(),
            definition.getMethod(),
            definition.getHeaders(),
            body,
            definition.getScheduleType(),
            definition.getIntervalSeconds(),
            definition.getCronExpression(),
            definition.getTimeoutSeconds(),
            definition.getRetryCount(),
            definition.getRetryDelaySeconds(),
            definition.isEnabled()
        );
    }

    public JobConfig fromRequest(ScheduleRequest request) {
        if (request == null) {
            throw new ConfigValidationException("Schedule configuration is missing");
        }
        return build(
            request.id(),
            request.name(),
            request.url(),
            request.method(),
            request.headers(),
            request.body() == null || request.body().isNull() ? null : request.body(),
            request.scheduleType(),
            request.intervalSeconds(),
            request.cronExpression(),
            request.timeoutSeconds(),
            request.retryCount(),
            request.retryDelaySeconds(),
            request.enabled() == null || request.enabled()
        );
    }

    private JobConfig build(
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
        boolean enabled
    ) {
        TimerProperties.Http http = properties.getHttp();
        return new JobConfig(
            id == null ? null : id.trim(),
            name,
            url == null ? null : url.trim(),
            method == null ? null : method.trim().toUpperCase(Locale.ROOT),
            sanitizeHeaders(headers),
            body,
            ScheduleType.fromValue(scheduleType),
            intervalSeconds,
            cronExpression == null ? null : cronExpression.trim(),
            timeoutSeconds == null ? http.getDefaultTimeoutSeconds() : timeoutSeconds,
            retryCount == null ? http.getDefaultRetryCount() : retryCount,
            retryDelaySeconds == null ? http.getDefaultRetryDelaySeconds() : retryDelaySeconds,
            enabled
        );
    }

    private static Map<String, String> sanitizeHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return Map.of();
        }
        Map<String, String> cleaned = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                continue;
            }
            cleaned.put(entry.getKey().trim(), entry.getValue() == null ? "" : entry.getValue());
        }
        return cleaned;
    }
}
