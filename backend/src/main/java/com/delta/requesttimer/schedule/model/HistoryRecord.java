package com.delta.requesttimer.schedule.model;

import java.time.Instant;

public record HistoryRecord(
    long id,
    String requestId,
    String scheduleName,
    Instant timestamp,
    String url,
    String method,
    String headers,
    String requestBody,
    boolean success,
    Integer statusCode,
    Long responseTimeMs,
    String responseHeaders,
    String responseBody,
    String errorMessage,
    int attemptCount,
    Instant createdAt
) {
}
