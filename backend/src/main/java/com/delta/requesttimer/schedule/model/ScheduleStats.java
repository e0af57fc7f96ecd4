package com.delta.requesttimer.schedule.model;

import java.time.Instant;

public record ScheduleStats(
    String scheduleId,
    String scheduleName,
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    Instant lastRequestTime,
    Instant lastSuccessTime,
    Instant lastFailureTime,
    double averageResponseTimeMs,
    Instant updatedAt
) {
}
