package com.delta.requesttimer.schedule.model;

import java.time.Instant;

public record JobStatus(
    String id,
    String name,
    boolean enabled,
    Instant nextRunTime,
    Instant lastRunTime,
    boolean running,
    long runCount,
    long errorCount,
    RequestResult lastResult,
    ScheduleType scheduleType,
    Long intervalSeconds,
    String cronExpression,
    String url,
    String method
) {
}
