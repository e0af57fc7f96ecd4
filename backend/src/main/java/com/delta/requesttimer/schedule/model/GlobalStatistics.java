package com.delta.requesttimer.schedule.model;

public record GlobalStatistics(
    long totalRequests,
    long successfulRequests,
    long failedRequests,
    double successRate,
    long recent24hRequests
) {
    public static GlobalStatistics empty() {
        return new GlobalStatistics(0, 0, 0, 0.0, 0);
    }
}
