package com.delta.requesttimer.schedule.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

public record RequestResult(
    String requestId,
    Instant timestamp,
    int attempt,
    boolean success,
    Integer statusCode,
    JsonNode responseBody,
    Map<String, String> responseHeaders,
    Long responseTimeMs,
    String url,
    String method,
    String error
) {
    public static RequestResult success(
        String requestId,
        Instant timestamp,
        int attempt,
        int statusCode,
        JsonNode responseBody,
        Map<String, String> responseHeaders,
        long responseTimeMs,
        String url,
        String method
    ) {
        return new RequestResult(
            requestId,
            timestamp,
            attempt,
            true,
            statusCode,
            responseBody,
            responseHeaders == null ? Map.of() : Map.copyOf(responseHeaders),
            responseTimeMs,
            url,
            method,
            null
        );
    }

    public static RequestResult failure(String requestId, Instant timestamp, int attempt, String error) {
        return new RequestResult(
            requestId,
            timestamp,
            attempt,
            false,
            null,
            null,
            null,
            null,
            null,
            null,
            error == null || error.isBlank() ? "Unknown error" : error
        );
    }
}
