package com.delta.requesttimer.schedule.model;

public record NotificationSettings(
    boolean enabled,
    String serverAddress,
    int port,
    long delayMs,
    boolean notifyOnSuccess,
    boolean notifyOnFailure,
    boolean notifyOnResponseChange,
    boolean notifyOnUnchanged,
    int maxResponseSizeBytes
) {
    public NotificationSettings {
        serverAddress = serverAddress == null || serverAddress.isBlank() ? "localhost" : serverAddress.trim();
        delayMs = Math.max(0, delayMs);
        maxResponseSizeBytes = Math.max(0, maxResponseSizeBytes);
    }
}
