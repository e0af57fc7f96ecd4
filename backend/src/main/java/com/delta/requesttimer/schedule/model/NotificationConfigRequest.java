package com.delta.requesttimer.schedule.model;

/**
 * Partial notifier settings as submitted over the control API. Null fields keep their current value.
 */
public record NotificationConfigRequest(
    Boolean enabled,
    String serverAddress,
    Integer port,
    Long delayMs,
    Boolean notifyOnSuccess,
    Boolean notifyOnFailure,
    Boolean notifyOnResponseChange,
    Boolean notifyOnUnchanged,
    Integer maxResponseSizeBytes
) {
    public NotificationSettings applyTo(NotificationSettings current) {
        return new NotificationSettings(
            enabled == null ? current.enabled() : enabled,
            serverAddress == null || serverAddress.isBlank() ? current.serverAddress() : serverAddress,
            port == null ? current.port() : port,
            delayMs == null ? current.delayMs() : delayMs,
            notifyOnSuccess == null ? current.notifyOnSuccess() : notifyOnSuccess,
            notifyOnFailure == null ? current.notifyOnFailure() : notifyOnFailure,
            notifyOnResponseChange == null ? current.notifyOnResponseChange() : notifyOnResponseChange,
            notifyOnUnchanged == null ? current.notifyOnUnchanged() : notifyOnUnchanged,
            maxResponseSizeBytes == null ? current.maxResponseSizeBytes() : maxResponseSizeBytes
        );
    }
}
