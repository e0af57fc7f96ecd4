package com.delta.requesttimer.schedule.model;

import java.time.Instant;

/**
 * History filter. Null fields do not filter; {@code from} and {@code to} are inclusive.
 */
public record HistoryQuery(
    String scheduleIdPrefix,
    Boolean success,
    Instant from,
    Instant to,
    int limit
) {
    public static HistoryQuery latest(int limit) {
        return new HistoryQuery(null, null, null, null, limit);
    }
}
