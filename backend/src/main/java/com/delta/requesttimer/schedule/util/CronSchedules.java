package com.delta.requesttimer.schedule.util;

import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Cron parsing on top of Spring's six-field {@link CronExpression}. Five-field expressions
 * (minute first) fire at second zero.
 */
public final class CronSchedules {
    private CronSchedules() {
    }

    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("cron expression is empty");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        if (fields.length == 5) {
            trimmed = "0 " + trimmed;
        }
        return CronExpression.parse(trimmed);
    }

    /**
     * First grid instant strictly after {@code from}, or null when the expression never fires again.
     */
    public static Instant nextAfter(String expression, Instant from, ZoneId zone) {
        ZonedDateTime next = parse(expression).next(from.atZone(zone));
        return next == null ? null : next.toInstant();
    }
}
