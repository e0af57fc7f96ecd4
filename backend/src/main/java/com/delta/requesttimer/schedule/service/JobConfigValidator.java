package com.delta.requesttimer.schedule.service;

import com.delta.requesttimer.schedule.model.JobConfig;
import com.delta.requesttimer.schedule.model.ScheduleType;
import com.delta.requesttimer.schedule.util.CronSchedules;

import java.util.Locale;
import java.util.Set;

public final class JobConfigValidator {
    private static final Set<String> SUPPORTED_METHODS = Set.of("GET", "POST", "PUT", "DELETE", "PATCH", "HEAD", "OPTIONS");
    // managed by java.net.http.HttpClient, which refuses to set them
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private JobConfigValidator() {
    }

    /**
     * Throws {@link ConfigValidationException} describing the first problem found.
     */
    public static void validate(JobConfig config) {
        if (config == null) {
            throw new ConfigValidationException("Schedule configuration is missing");
        }
        requireText(config.id(), "id");
        requireText(config.url(), "url");
        requireText(config.method(), "method");

        String url = config.url().trim();
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            throw new ConfigValidationException("Invalid URL format: " + url);
        }
        String method = config.method().trim().toUpperCase(Locale.ROOT);
        if (!SUPPORTED_METHODS.contains(method)) {
            throw new ConfigValidationException("Unsupported HTTP method: " + method);
        }
        for (String header : config.headers().keySet()) {
            if (RESTRICTED_HEADERS.contains(header.trim().toLowerCase(Locale.ROOT))) {
                throw new ConfigValidationException("Restricted HTTP header: " + header);
            }
        }

        if (config.scheduleType() == null) {
            throw new ConfigValidationException("Required field 'schedule_type' is missing or unsupported");
        }
        if (config.scheduleType() == ScheduleType.INTERVAL) {
            if (config.intervalSeconds() == null || config.intervalSeconds() <= 0) {
                throw new ConfigValidationException("interval_seconds must be a positive number for interval schedule");
            }
        } else {
            if (config.cronExpression() == null || config.cronExpression().isBlank()) {
                throw new ConfigValidationException("cron_expression is required for cron schedule");
            }
            try {
                CronSchedules.parse(config.cronExpression());
            } catch (IllegalArgumentException e) {
                throw new ConfigValidationException("Invalid cron expression: " + e.getMessage(), e);
            }
        }

        if (config.timeoutSeconds() <= 0) {
            throw new ConfigValidationException("timeout_seconds must be a positive number");
        }
        if (config.retryCount() < 0) {
            throw new ConfigValidationException("retry_count must not be negative");
        }
        if (config.retryDelaySeconds() < 0) {
            throw new ConfigValidationException("retry_delay_seconds must not be negative");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ConfigValidationException("Required field '" + field + "' is missing");
        }
    }
}
