package com.delta.requesttimer.schedule.notify;

import com.delta.requesttimer.config.TimerProperties;
import com.delta.requesttimer.schedule.model.JobConfig;
import com.delta.requesttimer.schedule.model.NotificationSettings;
import com.delta.requesttimer.schedule.model.NotificationType;
import com.delta.requesttimer.schedule.model.NotifierStatistics;
import com.delta.requesttimer.schedule.model.RequestResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classifies each result against the previous response of the same job and queues a datagram
 * notification when the active settings ask for one.
 *
 * <p>Successful results are hashed and compared to the stored hash of that job: no stored hash
 * is a first success, a different hash a change, an equal hash unchanged. The new hash is stored
 * whether or not a notification goes out. Failures are deduplicated by job id and error message;
 * the next success of a job with open failure keys closes all of them and emits one recovery.
 */
@Service
public class ResponseChangeDetector {
    private static final Logger log = LoggerFactory.getLogger(ResponseChangeDetector.class);

    private final TimerProperties properties;
    private final ResponseHasher hasher;
    private final DebouncedNotificationSender sender;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Map<String, String> lastHashes = new ConcurrentHashMap<>();
    private final Set<FailureKey> openFailures = ConcurrentHashMap.newKeySet();
    private volatile NotificationSettings settings;

    public ResponseChangeDetector(
        TimerProperties properties,
        ResponseHasher hasher,
        DebouncedNotificationSender sender,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.properties = properties;
        this.hasher = hasher;
        this.sender = sender;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.settings = properties.getNotification().toSettings();
        sender.setDelayMs(settings.delayMs());
    }

    /**
     * Returns the classification of {@code result}, or empty when notifications are disabled.
     */
    public Optional<NotificationType> process(RequestResult result, JobConfig job) {
        NotificationSettings active = settings;
        if (!active.enabled()) {
            return Optional.empty();
        }
        if (result.success()) {
            return Optional.of(processSuccess(result, job, active));
        }
        processFailure(result, job, active);
        return Optional.of(NotificationType.FAILURE);
    }

    private NotificationType processSuccess(RequestResult result, JobConfig job, NotificationSettings active) {
        String currentHash = hasher.hash(result.responseBody());
        String previousHash = lastHashes.put(job.id(), currentHash);

        NotificationType type;
        boolean notify;
        if (previousHash == null) {
            type = NotificationType.FIRST_SUCCESS;
            notify = active.notifyOnSuccess();
        } else if (!previousHash.equals(currentHash)) {
            type = NotificationType.RESPONSE_CHANGED;
            notify = active.notifyOnResponseChange();
        } else {
            type = NotificationType.UNCHANGED;
            notify = active.notifyOnUnchanged();
        }
        log.debug("Job {} classified as {} (hash {})", job.id(), type.wireName(), currentHash);

        if (notify) {
            ObjectNode extra = objectMapper.createObjectNode();
            extra.put("is_first_run", previousHash == null);
            extra.put("is_response_changed", type == NotificationType.RESPONSE_CHANGED);
            extra.put("response_hash", currentHash);
            extra.put("previous_hash", previousHash);
            send(type, job, result, extra, active);
        }

        if (closeFailures(job.id())) {
            ObjectNode extra = objectMapper.createObjectNode();
            extra.put("message", "Schedule recovered from previous failures");
            log.info("Job {} recovered from previous failures", job.id());
            send(NotificationType.RECOVERY, job, result, extra, active);
        }
        return type;
    }

    private void processFailure(RequestResult result, JobConfig job, NotificationSettings active) {
        if (!active.notifyOnFailure()) {
            return;
        }
        FailureKey key = new FailureKey(job.id(), result.error());
        if (!openFailures.add(key)) {
            log.debug("Suppressing repeated failure notification for job {}: {}", job.id(), result.error());
            return;
        }
        ObjectNode extra = objectMapper.createObjectNode();
        extra.put("error_message", result.error());
        if (result.statusCode() == null) {
            extra.putNull("status_code");
        } else {
            extra.put("status_code", result.statusCode());
        }
        extra.put("attempt_count", result.attempt());
        send(NotificationType.FAILURE, job, result, extra, active);
    }

    private boolean closeFailures(String jobId) {
        return openFailures.removeIf(key -> key.jobId().equals(jobId));
    }

    private void send(
        NotificationType type,
        JobConfig job,
        RequestResult result,
        ObjectNode additionalData,
        NotificationSettings active
    ) {
        ObjectNode payload = buildPayload(type, job, result, additionalData, active);
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(payload);
            sender.send(active.serverAddress(), active.port(), bytes);
            log.info(
                "Queued {} notification for job {} to {}:{}",
                type.wireName(),
                job.id(),
                active.serverAddress(),
                active.port()
            );
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} notification for job {}", type.wireName(), job.id(), e);
        }
    }

    ObjectNode buildPayload(
        NotificationType type,
        JobConfig job,
        RequestResult result,
        ObjectNode additionalData,
        NotificationSettings active
    ) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("application", properties.getApplicationName());
        payload.put("version", properties.getApplicationVersion());
        payload.put("timestamp", clock.instant().toString());
        payload.put("notification_type", type.wireName());

        ObjectNode schedule = payload.putObject("schedule");
        schedule.put("id", job.id());
        schedule.put("name", job.displayName());
        schedule.put("url", job.url());
        schedule.put("method", job.method());

        ObjectNode requestResult = payload.putObject("request_result");
        requestResult.put("request_id", result.requestId());
        requestResult.put("success", result.success());
        if (result.statusCode() == null) {
            requestResult.putNull("status_code");
        } else {
            requestResult.put("status_code", result.statusCode());
        }
        if (result.responseTimeMs() == null) {
            requestResult.putNull("response_time_ms");
        } else {
            requestResult.put("response_time_ms", result.responseTimeMs());
        }
        requestResult.put("timestamp", result.timestamp() == null ? null : result.timestamp().toString());
        requestResult.put("attempt", result.attempt());

        payload.set("additional_data", additionalData == null ? objectMapper.createObjectNode() : additionalData);

        boolean changeEvent = type == NotificationType.FIRST_SUCCESS || type == NotificationType.RESPONSE_CHANGED;
        if (changeEvent && result.success() && hasContent(result.responseBody())) {
            int size = hasher.serializedSize(result.responseBody());
            if (size <= active.maxResponseSizeBytes()) {
                payload.set("response_body", result.responseBody());
            } else {
                payload.put("response_body_truncated", true);
                payload.put("response_size_bytes", size);
            }
        }
        if (!result.success() && result.error() != null) {
            payload.put("error", result.error());
        }
        return payload;
    }

    public void updateConfig(NotificationSettings newSettings) {
        NotificationSettings applied = newSettings == null ? properties.getNotification().toSettings() : newSettings;
        this.settings = applied;
        sender.setDelayMs(applied.delayMs());
        log.info(
            "Notification config updated: enabled={}, target={}:{}, delay={}ms",
            applied.enabled(),
            applied.serverAddress(),
            applied.port(),
            applied.delayMs()
        );
    }

    /**
     * Forgets the stored hash and open failure keys of one job, or of every job when {@code jobId} is null.
     */
    public void clearHistory(String jobId) {
        if (jobId == null) {
            lastHashes.clear();
            openFailures.clear();
            log.info("Cleared all notification history");
            return;
        }
        lastHashes.remove(jobId);
        closeFailures(jobId);
        log.info("Cleared notification history for job {}", jobId);
    }

    public NotifierStatistics statistics() {
        List<String> tracked = new ArrayList<>(lastHashes.keySet());
        Collections.sort(tracked);
        return new NotifierStatistics(tracked.size(), openFailures.size(), settings, List.copyOf(tracked));
    }

    private static boolean hasContent(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            return false;
        }
        if (body.isContainerNode()) {
            return body.size() > 0;
        }
        return !body.asText().isEmpty();
    }

    private record FailureKey(String jobId, String message) {
    }
}
