package com.delta.requesttimer.schedule.service;

import com.delta.requesttimer.config.TimerProperties;
import com.delta.requesttimer.schedule.model.GlobalStatistics;
import com.delta.requesttimer.schedule.model.HistoryQuery;
import com.delta.requesttimer.schedule.model.HistoryRecord;
import com.delta.requesttimer.schedule.model.JobConfig;
import com.delta.requesttimer.schedule.model.RequestResult;
import com.delta.requesttimer.schedule.model.ScheduleStats;
import com.delta.requesttimer.schedule.persistence.HistoryJdbcRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Append-only request history plus per-job statistics. Every write goes through one lock and
 * commits inside it, so the read-modify-write of the running average never interleaves.
 * Storage failures are logged and swallowed; reads fall back to empty results.
 */
@Service
public class HistoryService {
    private static final Logger log = LoggerFactory.getLogger(HistoryService.class);

    private final HistoryJdbcRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final TimerProperties properties;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public HistoryService(
        HistoryJdbcRepository repository,
        TransactionTemplate transactionTemplate,
        ObjectMapper objectMapper,
        TimerProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public boolean recordResult(RequestResult result, JobConfig job) {
        if (result.success()) {
            log.info(
                "Request {} SUCCESS - Status: {}, Time: {}ms, URL: {}",
                result.requestId(),
                result.statusCode(),
                result.responseTimeMs(),
                job.url()
            );
        } else {
            log.warn("Request {} FAILED - Error: {}, URL: {}", result.requestId(), result.error(), job.url());
        }

        HistoryRecord record = toRecord(result, job);
        writeLock.lock();
        try {
            transactionTemplate.executeWithoutResult(status -> {
                repository.insertHistory(record);
                ScheduleStats existing = repository.findStats(job.id());
                ScheduleStats updated = nextStats(existing, job, result, clock.instant());
                if (existing == null) {
                    repository.insertStats(updated);
                } else {
                    repository.updateStats(updated);
                }
            });
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to store history for request {}", result.requestId(), e);
            return false;
        } finally {
            writeLock.unlock();
        }
    }

    public List<HistoryRecord> query(HistoryQuery query) {
        HistoryQuery effective = query == null ? HistoryQuery.latest(properties.getHistory().getDefaultQueryLimit()) : query;
        if (effective.limit() <= 0) {
            effective = new HistoryQuery(
                effective.scheduleIdPrefix(),
                effective.success(),
                effective.from(),
                effective.to(),
                properties.getHistory().getDefaultQueryLimit()
            );
        }
        try {
            return repository.findHistory(effective);
        } catch (RuntimeException e) {
            log.error("Failed to load request history", e);
            return List.of();
        }
    }

    public Optional<ScheduleStats> getStatistics(String scheduleId) {
        try {
            return Optional.ofNullable(repository.findStats(scheduleId));
        } catch (RuntimeException e) {
            log.error("Failed to load statistics for schedule {}", scheduleId, e);
            return Optional.empty();
        }
    }

    public List<ScheduleStats> getAllStatistics() {
        try {
            return repository.findAllStats();
        } catch (RuntimeException e) {
            log.error("Failed to load schedule statistics", e);
            return List.of();
        }
    }

    public GlobalStatistics getGlobalStatistics() {
        try {
            List<ScheduleStats> rows = repository.findAllStats();
            long total = rows.stream().mapToLong(ScheduleStats::totalRequests).sum();
            long successful = rows.stream().mapToLong(ScheduleStats::successfulRequests).sum();
            long failed = rows.stream().mapToLong(ScheduleStats::failedRequests).sum();
            double successRate = total == 0 ? 0.0 : successful * 100.0 / total;
            long recent = repository.countHistorySince(startOfToday());
            return new GlobalStatistics(total, successful, failed, successRate, recent);
        } catch (RuntimeException e) {
            log.error("Failed to compute global statistics", e);
            return GlobalStatistics.empty();
        }
    }

    /**
     * Deletes history older than the start of the current UTC day minus {@code retentionDays}.
     * Statistics rows are cumulative and stay untouched.
     */
    public int cleanup(int retentionDays) {
        Instant cutoff = startOfToday().minusSeconds(Math.max(0, retentionDays) * 86_400L);
        writeLock.lock();
        try {
            int deleted = repository.deleteHistoryBefore(cutoff);
            log.info("Cleaned up {} old history entries (older than {} days)", deleted, retentionDays);
            return deleted;
        } catch (RuntimeException e) {
            log.error("Failed to clean up history older than {}", cutoff, e);
            return 0;
        } finally {
            writeLock.unlock();
        }
    }

    static ScheduleStats nextStats(ScheduleStats existing, JobConfig job, RequestResult result, Instant now) {
        boolean success = result.success();
        Long responseTime = result.responseTimeMs();
        Instant timestamp = result.timestamp();
        if (existing == null) {
            return new ScheduleStats(
                job.id(),
                job.displayName(),
                1,
                success ? 1 : 0,
                success ? 0 : 1,
                timestamp,
                success ? timestamp : null,
                success ? null : timestamp,
                success && responseTime != null ? responseTime : 0.0,
                now
            );
        }
        long successful = existing.successfulRequests() + (success ? 1 : 0);
        double average = existing.averageResponseTimeMs();
        if (success && responseTime != null) {
            average = (existing.averageResponseTimeMs() * existing.successfulRequests() + responseTime) / successful;
        }
        return new ScheduleStats(
            job.id(),
            job.displayName(),
            existing.totalRequests() + 1,
            successful,
            existing.failedRequests() + (success ? 0 : 1),
            timestamp,
            success ? timestamp : existing.lastSuccessTime(),
            success ? existing.lastFailureTime() : timestamp,
            average,
            now
        );
    }

    private HistoryRecord toRecord(RequestResult result, JobConfig job) {
        return new HistoryRecord(
            0L,
            result.requestId(),
            job.displayName(),
            result.timestamp(),
            job.url(),
            job.method(),
            toJson(job.headers()),
            job.body() == null || job.body().isNull() ? null : toJson(job.body()),
            result.success(),
            result.statusCode(),
            result.responseTimeMs(),
            result.responseHeaders() == null ? null : toJson(result.responseHeaders()),
            result.responseBody() == null ? null : toJson(result.responseBody()),
            result.error(),
            result.attempt(),
            null
        );
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize history snapshot", e);
            return String.valueOf(value);
        }
    }

    private Instant startOfToday() {
        return LocalDate.now(clock.withZone(ZoneOffset.UTC)).atStartOfDay(ZoneOffset.UTC).toInstant();
    }
}
