package com.delta.requesttimer.schedule.api;

import com.delta.requesttimer.config.TimerProperties;
import com.delta.requesttimer.schedule.model.HistoryQuery;
import com.delta.requesttimer.schedule.model.HistoryRecord;
import com.delta.requesttimer.schedule.model.JobStatus;
import com.delta.requesttimer.schedule.model.NotificationConfigRequest;
import com.delta.requesttimer.schedule.model.NotificationSettings;
import com.delta.requesttimer.schedule.model.NotifierStatistics;
import com.delta.requesttimer.schedule.model.RequestResult;
import com.delta.requesttimer.schedule.model.ScheduleRequest;
import com.delta.requesttimer.schedule.model.ScheduleStats;
import com.delta.requesttimer.schedule.model.SchedulerStatus;
import com.delta.requesttimer.schedule.model.StatisticsResponse;
import com.delta.requesttimer.schedule.notify.ResponseChangeDetector;
import com.delta.requesttimer.schedule.service.HistoryService;
import com.delta.requesttimer.schedule.service.JobConfigFactory;
import com.delta.requesttimer.schedule.service.JobScheduler;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class TimerController {
    private final JobScheduler jobScheduler;
    private final JobConfigFactory jobConfigFactory;
    private final HistoryService historyService;
    private final ResponseChangeDetector changeDetector;
    private final TimerProperties properties;

    public TimerController(
        JobScheduler jobScheduler,
        JobConfigFactory jobConfigFactory,
        HistoryService historyService,
        ResponseChangeDetector changeDetector,
        TimerProperties properties
    ) {
        this.jobScheduler = jobScheduler;
        this.jobConfigFactory = jobConfigFactory;
        this.historyService = historyService;
        this.changeDetector = changeDetector;
        this.properties = properties;
    }

    @GetMapping("/schedules")
    public SchedulerStatus getSchedules() {
        return jobScheduler.status();
    }

    @GetMapping("/schedules/{id}")
    public JobStatus getSchedule(@PathVariable("id") String scheduleId) {
        return jobScheduler.status(scheduleId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Unknown schedule: " + scheduleId));
    }

    @PutMapping("/schedules")
    public JobStatus putSchedule(@RequestBody ScheduleRequest request) {
        return jobScheduler.addOrUpdateJob(jobConfigFactory.fromRequest(request));
    }

    @DeleteMapping("/schedules/{id}")
    public Map<String, Object> deleteSchedule(@PathVariable("id") String scheduleId) {
        if (!jobScheduler.removeJob(scheduleId)) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown schedule: " + scheduleId);
        }
        return Map.of("removed", true, "id", scheduleId);
    }

    @PostMapping("/schedules/test")
    public RequestResult testSchedule(@RequestParam(name = "scheduleId", required = false) String scheduleId) {
        return jobScheduler.testRequest(scheduleId)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No schedule available for test request"));
    }

    @GetMapping("/history")
    public List<HistoryRecord> getHistory(
        @RequestParam(name = "scheduleId", required = false) String scheduleId,
        @RequestParam(name = "success", required = false) Boolean success,
        @RequestParam(name = "from", required = false) String from,
        @RequestParam(name = "to", required = false) String to,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        int safeLimit = limit == null ? properties.getHistory().getDefaultQueryLimit() : Math.max(1, limit);
        HistoryQuery query = new HistoryQuery(scheduleId, success, parseInstant("from", from), parseInstant("to", to), safeLimit);
        return historyService.query(query);
    }

    @PostMapping("/history/cleanup")
    public Map<String, Object> cleanupHistory(@RequestParam(name = "retentionDays", required = false) Integer retentionDays) {
        int days = retentionDays == null ? properties.getHistory().getRetentionDays() : Math.max(0, retentionDays);
        int deleted = historyService.cleanup(days);
        return Map.of("retentionDays", days, "deleted", deleted);
    }

    @GetMapping("/statistics")
    public StatisticsResponse getStatistics(@RequestParam(name = "scheduleId", required = false) String scheduleId) {
        NotifierStatistics notifier = changeDetector.statistics();
        if (scheduleId != null && !scheduleId.isBlank()) {
            ScheduleStats stats = historyService.getStatistics(scheduleId.trim())
                .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No statistics for schedule: " + scheduleId));
            return new StatisticsResponse(List.of(stats), null, notifier);
        }
        return new StatisticsResponse(historyService.getAllStatistics(), historyService.getGlobalStatistics(), notifier);
    }

    @PutMapping("/notifications/config")
    public NotifierStatistics updateNotificationConfig(@RequestBody NotificationConfigRequest request) {
        if (request.port() != null && (request.port() < 1 || request.port() > 65535)) {
            throw new ResponseStatusException(BAD_REQUEST, "port must be between 1 and 65535");
        }
        NotificationSettings current = changeDetector.statistics().config();
        changeDetector.updateConfig(request.applyTo(current));
        return changeDetector.statistics();
    }

    private static Instant parseInstant(String name, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ResponseStatusException(BAD_REQUEST, "Invalid " + name + " timestamp: " + value);
        }
    }
}
