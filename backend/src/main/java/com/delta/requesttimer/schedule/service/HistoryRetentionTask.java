package com.delta.requesttimer.schedule.service;

import com.delta.requesttimer.config.TimerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class HistoryRetentionTask {
    private static final Logger log = LoggerFactory.getLogger(HistoryRetentionTask.class);

    private final HistoryService historyService;
    private final TimerProperties properties;

    public HistoryRetentionTask(HistoryService historyService, TimerProperties properties) {
        this.historyService = historyService;
        this.properties = properties;
    }

    @Scheduled(cron = "${timer.history.cleanup-cron:0 30 3 * * *}", zone = "UTC")
    public void purgeExpiredHistory() {
        if (!properties.getHistory().isCleanupEnabled()) {
            log.debug("History cleanup disabled");
            return;
        }
        historyService.cleanup(properties.getHistory().getRetentionDays());
    }
}
