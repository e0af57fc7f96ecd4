package com.delta.requesttimer.schedule.model;

import java.util.Map;

public record SchedulerStatus(
    int totalJobs,
    int runningJobs,
    boolean schedulerRunning,
    Map<String, JobStatus> jobs
) {
}
