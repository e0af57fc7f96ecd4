package com.delta.requesttimer.schedule.api;

import com.delta.requesttimer.schedule.model.SchedulerStatus;
import com.delta.requesttimer.schedule.service.JobScheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {
    private final JobScheduler jobScheduler;

    public SchedulerController(JobScheduler jobScheduler) {
        this.jobScheduler = jobScheduler;
    }

    @PostMapping("/start")
    public SchedulerStatus start() {
        jobScheduler.start();
        return jobScheduler.status();
    }

    @PostMapping("/stop")
    public SchedulerStatus stop() {
        jobScheduler.stop();
        return jobScheduler.status();
    }

    @GetMapping("/status")
    public SchedulerStatus status() {
        return jobScheduler.status();
    }
}
