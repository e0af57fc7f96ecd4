package com.delta.requesttimer.schedule.service;

import com.delta.requesttimer.config.TimerProperties;
import com.delta.requesttimer.schedule.model.RequestResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class TimerCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(TimerCliRunner.class);

    private final TimerProperties properties;
    private final JobScheduler jobScheduler;
    private final ConfigurableApplicationContext applicationContext;

    public TimerCliRunner(
        TimerProperties properties,
        JobScheduler jobScheduler,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.jobScheduler = jobScheduler;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isTestRequest()) {
            return;
        }

        Optional<RequestResult> outcome = jobScheduler.testRequest(properties.getCli().getScheduleId());
        if (outcome.isEmpty()) {
            log.warn("Test request skipped: no matching enabled schedule");
        } else {
            RequestResult result = outcome.get();
            log.info(
                "Test request {}: success={}, status={}, time={}ms, attempts={}, error={}",
                result.requestId(),
                result.success(),
                result.statusCode(),
                result.responseTimeMs(),
                result.attempt(),
                result.error()
            );
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> outcome.map(r -> r.success() ? 0 : 1).orElse(2));
            System.exit(exitCode);
        }
    }
}
