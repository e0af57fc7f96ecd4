package com.delta.requesttimer.schedule.service;

import com.delta.requesttimer.config.TimerProperties;
import com.delta.requesttimer.schedule.http.RequestExecutor;
import com.delta.requesttimer.schedule.model.JobConfig;
import com.delta.requesttimer.schedule.model.JobStatus;
import com.delta.requesttimer.schedule.model.RequestResult;
import com.delta.requesttimer.schedule.model.ScheduleType;
import com.delta.requesttimer.schedule.model.SchedulerStatus;
import com.delta.requesttimer.schedule.notify.ResponseChangeDetector;
import com.delta.requesttimer.schedule.util.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the job registry and drives timed execution from a one-second tick loop.
 *
 * <p>Each due job runs in its own execution unit; a job never has two units in flight. After a
 * unit completes, the job's next run is computed from the completion time, so overruns shift the
 * schedule instead of piling up.
 */
@Service
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);
    private static final long TICK_INTERVAL_MS = 1000;
    private static final ThreadLocal<Boolean> SCHEDULER_THREAD = ThreadLocal.withInitial(() -> false);

    private final TimerProperties properties;
    private final JobConfigFactory jobConfigFactory;
    private final RequestExecutor requestExecutor;
    private final HistoryService historyService;
    private final ResponseChangeDetector changeDetector;
    private final Clock clock;
    private final Map<String, ScheduledJob> jobs = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object lifecycleLock = new Object();

    private ExecutorService tickExecutor;
    private ExecutorService jobExecutor;

    public JobScheduler(
        TimerProperties properties,
        JobConfigFactory jobConfigFactory,
        RequestExecutor requestExecutor,
        HistoryService historyService,
        ResponseChangeDetector changeDetector,
        Clock clock
    ) {
        this.properties = properties;
        this.jobConfigFactory = jobConfigFactory;
        this.requestExecutor = requestExecutor;
        this.historyService = historyService;
        this.changeDetector = changeDetector;
        this.clock = clock;
    }

    @PostConstruct
    public void loadConfiguredSchedules() {
        int loaded = 0;
        for (TimerProperties.ScheduleDefinition definition : properties.getSchedules()) {
            try {
                addOrUpdateJob(jobConfigFactory.fromDefinition(definition));
                loaded++;
            } catch (ConfigValidationException e) {
                log.error("Skipping invalid schedule {}: {}", definition.getId(), e.getMessage());
            }
        }
        log.info("Loaded {} of {} configured schedules", loaded, properties.getSchedules().size());
        if (properties.getScheduler().isAutoStart()) {
            start();
        }
    }

    @PreDestroy
    public void stopOnShutdown() {
        stop();
    }

    public JobStatus addOrUpdateJob(JobConfig config) {
        JobConfigValidator.validate(config);
        Instant next = computeNextRun(config, clock.instant());
        ScheduledJob job = jobs.compute(config.id(), (id, previous) -> new ScheduledJob(
            config,
            previous == null ? sequence.incrementAndGet() : previous.sequence(),
            next,
            previous == null ? null : previous.inFlight()
        ));
        log.info(
            "Schedule {} registered ({}, enabled={}), next run at {}",
            config.id(),
            config.scheduleType().value(),
            config.enabled(),
            next
        );
        return job.toStatus();
    }

    public boolean removeJob(String jobId) {
        if (jobId == null) {
            return false;
        }
        ScheduledJob removed = jobs.remove(jobId);
        if (removed == null) {
            return false;
        }
        removed.cancel();
        log.info("Schedule {} removed", jobId);
        return true;
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running.get()) {
                return;
            }
            ExecutorService executor = ensureJobExecutor();
            tickExecutor = Executors.newSingleThreadExecutor(namedDaemonThreads("request-timer-tick"));
            running.set(true);
            tickExecutor.submit(() -> tickLoop(executor));
            log.info("Scheduler started with {} schedules", jobs.size());
        }
    }

    /**
     * Cancels the tick loop and every in-flight execution unit, then waits for them to finish.
     * When called from one of the scheduler's own threads it returns without waiting.
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (!running.get() && tickExecutor == null && jobExecutor == null) {
                return;
            }
            running.set(false);
            boolean calledFromScheduler = SCHEDULER_THREAD.get();
            for (ScheduledJob job : jobs.values()) {
                job.cancel();
            }
            List<ExecutorService> executors = new ArrayList<>();
            if (tickExecutor != null) {
                executors.add(tickExecutor);
            }
            if (jobExecutor != null) {
                executors.add(jobExecutor);
            }
            for (ExecutorService executor : executors) {
                executor.shutdownNow();
            }
            if (!calledFromScheduler) {
                long timeoutSeconds = properties.getScheduler().getStopTimeoutSeconds();
                for (ExecutorService executor : executors) {
                    awaitTermination(executor, timeoutSeconds);
                }
            }
            for (ScheduledJob job : jobs.values()) {
                job.releaseIfNotStarted();
            }
            tickExecutor = null;
            jobExecutor = null;
            log.info("Scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<JobStatus> status(String jobId) {
        ScheduledJob job = jobId == null ? null : jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.of(job.toStatus());
    }

    public SchedulerStatus status() {
        Map<String, JobStatus> statuses = new LinkedHashMap<>();
        int runningJobs = 0;
        for (ScheduledJob job : orderedJobs()) {
            JobStatus status = job.toStatus();
            statuses.put(status.id(), status);
            if (status.running()) {
                runningJobs++;
            }
        }
        return new SchedulerStatus(statuses.size(), runningJobs, running.get(), statuses);
    }

    /**
     * Runs one job immediately on the calling thread, persisting and classifying the result like a
     * scheduled run but leaving the job's runtime counters alone. Without an id, the first enabled
     * job in registration order is used.
     */
    public Optional<RequestResult> testRequest(String jobId) {
        Optional<ScheduledJob> target;
        if (jobId == null || jobId.isBlank()) {
            target = orderedJobs().stream().filter(job -> job.config().enabled()).findFirst();
        } else {
            target = Optional.ofNullable(jobs.get(jobId.trim()));
        }
        if (target.isEmpty()) {
            log.warn("No schedule available for test request (requested: {})", jobId);
            return Optional.empty();
        }
        JobConfig config = target.get().config();
        log.info("Executing test request for schedule {}", config.id());
        RequestResult result = executeSafely(config);
        historyService.recordResult(result, config);
        classifySafely(result, config);
        return Optional.of(result);
    }

    /**
     * Launches an execution unit for every job that is due at the current clock instant.
     */
    List<Future<?>> tick() {
        return tick(ensureJobExecutor());
    }

    private List<Future<?>> tick(ExecutorService executor) {
        Instant now = clock.instant();
        List<Future<?>> launched = new ArrayList<>();
        for (ScheduledJob job : jobs.values()) {
            if (!job.tryStart(now)) {
                continue;
            }
            try {
                Future<?> future = executor.submit(() -> runJob(job));
                job.attach(future);
                launched.add(future);
            } catch (RejectedExecutionException e) {
                job.release();
                log.warn("Could not launch schedule {}; scheduler is shutting down", job.config().id());
            }
        }
        return launched;
    }

    private void tickLoop(ExecutorService executor) {
        SCHEDULER_THREAD.set(true);
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                tick(executor);
            } catch (RuntimeException e) {
                log.error("Scheduler tick failed", e);
            }
            try {
                TimeUnit.MILLISECONDS.sleep(TICK_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void runJob(ScheduledJob job) {
        if (!job.beginUnit()) {
            return;
        }
        SCHEDULER_THREAD.set(true);
        JobConfig config = job.config();
        RequestResult result = null;
        try {
            log.debug("Executing schedule {}", config.id());
            result = executeSafely(config);
            if (!Thread.currentThread().isInterrupted()) {
                historyService.recordResult(result, config);
                classifySafely(result, config);
            }
        } finally {
            Instant completedAt = clock.instant();
            Instant next = computeNextRun(config, completedAt);
            job.complete(result, next);
            SCHEDULER_THREAD.remove();
            log.info(
                "Schedule {} completed (success={}), next run at {}",
                config.id(),
                result != null && result.success(),
                next
            );
        }
    }

    private RequestResult executeSafely(JobConfig config) {
        try {
            return requestExecutor.execute(config);
        } catch (RuntimeException e) {
            log.error("Unexpected error executing schedule {}", config.id(), e);
            return RequestResult.failure(config.id(), clock.instant(), 1, e.getMessage());
        }
    }

    private void classifySafely(RequestResult result, JobConfig config) {
        try {
            changeDetector.process(result, config);
        } catch (RuntimeException e) {
            log.error("Change detection failed for schedule {}", config.id(), e);
        }
    }

    /**
     * Null when the job is disabled or its schedule cannot produce another instant.
     */
    Instant computeNextRun(JobConfig config, Instant from) {
        if (!config.enabled()) {
            return null;
        }
        if (config.scheduleType() == ScheduleType.INTERVAL) {
            return from.plusSeconds(config.intervalSeconds());
        }
        try {
            Instant next = CronSchedules.nextAfter(config.cronExpression(), from, zone());
            if (next == null) {
                log.warn("Cron expression for schedule {} has no future run", config.id());
            }
            return next;
        } catch (IllegalArgumentException e) {
            log.error("Failed to compute next run for schedule {}: {}", config.id(), e.getMessage());
            return null;
        }
    }

    private ZoneId zone() {
        try {
            return ZoneId.of(properties.getScheduler().getZone());
        } catch (DateTimeException e) {
            log.warn("Unknown scheduler zone {}, using UTC", properties.getScheduler().getZone());
            return ZoneOffset.UTC;
        }
    }

    private List<ScheduledJob> orderedJobs() {
        List<ScheduledJob> ordered = new ArrayList<>(jobs.values());
        ordered.sort(Comparator.comparingLong(ScheduledJob::sequence));
        return ordered;
    }

    private ExecutorService ensureJobExecutor() {
        synchronized (lifecycleLock) {
            if (jobExecutor == null || jobExecutor.isShutdown()) {
                jobExecutor = Executors.newCachedThreadPool(namedDaemonThreads("request-timer-job"));
            }
            return jobExecutor;
        }
    }

    private static void awaitTermination(ExecutorService executor, long timeoutSeconds) {
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Scheduler threads did not terminate within {}s", timeoutSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
