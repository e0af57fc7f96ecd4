package com.delta.requesttimer.schedule.service;

import com.delta.requesttimer.schedule.model.JobConfig;
import com.delta.requesttimer.schedule.model.JobStatus;
import com.delta.requesttimer.schedule.model.RequestResult;

import java.time.Instant;
import java.util.concurrent.Future;

/**
 * Registry entry of one job: its config plus the runtime state guarded by this instance's monitor.
 * A replacement keeps a reference to the instance still in flight for the same id, which may be
 * older than the one it directly replaced, and does not start while that one is running.
 */
class ScheduledJob {
    private final JobConfig config;
    private final long sequence;
    private ScheduledJob predecessor;

    private Instant nextRunTime;
    private Instant lastRunTime;
    private boolean running;
    private boolean unitStarted;
    private long runCount;
    private long errorCount;
    private RequestResult lastResult;
    private Future<?> execution;

    ScheduledJob(JobConfig config, long sequence, Instant nextRunTime, ScheduledJob predecessor) {
        this.config = config;
        this.sequence = sequence;
        this.nextRunTime = nextRunTime;
        this.predecessor = predecessor;
    }

    JobConfig config() {
        return config;
    }

    long sequence() {
        return sequence;
    }

    synchronized boolean tryStart(Instant now) {
        if (!config.enabled() || running || nextRunTime == null || nextRunTime.isAfter(now)) {
            return false;
        }
        if (predecessor != null) {
            if (predecessor.isRunning()) {
                return false;
            }
            predecessor = null;
        }
        running = true;
        unitStarted = false;
        lastRunTime = now;
        return true;
    }

    /**
     * Called first thing by the execution unit. False when the start was already released.
     */
    synchronized boolean beginUnit() {
        if (!running) {
            return false;
        }
        unitStarted = true;
        return true;
    }

    synchronized void attach(Future<?> future) {
        this.execution = future;
    }

    synchronized void complete(RequestResult result, Instant next) {
        running = false;
        unitStarted = false;
        runCount++;
        if (result == null || !result.success()) {
            errorCount++;
        }
        lastResult = result;
        nextRunTime = next;
        execution = null;
    }

    /**
     * Undoes {@link #tryStart} when the execution unit could not be submitted.
     */
    synchronized void release() {
        running = false;
        execution = null;
    }

    /**
     * Releases a start whose execution unit was cancelled before it began.
     */
    synchronized void releaseIfNotStarted() {
        if (running && !unitStarted) {
            release();
        }
    }

    synchronized void cancel() {
        if (execution != null) {
            execution.cancel(true);
        }
        if (predecessor != null) {
            predecessor.cancel();
        }
    }

    synchronized boolean isRunning() {
        return running;
    }

    /**
     * The instance whose execution unit is still in flight for this job id: this one, the
     * instance it replaced, or null.
     */
    synchronized ScheduledJob inFlight() {
        if (running) {
            return this;
        }
        if (predecessor != null && predecessor.isRunning()) {
            return predecessor;
        }
        return null;
    }

    synchronized JobStatus toStatus() {
        return new JobStatus(
            config.id(),
            config.displayName(),
            config.enabled(),
            nextRunTime,
            lastRunTime,
            running,
            runCount,
            errorCount,
            lastResult,
            config.scheduleType(),
            config.intervalSeconds(),
            config.cronExpression(),
            config.url(),
            config.method()
        );
    }
}
