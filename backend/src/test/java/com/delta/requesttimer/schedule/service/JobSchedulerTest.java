package com.delta.requesttimer.schedule.service;

import com.delta.requesttimer.config.TimerProperties;
import com.delta.requesttimer.schedule.http.RequestExecutor;
import com.delta.requesttimer.schedule.model.JobConfig;
import com.delta.requesttimer.schedule.model.JobStatus;
import com.delta.requesttimer.schedule.model.RequestResult;
import com.delta.requesttimer.schedule.model.ScheduleType;
import com.delta.requesttimer.schedule.notify.ResponseChangeDetector;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobSchedulerTest {
    private static final Instant T0 = Instant.parse("2024-01-01T10:00:00Z");

    @Mock
    private RequestExecutor requestExecutor;

    @Mock
    private HistoryService historyService;

    @Mock
    private ResponseChangeDetector changeDetector;

    private MutableClock clock;
    private JobScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        TimerProperties properties = new TimerProperties();
        properties.getScheduler().setStopTimeoutSeconds(5);
        JobConfigFactory factory = new JobConfigFactory(properties, new ObjectMapper());
        scheduler = new JobScheduler(properties, factory, requestExecutor, historyService, changeDetector, clock);
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    @Test
    void intervalNextRunIsCompletionTimePlusInterval() throws Exception {
        when(requestExecutor.execute(any())).thenAnswer(invocation -> {
            clock.advance(Duration.ofSeconds(7));
            return success("interval-job");
        });

        JobStatus registered = scheduler.addOrUpdateJob(intervalJob("interval-job", 60, true));
        assertThat(registered.nextRunTime()).isEqualTo(T0.plusSeconds(60));
        assertThat(scheduler.tick()).isEmpty();

        clock.set(T0.plusSeconds(60));
        awaitAll(scheduler.tick());

        JobStatus status = scheduler.status("interval-job").orElseThrow();
        assertThat(status.nextRunTime()).isEqualTo(T0.plusSeconds(67 + 60));
        assertThat(status.lastRunTime()).isEqualTo(T0.plusSeconds(60));
        assertThat(status.runCount()).isEqualTo(1);
        assertThat(status.errorCount()).isZero();
        assertThat(status.running()).isFalse();
        assertThat(status.lastResult().success()).isTrue();
        verify(historyService).recordResult(any(), any());
        verify(changeDetector).process(any(), any());
    }

    @Test
    void cronNextRunIsFirstGridInstantStrictlyAfterCompletion() throws Exception {
        when(requestExecutor.execute(any())).thenReturn(success("cron-job"));

        JobStatus registered = scheduler.addOrUpdateJob(cronJob("cron-job", "0 */5 * * * *"));
        assertThat(registered.nextRunTime()).isEqualTo(Instant.parse("2024-01-01T10:05:00Z"));

        clock.set(Instant.parse("2024-01-01T10:05:00Z"));
        awaitAll(scheduler.tick());

        assertThat(scheduler.status("cron-job").orElseThrow().nextRunTime())
            .isEqualTo(Instant.parse("2024-01-01T10:10:00Z"));
    }

    @Test
    void fiveFieldCronRunsAtSecondZero() {
        JobStatus registered = scheduler.addOrUpdateJob(cronJob("classic-cron", "30 10 * * *"));

        assertThat(registered.nextRunTime()).isEqualTo(Instant.parse("2024-01-01T10:30:00Z"));
    }

    @Test
    void failedRunIncrementsErrorCount() throws Exception {
        when(requestExecutor.execute(any()))
            .thenReturn(RequestResult.failure("failing-job", T0, 1, "Connection refused"));
        scheduler.addOrUpdateJob(intervalJob("failing-job", 10, true));

        clock.set(T0.plusSeconds(10));
        awaitAll(scheduler.tick());

        JobStatus status = scheduler.status("failing-job").orElseThrow();
        assertThat(status.runCount()).isEqualTo(1);
        assertThat(status.errorCount()).isEqualTo(1);
        assertThat(status.lastResult().error()).isEqualTo("Connection refused");
        assertThat(status.nextRunTime()).isEqualTo(T0.plusSeconds(20));
    }

    @Test
    void executorExceptionBecomesFailedResult() throws Exception {
        when(requestExecutor.execute(any())).thenThrow(new IllegalStateException("client closed"));
        scheduler.addOrUpdateJob(intervalJob("throwing-job", 10, true));

        clock.set(T0.plusSeconds(10));
        awaitAll(scheduler.tick());

        JobStatus status = scheduler.status("throwing-job").orElseThrow();
        assertThat(status.errorCount()).isEqualTo(1);
        assertThat(status.lastResult().success()).isFalse();
        assertThat(status.lastResult().error()).isEqualTo("client closed");
    }

    @Test
    void invalidUpdateLeavesRegistryUntouched() {
        scheduler.addOrUpdateJob(intervalJob("stable", 30, true));
        JobConfig broken = new JobConfig(
            "stable",
            "Stable",
            "ftp://example.com/file",
            "GET",
            Map.of(),
            null,
            ScheduleType.INTERVAL,
            30L,
            null,
            5,
            0,
            0,
            true
        );

        assertThatThrownBy(() -> scheduler.addOrUpdateJob(broken))
            .isInstanceOf(ConfigValidationException.class)
            .hasMessageContaining("Invalid URL format");

        assertThat(scheduler.status().totalJobs()).isEqualTo(1);
        assertThat(scheduler.status("stable").orElseThrow().url()).isEqualTo("https://example.com/stable");
    }

    @Test
    void disabledJobIsRegisteredButNeverRuns() {
        JobStatus registered = scheduler.addOrUpdateJob(intervalJob("dormant", 5, false));

        clock.set(T0.plusSeconds(3600));

        assertThat(registered.nextRunTime()).isNull();
        assertThat(scheduler.tick()).isEmpty();
        assertThat(scheduler.status().totalJobs()).isEqualTo(1);
        verify(requestExecutor, never()).execute(any());
    }

    @Test
    void runningJobIsNotLaunchedTwice() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        when(requestExecutor.execute(any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return success("slow");
        });
        scheduler.addOrUpdateJob(intervalJob("slow", 1, true));

        clock.set(T0.plusSeconds(5));
        List<Future<?>> first = scheduler.tick();
        List<Future<?>> second = scheduler.tick();

        assertThat(first).hasSize(1);
        assertThat(second).isEmpty();
        assertThat(scheduler.status().runningJobs()).isEqualTo(1);

        release.countDown();
        awaitAll(first);
        assertThat(scheduler.status("slow").orElseThrow().runCount()).isEqualTo(1);
    }

    @Test
    void replacementWaitsForTheRunningUnitOfTheInstanceItReplaced() throws Exception {
        OverlapTracker tracker = new OverlapTracker();
        when(requestExecutor.execute(any())).thenAnswer(tracker::execute);
        scheduler.addOrUpdateJob(intervalJob("swap", "https://example.com/v1", 1));

        clock.set(T0.plusSeconds(1));
        List<Future<?>> first = scheduler.tick();
        assertThat(tracker.started.await(5, TimeUnit.SECONDS)).isTrue();

        JobStatus replaced = scheduler.addOrUpdateJob(intervalJob("swap", "https://example.com/v2", 1));
        assertThat(replaced.running()).isFalse();
        assertThat(replaced.url()).isEqualTo("https://example.com/v2");

        clock.set(T0.plusSeconds(30));
        assertThat(scheduler.tick()).isEmpty();

        tracker.release.countDown();
        awaitAll(first);
        awaitAll(scheduler.tick());

        assertThat(tracker.urls).containsExactly("https://example.com/v1", "https://example.com/v2");
        assertThat(tracker.maxInFlight.get()).isEqualTo(1);
        assertThat(scheduler.status("swap").orElseThrow().runCount()).isEqualTo(1);
    }

    @Test
    void repeatedUpdatesDuringOneRunNeverOverlapIt() throws Exception {
        OverlapTracker tracker = new OverlapTracker();
        when(requestExecutor.execute(any())).thenAnswer(tracker::execute);
        scheduler.addOrUpdateJob(intervalJob("churn", "https://example.com/v1", 1));

        clock.set(T0.plusSeconds(1));
        List<Future<?>> first = scheduler.tick();
        assertThat(tracker.started.await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.addOrUpdateJob(intervalJob("churn", "https://example.com/v2", 1));
        scheduler.addOrUpdateJob(intervalJob("churn", "https://example.com/v3", 1));

        clock.set(T0.plusSeconds(30));
        assertThat(scheduler.tick()).isEmpty();
        assertThat(scheduler.status().totalJobs()).isEqualTo(1);

        tracker.release.countDown();
        awaitAll(first);
        awaitAll(scheduler.tick());

        assertThat(tracker.urls).containsExactly("https://example.com/v1", "https://example.com/v3");
        assertThat(tracker.maxInFlight.get()).isEqualTo(1);
    }

    @Test
    void removingAReplacedJobCancelsTheUnitStillRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        when(requestExecutor.execute(any())).thenAnswer(invocation -> {
            started.countDown();
            try {
                TimeUnit.SECONDS.sleep(30);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return RequestResult.failure("doomed", T0, 1, "Request interrupted");
        });
        scheduler.addOrUpdateJob(intervalJob("doomed", "https://example.com/v1", 1));

        clock.set(T0.plusSeconds(1));
        assertThat(scheduler.tick()).hasSize(1);
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.addOrUpdateJob(intervalJob("doomed", "https://example.com/v2", 1));
        scheduler.addOrUpdateJob(intervalJob("doomed", "https://example.com/v3", 1));

        assertThat(scheduler.removeJob("doomed")).isTrue();
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.status("doomed")).isEmpty();
        verify(historyService, never()).recordResult(any(), any());
    }

    @Test
    void removeJobReportsWhetherItExisted() {
        scheduler.addOrUpdateJob(intervalJob("short-lived", 30, true));

        assertThat(scheduler.removeJob("unknown")).isFalse();
        assertThat(scheduler.removeJob("short-lived")).isTrue();
        assertThat(scheduler.status("short-lived")).isEmpty();
        assertThat(scheduler.status().totalJobs()).isZero();
    }

    @Test
    void stopCancelsInFlightUnitsAndWaitsForThem() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        when(requestExecutor.execute(any())).thenAnswer(invocation -> {
            started.countDown();
            try {
                TimeUnit.SECONDS.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return RequestResult.failure("hanging", T0, 1, "Request interrupted");
        });
        scheduler.addOrUpdateJob(intervalJob("hanging", 1, true));
        clock.set(T0.plusSeconds(1));

        scheduler.start();
        scheduler.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(scheduler.isRunning()).isTrue();

        scheduler.stop();

        assertThat(scheduler.isRunning()).isFalse();
        JobStatus status = scheduler.status("hanging").orElseThrow();
        assertThat(status.running()).isFalse();
        assertThat(status.runCount()).isEqualTo(1);
        verify(historyService, never()).recordResult(any(), any());
        scheduler.stop();
    }

    @Test
    void testRequestUsesFirstEnabledJobWithoutTouchingCounters() {
        when(requestExecutor.execute(any())).thenReturn(success("second"));
        scheduler.addOrUpdateJob(intervalJob("first", 30, false));
        scheduler.addOrUpdateJob(intervalJob("second", 30, true));

        Optional<RequestResult> result = scheduler.testRequest(null);

        assertThat(result).isPresent();
        assertThat(result.get().requestId()).isEqualTo("second");
        assertThat(scheduler.status("second").orElseThrow().runCount()).isZero();
        verify(historyService).recordResult(any(), any());
        assertThat(scheduler.testRequest("missing")).isEmpty();
    }

    @Test
    void configuredSchedulesAreLoadedAndInvalidOnesSkipped() {
        TimerProperties properties = new TimerProperties();
        TimerProperties.ScheduleDefinition valid = new TimerProperties.ScheduleDefinition();
        valid.setId("from-config");
        valid.setUrl("https://example.com/health");
        valid.setMethod("get");
        valid.setScheduleType("interval");
        valid.setIntervalSeconds(120L);
        valid.setBody("ping");
        TimerProperties.ScheduleDefinition invalid = new TimerProperties.ScheduleDefinition();
        invalid.setId("no-schedule-type");
        invalid.setUrl("https://example.com");
        invalid.setMethod("GET");
        properties.setSchedules(List.of(valid, invalid));
        JobScheduler configured = new JobScheduler(
            properties,
            new JobConfigFactory(properties, new ObjectMapper()),
            requestExecutor,
            historyService,
            changeDetector,
            clock
        );

        configured.loadConfiguredSchedules();

        assertThat(configured.status().totalJobs()).isEqualTo(1);
        JobStatus status = configured.status("from-config").orElseThrow();
        assertThat(status.method()).isEqualTo("GET");
        assertThat(status.nextRunTime()).isEqualTo(T0.plusSeconds(120));
        assertThat(configured.isRunning()).isFalse();
    }

    /**
     * Blocks the first unit until released and records how many units of the job overlapped.
     */
    private static final class OverlapTracker {
        private final CountDownLatch started = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();
        private final List<String> urls = new CopyOnWriteArrayList<>();

        RequestResult execute(InvocationOnMock invocation) throws InterruptedException {
            JobConfig config = invocation.getArgument(0);
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            urls.add(config.url());
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
                return success(config.id());
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }

    private static void awaitAll(List<Future<?>> futures) throws Exception {
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
    }

    private static RequestResult success(String id) {
        return RequestResult.success(id, T0, 1, 200, TextNode.valueOf("ok"), Map.of(), 12L, "https://example.com", "GET");
    }

    private static JobConfig intervalJob(String id, long intervalSeconds, boolean enabled) {
        return intervalJob(id, "https://example.com/" + id, intervalSeconds, enabled);
    }

    private static JobConfig intervalJob(String id, String url, long intervalSeconds) {
        return intervalJob(id, url, intervalSeconds, true);
    }

    private static JobConfig intervalJob(String id, String url, long intervalSeconds, boolean enabled) {
        return new JobConfig(
            id,
            id,
            url,
            "GET",
            Map.of(),
            null,
            ScheduleType.INTERVAL,
            intervalSeconds,
            null,
            5,
            0,
            0,
            enabled
        );
    }

    private static JobConfig cronJob(String id, String expression) {
        return new JobConfig(
            id,
            id,
            "https://example.com/" + id,
            "GET",
            Map.of(),
            null,
            ScheduleType.CRON,
            null,
            expression,
            5,
            0,
            0,
            true
        );
    }
}
