package com.delta.requesttimer.config;

import com.delta.requesttimer.schedule.model.NotificationSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "timer")
public class TimerProperties {
    private static final String DEFAULT_USER_AGENT = "WebRequestTimer/1.0";

    private String applicationName = "WebRequestTimer";
    private String applicationVersion = "1.0";
    private Http http = new Http();
    private Scheduler scheduler = new Scheduler();
    private History history = new History();
    private Notification notification = new Notification();
    private Cli cli = new Cli();
    private List<ScheduleDefinition> schedules = new ArrayList<>();

    public String getApplicationName() {
        return applicationName;
    }

    public void setApplicationName(String applicationName) {
        this.applicationName = applicationName;
    }

    public String getApplicationVersion() {
        return applicationVersion;
    }

    public void setApplicationVersion(String applicationVersion) {
        this.applicationVersion = applicationVersion;
    }

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public Notification getNotification() {
        return notification;
    }

    public void setNotification(Notification notification) {
        this.notification = notification;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public List<ScheduleDefinition> getSchedules() {
        return schedules;
    }

    public void setSchedules(List<ScheduleDefinition> schedules) {
        this.schedules = schedules == null ? new ArrayList<>() : schedules;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Http {
        private String userAgent;
        private int defaultTimeoutSeconds = 30;
        private int defaultRetryCount = 3;
        private int defaultRetryDelaySeconds = 5;
        private boolean verifySsl = true;
        private boolean followRedirects = true;
        private int maxConcurrentRequests = 5;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public int getDefaultTimeoutSeconds() {
            return Math.max(1, defaultTimeoutSeconds);
        }

        public void setDefaultTimeoutSeconds(int defaultTimeoutSeconds) {
            this.defaultTimeoutSeconds = Math.max(1, defaultTimeoutSeconds);
        }

        public int getDefaultRetryCount() {
            return Math.max(0, defaultRetryCount);
        }

        public void setDefaultRetryCount(int defaultRetryCount) {
            this.defaultRetryCount = Math.max(0, defaultRetryCount);
        }

        public int getDefaultRetryDelaySeconds() {
            return Math.max(0, defaultRetryDelaySeconds);
        }

        public void setDefaultRetryDelaySeconds(int defaultRetryDelaySeconds) {
            this.defaultRetryDelaySeconds = Math.max(0, defaultRetryDelaySeconds);
        }

        public boolean isVerifySsl() {
            return verifySsl;
        }

        public void setVerifySsl(boolean verifySsl) {
            this.verifySsl = verifySsl;
        }

        public boolean isFollowRedirects() {
            return followRedirects;
        }

        public void setFollowRedirects(boolean followRedirects) {
            this.followRedirects = followRedirects;
        }

        public int getMaxConcurrentRequests() {
            return Math.max(1, maxConcurrentRequests);
        }

        public void setMaxConcurrentRequests(int maxConcurrentRequests) {
            this.maxConcurrentRequests = Math.max(1, maxConcurrentRequests);
        }
    }

    public static class Scheduler {
        private boolean autoStart = false;
        private String zone = "UTC";
        private int stopTimeoutSeconds = 10;

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public String getZone() {
            return zone == null || zone.isBlank() ? "UTC" : zone.trim();
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public int getStopTimeoutSeconds() {
            return Math.max(1, stopTimeoutSeconds);
        }

        public void setStopTimeoutSeconds(int stopTimeoutSeconds) {
            this.stopTimeoutSeconds = Math.max(1, stopTimeoutSeconds);
        }
    }

    public static class History {
        private int retentionDays = 30;
        private boolean cleanupEnabled = true;
        private String cleanupCron = "0 30 3 * * *";
        private int defaultQueryLimit = 100;

        public int getRetentionDays() {
            return Math.max(0, retentionDays);
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = Math.max(0, retentionDays);
        }

        public boolean isCleanupEnabled() {
            return cleanupEnabled;
        }

        public void setCleanupEnabled(boolean cleanupEnabled) {
            this.cleanupEnabled = cleanupEnabled;
        }

        public String getCleanupCron() {
            return cleanupCron;
        }

        public void setCleanupCron(String cleanupCron) {
            this.cleanupCron = cleanupCron;
        }

        public int getDefaultQueryLimit() {
            return Math.max(1, defaultQueryLimit);
        }

        public void setDefaultQueryLimit(int defaultQueryLimit) {
            this.defaultQueryLimit = Math.max(1, defaultQueryLimit);
        }
    }

    public static class Notification {
        private boolean enabled = false;
        private String serverAddress = "localhost";
        private int port = 12345;
        private long delayMs = 1000;
        private boolean notifyOnSuccess = true;
        private boolean notifyOnFailure = true;
        private boolean notifyOnResponseChange = true;
        private boolean notifyOnUnchanged = false;
        private int maxResponseSizeBytes = 1024;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getServerAddress() {
            return serverAddress;
        }

        public void setServerAddress(String serverAddress) {
            this.serverAddress = serverAddress;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public long getDelayMs() {
            return Math.max(0, delayMs);
        }

        public void setDelayMs(long delayMs) {
            this.delayMs = Math.max(0, delayMs);
        }

        public boolean isNotifyOnSuccess() {
            return notifyOnSuccess;
        }

        public void setNotifyOnSuccess(boolean notifyOnSuccess) {
            this.notifyOnSuccess = notifyOnSuccess;
        }

        public boolean isNotifyOnFailure() {
            return notifyOnFailure;
        }

        public void setNotifyOnFailure(boolean notifyOnFailure) {
            this.notifyOnFailure = notifyOnFailure;
        }

        public boolean isNotifyOnResponseChange() {
            return notifyOnResponseChange;
        }

        public void setNotifyOnResponseChange(boolean notifyOnResponseChange) {
            this.notifyOnResponseChange = notifyOnResponseChange;
        }

        public boolean isNotifyOnUnchanged() {
            return notifyOnUnchanged;
        }

        public void setNotifyOnUnchanged(boolean notifyOnUnchanged) {
            this.notifyOnUnchanged = notifyOnUnchanged;
        }

        public int getMaxResponseSizeBytes() {
            return Math.max(0, maxResponseSizeBytes);
        }

        public void setMaxResponseSizeBytes(int maxResponseSizeBytes) {
            this.maxResponseSizeBytes = Math.max(0, maxResponseSizeBytes);
        }

        public NotificationSettings toSettings() {
            return new NotificationSettings(
                enabled,
                serverAddress,
                port,
                getDelayMs(),
                notifyOnSuccess,
                notifyOnFailure,
                notifyOnResponseChange,
                notifyOnUnchanged,
                getMaxResponseSizeBytes()
            );
        }
    }

    public static class Cli {
        private boolean testRequest;
        private String scheduleId;
        private boolean exitAfterRun = true;

        public boolean isTestRequest() {
            return testRequest;
        }

        public void setTestRequest(boolean testRequest) {
            this.testRequest = testRequest;
        }

        public String getScheduleId() {
            return scheduleId;
        }

        public void setScheduleId(String scheduleId) {
            this.scheduleId = scheduleId;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    /**
     * One job as written in the configuration file. Converted into a validated
     * {@link com.delta.requesttimer.schedule.model.JobConfig} before registration.
     */
    public static class ScheduleDefinition {
        private String id;
        private String name;
        private String url;
        private String method;
        private Map<String, String> headers = new LinkedHashMap<>();
        private String body;
        private Map<String, Object> jsonBody;
        private String scheduleType;
        private Long intervalSeconds;
        private String cronExpression;
        private Integer timeoutSeconds;
        private Integer retryCount;
        private Integer retryDelaySeconds;
        private boolean enabled = true;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }

        public String getBody() {
            return body;
        }

        public void setBody(String body) {
            this.body = body;
        }

        public Map<String, Object> getJsonBody() {
            return jsonBody;
        }

        public void setJsonBody(Map<String, Object> jsonBody) {
            this.jsonBody = jsonBody;
        }

        public String getScheduleType() {
            return scheduleType;
        }

        public void setScheduleType(String scheduleType) {
            this.scheduleType = scheduleType;
        }

        public Long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(Long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }

        public String getCronExpression() {
            return cronExpression;
        }

        public void setCronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
        }

        public Integer getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public Integer getRetryCount() {
            return retryCount;
        }

        public void setRetryCount(Integer retryCount) {
            this.retryCount = retryCount;
        }

        public Integer getRetryDelaySeconds() {
            return retryDelaySeconds;
        }

        public void setRetryDelaySeconds(Integer retryDelaySeconds) {
            this.retryDelaySeconds = retryDelaySeconds;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
