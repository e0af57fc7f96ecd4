package com.delta.requesttimer.schedule.api;

import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class TimerApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;
    private MockWebServer server;

    @BeforeEach
    void setUp() throws Exception {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void invalidScheduleIsRejectedWithValidationError() throws Exception {
        mockMvc.perform(put("/api/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"id":"bad-url","url":"ftp://example.com","method":"GET","scheduleType":"interval","intervalSeconds":10}
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("config_validation"))
            .andExpect(jsonPath("$.message").value(containsString("Invalid URL format")));

        mockMvc.perform(get("/api/schedules/bad-url"))
            .andExpect(status().isNotFound());
    }

    @Test
    void scheduleLifecycleAndAdHocTestRun() throws Exception {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody("{\"healthy\":true}"));
        String url = server.url("/health").toString();

        mockMvc.perform(put("/api/schedules")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"id":"api-health","name":"Health","url":"%s","method":"get","scheduleType":"cron",
                     "cronExpression":"0 0 * * * *","retryCount":0,"timeoutSeconds":5}
                    """.formatted(url)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("api-health"))
            .andExpect(jsonPath("$.method").value("GET"))
            .andExpect(jsonPath("$.scheduleType").value("cron"))
            .andExpect(jsonPath("$.running").value(false));

        mockMvc.perform(get("/api/schedules"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalJobs").value(greaterThanOrEqualTo(1)))
            .andExpect(jsonPath("$.jobs['api-health'].name").value("Health"));

        mockMvc.perform(post("/api/schedules/test").param("scheduleId", "api-health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.statusCode").value(200))
            .andExpect(jsonPath("$.responseBody.healthy").value(true));

        mockMvc.perform(get("/api/history").param("scheduleId", "api-health").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1))
            .andExpect(jsonPath("$[0].success").value(true));

        mockMvc.perform(get("/api/statistics").param("scheduleId", "api-health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.schedules[0].totalRequests").value(1))
            .andExpect(jsonPath("$.notification.config.enabled").value(false));

        mockMvc.perform(get("/api/schedules/api-health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.runCount").value(0));

        mockMvc.perform(delete("/api/schedules/api-health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.removed").value(true));

        mockMvc.perform(delete("/api/schedules/api-health"))
            .andExpect(status().isNotFound());
    }

    @Test
    void schedulerStartStopIsIdempotent() throws Exception {
        mockMvc.perform(post("/api/scheduler/start"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.schedulerRunning").value(true));
        mockMvc.perform(post("/api/scheduler/start"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.schedulerRunning").value(true));
        mockMvc.perform(post("/api/scheduler/stop"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.schedulerRunning").value(false));
        mockMvc.perform(get("/api/scheduler/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.schedulerRunning").value(false));
    }

    @Test
    void statisticsAndHistoryEndpointsHandleEmptyAndBadInput() throws Exception {
        mockMvc.perform(get("/api/statistics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.totalRequests").value(greaterThanOrEqualTo(0)))
            .andExpect(jsonPath("$.notification.trackedJobs").value(0));

        mockMvc.perform(get("/api/history").param("scheduleId", "never-registered"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray())
            .andExpect(jsonPath("$.length()").value(0));

        mockMvc.perform(get("/api/history").param("from", "yesterday"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/history/cleanup").param("retentionDays", "365"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.retentionDays").value(365));

        mockMvc.perform(post("/api/schedules/test").param("scheduleId", "never-registered"))
            .andExpect(status().isNotFound());
    }

    @Test
    void notificationConfigCanBeUpdated() throws Exception {
        mockMvc.perform(put("/api/notifications/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"enabled":false,"serverAddress":"127.0.0.1","port":20000,"delayMs":50,
                     "notifyOnSuccess":true,"notifyOnFailure":true,"notifyOnResponseChange":true,
                     "notifyOnUnchanged":false,"maxResponseSizeBytes":2048}
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.config.port").value(20000))
            .andExpect(jsonPath("$.config.maxResponseSizeBytes").value(2048));
    }

    @Test
    void partialNotificationConfigKeepsOmittedFields() throws Exception {
        mockMvc.perform(put("/api/notifications/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"port\":20001,\"maxResponseSizeBytes\":512}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.config.port").value(20001));

        mockMvc.perform(put("/api/notifications/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"delayMs\":75}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.config.delayMs").value(75))
            .andExpect(jsonPath("$.config.port").value(20001))
            .andExpect(jsonPath("$.config.maxResponseSizeBytes").value(512))
            .andExpect(jsonPath("$.config.enabled").value(false));

        mockMvc.perform(put("/api/notifications/config")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"port\":0}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/statistics"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.notification.config.port").value(20001));
    }
}
