package com.delta.requesttimer.schedule.http;

import com.delta.requesttimer.config.TimerProperties;
import com.delta.requesttimer.schedule.model.JobConfig;
import com.delta.requesttimer.schedule.model.RequestResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Performs one job's HTTP call. Attempts run sequentially on the calling thread, each bounded by
 * the job's timeout, with a fixed delay between a failed attempt and the next one.
 * Exhausting every attempt yields a failed {@link RequestResult}; nothing is thrown.
 */
@Service
public class RequestExecutor {
    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);
    private static final String TIMESTAMP_FIELD = "timestamp";
    private static final String AUTO_TIMESTAMP = "auto";

    private final TimerProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RequestExecutor(
        TimerProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(properties.getHttp().isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
            .connectTimeout(Duration.ofSeconds(properties.getHttp().getDefaultTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor);
        if (!properties.getHttp().isVerifySsl()) {
            log.warn("TLS certificate verification is disabled for outbound requests");
            builder.sslContext(trustAllContext());
        }
        this.client = builder.build();
        this.globalLimiter = new Semaphore(properties.getHttp().getMaxConcurrentRequests());
    }

    public RequestResult execute(JobConfig config) {
        Instant startedAt = clock.instant();
        int maxAttempts = Math.max(1, config.retryCount() + 1);
        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            AttemptOutcome outcome = executeOnce(config, attempt);
            if (outcome.response() != null) {
                log.info("Request {} completed successfully on attempt {}", config.id(), attempt);
                return toSuccess(config, startedAt, attempt, outcome);
            }
            lastError = outcome.error();
            log.warn("Request {} failed on attempt {}: {}", config.id(), attempt, lastError);
            if (outcome.interrupted()) {
                return RequestResult.failure(config.id(), startedAt, attempt, lastError);
            }
            if (attempt < maxAttempts && !sleepRetryDelay(config.retryDelaySeconds())) {
                return RequestResult.failure(config.id(), startedAt, attempt, lastError);
            }
        }
        return RequestResult.failure(config.id(), startedAt, maxAttempts, lastError);
    }

    private AttemptOutcome executeOnce(JobConfig config, int attempt) {
        HttpRequest request;
        try {
            request = buildRequest(config);
        } catch (IllegalArgumentException | JsonProcessingException e) {
            return AttemptOutcome.failed("Invalid request: " + e.getMessage());
        }

        boolean acquired = false;
        CompletableFuture<HttpResponse<byte[]>> pending = null;
        long deadlineNanos = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.timeoutSeconds());
        try {
            acquired = globalLimiter.tryAcquire(config.timeoutSeconds(), TimeUnit.SECONDS);
            if (!acquired) {
                log.debug("No request slot for {} within {}s", config.id(), config.timeoutSeconds());
                return AttemptOutcome.failed(timedOut(config));
            }
            log.debug("Sending {} request to {} (attempt {})", config.method(), config.url(), attempt);
            long startNanos = System.nanoTime();
            pending = client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
            HttpResponse<byte[]> response = pending.get(Math.max(0L, deadlineNanos - startNanos), TimeUnit.NANOSECONDS);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            log.debug("Response received: {} in {}ms", response.statusCode(), elapsedMs);
            if (response.statusCode() >= 400) {
                return AttemptOutcome.failed("HTTP " + response.statusCode());
            }
            return new AttemptOutcome(response, elapsedMs, null, false);
        } catch (TimeoutException e) {
            pending.cancel(true);
            return AttemptOutcome.failed(timedOut(config));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof HttpTimeoutException) {
                return AttemptOutcome.failed(timedOut(config));
            }
            return AttemptOutcome.failed(describe(cause));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (pending != null) {
                pending.cancel(true);
            }
            return new AttemptOutcome(null, 0L, "Request interrupted", true);
        } catch (RuntimeException e) {
            return AttemptOutcome.failed(describe(e));
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    HttpRequest buildRequest(JobConfig config) throws JsonProcessingException {
        URI uri = URI.create(config.url().trim());
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(config.timeoutSeconds()))
            .header("User-Agent", properties.getHttp().getUserAgent());

        String payload = null;
        JsonNode body = config.body();
        if (body != null && !body.isNull()) {
            if (body.isObject() || body.isArray()) {
                payload = objectMapper.writeValueAsString(resolveAutoFields(body));
                builder.header("Content-Type", "application/json");
            } else if (body.isTextual()) {
                payload = body.textValue();
            } else {
                payload = body.asText();
            }
        }
        for (Map.Entry<String, String> header : config.headers().entrySet()) {
            builder.setHeader(header.getKey(), header.getValue() == null ? "" : header.getValue());
        }
        HttpRequest.BodyPublisher publisher = payload == null
            ? HttpRequest.BodyPublishers.noBody()
            : HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8);
        return builder.method(config.method().toUpperCase(Locale.ROOT), publisher).build();
    }

    /**
     * Copies a structured body, replacing a top-level {@code "timestamp": "auto"} with the current time.
     */
    JsonNode resolveAutoFields(JsonNode body) {
        if (!body.isObject()) {
            return body;
        }
        JsonNode timestamp = body.get(TIMESTAMP_FIELD);
        if (timestamp == null || !timestamp.isTextual() || !AUTO_TIMESTAMP.equals(timestamp.textValue())) {
            return body;
        }
        ObjectNode copy = ((ObjectNode) body).deepCopy();
        copy.put(TIMESTAMP_FIELD, clock.instant().toString());
        return copy;
    }

    JsonNode parseBody(byte[] bytes) {
        String text = bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8);
        if (text.isBlank()) {
            return TextNode.valueOf(text);
        }
        try {
            JsonNode parsed = objectMapper.readTree(text);
            return parsed == null || parsed.isMissingNode() ? TextNode.valueOf(text) : parsed;
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(text);
        }
    }

    private RequestResult toSuccess(JobConfig config, Instant startedAt, int attempt, AttemptOutcome outcome) {
        HttpResponse<byte[]> response = outcome.response();
        Map<String, String> headers = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : response.headers().map().entrySet()) {
            headers.put(entry.getKey(), String.join(", ", entry.getValue()));
        }
        return RequestResult.success(
            config.id(),
            startedAt,
            attempt,
            response.statusCode(),
            parseBody(response.body()),
            headers,
            outcome.responseTimeMs(),
            response.uri().toString(),
            config.method().toUpperCase(Locale.ROOT)
        );
    }

    private boolean sleepRetryDelay(int delaySeconds) {
        if (delaySeconds <= 0) {
            return true;
        }
        try {
            TimeUnit.SECONDS.sleep(delaySeconds);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String timedOut(JobConfig config) {
        return "Request timed out after " + config.timeoutSeconds() + "s";
    }

    private String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return message;
    }

    private static SSLContext trustAllContext() {
        TrustManager[] trustAll = new TrustManager[] {
            new X509TrustManager() {
                @Override
                public void checkClientTrusted(X509Certificate[] chain, String authType) {
                    // accept any client certificate
                }

                @Override
                public void checkServerTrusted(X509Certificate[] chain, String authType) {
                    // accept any server certificate
                }

                @Override
                public X509Certificate[] getAcceptedIssuers() {
                    return new X509Certificate[0];
                }
            }
        };
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustAll, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Unable to build permissive TLS context", e);
        }
    }

    private record AttemptOutcome(HttpResponse<byte[]> response, long responseTimeMs, String error, boolean interrupted) {
        static AttemptOutcome failed(String error) {
            return new AttemptOutcome(null, 0L, error, false);
        }
    }
}
