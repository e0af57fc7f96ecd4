package com.delta.requesttimer.schedule.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * One delay timer shared by every caller. Each send cancels the pending message and re-arms the
 * timer, so only the payload current when the timer fires is transmitted.
 */
@Component
public class DebouncedNotificationSender {
    private static final Logger log = LoggerFactory.getLogger(DebouncedNotificationSender.class);
    private static final long DEFAULT_DELAY_MS = 1000;

    private final DatagramTransport transport;
    private final ScheduledExecutorService timer;
    private ScheduledFuture<?> pending;
    private long delayMs = DEFAULT_DELAY_MS;

    public DebouncedNotificationSender(DatagramTransport transport) {
        this.transport = transport;
        this.timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("notification-debounce");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void send(String host, int port, byte[] payload) {
        if (pending != null) {
            pending.cancel(false);
        }
        pending = timer.schedule(() -> transmit(host, port, payload), delayMs, TimeUnit.MILLISECONDS);
    }

    public synchronized void setDelayMs(long delayMs) {
        this.delayMs = Math.max(0, delayMs);
    }

    public synchronized boolean hasPending() {
        return pending != null && !pending.isDone();
    }

    @PreDestroy
    public void shutdown() {
        timer.shutdownNow();
    }

    private void transmit(String host, int port, byte[] payload) {
        try {
            transport.send(host, port, payload);
            log.debug("Notification datagram sent to {}:{} ({} bytes)", host, port, payload.length);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to send notification datagram to {}:{}", host, port, e);
        }
    }
}
