package in.makerflow.infrastructure.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keep-alive for one WebSocket connection.
 *
 * Every interval the watchdog either sends a ping or, when no pong arrived within the
 * timeout, expires: onExpired runs once and pinging stops. A ping that throws expires
 * the connection immediately.
 *
 * Bound to a single connection. After stop() it cannot be started again.
 *
 * Usage:
 * <pre>
 * PingWatchdog watchdog = new PingWatchdog("gen-3", Duration.ofSeconds(60), Duration.ofMinutes(10),
 *     () -> webSocket.sendPing(payload),
 *     () -> reconnect("heartbeat timeout"));
 * watchdog.start();
 * // Listener.onPong
 * watchdog.pongReceived();
 * </pre>
 */
public class PingWatchdog {
    private static final Logger log = LoggerFactory.getLogger(PingWatchdog.class);

    private final String label;
    private final Duration interval;
    private final Duration timeout;
    private final Runnable ping;
    private final Runnable onExpired;
    private final ScheduledExecutorService timer;
    private final AtomicBoolean expired = new AtomicBoolean(false);

    private volatile Instant lastPong;

    public PingWatchdog(String label, Duration interval, Duration timeout, Runnable ping, Runnable onExpired) {
        if (timeout.compareTo(interval) <= 0) {
            throw new IllegalArgumentException("Pong timeout " + timeout + " must exceed ping interval " + interval);
        }
        this.label = label;
        this.interval = interval;
        this.timeout = timeout;
        this.ping = ping;
        this.onExpired = onExpired;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "PingWatchdog-" + label);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (timer.isShutdown()) {
            throw new IllegalStateException("Watchdog " + label + " was stopped");
        }
        if (lastPong != null) {
            return;
        }
        lastPong = Instant.now();
        timer.scheduleAtFixedRate(this::tick, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("[QUOTES:{}] Watchdog started (ping {} ms, timeout {} ms)", label,
            interval.toMillis(), timeout.toMillis());
    }

    public synchronized void stop() {
        timer.shutdownNow();
    }

    /**
     * Any pong or ping frame from the peer proves the connection alive.
     */
    public void pongReceived() {
        lastPong = Instant.now();
    }

    public boolean isExpired() {
        return expired.get();
    }

    public boolean isRunning() {
        return lastPong != null && !timer.isShutdown();
    }

    /**
     * @return time since the last pong, or null before start
     */
    public Duration sinceLastPong() {
        Instant last = lastPong;
        return last == null ? null : Duration.between(last, Instant.now());
    }

    private void tick() {
        if (expired.get()) {
            return;
        }
        Duration silent = sinceLastPong();
        if (silent.compareTo(timeout) >= 0) {
            log.warn("[QUOTES:{}] No pong for {} ms", label, silent.toMillis());
            expire();
            return;
        }
        try {
            ping.run();
        } catch (RuntimeException e) {
            log.error("[QUOTES:{}] Ping failed: {}", label, e.getMessage(), e);
            expire();
        }
    }

    private void expire() {
        if (!expired.compareAndSet(false, true)) {
            return;
        }
        timer.shutdown();
        try {
            onExpired.run();
        } catch (RuntimeException e) {
            log.error("[QUOTES:{}] Expiry callback failed", label, e);
        }
    }
}
