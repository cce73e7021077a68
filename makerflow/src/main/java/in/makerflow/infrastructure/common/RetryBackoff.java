package in.makerflow.infrastructure.common;

import java.time.Duration;

/**
 * Attempt counter and delay schedule for one retried operation.
 *
 * The quote stream keeps one instance for its lifetime and resets it on every open.
 * REST reads create a fresh instance per call.
 *
 * Usage:
 * <pre>
 * RetryBackoff backoff = RetryBackoff.forVenueReads(3);
 * ...
 * backoff.onFailure();
 * if (retryable &amp;&amp; backoff.canRetry()) {
 *     schedule(retry, backoff.nextDelay());
 * }
 * </pre>
 */
public final class RetryBackoff {

    private final Duration firstDelay;
    private final Duration delayCap;
    private final double factor;
    private final int attemptLimit;

    private int failures;
    private Duration delay;

    private RetryBackoff(Duration firstDelay, Duration delayCap, double factor, int attemptLimit) {
        this.firstDelay = firstDelay;
        this.delayCap = delayCap;
        this.factor = factor;
        this.attemptLimit = attemptLimit;
        this.delay = firstDelay;
    }

    /**
     * @param firstDelay  wait before the first retry
     * @param delayCap    upper bound for any wait
     * @param factor      growth per failure after the first, at least 1.0
     * @param attemptLimit failures allowed before {@link #canRetry()} turns false
     */
    public static RetryBackoff exponential(Duration firstDelay, Duration delayCap, double factor, int attemptLimit) {
        if (firstDelay == null || firstDelay.isNegative() || firstDelay.isZero()) {
            throw new IllegalArgumentException("First delay must be positive");
        }
        if (delayCap == null || delayCap.compareTo(firstDelay) < 0) {
            throw new IllegalArgumentException("Delay cap must be at least the first delay");
        }
        if (factor < 1.0) {
            throw new IllegalArgumentException("Backoff factor must be at least 1.0, got " + factor);
        }
        if (attemptLimit <= 0) {
            throw new IllegalArgumentException("Attempt limit must be positive, got " + attemptLimit);
        }
        return new RetryBackoff(firstDelay, delayCap, factor, attemptLimit);
    }

    /**
     * Same wait after every failure, never gives up. The venue bans fast reconnect loops,
     * so the stream waits the full backoff every time.
     */
    public static RetryBackoff constant(Duration delay) {
        return exponential(delay, delay, 1.0, Integer.MAX_VALUE);
    }

    /**
     * 200 ms doubling up to 2 s.
     *
     * @param maxRetries retries after the first request
     */
    public static RetryBackoff forVenueReads(int maxRetries) {
        return exponential(Duration.ofMillis(200), Duration.ofSeconds(2), 2.0, Math.max(1, maxRetries + 1));
    }

    /**
     * Count a failed attempt. The wait for the retry that follows grows from the second failure on.
     */
    public synchronized void onFailure() {
        if (failures > 0) {
            long grown = (long) (delay.toMillis() * factor);
            delay = Duration.ofMillis(Math.min(grown, delayCap.toMillis()));
        }
        failures++;
    }

    public synchronized void onSuccess() {
        failures = 0;
        delay = firstDelay;
    }

    public synchronized boolean canRetry() {
        return failures < attemptLimit;
    }

    public synchronized Duration nextDelay() {
        return delay;
    }

    public synchronized int failures() {
        return failures;
    }
}
