package in.makerflow.domain.trade;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Maker entry retry and chase settings.
 *
 * @param maxRetries       resubmissions allowed after the first attempt
 * @param fillTimeout      wait per attempt before cancel and replace
 * @param pollInterval     order status polling interval
 * @param maxChasePercent  max move of the reference price from the first attempt, in percent
 * @param ticksDistance    ticks behind the best bid (buy) or ask (sell)
 */
public record EntryParams(
    int maxRetries,
    Duration fillTimeout,
    Duration pollInterval,
    BigDecimal maxChasePercent,
    int ticksDistance
) {
    public EntryParams {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("Max retries cannot be negative");
        }
        if (fillTimeout == null || fillTimeout.isNegative() || fillTimeout.isZero()) {
            throw new IllegalArgumentException("Fill timeout must be positive");
        }
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (maxChasePercent == null || maxChasePercent.signum() < 0) {
            throw new IllegalArgumentException("Max chase percent cannot be negative");
        }
        if (ticksDistance < 0) {
            throw new IllegalArgumentException("Ticks distance cannot be negative");
        }
    }

    public static EntryParams defaults() {
        return new EntryParams(2, Duration.ofMillis(1000), Duration.ofMillis(200), new BigDecimal("0.1"), 0);
    }

    public EntryParams withTicksDistance(int ticks) {
        return new EntryParams(maxRetries, fillTimeout, pollInterval, maxChasePercent, ticks);
    }
}
