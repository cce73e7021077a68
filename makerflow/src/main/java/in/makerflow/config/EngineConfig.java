package in.makerflow.config;

import in.makerflow.domain.trade.EntryParams;
import in.makerflow.util.Env;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Entry engine defaults applied to trade commands that do not override them.
 */
public record EngineConfig(
    int maxRetries,                 // Resubmissions after the first entry attempt
    long fillTimeoutMs,             // Wait per attempt before cancel and replace
    long pollIntervalMs,            // Order status polling interval
    BigDecimal maxChasePercent,     // Max reference price move from first attempt (0.1 = 0.1%)
    int ticksDistance,              // Ticks behind best bid/ask
    boolean hedgeMode               // Tag orders with LONG/SHORT position side
) {
    public static EngineConfig defaults() {
        return new EngineConfig(2, 1000, 200, new BigDecimal("0.1"), 0, false);
    }

    public static EngineConfig fromEnv() {
        return new EngineConfig(
            Env.getInt("ENTRY_MAX_RETRIES", 2),
            Env.getLong("ENTRY_FILL_TIMEOUT_MS", 1000),
            Env.getLong("ENTRY_POLL_INTERVAL_MS", 200),
            Env.getDecimal("ENTRY_MAX_CHASE_PERCENT", "0.1"),
            Env.getInt("ENTRY_TICKS_DISTANCE", 0),
            Env.getBool("HEDGE_MODE", false)
        );
    }

    public EntryParams entryParams() {
        return new EntryParams(maxRetries, Duration.ofMillis(fillTimeoutMs),
            Duration.ofMillis(pollIntervalMs), maxChasePercent, ticksDistance);
    }

    public boolean isValid() {
        return maxRetries >= 0
            && fillTimeoutMs > 0
            && pollIntervalMs > 0
            && pollIntervalMs <= fillTimeoutMs
            && maxChasePercent != null && maxChasePercent.signum() >= 0
            && ticksDistance >= 0;
    }
}
