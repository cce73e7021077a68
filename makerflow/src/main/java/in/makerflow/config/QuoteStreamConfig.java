package in.makerflow.config;

import in.makerflow.util.Env;

import java.time.Duration;

/**
 * Quote stream connection settings.
 *
 * The venue drops connections after 24 hours and after 10 minutes without a pong,
 * and bans clients that reconnect too quickly.
 */
public record QuoteStreamConfig(
    String url,
    Duration pingInterval,
    Duration pongTimeout,
    Duration reconnectBackoff,
    Duration maxConnectionAge,
    double reconnectFraction        // Proactive reconnect at this share of maxConnectionAge
) {
    public static final String DEFAULT_URL = "wss://fstream.asterdex.com/ws/!bookTicker";

    public static QuoteStreamConfig defaults() {
        return new QuoteStreamConfig(DEFAULT_URL, Duration.ofSeconds(60), Duration.ofMinutes(10),
            Duration.ofSeconds(5), Duration.ofHours(24), 0.95);
    }

    public static QuoteStreamConfig fromEnv() {
        return new QuoteStreamConfig(
            Env.get("QUOTE_STREAM_URL", DEFAULT_URL),
            Duration.ofMillis(Env.getLong("QUOTE_PING_INTERVAL_MS", 60_000)),
            Duration.ofMillis(Env.getLong("QUOTE_PONG_TIMEOUT_MS", 600_000)),
            Duration.ofMillis(Env.getLong("QUOTE_RECONNECT_BACKOFF_MS", 5_000)),
            Duration.ofMillis(Env.getLong("QUOTE_MAX_CONNECTION_AGE_MS", Duration.ofHours(24).toMillis())),
            Env.getDouble("QUOTE_RECONNECT_FRACTION", 0.95)
        );
    }

    /**
     * Connection age at which the manager closes and reopens the stream itself.
     */
    public Duration proactiveReconnectAge() {
        return Duration.ofMillis((long) (maxConnectionAge.toMillis() * reconnectFraction));
    }

    public boolean isValid() {
        return url != null && !url.isBlank()
            && pingInterval.toMillis() > 0
            && pongTimeout.compareTo(pingInterval) > 0
            && reconnectBackoff.toMillis() > 0
            && maxConnectionAge.toMillis() > 0
            && reconnectFraction > 0 && reconnectFraction <= 1.0;
    }
}
