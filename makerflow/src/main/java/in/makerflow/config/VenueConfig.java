package in.makerflow.config;

import in.makerflow.util.Env;

import java.time.Duration;

/**
 * REST venue settings shared by every account session.
 */
public record VenueConfig(
    String baseUrl,
    Duration requestTimeout,
    long recvWindowMs,
    int maxReadRetries              // Retries for idempotent GETs only
) {
    public static final String DEFAULT_BASE_URL = "https://fapi.asterdex.com";

    public static VenueConfig defaults() {
        return new VenueConfig(DEFAULT_BASE_URL, Duration.ofSeconds(10), 5000, 3);
    }

    public static VenueConfig fromEnv() {
        return new VenueConfig(
            Env.get("VENUE_BASE_URL", DEFAULT_BASE_URL),
            Duration.ofMillis(Env.getLong("VENUE_REQUEST_TIMEOUT_MS", 10_000)),
            Env.getLong("VENUE_RECV_WINDOW_MS", 5000),
            Env.getInt("VENUE_MAX_RETRIES", 3)
        );
    }

    public boolean isValid() {
        return baseUrl != null && baseUrl.startsWith("http")
            && requestTimeout.toMillis() > 0
            && recvWindowMs > 0 && recvWindowMs <= 60_000
            && maxReadRetries >= 0;
    }
}
