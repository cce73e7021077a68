package in.makerflow.config;

import in.makerflow.util.Env;

import java.time.Duration;

/**
 * Per-account user data stream settings.
 *
 * The venue expires a listen key 60 minutes after its last keepalive.
 */
public record UserStreamConfig(
    boolean enabled,
    String url,                     // Stream base; the listen key is appended as a path segment
    Duration keepAliveInterval,
    Duration reconnectBackoff
) {
    public static final String DEFAULT_URL = "wss://fstream.asterdex.com/ws";
    static final Duration LISTEN_KEY_VALIDITY = Duration.ofMinutes(60);

    public static UserStreamConfig defaults() {
        return new UserStreamConfig(true, DEFAULT_URL, Duration.ofMinutes(30), Duration.ofSeconds(5));
    }

    public static UserStreamConfig fromEnv() {
        return new UserStreamConfig(
            Env.getBool("USER_STREAM_ENABLED", true),
            Env.get("USER_STREAM_URL", DEFAULT_URL),
            Duration.ofMillis(Env.getLong("USER_STREAM_KEEPALIVE_MS", Duration.ofMinutes(30).toMillis())),
            Duration.ofMillis(Env.getLong("USER_STREAM_RECONNECT_BACKOFF_MS", 5_000))
        );
    }

    public String streamUrl(String listenKey) {
        return (url.endsWith("/") ? url : url + "/") + listenKey;
    }

    public boolean isValid() {
        return url != null && !url.isBlank()
            && keepAliveInterval.toMillis() > 0
            && keepAliveInterval.compareTo(LISTEN_KEY_VALIDITY) < 0
            && reconnectBackoff.toMillis() > 0;
    }
}
