package in.makerflow.bootstrap;

import in.makerflow.config.EngineConfig;
import in.makerflow.config.QuoteStreamConfig;
import in.makerflow.config.UserStreamConfig;
import in.makerflow.config.VenueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup configuration validator.
 *
 * Runs before any connection is opened. Impossible settings throw IllegalStateException
 * and the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @throws IllegalStateException if any setting is invalid
     */
    public static void validate(EngineConfig engine, QuoteStreamConfig stream, VenueConfig venue) {
        validate(engine, stream, venue, UserStreamConfig.defaults());
    }

    /**
     * @throws IllegalStateException if any setting is invalid
     */
    public static void validate(EngineConfig engine, QuoteStreamConfig stream, VenueConfig venue,
                                UserStreamConfig userStream) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        validateEngine(engine);
        log.info("✓ Entry engine: retries={} fillTimeout={}ms poll={}ms chase={}% ticks={} hedge={}",
            engine.maxRetries(), engine.fillTimeoutMs(), engine.pollIntervalMs(),
            engine.maxChasePercent().toPlainString(), engine.ticksDistance(), engine.hedgeMode());

        validateStream(stream);
        log.info("✓ Quote stream: {} ping={}s pongTimeout={}s backoff={}s reconnect at {}",
            stream.url(), stream.pingInterval().toSeconds(), stream.pongTimeout().toSeconds(),
            stream.reconnectBackoff().toSeconds(), stream.proactiveReconnectAge());

        validateVenue(venue);
        log.info("✓ Venue: {} timeout={}ms recvWindow={}ms readRetries={}",
            venue.baseUrl(), venue.requestTimeout().toMillis(), venue.recvWindowMs(), venue.maxReadRetries());

        validateUserStream(userStream);
        if (userStream.enabled()) {
            log.info("✓ User data streams: {} keepalive={}min backoff={}s", userStream.url(),
                userStream.keepAliveInterval().toMinutes(), userStream.reconnectBackoff().toSeconds());
        } else {
            log.info("✓ User data streams disabled");
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateEngine(EngineConfig engine) {
        if (engine.maxRetries() < 0) {
            fail("ENTRY_MAX_RETRIES must be >= 0, got " + engine.maxRetries());
        }
        if (engine.fillTimeoutMs() <= 0) {
            fail("ENTRY_FILL_TIMEOUT_MS must be positive, got " + engine.fillTimeoutMs());
        }
        if (engine.pollIntervalMs() <= 0 || engine.pollIntervalMs() > engine.fillTimeoutMs()) {
            fail("ENTRY_POLL_INTERVAL_MS must be positive and not above ENTRY_FILL_TIMEOUT_MS, got "
                + engine.pollIntervalMs());
        }
        if (engine.maxChasePercent() == null || engine.maxChasePercent().signum() < 0) {
            fail("ENTRY_MAX_CHASE_PERCENT must be >= 0, got " + engine.maxChasePercent());
        }
        if (engine.ticksDistance() < 0) {
            fail("ENTRY_TICKS_DISTANCE must be >= 0, got " + engine.ticksDistance());
        }
    }

    private static void validateStream(QuoteStreamConfig stream) {
        if (stream.url() == null || stream.url().isBlank()) {
            fail("QUOTE_STREAM_URL must be set");
        }
        if (stream.pingInterval().toMillis() <= 0 || stream.pongTimeout().compareTo(stream.pingInterval()) <= 0) {
            fail("QUOTE_PING_INTERVAL_MS must be positive and below QUOTE_PONG_TIMEOUT_MS ("
                + stream.pingInterval().toMillis() + " vs " + stream.pongTimeout().toMillis() + ")");
        }
        if (stream.reconnectBackoff().toMillis() <= 0) {
            fail("QUOTE_RECONNECT_BACKOFF_MS must be positive");
        }
        if (stream.maxConnectionAge().toMillis() <= 0) {
            fail("QUOTE_MAX_CONNECTION_AGE_MS must be positive");
        }
        if (!(stream.reconnectFraction() > 0 && stream.reconnectFraction() <= 1.0)) {
            fail("QUOTE_RECONNECT_FRACTION must be in (0, 1], got " + stream.reconnectFraction());
        }
    }

    private static void validateVenue(VenueConfig venue) {
        if (venue.baseUrl() == null || !venue.baseUrl().startsWith("http")) {
            fail("VENUE_BASE_URL must be an http(s) URL, got " + venue.baseUrl());
        }
        if (venue.requestTimeout().toMillis() <= 0) {
            fail("VENUE_REQUEST_TIMEOUT_MS must be positive");
        }
        if (venue.recvWindowMs() <= 0 || venue.recvWindowMs() > 60_000) {
            fail("VENUE_RECV_WINDOW_MS must be in 1..60000, got " + venue.recvWindowMs());
        }
        if (venue.maxReadRetries() < 0) {
            fail("VENUE_MAX_RETRIES must be >= 0");
        }
    }

    private static void validateUserStream(UserStreamConfig userStream) {
        if (!userStream.enabled()) {
            return;
        }
        if (userStream.url() == null || userStream.url().isBlank()) {
            fail("USER_STREAM_URL must be set");
        }
        if (!userStream.isValid()) {
            fail("USER_STREAM_KEEPALIVE_MS must be positive and below the 60 minute listen key validity, got "
                + userStream.keepAliveInterval().toMillis());
        }
    }

    private static void fail(String reason) {
        throw new IllegalStateException("❌ INVALID CONFIG: " + reason + "\nSystem refuses to start.");
    }

    private StartupConfigValidator() {}
}
