package in.makerflow.bootstrap;

import in.makerflow.config.EngineConfig;
import in.makerflow.config.QuoteStreamConfig;
import in.makerflow.config.UserStreamConfig;
import in.makerflow.config.VenueConfig;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StartupConfigValidator.
 *
 * Tests:
 * - Defaults pass
 * - Each impossible setting refuses startup with the offending variable named
 */
class StartupConfigValidatorTest {

    private static final EngineConfig ENGINE = EngineConfig.defaults();
    private static final QuoteStreamConfig STREAM = QuoteStreamConfig.defaults();
    private static final VenueConfig VENUE = VenueConfig.defaults();

    private static void assertRejected(String variable, EngineConfig engine, QuoteStreamConfig stream,
                                       VenueConfig venue) {
        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(engine, stream, venue));
        assertTrue(e.getMessage().contains("INVALID CONFIG"), e.getMessage());
        assertTrue(e.getMessage().contains(variable), "Message should name " + variable + ": " + e.getMessage());
    }

    @Test
    void testDefaultsPass() {
        assertDoesNotThrow(() -> StartupConfigValidator.validate(ENGINE, STREAM, VENUE));
    }

    @Test
    void testUserStreamKeepAliveMustBeatListenKeyExpiry() {
        UserStreamConfig tooSlow = new UserStreamConfig(true, UserStreamConfig.DEFAULT_URL,
            Duration.ofMinutes(61), Duration.ofSeconds(5));
        UserStreamConfig disabled = new UserStreamConfig(false, UserStreamConfig.DEFAULT_URL,
            Duration.ofMinutes(61), Duration.ofSeconds(5));

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> StartupConfigValidator.validate(ENGINE, STREAM, VENUE, tooSlow));
        assertTrue(e.getMessage().contains("USER_STREAM_KEEPALIVE_MS"), e.getMessage());
        assertDoesNotThrow(() -> StartupConfigValidator.validate(ENGINE, STREAM, VENUE, disabled),
            "Disabled streams are not checked");
        assertDoesNotThrow(() -> StartupConfigValidator.validate(ENGINE, STREAM, VENUE, UserStreamConfig.defaults()));
    }

    @Test
    void testEngineSettingsRejected() {
        assertRejected("ENTRY_MAX_RETRIES",
            new EngineConfig(-1, 1000, 200, new BigDecimal("0.1"), 0, false), STREAM, VENUE);
        assertRejected("ENTRY_FILL_TIMEOUT_MS",
            new EngineConfig(2, 0, 200, new BigDecimal("0.1"), 0, false), STREAM, VENUE);
        assertRejected("ENTRY_POLL_INTERVAL_MS",
            new EngineConfig(2, 1000, 2000, new BigDecimal("0.1"), 0, false), STREAM, VENUE);
        assertRejected("ENTRY_MAX_CHASE_PERCENT",
            new EngineConfig(2, 1000, 200, new BigDecimal("-0.5"), 0, false), STREAM, VENUE);
        assertRejected("ENTRY_TICKS_DISTANCE",
            new EngineConfig(2, 1000, 200, new BigDecimal("0.1"), -3, false), STREAM, VENUE);
    }

    @Test
    void testStreamSettingsRejected() {
        assertRejected("QUOTE_STREAM_URL", ENGINE, new QuoteStreamConfig(" ", Duration.ofSeconds(60),
            Duration.ofMinutes(10), Duration.ofSeconds(5), Duration.ofHours(24), 0.95), VENUE);
        assertRejected("QUOTE_PING_INTERVAL_MS", ENGINE, new QuoteStreamConfig(QuoteStreamConfig.DEFAULT_URL,
            Duration.ofMinutes(10), Duration.ofMinutes(10), Duration.ofSeconds(5), Duration.ofHours(24), 0.95), VENUE);
        assertRejected("QUOTE_RECONNECT_BACKOFF_MS", ENGINE, new QuoteStreamConfig(QuoteStreamConfig.DEFAULT_URL,
            Duration.ofSeconds(60), Duration.ofMinutes(10), Duration.ZERO, Duration.ofHours(24), 0.95), VENUE);
        assertRejected("QUOTE_RECONNECT_FRACTION", ENGINE, new QuoteStreamConfig(QuoteStreamConfig.DEFAULT_URL,
            Duration.ofSeconds(60), Duration.ofMinutes(10), Duration.ofSeconds(5), Duration.ofHours(24), 1.5), VENUE);
    }

    @Test
    void testVenueSettingsRejected() {
        assertRejected("VENUE_BASE_URL", ENGINE, STREAM,
            new VenueConfig("fapi.example.com", Duration.ofSeconds(10), 5000, 3));
        assertRejected("VENUE_RECV_WINDOW_MS", ENGINE, STREAM,
            new VenueConfig(VenueConfig.DEFAULT_BASE_URL, Duration.ofSeconds(10), 90_000, 3));
        assertRejected("VENUE_MAX_RETRIES", ENGINE, STREAM,
            new VenueConfig(VenueConfig.DEFAULT_BASE_URL, Duration.ofSeconds(10), 5000, -1));
    }
}
