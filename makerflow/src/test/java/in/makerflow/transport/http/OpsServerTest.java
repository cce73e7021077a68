package in.makerflow.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.config.QuoteStreamConfig;
import in.makerflow.domain.market.Quote;
import in.makerflow.infrastructure.metrics.PrometheusVenueMetrics;
import in.makerflow.infrastructure.metrics.VenueMetrics;
import in.makerflow.infrastructure.stream.BookTickerParser;
import in.makerflow.infrastructure.stream.QuoteCache;
import in.makerflow.infrastructure.stream.QuoteStreamManager;
import in.makerflow.infrastructure.stream.StreamState;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Integration tests for OpsServer routes.
 *
 * Tests:
 * - /quotes/{symbol} serves cached quotes, 404 for unknown symbols
 * - /health is 503 unless the quote stream is connected
 * - /metrics exposes the registry and quote stream gauges, optionally filtered by name
 * - Unknown routes fall back to 404
 */
class OpsServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    private QuoteStreamManager quotes;
    private CollectorRegistry registry;
    private OpsServer ops;

    @BeforeEach
    void setUp() {
        quotes = new QuoteStreamManager(QuoteStreamConfig.defaults(), httpClient,
            new BookTickerParser(MAPPER), VenueMetrics.NOOP);
        registry = new CollectorRegistry();
        new PrometheusVenueMetrics(registry).recordQuoteMessage();
        ops = new OpsServer(quotes, registry);
        ops.start(0);
    }

    @AfterEach
    void tearDown() {
        ops.stop();
        quotes.close();
    }

    private HttpResponse<String> get(OpsServer server, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://localhost:" + server.getPort() + path))
            .GET().build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testQuoteRoute() throws Exception {
        quotes.getCache().update(new Quote("ETHUSDT", new BigDecimal("3000.00"), new BigDecimal("3000.01"),
            null, Instant.parse("2024-01-01T00:00:00Z")));

        HttpResponse<String> response = get(ops, "/quotes/ethusdt");

        assertEquals(200, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("ETHUSDT", body.get("symbol").asText());
        assertEquals("3000.00", body.get("best_bid").asText());
        assertEquals("3000.01", body.get("best_ask").asText());
        assertEquals("2024-01-01T00:00:00Z", body.get("observed_at").asText());
    }

    @Test
    void testUnknownQuote() throws Exception {
        HttpResponse<String> response = get(ops, "/quotes/DOGEUSDT");

        assertEquals(404, response.statusCode());
        assertEquals("No quote for DOGEUSDT", response.body());
    }

    @Test
    void testHealthDegradedWhenDisconnected() throws Exception {
        HttpResponse<String> response = get(ops, "/health");

        assertEquals(503, response.statusCode());
        JsonNode body = MAPPER.readTree(response.body());
        assertEquals("DEGRADED", body.get("status").asText());
        assertEquals("DISCONNECTED", body.get("quote_stream").asText());
        assertTrue(body.get("connection_age_ms").isNull());
    }

    @Test
    void testHealthUpWhenConnected() throws Exception {
        QuoteStreamManager connected = mock(QuoteStreamManager.class);
        when(connected.getState()).thenReturn(StreamState.CONNECTED);
        when(connected.getCache()).thenReturn(new QuoteCache());
        when(connected.getConnectCount()).thenReturn(3L);
        when(connected.getConnectionAge()).thenReturn(Duration.ofSeconds(42));
        OpsServer server = new OpsServer(connected, registry);
        server.start(0);
        try {
            HttpResponse<String> response = get(server, "/health");

            assertEquals(200, response.statusCode());
            JsonNode body = MAPPER.readTree(response.body());
            assertEquals("UP", body.get("status").asText());
            assertEquals(3, body.get("connect_count").asInt());
            assertEquals(42000, body.get("connection_age_ms").asLong());
        } finally {
            server.stop();
        }
    }

    @Test
    void testMetricsRoute() throws Exception {
        HttpResponse<String> response = get(ops, "/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"));
        assertTrue(response.body().contains("# TYPE"), response.body());
        assertTrue(response.body().contains("quote_stream_messages_total 1.0"), response.body());
        assertTrue(response.body().contains("venue_orders"), response.body());
    }

    @Test
    void testMetricsIncludeQuoteStreamGauges() throws Exception {
        quotes.getCache().update(new Quote("ETHUSDT", new BigDecimal("3000.00"), new BigDecimal("3000.01"),
            null, Instant.now()));
        quotes.getCache().update(new Quote("BTCUSDT", new BigDecimal("65000.0"), new BigDecimal("65000.1"),
            null, Instant.now()));

        String body = get(ops, "/metrics").body();

        assertTrue(body.contains("quote_cache_symbols 2.0"), body);
        assertTrue(body.contains("quote_stream_connection_age_seconds 0.0"), "Not connected: " + body);
        assertTrue(body.contains("quote_stream_connects 0.0"), body);
    }

    @Test
    void testMetricsNameFilter() throws Exception {
        String body = get(ops, "/metrics?name=quote_stream_messages_total&name=quote_cache_symbols").body();

        assertTrue(body.contains("quote_stream_messages_total 1.0"), body);
        assertTrue(body.contains("quote_cache_symbols 0.0"), body);
        assertFalse(body.contains("venue_orders"), body);
        assertFalse(body.contains("quote_stream_connects"), body);
    }

    @Test
    void testFallbackAndLifecycle() throws Exception {
        assertEquals(404, get(ops, "/orders").statusCode());

        int port = ops.getPort();
        ops.start(0);
        assertEquals(port, ops.getPort(), "Second start is ignored");

        ops.stop();
        assertEquals(-1, ops.getPort());
    }
}
