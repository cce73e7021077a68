package in.makerflow.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.domain.market.Quote;
import in.makerflow.infrastructure.stream.QuoteStreamManager;
import in.makerflow.infrastructure.stream.StreamState;
import io.prometheus.client.Collector;
import io.prometheus.client.Collector.MetricFamilySamples;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Operational HTTP endpoints.
 *
 * Routes:
 * - GET /metrics          Prometheus exposition of the registry plus quote stream gauges;
 *                          name[] (or name) narrows it to the listed samples
 * - GET /health           quote stream state and cache size (503 unless connected)
 * - GET /quotes/{symbol}  latest cached quote, 404 when the symbol has none
 */
public class OpsServer {
    private static final Logger log = LoggerFactory.getLogger(OpsServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final QuoteStreamManager quotes;
    private final CollectorRegistry registry;
    private Undertow server;
    private int port = -1;

    public OpsServer(QuoteStreamManager quotes, CollectorRegistry registry) {
        this.quotes = quotes;
        this.registry = registry;
    }

    /**
     * Start listening. Port 0 binds an ephemeral port, see {@link #getPort()}.
     */
    public synchronized void start(int requestedPort) {
        if (server != null) {
            log.warn("[OPS] Server already running on port {}", port);
            return;
        }
        RoutingHandler routes = Handlers.routing()
            .get("/metrics", this::metrics)
            .get("/health", this::health)
            .get("/quotes/{symbol}", this::quote)
            .setFallbackHandler(exchange -> sendError(exchange, StatusCodes.NOT_FOUND,
                "Routes: GET /metrics, /health, /quotes/{symbol}"));

        Undertow started = Undertow.builder()
            .addHttpListener(requestedPort, "0.0.0.0")
            .setHandler(routes)
            .build();
        started.start();
        server = started;
        port = ((InetSocketAddress) started.getListenerInfo().get(0).getAddress()).getPort();
        log.info("[OPS] Ops server started on http://localhost:{}/", port);
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stop();
        server = null;
        log.info("[OPS] Ops server on port {} stopped", port);
        port = -1;
    }

    public synchronized int getPort() {
        return port;
    }

    void metrics(HttpServerExchange exchange) {
        Set<String> included = new HashSet<>();
        for (String key : List.of("name[]", "name")) {
            Deque<String> names = exchange.getQueryParameters().get(key);
            if (names != null) {
                included.addAll(names);
            }
        }
        List<MetricFamilySamples> families = Collections.list(included.isEmpty()
            ? registry.metricFamilySamples() : registry.filteredMetricFamilySamples(included));
        for (MetricFamilySamples family : streamGauges()) {
            if (included.isEmpty() || included.contains(family.name)) {
                families.add(family);
            }
        }

        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        StringWriter writer = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, writer, Collections.enumeration(families));
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Error exporting metrics: " + e.getMessage());
            return;
        }
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(writer.toString(), StandardCharsets.UTF_8);
        log.debug("[METRICS] Served {} families", families.size());
    }

    /**
     * Quote stream state read at scrape time.
     */
    private List<MetricFamilySamples> streamGauges() {
        Duration age = quotes.getConnectionAge();
        List<MetricFamilySamples> gauges = new ArrayList<>();
        gauges.add(gauge("quote_cache_symbols", "Symbols with a cached quote", quotes.getCache().size()));
        gauges.add(gauge("quote_stream_connection_age_seconds", "Age of the current quote stream connection",
            age == null ? 0 : age.toMillis() / 1000.0));
        gauges.add(gauge("quote_stream_connects", "Quote stream connections made since start",
            quotes.getConnectCount()));
        return gauges;
    }

    private static MetricFamilySamples gauge(String name, String help, double value) {
        return new MetricFamilySamples(name, Collector.Type.GAUGE, help,
            List.of(new MetricFamilySamples.Sample(name, List.of(), List.of(), value)));
    }

    void health(HttpServerExchange exchange) throws Exception {
        StreamState state = quotes.getState();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", state == StreamState.CONNECTED ? "UP" : "DEGRADED");
        body.put("quote_stream", state.name());
        body.put("cached_symbols", quotes.getCache().size());
        body.put("connect_count", quotes.getConnectCount());
        Duration age = quotes.getConnectionAge();
        body.put("connection_age_ms", age == null ? null : age.toMillis());
        sendJson(exchange, state == StreamState.CONNECTED ? StatusCodes.OK : StatusCodes.SERVICE_UNAVAILABLE, body);
    }

    void quote(HttpServerExchange exchange) throws Exception {
        Deque<String> param = exchange.getQueryParameters().get("symbol");
        String symbol = param == null ? null : param.getFirst();
        if (symbol == null || symbol.isBlank()) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Missing symbol");
            return;
        }
        Optional<Quote> quote = quotes.getQuote(symbol.toUpperCase());
        if (quote.isEmpty()) {
            sendError(exchange, StatusCodes.NOT_FOUND, "No quote for " + symbol.toUpperCase());
            return;
        }
        Quote q = quote.get();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", q.symbol());
        body.put("best_bid", q.bestBid().toPlainString());
        body.put("best_ask", q.bestAsk().toPlainString());
        body.put("observed_at", DateTimeFormatter.ISO_INSTANT.format(q.observedAt()));
        body.put("received_at", DateTimeFormatter.ISO_INSTANT.format(q.receivedAt()));
        sendJson(exchange, StatusCodes.OK, body);
    }

    private void sendJson(HttpServerExchange exchange, int status, Object data) throws Exception {
        String json = MAPPER.writeValueAsString(data);
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int status, String message) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
