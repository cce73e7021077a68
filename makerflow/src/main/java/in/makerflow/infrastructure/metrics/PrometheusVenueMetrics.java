package in.makerflow.infrastructure.metrics;

import in.makerflow.domain.trade.TradeStatus;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of VenueMetrics.
 *
 * Key Metrics:
 * - venue_orders_total{order_type, status, error_type} - Order placement outcomes
 * - venue_order_latency_seconds{order_type} - Placement latency distribution
 * - venue_order_cancellations_total{status} - Cancel outcomes
 * - entry_retries_total{symbol} - Entry chase resubmissions
 * - quote_stream_connection_events_total{event} - Stream lifecycle events
 * - quote_stream_connected - 1 while the stream is connected
 * - quote_stream_messages_total - Quote messages applied to the cache
 * - trades_total{status} - Terminal trade outcomes
 * - account_results_total{operation, status} - Per-account pool results
 *
 * Usage:
 * <pre>
 * PrometheusVenueMetrics metrics = new PrometheusVenueMetrics(new CollectorRegistry());
 * OpsServer ops = new OpsServer(port, metrics.getRegistry(), quoteStream);
 * </pre>
 */
public class PrometheusVenueMetrics implements VenueMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusVenueMetrics.class);

    private final CollectorRegistry registry;

    private final Counter orderCounter;
    private final Histogram orderLatency;
    private final Counter cancellationCounter;
    private final Counter entryRetryCounter;
    private final Histogram entryRetryAttempts;
    private final Counter connectionEventCounter;
    private final Gauge connectionStatus;
    private final Counter quoteMessageCounter;
    private final Counter tradeCounter;
    private final Counter accountResultCounter;

    public PrometheusVenueMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusVenueMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.orderCounter = Counter.build()
            .name("venue_orders_total")
            .help("Total number of order placements")
            .labelNames("order_type", "status", "error_type")
            .register(registry);

        this.orderLatency = Histogram.build()
            .name("venue_order_latency_seconds")
            .help("Order placement latency in seconds")
            .labelNames("order_type")
            .buckets(0.01, 0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.cancellationCounter = Counter.build()
            .name("venue_order_cancellations_total")
            .help("Total number of order cancellations")
            .labelNames("status")
            .register(registry);

        this.entryRetryCounter = Counter.build()
            .name("entry_retries_total")
            .help("Total number of entry resubmissions after fill timeout")
            .labelNames("symbol")
            .register(registry);

        this.entryRetryAttempts = Histogram.build()
            .name("entry_retry_attempt")
            .help("Attempt number of entry resubmissions")
            .buckets(1, 2, 3, 5, 10)
            .register(registry);

        this.connectionEventCounter = Counter.build()
            .name("quote_stream_connection_events_total")
            .help("Total number of quote stream connection events")
            .labelNames("event")
            .register(registry);

        this.connectionStatus = Gauge.build()
            .name("quote_stream_connected")
            .help("Quote stream connection status (1=connected, 0=disconnected)")
            .register(registry);

        this.quoteMessageCounter = Counter.build()
            .name("quote_stream_messages_total")
            .help("Total number of quote messages applied to the cache")
            .register(registry);

        this.tradeCounter = Counter.build()
            .name("trades_total")
            .help("Total number of trade runs by final status")
            .labelNames("status")
            .register(registry);

        this.accountResultCounter = Counter.build()
            .name("account_results_total")
            .help("Total number of per-account pool results")
            .labelNames("operation", "status")
            .register(registry);

        log.info("[PrometheusVenueMetrics] Initialized");
    }

    @Override
    public void recordOrderSuccess(String orderType, Duration latency) {
        orderCounter.labels(orderType, "success", "none").inc();
        orderLatency.labels(orderType).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordOrderFailure(String orderType, String errorType, Duration latency) {
        orderCounter.labels(orderType, "failure", errorType).inc();
        orderLatency.labels(orderType).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordOrderCancellation(boolean success, Duration latency) {
        cancellationCounter.labels(success ? "success" : "failure").inc();
    }

    @Override
    public void recordEntryRetry(String symbol, int attemptNumber) {
        entryRetryCounter.labels(symbol).inc();
        entryRetryAttempts.observe(attemptNumber);
    }

    @Override
    public void recordConnectionEvent(ConnectionEvent event) {
        connectionEventCounter.labels(event.name()).inc();
        if (event == ConnectionEvent.CONNECTED) {
            connectionStatus.set(1);
        } else if (event != ConnectionEvent.CONNECT_FAILED) {
            connectionStatus.set(0);
        }
    }

    @Override
    public void recordQuoteMessage() {
        quoteMessageCounter.inc();
    }

    @Override
    public void recordTradeOutcome(TradeStatus status) {
        tradeCounter.labels(status.name()).inc();
    }

    @Override
    public void recordAccountResult(String operation, boolean success) {
        accountResultCounter.labels(operation, success ? "success" : "failure").inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
