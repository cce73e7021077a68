package in.makerflow.infrastructure.metrics;

import in.makerflow.domain.trade.TradeStatus;

import java.time.Duration;

/**
 * Venue and engine metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Order placement success/failure and latency
 * - Cancellations
 * - Entry chase retries
 * - Quote stream connection events and message rate
 * - Trade outcomes and per-account pool results
 */
public interface VenueMetrics {

    /**
     * Record successful order placement.
     *
     * @param orderType LIMIT, STOP_MARKET, ...
     * @param latency Placement latency
     */
    void recordOrderSuccess(String orderType, Duration latency);

    /**
     * Record failed order placement.
     *
     * @param orderType LIMIT, STOP_MARKET, ...
     * @param errorType REJECTED, TIMEOUT, TRANSPORT, ...
     * @param latency Time to failure
     */
    void recordOrderFailure(String orderType, String errorType, Duration latency);

    void recordOrderCancellation(boolean success, Duration latency);

    /**
     * Record an entry resubmission after a fill timeout.
     */
    void recordEntryRetry(String symbol, int attemptNumber);

    void recordConnectionEvent(ConnectionEvent event);

    void recordQuoteMessage();

    void recordTradeOutcome(TradeStatus status);

    void recordAccountResult(String operation, boolean success);

    enum ConnectionEvent {
        CONNECTED,
        DISCONNECTED,
        CONNECT_FAILED,
        HEARTBEAT_TIMEOUT,
        SCHEDULED_RECONNECT
    }

    /**
     * Metrics sink that drops everything, for tests and tools.
     */
    VenueMetrics NOOP = new VenueMetrics() {
        @Override
        public void recordOrderSuccess(String orderType, Duration latency) {}

        @Override
        public void recordOrderFailure(String orderType, String errorType, Duration latency) {}

        @Override
        public void recordOrderCancellation(boolean success, Duration latency) {}

        @Override
        public void recordEntryRetry(String symbol, int attemptNumber) {}

        @Override
        public void recordConnectionEvent(ConnectionEvent event) {}

        @Override
        public void recordQuoteMessage() {}

        @Override
        public void recordTradeOutcome(TradeStatus status) {}

        @Override
        public void recordAccountResult(String operation, boolean success) {}
    };
}
