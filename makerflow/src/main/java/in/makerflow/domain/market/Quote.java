package in.makerflow.domain.market;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * Best bid/offer snapshot for one symbol.
 * Immutable; a newer observation replaces it in the cache.
 *
 * tickSize is null when the quote came from the stream, which does not carry filters.
 *
 * @param observedAt venue timestamp of the update
 * @param receivedAt local time the update arrived; age is measured from it
 */
public record Quote(
    String symbol,
    BigDecimal bestBid,
    BigDecimal bestAsk,
    BigDecimal tickSize,
    Instant observedAt,
    Instant receivedAt
) {
    public Quote {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (bestBid == null || bestBid.signum() <= 0) {
            throw new IllegalArgumentException("Best bid must be positive");
        }
        if (bestAsk == null || bestAsk.signum() <= 0) {
            throw new IllegalArgumentException("Best ask must be positive");
        }
        if (observedAt == null) {
            throw new IllegalArgumentException("Observed time cannot be null");
        }
        if (receivedAt == null) {
            receivedAt = observedAt;
        }
    }

    /**
     * Quote observed locally, so venue and receive time coincide.
     */
    public Quote(String symbol, BigDecimal bestBid, BigDecimal bestAsk, BigDecimal tickSize, Instant observedAt) {
        this(symbol, bestBid, bestAsk, tickSize, observedAt, observedAt);
    }

    public Quote withTickSize(BigDecimal tick) {
        return new Quote(symbol, bestBid, bestAsk, tick, observedAt, receivedAt);
    }

    /**
     * Age check against the local receive time, so venue clock skew does not count.
     */
    public boolean isOlderThan(Duration maxAge, Instant now) {
        return receivedAt.plus(maxAge).isBefore(now);
    }
}
