package in.makerflow.domain.market;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Top of the order book as returned by the depth endpoint.
 */
public record OrderBookSnapshot(
    String symbol,
    List<PriceLevel> bids,
    List<PriceLevel> asks,
    Instant observedAt
) {
    public record PriceLevel(BigDecimal price, BigDecimal quantity) {}

    public OrderBookSnapshot {
        bids = bids == null ? List.of() : List.copyOf(bids);
        asks = asks == null ? List.of() : List.copyOf(asks);
    }

    /**
     * Best bid/ask as a Quote.
     *
     * @throws IllegalStateException if either side of the book is empty
     */
    public Quote toQuote(BigDecimal tickSize) {
        if (bids.isEmpty() || asks.isEmpty()) {
            throw new IllegalStateException("Order book for " + symbol + " has an empty side");
        }
        return new Quote(symbol, bids.get(0).price(), asks.get(0).price(), tickSize, observedAt);
    }
}
