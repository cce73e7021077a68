package in.makerflow.infrastructure.venue;

import in.makerflow.domain.market.OrderBookSnapshot;
import in.makerflow.domain.market.SymbolFilters;

import java.util.concurrent.CompletableFuture;

/**
 * On-demand public market data.
 * The streaming side of the quote source is QuoteStreamManager.
 */
public interface QuoteSource {

    /**
     * Top levels of the order book.
     *
     * @param depth Levels per side (the venue accepts 5, 10, 20, 50, 100, 500, 1000)
     */
    CompletableFuture<OrderBookSnapshot> getOrderBook(String symbol, int depth);

    /**
     * Tick size and step size for a symbol.
     *
     * @throws VenueException (via the future) if the symbol is unknown
     */
    CompletableFuture<SymbolFilters> getSymbolFilters(String symbol);
}
