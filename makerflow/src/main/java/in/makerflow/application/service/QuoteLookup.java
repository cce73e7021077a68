package in.makerflow.application.service;

import in.makerflow.domain.market.Quote;
import in.makerflow.domain.market.SymbolFilters;
import in.makerflow.infrastructure.stream.QuoteCache;
import in.makerflow.infrastructure.venue.QuoteSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Fresh best bid/offer for a symbol: the streaming cache when its entry is recent,
 * otherwise the top of the REST order book. Tick and step sizes come from the symbol filter cache.
 */
public class QuoteLookup {
    private static final Logger log = LoggerFactory.getLogger(QuoteLookup.class);

    static final int BOOK_DEPTH = 5;

    private final QuoteCache cache;
    private final QuoteSource restSource;
    private final Duration maxStreamAge;
    private final Clock clock;

    public QuoteLookup(QuoteCache cache, QuoteSource restSource, Duration maxStreamAge) {
        this(cache, restSource, maxStreamAge, Clock.systemUTC());
    }

    public QuoteLookup(QuoteCache cache, QuoteSource restSource, Duration maxStreamAge, Clock clock) {
        this.cache = cache;
        this.restSource = restSource;
        this.maxStreamAge = maxStreamAge;
        this.clock = clock;
    }

    public CompletableFuture<Quote> fresh(String symbol) {
        Optional<Quote> cached = cache == null ? Optional.empty() : cache.get(symbol);
        if (cached.isPresent() && !cached.get().isOlderThan(maxStreamAge, clock.instant())) {
            return CompletableFuture.completedFuture(cached.get());
        }
        if (cached.isPresent()) {
            log.debug("[QUOTES] Cached {} quote is stale, using order book", symbol);
        }
        return restSource.getOrderBook(symbol, BOOK_DEPTH).thenApply(book -> book.toQuote(null));
    }

    public CompletableFuture<SymbolFilters> filters(String symbol) {
        return restSource.getSymbolFilters(symbol);
    }
}
