package in.makerflow.infrastructure.stream;

import in.makerflow.domain.market.Quote;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory cache of the latest best bid/offer per symbol.
 * One writer (the stream task), many readers. Entries are replaced, never mutated.
 */
public final class QuoteCache {

    private final ConcurrentHashMap<String, Quote> latestQuotes = new ConcurrentHashMap<>();

    /**
     * Store a quote, replacing any older one for the same symbol. Last write wins.
     */
    public void update(Quote quote) {
        latestQuotes.put(quote.symbol(), quote);
    }

    public Optional<Quote> get(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(latestQuotes.get(symbol.toUpperCase()));
    }

    /**
     * Snapshot of all cached quotes (for monitoring).
     */
    public Map<String, Quote> getAll() {
        return Map.copyOf(latestQuotes);
    }

    public void clear() {
        latestQuotes.clear();
    }

    public int size() {
        return latestQuotes.size();
    }
}
