package in.makerflow.infrastructure.venue.rest;

import in.makerflow.domain.market.SymbolFilters;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide cache of symbol filters for one venue endpoint.
 *
 * Created once at startup for a venue base URL and handed to every collaborator
 * that needs tick or step sizes. Filters change rarely; the whole map is replaced
 * on warmup and single symbols are added on demand.
 */
public final class SymbolFilterCache {

    private final String venueBaseUrl;
    private final Map<String, SymbolFilters> filters = new ConcurrentHashMap<>();
    private volatile Instant loadedAt;

    public SymbolFilterCache(String venueBaseUrl) {
        if (venueBaseUrl == null || venueBaseUrl.isBlank()) {
            throw new IllegalArgumentException("Venue base URL cannot be null or empty");
        }
        this.venueBaseUrl = venueBaseUrl;
    }

    public String getVenueBaseUrl() {
        return venueBaseUrl;
    }

    public Optional<SymbolFilters> get(String symbol) {
        return Optional.ofNullable(filters.get(symbol.toUpperCase()));
    }

    public void put(SymbolFilters symbolFilters) {
        filters.put(symbolFilters.symbol().toUpperCase(), symbolFilters);
    }

    public void putAll(Collection<SymbolFilters> all) {
        for (SymbolFilters f : all) {
            put(f);
        }
        loadedAt = Instant.now();
    }

    /**
     * Time of the last full load, or null if never warmed up.
     */
    public Instant getLoadedAt() {
        return loadedAt;
    }

    public int size() {
        return filters.size();
    }

    public void clear() {
        filters.clear();
        loadedAt = null;
    }
}
