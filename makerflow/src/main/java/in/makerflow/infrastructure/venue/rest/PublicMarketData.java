package in.makerflow.infrastructure.venue.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.config.VenueConfig;
import in.makerflow.domain.market.OrderBookSnapshot;
import in.makerflow.domain.market.SymbolFilters;
import in.makerflow.infrastructure.common.RetryBackoff;
import in.makerflow.infrastructure.venue.QuoteSource;
import in.makerflow.infrastructure.venue.VenueException;
import in.makerflow.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Unauthenticated market data over REST (order book depth and exchange filters).
 *
 * Symbol filters are served from the SymbolFilterCache passed in; a miss loads
 * exchangeInfo once and fills the cache for every symbol.
 */
public class PublicMarketData implements QuoteSource {
    private static final Logger log = LoggerFactory.getLogger(PublicMarketData.class);

    private static final String PUBLIC = "PUBLIC";

    private final VenueConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final SymbolFilterCache filterCache;
    private final VenueErrorMapper errorMapper;

    public PublicMarketData(VenueConfig config, HttpClient httpClient, ObjectMapper mapper,
                            SymbolFilterCache filterCache) {
        if (!filterCache.getVenueBaseUrl().equals(config.baseUrl())) {
            throw new IllegalArgumentException("Filter cache belongs to " + filterCache.getVenueBaseUrl()
                + ", not " + config.baseUrl());
        }
        this.config = config;
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.filterCache = filterCache;
        this.errorMapper = new VenueErrorMapper(mapper);
    }

    @Override
    public CompletableFuture<OrderBookSnapshot> getOrderBook(String symbol, int depth) {
        return get("/fapi/v1/depth", Map.of("symbol", symbol, "limit", Integer.toString(depth)), "Get order book")
            .thenApply(node -> VenueResponseParser.orderBook(symbol, node));
    }

    @Override
    public CompletableFuture<SymbolFilters> getSymbolFilters(String symbol) {
        Optional<SymbolFilters> cached = filterCache.get(symbol);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }
        return warmup().thenApply(count -> filterCache.get(symbol)
            .orElseThrow(() -> new VenueException(PUBLIC, "Unknown symbol " + symbol)));
    }

    /**
     * Load filters for every listed symbol into the cache.
     *
     * @return number of symbols loaded
     */
    public CompletableFuture<Integer> warmup() {
        return get("/fapi/v1/exchangeInfo", Map.of(), "Get exchange info")
            .thenApply(node -> {
                List<SymbolFilters> all = VenueResponseParser.symbolFilters(node);
                filterCache.putAll(all);
                log.info("[MARKET] Loaded filters for {} symbols from {}", all.size(), config.baseUrl());
                return all.size();
            });
    }

    public SymbolFilterCache getFilterCache() {
        return filterCache;
    }

    private CompletableFuture<JsonNode> get(String path, Map<String, String> params, String operation) {
        return attempt(path, params, operation, RetryBackoff.forVenueReads(config.maxReadRetries()));
    }

    private CompletableFuture<JsonNode> attempt(String path, Map<String, String> params, String operation,
                                                RetryBackoff backoff) {
        String query = params.isEmpty() ? "" : "?" + RequestSigner.encode(new TreeMap<>(params));
        HttpRequest request = HttpRequest.newBuilder(URI.create(config.baseUrl() + path + query))
            .timeout(config.requestTimeout())
            .GET()
            .build();

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .handle((response, error) -> {
                if (error != null) {
                    Throwable cause = Futures.unwrap(error);
                    if (cause instanceof HttpTimeoutException) {
                        throw VenueException.timeout(PUBLIC, operation, cause);
                    }
                    throw VenueException.transport(PUBLIC, operation, cause);
                }
                if (response.statusCode() / 100 != 2) {
                    throw errorMapper.forRequest(PUBLIC, operation, response.statusCode(), response.body());
                }
                try {
                    return mapper.readTree(response.body());
                } catch (IOException e) {
                    throw new VenueException(PUBLIC, "Unparseable response for " + operation, null,
                        response.statusCode(), false, e);
                }
            })
            .exceptionallyCompose(error -> {
                Throwable cause = Futures.unwrap(error);
                backoff.onFailure();
                if (cause instanceof VenueException && ((VenueException) cause).isRetryable() && backoff.canRetry()) {
                    Duration delay = backoff.nextDelay();
                    log.warn("[MARKET] {} failed, retrying in {} ms: {}", operation, delay.toMillis(), cause.getMessage());
                    return CompletableFuture.supplyAsync(() -> null,
                            CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS))
                        .thenCompose(ignored -> attempt(path, params, operation, backoff));
                }
                return CompletableFuture.failedFuture(cause);
            });
    }
}
