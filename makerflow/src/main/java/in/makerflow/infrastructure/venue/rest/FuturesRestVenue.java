package in.makerflow.infrastructure.venue.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.config.VenueConfig;
import in.makerflow.domain.account.AccountConfig;
import in.makerflow.domain.account.AccountInfo;
import in.makerflow.domain.account.Balance;
import in.makerflow.domain.account.Position;
import in.makerflow.domain.order.OrderRequest;
import in.makerflow.domain.order.OrderResponse;
import in.makerflow.domain.order.OrderStatus;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.infrastructure.common.RetryBackoff;
import in.makerflow.infrastructure.metrics.VenueMetrics;
import in.makerflow.infrastructure.venue.OrderCancellationException;
import in.makerflow.infrastructure.venue.OrderCancellationException.CancelFailure;
import in.makerflow.infrastructure.venue.OrderRejectedException;
import in.makerflow.infrastructure.venue.UserStreamVenue;
import in.makerflow.infrastructure.venue.VenueException;
import in.makerflow.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Signed REST implementation of UserStreamVenue for a Binance-compatible
 * perpetual-futures API.
 *
 * Endpoints:
 * - POST/GET/DELETE /fapi/v1/order
 * - GET /fapi/v1/openOrders, DELETE /fapi/v1/allOpenOrders
 * - GET /fapi/v2/account, /fapi/v2/positionRisk, /fapi/v2/balance
 * - GET /fapi/v1/positionSide/dual
 * - POST/PUT/DELETE /fapi/v1/listenKey (API key only, unsigned)
 *
 * Error Handling:
 * - Idempotent reads retry transport errors, timeouts and 5xx with exponential backoff
 * - Writes (place, cancel) are never retried here; the entry engine owns that policy
 * - A cancel answered with "unknown order" re-queries the order, so a fill that
 *   raced the cancel surfaces as CancelFailure.ORDER_ALREADY_FILLED
 */
public class FuturesRestVenue implements UserStreamVenue {
    private static final Logger log = LoggerFactory.getLogger(FuturesRestVenue.class);

    private final String accountId;
    private final String baseUrl;
    private final VenueConfig config;
    private final RequestSigner signer;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final VenueErrorMapper errorMapper;
    private final VenueMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public FuturesRestVenue(AccountConfig account, VenueConfig config, HttpClient httpClient,
                            ObjectMapper mapper, VenueMetrics metrics) {
        this.accountId = account.id();
        this.baseUrl = account.baseUrl() != null ? account.baseUrl() : config.baseUrl();
        this.config = config;
        this.signer = new RequestSigner(account.apiKey(), account.apiSecret(), account.recvWindowMs());
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.errorMapper = new VenueErrorMapper(mapper);
        this.metrics = metrics;
        log.info("[VENUE:{}] REST session created (base: {}, key: {})", accountId, baseUrl, account.maskedApiKey());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<OrderResponse> placeOrder(OrderRequest request) {
        ensureOpen();
        Map<String, String> params = orderParams(request);
        Instant start = Instant.now();
        String orderType = request.orderType().name();

        return send("POST", "/fapi/v1/order", params, "Place order")
            .thenApply(response -> {
                if (response.statusCode() / 100 != 2) {
                    throw errorMapper.forPlacement(accountId, request, response.statusCode(), response.body());
                }
                OrderResponse order = VenueResponseParser.order(readJson(response.body()));
                metrics.recordOrderSuccess(orderType, Duration.between(start, Instant.now()));
                log.info("[VENUE:{}] Placed {} {} {} qty={} price={} stop={} -> {}", accountId,
                    request.symbol(), request.side(), orderType, request.quantity(),
                    request.price(), request.stopPrice(), order.orderId());
                return order;
            })
            .whenComplete((order, error) -> {
                if (error != null) {
                    Throwable cause = Futures.unwrap(error);
                    String errorType = cause instanceof OrderRejectedException ? "REJECTED"
                        : cause instanceof VenueException && ((VenueException) cause).isTimeout() ? "TIMEOUT"
                        : "REQUEST_FAILED";
                    metrics.recordOrderFailure(orderType, errorType, Duration.between(start, Instant.now()));
                    log.warn("[VENUE:{}] Place {} {} failed: {}", accountId, request.symbol(), orderType,
                        cause.getMessage());
                }
            });
    }

    @Override
    public CompletableFuture<OrderResponse> cancelOrder(String symbol, String orderId) {
        ensureOpen();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("orderId", orderId);
        Instant start = Instant.now();

        CompletableFuture<OrderResponse> cancel = send("DELETE", "/fapi/v1/order", params, "Cancel order")
            .handle((response, error) -> {
                if (error != null) {
                    Throwable cause = Futures.unwrap(error);
                    throw new OrderCancellationException(accountId, symbol, orderId,
                        CancelFailure.REQUEST_FAILED, cause.getMessage(), null, cause);
                }
                if (response.statusCode() / 100 != 2) {
                    throw errorMapper.forCancel(accountId, symbol, orderId, response.statusCode(), response.body());
                }
                return VenueResponseParser.order(readJson(response.body()));
            });

        return cancel
            .exceptionallyCompose(error -> {
                Throwable cause = Futures.unwrap(error);
                if (cause instanceof OrderCancellationException
                        && ((OrderCancellationException) cause).getFailure() == CancelFailure.UNKNOWN_ORDER) {
                    return resolveUnknownOrder(symbol, orderId, (OrderCancellationException) cause);
                }
                return CompletableFuture.failedFuture(cause);
            })
            .whenComplete((order, error) -> {
                metrics.recordOrderCancellation(error == null, Duration.between(start, Instant.now()));
                if (error == null) {
                    log.info("[VENUE:{}] Cancelled {} order {}", accountId, symbol, orderId);
                }
            });
    }

    /**
     * The venue reports a cancel of a just-filled order as unknown. Look the order up
     * to tell a fill from a genuinely unknown id. A partially filled order is returned as is.
     */
    private CompletableFuture<OrderResponse> resolveUnknownOrder(String symbol, String orderId,
                                                                 OrderCancellationException original) {
        return getOrder(symbol, orderId)
            .handle((order, lookupError) -> {
                if (lookupError != null) {
                    throw original;
                }
                if (order.status() == OrderStatus.FILLED) {
                    log.info("[VENUE:{}] Cancel of {} raced a fill", accountId, orderId);
                    throw new OrderCancellationException(accountId, symbol, orderId,
                        CancelFailure.ORDER_ALREADY_FILLED, "order already filled", original.getVenueCode(), null);
                }
                if (order.status() == OrderStatus.CANCELED || order.status() == OrderStatus.EXPIRED) {
                    return order;
                }
                if (order.status() == OrderStatus.PARTIALLY_FILLED) {
                    log.warn("[VENUE:{}] Cancel of {} found it partially filled ({} of {})", accountId, orderId,
                        order.executedQuantity().toPlainString(), order.origQuantity().toPlainString());
                    return order;
                }
                throw original;
            });
    }

    @Override
    public CompletableFuture<Void> cancelAllOrders(String symbol) {
        ensureOpen();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        return send("DELETE", "/fapi/v1/allOpenOrders", params, "Cancel all orders")
            .thenApply(response -> {
                if (response.statusCode() / 100 != 2) {
                    throw errorMapper.forRequest(accountId, "Cancel all orders", response.statusCode(), response.body());
                }
                log.info("[VENUE:{}] Cancelled all open orders on {}", accountId, symbol);
                return null;
            });
    }

    @Override
    public CompletableFuture<OrderResponse> getOrder(String symbol, String orderId) {
        ensureOpen();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", symbol);
        params.put("orderId", orderId);
        return read("/fapi/v1/order", params, "Get order", VenueResponseParser::order);
    }

    @Override
    public CompletableFuture<List<OrderResponse>> getOpenOrders(String symbol) {
        ensureOpen();
        Map<String, String> params = new LinkedHashMap<>();
        if (symbol != null) {
            params.put("symbol", symbol);
        }
        return read("/fapi/v1/openOrders", params, "Get open orders", VenueResponseParser::orders);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ACCOUNT
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<AccountInfo> getAccountInfo() {
        ensureOpen();
        return read("/fapi/v2/account", Map.of(), "Get account", VenueResponseParser::accountInfo);
    }

    @Override
    public CompletableFuture<List<Position>> getPositions() {
        ensureOpen();
        return read("/fapi/v2/positionRisk", Map.of(), "Get positions", VenueResponseParser::positions);
    }

    @Override
    public CompletableFuture<List<Balance>> getBalances() {
        ensureOpen();
        return read("/fapi/v2/balance", Map.of(), "Get balances", VenueResponseParser::balances);
    }

    @Override
    public CompletableFuture<Boolean> isHedgeMode() {
        ensureOpen();
        return read("/fapi/v1/positionSide/dual", Map.of(), "Get position mode",
            node -> node.path("dualSidePosition").asBoolean(false));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // USER DATA STREAM
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public CompletableFuture<String> createListenKey() {
        ensureOpen();
        return sendKeyed("POST", "Create listen key")
            .thenApply(node -> {
                String key = node.path("listenKey").asText(null);
                if (key == null || key.isBlank()) {
                    throw new VenueException(accountId, "Create listen key: response has no listenKey");
                }
                log.info("[VENUE:{}] Listen key ready: {}...", accountId, key.substring(0, Math.min(8, key.length())));
                return key;
            });
    }

    @Override
    public CompletableFuture<Void> keepAliveListenKey() {
        ensureOpen();
        return sendKeyed("PUT", "Keep alive listen key").thenApply(node -> {
            log.debug("[VENUE:{}] Listen key kept alive", accountId);
            return null;
        });
    }

    @Override
    public CompletableFuture<Void> closeListenKey() {
        ensureOpen();
        return sendKeyed("DELETE", "Close listen key").thenApply(node -> {
            log.info("[VENUE:{}] Listen key closed", accountId);
            return null;
        });
    }

    @Override
    public String getAccountId() {
        return accountId;
    }

    @Override
    public boolean isSimulation() {
        return false;
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("[VENUE:{}] Session closed", accountId);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HTTP
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Signed GET with retry on retryable failures.
     */
    private <T> CompletableFuture<T> read(String path, Map<String, String> params, String operation,
                                          Function<JsonNode, T> parser) {
        RetryBackoff backoff = RetryBackoff.forVenueReads(config.maxReadRetries());
        return attemptRead(path, params, operation, parser, backoff);
    }

    private <T> CompletableFuture<T> attemptRead(String path, Map<String, String> params, String operation,
                                                 Function<JsonNode, T> parser, RetryBackoff backoff) {
        return send("GET", path, params, operation)
            .thenApply(response -> {
                if (response.statusCode() / 100 != 2) {
                    throw errorMapper.forRequest(accountId, operation, response.statusCode(), response.body());
                }
                return parser.apply(readJson(response.body()));
            })
            .exceptionallyCompose(error -> {
                Throwable cause = Futures.unwrap(error);
                backoff.onFailure();
                if (cause instanceof VenueException && ((VenueException) cause).isRetryable()
                        && backoff.canRetry() && !closed.get()) {
                    Duration delay = backoff.nextDelay();
                    log.warn("[VENUE:{}] {} failed (attempt {}), retrying in {} ms: {}", accountId, operation,
                        backoff.failures(), delay.toMillis(), cause.getMessage());
                    return CompletableFuture.supplyAsync(() -> null,
                            CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS))
                        .thenCompose(ignored -> attemptRead(path, params, operation, parser, backoff));
                }
                return CompletableFuture.failedFuture(cause);
            });
    }

    private CompletableFuture<HttpResponse<String>> send(String method, String path,
                                                         Map<String, String> params, String operation) {
        URI uri = URI.create(baseUrl + path + "?" + signer.sign(params));
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(config.requestTimeout())
            .header("X-MBX-APIKEY", signer.getApiKey())
            .header("Content-Type", "application/x-www-form-urlencoded")
            .method(method, HttpRequest.BodyPublishers.noBody())
            .build();
        return dispatch(request, operation);
    }

    /**
     * Listen key calls carry the API key header but no signature.
     */
    private CompletableFuture<JsonNode> sendKeyed(String method, String operation) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/fapi/v1/listenKey"))
            .timeout(config.requestTimeout())
            .header("X-MBX-APIKEY", signer.getApiKey())
            .method(method, HttpRequest.BodyPublishers.noBody())
            .build();
        return dispatch(request, operation)
            .thenApply(response -> {
                if (response.statusCode() / 100 != 2) {
                    throw errorMapper.forRequest(accountId, operation, response.statusCode(), response.body());
                }
                return readJson(response.body().isBlank() ? "{}" : response.body());
            });
    }

    private CompletableFuture<HttpResponse<String>> dispatch(HttpRequest request, String operation) {
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
            .exceptionallyCompose(error -> {
                Throwable cause = Futures.unwrap(error);
                if (cause instanceof HttpTimeoutException) {
                    return CompletableFuture.failedFuture(VenueException.timeout(accountId, operation, cause));
                }
                if (cause instanceof IOException) {
                    return CompletableFuture.failedFuture(VenueException.transport(accountId, operation, cause));
                }
                return CompletableFuture.failedFuture(cause);
            });
    }

    private JsonNode readJson(String body) {
        try {
            return mapper.readTree(body);
        } catch (IOException e) {
            throw new VenueException(accountId, "Unparseable venue response: " + e.getMessage(),
                null, 200, false, e);
        }
    }

    private Map<String, String> orderParams(OrderRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("symbol", request.symbol());
        params.put("side", request.side().name());
        params.put("type", request.orderType().name());
        params.put("positionSide", request.positionSide().name());
        if (request.quantity() != null && !request.closePosition()) {
            params.put("quantity", plain(request.quantity()));
        }
        if (request.price() != null) {
            params.put("price", plain(request.price()));
        }
        if (request.stopPrice() != null) {
            params.put("stopPrice", plain(request.stopPrice()));
        }
        if (request.timeInForce() != null) {
            params.put("timeInForce", request.timeInForce().name());
        }
        // reduceOnly is not accepted in hedge mode; positionSide already scopes the order there
        if (request.reduceOnly() && request.positionSide() == PositionSide.BOTH) {
            params.put("reduceOnly", "true");
        }
        if (request.closePosition()) {
            params.put("closePosition", "true");
        }
        if (request.clientOrderId() != null) {
            params.put("newClientOrderId", request.clientOrderId());
        }
        params.put("newOrderRespType", "RESULT");
        return params;
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Venue session " + accountId + " is closed");
        }
    }
}
