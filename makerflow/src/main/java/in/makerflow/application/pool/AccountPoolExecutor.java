package in.makerflow.application.pool;

import in.makerflow.application.service.CancellationToken;
import in.makerflow.application.service.EntryExecutionEngine;
import in.makerflow.application.service.EntryOrder;
import in.makerflow.application.service.PriceMath;
import in.makerflow.application.service.TradeLifecycleController;
import in.makerflow.domain.account.AccountConfig;
import in.makerflow.domain.account.AccountInfo;
import in.makerflow.domain.account.Balance;
import in.makerflow.domain.account.Position;
import in.makerflow.domain.market.Quote;
import in.makerflow.domain.market.SymbolFilters;
import in.makerflow.domain.order.OrderRequest;
import in.makerflow.domain.order.OrderResponse;
import in.makerflow.domain.order.OrderType;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.order.Side;
import in.makerflow.domain.trade.EntryParams;
import in.makerflow.domain.trade.LegStatus;
import in.makerflow.domain.trade.OrderLeg;
import in.makerflow.domain.trade.Trade;
import in.makerflow.domain.trade.TradeRequest;
import in.makerflow.infrastructure.metrics.VenueMetrics;
import in.makerflow.infrastructure.venue.TradingVenue;
import in.makerflow.infrastructure.venue.VenueFactory;
import in.makerflow.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Runs one operation per account concurrently with per-account error isolation.
 *
 * Guarantees:
 * - Results come back in account order, one per account
 * - A failure (thrown or a failed future) becomes that account's AccountResult and never
 *   reaches sibling accounts
 * - Every account's operation is awaited; there is no early exit
 *
 * Usage:
 * <pre>
 * try (AccountPoolExecutor pool = AccountPoolExecutor.open(accounts, venueFactory, services)) {
 *     List&lt;AccountResult&lt;Trade&gt;&gt; results =
 *         pool.createTrades(template, PerAccount.shared(new BigDecimal("0.1"))).join();
 * }
 * </pre>
 */
public class AccountPoolExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AccountPoolExecutor.class);

    private final List<AccountSession> sessions;
    private final PoolServices services;
    private volatile boolean closed = false;

    /**
     * Engines and executor shared by the pooled operations.
     */
    public record PoolServices(
        TradeLifecycleController controller,
        EntryExecutionEngine entryEngine,
        Executor executor,
        VenueMetrics metrics
    ) {
        public PoolServices {
            if (executor == null) {
                throw new IllegalArgumentException("Executor cannot be null");
            }
            if (metrics == null) {
                metrics = VenueMetrics.NOOP;
            }
        }
    }

    public AccountPoolExecutor(List<AccountSession> sessions, PoolServices services) {
        if (sessions == null || sessions.isEmpty()) {
            throw new IllegalArgumentException("Account pool needs at least one account");
        }
        Set<String> ids = new HashSet<>();
        for (AccountSession session : sessions) {
            if (!ids.add(session.accountId())) {
                throw new IllegalArgumentException("Duplicate account id: " + session.accountId());
            }
        }
        this.sessions = List.copyOf(sessions);
        this.services = services;
        log.info("[POOL] Created pool with {} accounts", sessions.size());
    }

    /**
     * Create a session per account config. Sessions already created are closed if a later one fails.
     */
    public static AccountPoolExecutor open(List<AccountConfig> accounts, VenueFactory factory, PoolServices services) {
        if (accounts == null || accounts.isEmpty()) {
            throw new IllegalArgumentException("Account pool needs at least one account");
        }
        Set<String> ids = new HashSet<>();
        for (AccountConfig account : accounts) {
            if (!ids.add(account.id())) {
                throw new IllegalArgumentException("Duplicate account id: " + account.id());
            }
        }
        List<AccountSession> created = new ArrayList<>();
        try {
            for (AccountConfig account : accounts) {
                created.add(new AccountSession(account, factory.create(account)));
            }
        } catch (RuntimeException e) {
            created.forEach(AccountPoolExecutor::closeQuietly);
            throw e;
        }
        return new AccountPoolExecutor(created, services);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // GENERIC FAN-OUT
    // ═══════════════════════════════════════════════════════════════════════

    public <T> CompletableFuture<List<AccountResult<T>>> executeParallel(
            String operation, Function<AccountSession, CompletableFuture<T>> action) {
        return executeIndexed(operation, (session, index) -> action.apply(session));
    }

    /**
     * Run the action for every account; the action also receives the account's index in the pool.
     *
     * @return future completing with one result per account in pool order; never fails
     */
    public <T> CompletableFuture<List<AccountResult<T>>> executeIndexed(
            String operation, BiFunction<AccountSession, Integer, CompletableFuture<T>> action) {
        ensureOpen();
        List<CompletableFuture<AccountResult<T>>> futures = new ArrayList<>(sessions.size());
        for (int i = 0; i < sessions.size(); i++) {
            AccountSession session = sessions.get(i);
            int index = i;
            CompletableFuture<AccountResult<T>> result = CompletableFuture
                .supplyAsync(() -> Futures.guard(() -> action.apply(session, index)), services.executor())
                .thenCompose(f -> f)
                .handle((value, error) -> toResult(operation, session, value, error));
            futures.add(result);
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
            .thenApply(v -> {
                List<AccountResult<T>> results = new ArrayList<>(futures.size());
                for (CompletableFuture<AccountResult<T>> f : futures) {
                    results.add(f.join());
                }
                long ok = results.stream().filter(AccountResult::success).count();
                log.info("[POOL] {} finished: {}/{} accounts succeeded", operation, ok, results.size());
                return results;
            });
    }

    private <T> AccountResult<T> toResult(String operation, AccountSession session, T value, Throwable error) {
        if (error == null) {
            services.metrics().recordAccountResult(operation, true);
            return AccountResult.success(session.accountId(), value);
        }
        Throwable cause = Futures.unwrap(error);
        services.metrics().recordAccountResult(operation, false);
        log.warn("[POOL] {} failed for account {}: {}", operation, session.accountId(), cause.getMessage());
        return AccountResult.failure(session.accountId(), cause);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ACCOUNT QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    public CompletableFuture<List<AccountResult<AccountInfo>>> getAccountsInfo() {
        return executeParallel("getAccountsInfo", s -> s.venue().getAccountInfo());
    }

    public CompletableFuture<List<AccountResult<List<Position>>>> getPositions() {
        return executeParallel("getPositions", s -> s.venue().getPositions());
    }

    public CompletableFuture<List<AccountResult<List<Balance>>>> getBalances() {
        return executeParallel("getBalances", s -> s.venue().getBalances());
    }

    /**
     * @param symbol symbol filter, or null for every symbol
     */
    public CompletableFuture<List<AccountResult<List<OrderResponse>>>> getOpenOrders(String symbol) {
        return executeParallel("getOpenOrders", s -> s.venue().getOpenOrders(symbol));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════════════

    public CompletableFuture<List<AccountResult<OrderResponse>>> placeOrders(PerAccount<OrderRequest> requests) {
        List<OrderRequest> perAccount = requests.resolve(sessions.size());
        return executeIndexed("placeOrders", (s, i) -> s.venue().placeOrder(required(perAccount.get(i), "order")));
    }

    /**
     * Post-only limit orders priced off the best bid (buy) or ask (sell).
     */
    public CompletableFuture<List<AccountResult<OrderResponse>>> placeBboOrders(
            String symbol, Side side, PerAccount<BigDecimal> quantities, Quote quote,
            BigDecimal tickSize, int ticksDistance) {
        List<BigDecimal> perAccount = quantities.resolve(sessions.size());
        BigDecimal price = PriceMath.entryPrice(side, quote, tickSize, ticksDistance);
        return executeIndexed("placeBboOrders", (s, i) -> s.venue().placeOrder(OrderRequest.makerLimit(
            symbol, side, required(perAccount.get(i), "quantity"), price, PositionSide.BOTH, false)));
    }

    public CompletableFuture<List<AccountResult<OrderResponse>>> cancelOrders(String symbol, PerAccount<String> orderIds) {
        List<String> perAccount = orderIds.resolve(sessions.size());
        return executeIndexed("cancelOrders", (s, i) -> s.venue().cancelOrder(symbol, required(perAccount.get(i), "order id")));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // TRADES
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Full trade lifecycle per account, with the template's quantity replaced per account
     * and the hedge mode taken from the account's venue.
     */
    public CompletableFuture<List<AccountResult<Trade>>> createTrades(TradeRequest template, PerAccount<BigDecimal> quantities) {
        TradeLifecycleController controller = requireService(services.controller(), "trade controller");
        List<BigDecimal> perAccount = quantities.resolve(sessions.size());
        return executeIndexed("createTrades", (s, i) -> {
            TradeRequest request = template.withQuantity(required(perAccount.get(i), "quantity"));
            return s.hedgeMode(template.hedgeMode())
                .thenCompose(hedge -> controller.execute(s.venue(), request.withHedgeMode(hedge)));
        });
    }

    /**
     * Cancel every open order on the symbol, then close each open position with a reduce-only
     * maker order run through the entry engine.
     *
     * @return per account, the close legs (empty when the account had no position)
     */
    public CompletableFuture<List<AccountResult<List<OrderLeg>>>> closePositions(
            String symbol, Quote quote, BigDecimal tickSize, EntryParams params) {
        return closePositions(symbol, null, quote, tickSize, params);
    }

    /**
     * @param direction LONG or SHORT to close only positions held in that direction, null for all
     */
    public CompletableFuture<List<AccountResult<List<OrderLeg>>>> closePositions(
            String symbol, PositionSide direction, Quote quote, BigDecimal tickSize, EntryParams params) {
        EntryExecutionEngine engine = requireService(services.entryEngine(), "entry engine");
        return executeParallel("closePositions", s -> s.venue().cancelAllOrders(symbol)
            .thenCompose(v -> s.venue().getPositions())
            .thenCompose(positions -> closeAll(engine, s.venue(), symbol, direction, positions, quote, tickSize,
                params)));
    }

    private CompletableFuture<List<OrderLeg>> closeAll(EntryExecutionEngine engine, TradingVenue venue, String symbol,
                                                       PositionSide direction, List<Position> positions, Quote quote,
                                                       BigDecimal tickSize, EntryParams params) {
        List<CompletableFuture<OrderLeg>> closes = new ArrayList<>();
        for (Position position : positions) {
            if (!position.isOpen() || !position.symbol().equals(symbol) || !heldIn(position, direction)) {
                continue;
            }
            PositionSide positionSide = PositionSide.valueOf(position.positionSide());
            Side closeSide = position.isLong() ? Side.SELL : Side.BUY;
            EntryOrder close = new EntryOrder(symbol, closeSide, position.positionAmount().abs(), tickSize, quote,
                params, positionSide, positionSide == PositionSide.BOTH);
            log.info("[POOL] Closing {} {} {} on account {}", symbol, positionSide,
                position.positionAmount().toPlainString(), venue.getAccountId());
            closes.add(engine.placeEntry(venue, close, CancellationToken.create()));
        }
        return CompletableFuture.allOf(closes.toArray(new CompletableFuture[0]))
            .thenApply(v -> {
                List<OrderLeg> legs = new ArrayList<>(closes.size());
                closes.forEach(f -> legs.add(f.join()));
                return legs;
            });
    }

    /**
     * Close part of the position held in {@code direction} with a reduce-only maker order.
     *
     * The quantity is the position times {@code fraction}, rounded down to the step size, at least
     * one step and at most the whole position. With {@code stopToEntry}, once the close fills the
     * resting stop-loss is replaced by a close-position stop at the entry price.
     *
     * @return per account, the close leg (empty when the account holds no such position)
     */
    public CompletableFuture<List<AccountResult<List<OrderLeg>>>> reducePositions(
            String symbol, PositionSide direction, BigDecimal fraction, boolean stopToEntry, Quote quote,
            SymbolFilters filters, EntryParams params) {
        if (fraction == null || fraction.signum() <= 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("Exit fraction must be in (0, 1], got " + fraction);
        }
        EntryExecutionEngine engine = requireService(services.entryEngine(), "entry engine");
        return executeParallel("reducePositions", s -> s.venue().getPositions().thenCompose(positions -> {
            for (Position position : positions) {
                if (position.isOpen() && position.symbol().equals(symbol) && heldIn(position, direction)) {
                    return reduce(engine, s.venue(), position, fraction, stopToEntry, quote, filters, params)
                        .thenApply(List::of);
                }
            }
            log.info("[POOL] No {} position on {} for account {}", direction, symbol, s.accountId());
            return CompletableFuture.completedFuture(List.<OrderLeg>of());
        }));
    }

    private CompletableFuture<OrderLeg> reduce(EntryExecutionEngine engine, TradingVenue venue, Position position,
                                               BigDecimal fraction, boolean stopToEntry, Quote quote,
                                               SymbolFilters filters, EntryParams params) {
        String symbol = position.symbol();
        BigDecimal held = position.positionAmount().abs();
        BigDecimal quantity = reduceQuantity(held, fraction, filters.stepSize());
        PositionSide positionSide = PositionSide.valueOf(position.positionSide());
        Side closeSide = position.isLong() ? Side.SELL : Side.BUY;

        log.info("[POOL] Reducing {} {} by {} of {} on account {}", symbol, positionSide,
            quantity.toPlainString(), held.toPlainString(), venue.getAccountId());
        EntryOrder close = new EntryOrder(symbol, closeSide, quantity, filters.tickSize(), quote, params,
            positionSide, positionSide == PositionSide.BOTH);
        return engine.placeEntry(venue, close, CancellationToken.create()).thenCompose(leg -> {
            if (!stopToEntry || leg.getStatus() != LegStatus.FILLED || quantity.compareTo(held) >= 0) {
                return CompletableFuture.completedFuture(leg);
            }
            BigDecimal stopPrice = position.isLong()
                ? PriceMath.roundUp(position.entryPrice(), filters.tickSize())
                : PriceMath.roundDown(position.entryPrice(), filters.tickSize());
            return moveStop(venue, symbol, closeSide, positionSide, stopPrice).handle((placed, error) -> {
                if (error != null) {
                    log.error("[POOL] Failed to move stop to entry {} on {} for account {}: {}",
                        stopPrice.toPlainString(), symbol, venue.getAccountId(), Futures.unwrap(error).getMessage());
                } else {
                    log.info("[POOL] Stop moved to entry on {} for account {}: {} @ {}", symbol,
                        venue.getAccountId(), placed.orderId(), stopPrice.toPlainString());
                }
                return leg;
            });
        });
    }

    /**
     * Cancel the resting stop-market orders on the closing side, then place one at {@code stopPrice}.
     */
    private CompletableFuture<OrderResponse> moveStop(TradingVenue venue, String symbol, Side closeSide,
                                                      PositionSide positionSide, BigDecimal stopPrice) {
        return venue.getOpenOrders(symbol).thenCompose(open -> {
            List<CompletableFuture<OrderResponse>> cancels = new ArrayList<>();
            for (OrderResponse order : open) {
                if (order.orderType() == OrderType.STOP_MARKET && order.side() == closeSide) {
                    cancels.add(venue.cancelOrder(symbol, order.orderId()));
                }
            }
            return CompletableFuture.allOf(cancels.toArray(new CompletableFuture[0]));
        }).thenCompose(v -> venue.placeOrder(OrderRequest.stopClose(symbol, closeSide, stopPrice, positionSide)));
    }

    static BigDecimal reduceQuantity(BigDecimal held, BigDecimal fraction, BigDecimal stepSize) {
        BigDecimal quantity = PriceMath.roundDown(held.multiply(fraction), stepSize);
        if (quantity.compareTo(stepSize) < 0) {
            quantity = stepSize;
        }
        return quantity.min(held);
    }

    private static boolean heldIn(Position position, PositionSide direction) {
        if (direction == null || direction == PositionSide.BOTH) {
            return true;
        }
        return direction == PositionSide.LONG ? position.isLong() : !position.isLong();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    public List<String> accountIds() {
        List<String> ids = new ArrayList<>(sessions.size());
        sessions.forEach(s -> ids.add(s.accountId()));
        return ids;
    }

    public int size() {
        return sessions.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Close every session. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        sessions.forEach(AccountPoolExecutor::closeQuietly);
        log.info("[POOL] Closed pool with {} accounts", sessions.size());
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Account pool is closed");
        }
    }

    private static void closeQuietly(AccountSession session) {
        try {
            session.close();
        } catch (RuntimeException e) {
            log.warn("[POOL] Error closing session {}: {}", session.accountId(), e.getMessage());
        }
    }

    private static <T> T required(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException("No " + name + " given for this account");
        }
        return value;
    }

    private static <T> T requireService(T service, String name) {
        if (service == null) {
            throw new IllegalStateException("Account pool was created without a " + name);
        }
        return service;
    }
}
