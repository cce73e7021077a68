package in.makerflow.infrastructure.venue.paper;

import in.makerflow.domain.account.AccountInfo;
import in.makerflow.domain.account.Balance;
import in.makerflow.domain.account.Position;
import in.makerflow.domain.order.OrderRequest;
import in.makerflow.domain.order.OrderResponse;
import in.makerflow.domain.order.OrderStatus;
import in.makerflow.domain.order.OrderType;
import in.makerflow.domain.order.Side;
import in.makerflow.infrastructure.venue.OrderCancellationException;
import in.makerflow.infrastructure.venue.OrderCancellationException.CancelFailure;
import in.makerflow.infrastructure.venue.OrderRejectedException;
import in.makerflow.infrastructure.venue.TradingVenue;
import in.makerflow.infrastructure.venue.VenueException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory TradingVenue for simulation accounts. No network access.
 *
 * Fill model:
 * - LIMIT orders rest until the first status query, then fill completely at their limit price
 * - STOP_MARKET / TAKE_PROFIT_MARKET orders rest until cancelled
 * - MARKET orders are rejected (no price reference)
 *
 * Positions are tracked per symbol as a signed amount with an average entry price.
 */
public class PaperTradingVenue implements TradingVenue {
    private static final Logger log = LoggerFactory.getLogger(PaperTradingVenue.class);

    private static final int PAPER_REJECT_CODE = -4000;

    private final String accountId;
    private final BigDecimal startingBalance;
    private final AtomicLong nextOrderId = new AtomicLong(1);
    private final Map<String, OrderResponse> orders = new LinkedHashMap<>();
    private final Map<String, PaperPosition> positions = new LinkedHashMap<>();
    private volatile boolean closed = false;

    private static final class PaperPosition {
        BigDecimal amount = BigDecimal.ZERO;
        BigDecimal entryPrice = BigDecimal.ZERO;
    }

    public PaperTradingVenue(String accountId) {
        this(accountId, new BigDecimal("10000"));
    }

    public PaperTradingVenue(String accountId, BigDecimal startingBalance) {
        this.accountId = accountId;
        this.startingBalance = startingBalance;
        log.info("[VENUE:{}] Paper trading session created", accountId);
    }

    @Override
    public synchronized CompletableFuture<OrderResponse> placeOrder(OrderRequest request) {
        ensureOpen();
        if (request.orderType() == OrderType.MARKET) {
            return CompletableFuture.failedFuture(new OrderRejectedException(accountId, request,
                PAPER_REJECT_CODE, 400, "Market orders are not supported in paper trading"));
        }
        if (request.reduceOnly() && positionAmount(request.symbol()).signum() == 0) {
            return CompletableFuture.failedFuture(new OrderRejectedException(accountId, request,
                -2022, 400, "ReduceOnly Order is rejected."));
        }
        String orderId = "paper-" + nextOrderId.getAndIncrement();
        OrderResponse order = new OrderResponse(orderId, request.clientOrderId(), request.symbol(),
            request.side(), request.orderType(), OrderStatus.NEW,
            request.orderType() == OrderType.LIMIT ? request.price() : request.stopPrice(),
            request.quantity(), BigDecimal.ZERO, null, Instant.now());
        orders.put(orderId, order);
        log.info("[VENUE:{}] Paper order {} {} {} {} qty={} price={}", accountId, orderId,
            request.symbol(), request.side(), request.orderType(), request.quantity(), order.price());
        return CompletableFuture.completedFuture(order);
    }

    @Override
    public synchronized CompletableFuture<OrderResponse> cancelOrder(String symbol, String orderId) {
        ensureOpen();
        OrderResponse order = orders.get(orderId);
        if (order == null) {
            return CompletableFuture.failedFuture(new OrderCancellationException(accountId, symbol, orderId,
                CancelFailure.UNKNOWN_ORDER, "Unknown order sent.", -2011, null));
        }
        if (order.status() == OrderStatus.FILLED) {
            return CompletableFuture.failedFuture(new OrderCancellationException(accountId, symbol, orderId,
                CancelFailure.ORDER_ALREADY_FILLED, "order already filled", -2011, null));
        }
        if (order.status().isTerminal()) {
            return CompletableFuture.completedFuture(order);
        }
        OrderResponse cancelled = order.withStatus(OrderStatus.CANCELED, order.executedQuantity(),
            order.avgPrice(), Instant.now());
        orders.put(orderId, cancelled);
        return CompletableFuture.completedFuture(cancelled);
    }

    @Override
    public synchronized CompletableFuture<Void> cancelAllOrders(String symbol) {
        ensureOpen();
        for (Map.Entry<String, OrderResponse> e : orders.entrySet()) {
            OrderResponse order = e.getValue();
            if (order.symbol().equals(symbol) && !order.status().isTerminal()) {
                e.setValue(order.withStatus(OrderStatus.CANCELED, order.executedQuantity(),
                    order.avgPrice(), Instant.now()));
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<OrderResponse> getOrder(String symbol, String orderId) {
        ensureOpen();
        OrderResponse order = orders.get(orderId);
        if (order == null) {
            return CompletableFuture.failedFuture(new VenueException(accountId,
                "Order does not exist: " + orderId, -2013, 400, false, null));
        }
        if (order.status() == OrderStatus.NEW && order.orderType() == OrderType.LIMIT) {
            order = fill(order);
        }
        return CompletableFuture.completedFuture(order);
    }

    @Override
    public synchronized CompletableFuture<List<OrderResponse>> getOpenOrders(String symbol) {
        ensureOpen();
        List<OrderResponse> open = new ArrayList<>();
        for (OrderResponse order : orders.values()) {
            if (!order.status().isTerminal() && (symbol == null || order.symbol().equals(symbol))) {
                open.add(order);
            }
        }
        return CompletableFuture.completedFuture(open);
    }

    @Override
    public synchronized CompletableFuture<AccountInfo> getAccountInfo() {
        ensureOpen();
        return CompletableFuture.completedFuture(
            new AccountInfo(startingBalance, BigDecimal.ZERO, startingBalance, true));
    }

    @Override
    public synchronized CompletableFuture<List<Position>> getPositions() {
        ensureOpen();
        List<Position> open = new ArrayList<>();
        for (Map.Entry<String, PaperPosition> e : positions.entrySet()) {
            PaperPosition p = e.getValue();
            if (p.amount.signum() != 0) {
                open.add(new Position(e.getKey(), "BOTH", p.amount, p.entryPrice, BigDecimal.ZERO, 1));
            }
        }
        return CompletableFuture.completedFuture(open);
    }

    @Override
    public CompletableFuture<List<Balance>> getBalances() {
        ensureOpen();
        return CompletableFuture.completedFuture(List.of(new Balance("USDT", startingBalance, startingBalance)));
    }

    @Override
    public CompletableFuture<Boolean> isHedgeMode() {
        return CompletableFuture.completedFuture(false);
    }

    @Override
    public String getAccountId() {
        return accountId;
    }

    @Override
    public boolean isSimulation() {
        return true;
    }

    @Override
    public void close() {
        closed = true;
    }

    private OrderResponse fill(OrderResponse order) {
        BigDecimal qty = order.origQuantity();
        OrderResponse filled = order.withStatus(OrderStatus.FILLED, qty, order.price(), Instant.now());
        orders.put(order.orderId(), filled);
        applyFill(order.symbol(), order.side(), qty, order.price());
        log.info("[VENUE:{}] Paper fill {} {} {} @ {}", accountId, order.orderId(), order.side(), qty, order.price());
        return filled;
    }

    private void applyFill(String symbol, Side side, BigDecimal qty, BigDecimal price) {
        PaperPosition p = positions.computeIfAbsent(symbol, s -> new PaperPosition());
        BigDecimal signed = side == Side.BUY ? qty : qty.negate();
        BigDecimal newAmount = p.amount.add(signed);
        boolean increasing = p.amount.signum() == 0 || p.amount.signum() == signed.signum();
        if (increasing) {
            BigDecimal notional = p.entryPrice.multiply(p.amount.abs()).add(price.multiply(qty));
            p.entryPrice = notional.divide(newAmount.abs(), 8, RoundingMode.HALF_UP).stripTrailingZeros();
        } else if (newAmount.signum() != 0 && newAmount.signum() != p.amount.signum()) {
            p.entryPrice = price;
        }
        p.amount = newAmount;
        if (newAmount.signum() == 0) {
            p.entryPrice = BigDecimal.ZERO;
        }
    }

    private BigDecimal positionAmount(String symbol) {
        PaperPosition p = positions.get(symbol);
        return p == null ? BigDecimal.ZERO : p.amount;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Venue session " + accountId + " is closed");
        }
    }
}
