package in.makerflow.infrastructure.venue;

import in.makerflow.domain.account.AccountInfo;
import in.makerflow.domain.account.Balance;
import in.makerflow.domain.account.Position;
import in.makerflow.domain.order.OrderRequest;
import in.makerflow.domain.order.OrderResponse;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Trading venue capability for one authenticated account.
 *
 * Responsibilities:
 * - Submit, cancel and query orders
 * - Report account summary, positions and balances
 *
 * Error Handling:
 * - All operations return CompletableFuture and never block the caller
 * - Failures complete the future exceptionally with a typed VenueException:
 *   OrderRejectedException for synchronous rejections, OrderCancellationException
 *   for cancels (with a reason that separates "already filled" from other failures),
 *   VenueException for transport and timeout errors
 *
 * Lifecycle:
 * 1. Created by the account pool from an AccountConfig
 * 2. placeOrder() / getOrder() / cancelOrder() during trade runs
 * 3. close() when the pool closes
 */
public interface TradingVenue extends AutoCloseable {

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER PLACEMENT
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Submit a new order.
     *
     * @param request Order details
     * @return CompletableFuture with the venue's acknowledgement
     * @throws OrderRejectedException (via the future) if the venue rejects the order
     */
    CompletableFuture<OrderResponse> placeOrder(OrderRequest request);

    // ═══════════════════════════════════════════════════════════════════════
    // CANCELLATION
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Cancel a resting order.
     *
     * @param symbol Symbol of the order
     * @param orderId Venue order ID
     * @return CompletableFuture with the order state after cancel
     * @throws OrderCancellationException (via the future) with reason ORDER_ALREADY_FILLED
     *         when the order filled before the cancel arrived
     */
    CompletableFuture<OrderResponse> cancelOrder(String symbol, String orderId);

    /**
     * Cancel every open order on a symbol.
     */
    CompletableFuture<Void> cancelAllOrders(String symbol);

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER STATUS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Get current state of an order including executed quantity.
     */
    CompletableFuture<OrderResponse> getOrder(String symbol, String orderId);

    /**
     * Get open orders.
     *
     * @param symbol Symbol filter, or null for all symbols
     */
    CompletableFuture<List<OrderResponse>> getOpenOrders(String symbol);

    // ═══════════════════════════════════════════════════════════════════════
    // ACCOUNT
    // ═══════════════════════════════════════════════════════════════════════

    CompletableFuture<AccountInfo> getAccountInfo();

    CompletableFuture<List<Position>> getPositions();

    CompletableFuture<List<Balance>> getBalances();

    /**
     * Whether the account runs in hedge (dual position side) mode.
     */
    CompletableFuture<Boolean> isHedgeMode();

    // ═══════════════════════════════════════════════════════════════════════
    // METADATA
    // ═══════════════════════════════════════════════════════════════════════

    String getAccountId();

    boolean isSimulation();

    /**
     * Release connections held for this account. Idempotent.
     */
    @Override
    void close();
}
