package in.makerflow.infrastructure.venue.paper;

import in.makerflow.domain.account.Position;
import in.makerflow.domain.order.OrderRequest;
import in.makerflow.domain.order.OrderResponse;
import in.makerflow.domain.order.OrderStatus;
import in.makerflow.domain.order.OrderType;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.order.Side;
import in.makerflow.domain.order.TimeInForce;
import in.makerflow.infrastructure.venue.OrderCancellationException;
import in.makerflow.infrastructure.venue.OrderCancellationException.CancelFailure;
import in.makerflow.infrastructure.venue.OrderRejectedException;
import in.makerflow.util.Futures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PaperTradingVenue.
 *
 * Tests:
 * - Limit orders fill on the first status query
 * - Position tracking across fills
 * - Reduce-only and market order rejection
 * - Cancel semantics (open, filled, unknown)
 */
class PaperTradingVenueTest {

    private final PaperTradingVenue venue = new PaperTradingVenue("paper_1");

    private static OrderRequest limit(Side side, String qty, String price, boolean reduceOnly) {
        return OrderRequest.makerLimit("ETHUSDT", side, new BigDecimal(qty), new BigDecimal(price),
            PositionSide.BOTH, reduceOnly);
    }

    private static Throwable failure(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        return Futures.unwrap(e);
    }

    @Test
    void testLimitFillsOnFirstQuery() {
        OrderResponse placed = venue.placeOrder(limit(Side.BUY, "0.010", "3000.00", false)).join();
        assertEquals(OrderStatus.NEW, placed.status());
        assertEquals(1, venue.getOpenOrders("ETHUSDT").join().size());

        OrderResponse queried = venue.getOrder("ETHUSDT", placed.orderId()).join();

        assertEquals(OrderStatus.FILLED, queried.status());
        assertEquals(new BigDecimal("0.010"), queried.executedQuantity());
        assertEquals(new BigDecimal("3000.00"), queried.avgPrice());
        assertTrue(venue.getOpenOrders(null).join().isEmpty());
    }

    @Test
    void testPositionTracking() {
        String first = venue.placeOrder(limit(Side.BUY, "0.010", "3000", false)).join().orderId();
        venue.getOrder("ETHUSDT", first).join();
        String second = venue.placeOrder(limit(Side.BUY, "0.010", "3100", false)).join().orderId();
        venue.getOrder("ETHUSDT", second).join();

        List<Position> positions = venue.getPositions().join();
        assertEquals(1, positions.size());
        assertEquals(0, new BigDecimal("0.020").compareTo(positions.get(0).positionAmount()));
        assertEquals(0, new BigDecimal("3050").compareTo(positions.get(0).entryPrice()));

        String close = venue.placeOrder(limit(Side.SELL, "0.020", "3200", true)).join().orderId();
        venue.getOrder("ETHUSDT", close).join();

        assertTrue(venue.getPositions().join().isEmpty());
    }

    @Test
    void testRejections() {
        Throwable reduceOnly = failure(venue.placeOrder(limit(Side.SELL, "0.010", "3000", true)));
        assertTrue(reduceOnly instanceof OrderRejectedException);

        OrderRequest market = new OrderRequest("ETHUSDT", Side.BUY, OrderType.MARKET, new BigDecimal("0.01"),
            null, null, null, PositionSide.BOTH, false, false, null);
        Throwable marketError = failure(venue.placeOrder(market));
        assertTrue(marketError instanceof OrderRejectedException);

        OrderRequest gtc = new OrderRequest("ETHUSDT", Side.BUY, OrderType.LIMIT, new BigDecimal("0.01"),
            new BigDecimal("3000"), null, TimeInForce.GTC, PositionSide.BOTH, false, false, null);
        assertEquals(OrderStatus.NEW, venue.placeOrder(gtc).join().status());
    }

    @Test
    void testCancelSemantics() {
        String open = venue.placeOrder(limit(Side.BUY, "0.010", "3000", false)).join().orderId();
        assertEquals(OrderStatus.CANCELED, venue.cancelOrder("ETHUSDT", open).join().status());
        assertEquals(OrderStatus.CANCELED, venue.cancelOrder("ETHUSDT", open).join().status(), "Repeat cancel is harmless");

        String filled = venue.placeOrder(limit(Side.BUY, "0.010", "3000", false)).join().orderId();
        venue.getOrder("ETHUSDT", filled).join();
        Throwable race = failure(venue.cancelOrder("ETHUSDT", filled));
        assertEquals(CancelFailure.ORDER_ALREADY_FILLED, ((OrderCancellationException) race).getFailure());

        Throwable unknown = failure(venue.cancelOrder("ETHUSDT", "paper-999"));
        assertEquals(CancelFailure.UNKNOWN_ORDER, ((OrderCancellationException) unknown).getFailure());
    }

    @Test
    void testStopOrdersRestUntilCancelAll() {
        String buy = venue.placeOrder(limit(Side.BUY, "0.010", "3000", false)).join().orderId();
        venue.getOrder("ETHUSDT", buy).join();
        OrderResponse stop = venue.placeOrder(OrderRequest.stopClose("ETHUSDT", Side.SELL,
            new BigDecimal("2985.00"), PositionSide.BOTH)).join();

        assertEquals(OrderStatus.NEW, venue.getOrder("ETHUSDT", stop.orderId()).join().status());

        venue.cancelAllOrders("ETHUSDT").join();
        assertTrue(venue.getOpenOrders("ETHUSDT").join().isEmpty());
    }

    @Test
    void testClosedVenue() {
        venue.close();

        assertTrue(venue.isSimulation());
        assertThrows(IllegalStateException.class, () -> venue.getAccountInfo());
    }
}
