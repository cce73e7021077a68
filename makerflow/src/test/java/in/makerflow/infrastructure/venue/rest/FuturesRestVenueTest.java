package in.makerflow.infrastructure.venue.rest;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.config.VenueConfig;
import in.makerflow.domain.account.AccountConfig;
import in.makerflow.domain.account.Position;
import in.makerflow.domain.order.OrderRequest;
import in.makerflow.domain.order.OrderResponse;
import in.makerflow.domain.order.OrderStatus;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.order.Side;
import in.makerflow.infrastructure.metrics.VenueMetrics;
import in.makerflow.infrastructure.venue.OrderCancellationException;
import in.makerflow.infrastructure.venue.OrderCancellationException.CancelFailure;
import in.makerflow.infrastructure.venue.OrderRejectedException;
import in.makerflow.infrastructure.venue.VenueException;
import in.makerflow.util.Futures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for FuturesRestVenue against a local HTTP server.
 *
 * Tests:
 * - Signed order placement and response parsing
 * - Rejections and server errors on placement (never retried)
 * - Read retries on 5xx
 * - Cancel of a just-filled order surfaces as ORDER_ALREADY_FILLED
 * - Listen key create, keepalive and close carry the API key without a signature
 */
class FuturesRestVenueTest {

    private static final String NEW_ORDER = "{\"orderId\":42,\"clientOrderId\":\"c1\",\"symbol\":\"ETHUSDT\","
        + "\"status\":\"NEW\",\"side\":\"BUY\",\"type\":\"LIMIT\",\"price\":\"3000.00\",\"origQty\":\"0.010\","
        + "\"executedQty\":\"0\",\"avgPrice\":\"0\",\"updateTime\":1700000000000}";
    private static final String FILLED_ORDER = NEW_ORDER.replace("\"NEW\"", "\"FILLED\"")
        .replace("\"executedQty\":\"0\"", "\"executedQty\":\"0.010\"")
        .replace("\"avgPrice\":\"0\"", "\"avgPrice\":\"3000.00\"");
    private static final String CANCELED_ORDER = NEW_ORDER.replace("\"NEW\"", "\"CANCELED\"");
    private static final String PARTIAL_ORDER = NEW_ORDER.replace("\"NEW\"", "\"PARTIALLY_FILLED\"")
        .replace("\"executedQty\":\"0\"", "\"executedQty\":\"0.004\"")
        .replace("\"avgPrice\":\"0\"", "\"avgPrice\":\"2999.99\"");
    private static final String UNKNOWN_ORDER = "{\"code\":-2011,\"msg\":\"Unknown order sent.\"}";

    private static final OrderRequest ORDER = OrderRequest.makerLimit("ETHUSDT", Side.BUY,
        new BigDecimal("0.010"), new BigDecimal("3000.00"), PositionSide.BOTH, false);

    private FakeVenueServer server;
    private VenueMetrics metrics;
    private FuturesRestVenue venue;

    @BeforeEach
    void setUp() {
        server = new FakeVenueServer();
        metrics = mock(VenueMetrics.class);
        VenueConfig config = new VenueConfig(server.baseUrl(), Duration.ofSeconds(5), 5000, 2);
        venue = new FuturesRestVenue(AccountConfig.live("acc_1", "test-api-key", "test-secret"), config,
            HttpClient.newHttpClient(), new ObjectMapper(), metrics);
    }

    @AfterEach
    void tearDown() {
        venue.close();
        server.close();
    }

    private static Throwable failure(CompletableFuture<?> future) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        return Futures.unwrap(e);
    }

    @Test
    void testPlaceOrderSignedAndParsed() throws Exception {
        server.on("POST", "/fapi/v1/order", 200, NEW_ORDER);

        OrderResponse order = venue.placeOrder(ORDER).get(5, TimeUnit.SECONDS);

        assertEquals("42", order.orderId());
        assertEquals(OrderStatus.NEW, order.status());
        assertEquals(new BigDecimal("0.010"), order.origQuantity());

        FakeVenueServer.Call call = server.calls().get(0);
        assertEquals("test-api-key", call.apiKey());
        assertTrue(call.query().contains("type=LIMIT"), call.query());
        assertTrue(call.query().contains("timeInForce=GTX"), call.query());
        assertTrue(call.query().contains("price=3000&"), call.query());
        assertTrue(call.query().contains("quantity=0.01&"), call.query());
        assertFalse(call.query().contains("reduceOnly"), call.query());

        String[] parts = call.query().split("&signature=");
        assertEquals(2, parts.length);
        assertEquals(new RequestSigner("test-api-key", "test-secret", 5000).hmacHex(parts[0]), parts[1]);
        verify(metrics).recordOrderSuccess(eq("LIMIT"), any(Duration.class));
    }

    @Test
    void testPlaceOrderRejected() {
        server.on("POST", "/fapi/v1/order", 400,
            "{\"code\":-5022,\"msg\":\"Post Only order will be rejected.\"}");

        Throwable error = failure(venue.placeOrder(ORDER));

        assertTrue(error instanceof OrderRejectedException, error.toString());
        assertEquals(-5022, ((OrderRejectedException) error).getVenueCode());
        verify(metrics).recordOrderFailure(eq("LIMIT"), eq("REJECTED"), any(Duration.class));
    }

    @Test
    void testPlaceOrderNotRetriedOnServerError() {
        server.on("POST", "/fapi/v1/order", 503, "Service Unavailable");

        Throwable error = failure(venue.placeOrder(ORDER));

        assertFalse(error instanceof OrderRejectedException);
        assertEquals(503, ((VenueException) error).getHttpStatus());
        assertEquals(1, server.count("POST", "/fapi/v1/order"), "Writes are never retried");
    }

    @Test
    void testReadRetriesServerErrors() throws Exception {
        server.on("GET", "/fapi/v1/order", 502, "Bad Gateway")
            .on("GET", "/fapi/v1/order", 200, FILLED_ORDER);

        OrderResponse order = venue.getOrder("ETHUSDT", "42").get(5, TimeUnit.SECONDS);

        assertEquals(OrderStatus.FILLED, order.status());
        assertEquals(new BigDecimal("3000.00"), order.avgPrice());
        assertEquals(2, server.count("GET", "/fapi/v1/order"));
    }

    @Test
    void testReadNotRetriedOnClientError() {
        server.on("GET", "/fapi/v1/order", 400, "{\"code\":-2013,\"msg\":\"Order does not exist.\"}");

        Throwable error = failure(venue.getOrder("ETHUSDT", "99"));

        assertEquals(-2013, ((VenueException) error).getVenueCode());
        assertEquals(1, server.count("GET", "/fapi/v1/order"));
    }

    @Test
    void testCancelRacingFill() {
        server.on("DELETE", "/fapi/v1/order", 400, UNKNOWN_ORDER)
            .on("GET", "/fapi/v1/order", 200, FILLED_ORDER);

        Throwable error = failure(venue.cancelOrder("ETHUSDT", "42"));

        assertTrue(error instanceof OrderCancellationException, error.toString());
        assertEquals(CancelFailure.ORDER_ALREADY_FILLED, ((OrderCancellationException) error).getFailure());
        assertTrue(((OrderCancellationException) error).isAlreadyFilled());
        verify(metrics).recordOrderCancellation(eq(false), any(Duration.class));
    }

    @Test
    void testCancelOfAlreadyCancelledOrderSucceeds() throws Exception {
        server.on("DELETE", "/fapi/v1/order", 400, UNKNOWN_ORDER)
            .on("GET", "/fapi/v1/order", 200, CANCELED_ORDER);

        OrderResponse order = venue.cancelOrder("ETHUSDT", "42").get(5, TimeUnit.SECONDS);

        assertEquals(OrderStatus.CANCELED, order.status());
    }

    @Test
    void testCancelOfPartiallyFilledOrderReturnsIt() throws Exception {
        server.on("DELETE", "/fapi/v1/order", 400, UNKNOWN_ORDER)
            .on("GET", "/fapi/v1/order", 200, PARTIAL_ORDER);

        OrderResponse order = venue.cancelOrder("ETHUSDT", "42").get(5, TimeUnit.SECONDS);

        assertEquals(OrderStatus.PARTIALLY_FILLED, order.status());
        assertEquals(new BigDecimal("0.004"), order.executedQuantity());
        assertEquals(new BigDecimal("2999.99"), order.avgPrice());
        assertTrue(order.hasExecution());
    }

    @Test
    void testCancelUnknownOrderStaysUnknown() {
        server.on("DELETE", "/fapi/v1/order", 400, UNKNOWN_ORDER)
            .on("GET", "/fapi/v1/order", 400, "{\"code\":-2013,\"msg\":\"Order does not exist.\"}");

        Throwable error = failure(venue.cancelOrder("ETHUSDT", "7"));

        assertEquals(CancelFailure.UNKNOWN_ORDER, ((OrderCancellationException) error).getFailure());
    }

    @Test
    void testPositionsDropFlatEntries() throws Exception {
        server.on("GET", "/fapi/v2/positionRisk", 200, "["
            + "{\"symbol\":\"ETHUSDT\",\"positionSide\":\"BOTH\",\"positionAmt\":\"-0.020\",\"entryPrice\":\"3010.5\","
            + "\"unRealizedProfit\":\"0.2\",\"leverage\":\"10\"},"
            + "{\"symbol\":\"BTCUSDT\",\"positionSide\":\"BOTH\",\"positionAmt\":\"0.000\",\"entryPrice\":\"0\","
            + "\"unRealizedProfit\":\"0\",\"leverage\":\"20\"}]");

        List<Position> positions = venue.getPositions().get(5, TimeUnit.SECONDS);

        assertEquals(1, positions.size());
        assertEquals("ETHUSDT", positions.get(0).symbol());
        assertFalse(positions.get(0).isLong());
        assertEquals(10, positions.get(0).leverage());
    }

    @Test
    void testHedgeModeQuery() throws Exception {
        server.on("GET", "/fapi/v1/positionSide/dual", 200, "{\"dualSidePosition\":true}");

        assertTrue(venue.isHedgeMode().get(5, TimeUnit.SECONDS));
    }

    @Test
    void testClosedSessionRejectsCalls() {
        venue.close();

        assertThrows(IllegalStateException.class, () -> venue.placeOrder(ORDER));
        assertThrows(IllegalStateException.class, () -> venue.getAccountInfo());
    }

    @Test
    void testListenKeyLifecycleIsKeyedButUnsigned() throws Exception {
        server.on("POST", "/fapi/v1/listenKey", 200, "{\"listenKey\":\"pqia91ma19a5s61cv6a81va65sdf19v8a65a1a5s61cv6a81va65sdf19v8a65a1\"}")
            .on("PUT", "/fapi/v1/listenKey", 200, "{}")
            .on("DELETE", "/fapi/v1/listenKey", 200, "{}");

        String key = venue.createListenKey().get(5, TimeUnit.SECONDS);
        venue.keepAliveListenKey().get(5, TimeUnit.SECONDS);
        venue.closeListenKey().get(5, TimeUnit.SECONDS);

        assertTrue(key.startsWith("pqia91ma19a5"), key);
        assertEquals(3, server.calls().size());
        for (FakeVenueServer.Call call : server.calls()) {
            assertEquals("/fapi/v1/listenKey", call.path());
            assertEquals("test-api-key", call.apiKey());
            assertTrue(call.query() == null || !call.query().contains("signature"), "Listen key calls are not signed");
        }
        assertEquals(List.of("POST", "PUT", "DELETE"),
            server.calls().stream().map(FakeVenueServer.Call::method).collect(Collectors.toList()));
    }

    @Test
    void testListenKeyErrorsSurface() {
        server.on("PUT", "/fapi/v1/listenKey", 400, "{\"code\":-1125,\"msg\":\"This listenKey does not exist.\"}")
            .on("POST", "/fapi/v1/listenKey", 200, "{}");

        Throwable keepAlive = failure(venue.keepAliveListenKey());
        assertInstanceOf(VenueException.class, keepAlive);
        assertEquals(-1125, ((VenueException) keepAlive).getVenueCode());

        Throwable create = failure(venue.createListenKey());
        assertTrue(create.getMessage().contains("no listenKey"), create.getMessage());
    }
}
