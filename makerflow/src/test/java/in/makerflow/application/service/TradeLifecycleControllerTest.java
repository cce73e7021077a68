package in.makerflow.application.service;

import in.makerflow.domain.market.Quote;
import in.makerflow.domain.market.SymbolFilters;
import in.makerflow.domain.order.OrderType;
import in.makerflow.domain.order.Side;
import in.makerflow.domain.trade.EntryParams;
import in.makerflow.domain.trade.LegStatus;
import in.makerflow.domain.trade.OrderLeg;
import in.makerflow.domain.trade.TakeProfitPlan;
import in.makerflow.domain.trade.Trade;
import in.makerflow.domain.trade.TradeRequest;
import in.makerflow.domain.trade.TradeStatus;
import in.makerflow.infrastructure.metrics.VenueMetrics;
import in.makerflow.infrastructure.stream.QuoteCache;
import in.makerflow.infrastructure.venue.QuoteSource;
import in.makerflow.infrastructure.venue.ScriptedVenue;
import in.makerflow.infrastructure.venue.TradingVenue;
import in.makerflow.infrastructure.venue.VenueException;
import in.makerflow.infrastructure.venue.paper.PaperTradingVenue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TradeLifecycleController.
 *
 * Tests:
 * - Happy path against the paper venue
 * - Partial and total exit failure
 * - Validation before any venue call
 * - Entry outcomes mapped to trade status
 */
class TradeLifecycleControllerTest {

    private static final SymbolFilters FILTERS = new SymbolFilters("ETHUSDT", new BigDecimal("0.01"),
        new BigDecimal("0.001"), new BigDecimal("0.001"));
    private static final EntryParams FAST = new EntryParams(1, Duration.ofMillis(100), Duration.ofMillis(20),
        new BigDecimal("0.1"), 0);

    private ExecutorService executor;
    private VenueMetrics metrics;
    private TradeLifecycleController controller;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        metrics = mock(VenueMetrics.class);
        QuoteCache cache = new QuoteCache();
        cache.update(quote());
        QuoteLookup lookup = new QuoteLookup(cache, mock(QuoteSource.class), Duration.ofMinutes(1));
        controller = new TradeLifecycleController(new EntryExecutionEngine(lookup, metrics, executor),
            new ExitFanoutEngine(), metrics);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Quote quote() {
        return new Quote("ETHUSDT", new BigDecimal("3000.00"), new BigDecimal("3000.01"), null, Instant.now());
    }

    private static TradeRequest request(String qty, TakeProfitPlan plan) {
        return new TradeRequest("ETHUSDT", Side.BUY, new BigDecimal(qty), quote(), FILTERS, plan,
            new BigDecimal("0.5"), FAST, false);
    }

    private static TakeProfitPlan percents(String... values) {
        List<BigDecimal> list = new java.util.ArrayList<>();
        for (String v : values) {
            list.add(new BigDecimal(v));
        }
        return TakeProfitPlan.equalSplit(list);
    }

    private Trade execute(TradingVenue venue, TradeRequest request) throws Exception {
        return controller.execute(venue, request).get(5, TimeUnit.SECONDS);
    }

    @Test
    void testEthLongScenarioOnPaperVenue() throws Exception {
        Trade trade = execute(new PaperTradingVenue("paper_1"), request("0.010", percents("0.5", "1.0")));

        assertEquals(TradeStatus.ACTIVE, trade.getStatus());
        assertEquals(LegStatus.FILLED, trade.getEntry().getStatus());
        assertEquals(new BigDecimal("3000.00"), trade.getEntry().getFillPrice());

        assertEquals(2, trade.getTakeProfits().size());
        assertEquals(new BigDecimal("3015.00"), trade.getTakeProfits().get(0).getPrice());
        assertEquals(new BigDecimal("3030.00"), trade.getTakeProfits().get(1).getPrice());
        assertEquals(new BigDecimal("2985.00"), trade.getStopLoss().getPrice());
        assertTrue(trade.allLegs().stream().allMatch(OrderLeg::isPlaced));

        assertEquals("paper_1", trade.getMetadata().get("account_id"));
        assertEquals(new BigDecimal("3000.00"), trade.getMetadata().get("fill_price"));
        assertFalse(trade.getMetadata().containsKey(TradeLifecycleController.ERROR_KIND));
        assertNotNull(trade.getFilledAt());
        assertTrue(trade.getTradeId().startsWith("trade_ETHUSDT_buy_"));
        verify(metrics).recordTradeOutcome(TradeStatus.ACTIVE);
    }

    @Test
    void testPartialExitFailureStaysActive() throws Exception {
        BigDecimal failingTp = new BigDecimal("3030.00");
        ScriptedVenue venue = new ScriptedVenue("acc_1");
        venue.onPlace(r -> failingTp.equals(r.price()) ? venue.reject(r) : venue.accept(r));
        venue.onStatus((order, poll) -> ScriptedVenue.filled(order));

        Trade trade = execute(venue, request("0.009", percents("0.5", "1.0", "1.5")));

        assertEquals(TradeStatus.ACTIVE, trade.getStatus());
        assertEquals(TradeLifecycleController.PARTIAL_EXIT_FAILURE,
            trade.getMetadata().get(TradeLifecycleController.ERROR_KIND));
        assertEquals(LegStatus.REJECTED, trade.getTakeProfits().get(1).getStatus());
        assertTrue(trade.getTakeProfits().get(0).isPlaced());
        assertTrue(trade.getTakeProfits().get(2).isPlaced());
        assertTrue(trade.getStopLoss().isPlaced());
        assertEquals(1, ((List<?>) trade.getMetadata().get("failed_legs")).size());
    }

    @Test
    void testTotalExitFailureFailsTrade() throws Exception {
        ScriptedVenue venue = new ScriptedVenue("acc_1");
        venue.onPlace(r -> r.reduceOnly() || r.closePosition()
            ? CompletableFuture.failedFuture(new VenueException("acc_1", "Service unavailable", null, 503, false, null))
            : venue.accept(r));
        venue.onStatus((order, poll) -> ScriptedVenue.filled(order));

        Trade trade = execute(venue, request("0.010", percents("0.5", "1.0")));

        assertEquals(TradeStatus.FAILED, trade.getStatus());
        assertEquals(TradeLifecycleController.TOTAL_EXIT_FAILURE,
            trade.getMetadata().get(TradeLifecycleController.ERROR_KIND));
        assertEquals(LegStatus.FILLED, trade.getEntry().getStatus(), "Entry stays filled: position is open");
        assertTrue(trade.getTakeProfits().stream().noneMatch(OrderLeg::isPlaced));
        verify(metrics).recordTradeOutcome(TradeStatus.FAILED);
    }

    @Test
    void testValidationFailureMakesNoVenueCalls() throws Exception {
        TradingVenue venue = mock(TradingVenue.class);
        when(venue.getAccountId()).thenReturn("acc_1");

        Trade trade = execute(venue, request("0.0105", percents("0.5", "1.0")));

        assertEquals(TradeStatus.FAILED, trade.getStatus());
        assertEquals(TradeLifecycleController.VALIDATION_ERROR,
            trade.getMetadata().get(TradeLifecycleController.ERROR_KIND));
        assertTrue(((String) trade.getMetadata().get(TradeLifecycleController.ERROR)).contains("step size"));
        verify(venue, never()).placeOrder(any());
        verify(venue, never()).getOrder(anyString(), anyString());
        verify(venue, never()).cancelOrder(anyString(), anyString());
        assertNull(trade.getEntry().getOrderId());
    }

    @Test
    void testRejectedEntryCancelsTrade() throws Exception {
        ScriptedVenue venue = new ScriptedVenue("acc_1");
        venue.onPlace(venue::reject);

        Trade trade = execute(venue, request("0.010", percents("0.5")));

        assertEquals(TradeStatus.CANCELLED, trade.getStatus());
        assertEquals("VENUE_REJECTION", trade.getMetadata().get(TradeLifecycleController.ERROR_KIND));
        assertTrue(trade.getTakeProfits().isEmpty());
        assertNull(trade.getStopLoss());
        assertEquals(1, venue.placed.size());
    }

    @Test
    void testUnfilledEntryCancelsTradeWithoutExits() throws Exception {
        ScriptedVenue venue = new ScriptedVenue("acc_1");

        Trade trade = execute(venue, request("0.010", percents("0.5")));

        assertEquals(TradeStatus.CANCELLED, trade.getStatus());
        assertEquals("RETRY_EXHAUSTED", trade.getMetadata().get(TradeLifecycleController.ERROR_KIND));
        assertEquals(2, venue.placed.size());
        assertTrue(venue.placed.stream().allMatch(r -> r.orderType() == OrderType.LIMIT && !r.reduceOnly()));
        assertNotNull(trade.getClosedAt());
    }

    @Test
    void testPartialEntrySizesExits() throws Exception {
        BigDecimal part = new BigDecimal("0.006");
        ScriptedVenue venue = new ScriptedVenue("acc_1");
        venue.onStatus((order, poll) -> order.orderType() == OrderType.LIMIT && !order.status().isTerminal()
            ? ScriptedVenue.partiallyFilled(order, part) : order);

        Trade trade = execute(venue, request("0.010", percents("0.5", "1.0")));

        assertEquals(TradeStatus.ACTIVE, trade.getStatus());
        assertEquals(Boolean.TRUE, trade.getMetadata().get("partial_entry"));
        assertEquals(0, new BigDecimal("0.003").compareTo(trade.getTakeProfits().get(0).getQuantity()));
        assertEquals(0, new BigDecimal("0.003").compareTo(trade.getTakeProfits().get(1).getQuantity()));
    }

    @Test
    void testCompletedOnlyFromActive() throws Exception {
        Trade trade = execute(new PaperTradingVenue("paper_1"), request("0.010", percents("0.5")));

        trade.markCompleted(Instant.now());

        assertEquals(TradeStatus.COMPLETED, trade.getStatus());
        assertThrows(IllegalStateException.class, () -> trade.transitionTo(TradeStatus.ACTIVE, Instant.now()));
    }
}
