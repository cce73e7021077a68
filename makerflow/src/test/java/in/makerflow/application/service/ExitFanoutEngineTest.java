package in.makerflow.application.service;

import in.makerflow.domain.market.SymbolFilters;
import in.makerflow.domain.order.OrderRequest;
import in.makerflow.domain.order.OrderType;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.order.Side;
import in.makerflow.domain.order.TimeInForce;
import in.makerflow.domain.trade.LegErrorKind;
import in.makerflow.domain.trade.LegStatus;
import in.makerflow.domain.trade.OrderLeg;
import in.makerflow.domain.trade.TakeProfitLevel;
import in.makerflow.domain.trade.TakeProfitPlan;
import in.makerflow.infrastructure.venue.ScriptedVenue;
import in.makerflow.infrastructure.venue.VenueException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ExitFanoutEngineTest {

    private static final SymbolFilters FILTERS = new SymbolFilters("ETHUSDT", new BigDecimal("0.01"),
        new BigDecimal("0.001"), new BigDecimal("0.001"));

    private final ExitFanoutEngine engine = new ExitFanoutEngine();

    private static List<TakeProfitLevel> levels(String... percents) {
        List<BigDecimal> values = new java.util.ArrayList<>();
        for (String p : percents) {
            values.add(new BigDecimal(p));
        }
        return TakeProfitPlan.equalSplit(values).levels();
    }

    private static ExitOrder longExit(String qty, List<TakeProfitLevel> levels, String sl) {
        return new ExitOrder("ETHUSDT", Side.BUY, new BigDecimal("3000.00"), new BigDecimal(qty), levels,
            sl == null ? null : new BigDecimal(sl), FILTERS, PositionSide.BOTH);
    }

    @Test
    void testBuildLegs() {
        ExitLegs legs = engine.buildLegs(longExit("0.010", levels("0.5", "1.0"), "0.5"));

        assertEquals(2, legs.takeProfits().size());
        assertEquals(new BigDecimal("3015.00"), legs.takeProfits().get(0).getPrice());
        assertEquals(new BigDecimal("3030.00"), legs.takeProfits().get(1).getPrice());
        assertEquals(0, new BigDecimal("0.005").compareTo(legs.takeProfits().get(0).getQuantity()));
        assertEquals(0, new BigDecimal("0.005").compareTo(legs.takeProfits().get(1).getQuantity()));
        assertEquals(new BigDecimal("2985.00"), legs.stopLoss().getPrice());
        assertTrue(legs.all().stream().allMatch(l -> l.getStatus() == LegStatus.PENDING));
    }

    @Test
    void testAllLegsPlacedOnOppositeSide() throws Exception {
        ScriptedVenue venue = new ScriptedVenue("acc_1");

        ExitLegs legs = engine.placeExits(venue, longExit("0.010", levels("0.5", "1.0"), "0.5"))
            .get(5, TimeUnit.SECONDS);

        assertTrue(legs.isStopLossPlaced());
        assertEquals(2, legs.placedTakeProfits());
        assertTrue(legs.failed().isEmpty());
        assertEquals(3, venue.placed.size());

        OrderRequest sl = venue.placed.stream().filter(r -> r.orderType() == OrderType.STOP_MARKET)
            .findFirst().orElseThrow();
        assertEquals(Side.SELL, sl.side());
        assertTrue(sl.closePosition());
        assertEquals(new BigDecimal("2985.00"), sl.stopPrice());

        List<OrderRequest> tps = venue.placed.stream().filter(r -> r.orderType() == OrderType.LIMIT).toList();
        assertEquals(2, tps.size());
        for (OrderRequest tp : tps) {
            assertEquals(Side.SELL, tp.side());
            assertTrue(tp.reduceOnly());
            assertEquals(TimeInForce.GTX, tp.timeInForce());
        }
    }

    @Test
    void testOneFailedLegDoesNotAffectSiblings() throws Exception {
        BigDecimal failing = new BigDecimal("3030.00");
        ScriptedVenue venue = new ScriptedVenue("acc_1");
        venue.onPlace(r -> failing.equals(r.price()) ? venue.reject(r) : venue.accept(r));

        ExitLegs legs = engine.placeExits(venue, longExit("0.009", levels("0.5", "1.0", "1.5"), "0.5"))
            .get(5, TimeUnit.SECONDS);

        assertEquals(4, venue.placed.size(), "Every leg submitted exactly once");
        assertEquals(LegStatus.SUBMITTED, legs.takeProfits().get(0).getStatus());
        assertEquals(LegStatus.REJECTED, legs.takeProfits().get(1).getStatus());
        assertEquals(LegErrorKind.VENUE_REJECTION, legs.takeProfits().get(1).getError().kind());
        assertEquals(LegStatus.SUBMITTED, legs.takeProfits().get(2).getStatus());
        assertTrue(legs.isStopLossPlaced());
        assertEquals(1, legs.failed().size());
    }

    @Test
    void testTransportFailureMarksLegFailed() throws Exception {
        ScriptedVenue venue = new ScriptedVenue("acc_1");
        venue.onPlace(r -> CompletableFuture.failedFuture(VenueException.timeout("acc_1", "Place order", null)));

        ExitLegs legs = engine.placeExits(venue, longExit("0.010", levels("0.5"), "0.5"))
            .get(5, TimeUnit.SECONDS);

        assertFalse(legs.anyPlaced());
        for (OrderLeg leg : legs.all()) {
            assertEquals(LegStatus.FAILED, leg.getStatus());
            assertEquals(LegErrorKind.REQUEST_FAILED, leg.getError().kind());
        }
    }

    @Test
    void testSynchronousThrowIsCaptured() throws Exception {
        ScriptedVenue venue = new ScriptedVenue("acc_1");
        venue.onPlace(r -> {
            throw new IllegalStateException("session closed");
        });

        ExitLegs legs = engine.placeExits(venue, longExit("0.010", levels("0.5"), "0.5"))
            .get(5, TimeUnit.SECONDS);

        assertEquals(2, legs.failed().size());
    }

    @Test
    void testZeroQuantityLegNotSubmitted() throws Exception {
        ScriptedVenue venue = new ScriptedVenue("acc_1");

        // 0.002 over three legs: the first two round down to zero
        ExitLegs legs = engine.placeExits(venue, longExit("0.002", levels("0.5", "1.0", "1.5"), "0.5"))
            .get(5, TimeUnit.SECONDS);

        assertEquals(LegStatus.FAILED, legs.takeProfits().get(0).getStatus());
        assertEquals(LegStatus.FAILED, legs.takeProfits().get(1).getStatus());
        assertEquals(LegStatus.SUBMITTED, legs.takeProfits().get(2).getStatus());
        assertEquals(2, venue.placed.size(), "Only the SL and the last TP reach the venue");
    }

    @Test
    void testStopLossOnlyPlan() throws Exception {
        ScriptedVenue venue = new ScriptedVenue("acc_1");

        ExitLegs legs = engine.placeExits(venue, longExit("0.010", List.of(), "0.5")).get(5, TimeUnit.SECONDS);

        assertTrue(legs.takeProfits().isEmpty());
        assertTrue(legs.isStopLossPlaced());
        assertEquals(1, venue.placed.size());
    }

    @Test
    void testShortExitsBuyBack() throws Exception {
        ScriptedVenue venue = new ScriptedVenue("acc_1");
        ExitOrder shortExit = new ExitOrder("ETHUSDT", Side.SELL, new BigDecimal("3000.00"), new BigDecimal("0.010"),
            levels("0.5"), new BigDecimal("0.5"), FILTERS, PositionSide.SHORT);

        ExitLegs legs = engine.placeExits(venue, shortExit).get(5, TimeUnit.SECONDS);

        assertEquals(new BigDecimal("2985.00"), legs.takeProfits().get(0).getPrice());
        assertEquals(new BigDecimal("3015.00"), legs.stopLoss().getPrice());
        assertTrue(venue.placed.stream().allMatch(r -> r.side() == Side.BUY));
        assertTrue(venue.placed.stream().allMatch(r -> r.positionSide() == PositionSide.SHORT));
    }
}
