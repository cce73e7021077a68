package in.makerflow.application.service;

import in.makerflow.domain.market.Quote;
import in.makerflow.domain.order.Side;
import in.makerflow.domain.trade.ExitPrices;
import in.makerflow.domain.trade.TakeProfitLevel;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PriceMath.
 *
 * Tests:
 * - Maker entry pricing off the spread
 * - Take-profit / stop-loss rounding directions
 * - Chase deviation
 */
class PriceMathTest {

    private static final BigDecimal TICK = new BigDecimal("0.01");

    private static Quote quote(String bid, String ask) {
        return new Quote("ETHUSDT", new BigDecimal(bid), new BigDecimal(ask), TICK, Instant.now());
    }

    @Test
    void testBuyEntryJoinsBestBid() {
        assertEquals(new BigDecimal("3000.00"), PriceMath.entryPrice(Side.BUY, quote("3000.00", "3000.01"), TICK, 0));
    }

    @Test
    void testEntryStepsBackByTicks() {
        assertEquals(new BigDecimal("2999.98"), PriceMath.entryPrice(Side.BUY, quote("3000.00", "3000.01"), TICK, 2));
        assertEquals(new BigDecimal("3000.03"), PriceMath.entryPrice(Side.SELL, quote("3000.00", "3000.01"), TICK, 2));
    }

    @Test
    void testEntryNeverRoundsTowardSpread() {
        // Off-grid quotes: buy rounds down, sell rounds up
        assertEquals(new BigDecimal("100.03"), PriceMath.entryPrice(Side.BUY, quote("100.037", "100.041"), TICK, 0));
        assertEquals(new BigDecimal("100.05"), PriceMath.entryPrice(Side.SELL, quote("100.037", "100.041"), TICK, 0));
    }

    @Test
    void testLongExitPricesForEthScenario() {
        List<TakeProfitLevel> levels = List.of(
            new TakeProfitLevel(new BigDecimal("0.5"), new BigDecimal("0.5")),
            new TakeProfitLevel(new BigDecimal("1.0"), new BigDecimal("0.5")));

        ExitPrices prices = PriceMath.exitPrices(new BigDecimal("3000.00"), Side.BUY, levels,
            new BigDecimal("0.5"), TICK);

        assertEquals(List.of(new BigDecimal("3015.00"), new BigDecimal("3030.00")), prices.takeProfitPrices());
        assertEquals(new BigDecimal("2985.00"), prices.stopLossPrice());
    }

    @Test
    void testShortExitPricesMirrorLong() {
        List<TakeProfitLevel> levels = List.of(new TakeProfitLevel(new BigDecimal("0.5"), BigDecimal.ONE));

        ExitPrices prices = PriceMath.exitPrices(new BigDecimal("3000.00"), Side.SELL, levels,
            new BigDecimal("0.5"), TICK);

        assertEquals(List.of(new BigDecimal("2985.00")), prices.takeProfitPrices());
        assertEquals(new BigDecimal("3015.00"), prices.stopLossPrice());
    }

    @Test
    void testExitRoundingTowardFillPrice() {
        BigDecimal fill = new BigDecimal("100.01");
        BigDecimal pct = new BigDecimal("0.3");

        // 100.31003 / 99.70997 for a long
        assertEquals(new BigDecimal("100.31"), PriceMath.takeProfitPrice(fill, Side.BUY, pct, TICK));
        assertEquals(new BigDecimal("99.71"), PriceMath.stopLossPrice(fill, Side.BUY, pct, TICK));

        // 99.70997 / 100.31003 for a short
        assertEquals(new BigDecimal("99.71"), PriceMath.takeProfitPrice(fill, Side.SELL, pct, TICK));
        assertEquals(new BigDecimal("100.31"), PriceMath.stopLossPrice(fill, Side.SELL, pct, TICK));
    }

    @Test
    void testNoStopLossWhenPercentMissing() {
        ExitPrices prices = PriceMath.exitPrices(new BigDecimal("3000.00"), Side.BUY, List.of(), null, TICK);

        assertTrue(prices.takeProfitPrices().isEmpty());
        assertNull(prices.stopLossPrice());
    }

    @Test
    void testDeviationPercent() {
        assertEquals(0, new BigDecimal("0.1").compareTo(
            PriceMath.deviationPercent(new BigDecimal("3000"), new BigDecimal("3003"))));
        assertEquals(0, new BigDecimal("0.1").compareTo(
            PriceMath.deviationPercent(new BigDecimal("3000"), new BigDecimal("2997"))));
        assertEquals(0, BigDecimal.ZERO.compareTo(
            PriceMath.deviationPercent(new BigDecimal("3000"), new BigDecimal("3000"))));
    }

    @Test
    void testReferencePriceBySide() {
        Quote q = quote("3000.00", "3000.01");
        assertEquals(new BigDecimal("3000.00"), PriceMath.referencePrice(Side.BUY, q));
        assertEquals(new BigDecimal("3000.01"), PriceMath.referencePrice(Side.SELL, q));
    }

    @Test
    void testCoarseTickKeepsTickScale() {
        BigDecimal tick = new BigDecimal("0.5");
        assertEquals(new BigDecimal("101.5"), PriceMath.roundDown(new BigDecimal("101.99"), tick));
        assertEquals(new BigDecimal("102.0"), PriceMath.roundUp(new BigDecimal("101.51"), tick));
    }

    @Test
    void testRejectsNonPositiveIncrement() {
        assertThrows(IllegalArgumentException.class,
            () -> PriceMath.roundDown(BigDecimal.TEN, BigDecimal.ZERO));
    }

    @Test
    void testIsMultipleOf() {
        assertTrue(PriceMath.isMultipleOf(new BigDecimal("0.010"), new BigDecimal("0.001")));
        assertFalse(PriceMath.isMultipleOf(new BigDecimal("0.0105"), new BigDecimal("0.001")));
    }
}
