package in.makerflow.application.service;

import in.makerflow.domain.market.Quote;
import in.makerflow.domain.order.Side;
import in.makerflow.domain.trade.ExitPrices;
import in.makerflow.domain.trade.TakeProfitLevel;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Tick-aligned price calculations for entries and exits.
 *
 * Rounding directions:
 * - Entry: buy rounds down, sell rounds up (never toward the spread)
 * - Take-profit: toward the fill price (buy down, sell up) so the target stays reachable
 * - Stop-loss: toward the fill price (buy up, sell down) for tighter protection
 */
public final class PriceMath {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * Maker entry price: best bid minus ticksDistance ticks for a buy, best ask plus
     * ticksDistance ticks for a sell.
     */
    public static BigDecimal entryPrice(Side side, Quote quote, BigDecimal tickSize, int ticksDistance) {
        BigDecimal offset = tickSize.multiply(BigDecimal.valueOf(ticksDistance));
        if (side == Side.BUY) {
            return roundDown(quote.bestBid().subtract(offset), tickSize);
        }
        return roundUp(quote.bestAsk().add(offset), tickSize);
    }

    /**
     * Price the entry chase is measured against: best bid for a buy, best ask for a sell.
     */
    public static BigDecimal referencePrice(Side side, Quote quote) {
        return side == Side.BUY ? quote.bestBid() : quote.bestAsk();
    }

    /**
     * Absolute move from original to current in percent of original.
     */
    public static BigDecimal deviationPercent(BigDecimal original, BigDecimal current) {
        return current.subtract(original).abs()
            .multiply(HUNDRED)
            .divide(original, MathContext.DECIMAL64);
    }

    /**
     * Take-profit and stop-loss prices for a fill.
     *
     * @param slPercent stop distance in percent, or null for no stop
     */
    public static ExitPrices exitPrices(BigDecimal fillPrice, Side side, List<TakeProfitLevel> levels,
                                        BigDecimal slPercent, BigDecimal tickSize) {
        List<BigDecimal> tps = new ArrayList<>(levels.size());
        for (TakeProfitLevel level : levels) {
            tps.add(takeProfitPrice(fillPrice, side, level.percent(), tickSize));
        }
        BigDecimal sl = slPercent == null ? null : stopLossPrice(fillPrice, side, slPercent, tickSize);
        return new ExitPrices(tps, sl);
    }

    public static BigDecimal takeProfitPrice(BigDecimal fillPrice, Side side, BigDecimal percent, BigDecimal tickSize) {
        if (side == Side.BUY) {
            return roundDown(applyPercent(fillPrice, percent), tickSize);
        }
        return roundUp(applyPercent(fillPrice, percent.negate()), tickSize);
    }

    public static BigDecimal stopLossPrice(BigDecimal fillPrice, Side side, BigDecimal percent, BigDecimal tickSize) {
        if (side == Side.BUY) {
            return roundUp(applyPercent(fillPrice, percent.negate()), tickSize);
        }
        return roundDown(applyPercent(fillPrice, percent), tickSize);
    }

    /**
     * price × (1 + percent / 100)
     */
    static BigDecimal applyPercent(BigDecimal price, BigDecimal percent) {
        BigDecimal factor = BigDecimal.ONE.add(percent.divide(HUNDRED, MathContext.DECIMAL64));
        return price.multiply(factor);
    }

    public static BigDecimal roundDown(BigDecimal value, BigDecimal increment) {
        return round(value, increment, RoundingMode.FLOOR);
    }

    public static BigDecimal roundUp(BigDecimal value, BigDecimal increment) {
        return round(value, increment, RoundingMode.CEILING);
    }

    public static boolean isMultipleOf(BigDecimal value, BigDecimal increment) {
        return value.remainder(increment).signum() == 0;
    }

    private static BigDecimal round(BigDecimal value, BigDecimal increment, RoundingMode mode) {
        if (increment.signum() <= 0) {
            throw new IllegalArgumentException("Increment must be positive, got " + increment);
        }
        BigDecimal units = value.divide(increment, 0, mode);
        int scale = Math.max(0, increment.stripTrailingZeros().scale());
        return units.multiply(increment).setScale(scale, RoundingMode.UNNECESSARY);
    }

    private PriceMath() {}
}
