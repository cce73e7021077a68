package in.makerflow.application.service;

import in.makerflow.domain.market.SymbolFilters;
import in.makerflow.domain.order.Side;
import in.makerflow.domain.trade.TakeProfitLevel;
import in.makerflow.domain.trade.TakeProfitPlan;
import in.makerflow.domain.trade.TradeRequest;
import in.makerflow.domain.trade.TradeValidationException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a trade request before anything is sent to the venue.
 */
public final class TradeValidator {

    private static final BigDecimal MIN_FRACTION_TOLERANCE = new BigDecimal("1e-9");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * @throws TradeValidationException listing every violation found
     */
    public static void validate(TradeRequest request) {
        List<String> violations = new ArrayList<>();
        SymbolFilters filters = request.filters();
        BigDecimal quantity = request.quantity();

        if (quantity == null || quantity.signum() <= 0) {
            violations.add("quantity must be positive");
        } else if (!PriceMath.isMultipleOf(quantity, filters.stepSize())) {
            violations.add("quantity " + quantity.toPlainString() + " is not a multiple of step size "
                + filters.stepSize().toPlainString());
        } else if (filters.minQty().signum() > 0 && quantity.compareTo(filters.minQty()) < 0) {
            violations.add("quantity " + quantity.toPlainString() + " is below minimum " + filters.minQty().toPlainString());
        }

        BigDecimal sl = request.slPercent();
        if (sl == null || sl.signum() <= 0) {
            violations.add("stop-loss percent must be positive");
        } else if (request.side() == Side.BUY && sl.compareTo(HUNDRED) >= 0) {
            violations.add("stop-loss percent must be below 100 for a buy");
        }

        List<TakeProfitLevel> levels = request.takeProfits().levels();
        if (levels.size() > TakeProfitPlan.MAX_LEVELS) {
            violations.add("at most " + TakeProfitPlan.MAX_LEVELS + " take-profit legs allowed, got " + levels.size());
        }

        BigDecimal fractionSum = BigDecimal.ZERO;
        for (int i = 0; i < levels.size(); i++) {
            TakeProfitLevel level = levels.get(i);
            if (level.percent().signum() <= 0) {
                violations.add("take-profit " + (i + 1) + " percent must be positive");
            } else if (request.side() == Side.SELL && level.percent().compareTo(HUNDRED) >= 0) {
                violations.add("take-profit " + (i + 1) + " percent must be below 100 for a sell");
            }
            if (level.fraction().signum() <= 0) {
                violations.add("take-profit " + (i + 1) + " fraction must be positive");
            }
            fractionSum = fractionSum.add(level.fraction());
        }

        if (!levels.isEmpty() && quantity != null && quantity.signum() > 0) {
            BigDecimal tolerance = filters.stepSize().divide(quantity, MathContext.DECIMAL64).max(MIN_FRACTION_TOLERANCE);
            if (fractionSum.subtract(BigDecimal.ONE).abs().compareTo(tolerance) > 0) {
                violations.add("take-profit fractions sum to " + fractionSum.stripTrailingZeros().toPlainString()
                    + ", expected 1");
            } else if (violations.isEmpty()) {
                List<BigDecimal> split = QuantityAllocator.allocate(quantity, levels, filters.stepSize());
                for (int i = 0; i < split.size(); i++) {
                    if (split.get(i).signum() <= 0) {
                        violations.add("take-profit " + (i + 1) + " gets no quantity at step size "
                            + filters.stepSize().toPlainString());
                    }
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new TradeValidationException(violations);
        }
    }

    private TradeValidator() {}
}
