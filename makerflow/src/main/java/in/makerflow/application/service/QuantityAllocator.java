package in.makerflow.application.service;

import in.makerflow.domain.trade.TakeProfitLevel;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a filled quantity across take-profit legs.
 * Every leg but the last is rounded down to the step size; the last leg takes the remainder
 * so the legs always sum to the total.
 */
public final class QuantityAllocator {

    public static List<BigDecimal> allocate(BigDecimal total, List<TakeProfitLevel> levels, BigDecimal stepSize) {
        List<BigDecimal> result = new ArrayList<>(levels.size());
        if (levels.isEmpty()) {
            return result;
        }
        BigDecimal assigned = BigDecimal.ZERO;
        for (int i = 0; i < levels.size() - 1; i++) {
            BigDecimal share = PriceMath.roundDown(total.multiply(levels.get(i).fraction()), stepSize);
            result.add(share);
            assigned = assigned.add(share);
        }
        result.add(total.subtract(assigned));
        return result;
    }

    private QuantityAllocator() {}
}
