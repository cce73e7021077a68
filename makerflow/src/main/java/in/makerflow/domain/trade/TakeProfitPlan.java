package in.makerflow.domain.trade;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Take-profit configuration in one of its accepted shapes, resolved to an ordered
 * list of (percent, fraction) levels.
 *
 * Shapes:
 * - None: no take-profit legs, only the stop-loss protects the position
 * - Single: one leg closing the full quantity
 * - EqualSplit: N legs with equal fractions, rounding remainder on the last leg
 * - WeightedSplit: explicit fractions that must sum to one
 *
 * Shape rules (at most five legs, positive percents, fraction sum) are checked by
 * TradeValidator so a bad plan fails the trade instead of the caller.
 */
public interface TakeProfitPlan {

    int MAX_LEVELS = 5;

    List<TakeProfitLevel> levels();

    static TakeProfitPlan none() {
        return new None();
    }

    static TakeProfitPlan single(BigDecimal percent) {
        return new Single(percent);
    }

    static TakeProfitPlan equalSplit(List<BigDecimal> percents) {
        return new EqualSplit(percents);
    }

    static TakeProfitPlan weighted(List<TakeProfitLevel> levels) {
        return new WeightedSplit(levels);
    }

    record None() implements TakeProfitPlan {
        @Override
        public List<TakeProfitLevel> levels() {
            return List.of();
        }
    }

    record Single(BigDecimal percent) implements TakeProfitPlan {
        public Single {
            if (percent == null) {
                throw new IllegalArgumentException("Take-profit percent cannot be null");
            }
        }

        @Override
        public List<TakeProfitLevel> levels() {
            return List.of(new TakeProfitLevel(percent, BigDecimal.ONE));
        }
    }

    record EqualSplit(List<BigDecimal> percents) implements TakeProfitPlan {
        public EqualSplit {
            if (percents == null || percents.isEmpty()) {
                throw new IllegalArgumentException("Take-profit percents cannot be empty");
            }
            percents = List.copyOf(percents);
        }

        @Override
        public List<TakeProfitLevel> levels() {
            int n = percents.size();
            BigDecimal share = BigDecimal.ONE.divide(BigDecimal.valueOf(n), 12, RoundingMode.DOWN);
            List<TakeProfitLevel> result = new ArrayList<>(n);
            BigDecimal assigned = BigDecimal.ZERO;
            for (int i = 0; i < n; i++) {
                BigDecimal fraction = i == n - 1 ? BigDecimal.ONE.subtract(assigned) : share;
                assigned = assigned.add(fraction);
                result.add(new TakeProfitLevel(percents.get(i), fraction));
            }
            return List.copyOf(result);
        }
    }

    record WeightedSplit(List<TakeProfitLevel> levels) implements TakeProfitPlan {
        public WeightedSplit {
            if (levels == null || levels.isEmpty()) {
                throw new IllegalArgumentException("Take-profit levels cannot be empty");
            }
            levels = List.copyOf(levels);
        }
    }
}
