package in.makerflow.domain.trade;

import java.math.BigDecimal;

/**
 * One take-profit target: price offset in percent from the fill and the share of quantity it closes.
 */
public record TakeProfitLevel(BigDecimal percent, BigDecimal fraction) {

    public TakeProfitLevel {
        if (percent == null) {
            throw new IllegalArgumentException("Percent cannot be null");
        }
        if (fraction == null) {
            throw new IllegalArgumentException("Fraction cannot be null");
        }
    }
}
