package in.makerflow.domain.account;

import java.math.BigDecimal;

/**
 * Open position on one symbol.
 * positionAmount is signed: positive long, negative short.
 */
public record Position(
    String symbol,
    String positionSide,
    BigDecimal positionAmount,
    BigDecimal entryPrice,
    BigDecimal unrealizedProfit,
    int leverage
) {
    public boolean isOpen() {
        return positionAmount != null && positionAmount.signum() != 0;
    }

    public boolean isLong() {
        return positionAmount != null && positionAmount.signum() > 0;
    }
}
