package in.makerflow.domain.market;

import java.math.BigDecimal;

/**
 * Price and quantity filters for a symbol (PRICE_FILTER and LOT_SIZE).
 */
public record SymbolFilters(
    String symbol,
    BigDecimal tickSize,
    BigDecimal stepSize,
    BigDecimal minQty
) {
    public SymbolFilters {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (tickSize == null || tickSize.signum() <= 0) {
            throw new IllegalArgumentException("Tick size must be positive");
        }
        if (stepSize == null || stepSize.signum() <= 0) {
            throw new IllegalArgumentException("Step size must be positive");
        }
        if (minQty == null) {
            minQty = BigDecimal.ZERO;
        }
    }
}
