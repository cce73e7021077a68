package in.makerflow.domain.trade;

import java.math.BigDecimal;
import java.util.List;

/**
 * Tick-aligned exit prices computed from a fill price.
 */
public record ExitPrices(List<BigDecimal> takeProfitPrices, BigDecimal stopLossPrice) {

    public ExitPrices {
        takeProfitPrices = List.copyOf(takeProfitPrices);
    }
}
