package in.makerflow.domain.trade;

import in.makerflow.domain.market.Quote;
import in.makerflow.domain.market.SymbolFilters;
import in.makerflow.domain.order.Side;

import java.math.BigDecimal;

/**
 * Input of one trade run: instrument, size, initial quote and exit plan.
 * Values are checked by TradeValidator; only missing references fail here.
 */
public record TradeRequest(
    String symbol,
    Side side,
    BigDecimal quantity,
    Quote quote,
    SymbolFilters filters,
    TakeProfitPlan takeProfits,
    BigDecimal slPercent,
    EntryParams entry,
    boolean hedgeMode
) {
    public TradeRequest {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (side == null) {
            throw new IllegalArgumentException("Side cannot be null");
        }
        if (quote == null) {
            throw new IllegalArgumentException("Quote cannot be null");
        }
        if (filters == null) {
            throw new IllegalArgumentException("Symbol filters cannot be null");
        }
        if (takeProfits == null) {
            takeProfits = TakeProfitPlan.none();
        }
        if (entry == null) {
            entry = EntryParams.defaults();
        }
    }

    public BigDecimal tickSize() {
        return filters.tickSize();
    }

    public TradeRequest withQuantity(BigDecimal newQuantity) {
        return new TradeRequest(symbol, side, newQuantity, quote, filters, takeProfits,
            slPercent, entry, hedgeMode);
    }

    public TradeRequest withQuote(Quote newQuote) {
        return new TradeRequest(symbol, side, quantity, newQuote, filters, takeProfits,
            slPercent, entry, hedgeMode);
    }

    public TradeRequest withHedgeMode(boolean newHedgeMode) {
        return new TradeRequest(symbol, side, quantity, quote, filters, takeProfits,
            slPercent, entry, newHedgeMode);
    }
}
