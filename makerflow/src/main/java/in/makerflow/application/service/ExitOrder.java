package in.makerflow.application.service;

import in.makerflow.domain.market.SymbolFilters;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.order.Side;
import in.makerflow.domain.trade.TakeProfitLevel;

import java.math.BigDecimal;
import java.util.List;

/**
 * Exit plan for a filled entry.
 *
 * @param entrySide      side of the entry; exits go on the opposite side
 * @param fillPrice      average entry fill price
 * @param filledQuantity quantity actually filled, split across the take-profit legs
 * @param slPercent      stop distance in percent, or null for no stop-loss leg
 */
public record ExitOrder(
    String symbol,
    Side entrySide,
    BigDecimal fillPrice,
    BigDecimal filledQuantity,
    List<TakeProfitLevel> levels,
    BigDecimal slPercent,
    SymbolFilters filters,
    PositionSide positionSide
) {
    public ExitOrder {
        if (symbol == null || entrySide == null || fillPrice == null || filledQuantity == null || filters == null) {
            throw new IllegalArgumentException("Exit order fields cannot be null");
        }
        levels = levels == null ? List.of() : List.copyOf(levels);
        if (positionSide == null) {
            positionSide = PositionSide.BOTH;
        }
    }

    public Side exitSide() {
        return entrySide.opposite();
    }
}
