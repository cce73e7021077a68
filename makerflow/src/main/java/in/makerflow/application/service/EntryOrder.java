package in.makerflow.application.service;

import in.makerflow.domain.market.Quote;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.order.Side;
import in.makerflow.domain.trade.EntryParams;

import java.math.BigDecimal;

/**
 * What the entry engine should fill. Quantity is fixed across retries; only the price moves.
 *
 * @param reduceOnly true when the "entry" closes an existing position
 */
public record EntryOrder(
    String symbol,
    Side side,
    BigDecimal quantity,
    BigDecimal tickSize,
    Quote initialQuote,
    EntryParams params,
    PositionSide positionSide,
    boolean reduceOnly
) {
    public EntryOrder {
        if (symbol == null || side == null || quantity == null || tickSize == null
                || initialQuote == null || params == null) {
            throw new IllegalArgumentException("Entry order fields cannot be null");
        }
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (tickSize.signum() <= 0) {
            throw new IllegalArgumentException("Tick size must be positive");
        }
        if (positionSide == null) {
            positionSide = PositionSide.BOTH;
        }
    }
}
