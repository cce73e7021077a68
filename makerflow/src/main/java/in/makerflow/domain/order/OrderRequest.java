package in.makerflow.domain.order;

import java.math.BigDecimal;

/**
 * Order request submitted to a trading venue.
 * Used by TradingVenue implementations.
 *
 * quantity is null only for closePosition orders.
 */
public record OrderRequest(
    String symbol,
    Side side,
    OrderType orderType,
    BigDecimal quantity,
    BigDecimal price,
    BigDecimal stopPrice,
    TimeInForce timeInForce,
    PositionSide positionSide,
    boolean reduceOnly,
    boolean closePosition,
    String clientOrderId
) {
    public OrderRequest {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol cannot be null or empty");
        }
        if (side == null) {
            throw new IllegalArgumentException("Side cannot be null");
        }
        if (orderType == null) {
            throw new IllegalArgumentException("Order type cannot be null");
        }
        if (!closePosition && (quantity == null || quantity.signum() <= 0)) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (orderType == OrderType.LIMIT) {
            if (price == null || price.signum() <= 0) {
                throw new IllegalArgumentException("Limit order requires a positive price");
            }
            if (timeInForce == null) {
                throw new IllegalArgumentException("Limit order requires time in force");
            }
        }
        if (orderType.isConditional() && (stopPrice == null || stopPrice.signum() <= 0)) {
            throw new IllegalArgumentException("Conditional order requires a positive stop price");
        }
        if (positionSide == null) {
            positionSide = PositionSide.BOTH;
        }
    }

    /**
     * Post-only limit order (time in force GTX).
     */
    public static OrderRequest makerLimit(String symbol, Side side, BigDecimal quantity,
                                          BigDecimal price, PositionSide positionSide,
                                          boolean reduceOnly) {
        return new OrderRequest(symbol, side, OrderType.LIMIT, quantity, price, null,
            TimeInForce.GTX, positionSide, reduceOnly, false, null);
    }

    /**
     * Stop-market order that closes the whole position when triggered.
     */
    public static OrderRequest stopClose(String symbol, Side side, BigDecimal stopPrice,
                                         PositionSide positionSide) {
        return new OrderRequest(symbol, side, OrderType.STOP_MARKET, null, null, stopPrice,
            null, positionSide, false, true, null);
    }

    public OrderRequest withClientOrderId(String id) {
        return new OrderRequest(symbol, side, orderType, quantity, price, stopPrice,
            timeInForce, positionSide, reduceOnly, closePosition, id);
    }
}
