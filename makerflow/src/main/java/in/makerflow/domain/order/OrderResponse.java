package in.makerflow.domain.order;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Order state as reported by a trading venue.
 * Returned by TradingVenue placeOrder, getOrder and cancelOrder.
 */
public record OrderResponse(
    String orderId,
    String clientOrderId,
    String symbol,
    Side side,
    OrderType orderType,
    OrderStatus status,
    BigDecimal price,
    BigDecimal origQuantity,
    BigDecimal executedQuantity,
    BigDecimal avgPrice,
    Instant updateTime
) {
    public OrderResponse {
        if (orderId == null || orderId.isBlank()) {
            throw new IllegalArgumentException("Order id cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (executedQuantity == null) {
            executedQuantity = BigDecimal.ZERO;
        }
    }

    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }

    public boolean hasExecution() {
        return executedQuantity.signum() > 0;
    }

    /**
     * Average fill price, falling back to the limit price when the venue reports none.
     */
    public BigDecimal fillPrice() {
        if (avgPrice != null && avgPrice.signum() > 0) {
            return avgPrice;
        }
        return price;
    }

    public OrderResponse withStatus(OrderStatus newStatus, BigDecimal executed, BigDecimal avg, Instant time) {
        return new OrderResponse(orderId, clientOrderId, symbol, side, orderType, newStatus,
            price, origQuantity, executed, avg, time);
    }
}
