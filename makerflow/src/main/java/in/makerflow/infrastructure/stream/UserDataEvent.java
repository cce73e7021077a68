package in.makerflow.infrastructure.stream;

import in.makerflow.domain.order.OrderStatus;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.order.Side;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Events pushed on an account's private user data stream.
 */
public interface UserDataEvent {

    Instant eventTime();

    /**
     * One position entry of an ACCOUNT_UPDATE. amount is signed: positive long, negative short.
     */
    record PositionUpdate(
        String symbol,
        PositionSide positionSide,
        BigDecimal amount,
        BigDecimal entryPrice
    ) {
        public PositionUpdate {
            if (symbol == null || symbol.isBlank()) {
                throw new IllegalArgumentException("Position update needs a symbol");
            }
            if (positionSide == null) {
                positionSide = PositionSide.BOTH;
            }
            if (amount == null) {
                amount = BigDecimal.ZERO;
            }
        }

        public boolean isOpen() {
            return amount.signum() != 0;
        }

        public boolean isLong() {
            return amount.signum() > 0;
        }

        /**
         * Key for the position within one account: symbol and side.
         */
        public String key() {
            return symbol + ":" + positionSide;
        }
    }

    /**
     * Balance and position change. reason is the venue's update reason (ORDER, FUNDING_FEE, ...).
     */
    record AccountUpdate(String reason, List<PositionUpdate> positions, Instant eventTime)
            implements UserDataEvent {
        public AccountUpdate {
            positions = positions == null ? List.of() : List.copyOf(positions);
        }
    }

    /**
     * Order state change. orderType is kept as the venue's text; the stream carries
     * types the order model does not place.
     */
    record OrderUpdate(
        String symbol,
        String orderId,
        Side side,
        String orderType,
        OrderStatus status,
        BigDecimal price,
        BigDecimal quantity,
        BigDecimal filledQuantity,
        BigDecimal averagePrice,
        BigDecimal realizedProfit,
        PositionSide positionSide,
        boolean reduceOnly,
        Instant eventTime
    ) implements UserDataEvent {
        public boolean isFilled() {
            return status == OrderStatus.FILLED;
        }
    }

    /**
     * The venue expired the stream's listen key. The socket stops delivering events.
     */
    record ListenKeyExpired(Instant eventTime) implements UserDataEvent {
    }
}
