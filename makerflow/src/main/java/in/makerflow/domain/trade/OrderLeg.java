package in.makerflow.domain.trade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One order inside a trade.
 *
 * A leg is written only by the component that submits it and becomes
 * read-only once its status is terminal.
 */
public class OrderLeg {

    private final LegRole role;
    private final int index;
    private final BigDecimal quantity;

    private String orderId;
    private BigDecimal price;
    private LegStatus status = LegStatus.PENDING;
    private LegError error;
    private Instant placedAt;
    private Instant filledAt;
    private BigDecimal fillPrice;
    private BigDecimal filledQuantity;
    private int attempts;

    private OrderLeg(LegRole role, int index, BigDecimal quantity, BigDecimal price) {
        this.role = role;
        this.index = index;
        this.quantity = quantity;
        this.price = price;
    }

    public static OrderLeg entry(BigDecimal quantity) {
        return new OrderLeg(LegRole.ENTRY, 0, quantity, null);
    }

    public static OrderLeg takeProfit(int index, BigDecimal quantity, BigDecimal price) {
        return new OrderLeg(LegRole.TAKE_PROFIT, index, quantity, price);
    }

    /**
     * Stop-loss legs close the whole position, so quantity tracks the filled entry for reporting only.
     */
    public static OrderLeg stopLoss(BigDecimal quantity, BigDecimal stopPrice) {
        return new OrderLeg(LegRole.STOP_LOSS, 0, quantity, stopPrice);
    }

    /**
     * Record a venue acceptance. Entry retries call this again with the replacement order.
     */
    public synchronized void markSubmitted(String newOrderId, BigDecimal newPrice, Instant at) {
        ensureOpen();
        this.orderId = newOrderId;
        this.price = newPrice;
        this.status = LegStatus.SUBMITTED;
        this.attempts++;
        if (placedAt == null) {
            placedAt = at;
        }
    }

    public synchronized void markPartiallyFilled(BigDecimal executed, BigDecimal avgPrice) {
        ensureOpen();
        this.filledQuantity = executed;
        this.fillPrice = avgPrice;
        this.status = LegStatus.PARTIALLY_FILLED;
    }

    public synchronized void markFilled(BigDecimal avgPrice, BigDecimal executed, Instant at) {
        ensureOpen();
        this.fillPrice = avgPrice;
        this.filledQuantity = executed;
        this.filledAt = at;
        this.status = LegStatus.FILLED;
    }

    /**
     * Move the leg to a terminal non-fill status with an error.
     */
    public synchronized void markFailed(LegStatus terminal, LegError legError) {
        ensureOpen();
        if (!terminal.isTerminal() || terminal == LegStatus.FILLED) {
            throw new IllegalArgumentException("Not a failure status: " + terminal);
        }
        this.status = terminal;
        this.error = legError;
    }

    /**
     * Counts a submission attempt that never reached the venue.
     */
    public synchronized void countAttempt() {
        ensureOpen();
        this.attempts++;
    }

    private void ensureOpen() {
        if (status.isTerminal()) {
            throw new IllegalStateException(role + " leg is already " + status);
        }
    }

    public LegRole getRole() {
        return role;
    }

    public int getIndex() {
        return index;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public synchronized String getOrderId() {
        return orderId;
    }

    public synchronized BigDecimal getPrice() {
        return price;
    }

    public synchronized LegStatus getStatus() {
        return status;
    }

    public synchronized LegError getError() {
        return error;
    }

    public synchronized Instant getPlacedAt() {
        return placedAt;
    }

    public synchronized Instant getFilledAt() {
        return filledAt;
    }

    public synchronized BigDecimal getFillPrice() {
        return fillPrice;
    }

    public synchronized BigDecimal getFilledQuantity() {
        return filledQuantity;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    /**
     * An exit leg counts as placed when the venue accepted it.
     */
    public synchronized boolean isPlaced() {
        return status == LegStatus.SUBMITTED || status == LegStatus.PARTIALLY_FILLED
            || status == LegStatus.FILLED;
    }

    @Override
    public synchronized String toString() {
        return "OrderLeg{" + role + (role == LegRole.TAKE_PROFIT ? "[" + index + "]" : "")
            + ", orderId=" + orderId + ", price=" + price + ", qty=" + quantity
            + ", status=" + status + (error != null ? ", error=" + error : "") + "}";
    }
}
