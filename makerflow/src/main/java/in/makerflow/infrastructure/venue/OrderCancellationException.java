package in.makerflow.infrastructure.venue;

/**
 * Exception thrown when cancelling an order fails.
 */
public class OrderCancellationException extends VenueException {

    public enum CancelFailure {
        ORDER_ALREADY_FILLED,   // Order executed before the cancel arrived
        UNKNOWN_ORDER,          // Venue has no such order
        REQUEST_FAILED          // Transport, timeout or any other venue error
    }

    private final String symbol;
    private final String orderId;
    private final CancelFailure failure;

    public OrderCancellationException(String accountId, String symbol, String orderId,
                                      CancelFailure failure, String message,
                                      Integer venueCode, Throwable cause) {
        super(accountId, String.format("Cancel failed for %s order %s (%s): %s",
            symbol, orderId, failure, message), venueCode, 0, false, cause);
        this.symbol = symbol;
        this.orderId = orderId;
        this.failure = failure;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getOrderId() {
        return orderId;
    }

    public CancelFailure getFailure() {
        return failure;
    }

    public boolean isAlreadyFilled() {
        return failure == CancelFailure.ORDER_ALREADY_FILLED;
    }
}
