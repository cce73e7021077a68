package in.makerflow.infrastructure.venue;

import in.makerflow.domain.order.OrderRequest;

/**
 * Exception thrown when the venue rejects an order synchronously.
 * Rejections are final; callers do not retry them.
 */
public class OrderRejectedException extends VenueException {

    private final OrderRequest orderRequest;
    private final String reason;

    public OrderRejectedException(String accountId, OrderRequest orderRequest,
                                  Integer venueCode, int httpStatus, String reason) {
        super(accountId, String.format("Order rejected for %s %s: %s",
            orderRequest.symbol(), orderRequest.side(), reason), venueCode, httpStatus, false, null);
        this.orderRequest = orderRequest;
        this.reason = reason;
    }

    public OrderRequest getOrderRequest() {
        return orderRequest;
    }

    public String getReason() {
        return reason;
    }
}
