package in.makerflow.domain.order;

/**
 * Venue order status.
 */
public enum OrderStatus {
    NEW,                // Accepted and resting
    PARTIALLY_FILLED,   // Some quantity executed, remainder resting
    FILLED,             // Completely filled
    CANCELED,           // Cancelled by user or system
    REJECTED,           // Rejected by venue
    EXPIRED;            // Expired (post-only order that would have crossed, IOC remainder)

    public boolean isTerminal() {
        return this == FILLED || this == CANCELED || this == REJECTED || this == EXPIRED;
    }

    /**
     * Parse a venue status string. Unknown values map to NEW so a poll keeps waiting.
     */
    public static OrderStatus fromVenue(String value) {
        if (value == null) {
            return NEW;
        }
        switch (value) {
            case "PARTIALLY_FILLED":
                return PARTIALLY_FILLED;
            case "FILLED":
                return FILLED;
            case "CANCELED":
            case "CANCELLED":
                return CANCELED;
            case "REJECTED":
                return REJECTED;
            case "EXPIRED":
            case "EXPIRED_IN_MATCH":
                return EXPIRED;
            default:
                return NEW;
        }
    }
}
