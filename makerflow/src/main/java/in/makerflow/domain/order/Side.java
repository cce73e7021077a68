package in.makerflow.domain.order;

/**
 * Order side.
 */
public enum Side {
    BUY,
    SELL;

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * Parse a side from a command value ("buy", "SELL", "long", "short").
     */
    public static Side parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Side cannot be null or empty");
        }
        switch (value.trim().toUpperCase()) {
            case "BUY":
            case "LONG":
                return BUY;
            case "SELL":
            case "SHORT":
                return SELL;
            default:
                throw new IllegalArgumentException("Unknown side: " + value);
        }
    }
}
