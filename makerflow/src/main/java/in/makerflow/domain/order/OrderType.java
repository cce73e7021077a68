package in.makerflow.domain.order;

/**
 * Futures order types used by the engines.
 */
public enum OrderType {
    LIMIT,
    MARKET,
    STOP_MARKET,
    TAKE_PROFIT_MARKET;

    public boolean isConditional() {
        return this == STOP_MARKET || this == TAKE_PROFIT_MARKET;
    }
}
