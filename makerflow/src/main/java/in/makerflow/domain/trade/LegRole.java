package in.makerflow.domain.trade;

/**
 * Role of an order leg inside a trade.
 */
public enum LegRole {
    ENTRY,
    TAKE_PROFIT,
    STOP_LOSS
}
