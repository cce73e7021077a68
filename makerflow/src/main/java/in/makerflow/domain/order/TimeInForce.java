package in.makerflow.domain.order;

/**
 * Time in force for limit orders.
 */
public enum TimeInForce {
    GTC,    // Good till cancelled
    IOC,    // Immediate or cancel
    FOK,    // Fill or kill
    GTX     // Post only, rejected if it would take liquidity
}
