package in.makerflow.domain.trade;

/**
 * Order leg status.
 */
public enum LegStatus {
    PENDING,            // Not yet submitted
    SUBMITTED,          // Accepted by the venue and resting
    PARTIALLY_FILLED,   // Some quantity executed
    FILLED,             // Filled (entry) or fully executed
    CANCELLED,          // Cancelled by the engine (retry budget, chase limit, abort)
    REJECTED,           // Rejected by the venue
    FAILED;             // Request or cancel failure

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED || this == FAILED;
    }
}
