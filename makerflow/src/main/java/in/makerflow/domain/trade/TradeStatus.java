package in.makerflow.domain.trade;

import java.util.EnumSet;
import java.util.Set;

/**
 * Trade lifecycle status.
 *
 * Lifecycle: PENDING → ENTRY_PLACED → ENTRY_FILLED → ACTIVE → COMPLETED
 * with CANCELLED and FAILED as terminal side exits.
 */
public enum TradeStatus {
    PENDING,        // Created, nothing sent to the venue
    ENTRY_PLACED,   // Entry order accepted by the venue
    ENTRY_FILLED,   // Entry fill confirmed, exits being placed
    ACTIVE,         // At least one exit leg in place
    COMPLETED,      // Position closed by TP or SL (observed externally)
    CANCELLED,      // Entry never filled
    FAILED;         // Validation error or no exit leg could be placed

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }

    public boolean canTransitionTo(TradeStatus next) {
        return allowedNext().contains(next);
    }

    private Set<TradeStatus> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(ENTRY_PLACED, CANCELLED, FAILED);
            case ENTRY_PLACED:
                return EnumSet.of(ENTRY_FILLED, CANCELLED, FAILED);
            case ENTRY_FILLED:
                return EnumSet.of(ACTIVE, FAILED);
            case ACTIVE:
                return EnumSet.of(COMPLETED);
            default:
                return EnumSet.noneOf(TradeStatus.class);
        }
    }
}
