package in.makerflow.domain.order;

/**
 * Position side tag required on orders when the account runs in hedge mode.
 */
public enum PositionSide {
    BOTH,   // One-way mode
    LONG,
    SHORT;

    public static PositionSide forEntry(Side side, boolean hedgeMode) {
        if (!hedgeMode) {
            return BOTH;
        }
        return side == Side.BUY ? LONG : SHORT;
    }
}
