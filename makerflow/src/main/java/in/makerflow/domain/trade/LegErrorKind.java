package in.makerflow.domain.trade;

/**
 * Reason recorded on a leg that did not reach its goal.
 */
public enum LegErrorKind {
    VENUE_REJECTION,
    FILL_TIMEOUT,
    CHASE_LIMIT_EXCEEDED,
    RETRY_EXHAUSTED,
    CANCEL_FAILED,
    REQUEST_FAILED,
    ABORTED
}
