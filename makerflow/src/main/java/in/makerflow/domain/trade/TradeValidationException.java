package in.makerflow.domain.trade;

import java.util.List;

/**
 * Thrown when a trade request is misconfigured. Raised before any order reaches the venue.
 */
public class TradeValidationException extends RuntimeException {

    private final List<String> violations;

    public TradeValidationException(List<String> violations) {
        super("Trade validation failed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public TradeValidationException(String violation) {
        this(List.of(violation));
    }

    public List<String> getViolations() {
        return violations;
    }
}
