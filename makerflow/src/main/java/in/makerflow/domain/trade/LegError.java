package in.makerflow.domain.trade;

/**
 * Error recorded on an order leg.
 *
 * @param venueCode venue error code when the venue supplied one, otherwise null
 */
public record LegError(LegErrorKind kind, String message, Integer venueCode) {

    public LegError {
        if (kind == null) {
            throw new IllegalArgumentException("Error kind cannot be null");
        }
    }

    public static LegError of(LegErrorKind kind, String message) {
        return new LegError(kind, message, null);
    }

    @Override
    public String toString() {
        return venueCode == null ? kind + ": " + message : kind + " (" + venueCode + "): " + message;
    }
}
