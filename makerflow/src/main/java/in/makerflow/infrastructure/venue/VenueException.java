package in.makerflow.infrastructure.venue;

/**
 * Base exception for trading venue failures.
 *
 * httpStatus is 0 when the request never got a response (transport error or timeout).
 */
public class VenueException extends RuntimeException {

    private final String accountId;
    private final Integer venueCode;
    private final int httpStatus;
    private final boolean timeout;

    public VenueException(String accountId, String message, Integer venueCode, int httpStatus,
                          boolean timeout, Throwable cause) {
        super(String.format("[VENUE:%s] %s", accountId, message), cause);
        this.accountId = accountId;
        this.venueCode = venueCode;
        this.httpStatus = httpStatus;
        this.timeout = timeout;
    }

    public VenueException(String accountId, String message) {
        this(accountId, message, null, 0, false, null);
    }

    public static VenueException timeout(String accountId, String operation, Throwable cause) {
        return new VenueException(accountId, operation + " timed out", null, 0, true, cause);
    }

    public static VenueException transport(String accountId, String operation, Throwable cause) {
        return new VenueException(accountId, operation + " failed: " + cause.getMessage(), null, 0, false, cause);
    }

    public String getAccountId() {
        return accountId;
    }

    public Integer getVenueCode() {
        return venueCode;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isTimeout() {
        return timeout;
    }

    /**
     * Transport errors, timeouts and 5xx responses may succeed on a repeat of an idempotent request.
     */
    public boolean isRetryable() {
        return timeout || httpStatus == 0 || httpStatus >= 500;
    }
}
