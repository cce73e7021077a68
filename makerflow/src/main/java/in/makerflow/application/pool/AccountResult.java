package in.makerflow.application.pool;

/**
 * Outcome of a pooled operation for one account.
 *
 * @param result value on success, null on failure
 * @param error  captured failure, null on success
 */
public record AccountResult<T>(String accountId, boolean success, T result, Throwable error) {

    public AccountResult {
        if (accountId == null) {
            throw new IllegalArgumentException("Account id cannot be null");
        }
        if (!success && error == null) {
            throw new IllegalArgumentException("Failed result needs an error");
        }
    }

    public static <T> AccountResult<T> success(String accountId, T result) {
        return new AccountResult<>(accountId, true, result, null);
    }

    public static <T> AccountResult<T> failure(String accountId, Throwable error) {
        return new AccountResult<>(accountId, false, null, error);
    }

    public String errorMessage() {
        if (error == null) {
            return null;
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
