package in.makerflow.domain.account;

/**
 * Credentials and connection settings for one venue account.
 *
 * @param baseUrl venue REST base URL override, or null for the configured default
 */
public record AccountConfig(
    String id,
    String apiKey,
    String apiSecret,
    boolean simulation,
    long recvWindowMs,
    String baseUrl
) {
    public static final long DEFAULT_RECV_WINDOW_MS = 5000;

    public AccountConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Account id cannot be null or empty");
        }
        if (!simulation && (apiKey == null || apiKey.isBlank() || apiSecret == null || apiSecret.isBlank())) {
            throw new IllegalArgumentException("Account " + id + " needs an API key and secret");
        }
        if (recvWindowMs <= 0) {
            recvWindowMs = DEFAULT_RECV_WINDOW_MS;
        }
    }

    public static AccountConfig live(String id, String apiKey, String apiSecret) {
        return new AccountConfig(id, apiKey, apiSecret, false, DEFAULT_RECV_WINDOW_MS, null);
    }

    public static AccountConfig paper(String id) {
        return new AccountConfig(id, null, null, true, DEFAULT_RECV_WINDOW_MS, null);
    }

    /**
     * API key with all but the last four characters masked, for logs.
     */
    public String maskedApiKey() {
        if (apiKey == null || apiKey.isEmpty()) {
            return "";
        }
        if (apiKey.length() <= 4) {
            return "****";
        }
        return "****" + apiKey.substring(apiKey.length() - 4);
    }

    @Override
    public String toString() {
        return "AccountConfig{id=" + id + ", apiKey=" + maskedApiKey() + ", simulation=" + simulation
            + ", recvWindowMs=" + recvWindowMs + (baseUrl != null ? ", baseUrl=" + baseUrl : "") + "}";
    }
}
