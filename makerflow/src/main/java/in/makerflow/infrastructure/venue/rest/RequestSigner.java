package in.makerflow.infrastructure.venue.rest;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;
import java.util.function.LongSupplier;

/**
 * HMAC-SHA256 request signing for the venue's USER_DATA and TRADE endpoints.
 *
 * The signed payload is the URL-encoded query string including timestamp and
 * recvWindow; the hex digest is appended as the signature parameter.
 */
public class RequestSigner {

    private static final String ALGORITHM = "HmacSHA256";

    private final String apiKey;
    private final SecretKeySpec secretKey;
    private final long recvWindowMs;
    private final LongSupplier clock;

    public RequestSigner(String apiKey, String apiSecret, long recvWindowMs) {
        this(apiKey, apiSecret, recvWindowMs, System::currentTimeMillis);
    }

    RequestSigner(String apiKey, String apiSecret, long recvWindowMs, LongSupplier clock) {
        if (apiKey == null || apiKey.isBlank() || apiSecret == null || apiSecret.isBlank()) {
            throw new IllegalArgumentException("API key and secret are required for signing");
        }
        this.apiKey = apiKey;
        this.secretKey = new SecretKeySpec(apiSecret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        this.recvWindowMs = recvWindowMs;
        this.clock = clock;
    }

    /**
     * Build the signed query string for the given parameters.
     */
    public String sign(Map<String, String> params) {
        Map<String, String> all = new LinkedHashMap<>(params);
        all.put("timestamp", Long.toString(clock.getAsLong()));
        all.put("recvWindow", Long.toString(recvWindowMs));
        String query = encode(all);
        return query + "&signature=" + hmacHex(query);
    }

    public String getApiKey() {
        return apiKey;
    }

    String hmacHex(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(secretKey);
            byte[] digest = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(digest.length * 2);
            for (byte b : digest) {
                hex.append(Character.forDigit((b >> 4) & 0xF, 16));
                hex.append(Character.forDigit(b & 0xF, 16));
            }
            return hex.toString();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    public static String encode(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> e : params.entrySet()) {
            joiner.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }
}
