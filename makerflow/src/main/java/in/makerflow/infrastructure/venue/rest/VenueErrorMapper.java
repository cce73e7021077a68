package in.makerflow.infrastructure.venue.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.domain.order.OrderRequest;
import in.makerflow.infrastructure.venue.OrderCancellationException;
import in.makerflow.infrastructure.venue.OrderCancellationException.CancelFailure;
import in.makerflow.infrastructure.venue.OrderRejectedException;
import in.makerflow.infrastructure.venue.VenueException;

import java.io.IOException;
import java.util.Set;

/**
 * Maps venue error responses ({"code": -2011, "msg": "Unknown order sent."}) to typed exceptions.
 */
public class VenueErrorMapper {

    // Request-level errors that say nothing about the order itself
    static final int TIMESTAMP_OUTSIDE_RECV_WINDOW = -1021;
    static final int TOO_MANY_REQUESTS = -1003;
    static final int UNKNOWN_ERROR = -1000;
    static final int DISCONNECTED = -1001;

    static final int UNKNOWN_ORDER = -2011;
    static final int ORDER_DOES_NOT_EXIST = -2013;

    private static final Set<Integer> REQUEST_LEVEL_CODES =
        Set.of(TIMESTAMP_OUTSIDE_RECV_WINDOW, TOO_MANY_REQUESTS, UNKNOWN_ERROR, DISCONNECTED);

    private final ObjectMapper mapper;

    public VenueErrorMapper(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Error body parsed to (code, msg). Code is null when the body is not a venue error.
     */
    public record VenueError(Integer code, String message) {}

    public VenueError parse(String body) {
        if (body == null || body.isBlank()) {
            return new VenueError(null, "empty response");
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node != null && node.has("code")) {
                return new VenueError(node.get("code").asInt(), node.path("msg").asText(""));
            }
        } catch (IOException e) {
            // Not JSON (proxy error page); keep the raw body as message
            return new VenueError(null, abbreviate(body));
        }
        return new VenueError(null, abbreviate(body));
    }

    public VenueException forRequest(String accountId, String operation, int httpStatus, String body) {
        VenueError error = parse(body);
        return new VenueException(accountId,
            String.format("%s failed with HTTP %d: %s", operation, httpStatus, error.message()),
            error.code(), httpStatus, false, null);
    }

    /**
     * Order placement errors. A 4xx with an order-level code is a rejection;
     * request-level codes, rate limits and 5xx stay plain VenueExceptions.
     */
    public VenueException forPlacement(String accountId, OrderRequest request, int httpStatus, String body) {
        VenueError error = parse(body);
        boolean orderLevel = httpStatus >= 400 && httpStatus < 500
            && httpStatus != 429 && httpStatus != 418
            && error.code() != null && !REQUEST_LEVEL_CODES.contains(error.code());
        if (orderLevel) {
            return new OrderRejectedException(accountId, request, error.code(), httpStatus, error.message());
        }
        return new VenueException(accountId,
            String.format("Place order failed with HTTP %d: %s", httpStatus, error.message()),
            error.code(), httpStatus, false, null);
    }

    public OrderCancellationException forCancel(String accountId, String symbol, String orderId,
                                                int httpStatus, String body) {
        VenueError error = parse(body);
        CancelFailure failure = error.code() != null
            && (error.code() == UNKNOWN_ORDER || error.code() == ORDER_DOES_NOT_EXIST)
            ? CancelFailure.UNKNOWN_ORDER
            : CancelFailure.REQUEST_FAILED;
        return new OrderCancellationException(accountId, symbol, orderId, failure,
            "HTTP " + httpStatus + ": " + error.message(), error.code(), null);
    }

    private static String abbreviate(String body) {
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
