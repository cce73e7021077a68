package in.makerflow.infrastructure.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.domain.order.OrderStatus;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.order.Side;
import in.makerflow.infrastructure.stream.UserDataEvent.AccountUpdate;
import in.makerflow.infrastructure.stream.UserDataEvent.ListenKeyExpired;
import in.makerflow.infrastructure.stream.UserDataEvent.OrderUpdate;
import in.makerflow.infrastructure.stream.UserDataEvent.PositionUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses user data stream payloads.
 *
 * Handled events:
 * <pre>
 * {"e":"ACCOUNT_UPDATE","E":1564745798939,"a":{"m":"ORDER","P":[{"s":"ETHUSDT","pa":"0.010","ep":"3000.0","ps":"BOTH"}]}}
 * {"e":"ORDER_TRADE_UPDATE","E":1568879465651,"o":{"s":"ETHUSDT","i":8886774,"S":"SELL","o":"LIMIT","X":"FILLED",
 *  "p":"3100","q":"0.010","z":"0.010","ap":"3100","rp":"1.0","ps":"BOTH","R":true}}
 * {"e":"listenKeyExpired","E":1576653824250}
 * </pre>
 * Anything else, including malformed JSON, yields empty.
 */
public class UserDataEventParser {
    private static final Logger log = LoggerFactory.getLogger(UserDataEventParser.class);

    private final ObjectMapper mapper;

    public UserDataEventParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Optional<UserDataEvent> parse(String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("[POOL] Skipping malformed user stream message: {}", abbreviate(text));
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }
        JsonNode event = root.has("data") ? root.get("data") : root;
        String type = event.path("e").asText("");
        Instant eventTime = Instant.ofEpochMilli(event.path("E").asLong(0L));

        try {
            switch (type) {
                case "ACCOUNT_UPDATE":
                    return Optional.of(accountUpdate(event.path("a"), eventTime));
                case "ORDER_TRADE_UPDATE":
                    return orderUpdate(event.path("o"), eventTime);
                case "listenKeyExpired":
                    return Optional.of(new ListenKeyExpired(eventTime));
                default:
                    log.debug("[POOL] Ignoring user stream event '{}'", type);
                    return Optional.empty();
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException and unknown enum constants included
            log.warn("[POOL] Skipping invalid {} ({}): {}", type, e.getMessage(), abbreviate(text));
            return Optional.empty();
        }
    }

    private AccountUpdate accountUpdate(JsonNode body, Instant eventTime) {
        List<PositionUpdate> positions = new ArrayList<>();
        for (JsonNode p : body.path("P")) {
            positions.add(new PositionUpdate(
                p.path("s").asText(),
                positionSide(p),
                decimal(p, "pa"),
                decimal(p, "ep")));
        }
        return new AccountUpdate(body.path("m").asText(null), positions, eventTime);
    }

    private Optional<UserDataEvent> orderUpdate(JsonNode o, Instant eventTime) {
        if (!o.hasNonNull("s") || !o.hasNonNull("i")) {
            return Optional.empty();
        }
        OrderStatus status;
        try {
            status = OrderStatus.valueOf(o.path("X").asText());
        } catch (IllegalArgumentException e) {
            log.debug("[POOL] Ignoring order update with status '{}'", o.path("X").asText());
            return Optional.empty();
        }
        return Optional.of(new OrderUpdate(
            o.get("s").asText(),
            o.get("i").asText(),
            Side.valueOf(o.path("S").asText()),
            o.path("o").asText(null),
            status,
            decimal(o, "p"),
            decimal(o, "q"),
            decimal(o, "z"),
            decimal(o, "ap"),
            decimal(o, "rp"),
            positionSide(o),
            o.path("R").asBoolean(false),
            eventTime));
    }

    private static PositionSide positionSide(JsonNode node) {
        return node.hasNonNull("ps") ? PositionSide.valueOf(node.get("ps").asText()) : PositionSide.BOTH;
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        return node.hasNonNull(field) ? new BigDecimal(node.get(field).asText()) : null;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
