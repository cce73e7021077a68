package in.makerflow.infrastructure.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.domain.market.Quote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Parses bookTicker stream events into quotes.
 *
 * Event shape:
 * <pre>
 * {"e":"bookTicker","u":400900217,"E":1568014460893,"T":1568014460891,
 *  "s":"BNBUSDT","b":"25.35190000","B":"31.21000000","a":"25.36520000","A":"40.66000000"}
 * </pre>
 * Combined-stream payloads wrapped as {"stream": ..., "data": {...}} are unwrapped.
 * Each quote is stamped with the local receive time.
 */
public class BookTickerParser {
    private static final Logger log = LoggerFactory.getLogger(BookTickerParser.class);

    private final ObjectMapper mapper;
    private final Clock clock;

    public BookTickerParser(ObjectMapper mapper) {
        this(mapper, Clock.systemUTC());
    }

    public BookTickerParser(ObjectMapper mapper, Clock clock) {
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * @return the quote, or empty for non-quote and malformed messages
     */
    public Optional<Quote> parse(String text) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("[QUOTES] Skipping malformed message: {}", abbreviate(text));
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        JsonNode event = root.has("data") ? root.get("data") : root;
        if (!event.hasNonNull("s") || !event.hasNonNull("b") || !event.hasNonNull("a")) {
            // Subscription acks ({"result":null,"id":1}) land here
            log.debug("[QUOTES] Ignoring non-quote message: {}", abbreviate(text));
            return Optional.empty();
        }

        try {
            BigDecimal bid = new BigDecimal(event.get("b").asText());
            BigDecimal ask = new BigDecimal(event.get("a").asText());
            long ts = event.hasNonNull("T") ? event.get("T").asLong()
                : event.hasNonNull("E") ? event.get("E").asLong() : 0L;
            Instant receivedAt = clock.instant();
            Instant observedAt = ts > 0 ? Instant.ofEpochMilli(ts) : receivedAt;
            return Optional.of(new Quote(event.get("s").asText().toUpperCase(), bid, ask, null,
                observedAt, receivedAt));
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            log.warn("[QUOTES] Skipping invalid quote ({}): {}", e.getMessage(), abbreviate(text));
            return Optional.empty();
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "null";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
