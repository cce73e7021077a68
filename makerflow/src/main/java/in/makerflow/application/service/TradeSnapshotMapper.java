package in.makerflow.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.domain.trade.LegError;
import in.makerflow.domain.trade.OrderLeg;
import in.makerflow.domain.trade.TakeProfitLevel;
import in.makerflow.domain.trade.Trade;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured snapshot of a trade for logs and callers that persist it.
 *
 * Decimals are plain strings, timestamps ISO-8601 UTC, absent values null.
 */
public final class TradeSnapshotMapper {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static Map<String, Object> toMap(Trade trade) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("trade_id", trade.getTradeId());
        snapshot.put("symbol", trade.getSymbol());
        snapshot.put("side", trade.getSide().name());
        snapshot.put("status", trade.getStatus().name());
        snapshot.put("entry", leg(trade.getEntry()));

        List<Map<String, Object>> tps = new ArrayList<>();
        for (OrderLeg tp : trade.getTakeProfits()) {
            tps.add(leg(tp));
        }
        snapshot.put("take_profits", tps);
        snapshot.put("stop_loss", trade.getStopLoss() == null ? null : leg(trade.getStopLoss()));

        List<Map<String, Object>> levels = new ArrayList<>();
        for (TakeProfitLevel level : trade.getTpLevels()) {
            Map<String, Object> l = new LinkedHashMap<>();
            l.put("percent", decimal(level.percent()));
            l.put("fraction", decimal(level.fraction()));
            levels.add(l);
        }
        snapshot.put("tp_levels", levels);
        snapshot.put("sl_percent", decimal(trade.getSlPercent()));
        snapshot.put("created_at", timestamp(trade.getCreatedAt()));
        snapshot.put("filled_at", timestamp(trade.getFilledAt()));
        snapshot.put("closed_at", timestamp(trade.getClosedAt()));

        Map<String, Object> metadata = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : trade.getMetadata().entrySet()) {
            metadata.put(e.getKey(), value(e.getValue()));
        }
        snapshot.put("metadata", metadata);
        return snapshot;
    }

    public static String toJson(Trade trade) {
        try {
            return MAPPER.writeValueAsString(toMap(trade));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize trade " + trade.getTradeId(), e);
        }
    }

    private static Map<String, Object> leg(OrderLeg leg) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("role", leg.getRole().name());
        m.put("index", leg.getIndex());
        m.put("order_id", leg.getOrderId());
        m.put("price", decimal(leg.getPrice()));
        m.put("quantity", decimal(leg.getQuantity()));
        m.put("status", leg.getStatus().name());
        m.put("fill_price", decimal(leg.getFillPrice()));
        m.put("filled_quantity", decimal(leg.getFilledQuantity()));
        m.put("attempts", leg.getAttempts());
        m.put("placed_at", timestamp(leg.getPlacedAt()));
        m.put("filled_at", timestamp(leg.getFilledAt()));
        LegError error = leg.getError();
        if (error == null) {
            m.put("error", null);
        } else {
            Map<String, Object> err = new LinkedHashMap<>();
            err.put("kind", error.kind().name());
            err.put("message", error.message());
            err.put("venue_code", error.venueCode());
            m.put("error", err);
        }
        return m;
    }

    private static Object value(Object v) {
        if (v instanceof BigDecimal) {
            return decimal((BigDecimal) v);
        }
        if (v instanceof Instant) {
            return timestamp((Instant) v);
        }
        if (v instanceof Collection) {
            List<Object> list = new ArrayList<>();
            for (Object item : (Collection<?>) v) {
                list.add(value(item));
            }
            return list;
        }
        if (v instanceof Enum) {
            return ((Enum<?>) v).name();
        }
        return v;
    }

    static String decimal(BigDecimal v) {
        return v == null ? null : v.toPlainString();
    }

    static String timestamp(Instant t) {
        return t == null ? null : DateTimeFormatter.ISO_INSTANT.format(t);
    }

    private TradeSnapshotMapper() {}
}
