package in.makerflow.infrastructure.venue.rest;

import com.fasterxml.jackson.databind.JsonNode;
import in.makerflow.domain.account.AccountInfo;
import in.makerflow.domain.account.Balance;
import in.makerflow.domain.account.Position;
import in.makerflow.domain.market.OrderBookSnapshot;
import in.makerflow.domain.market.OrderBookSnapshot.PriceLevel;
import in.makerflow.domain.market.SymbolFilters;
import in.makerflow.domain.order.OrderResponse;
import in.makerflow.domain.order.OrderStatus;
import in.makerflow.domain.order.OrderType;
import in.makerflow.domain.order.Side;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts venue JSON payloads to domain records.
 * Decimal fields arrive as strings and are parsed as BigDecimal without a double detour.
 */
final class VenueResponseParser {

    static OrderResponse order(JsonNode node) {
        long updateTime = node.path("updateTime").asLong(node.path("time").asLong(0));
        return new OrderResponse(
            node.path("orderId").asText(),
            textOrNull(node, "clientOrderId"),
            node.path("symbol").asText(),
            enumOrNull(Side.class, node.path("side").asText(null)),
            enumOrNull(OrderType.class, node.path("type").asText(null)),
            OrderStatus.fromVenue(node.path("status").asText(null)),
            decimal(node, "price"),
            decimal(node, "origQty"),
            decimal(node, "executedQty"),
            decimal(node, "avgPrice"),
            updateTime > 0 ? Instant.ofEpochMilli(updateTime) : Instant.now()
        );
    }

    static List<OrderResponse> orders(JsonNode array) {
        List<OrderResponse> result = new ArrayList<>();
        for (JsonNode node : array) {
            result.add(order(node));
        }
        return result;
    }

    static AccountInfo accountInfo(JsonNode node) {
        return new AccountInfo(
            decimal(node, "totalWalletBalance"),
            decimal(node, "totalUnrealizedProfit"),
            decimal(node, "availableBalance"),
            node.path("canTrade").asBoolean(true)
        );
    }

    /**
     * Position risk entries; flat entries are dropped.
     */
    static List<Position> positions(JsonNode array) {
        List<Position> result = new ArrayList<>();
        for (JsonNode node : array) {
            Position p = new Position(
                node.path("symbol").asText(),
                node.path("positionSide").asText("BOTH"),
                decimal(node, "positionAmt"),
                decimal(node, "entryPrice"),
                decimal(node, "unRealizedProfit"),
                node.path("leverage").asInt(0)
            );
            if (p.isOpen()) {
                result.add(p);
            }
        }
        return result;
    }

    static List<Balance> balances(JsonNode array) {
        List<Balance> result = new ArrayList<>();
        for (JsonNode node : array) {
            result.add(new Balance(
                node.path("asset").asText(),
                decimal(node, "balance"),
                decimal(node, "availableBalance")
            ));
        }
        return result;
    }

    static OrderBookSnapshot orderBook(String symbol, JsonNode node) {
        long ts = node.path("T").asLong(node.path("E").asLong(0));
        return new OrderBookSnapshot(symbol, levels(node.path("bids")), levels(node.path("asks")),
            ts > 0 ? Instant.ofEpochMilli(ts) : Instant.now());
    }

    /**
     * PRICE_FILTER and LOT_SIZE of every symbol in an exchangeInfo payload.
     */
    static List<SymbolFilters> symbolFilters(JsonNode exchangeInfo) {
        List<SymbolFilters> result = new ArrayList<>();
        for (JsonNode symbol : exchangeInfo.path("symbols")) {
            BigDecimal tick = null;
            BigDecimal step = null;
            BigDecimal minQty = null;
            for (JsonNode filter : symbol.path("filters")) {
                String type = filter.path("filterType").asText();
                if ("PRICE_FILTER".equals(type)) {
                    tick = decimal(filter, "tickSize");
                } else if ("LOT_SIZE".equals(type)) {
                    step = decimal(filter, "stepSize");
                    minQty = decimal(filter, "minQty");
                }
            }
            if (tick != null && tick.signum() > 0 && step != null && step.signum() > 0) {
                result.add(new SymbolFilters(symbol.path("symbol").asText(),
                    tick.stripTrailingZeros(), step.stripTrailingZeros(), minQty));
            }
        }
        return result;
    }

    private static List<PriceLevel> levels(JsonNode array) {
        List<PriceLevel> result = new ArrayList<>();
        for (JsonNode level : array) {
            result.add(new PriceLevel(new BigDecimal(level.get(0).asText()), new BigDecimal(level.get(1).asText())));
        }
        return result;
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            return null;
        }
        return new BigDecimal(value.asText());
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static <E extends Enum<E>> E enumOrNull(Class<E> type, String value) {
        if (value == null) {
            return null;
        }
        try {
            return Enum.valueOf(type, value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private VenueResponseParser() {}
}
