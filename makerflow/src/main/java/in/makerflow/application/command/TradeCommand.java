package in.makerflow.application.command;

import com.fasterxml.jackson.databind.JsonNode;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.order.Side;
import in.makerflow.domain.trade.TakeProfitLevel;
import in.makerflow.domain.trade.TakeProfitPlan;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Command message from the trade command topic.
 *
 * Trade message:
 * <pre>
 * {
 *   "type": "trade",
 *   "symbol": "BTCUSDT",
 *   "side": "buy",
 *   "tp_percent": 1.5,                  // or "tp_percents": [0.5, 1.0]
 *                                       // or "tp_levels": [[0.5, 0.6], [1.0, 0.4]]
 *   "sl_percent": 0.5,
 *   "ticks_distance": 1,
 *   "quantity": 0.001,
 *   "accounts": [{"id": "acc_1", "api_key": "...", "api_secret": "...", "quantity": 0.002, "simulation": false}]
 * }
 * </pre>
 *
 * Order messages ("type": "order") carry "order_type" (limit | bbo), "price" for limit orders and
 * optional "reduce_only". Heartbeats ("type": "heartbeat") carry "status" and "message".
 *
 * Exit messages need no side:
 * <pre>
 * {"type": "exit", "symbol": "BTCUSDT", "direction": "long"}
 * {"type": "partial_exit", "symbol": "BTCUSDT", "direction": "long", "exit_pct": 0.5, "move_sl_to_be": true}
 * </pre>
 * "direction" is optional on exit (all positions on the symbol) and required on partial_exit.
 */
public record TradeCommand(
    CommandType type,
    String symbol,
    Side side,
    TakeProfitPlan takeProfits,
    BigDecimal slPercent,
    Integer ticksDistance,
    BigDecimal quantity,
    List<CommandAccount> accounts,
    String orderType,
    BigDecimal price,
    boolean reduceOnly,
    String status,
    String message,
    PositionSide direction,
    BigDecimal exitFraction,
    boolean moveStopToEntry
) {
    public TradeCommand {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
        if (takeProfits == null) {
            takeProfits = TakeProfitPlan.none();
        }
    }

    /**
     * @throws IllegalArgumentException when a required field is missing or malformed
     */
    public static TradeCommand parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Command must be a JSON object");
        }
        CommandType type = CommandType.parse(text(root, "type"));
        if (type == CommandType.HEARTBEAT) {
            return new TradeCommand(type, null, null, null, null, null, null, List.of(), null, null, false,
                text(root, "status"), text(root, "message"), null, null, false);
        }

        String symbol = text(root, "symbol");
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Missing required field: symbol");
        }
        String sideText = text(root, "side");
        boolean exit = type == CommandType.EXIT || type == CommandType.PARTIAL_EXIT;
        if (sideText == null && !exit) {
            throw new IllegalArgumentException("Missing required field: side");
        }
        Side side = sideText == null ? null : Side.parse(sideText);

        List<CommandAccount> accounts = new ArrayList<>();
        JsonNode accountsNode = root.get("accounts");
        if (accountsNode != null && !accountsNode.isNull()) {
            if (!accountsNode.isArray()) {
                throw new IllegalArgumentException("accounts must be an array");
            }
            for (JsonNode acc : accountsNode) {
                accounts.add(new CommandAccount(
                    text(acc, "id"),
                    text(acc, "api_key"),
                    text(acc, "api_secret"),
                    decimal(acc, "quantity"),
                    acc.path("simulation").asBoolean(false)));
            }
        }

        Integer ticksDistance = root.hasNonNull("ticks_distance") ? root.get("ticks_distance").asInt() : null;
        BigDecimal quantity = decimal(root, "quantity");

        if (exit) {
            return exitCommand(type, symbol.toUpperCase(), side, root, ticksDistance, accounts);
        }

        if (type == CommandType.ORDER) {
            String orderType = text(root, "order_type");
            if (orderType == null) {
                throw new IllegalArgumentException("Missing required field: order_type");
            }
            return new TradeCommand(type, symbol.toUpperCase(), side, null, null, ticksDistance, quantity, accounts,
                orderType.toLowerCase(), decimal(root, "price"), root.path("reduce_only").asBoolean(false),
                null, null, null, null, false);
        }

        BigDecimal slPercent = decimal(root, "sl_percent");
        if (slPercent == null) {
            throw new IllegalArgumentException("Missing required field: sl_percent");
        }
        return new TradeCommand(type, symbol.toUpperCase(), side, takeProfitPlan(root), slPercent, ticksDistance,
            quantity, accounts, null, null, false, null, null, null, null, false);
    }

    private static TradeCommand exitCommand(CommandType type, String symbol, Side side, JsonNode root,
                                            Integer ticksDistance, List<CommandAccount> accounts) {
        PositionSide direction = direction(text(root, "direction"));
        BigDecimal fraction = null;
        if (type == CommandType.PARTIAL_EXIT) {
            if (direction == null) {
                throw new IllegalArgumentException("Missing required field: direction");
            }
            fraction = decimal(root, "exit_pct");
            if (fraction == null) {
                throw new IllegalArgumentException("Missing required field: exit_pct");
            }
            if (fraction.signum() <= 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
                throw new IllegalArgumentException("exit_pct must be in (0, 1], got " + fraction.toPlainString());
            }
        }
        return new TradeCommand(type, symbol, side, null, null, ticksDistance, null, accounts, null, null, true,
            null, null, direction, fraction, root.path("move_sl_to_be").asBoolean(false));
    }

    /**
     * LONG or SHORT, case-insensitive. Null stays null.
     */
    static PositionSide direction(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase();
        if (normalized.equals("LONG")) {
            return PositionSide.LONG;
        }
        if (normalized.equals("SHORT")) {
            return PositionSide.SHORT;
        }
        throw new IllegalArgumentException("direction must be long or short, got " + value);
    }

    /**
     * Resolve whichever take-profit shape the message uses.
     */
    static TakeProfitPlan takeProfitPlan(JsonNode root) {
        JsonNode levels = root.get("tp_levels");
        if (levels != null && !levels.isNull()) {
            List<TakeProfitLevel> parsed = new ArrayList<>();
            for (JsonNode level : levels) {
                if (level.isArray() && level.size() == 2) {
                    parsed.add(new TakeProfitLevel(toDecimal(level.get(0)), toDecimal(level.get(1))));
                } else if (level.isObject()) {
                    parsed.add(new TakeProfitLevel(decimal(level, "percent"), decimal(level, "fraction")));
                } else {
                    throw new IllegalArgumentException("tp_levels entries must be [percent, fraction] pairs");
                }
            }
            return TakeProfitPlan.weighted(parsed);
        }
        JsonNode percents = root.get("tp_percents");
        if (percents == null || percents.isNull()) {
            percents = root.get("tp_percent");
        }
        if (percents == null || percents.isNull()) {
            return TakeProfitPlan.none();
        }
        if (percents.isArray()) {
            List<BigDecimal> values = new ArrayList<>();
            for (JsonNode p : percents) {
                values.add(toDecimal(p));
            }
            return values.size() == 1 ? TakeProfitPlan.single(values.get(0)) : TakeProfitPlan.equalSplit(values);
        }
        return TakeProfitPlan.single(toDecimal(percents));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : toDecimal(value);
    }

    private static BigDecimal toDecimal(JsonNode value) {
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Expected a number, got null");
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        try {
            return new BigDecimal(value.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + value.asText(), e);
        }
    }
}
