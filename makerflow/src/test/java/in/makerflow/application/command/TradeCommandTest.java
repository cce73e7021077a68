package in.makerflow.application.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.order.Side;
import in.makerflow.domain.trade.TakeProfitLevel;
import in.makerflow.domain.trade.TakeProfitPlan;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TradeCommand parsing.
 *
 * Tests:
 * - Take-profit shapes (single, list, weighted pairs)
 * - Account list and per-account quantity
 * - Order and heartbeat messages
 * - Exit and partial exit messages
 * - Missing fields rejected
 */
class TradeCommandTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static TradeCommand parse(String json) throws Exception {
        JsonNode node = MAPPER.readTree(json);
        return TradeCommand.parse(node);
    }

    @Test
    void testFullTradeMessage() throws Exception {
        TradeCommand cmd = parse("{\"symbol\":\"ethusdt\",\"side\":\"buy\",\"tp_percent\":1.5,"
            + "\"sl_percent\":0.5,\"ticks_distance\":1,\"quantity\":0.01,"
            + "\"accounts\":[{\"id\":\"acc_1\",\"api_key\":\"k1\",\"api_secret\":\"s1\",\"quantity\":0.002},"
            + "{\"id\":\"acc_2\",\"simulation\":true}]}");

        assertEquals(CommandType.TRADE, cmd.type(), "Type defaults to trade");
        assertEquals("ETHUSDT", cmd.symbol());
        assertEquals(Side.BUY, cmd.side());
        assertEquals(0, new BigDecimal("0.5").compareTo(cmd.slPercent()));
        assertEquals(1, cmd.ticksDistance());
        assertEquals(0, new BigDecimal("0.01").compareTo(cmd.quantity()));
        assertTrue(cmd.takeProfits() instanceof TakeProfitPlan.Single);

        assertEquals(2, cmd.accounts().size());
        CommandAccount first = cmd.accounts().get(0);
        assertEquals("acc_1", first.id());
        assertEquals("k1", first.apiKey());
        assertEquals(0, new BigDecimal("0.002").compareTo(first.quantity()));
        assertFalse(first.simulation());
        assertNull(cmd.accounts().get(1).quantity());
        assertTrue(cmd.accounts().get(1).simulation());
    }

    @Test
    void testTakeProfitShapes() throws Exception {
        TakeProfitPlan list = parse("{\"symbol\":\"BTCUSDT\",\"side\":\"sell\",\"sl_percent\":1,"
            + "\"tp_percents\":[0.5,1.0,\"1.5\"]}").takeProfits();
        assertTrue(list instanceof TakeProfitPlan.EqualSplit);
        assertEquals(3, list.levels().size());

        TakeProfitPlan singleInList = parse("{\"symbol\":\"BTCUSDT\",\"side\":\"sell\",\"sl_percent\":1,"
            + "\"tp_percents\":[2]}").takeProfits();
        assertTrue(singleInList instanceof TakeProfitPlan.Single);

        List<TakeProfitLevel> weighted = parse("{\"symbol\":\"BTCUSDT\",\"side\":\"sell\",\"sl_percent\":1,"
            + "\"tp_levels\":[[0.5,0.6],{\"percent\":1.0,\"fraction\":0.4}]}").takeProfits().levels();
        assertEquals(2, weighted.size());
        assertEquals(0, new BigDecimal("0.6").compareTo(weighted.get(0).fraction()));
        assertEquals(0, new BigDecimal("1.0").compareTo(weighted.get(1).percent()));

        TakeProfitPlan none = parse("{\"symbol\":\"BTCUSDT\",\"side\":\"short\",\"sl_percent\":1}").takeProfits();
        assertTrue(none.levels().isEmpty());
    }

    @Test
    void testOrderMessage() throws Exception {
        TradeCommand cmd = parse("{\"type\":\"order\",\"symbol\":\"BTCUSDT\",\"side\":\"sell\","
            + "\"order_type\":\"LIMIT\",\"price\":\"65000.5\",\"quantity\":0.001,\"reduce_only\":true}");

        assertEquals(CommandType.ORDER, cmd.type());
        assertEquals("limit", cmd.orderType());
        assertEquals(new BigDecimal("65000.5"), cmd.price());
        assertTrue(cmd.reduceOnly());
        assertNull(cmd.slPercent(), "Order messages carry no stop loss");
    }

    @Test
    void testExitMessage() throws Exception {
        TradeCommand all = parse("{\"type\":\"exit\",\"symbol\":\"ethusdt\"}");
        TradeCommand longOnly = parse("{\"type\":\"EXIT\",\"symbol\":\"ETHUSDT\",\"direction\":\"long\"}");

        assertEquals(CommandType.EXIT, all.type());
        assertEquals("ETHUSDT", all.symbol());
        assertNull(all.side(), "Exits need no side");
        assertNull(all.direction(), "No direction closes every position on the symbol");
        assertEquals(PositionSide.LONG, longOnly.direction());
    }

    @Test
    void testPartialExitMessage() throws Exception {
        TradeCommand cmd = parse("{\"type\":\"partial_exit\",\"symbol\":\"BTCUSDT\",\"direction\":\"SHORT\","
            + "\"exit_pct\":0.5,\"move_sl_to_be\":true,\"accounts\":[{\"id\":\"acc_1\"}]}");

        assertEquals(CommandType.PARTIAL_EXIT, cmd.type());
        assertEquals(PositionSide.SHORT, cmd.direction());
        assertEquals(0, new BigDecimal("0.5").compareTo(cmd.exitFraction()));
        assertTrue(cmd.moveStopToEntry());
        assertEquals(1, cmd.accounts().size());
    }

    @Test
    void testPartialExitValidation() {
        assertThrows(IllegalArgumentException.class, () -> parse(
            "{\"type\":\"partial_exit\",\"symbol\":\"BTCUSDT\",\"exit_pct\":0.5}"), "direction required");
        assertThrows(IllegalArgumentException.class, () -> parse(
            "{\"type\":\"partial_exit\",\"symbol\":\"BTCUSDT\",\"direction\":\"long\"}"), "exit_pct required");
        assertThrows(IllegalArgumentException.class, () -> parse(
            "{\"type\":\"partial_exit\",\"symbol\":\"BTCUSDT\",\"direction\":\"long\",\"exit_pct\":1.5}"));
        assertThrows(IllegalArgumentException.class, () -> parse(
            "{\"type\":\"partial_exit\",\"symbol\":\"BTCUSDT\",\"direction\":\"long\",\"exit_pct\":0}"));
        assertThrows(IllegalArgumentException.class, () -> parse(
            "{\"type\":\"exit\",\"symbol\":\"BTCUSDT\",\"direction\":\"up\"}"));
    }

    @Test
    void testHeartbeatMessage() throws Exception {
        TradeCommand cmd = parse("{\"type\":\"heartbeat\",\"status\":\"ok\",\"message\":\"alive\"}");

        assertEquals(CommandType.HEARTBEAT, cmd.type());
        assertEquals("ok", cmd.status());
        assertEquals("alive", cmd.message());
        assertNull(cmd.symbol());
    }

    @Test
    void testMissingFieldsRejected() {
        assertThrows(IllegalArgumentException.class, () -> parse("[]"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"side\":\"buy\",\"sl_percent\":1}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"symbol\":\"BTCUSDT\",\"sl_percent\":1}"));
        assertThrows(IllegalArgumentException.class, () -> parse("{\"symbol\":\"BTCUSDT\",\"side\":\"buy\"}"));
        assertThrows(IllegalArgumentException.class,
            () -> parse("{\"symbol\":\"BTCUSDT\",\"side\":\"hold\",\"sl_percent\":1}"));
        assertThrows(IllegalArgumentException.class,
            () -> parse("{\"type\":\"order\",\"symbol\":\"BTCUSDT\",\"side\":\"buy\"}"));
        assertThrows(IllegalArgumentException.class,
            () -> parse("{\"type\":\"cancel\",\"symbol\":\"BTCUSDT\",\"side\":\"buy\"}"));
        assertThrows(IllegalArgumentException.class,
            () -> parse("{\"symbol\":\"BTCUSDT\",\"side\":\"buy\",\"sl_percent\":\"abc\"}"));
        assertThrows(IllegalArgumentException.class,
            () -> parse("{\"symbol\":\"BTCUSDT\",\"side\":\"buy\",\"sl_percent\":1,\"accounts\":[{\"api_key\":\"k\"}]}"));
    }

    @Test
    void testAccountToStringMasksKey() {
        CommandAccount account = new CommandAccount("acc_1", "abcdefgh1234", "secret", null, false);

        String text = account.toString();
        assertTrue(text.contains("****1234"), text);
        assertFalse(text.contains("abcdefgh"), text);
        assertFalse(text.contains("secret"), text);
    }
}
