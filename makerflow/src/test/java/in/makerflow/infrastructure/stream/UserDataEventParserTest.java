package in.makerflow.infrastructure.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.domain.order.OrderStatus;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.order.Side;
import in.makerflow.infrastructure.stream.UserDataEvent.AccountUpdate;
import in.makerflow.infrastructure.stream.UserDataEvent.ListenKeyExpired;
import in.makerflow.infrastructure.stream.UserDataEvent.OrderUpdate;
import in.makerflow.infrastructure.stream.UserDataEvent.PositionUpdate;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for UserDataEventParser.
 */
class UserDataEventParserTest {

    private final UserDataEventParser parser = new UserDataEventParser(new ObjectMapper());

    @Test
    void testParsesAccountUpdatePositions() {
        UserDataEvent event = parser.parse("{\"e\":\"ACCOUNT_UPDATE\",\"E\":1564745798939,\"T\":1564745798938,"
            + "\"a\":{\"m\":\"ORDER\",\"B\":[{\"a\":\"USDT\",\"wb\":\"122624.12\",\"cw\":\"100.12\"}],"
            + "\"P\":[{\"s\":\"ETHUSDT\",\"pa\":\"0\",\"ep\":\"0.00000\",\"ps\":\"LONG\"},"
            + "{\"s\":\"BTCUSDT\",\"pa\":\"-0.002\",\"ep\":\"65000.1\",\"ps\":\"BOTH\"}]}}").orElseThrow();

        AccountUpdate update = assertInstanceOf(AccountUpdate.class, event);
        assertEquals("ORDER", update.reason());
        assertEquals(1564745798939L, update.eventTime().toEpochMilli());
        assertEquals(2, update.positions().size());

        PositionUpdate eth = update.positions().get(0);
        assertEquals(PositionSide.LONG, eth.positionSide());
        assertFalse(eth.isOpen(), "Zero amount means flat");

        PositionUpdate btc = update.positions().get(1);
        assertTrue(btc.isOpen());
        assertFalse(btc.isLong());
        assertEquals(new BigDecimal("65000.1"), btc.entryPrice());
        assertEquals("BTCUSDT:BOTH", btc.key());
    }

    @Test
    void testParsesOrderTradeUpdate() {
        UserDataEvent event = parser.parse("{\"e\":\"ORDER_TRADE_UPDATE\",\"E\":1568879465651,\"T\":1568879465650,"
            + "\"o\":{\"s\":\"ETHUSDT\",\"c\":\"TEST\",\"S\":\"SELL\",\"o\":\"TAKE_PROFIT_MARKET\",\"f\":\"GTC\","
            + "\"q\":\"0.010\",\"p\":\"0\",\"ap\":\"3100.5\",\"sp\":\"3100\",\"x\":\"TRADE\",\"X\":\"FILLED\","
            + "\"i\":8886774,\"l\":\"0.010\",\"z\":\"0.010\",\"rp\":\"1.005\",\"R\":true,\"ps\":\"BOTH\"}}")
            .orElseThrow();

        OrderUpdate update = assertInstanceOf(OrderUpdate.class, event);
        assertEquals("8886774", update.orderId());
        assertEquals(Side.SELL, update.side());
        assertEquals("TAKE_PROFIT_MARKET", update.orderType(), "Order types outside the order model are kept");
        assertEquals(OrderStatus.FILLED, update.status());
        assertTrue(update.isFilled());
        assertEquals(new BigDecimal("0.010"), update.filledQuantity());
        assertEquals(new BigDecimal("3100.5"), update.averagePrice());
        assertEquals(new BigDecimal("1.005"), update.realizedProfit());
        assertTrue(update.reduceOnly());
    }

    @Test
    void testParsesListenKeyExpired() {
        UserDataEvent event = parser.parse("{\"e\":\"listenKeyExpired\",\"E\":1576653824250}").orElseThrow();

        assertInstanceOf(ListenKeyExpired.class, event);
        assertEquals(1576653824250L, event.eventTime().toEpochMilli());
    }

    @Test
    void testMissingPositionSideMeansOneWay() {
        AccountUpdate update = (AccountUpdate) parser.parse("{\"e\":\"ACCOUNT_UPDATE\",\"E\":1,"
            + "\"a\":{\"m\":\"FUNDING_FEE\",\"P\":[{\"s\":\"ETHUSDT\",\"pa\":\"0.5\",\"ep\":\"3000\"}]}}").orElseThrow();

        assertEquals(PositionSide.BOTH, update.positions().get(0).positionSide());
    }

    @Test
    void testIgnoresUnhandledAndMalformedMessages() {
        assertTrue(parser.parse("{\"e\":\"MARGIN_CALL\",\"E\":1}").isEmpty(), "Unhandled event type");
        assertTrue(parser.parse("{\"e\":\"ORDER_TRADE_UPDATE\",\"E\":1,\"o\":{\"s\":\"ETHUSDT\",\"i\":1,"
            + "\"S\":\"BUY\",\"X\":\"NEW_INSURANCE\"}}").isEmpty(), "Unknown order status");
        assertTrue(parser.parse("{\"e\":\"ACCOUNT_UPDATE\",\"E\":1,\"a\":{\"P\":[{\"s\":\"ETHUSDT\","
            + "\"pa\":\"abc\"}]}}").isEmpty(), "Unparseable amount");
        assertTrue(parser.parse("not json").isEmpty());
        assertTrue(parser.parse("[1,2]").isEmpty());
    }
}
