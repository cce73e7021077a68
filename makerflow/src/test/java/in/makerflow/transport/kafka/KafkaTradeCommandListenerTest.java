package in.makerflow.transport.kafka;

import in.makerflow.application.command.TradeCommandHandler;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for KafkaTradeCommandListener using a MockConsumer.
 *
 * Tests:
 * - Records are handed to the handler in offset order
 * - A failing message is counted and skipped
 * - stop() wakes the consumer and closes it
 */
@ExtendWith(MockitoExtension.class)
class KafkaTradeCommandListenerTest {

    private static final String TOPIC = "trade.commands";
    private static final TopicPartition PARTITION = new TopicPartition(TOPIC, 0);

    @Mock
    private TradeCommandHandler handler;

    private MockConsumer<String, String> consumer;
    private KafkaTradeCommandListener listener;

    @BeforeEach
    void setUp() {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        consumer.updateBeginningOffsets(Map.of(PARTITION, 0L));
        listener = new KafkaTradeCommandListener(consumer, TOPIC, handler);
    }

    @AfterEach
    void tearDown() {
        listener.stop();
    }

    private void deliver(String... values) {
        consumer.schedulePollTask(() -> {
            consumer.rebalance(List.of(PARTITION));
            for (int i = 0; i < values.length; i++) {
                consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, i, "key-" + i, values[i]));
            }
        });
    }

    @Test
    void testRecordsDispatchedInOrder() {
        when(handler.handleMessage(anyString())).thenReturn(CompletableFuture.completedFuture(null));
        deliver("{\"type\":\"heartbeat\"}", "{\"symbol\":\"ETHUSDT\"}");

        listener.start();

        verify(handler, timeout(5000)).handleMessage("{\"symbol\":\"ETHUSDT\"}");
        InOrder inOrder = inOrder(handler);
        inOrder.verify(handler).handleMessage("{\"type\":\"heartbeat\"}");
        inOrder.verify(handler).handleMessage("{\"symbol\":\"ETHUSDT\"}");
        assertTrue(listener.isRunning());
    }

    @Test
    void testFailedMessageSkipped() throws Exception {
        when(handler.handleMessage("bad")).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));
        when(handler.handleMessage("good")).thenReturn(CompletableFuture.completedFuture(null));
        deliver("bad", "good");

        listener.start();

        verify(handler, timeout(5000)).handleMessage("good");
        long deadline = System.currentTimeMillis() + 5000;
        while (listener.getProcessedCount() < 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, listener.getFailedCount());
        assertEquals(1, listener.getProcessedCount());
    }

    @Test
    void testStopClosesConsumer() {
        listener.start();
        listener.start();

        listener.stop();

        assertFalse(listener.isRunning());
        assertTrue(consumer.closed(), "Consumer is closed when the loop exits");
    }

    @Test
    void testConsumerProps() {
        Properties props = KafkaTradeCommandListener.consumerProps("broker:9092", "makerflow");

        assertEquals("broker:9092", props.get(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals("makerflow", props.get(ConsumerConfig.GROUP_ID_CONFIG));
        assertEquals("latest", props.get(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG));
    }
}
