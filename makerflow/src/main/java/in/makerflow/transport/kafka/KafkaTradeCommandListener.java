package in.makerflow.transport.kafka;

import in.makerflow.application.command.TradeCommandHandler;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes trade command messages from a Kafka topic and hands each one to the command handler.
 *
 * Features:
 * - Single consumer thread; messages run one at a time in arrival order
 * - A message that fails to parse or execute is logged and skipped, the loop keeps running
 * - stop() wakes the consumer out of poll and joins the thread
 *
 * Usage:
 * <pre>
 * KafkaTradeCommandListener listener = KafkaTradeCommandListener.create(servers, groupId, topic, handler);
 * listener.start();
 * ...
 * listener.stop();
 * </pre>
 */
public class KafkaTradeCommandListener {
    private static final Logger log = LoggerFactory.getLogger(KafkaTradeCommandListener.class);

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(1000);
    private static final long STOP_JOIN_MS = 10_000;

    private final Consumer<String, String> consumer;
    private final String topic;
    private final TradeCommandHandler handler;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private volatile Thread thread;

    public KafkaTradeCommandListener(Consumer<String, String> consumer, String topic, TradeCommandHandler handler) {
        this.consumer = consumer;
        this.topic = topic;
        this.handler = handler;
    }

    public static KafkaTradeCommandListener create(String bootstrapServers, String groupId, String topic,
                                                   TradeCommandHandler handler) {
        return new KafkaTradeCommandListener(new KafkaConsumer<>(consumerProps(bootstrapServers, groupId)),
            topic, handler);
    }

    static Properties consumerProps(String bootstrapServers, String groupId) {
        Properties p = new Properties();
        p.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        p.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        p.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
        p.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        p.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        p.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        return p;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.warn("[COMMAND] Listener already running on {}", topic);
            return;
        }
        Thread t = new Thread(this::runLoop, "trade-command-listener");
        t.setDaemon(true);
        thread = t;
        t.start();
        log.info("[COMMAND] Listening for trade commands on topic {}", topic);
    }

    private void runLoop() {
        try {
            consumer.subscribe(List.of(topic));
            while (running.get()) {
                ConsumerRecords<String, String> records = consumer.poll(POLL_TIMEOUT);
                for (ConsumerRecord<String, String> record : records) {
                    dispatch(record);
                }
            }
        } catch (WakeupException e) {
            if (running.get()) {
                log.error("[COMMAND] Unexpected consumer wakeup on {}", topic, e);
            }
        } catch (RuntimeException e) {
            log.error("[COMMAND] Consumer loop on {} failed: {}", topic, e.getMessage(), e);
        } finally {
            running.set(false);
            consumer.close();
            log.info("[COMMAND] Listener on {} stopped (processed={}, failed={})", topic, processed.get(), failed.get());
        }
    }

    private void dispatch(ConsumerRecord<String, String> record) {
        log.info("[COMMAND] Received message partition={} offset={} key={}", record.partition(), record.offset(),
            record.key());
        try {
            handler.handleMessage(record.value()).join();
            processed.incrementAndGet();
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.error("[COMMAND] Message at offset {} failed: {}", record.offset(), e.getMessage(), e);
        }
    }

    /**
     * Stop polling and wait for the consumer thread to finish the message in hand.
     */
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        consumer.wakeup();
        Thread t = thread;
        if (t != null && t != Thread.currentThread()) {
            try {
                t.join(STOP_JOIN_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[COMMAND] Interrupted while stopping listener on {}", topic);
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getProcessedCount() {
        return processed.get();
    }

    public long getFailedCount() {
        return failed.get();
    }
}
