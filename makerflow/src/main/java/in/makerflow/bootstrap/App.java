package in.makerflow.bootstrap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.application.command.TradeCommandHandler;
import in.makerflow.application.pool.AccountPoolExecutor.PoolServices;
import in.makerflow.application.service.EntryExecutionEngine;
import in.makerflow.application.service.ExitFanoutEngine;
import in.makerflow.application.service.PositionCloseWatcher;
import in.makerflow.application.service.QuoteLookup;
import in.makerflow.application.service.TradeLifecycleController;
import in.makerflow.config.EngineConfig;
import in.makerflow.config.QuoteStreamConfig;
import in.makerflow.config.UserStreamConfig;
import in.makerflow.config.VenueConfig;
import in.makerflow.domain.account.AccountConfig;
import in.makerflow.infrastructure.metrics.PrometheusVenueMetrics;
import in.makerflow.infrastructure.stream.BookTickerParser;
import in.makerflow.infrastructure.stream.QuoteStreamManager;
import in.makerflow.infrastructure.stream.UserDataEventParser;
import in.makerflow.infrastructure.stream.UserDataStream;
import in.makerflow.infrastructure.venue.DefaultVenueFactory;
import in.makerflow.infrastructure.venue.rest.FuturesRestVenue;
import in.makerflow.infrastructure.venue.rest.PublicMarketData;
import in.makerflow.infrastructure.venue.rest.SymbolFilterCache;
import in.makerflow.transport.http.OpsServer;
import in.makerflow.transport.kafka.KafkaTradeCommandListener;
import in.makerflow.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process entry point.
 *
 * Wiring order: config → metrics → filter cache warmup → quote stream → engines →
 * command handler → user data streams → Kafka listener → ops server. The shutdown hook
 * stops them in reverse.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final Duration MAX_STREAM_QUOTE_AGE = Duration.ofSeconds(5);

    public static void main(String[] args) throws Exception {
        EngineConfig engineConfig = EngineConfig.fromEnv();
        QuoteStreamConfig streamConfig = QuoteStreamConfig.fromEnv();
        VenueConfig venueConfig = VenueConfig.fromEnv();
        UserStreamConfig userStreamConfig = UserStreamConfig.fromEnv();
        StartupConfigValidator.validate(engineConfig, streamConfig, venueConfig, userStreamConfig);

        int opsPort = Env.getInt("OPS_PORT", 9091);
        String kafkaServers = Env.get("KAFKA_BOOTSTRAP_SERVERS", null);
        String commandTopic = Env.get("TRADE_COMMAND_TOPIC", "trade.commands");
        String groupId = Env.get("KAFKA_GROUP_ID", "makerflow");
        String accountsFile = Env.get("ACCOUNTS_FILE", null);

        ObjectMapper mapper = new ObjectMapper();
        PrometheusVenueMetrics metrics = new PrometheusVenueMetrics();
        log.info("✓ Prometheus metrics initialized");

        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(venueConfig.requestTimeout())
            .build();

        // ═══════════════════════════════════════════════════════════════
        // Market data: symbol filters, then the quote stream
        // ═══════════════════════════════════════════════════════════════
        SymbolFilterCache filterCache = new SymbolFilterCache(venueConfig.baseUrl());
        PublicMarketData marketData = new PublicMarketData(venueConfig, httpClient, mapper, filterCache);
        try {
            int symbols = marketData.warmup().join();
            log.info("✓ Symbol filters loaded: {}", symbols);
        } catch (RuntimeException e) {
            log.warn("[MARKET] Filter warmup failed, symbols will load on demand: {}", e.getMessage());
        }

        QuoteStreamManager quoteStream = new QuoteStreamManager(streamConfig, httpClient,
            new BookTickerParser(mapper), metrics);
        quoteStream.start();
        log.info("✓ Quote stream started: {}", streamConfig.url());

        // ═══════════════════════════════════════════════════════════════
        // Engines
        // ═══════════════════════════════════════════════════════════════
        AtomicInteger threadIds = new AtomicInteger();
        ScheduledExecutorService executor = Executors.newScheduledThreadPool(
            Math.max(4, Runtime.getRuntime().availableProcessors()), r -> {
                Thread t = new Thread(r, "makerflow-" + threadIds.incrementAndGet());
                t.setDaemon(true);
                return t;
            });

        QuoteLookup quoteLookup = new QuoteLookup(quoteStream.getCache(), marketData, MAX_STREAM_QUOTE_AGE);
        EntryExecutionEngine entryEngine = new EntryExecutionEngine(quoteLookup, metrics, executor);
        ExitFanoutEngine exitEngine = new ExitFanoutEngine();
        TradeLifecycleController controller = new TradeLifecycleController(entryEngine, exitEngine, metrics);
        PoolServices services = new PoolServices(controller, entryEngine, executor, metrics);
        log.info("✓ Trade engines initialized");

        List<AccountConfig> defaultAccounts = accountsFile == null
            ? List.of()
            : loadAccounts(Path.of(accountsFile), mapper, venueConfig.recvWindowMs());
        PositionCloseWatcher closeWatcher = new PositionCloseWatcher(metrics);
        TradeCommandHandler handler = new TradeCommandHandler(quoteLookup,
            new DefaultVenueFactory(venueConfig, httpClient, mapper, metrics), services, engineConfig,
            defaultAccounts, venueConfig.recvWindowMs(), mapper, closeWatcher);
        log.info("✓ Command handler ready ({} default accounts)", defaultAccounts.size());

        // ═══════════════════════════════════════════════════════════════
        // User data streams (live default accounts only)
        // ═══════════════════════════════════════════════════════════════
        List<UserDataStream> userStreams = new ArrayList<>();
        if (userStreamConfig.enabled()) {
            UserDataEventParser eventParser = new UserDataEventParser(mapper);
            for (AccountConfig account : defaultAccounts) {
                if (account.simulation()) {
                    continue;
                }
                UserDataStream stream = new UserDataStream(userStreamConfig,
                    new FuturesRestVenue(account, venueConfig, httpClient, mapper, metrics), httpClient, eventParser);
                stream.addListener(closeWatcher);
                stream.start();
                userStreams.add(stream);
            }
            log.info("✓ User data streams started: {}", userStreams.size());
        } else {
            log.info("[POOL] USER_STREAM_ENABLED=false, trades stay ACTIVE until restart");
        }

        // ═══════════════════════════════════════════════════════════════
        // Transports
        // ═══════════════════════════════════════════════════════════════
        KafkaTradeCommandListener listener = null;
        if (kafkaServers != null) {
            listener = KafkaTradeCommandListener.create(kafkaServers, groupId, commandTopic, handler);
            listener.start();
            log.info("✓ Kafka command listener started: {} topic={}", kafkaServers, commandTopic);
        } else {
            log.info("[COMMAND] KAFKA_BOOTSTRAP_SERVERS not set, command listener disabled");
        }

        OpsServer opsServer = new OpsServer(quoteStream, metrics.getRegistry());
        opsServer.start(opsPort);

        KafkaTradeCommandListener commandListener = listener;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down makerflow...");
            opsServer.stop();
            if (commandListener != null) {
                commandListener.stop();
            }
            handler.close();
            userStreams.forEach(UserDataStream::close);
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            quoteStream.close();
            log.info("Shutdown complete");
        }, "makerflow-shutdown"));

        log.info("makerflow started (ops port {})", opsServer.getPort());
    }

    /**
     * Read default accounts from a JSON array of {id, api_key, api_secret, simulation, recv_window_ms}.
     */
    static List<AccountConfig> loadAccounts(Path file, ObjectMapper mapper, long defaultRecvWindowMs)
            throws IOException {
        JsonNode root = mapper.readTree(Files.readString(file));
        if (root == null || !root.isArray()) {
            throw new IllegalStateException("Accounts file " + file + " must contain a JSON array");
        }
        List<AccountConfig> accounts = new ArrayList<>();
        for (JsonNode node : root) {
            AccountConfig account = new AccountConfig(
                node.path("id").asText(null),
                node.path("api_key").asText(null),
                node.path("api_secret").asText(null),
                node.path("simulation").asBoolean(false),
                node.path("recv_window_ms").asLong(defaultRecvWindowMs),
                node.path("base_url").asText(null));
            accounts.add(account);
            log.info("✓ Default account {}", account);
        }
        return accounts;
    }

    private App() {}
}
