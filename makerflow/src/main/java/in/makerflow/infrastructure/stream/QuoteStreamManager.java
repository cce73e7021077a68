package in.makerflow.infrastructure.stream;

import in.makerflow.config.QuoteStreamConfig;
import in.makerflow.domain.market.Quote;
import in.makerflow.infrastructure.common.PingWatchdog;
import in.makerflow.infrastructure.common.RetryBackoff;
import in.makerflow.infrastructure.metrics.VenueMetrics;
import in.makerflow.infrastructure.metrics.VenueMetrics.ConnectionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Quote Stream Manager - keeps the symbol → best bid/offer cache warm over one
 * long-lived WebSocket connection to the venue's bookTicker feed.
 *
 * Connection rules enforced:
 * - Ping at a fixed interval well under the venue's pong timeout; a missing pong
 *   forces a reconnect
 * - Server pings are answered by the JDK WebSocket client; pongs of either kind are
 *   recorded as liveness
 * - Proactive close once connection age reaches a fraction of the venue's 24h limit
 * - Constant backoff before every reconnect (the venue bans rapid reconnects)
 *
 * Each connection attempt gets a generation number. Callbacks from a superseded
 * socket are ignored.
 *
 * Usage:
 * <pre>
 * QuoteStreamManager quotes = new QuoteStreamManager(QuoteStreamConfig.fromEnv(),
 *     HttpClient.newHttpClient(), new BookTickerParser(mapper), metrics);
 * quotes.start();
 * Optional&lt;Quote&gt; eth = quotes.getQuote("ETHUSDT");
 * quotes.stop();
 * </pre>
 */
public class QuoteStreamManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QuoteStreamManager.class);

    private static final ByteBuffer PING_PAYLOAD = ByteBuffer.wrap("ping".getBytes(StandardCharsets.UTF_8));

    private final QuoteStreamConfig config;
    private final HttpClient httpClient;
    private final BookTickerParser parser;
    private final VenueMetrics metrics;
    private final QuoteCache cache = new QuoteCache();
    private final RetryBackoff reconnectBackoff;
    private final ScheduledExecutorService scheduler;
    private final List<Consumer<Quote>> listeners = new CopyOnWriteArrayList<>();

    private final AtomicReference<StreamState> state = new AtomicReference<>(StreamState.DISCONNECTED);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong connectCount = new AtomicLong();
    private final AtomicReference<Connection> current = new AtomicReference<>();

    private volatile boolean running = false;
    private volatile ScheduledFuture<?> reconnectTask;

    public QuoteStreamManager(QuoteStreamConfig config, HttpClient httpClient,
                              BookTickerParser parser, VenueMetrics metrics) {
        if (!config.isValid()) {
            throw new IllegalArgumentException("Invalid quote stream config: " + config);
        }
        this.config = config;
        this.httpClient = httpClient;
        this.parser = parser;
        this.metrics = metrics;
        this.reconnectBackoff = RetryBackoff.constant(config.reconnectBackoff());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "QuoteStream");
            t.setDaemon(true);
            return t;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PUBLIC CONTRACT
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Start the background connection. Idempotent; returns without waiting for the handshake.
     */
    public synchronized void start() {
        if (running) {
            log.debug("[QUOTES] Already running");
            return;
        }
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("Quote stream manager is closed");
        }
        running = true;
        log.info("[QUOTES] Starting quote stream: {}", config.url());
        scheduler.execute(this::connect);
    }

    /**
     * Stop the stream and close the socket. Idempotent; the cache keeps its last values.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        state.set(StreamState.STOPPING);
        generation.incrementAndGet();

        ScheduledFuture<?> pending = reconnectTask;
        if (pending != null) {
            pending.cancel(false);
            reconnectTask = null;
        }

        Connection connection = current.getAndSet(null);
        if (connection != null) {
            connection.teardown(true);
        }

        state.set(StreamState.DISCONNECTED);
        log.info("[QUOTES] Quote stream stopped");
    }

    /**
     * Stop the stream and release the scheduler. The manager cannot be restarted afterwards.
     */
    @Override
    public void close() {
        stop();
        scheduler.shutdownNow();
    }

    /**
     * Latest cached quote. Never blocks on network I/O.
     */
    public Optional<Quote> getQuote(String symbol) {
        return cache.get(symbol);
    }

    /**
     * Register a listener for every quote applied to the cache.
     * Listener exceptions are logged and do not affect the stream.
     */
    public void addListener(Consumer<Quote> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<Quote> listener) {
        listeners.remove(listener);
    }

    public StreamState getState() {
        return state.get();
    }

    public boolean isRunning() {
        return running;
    }

    public QuoteCache getCache() {
        return cache;
    }

    /**
     * Number of successful handshakes since construction.
     */
    public long getConnectCount() {
        return connectCount.get();
    }

    /**
     * Age of the open connection, or null when disconnected.
     */
    public Duration getConnectionAge() {
        Connection connection = current.get();
        if (connection == null || connection.openedAt == null) {
            return null;
        }
        return Duration.between(connection.openedAt, Instant.now());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CONNECTION LIFECYCLE
    // ═══════════════════════════════════════════════════════════════════════

    private void connect() {
        if (!running) {
            return;
        }
        long gen = generation.incrementAndGet();
        Connection connection = new Connection(gen);
        current.set(connection);
        state.set(StreamState.CONNECTING);
        log.info("[QUOTES] Connecting (generation {})", gen);

        httpClient.newWebSocketBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .buildAsync(URI.create(config.url()), connection)
            .whenComplete((ws, error) -> {
                if (error != null) {
                    log.warn("[QUOTES] Connect failed (generation {}): {}", gen, error.getMessage());
                    metrics.recordConnectionEvent(ConnectionEvent.CONNECT_FAILED);
                    connection.onDisconnected("connect failed");
                }
            });
    }

    private void scheduleReconnect(long gen, String reason) {
        synchronized (this) {
            if (!running || gen != generation.get()) {
                return;
            }
            state.set(StreamState.DISCONNECTED);
            reconnectBackoff.onFailure();
            Duration delay = reconnectBackoff.nextDelay();
            log.info("[QUOTES] Disconnected ({}), reconnecting in {} ms", reason, delay.toMillis());
            reconnectTask = scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void dispatch(String text) {
        Optional<Quote> parsed = parser.parse(text);
        if (parsed.isEmpty()) {
            return;
        }
        Quote quote = parsed.get();
        cache.update(quote);
        metrics.recordQuoteMessage();
        for (Consumer<Quote> listener : listeners) {
            try {
                listener.accept(quote);
            } catch (Exception e) {
                log.error("[QUOTES] Quote listener failed for {}", quote.symbol(), e);
            }
        }
    }

    /**
     * One connection attempt. All socket callbacks for a generation land here.
     */
    private final class Connection implements WebSocket.Listener {
        private final long gen;
        private final AtomicBoolean disconnected = new AtomicBoolean(false);
        private final StringBuilder buffer = new StringBuilder();

        private volatile WebSocket socket;
        private volatile Instant openedAt;
        private volatile PingWatchdog watchdog;
        private volatile ScheduledFuture<?> ageTask;

        Connection(long gen) {
            this.gen = gen;
        }

        private boolean isStale() {
            return gen != generation.get();
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            if (isStale() || !running) {
                webSocket.abort();
                return;
            }
            this.socket = webSocket;
            this.openedAt = Instant.now();
            connectCount.incrementAndGet();
            reconnectBackoff.onSuccess();
            state.set(StreamState.CONNECTED);
            metrics.recordConnectionEvent(ConnectionEvent.CONNECTED);
            log.info("[QUOTES] Connected (generation {})", gen);

            watchdog = new PingWatchdog("gen-" + gen, config.pingInterval(), config.pongTimeout(),
                () -> webSocket.sendPing(PING_PAYLOAD.duplicate()),
                () -> {
                    metrics.recordConnectionEvent(ConnectionEvent.HEARTBEAT_TIMEOUT);
                    forceReconnect("heartbeat timeout");
                });
            watchdog.start();

            Duration maxAge = config.proactiveReconnectAge();
            ageTask = scheduler.schedule(() -> {
                log.info("[QUOTES] Connection age reached {} ms, reconnecting ahead of the venue limit",
                    maxAge.toMillis());
                metrics.recordConnectionEvent(ConnectionEvent.SCHEDULED_RECONNECT);
                forceReconnect("scheduled reconnect");
            }, maxAge.toMillis(), TimeUnit.MILLISECONDS);

            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            if (isStale()) {
                return null;
            }
            buffer.append(data);
            if (last) {
                String text = buffer.toString();
                buffer.setLength(0);
                try {
                    dispatch(text);
                } catch (Exception e) {
                    log.error("[QUOTES] Failed to handle message", e);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPing(WebSocket webSocket, ByteBuffer message) {
            PingWatchdog dog = watchdog;
            if (dog != null) {
                dog.pongReceived();
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onPong(WebSocket webSocket, ByteBuffer message) {
            PingWatchdog dog = watchdog;
            if (dog != null) {
                dog.pongReceived();
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info("[QUOTES] Server closed connection (generation {}): {} {}", gen, statusCode, reason);
            onDisconnected("server close " + statusCode);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.warn("[QUOTES] Transport error (generation {}): {}", gen, error.getMessage());
            onDisconnected("transport error");
        }

        private void forceReconnect(String reason) {
            if (isStale() || !running) {
                return;
            }
            if (disconnected.compareAndSet(false, true)) {
                teardown(false);
                metrics.recordConnectionEvent(ConnectionEvent.DISCONNECTED);
                scheduleReconnect(gen, reason);
            }
        }

        void onDisconnected(String reason) {
            if (disconnected.compareAndSet(false, true)) {
                teardown(false);
                if (isStale() || !running) {
                    return;
                }
                metrics.recordConnectionEvent(ConnectionEvent.DISCONNECTED);
                scheduleReconnect(gen, reason);
            }
        }

        /**
         * Release heartbeat, age timer and socket. graceful sends a close frame first.
         */
        void teardown(boolean graceful) {
            disconnected.set(true);
            PingWatchdog dog = watchdog;
            if (dog != null) {
                dog.stop();
            }
            ScheduledFuture<?> age = ageTask;
            if (age != null) {
                age.cancel(false);
            }
            WebSocket ws = socket;
            if (ws == null) {
                return;
            }
            if (graceful && !ws.isOutputClosed()) {
                ws.sendClose(WebSocket.NORMAL_CLOSURE, "shutdown")
                    .orTimeout(2, TimeUnit.SECONDS)
                    .whenComplete((r, e) -> ws.abort());
            } else {
                ws.abort();
            }
        }
    }
}
