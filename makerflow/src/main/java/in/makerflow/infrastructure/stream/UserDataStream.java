package in.makerflow.infrastructure.stream;

import in.makerflow.config.UserStreamConfig;
import in.makerflow.domain.account.Position;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.infrastructure.common.RetryBackoff;
import in.makerflow.infrastructure.stream.UserDataEvent.AccountUpdate;
import in.makerflow.infrastructure.stream.UserDataEvent.ListenKeyExpired;
import in.makerflow.infrastructure.stream.UserDataEvent.OrderUpdate;
import in.makerflow.infrastructure.stream.UserDataEvent.PositionUpdate;
import in.makerflow.infrastructure.venue.UserStreamVenue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
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
 * User Data Stream - one account's private event feed.
 *
 * Lifecycle:
 * 1. start(): seed open positions from REST, create a listen key, connect to url/listenKey
 * 2. Keep the listen key alive at a fixed interval
 * 3. ACCOUNT_UPDATE events maintain the open-position map; a position going from
 *    open to flat is reported to listeners as closed
 * 4. listenKeyExpired, server close or transport error: wait the backoff, create a
 *    fresh listen key and reconnect
 * 5. stop(): close the socket and release the listen key
 *
 * Positions are keyed by symbol and position side, so hedge-mode accounts track
 * their long and short legs separately.
 */
public class UserDataStream implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UserDataStream.class);

    /**
     * Callbacks run on the socket thread. Exceptions are logged and do not affect the stream.
     */
    public interface Listener {
        default void onPositionChanged(String accountId, PositionUpdate position) {
        }

        /**
         * @param lastOpen the position as last seen open
         */
        default void onPositionClosed(String accountId, PositionUpdate lastOpen) {
        }

        default void onOrderUpdate(String accountId, OrderUpdate update) {
        }
    }

    private final UserStreamConfig config;
    private final UserStreamVenue venue;
    private final HttpClient httpClient;
    private final UserDataEventParser parser;
    private final String accountId;
    private final RetryBackoff reconnectBackoff;
    private final ScheduledExecutorService scheduler;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, PositionUpdate> openPositions = new ConcurrentHashMap<>();

    private final AtomicReference<StreamState> state = new AtomicReference<>(StreamState.DISCONNECTED);
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong connectCount = new AtomicLong();
    private final AtomicReference<Connection> current = new AtomicReference<>();

    private volatile boolean running = false;
    private volatile String listenKey;
    private volatile ScheduledFuture<?> reconnectTask;
    private volatile ScheduledFuture<?> keepAliveTask;

    public UserDataStream(UserStreamConfig config, UserStreamVenue venue, HttpClient httpClient,
                          UserDataEventParser parser) {
        if (!config.isValid()) {
            throw new IllegalArgumentException("Invalid user stream config: " + config);
        }
        this.config = config;
        this.venue = venue;
        this.httpClient = httpClient;
        this.parser = parser;
        this.accountId = venue.getAccountId();
        this.reconnectBackoff = RetryBackoff.constant(config.reconnectBackoff());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "UserStream-" + accountId);
            t.setDaemon(true);
            return t;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PUBLIC CONTRACT
    // ═══════════════════════════════════════════════════════════════════════

    public synchronized void start() {
        if (running) {
            return;
        }
        if (scheduler.isShutdown()) {
            throw new IllegalStateException("User data stream is closed");
        }
        running = true;
        log.info("[POOL] Starting user data stream for {}", accountId);
        scheduler.execute(this::seedPositions);
        scheduler.execute(this::open);
        long every = config.keepAliveInterval().toMillis();
        keepAliveTask = scheduler.scheduleAtFixedRate(this::keepAlive, every, every, TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        state.set(StreamState.STOPPING);
        generation.incrementAndGet();
        cancel(reconnectTask);
        cancel(keepAliveTask);
        reconnectTask = null;
        keepAliveTask = null;

        Connection connection = current.getAndSet(null);
        if (connection != null) {
            connection.teardown(true);
        }
        if (listenKey != null) {
            listenKey = null;
            venue.closeListenKey().whenComplete((ignored, error) -> {
                if (error != null) {
                    log.warn("[POOL] Failed to close listen key for {}: {}", accountId, error.getMessage());
                }
            });
        }
        state.set(StreamState.DISCONNECTED);
        log.info("[POOL] User data stream stopped for {}", accountId);
    }

    @Override
    public void close() {
        stop();
        scheduler.shutdownNow();
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public String getAccountId() {
        return accountId;
    }

    public StreamState getState() {
        return state.get();
    }

    public boolean isRunning() {
        return running;
    }

    public long getConnectCount() {
        return connectCount.get();
    }

    public Optional<PositionUpdate> getOpenPosition(String symbol, PositionSide side) {
        return Optional.ofNullable(openPositions.get(symbol + ":" + side));
    }

    public Map<String, PositionUpdate> getOpenPositions() {
        return Map.copyOf(openPositions);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // LISTEN KEY AND CONNECTION
    // ═══════════════════════════════════════════════════════════════════════

    private void seedPositions() {
        venue.getPositions().whenComplete((positions, error) -> {
            if (error != null) {
                log.warn("[POOL] Could not seed positions for {}: {}", accountId, error.getMessage());
                return;
            }
            for (Position p : positions) {
                if (!p.isOpen()) {
                    continue;
                }
                PositionSide side = p.positionSide() == null ? PositionSide.BOTH
                    : PositionSide.valueOf(p.positionSide());
                PositionUpdate seeded = new PositionUpdate(p.symbol(), side, p.positionAmount(), p.entryPrice());
                // A stream update that already arrived is newer than the REST snapshot
                openPositions.putIfAbsent(seeded.key(), seeded);
            }
            log.info("[POOL] {} open position(s) on {}", openPositions.size(), accountId);
        });
    }

    private void open() {
        if (!running) {
            return;
        }
        long gen = generation.incrementAndGet();
        state.set(StreamState.CONNECTING);
        venue.createListenKey().whenComplete((key, error) -> {
            if (error != null) {
                log.warn("[POOL] Listen key request failed for {}: {}", accountId, error.getMessage());
                scheduleReconnect(gen, "listen key unavailable");
                return;
            }
            if (!running || gen != generation.get()) {
                return;
            }
            listenKey = key;
            connect(gen, key);
        });
    }

    private void connect(long gen, String key) {
        if (!running || gen != generation.get()) {
            return;
        }
        Connection connection = new Connection(gen);
        current.set(connection);
        log.info("[POOL] Connecting user stream for {} (generation {})", accountId, gen);

        httpClient.newWebSocketBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .buildAsync(URI.create(config.streamUrl(key)), connection)
            .whenComplete((ws, error) -> {
                if (error != null) {
                    log.warn("[POOL] User stream connect failed for {}: {}", accountId, error.getMessage());
                    connection.onDisconnected("connect failed");
                }
            });
    }

    private void keepAlive() {
        if (!running || listenKey == null) {
            return;
        }
        venue.keepAliveListenKey().whenComplete((ignored, error) -> {
            if (error != null) {
                log.warn("[POOL] Listen key keepalive failed for {}: {}", accountId, error.getMessage());
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
            log.info("[POOL] User stream for {} disconnected ({}), reconnecting in {} ms",
                accountId, reason, delay.toMillis());
            reconnectTask = scheduler.schedule(this::open, delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // EVENTS
    // ═══════════════════════════════════════════════════════════════════════

    private void dispatch(String text, Connection connection) {
        Optional<UserDataEvent> parsed = parser.parse(text);
        if (parsed.isEmpty()) {
            return;
        }
        UserDataEvent event = parsed.get();
        if (event instanceof AccountUpdate) {
            apply((AccountUpdate) event);
        } else if (event instanceof OrderUpdate) {
            OrderUpdate update = (OrderUpdate) event;
            notifyListeners(l -> l.onOrderUpdate(accountId, update));
        } else if (event instanceof ListenKeyExpired) {
            log.warn("[POOL] Listen key expired for {}", accountId);
            listenKey = null;
            connection.forceReconnect("listen key expired");
        }
    }

    private void apply(AccountUpdate update) {
        for (PositionUpdate position : update.positions()) {
            if (position.isOpen()) {
                openPositions.put(position.key(), position);
                notifyListeners(l -> l.onPositionChanged(accountId, position));
                continue;
            }
            PositionUpdate previous = openPositions.remove(position.key());
            if (previous != null) {
                log.info("[POOL] Position closed on {}: {} {} (reason {})", accountId, position.symbol(),
                    position.positionSide(), update.reason());
                notifyListeners(l -> l.onPositionClosed(accountId, previous));
            }
        }
    }

    private void notifyListeners(Consumer<Listener> call) {
        for (Listener listener : listeners) {
            try {
                call.accept(listener);
            } catch (Exception e) {
                log.error("[POOL] User stream listener failed for {}", accountId, e);
            }
        }
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    private final class Connection implements WebSocket.Listener {
        private final long gen;
        private final AtomicBoolean disconnected = new AtomicBoolean(false);
        private final StringBuilder buffer = new StringBuilder();

        private volatile WebSocket socket;

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
            connectCount.incrementAndGet();
            reconnectBackoff.onSuccess();
            state.set(StreamState.CONNECTED);
            log.info("[POOL] User stream connected for {} (generation {})", accountId, gen);
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
                    dispatch(text, this);
                } catch (Exception e) {
                    log.error("[POOL] Failed to handle user stream message for {}", accountId, e);
                }
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            log.info("[POOL] User stream closed by server for {}: {} {}", accountId, statusCode, reason);
            onDisconnected("server close " + statusCode);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            log.warn("[POOL] User stream transport error for {}: {}", accountId, error.getMessage());
            onDisconnected("transport error");
        }

        void forceReconnect(String reason) {
            if (isStale() || !running) {
                return;
            }
            if (disconnected.compareAndSet(false, true)) {
                teardown(false);
                scheduleReconnect(gen, reason);
            }
        }

        void onDisconnected(String reason) {
            if (disconnected.compareAndSet(false, true)) {
                teardown(false);
                if (isStale() || !running) {
                    return;
                }
                scheduleReconnect(gen, reason);
            }
        }

        void teardown(boolean graceful) {
            disconnected.set(true);
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
