package in.makerflow.application.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.application.pool.AccountPoolExecutor;
import in.makerflow.application.pool.AccountPoolExecutor.PoolServices;
import in.makerflow.application.pool.AccountResult;
import in.makerflow.application.pool.AccountSession;
import in.makerflow.application.pool.PerAccount;
import in.makerflow.application.service.PositionCloseWatcher;
import in.makerflow.application.service.QuoteLookup;
import in.makerflow.application.service.TradeSnapshotMapper;
import in.makerflow.config.EngineConfig;
import in.makerflow.domain.account.AccountConfig;
import in.makerflow.domain.market.Quote;
import in.makerflow.domain.market.SymbolFilters;
import in.makerflow.domain.order.OrderRequest;
import in.makerflow.domain.order.OrderResponse;
import in.makerflow.domain.order.OrderType;
import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.order.TimeInForce;
import in.makerflow.domain.trade.EntryParams;
import in.makerflow.domain.trade.LegStatus;
import in.makerflow.domain.trade.OrderLeg;
import in.makerflow.domain.trade.Trade;
import in.makerflow.domain.trade.TradeRequest;
import in.makerflow.domain.trade.TradeStatus;
import in.makerflow.infrastructure.venue.VenueFactory;
import in.makerflow.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executes command messages across the accounts they list.
 *
 * Flow for a trade command:
 * 1. Resolve accounts (message accounts, else the configured defaults) and per-account quantities
 * 2. Fetch a fresh quote (stream cache, else order book) and the symbol filters
 * 3. Run the trade lifecycle for every account in parallel through an account pool
 * 4. Log a batch summary
 * 5. Hand ACTIVE trades to the position close watcher, when one is configured
 *
 * Exit commands close (EXIT) or trim (PARTIAL_EXIT) the positions the accounts hold; accounts
 * need no quantity for them.
 *
 * Venue sessions are cached per (account id, API key hash) across messages and closed with the handler.
 */
public class TradeCommandHandler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TradeCommandHandler.class);

    private static final Set<TradeStatus> SUCCESS_STATUSES =
        EnumSet.of(TradeStatus.ACTIVE, TradeStatus.COMPLETED);

    private final QuoteLookup quoteLookup;
    private final VenueFactory venueFactory;
    private final PoolServices services;
    private final EngineConfig engineConfig;
    private final List<AccountConfig> defaultAccounts;
    private final long recvWindowMs;
    private final ObjectMapper mapper;
    private final PositionCloseWatcher closeWatcher;
    private final Map<String, AccountSession> sessions = new ConcurrentHashMap<>();

    public TradeCommandHandler(QuoteLookup quoteLookup, VenueFactory venueFactory, PoolServices services,
                               EngineConfig engineConfig, List<AccountConfig> defaultAccounts,
                               long recvWindowMs, ObjectMapper mapper) {
        this(quoteLookup, venueFactory, services, engineConfig, defaultAccounts, recvWindowMs, mapper, null);
    }

    /**
     * @param closeWatcher completes ACTIVE trades when their position closes; null to skip
     */
    public TradeCommandHandler(QuoteLookup quoteLookup, VenueFactory venueFactory, PoolServices services,
                               EngineConfig engineConfig, List<AccountConfig> defaultAccounts,
                               long recvWindowMs, ObjectMapper mapper, PositionCloseWatcher closeWatcher) {
        this.quoteLookup = quoteLookup;
        this.venueFactory = venueFactory;
        this.services = services;
        this.engineConfig = engineConfig;
        this.defaultAccounts = defaultAccounts == null ? List.of() : List.copyOf(defaultAccounts);
        this.recvWindowMs = recvWindowMs;
        this.mapper = mapper;
        this.closeWatcher = closeWatcher;
    }

    /**
     * Parse and execute one raw message. Never fails: malformed messages and execution
     * errors are logged.
     */
    public CompletableFuture<Void> handleMessage(String payload) {
        TradeCommand command;
        try {
            command = TradeCommand.parse(mapper.readTree(payload));
        } catch (JsonProcessingException e) {
            log.error("[COMMAND] Message is not valid JSON: {}", e.getOriginalMessage());
            return CompletableFuture.completedFuture(null);
        } catch (IllegalArgumentException e) {
            log.error("[COMMAND] Invalid command: {}", e.getMessage());
            return CompletableFuture.completedFuture(null);
        }

        CompletableFuture<?> execution;
        switch (command.type()) {
            case HEARTBEAT:
                log.info("[COMMAND] Heartbeat from sender: status={} message={}", command.status(), command.message());
                return CompletableFuture.completedFuture(null);
            case ORDER:
                execution = Futures.guard(() -> executeOrder(command));
                break;
            case EXIT:
            case PARTIAL_EXIT:
                execution = Futures.guard(() -> executeExit(command));
                break;
            default:
                execution = Futures.guard(() -> executeTrade(command));
                break;
        }
        return execution.handle((result, error) -> {
            if (error != null) {
                Throwable cause = Futures.unwrap(error);
                log.error("[COMMAND] {} {} {} failed: {}", command.type(), command.symbol(), command.side(),
                    cause.getMessage(), cause);
            }
            return null;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // TRADE COMMANDS
    // ═══════════════════════════════════════════════════════════════════════

    public CompletableFuture<List<AccountResult<Trade>>> executeTrade(TradeCommand command) {
        List<CommandAccount> accounts = resolveAccounts(command);
        if (accounts.isEmpty()) {
            log.warn("[COMMAND] No executable accounts for {} {}", command.symbol(), command.side());
            return CompletableFuture.completedFuture(List.of());
        }
        String symbol = command.symbol();
        List<AccountSession> accountSessions = sessionsFor(accounts);

        return marketData(symbol).thenCompose(market -> {
            EntryParams params = engineConfig.entryParams();
            if (command.ticksDistance() != null) {
                params = params.withTicksDistance(command.ticksDistance());
            }
            List<BigDecimal> quantities = new ArrayList<>();
            accounts.forEach(a -> quantities.add(a.quantity()));

            TradeRequest template = new TradeRequest(symbol, command.side(), quantities.get(0), market.quote(),
                market.filters(), command.takeProfits(), command.slPercent(), params, engineConfig.hedgeMode());

            log.info("[COMMAND] Trade {} {} on {} accounts: bid={} ask={} tick={} SL={}% ticksDistance={}",
                symbol, command.side(), accounts.size(), market.quote().bestBid().toPlainString(),
                market.quote().bestAsk().toPlainString(), market.filters().tickSize().toPlainString(),
                command.slPercent().toPlainString(), params.ticksDistance());

            AccountPoolExecutor pool = new AccountPoolExecutor(accountSessions, services);
            return pool.createTrades(template, PerAccount.of(quantities));
        }).thenApply(results -> {
            logTradeSummary(symbol, command, results);
            watch(accountSessions, results);
            return results;
        });
    }

    private void watch(List<AccountSession> accountSessions, List<AccountResult<Trade>> results) {
        if (closeWatcher == null) {
            return;
        }
        for (int i = 0; i < results.size(); i++) {
            AccountResult<Trade> r = results.get(i);
            if (r.success()) {
                AccountSession session = accountSessions.get(i);
                closeWatcher.track(session.accountId(), session.venue(), r.result());
            }
        }
    }

    private void logTradeSummary(String symbol, TradeCommand command, List<AccountResult<Trade>> results) {
        int ok = 0;
        for (AccountResult<Trade> r : results) {
            if (!r.success()) {
                log.error("[COMMAND] Trade FAILED for account {}: {}", r.accountId(), r.errorMessage());
                continue;
            }
            Trade trade = r.result();
            if (succeeded(trade)) {
                ok++;
                log.info("[COMMAND] Trade SUCCESS for account {}: {} {}", r.accountId(), trade.getTradeId(),
                    trade.getStatus());
            } else {
                log.warn("[COMMAND] Trade INCOMPLETE for account {}: {} {} {}", r.accountId(), trade.getTradeId(),
                    trade.getStatus(), trade.getMetadata().get("error"));
            }
            if (log.isDebugEnabled()) {
                log.debug("[COMMAND] {}", TradeSnapshotMapper.toJson(trade));
            }
        }
        log.info("[COMMAND] Batch summary {} {}: total={} success={} failed={}", symbol, command.side(),
            results.size(), ok, results.size() - ok);
    }

    /** Exits in place, or already closed. A trade stopped before its exits is not a success. */
    static boolean succeeded(Trade trade) {
        return SUCCESS_STATUSES.contains(trade.getStatus());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDER COMMANDS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * One order per account: "limit" at the message price (GTC), or "bbo" priced off the fresh quote.
     */
    public CompletableFuture<List<AccountResult<OrderResponse>>> executeOrder(TradeCommand command) {
        List<CommandAccount> accounts = resolveAccounts(command);
        if (accounts.isEmpty()) {
            log.warn("[COMMAND] No executable accounts for order on {}", command.symbol());
            return CompletableFuture.completedFuture(List.of());
        }
        List<BigDecimal> quantities = new ArrayList<>();
        accounts.forEach(a -> quantities.add(a.quantity()));
        PositionSide positionSide = PositionSide.forEntry(command.side(), engineConfig.hedgeMode());

        CompletableFuture<List<AccountResult<OrderResponse>>> results;
        switch (command.orderType()) {
            case "bbo":
                int ticks = command.ticksDistance() != null ? command.ticksDistance() : engineConfig.ticksDistance();
                results = marketData(command.symbol()).thenCompose(market ->
                    new AccountPoolExecutor(sessionsFor(accounts), services).placeBboOrders(command.symbol(),
                        command.side(), PerAccount.of(quantities), market.quote(), market.filters().tickSize(), ticks));
                break;
            case "limit":
                if (command.price() == null) {
                    throw new IllegalArgumentException("Limit order command needs a price");
                }
                List<OrderRequest> requests = new ArrayList<>();
                for (BigDecimal qty : quantities) {
                    requests.add(new OrderRequest(command.symbol(), command.side(), OrderType.LIMIT,
                        qty, command.price(), null, TimeInForce.GTC, positionSide,
                        command.reduceOnly(), false, null));
                }
                results = new AccountPoolExecutor(sessionsFor(accounts), services).placeOrders(PerAccount.of(requests));
                break;
            default:
                throw new IllegalArgumentException("Unsupported order_type: " + command.orderType());
        }
        return results.thenApply(list -> {
            long ok = list.stream().filter(AccountResult::success).count();
            for (AccountResult<OrderResponse> r : list) {
                if (r.success()) {
                    log.info("[COMMAND] Order success for {}: id={} status={}", r.accountId(),
                        r.result().orderId(), r.result().status());
                } else {
                    log.error("[COMMAND] Order failed for {}: {}", r.accountId(), r.errorMessage());
                }
            }
            log.info("[COMMAND] Order batch completed: {} ok, {} failed", ok, list.size() - ok);
            return list;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // EXIT COMMANDS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * EXIT: cancel the symbol's orders and close the matching positions.
     * PARTIAL_EXIT: close exit_pct of the direction's position, optionally moving the stop to entry.
     * Both close with reduce-only maker orders run through the entry engine.
     */
    public CompletableFuture<List<AccountResult<List<OrderLeg>>>> executeExit(TradeCommand command) {
        List<CommandAccount> accounts = resolveAccounts(command, false);
        if (accounts.isEmpty()) {
            log.warn("[COMMAND] No executable accounts for {} on {}", command.type(), command.symbol());
            return CompletableFuture.completedFuture(List.of());
        }
        String symbol = command.symbol();
        List<AccountSession> accountSessions = sessionsFor(accounts);
        return marketData(symbol).thenCompose(market -> {
            EntryParams params = engineConfig.entryParams();
            if (command.ticksDistance() != null) {
                params = params.withTicksDistance(command.ticksDistance());
            }
            AccountPoolExecutor pool = new AccountPoolExecutor(accountSessions, services);
            if (command.type() == CommandType.PARTIAL_EXIT) {
                log.info("[COMMAND] Partial exit {} {} on {} accounts: {} of position, stop to entry {}",
                    symbol, command.direction(), accounts.size(), command.exitFraction().toPlainString(),
                    command.moveStopToEntry());
                return pool.reducePositions(symbol, command.direction(), command.exitFraction(),
                    command.moveStopToEntry(), market.quote(), market.filters(), params);
            }
            log.info("[COMMAND] Exit {} {} on {} accounts", symbol,
                command.direction() != null ? command.direction() : "ALL", accounts.size());
            return pool.closePositions(symbol, command.direction(), market.quote(), market.filters().tickSize(),
                params);
        }).thenApply(results -> {
            int ok = 0;
            for (AccountResult<List<OrderLeg>> r : results) {
                if (!r.success()) {
                    log.error("[COMMAND] {} FAILED for account {}: {}", command.type(), r.accountId(), r.errorMessage());
                    continue;
                }
                boolean filled = r.result().stream().allMatch(leg -> leg.getStatus() == LegStatus.FILLED);
                if (filled) {
                    ok++;
                }
                log.info("[COMMAND] {} for account {}: {} close order(s) {}", command.type(), r.accountId(),
                    r.result().size(), filled ? "filled" : "NOT filled");
            }
            log.info("[COMMAND] {} summary {}: total={} success={} failed={}", command.type(), symbol,
                results.size(), ok, results.size() - ok);
            return results;
        });
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    record MarketData(Quote quote, SymbolFilters filters) {}

    private CompletableFuture<MarketData> marketData(String symbol) {
        return quoteLookup.fresh(symbol).thenCombine(quoteLookup.filters(symbol), MarketData::new);
    }

    /**
     * Message accounts (or the defaults) with a resolved quantity. Accounts without one are skipped.
     */
    List<CommandAccount> resolveAccounts(TradeCommand command) {
        return resolveAccounts(command, true);
    }

    private List<CommandAccount> resolveAccounts(TradeCommand command, boolean needQuantity) {
        List<CommandAccount> source = command.accounts();
        if (source.isEmpty()) {
            source = new ArrayList<>();
            for (AccountConfig config : defaultAccounts) {
                source.add(CommandAccount.of(config, null));
            }
        }
        List<CommandAccount> resolved = new ArrayList<>();
        for (CommandAccount account : source) {
            BigDecimal qty = account.quantity() != null ? account.quantity() : command.quantity();
            if (needQuantity && (qty == null || qty.signum() <= 0)) {
                log.error("[COMMAND] Skipping account {}: no quantity", account.id());
                continue;
            }
            resolved.add(new CommandAccount(account.id(), account.apiKey(), account.apiSecret(), qty,
                account.simulation()));
            log.info("[COMMAND] Account {}", resolved.get(resolved.size() - 1));
        }
        return resolved;
    }

    private List<AccountSession> sessionsFor(List<CommandAccount> accounts) {
        List<AccountSession> result = new ArrayList<>(accounts.size());
        for (CommandAccount account : accounts) {
            String key = account.id() + ":" + (account.simulation() ? "paper" : keyHash(account.apiKey()));
            result.add(sessions.computeIfAbsent(key, k -> {
                AccountConfig config = configFor(account);
                log.info("[COMMAND] Opening venue session for {}", config);
                return new AccountSession(config, venueFactory.create(config));
            }));
        }
        return result;
    }

    /**
     * A configured default account keeps its own receive window and base URL; message accounts get the
     * process-wide receive window.
     */
    private AccountConfig configFor(CommandAccount account) {
        for (AccountConfig config : defaultAccounts) {
            if (config.id().equals(account.id()) && config.simulation() == account.simulation()
                    && Objects.equals(config.apiKey(), account.apiKey())
                    && Objects.equals(config.apiSecret(), account.apiSecret())) {
                return config;
            }
        }
        return account.toConfig(recvWindowMs);
    }

    static String keyHash(String apiKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(String.valueOf(apiKey).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public int cachedSessions() {
        return sessions.size();
    }

    @Override
    public void close() {
        sessions.values().forEach(session -> {
            try {
                session.close();
            } catch (RuntimeException e) {
                log.warn("[COMMAND] Error closing session {}: {}", session.accountId(), e.getMessage());
            }
        });
        sessions.clear();
    }
}
