package in.makerflow.application.service;

import in.makerflow.domain.order.PositionSide;
import in.makerflow.domain.trade.EntryParams;
import in.makerflow.domain.trade.LegError;
import in.makerflow.domain.trade.LegStatus;
import in.makerflow.domain.trade.OrderLeg;
import in.makerflow.domain.trade.TakeProfitLevel;
import in.makerflow.domain.trade.Trade;
import in.makerflow.domain.trade.TradeRequest;
import in.makerflow.domain.trade.TradeStatus;
import in.makerflow.domain.trade.TradeValidationException;
import in.makerflow.infrastructure.metrics.VenueMetrics;
import in.makerflow.infrastructure.venue.TradingVenue;
import in.makerflow.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Runs one trade to a settled status: validate, enter, then fan out exits.
 *
 * Status flow:
 * - PENDING → FAILED on validation errors, before any venue call
 * - PENDING → ENTRY_PLACED when the venue accepts the first entry order
 * - → CANCELLED when the entry is rejected, exhausts its retries or exceeds the chase limit
 * - → FAILED when entry requests fail
 * - ENTRY_PLACED → ENTRY_FILLED → ACTIVE when the stop-loss or any take-profit is placed
 * - ENTRY_FILLED → FAILED when no exit leg could be placed (open position without protection)
 *
 * The returned future always completes normally with the trade; outcomes are read from
 * {@link Trade#getStatus()}, the legs and the metadata.
 */
public class TradeLifecycleController {
    private static final Logger log = LoggerFactory.getLogger(TradeLifecycleController.class);

    public static final String ERROR_KIND = "error_kind";
    public static final String ERROR = "error";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String PARTIAL_EXIT_FAILURE = "PARTIAL_EXIT_FAILURE";
    public static final String TOTAL_EXIT_FAILURE = "TOTAL_EXIT_FAILURE";
    public static final String UNEXPECTED_ERROR = "UNEXPECTED_ERROR";

    private final EntryExecutionEngine entryEngine;
    private final ExitFanoutEngine exitEngine;
    private final VenueMetrics metrics;
    private final Clock clock;

    public TradeLifecycleController(EntryExecutionEngine entryEngine, ExitFanoutEngine exitEngine,
                                    VenueMetrics metrics) {
        this(entryEngine, exitEngine, metrics, Clock.systemUTC());
    }

    public TradeLifecycleController(EntryExecutionEngine entryEngine, ExitFanoutEngine exitEngine,
                                    VenueMetrics metrics, Clock clock) {
        this.entryEngine = entryEngine;
        this.exitEngine = exitEngine;
        this.metrics = metrics != null ? metrics : VenueMetrics.NOOP;
        this.clock = clock;
    }

    public CompletableFuture<Trade> execute(TradingVenue venue, TradeRequest request) {
        return execute(venue, request, CancellationToken.create());
    }

    public CompletableFuture<Trade> execute(TradingVenue venue, TradeRequest request, CancellationToken token) {
        Trade trade;
        try {
            trade = newTrade(request);
        } catch (RuntimeException e) {
            // Plan shapes that cannot even resolve their levels
            trade = new Trade(newTradeId(request), request.symbol(), request.side(), request.quantity(),
                List.of(), request.slPercent(), clock.instant());
            return CompletableFuture.completedFuture(
                failValidation(trade, List.of(e.getMessage() != null ? e.getMessage() : e.toString())));
        }
        trade.putMetadata("account_id", venue.getAccountId());

        try {
            TradeValidator.validate(request);
        } catch (TradeValidationException e) {
            return CompletableFuture.completedFuture(failValidation(trade, e.getViolations()));
        }

        log.info("[TRADE] {} {} {} {} qty={} TP={} SL={}%", trade.getTradeId(), venue.getAccountId(),
            request.symbol(), request.side(), request.quantity().toPlainString(),
            describeLevels(trade.getTpLevels()), request.slPercent().toPlainString());

        Trade run = trade;
        PositionSide positionSide = PositionSide.forEntry(request.side(), request.hedgeMode());
        EntryOrder entryOrder = new EntryOrder(request.symbol(), request.side(), request.quantity(),
            request.tickSize(), request.quote(), request.entry(), positionSide, false);

        EntryProgressListener onPlaced = (leg, ack, attempt) -> {
            if (run.getStatus() == TradeStatus.PENDING) {
                run.transitionTo(TradeStatus.ENTRY_PLACED, clock.instant());
            }
        };

        return Futures.guard(() -> entryEngine.placeEntry(venue, entryOrder, run.getEntry(), token, onPlaced))
            .thenCompose(entry -> onEntryFinished(venue, request, run, entry, positionSide))
            .exceptionally(error -> {
                Throwable cause = Futures.unwrap(error);
                log.error("[TRADE] {} unexpected error: {}", run.getTradeId(), cause.getMessage(), cause);
                if (run.getStatus().canTransitionTo(TradeStatus.FAILED)) {
                    run.putMetadata(ERROR_KIND, UNEXPECTED_ERROR);
                    run.putMetadata(ERROR, String.valueOf(cause.getMessage()));
                    run.transitionTo(TradeStatus.FAILED, clock.instant());
                }
                return run;
            })
            .thenApply(this::settle);
    }

    private CompletableFuture<Trade> onEntryFinished(TradingVenue venue, TradeRequest request, Trade trade,
                                                     OrderLeg entry, PositionSide positionSide) {
        if (entry.getStatus() != LegStatus.FILLED) {
            LegError error = entry.getError();
            if (error != null) {
                trade.putMetadata(ERROR_KIND, error.kind().name());
                trade.putMetadata(ERROR, error.message());
            }
            TradeStatus outcome = entry.getStatus() == LegStatus.FAILED ? TradeStatus.FAILED : TradeStatus.CANCELLED;
            trade.transitionTo(outcome, clock.instant());
            return CompletableFuture.completedFuture(trade);
        }

        if (trade.getStatus() == TradeStatus.PENDING) {
            trade.transitionTo(TradeStatus.ENTRY_PLACED, clock.instant());
        }
        trade.transitionTo(TradeStatus.ENTRY_FILLED, clock.instant());
        trade.putMetadata("fill_price", entry.getFillPrice());
        trade.putMetadata("entry_attempts", entry.getAttempts());
        if (entry.getFilledQuantity().compareTo(entry.getQuantity()) < 0) {
            trade.putMetadata("partial_entry", true);
            trade.putMetadata("filled_quantity", entry.getFilledQuantity());
        }

        ExitOrder exitOrder = new ExitOrder(request.symbol(), request.side(), entry.getFillPrice(),
            entry.getFilledQuantity(), trade.getTpLevels(), request.slPercent(), request.filters(), positionSide);
        ExitLegs legs = exitEngine.buildLegs(exitOrder);
        trade.attachExitLegs(legs.takeProfits(), legs.stopLoss());

        return exitEngine.submit(venue, exitOrder, legs).thenApply(placed -> onExitsPlaced(trade, placed));
    }

    private Trade onExitsPlaced(Trade trade, ExitLegs legs) {
        List<OrderLeg> failed = legs.failed();
        if (!legs.anyPlaced()) {
            trade.putMetadata(ERROR_KIND, TOTAL_EXIT_FAILURE);
            trade.putMetadata(ERROR, "No exit order could be placed, position is unprotected");
            trade.transitionTo(TradeStatus.FAILED, clock.instant());
            log.error("[TRADE] {} all {} exit legs failed, position open without protection",
                trade.getTradeId(), failed.size());
            return trade;
        }
        if (!failed.isEmpty()) {
            trade.putMetadata(ERROR_KIND, PARTIAL_EXIT_FAILURE);
            trade.putMetadata("failed_legs", failed.stream()
                .map(OrderLeg::toString)
                .collect(Collectors.toList()));
            log.warn("[TRADE] {} {} of {} exit legs failed", trade.getTradeId(), failed.size(), legs.all().size());
        }
        if (!legs.isStopLossPlaced()) {
            log.warn("[TRADE] {} active without stop-loss", trade.getTradeId());
        }
        trade.transitionTo(TradeStatus.ACTIVE, clock.instant());
        return trade;
    }

    private Trade failValidation(Trade trade, List<String> violations) {
        String message = String.join("; ", violations);
        trade.putMetadata(ERROR_KIND, VALIDATION_ERROR);
        trade.putMetadata(ERROR, message);
        trade.transitionTo(TradeStatus.FAILED, clock.instant());
        log.warn("[TRADE] {} validation failed: {}", trade.getTradeId(), message);
        return settle(trade);
    }

    private Trade settle(Trade trade) {
        metrics.recordTradeOutcome(trade.getStatus());
        log.info("[TRADE] {} finished {}", trade.getTradeId(), trade.getStatus());
        return trade;
    }

    private Trade newTrade(TradeRequest request) {
        Trade trade = new Trade(newTradeId(request), request.symbol(), request.side(), request.quantity(),
            request.takeProfits().levels(), request.slPercent(), clock.instant());
        EntryParams params = request.entry();
        trade.putMetadata("best_bid", request.quote().bestBid());
        trade.putMetadata("best_ask", request.quote().bestAsk());
        trade.putMetadata("tick_size", request.tickSize());
        trade.putMetadata("ticks_distance", params.ticksDistance());
        trade.putMetadata("max_retries", params.maxRetries());
        trade.putMetadata("fill_timeout_ms", params.fillTimeout().toMillis());
        trade.putMetadata("max_chase_percent", params.maxChasePercent());
        return trade;
    }

    private String newTradeId(TradeRequest request) {
        return String.format("trade_%s_%s_%d_%06x", request.symbol(), request.side().name().toLowerCase(Locale.ROOT),
            clock.millis(), ThreadLocalRandom.current().nextInt(0x1000000));
    }

    private static String describeLevels(List<TakeProfitLevel> levels) {
        if (levels.isEmpty()) {
            return "none";
        }
        return levels.stream()
            .map(l -> l.percent().toPlainString() + "%x" + l.fraction().stripTrailingZeros().toPlainString())
            .collect(Collectors.joining(",", "[", "]"));
    }
}
