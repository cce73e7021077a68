package in.makerflow.application.service;

import in.makerflow.domain.market.Quote;
import in.makerflow.domain.order.OrderRequest;
import in.makerflow.domain.order.OrderResponse;
import in.makerflow.domain.trade.LegError;
import in.makerflow.domain.trade.LegErrorKind;
import in.makerflow.domain.trade.LegStatus;
import in.makerflow.domain.trade.OrderLeg;
import in.makerflow.infrastructure.metrics.VenueMetrics;
import in.makerflow.infrastructure.venue.OrderCancellationException;
import in.makerflow.infrastructure.venue.OrderRejectedException;
import in.makerflow.infrastructure.venue.TradingVenue;
import in.makerflow.infrastructure.venue.VenueException;
import in.makerflow.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Maker entry with cancel-and-replace chasing.
 *
 * Per attempt:
 * 1. Price off the spread (bid - ticks for a buy, ask + ticks for a sell) and submit post-only
 * 2. Poll the order every pollInterval until fillTimeout
 * 3. On timeout cancel; a cancel that loses the race to a fill is confirmed by a status query.
 *    The fill is assumed only when that query itself fails; a confirmed zero execution is unfilled
 * 4. Unfilled after a clean cancel: refresh the quote, check the chase limit against the first
 *    attempt's reference price, resubmit
 *
 * Outcomes are reported on the returned leg, the future itself does not fail:
 * - FILLED: full fill, or the executed part of a partial fill found at cancel time
 * - REJECTED: venue refused the order (no retry)
 * - CANCELLED: retries exhausted, chase limit exceeded or run aborted
 * - FAILED: submission or cancel request failures the retry budget could not absorb
 *
 * Polls and retries are continuations on the injected executor. No thread waits on the venue.
 */
public class EntryExecutionEngine {
    private static final Logger log = LoggerFactory.getLogger(EntryExecutionEngine.class);

    private final QuoteLookup quoteLookup;
    private final VenueMetrics metrics;
    private final Executor executor;
    private final Clock clock;

    public EntryExecutionEngine(QuoteLookup quoteLookup, VenueMetrics metrics, Executor executor) {
        this(quoteLookup, metrics, executor, Clock.systemUTC());
    }

    public EntryExecutionEngine(QuoteLookup quoteLookup, VenueMetrics metrics, Executor executor, Clock clock) {
        this.quoteLookup = quoteLookup;
        this.metrics = metrics != null ? metrics : VenueMetrics.NOOP;
        this.executor = executor;
        this.clock = clock;
    }

    public CompletableFuture<OrderLeg> placeEntry(TradingVenue venue, EntryOrder order, CancellationToken token) {
        return placeEntry(venue, order, OrderLeg.entry(order.quantity()), token, EntryProgressListener.NONE);
    }

    /**
     * Run the entry on an existing leg. The leg is written only by this run.
     *
     * @return future completing with the same leg in a terminal status
     */
    public CompletableFuture<OrderLeg> placeEntry(TradingVenue venue, EntryOrder order, OrderLeg leg,
                                                  CancellationToken token, EntryProgressListener listener) {
        EntryRun run = new EntryRun(venue, order, leg, token, listener != null ? listener : EntryProgressListener.NONE);
        run.submit(order.initialQuote());
        return run.result;
    }

    /**
     * State of one entry run. Every step is a callback on a venue future or a delayed task,
     * so at most one step of a run executes at a time.
     */
    private final class EntryRun {
        private final TradingVenue venue;
        private final EntryOrder order;
        private final OrderLeg leg;
        private final CancellationToken token;
        private final EntryProgressListener listener;
        private final BigDecimal referencePrice;
        private final int maxAttempts;
        private final CompletableFuture<OrderLeg> result = new CompletableFuture<>();

        EntryRun(TradingVenue venue, EntryOrder order, OrderLeg leg, CancellationToken token,
                 EntryProgressListener listener) {
            this.venue = venue;
            this.order = order;
            this.leg = leg;
            this.token = token != null ? token : CancellationToken.create();
            this.listener = listener;
            this.referencePrice = PriceMath.referencePrice(order.side(), order.initialQuote());
            this.maxAttempts = order.params().maxRetries() + 1;
        }

        void submit(Quote quote) {
            if (token.isCancelled()) {
                finish(LegStatus.CANCELLED, LegError.of(LegErrorKind.ABORTED, "Entry aborted before submission"));
                return;
            }
            BigDecimal price = PriceMath.entryPrice(order.side(), quote, order.tickSize(),
                order.params().ticksDistance());
            OrderRequest request = OrderRequest.makerLimit(order.symbol(), order.side(), order.quantity(),
                price, order.positionSide(), order.reduceOnly()).withClientOrderId(newClientOrderId());
            int attempt = leg.getAttempts() + 1;

            log.info("[ENTRY] {} {} {} qty={} @ {} (attempt {}/{}, bid={}, ask={})", venue.getAccountId(),
                order.symbol(), order.side(), order.quantity().toPlainString(), price.toPlainString(),
                attempt, maxAttempts, quote.bestBid().toPlainString(), quote.bestAsk().toPlainString());

            Futures.guard(() -> venue.placeOrder(request))
                .whenComplete((ack, error) -> step(() -> onSubmitted(request, ack, error, attempt)));
        }

        private void onSubmitted(OrderRequest request, OrderResponse ack, Throwable error, int attempt) {
            if (error != null) {
                Throwable cause = Futures.unwrap(error);
                if (cause instanceof OrderRejectedException) {
                    OrderRejectedException rejected = (OrderRejectedException) cause;
                    log.warn("[ENTRY] {} {} entry rejected: {}", venue.getAccountId(), order.symbol(), cause.getMessage());
                    finish(LegStatus.REJECTED,
                        new LegError(LegErrorKind.VENUE_REJECTION, cause.getMessage(), rejected.getVenueCode()));
                    return;
                }
                leg.countAttempt();
                log.warn("[ENTRY] {} {} submission failed (attempt {}/{}): {}", venue.getAccountId(),
                    order.symbol(), attempt, maxAttempts, cause.getMessage());
                retry(LegStatus.FAILED, LegErrorKind.REQUEST_FAILED,
                    "Entry submission failed: " + cause.getMessage(), venueCode(cause));
                return;
            }

            leg.markSubmitted(ack.orderId(), request.price(), clock.instant());
            notifySubmitted(ack);

            if (ack.isFilled()) {
                fill(ack);
                return;
            }
            long deadline = System.nanoTime() + order.params().fillTimeout().toNanos();
            schedulePoll(ack.orderId(), deadline);
        }

        private void notifySubmitted(OrderResponse ack) {
            try {
                listener.onSubmitted(leg, ack, leg.getAttempts());
            } catch (RuntimeException e) {
                log.warn("[ENTRY] Progress listener failed for order {}: {}", ack.orderId(), e.getMessage(), e);
            }
        }

        private void schedulePoll(String orderId, long deadline) {
            Executor delayed = CompletableFuture.delayedExecutor(
                order.params().pollInterval().toMillis(), TimeUnit.MILLISECONDS, executor);
            CompletableFuture.runAsync(() -> step(() -> poll(orderId, deadline)), delayed);
        }

        private void poll(String orderId, long deadline) {
            if (token.isCancelled()) {
                log.info("[ENTRY] {} {} run aborted, cancelling order {}", venue.getAccountId(), order.symbol(), orderId);
                cancel(orderId, true);
                return;
            }
            if (System.nanoTime() - deadline >= 0) {
                log.info("[ENTRY] {} {} order {} not filled within {}ms, cancelling", venue.getAccountId(),
                    order.symbol(), orderId, order.params().fillTimeout().toMillis());
                cancel(orderId, false);
                return;
            }
            Futures.guard(() -> venue.getOrder(order.symbol(), orderId))
                .whenComplete((state, error) -> step(() -> onPolled(orderId, deadline, state, error)));
        }

        private void onPolled(String orderId, long deadline, OrderResponse state, Throwable error) {
            if (error != null) {
                log.debug("[ENTRY] Status query for order {} failed: {}", orderId, Futures.unwrap(error).getMessage());
                schedulePoll(orderId, deadline);
                return;
            }
            switch (state.status()) {
                case FILLED:
                    fill(state);
                    break;
                case PARTIALLY_FILLED:
                    leg.markPartiallyFilled(state.executedQuantity(), state.fillPrice());
                    schedulePoll(orderId, deadline);
                    break;
                case CANCELED:
                case EXPIRED:
                case REJECTED:
                    if (state.hasExecution()) {
                        partialFill(state);
                    } else {
                        // Post-only orders expire when they would cross
                        log.info("[ENTRY] {} {} order {} ended {} unfilled", venue.getAccountId(),
                            order.symbol(), orderId, state.status());
                        retry(LegStatus.CANCELLED, unfilledKind(),
                            "Entry not filled after " + leg.getAttempts() + " attempts", null);
                    }
                    break;
                default:
                    schedulePoll(orderId, deadline);
                    break;
            }
        }

        private void cancel(String orderId, boolean aborting) {
            Futures.guard(() -> venue.cancelOrder(order.symbol(), orderId))
                .whenComplete((state, error) -> step(() -> onCancelled(orderId, aborting, state, error)));
        }

        private void onCancelled(String orderId, boolean aborting, OrderResponse state, Throwable error) {
            if (error != null) {
                Throwable cause = Futures.unwrap(error);
                if (cause instanceof OrderCancellationException && ((OrderCancellationException) cause).isAlreadyFilled()) {
                    log.info("[ENTRY] {} {} order {} filled before cancel, confirming", venue.getAccountId(),
                        order.symbol(), orderId);
                    confirmFill(orderId, aborting);
                    return;
                }
                log.error("[ENTRY] {} {} cancel of order {} failed: {}", venue.getAccountId(), order.symbol(),
                    orderId, cause.getMessage());
                finish(LegStatus.FAILED, new LegError(LegErrorKind.CANCEL_FAILED, cause.getMessage(), venueCode(cause)));
                return;
            }
            if (state.isFilled()) {
                fill(state);
            } else if (state.hasExecution()) {
                partialFill(state);
            } else if (aborting || token.isCancelled()) {
                finish(LegStatus.CANCELLED, LegError.of(LegErrorKind.ABORTED, "Entry aborted, order " + orderId + " cancelled"));
            } else {
                retry(LegStatus.CANCELLED, unfilledKind(),
                    "Entry not filled after " + leg.getAttempts() + " attempts", null);
            }
        }

        private LegErrorKind unfilledKind() {
            return maxAttempts == 1 ? LegErrorKind.FILL_TIMEOUT : LegErrorKind.RETRY_EXHAUSTED;
        }

        private void confirmFill(String orderId, boolean aborting) {
            Futures.guard(() -> venue.getOrder(order.symbol(), orderId))
                .whenComplete((state, error) -> step(() -> {
                    if (error != null) {
                        log.warn("[ENTRY] {} {} could not confirm fill of order {} ({}), assuming full fill at {}",
                            venue.getAccountId(), order.symbol(), orderId, Futures.unwrap(error).getMessage(),
                            leg.getPrice().toPlainString());
                        leg.markFilled(leg.getPrice(), order.quantity(), clock.instant());
                        result.complete(leg);
                        return;
                    }
                    if (state.isFilled()) {
                        fill(state);
                    } else if (state.hasExecution()) {
                        partialFill(state);
                    } else if (!state.status().isTerminal()) {
                        log.error("[ENTRY] {} {} order {} reported filled on cancel but is still {} with nothing executed",
                            venue.getAccountId(), order.symbol(), orderId, state.status());
                        finish(LegStatus.CANCELLED, LegError.of(LegErrorKind.CANCEL_FAILED,
                            "Order " + orderId + " still " + state.status() + " after cancel"));
                    } else if (aborting || token.isCancelled()) {
                        finish(LegStatus.CANCELLED, LegError.of(LegErrorKind.ABORTED,
                            "Entry aborted, order " + orderId + " ended " + state.status()));
                    } else {
                        log.info("[ENTRY] {} {} order {} ended {} with nothing executed", venue.getAccountId(),
                            order.symbol(), orderId, state.status());
                        retry(LegStatus.CANCELLED, unfilledKind(),
                            "Entry not filled after " + leg.getAttempts() + " attempts", null);
                    }
                }));
        }

        /**
         * Next attempt, or the terminal status when the budget or chase limit is used up.
         */
        private void retry(LegStatus exhaustedStatus, LegErrorKind exhaustedKind, String exhaustedMessage,
                           Integer exhaustedCode) {
            if (token.isCancelled()) {
                finish(LegStatus.CANCELLED, LegError.of(LegErrorKind.ABORTED, "Entry aborted"));
                return;
            }
            if (leg.getAttempts() >= maxAttempts) {
                log.warn("[ENTRY] {} {} giving up after {} attempts", venue.getAccountId(), order.symbol(),
                    leg.getAttempts());
                finish(exhaustedStatus, new LegError(exhaustedKind, exhaustedMessage, exhaustedCode));
                return;
            }
            Futures.guard(() -> quoteLookup.fresh(order.symbol()))
                .whenComplete((quote, error) -> step(() -> {
                    if (error != null) {
                        String message = "Quote refresh failed: " + Futures.unwrap(error).getMessage();
                        log.error("[ENTRY] {} {} {}", venue.getAccountId(), order.symbol(), message);
                        finish(LegStatus.FAILED, LegError.of(LegErrorKind.REQUEST_FAILED, message));
                        return;
                    }
                    BigDecimal current = PriceMath.referencePrice(order.side(), quote);
                    BigDecimal deviation = PriceMath.deviationPercent(referencePrice, current);
                    if (deviation.compareTo(order.params().maxChasePercent()) > 0) {
                        String message = String.format("Price moved %s%% from %s to %s, limit %s%%",
                            deviation.stripTrailingZeros().toPlainString(), referencePrice.toPlainString(),
                            current.toPlainString(), order.params().maxChasePercent().toPlainString());
                        log.warn("[ENTRY] {} {} chase limit exceeded: {}", venue.getAccountId(), order.symbol(), message);
                        finish(LegStatus.CANCELLED, LegError.of(LegErrorKind.CHASE_LIMIT_EXCEEDED, message));
                        return;
                    }
                    metrics.recordEntryRetry(order.symbol(), leg.getAttempts() + 1);
                    submit(quote);
                }));
        }

        private void fill(OrderResponse state) {
            BigDecimal executed = state.hasExecution() ? state.executedQuantity() : order.quantity();
            leg.markFilled(state.fillPrice(), executed, clock.instant());
            log.info("[ENTRY] {} {} filled {} @ {} (order {}, attempt {})", venue.getAccountId(), order.symbol(),
                executed.toPlainString(), state.fillPrice().toPlainString(), state.orderId(), leg.getAttempts());
            result.complete(leg);
        }

        private void partialFill(OrderResponse state) {
            leg.markFilled(state.fillPrice(), state.executedQuantity(), clock.instant());
            log.warn("[ENTRY] {} {} partial fill {} of {} @ {} (order {}), remainder cancelled",
                venue.getAccountId(), order.symbol(), state.executedQuantity().toPlainString(),
                order.quantity().toPlainString(), state.fillPrice().toPlainString(), state.orderId());
            result.complete(leg);
        }

        private void finish(LegStatus status, LegError error) {
            if (!leg.getStatus().isTerminal()) {
                leg.markFailed(status, error);
            }
            log.info("[ENTRY] {} {} entry ended {}: {}", venue.getAccountId(), order.symbol(), status, error);
            result.complete(leg);
        }

        /**
         * Run one step; a programming error inside it fails the leg instead of leaving the run hanging.
         */
        private void step(Runnable action) {
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("[ENTRY] {} {} unexpected error: {}", venue.getAccountId(), order.symbol(), e.getMessage(), e);
                finish(LegStatus.FAILED, LegError.of(LegErrorKind.REQUEST_FAILED, "Unexpected error: " + e.getMessage()));
            }
        }
    }

    private static Integer venueCode(Throwable cause) {
        return cause instanceof VenueException ? ((VenueException) cause).getVenueCode() : null;
    }

    private static String newClientOrderId() {
        return "mfe-" + UUID.randomUUID().toString().replace("-", "");
    }
}
