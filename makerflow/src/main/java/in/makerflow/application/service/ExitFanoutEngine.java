package in.makerflow.application.service;

import in.makerflow.domain.order.OrderRequest;
import in.makerflow.domain.order.OrderResponse;
import in.makerflow.domain.order.Side;
import in.makerflow.domain.trade.ExitPrices;
import in.makerflow.domain.trade.LegError;
import in.makerflow.domain.trade.LegErrorKind;
import in.makerflow.domain.trade.LegStatus;
import in.makerflow.domain.trade.OrderLeg;
import in.makerflow.infrastructure.venue.OrderRejectedException;
import in.makerflow.infrastructure.venue.TradingVenue;
import in.makerflow.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Places the take-profit and stop-loss orders for a filled entry.
 *
 * Legs:
 * - Take-profit: post-only limit, reduce-only, opposite side, quantity split by level fraction
 * - Stop-loss: stop-market with closePosition, opposite side
 *
 * All legs are submitted together and each records its own outcome. A failed leg never
 * cancels or delays its siblings. Every leg is submitted at most once.
 */
public class ExitFanoutEngine {
    private static final Logger log = LoggerFactory.getLogger(ExitFanoutEngine.class);

    private final Clock clock;

    public ExitFanoutEngine() {
        this(Clock.systemUTC());
    }

    public ExitFanoutEngine(Clock clock) {
        this.clock = clock;
    }

    /**
     * Compute prices and quantities and create the (unsubmitted) legs.
     */
    public ExitLegs buildLegs(ExitOrder order) {
        ExitPrices prices = PriceMath.exitPrices(order.fillPrice(), order.entrySide(), order.levels(),
            order.slPercent(), order.filters().tickSize());
        List<BigDecimal> quantities = QuantityAllocator.allocate(order.filledQuantity(), order.levels(),
            order.filters().stepSize());

        List<OrderLeg> tps = new ArrayList<>(order.levels().size());
        for (int i = 0; i < order.levels().size(); i++) {
            tps.add(OrderLeg.takeProfit(i, quantities.get(i), prices.takeProfitPrices().get(i)));
        }
        OrderLeg sl = prices.stopLossPrice() == null ? null
            : OrderLeg.stopLoss(order.filledQuantity(), prices.stopLossPrice());
        return new ExitLegs(tps, sl);
    }

    public CompletableFuture<ExitLegs> placeExits(TradingVenue venue, ExitOrder order) {
        return submit(venue, order, buildLegs(order));
    }

    /**
     * Submit every leg concurrently.
     *
     * @return future completing with the same legs once every submission has an outcome; never fails
     */
    public CompletableFuture<ExitLegs> submit(TradingVenue venue, ExitOrder order, ExitLegs legs) {
        List<CompletableFuture<Void>> submissions = new ArrayList<>();

        if (legs.stopLoss() != null) {
            OrderLeg sl = legs.stopLoss();
            if (isOnLossSide(order, sl.getPrice())) {
                OrderRequest request = OrderRequest.stopClose(order.symbol(), order.exitSide(), sl.getPrice(),
                    order.positionSide());
                submissions.add(submitLeg(venue, sl, request));
            } else {
                rejectLocally(venue, sl, "Stop price " + sl.getPrice().toPlainString()
                    + " is not beyond fill " + order.fillPrice().toPlainString());
            }
        }

        for (OrderLeg tp : legs.takeProfits()) {
            if (tp.getQuantity().signum() <= 0) {
                rejectLocally(venue, tp, "Take-profit " + (tp.getIndex() + 1) + " has no quantity");
            } else if (!isOnProfitSide(order, tp.getPrice())) {
                rejectLocally(venue, tp, "Take-profit price " + tp.getPrice().toPlainString()
                    + " is not beyond fill " + order.fillPrice().toPlainString());
            } else {
                OrderRequest request = OrderRequest.makerLimit(order.symbol(), order.exitSide(), tp.getQuantity(),
                    tp.getPrice(), order.positionSide(), true);
                submissions.add(submitLeg(venue, tp, request));
            }
        }

        return CompletableFuture.allOf(submissions.toArray(new CompletableFuture[0]))
            .thenApply(v -> {
                log.info("[EXIT] {} {} exits placed: SL {} TP {}/{}", venue.getAccountId(), order.symbol(),
                    legs.isStopLossPlaced() ? "ok" : (legs.stopLoss() == null ? "none" : "failed"),
                    legs.placedTakeProfits(), legs.takeProfits().size());
                return legs;
            });
    }

    /**
     * The returned future only completes normally; the outcome is written to the leg.
     */
    private CompletableFuture<Void> submitLeg(TradingVenue venue, OrderLeg leg, OrderRequest request) {
        return Futures.guard(() -> venue.placeOrder(request))
            .handle((OrderResponse ack, Throwable error) -> {
                if (error == null) {
                    leg.markSubmitted(ack.orderId(), leg.getPrice(), clock.instant());
                    log.info("[EXIT] {} {} {} order {} @ {}", venue.getAccountId(), request.symbol(),
                        legName(leg), ack.orderId(), leg.getPrice().toPlainString());
                    return null;
                }
                Throwable cause = Futures.unwrap(error);
                if (cause instanceof OrderRejectedException) {
                    leg.markFailed(LegStatus.REJECTED, new LegError(LegErrorKind.VENUE_REJECTION,
                        cause.getMessage(), ((OrderRejectedException) cause).getVenueCode()));
                } else {
                    leg.markFailed(LegStatus.FAILED, LegError.of(LegErrorKind.REQUEST_FAILED, cause.getMessage()));
                }
                log.error("[EXIT] {} {} {} failed: {}", venue.getAccountId(), request.symbol(), legName(leg),
                    cause.getMessage());
                return null;
            });
    }

    private void rejectLocally(TradingVenue venue, OrderLeg leg, String message) {
        leg.markFailed(LegStatus.FAILED, LegError.of(LegErrorKind.REQUEST_FAILED, message));
        log.error("[EXIT] {} {} not submitted: {}", venue.getAccountId(), legName(leg), message);
    }

    private static boolean isOnProfitSide(ExitOrder order, BigDecimal price) {
        int cmp = price.compareTo(order.fillPrice());
        return order.entrySide() == Side.BUY ? cmp > 0 : cmp < 0;
    }

    private static boolean isOnLossSide(ExitOrder order, BigDecimal price) {
        if (price.signum() <= 0) {
            return false;
        }
        int cmp = price.compareTo(order.fillPrice());
        return order.entrySide() == Side.BUY ? cmp < 0 : cmp > 0;
    }

    private static String legName(OrderLeg leg) {
        switch (leg.getRole()) {
            case TAKE_PROFIT:
                return "TP" + (leg.getIndex() + 1);
            case STOP_LOSS:
                return "SL";
            default:
                return leg.getRole().name();
        }
    }
}
