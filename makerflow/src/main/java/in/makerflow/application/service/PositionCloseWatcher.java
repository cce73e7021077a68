package in.makerflow.application.service;

import in.makerflow.domain.order.Side;
import in.makerflow.domain.trade.Trade;
import in.makerflow.domain.trade.TradeStatus;
import in.makerflow.infrastructure.metrics.VenueMetrics;
import in.makerflow.infrastructure.stream.UserDataEvent.OrderUpdate;
import in.makerflow.infrastructure.stream.UserDataEvent.PositionUpdate;
import in.makerflow.infrastructure.stream.UserDataStream;
import in.makerflow.infrastructure.venue.TradingVenue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Completes ACTIVE trades when the user data stream reports their position flat.
 *
 * On close:
 * - the remaining exit orders on the symbol are cancelled (the surviving TP or SL
 *   would otherwise open a new position)
 * - every tracked trade on that account, symbol and side moves to COMPLETED
 *
 * A position in one-way mode (side BOTH) is matched by the direction it was open in.
 */
public class PositionCloseWatcher implements UserDataStream.Listener {
    private static final Logger log = LoggerFactory.getLogger(PositionCloseWatcher.class);

    private final VenueMetrics metrics;
    private final Clock clock;
    private final Map<String, Tracked> byAccount = new ConcurrentHashMap<>();

    public PositionCloseWatcher(VenueMetrics metrics) {
        this(metrics, Clock.systemUTC());
    }

    public PositionCloseWatcher(VenueMetrics metrics, Clock clock) {
        this.metrics = metrics != null ? metrics : VenueMetrics.NOOP;
        this.clock = clock;
    }

    /**
     * Watch a trade until its position closes. Only ACTIVE trades are tracked.
     *
     * @return true if the trade is now tracked
     */
    public boolean track(String accountId, TradingVenue venue, Trade trade) {
        if (trade.getStatus() != TradeStatus.ACTIVE) {
            return false;
        }
        byAccount.computeIfAbsent(accountId, id -> new Tracked(venue)).trades.add(trade);
        log.debug("[TRADE] Watching {} on {} for position close", trade.getTradeId(), accountId);
        return true;
    }

    public int trackedCount() {
        return byAccount.values().stream().mapToInt(t -> t.trades.size()).sum();
    }

    @Override
    public void onPositionClosed(String accountId, PositionUpdate lastOpen) {
        Tracked tracked = byAccount.get(accountId);
        if (tracked == null) {
            return;
        }
        Side side = closedSide(lastOpen);
        List<Trade> closed = new ArrayList<>();
        for (Trade trade : tracked.trades) {
            if (trade.getSymbol().equals(lastOpen.symbol()) && trade.getSide() == side) {
                closed.add(trade);
            }
        }
        if (closed.isEmpty()) {
            return;
        }
        tracked.trades.removeAll(closed);

        tracked.venue.cancelAllOrders(lastOpen.symbol()).whenComplete((ignored, error) -> {
            if (error != null) {
                log.error("[TRADE] Position {} {} closed on {} but leftover exit orders could not be cancelled: {}",
                    lastOpen.symbol(), lastOpen.positionSide(), accountId, error.getMessage());
            }
        });

        for (Trade trade : closed) {
            if (trade.getStatus() != TradeStatus.ACTIVE) {
                continue;
            }
            trade.markCompleted(clock.instant());
            metrics.recordTradeOutcome(TradeStatus.COMPLETED);
            log.info("[TRADE] {} COMPLETED: {} {} position closed on {}", trade.getTradeId(),
                trade.getSymbol(), trade.getSide(), accountId);
        }
    }

    @Override
    public void onOrderUpdate(String accountId, OrderUpdate update) {
        if (update.isFilled()) {
            log.info("[TRADE] {} {} {} filled on {}: {} @ {} (pnl {})", update.symbol(), update.orderType(),
                update.side(), accountId, update.filledQuantity(), update.averagePrice(), update.realizedProfit());
        }
    }

    private static Side closedSide(PositionUpdate lastOpen) {
        switch (lastOpen.positionSide()) {
            case LONG:
                return Side.BUY;
            case SHORT:
                return Side.SELL;
            default:
                return lastOpen.isLong() ? Side.BUY : Side.SELL;
        }
    }

    private static final class Tracked {
        private final TradingVenue venue;
        private final List<Trade> trades = new CopyOnWriteArrayList<>();

        Tracked(TradingVenue venue) {
            this.venue = venue;
        }
    }
}
