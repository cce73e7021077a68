package in.makerflow.domain.trade;

import in.makerflow.domain.order.Side;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Trade aggregate: entry leg, take-profit legs and stop-loss leg of one trade run.
 *
 * Lifecycle: PENDING → ENTRY_PLACED → ENTRY_FILLED → ACTIVE | CANCELLED | FAILED,
 * ACTIVE → COMPLETED only through {@link #markCompleted(Instant)}.
 *
 * Status never moves backwards. Exit legs are attached once, after the entry fill.
 * The stop-loss leg is null until then.
 */
public class Trade {

    private final String tradeId;
    private final String symbol;
    private final Side side;
    private final OrderLeg entry;
    private final List<TakeProfitLevel> tpLevels;
    private final BigDecimal slPercent;
    private final Instant createdAt;
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    private List<OrderLeg> takeProfits = List.of();
    private OrderLeg stopLoss;
    private TradeStatus status = TradeStatus.PENDING;
    private Instant filledAt;
    private Instant closedAt;

    public Trade(String tradeId, String symbol, Side side, BigDecimal quantity,
                 List<TakeProfitLevel> tpLevels, BigDecimal slPercent, Instant createdAt) {
        if (tradeId == null || tradeId.isBlank()) {
            throw new IllegalArgumentException("Trade id cannot be null or empty");
        }
        this.tradeId = tradeId;
        this.symbol = symbol;
        this.side = side;
        this.entry = OrderLeg.entry(quantity);
        this.tpLevels = tpLevels == null ? List.of() : List.copyOf(tpLevels);
        this.slPercent = slPercent;
        this.createdAt = createdAt;
    }

    /**
     * Advance the status.
     *
     * @throws IllegalStateException if the transition would skip or move backwards
     */
    public synchronized void transitionTo(TradeStatus next, Instant at) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                String.format("Trade %s cannot move from %s to %s", tradeId, status, next));
        }
        status = next;
        if (next == TradeStatus.ENTRY_FILLED) {
            filledAt = at;
        } else if (next.isTerminal()) {
            closedAt = at;
        }
    }

    /**
     * Externally observed position closure (TP or SL executed).
     */
    public void markCompleted(Instant at) {
        transitionTo(TradeStatus.COMPLETED, at);
    }

    public synchronized void attachExitLegs(List<OrderLeg> tpLegs, OrderLeg slLeg) {
        if (status != TradeStatus.ENTRY_FILLED) {
            throw new IllegalStateException("Exit legs can only be attached after the entry fill, status " + status);
        }
        if (stopLoss != null) {
            throw new IllegalStateException("Exit legs already attached to trade " + tradeId);
        }
        if (tpLegs.size() > TakeProfitPlan.MAX_LEVELS) {
            throw new IllegalArgumentException("At most " + TakeProfitPlan.MAX_LEVELS + " take-profit legs");
        }
        this.takeProfits = List.copyOf(tpLegs);
        this.stopLoss = slLeg;
    }

    public synchronized void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    public String getTradeId() {
        return tradeId;
    }

    public String getSymbol() {
        return symbol;
    }

    public Side getSide() {
        return side;
    }

    public OrderLeg getEntry() {
        return entry;
    }

    public synchronized List<OrderLeg> getTakeProfits() {
        return takeProfits;
    }

    public synchronized OrderLeg getStopLoss() {
        return stopLoss;
    }

    public synchronized TradeStatus getStatus() {
        return status;
    }

    public List<TakeProfitLevel> getTpLevels() {
        return tpLevels;
    }

    public BigDecimal getSlPercent() {
        return slPercent;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized Instant getFilledAt() {
        return filledAt;
    }

    public synchronized Instant getClosedAt() {
        return closedAt;
    }

    public synchronized Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * All legs in submission order: entry, take-profits, stop-loss.
     */
    public synchronized List<OrderLeg> allLegs() {
        List<OrderLeg> legs = new ArrayList<>();
        legs.add(entry);
        legs.addAll(takeProfits);
        if (stopLoss != null) {
            legs.add(stopLoss);
        }
        return legs;
    }

    @Override
    public synchronized String toString() {
        return "Trade{" + tradeId + ", " + symbol + " " + side + ", status=" + status + "}";
    }
}
