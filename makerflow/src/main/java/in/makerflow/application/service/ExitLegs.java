package in.makerflow.application.service;

import in.makerflow.domain.trade.LegStatus;
import in.makerflow.domain.trade.OrderLeg;

import java.util.ArrayList;
import java.util.List;

/**
 * Exit legs of one trade: take-profits in level order plus the stop-loss (null when none requested).
 */
public record ExitLegs(List<OrderLeg> takeProfits, OrderLeg stopLoss) {

    public ExitLegs {
        takeProfits = List.copyOf(takeProfits);
    }

    public List<OrderLeg> all() {
        List<OrderLeg> legs = new ArrayList<>(takeProfits);
        if (stopLoss != null) {
            legs.add(stopLoss);
        }
        return legs;
    }

    public boolean isStopLossPlaced() {
        return stopLoss != null && stopLoss.isPlaced();
    }

    public long placedTakeProfits() {
        return takeProfits.stream().filter(OrderLeg::isPlaced).count();
    }

    public boolean anyPlaced() {
        return isStopLossPlaced() || placedTakeProfits() > 0;
    }

    public List<OrderLeg> failed() {
        List<OrderLeg> failed = new ArrayList<>();
        for (OrderLeg leg : all()) {
            LegStatus status = leg.getStatus();
            if (status == LegStatus.FAILED || status == LegStatus.REJECTED || status == LegStatus.CANCELLED) {
                failed.add(leg);
            }
        }
        return failed;
    }
}
