package in.makerflow.application.service;

import in.makerflow.domain.order.OrderResponse;
import in.makerflow.domain.trade.OrderLeg;

/**
 * Callback for entry order progress, used by the lifecycle controller to record ENTRY_PLACED.
 */
public interface EntryProgressListener {

    /**
     * The venue accepted an entry submission. Called once per attempt.
     */
    void onSubmitted(OrderLeg leg, OrderResponse ack, int attempt);

    EntryProgressListener NONE = (leg, ack, attempt) -> { };
}
