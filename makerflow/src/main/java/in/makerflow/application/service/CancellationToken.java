package in.makerflow.application.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for one trade run.
 * The entry engine checks it between polls and before each submission.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * @return true if this call cancelled the token
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
