package in.makerflow.infrastructure.venue;

import java.util.concurrent.CompletableFuture;

/**
 * A venue session that can open a private user data stream.
 *
 * The listen key is scoped to the API key: creating one while a key is active
 * returns the active key and extends it.
 */
public interface UserStreamVenue extends TradingVenue {

    CompletableFuture<String> createListenKey();

    /**
     * Extend the active listen key's validity.
     */
    CompletableFuture<Void> keepAliveListenKey();

    CompletableFuture<Void> closeListenKey();
}
