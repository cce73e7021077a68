package in.makerflow.application.pool;

import in.makerflow.domain.account.AccountConfig;
import in.makerflow.infrastructure.venue.TradingVenue;
import in.makerflow.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * One authenticated venue handle inside an account pool.
 */
public final class AccountSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AccountSession.class);

    private final AccountConfig config;
    private final TradingVenue venue;
    private volatile Boolean hedgeMode;

    public AccountSession(AccountConfig config, TradingVenue venue) {
        if (config == null || venue == null) {
            throw new IllegalArgumentException("Account config and venue cannot be null");
        }
        this.config = config;
        this.venue = venue;
    }

    public String accountId() {
        return config.id();
    }

    public AccountConfig config() {
        return config;
    }

    public TradingVenue venue() {
        return venue;
    }

    public boolean isSimulation() {
        return config.simulation();
    }

    /**
     * The account's position mode as the venue reports it, queried once per session.
     * A failed query answers {@code configured} and is repeated on the next call.
     */
    public CompletableFuture<Boolean> hedgeMode(boolean configured) {
        Boolean known = hedgeMode;
        if (known != null) {
            return CompletableFuture.completedFuture(known);
        }
        return Futures.guard(venue::isHedgeMode).handle((mode, error) -> {
            if (error != null) {
                log.warn("[POOL] Account {} position mode unknown ({}), using configured hedge mode {}",
                    accountId(), Futures.unwrap(error).getMessage(), configured);
                return configured;
            }
            if (mode != configured) {
                log.warn("[POOL] Account {} is in {} mode but hedge mode is configured {}, following the venue",
                    accountId(), mode ? "hedge" : "one-way", configured);
            }
            hedgeMode = mode;
            return mode;
        });
    }

    @Override
    public void close() {
        venue.close();
    }

    @Override
    public String toString() {
        return "AccountSession{" + config + "}";
    }
}
