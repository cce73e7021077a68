package in.makerflow.infrastructure.venue;

import in.makerflow.domain.account.AccountConfig;

/**
 * Creates a venue session for an account.
 */
@FunctionalInterface
public interface VenueFactory {

    TradingVenue create(AccountConfig account);
}
