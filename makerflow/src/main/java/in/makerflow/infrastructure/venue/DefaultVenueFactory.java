package in.makerflow.infrastructure.venue;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.makerflow.config.VenueConfig;
import in.makerflow.domain.account.AccountConfig;
import in.makerflow.infrastructure.metrics.VenueMetrics;
import in.makerflow.infrastructure.venue.paper.PaperTradingVenue;
import in.makerflow.infrastructure.venue.rest.FuturesRestVenue;

import java.net.http.HttpClient;

/**
 * Simulation accounts get a PaperTradingVenue, all others a signed FuturesRestVenue
 * sharing one HttpClient.
 */
public class DefaultVenueFactory implements VenueFactory {

    private final VenueConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final VenueMetrics metrics;

    public DefaultVenueFactory(VenueConfig config, HttpClient httpClient, ObjectMapper mapper,
                               VenueMetrics metrics) {
        this.config = config;
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.metrics = metrics;
    }

    @Override
    public TradingVenue create(AccountConfig account) {
        if (account.simulation()) {
            return new PaperTradingVenue(account.id());
        }
        return new FuturesRestVenue(account, config, httpClient, mapper, metrics);
    }
}
