package in.makerflow.application.command;

import in.makerflow.domain.account.AccountConfig;

import java.math.BigDecimal;

/**
 * Account entry of a command message.
 *
 * @param quantity per-account order quantity, or null to use the command quantity
 */
public record CommandAccount(
    String id,
    String apiKey,
    String apiSecret,
    BigDecimal quantity,
    boolean simulation
) {
    public CommandAccount {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Account id cannot be null or empty");
        }
    }

    public static CommandAccount of(AccountConfig config, BigDecimal quantity) {
        return new CommandAccount(config.id(), config.apiKey(), config.apiSecret(), quantity, config.simulation());
    }

    public AccountConfig toConfig(long recvWindowMs) {
        return new AccountConfig(id, apiKey, apiSecret, simulation, recvWindowMs, null);
    }

    @Override
    public String toString() {
        String masked = apiKey == null || apiKey.isEmpty() ? ""
            : "****" + (apiKey.length() > 4 ? apiKey.substring(apiKey.length() - 4) : "");
        return "CommandAccount{id=" + id + ", apiKey=" + masked + ", quantity=" + quantity
            + ", simulation=" + simulation + "}";
    }
}
