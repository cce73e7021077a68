package in.makerflow.domain.account;

import java.math.BigDecimal;

/**
 * Wallet balance for one asset.
 */
public record Balance(
    String asset,
    BigDecimal balance,
    BigDecimal availableBalance
) {}
