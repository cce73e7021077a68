package in.makerflow.domain.account;

import java.math.BigDecimal;

/**
 * Account-level margin summary.
 */
public record AccountInfo(
    BigDecimal totalWalletBalance,
    BigDecimal totalUnrealizedProfit,
    BigDecimal availableBalance,
    boolean canTrade
) {}
