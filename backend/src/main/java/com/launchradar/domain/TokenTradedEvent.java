package com.launchradar.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Application event: a buy or sell was recorded. {@code traderAddress} is the counterparty that is not the curve.
 */
public record TokenTradedEvent(
        long chainId,
        String tokenAddress,
        TransactionType side,
        String traderAddress,
        String quoteAmount,
        String tokenAmount,
        String txHash,
        long blockNumber,
        Instant blockTimestamp,
        String tokenPrice,
        BigDecimal tokenPriceUsd,
        String marketCap,
        BigDecimal marketCapUsd,
        String graduationProgress,
        List<HolderSnapshot> holders
) {
}
