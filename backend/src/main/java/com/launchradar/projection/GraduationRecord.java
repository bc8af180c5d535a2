package com.launchradar.projection;

import com.launchradar.domain.ChainId;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Curve graduation of a token into a liquidity pool.
 */
public record GraduationRecord(
        ChainId chain,
        String txHash,
        String tokenAddress,
        BigInteger graduationPrice,
        String curveAddress,
        long blockNumber,
        Instant blockTimestamp
) {
}
