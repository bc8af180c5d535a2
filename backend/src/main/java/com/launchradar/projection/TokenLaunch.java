package com.launchradar.projection;

import com.launchradar.domain.ChainId;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Everything known about a token at creation. {@code curveAddress} is the bonding-curve contract that holds the
 * whole supply initially.
 */
public record TokenLaunch(
        ChainId chain,
        String tokenAddress,
        String creatorAddress,
        String name,
        String symbol,
        String description,
        String logoUri,
        BigInteger totalSupply,
        BigInteger graduationThreshold,
        String curveAddress,
        String txHash,
        long blockNumber,
        Instant blockTimestamp
) {
}
