package com.launchradar.ingestion.event;

import java.math.BigInteger;

/**
 * {@code TokenCreated(address indexed token, address indexed creator, string name, string symbol,
 * string description, string uri, uint256 totalSupply, uint256 virtualEthReserves, uint256 virtualTokenReserves,
 * uint256 graduationEth)}.
 */
public record TokenCreatedLog(
        String tokenAddress,
        String creatorAddress,
        String name,
        String symbol,
        String description,
        String uri,
        BigInteger totalSupply,
        BigInteger virtualQuoteReserves,
        BigInteger virtualTokenReserves,
        BigInteger graduationThreshold
) implements CurveEvent {

    @Override
    public String topic() {
        return CurveEvents.TOKEN_CREATED_TOPIC;
    }
}
