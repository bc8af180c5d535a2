package com.launchradar.ingestion.event;

import com.launchradar.domain.TransactionType;

import java.math.BigInteger;

/**
 * {@code TokenBought} or {@code TokenSold}; both carry the trader, the two amounts and the reserves after the trade.
 * The ABI orders the amounts differently (buy: eth, token; sell: token, eth); fields here are normalized.
 */
public record TokenTradeLog(
        TransactionType side,
        String tokenAddress,
        String traderAddress,
        BigInteger quoteAmount,
        BigInteger tokenAmount,
        BigInteger realQuoteReserves,
        BigInteger realTokenReserves,
        BigInteger virtualQuoteReserves,
        BigInteger virtualTokenReserves
) implements CurveEvent {

    @Override
    public String topic() {
        return side == TransactionType.BOUGHT ? CurveEvents.TOKEN_BOUGHT_TOPIC : CurveEvents.TOKEN_SOLD_TOPIC;
    }
}
