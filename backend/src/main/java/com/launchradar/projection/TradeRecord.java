package com.launchradar.projection;

import com.launchradar.domain.ChainId;
import com.launchradar.domain.TransactionType;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One curve trade. Tokens move from {@code senderAddress} to {@code recipientAddress}; for a buy the sender is the
 * curve, for a sell the recipient is. {@code realQuoteReserves} is the curve's quote balance after the trade.
 */
public record TradeRecord(
        ChainId chain,
        String txHash,
        String tokenAddress,
        TransactionType type,
        String senderAddress,
        String recipientAddress,
        BigInteger quoteAmount,
        BigInteger tokenAmount,
        BigInteger realQuoteReserves,
        long blockNumber,
        Instant blockTimestamp
) {

    /** The counterparty that is not the curve. */
    public String traderAddress() {
        return type == TransactionType.SOLD ? senderAddress : recipientAddress;
    }
}
