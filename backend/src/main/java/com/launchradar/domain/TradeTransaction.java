package com.launchradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Trade record, unique per (txHash, chainId). Trade fields are never mutated after insert; {@code applied} turns true
 * once the token price and holder balances reflect the trade.
 */
@Document(collection = "transactions")
@CompoundIndexes({
        @CompoundIndex(name = "tx_chain", def = "{'txHash': 1, 'chainId': 1}", unique = true),
        @CompoundIndex(name = "token_chain_block", def = "{'tokenAddress': 1, 'chainId': 1, 'blockNumber': -1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TradeTransaction {

    public static final String STATUS_CONFIRMED = "CONFIRMED";

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String txHash;
    private long chainId;
    private String tokenId;
    private String tokenAddress;
    private TransactionType type;
    private String senderAddress;
    private String recipientAddress;
    /** Wei. */
    private String quoteAmount;
    private String tokenAmount;
    private String tokenPrice;
    private BigDecimal tokenPriceUsd;
    private long blockNumber;
    private Instant blockTimestamp;
    private String status;
    private String methodName;
    private boolean applied;
    private Instant createdAt;
}
