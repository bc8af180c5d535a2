package com.launchradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Price snapshot for charts, unique per (tokenAddress, chainId, timestamp). Insert-once.
 */
@Document(collection = "token_histories")
@CompoundIndex(name = "token_chain_timestamp", def = "{'tokenAddress': 1, 'chainId': 1, 'timestamp': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TokenHistory {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String tokenId;
    private String tokenAddress;
    private long chainId;
    private String tokenPrice;
    private BigDecimal priceUsd;
    private String marketCap;
    private BigDecimal marketCapUsd;
    private long blockNumber;
    private Instant timestamp;
    private long holdersCount;
    private long transactionsCount;
}
