package com.launchradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Append-only liquidity record (graduation, pool add/remove), unique per (txHash, chainId).
 */
@Document(collection = "liquidity_events")
@CompoundIndex(name = "tx_chain", def = "{'txHash': 1, 'chainId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LiquidityEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String txHash;
    private long chainId;
    private String tokenId;
    private String tokenAddress;
    private LiquidityEventType type;
    private String providerAddress;
    private String quoteAmount;
    private String tokenAmount;
    private String tokenPrice;
    private long blockNumber;
    private Instant blockTimestamp;
    private String methodName;
    private String status;
    private Instant createdAt;

    public enum LiquidityEventType {
        ADD,
        REMOVE
    }
}
