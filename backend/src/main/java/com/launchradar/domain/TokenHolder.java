package com.launchradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Holder balance per (tokenAddress, holderAddress, chainId). Rows stay at zero balance.
 * {@code percentage} is recomputed from the whole holder set, never adjusted by deltas.
 * <p>
 * {@code netDelta} is the unclamped sum of all trade deltas. A row touched by trades before the token launch was
 * projected is unseeded; seeding it adds the initial balance to {@code netDelta}. {@code revision} guards every
 * compare-and-set and {@code recentTransactionHashes} keeps a replayed trade from applying twice.
 */
@Document(collection = "token_holders")
@CompoundIndex(name = "token_holder_chain", def = "{'tokenAddress': 1, 'holderAddress': 1, 'chainId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class TokenHolder {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String tokenId;
    private String tokenAddress;
    private String holderAddress;
    private long chainId;
    /** Base units. */
    private String balance;
    private double percentage;
    private String firstTransactionHash;
    private String lastTransactionHash;
    private long transactionCount;
    private boolean seeded;
    private String netDelta;
    private long revision;
    private List<String> recentTransactionHashes;
    private Instant createdAt;
    private Instant updatedAt;
}
