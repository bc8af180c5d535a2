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
 * Launched token per (address, chainId). Price, market cap and graduation progress cache the curve's latest
 * observed state; on-chain quantities are base-unit integer strings, prices are 18-decimal strings.
 */
@Document(collection = "tokens")
@CompoundIndex(name = "address_chain", def = "{'address': 1, 'chainId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Token {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String address;
    private long chainId;
    private String name;
    private String symbol;
    private String description;
    private String logoUri;
    private String creatorAddress;
    private String totalSupply;
    /** Quote amount (wei) at which the curve graduates. */
    private String graduationThreshold;
    /** realQuoteReserves * 1e18 / graduationThreshold. */
    private String graduationProgress;
    private String currentPrice;
    private BigDecimal currentPriceUsd;
    /** Wei. */
    private String marketCap;
    private BigDecimal marketCapUsd;
    /** Block of the trade that last set the price; older trades never overwrite it. */
    private Long priceBlockNumber;
    private PricingSource pricingSource;
    private boolean active;
    private Instant graduatedAt;
    private Instant createdAt;
    private Instant updatedAt;

    public enum PricingSource {
        BONDING_CURVE,
        MIGRATED
    }
}
