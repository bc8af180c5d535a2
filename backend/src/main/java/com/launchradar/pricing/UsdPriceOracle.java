package com.launchradar.pricing;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ETH price in USD for the projector's USD fields. A fetched rate is served for the TTL; on expiry providers are
 * asked in order. When all fail the last known rate is returned, and the configured default only if no provider
 * ever answered. Never throws.
 */
@Slf4j
public class UsdPriceOracle {

    private static final String ETH_USD = "ETH/USD";

    private final List<UsdPriceProvider> providers;
    private final BigDecimal defaultPrice;
    private final Cache<String, BigDecimal> cache;
    private final AtomicReference<BigDecimal> lastKnown = new AtomicReference<>();

    public UsdPriceOracle(List<UsdPriceProvider> providers, Duration ttl, BigDecimal defaultPrice, Ticker ticker) {
        this.providers = List.copyOf(providers);
        this.defaultPrice = defaultPrice;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(1)
                .ticker(ticker)
                .build();
    }

    public BigDecimal getUsdPrice() {
        BigDecimal fresh = cache.get(ETH_USD, key -> fetch().orElse(null));
        if (fresh != null) {
            return fresh;
        }
        BigDecimal stale = lastKnown.get();
        if (stale != null) {
            log.warn("All ETH price providers failed, serving last known rate {}", stale);
            return stale;
        }
        log.warn("All ETH price providers failed and no rate cached, using default {}", defaultPrice);
        return defaultPrice;
    }

    /**
     * Drops the fresh entry so the next call asks the providers. The last known rate is kept.
     */
    public void clearCache() {
        cache.invalidateAll();
    }

    private Optional<BigDecimal> fetch() {
        for (UsdPriceProvider provider : providers) {
            Optional<BigDecimal> price = provider.fetchEthUsd();
            if (price.isPresent()) {
                log.debug("ETH/USD {} from {}", price.get(), provider.name());
                lastKnown.set(price.get());
                return price;
            }
            log.info("ETH price provider {} returned nothing, trying next", provider.name());
        }
        return Optional.empty();
    }
}
