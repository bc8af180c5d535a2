package com.launchradar.ingestion.adapter;

import com.launchradar.domain.ChainId;
import com.launchradar.ingestion.config.IngestionChainProperties;
import com.launchradar.ingestion.config.IngestionChainProperties.ChainEntry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Resolves per-chain configuration. Validated at startup: a default chain without RPC URL or contract address
 * aborts the application; other incomplete chains are excluded with a warning.
 */
@Slf4j
@Component
public class ChainRegistry {

    private final IngestionChainProperties properties;
    private volatile List<ChainId> configuredChains = List.of();
    private volatile ChainId defaultChain;

    public ChainRegistry(IngestionChainProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void validate() {
        defaultChain = parseChain(properties.getDefaultChain())
                .orElseThrow(() -> new ChainConfigurationException("Unknown default chain: " + properties.getDefaultChain()));
        for (String key : properties.getChain().keySet()) {
            if (parseChain(key).isEmpty()) {
                log.warn("Ignoring configuration for unsupported chain {}", key);
            }
        }
        List<ChainId> chains = new ArrayList<>();
        for (ChainId chain : ChainId.values()) {
            if (isComplete(chain)) {
                chains.add(chain);
            } else if (chain == defaultChain) {
                throw new ChainConfigurationException("Default chain " + chain
                        + " requires rpc-urls and contract-address under launchradar.ingestion.chain." + chain.name());
            } else if (properties.getChain().containsKey(chain.name())) {
                log.warn("Chain {} excluded: rpc-urls or contract-address missing", chain);
            }
        }
        configuredChains = Collections.unmodifiableList(chains);
        log.info("Configured chains: {} (default {})", configuredChains, defaultChain);
    }

    public ChainId defaultChain() {
        return defaultChain;
    }

    public List<ChainId> configuredChains() {
        return configuredChains;
    }

    public boolean isConfigured(ChainId chain) {
        return configuredChains.contains(chain);
    }

    public List<String> rpcUrls(ChainId chain) {
        return requireConfigured(chain).getRpcUrls().stream()
                .filter(u -> u != null && !u.isBlank())
                .map(String::strip)
                .toList();
    }

    public String contractAddress(ChainId chain) {
        return requireConfigured(chain).getContractAddress().toLowerCase();
    }

    public Optional<String> wsUrl(ChainId chain) {
        ChainEntry entry = properties.getChain().get(chain.name());
        if (entry == null || entry.getWsUrl() == null || entry.getWsUrl().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(entry.getWsUrl().strip());
    }

    public Optional<Long> startBlock(ChainId chain) {
        ChainEntry entry = properties.getChain().get(chain.name());
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.getStartBlock());
    }

    private ChainEntry requireConfigured(ChainId chain) {
        if (!isConfigured(chain)) {
            throw new ChainConfigurationException("Chain " + chain + " is not configured");
        }
        return properties.getChain().get(chain.name());
    }

    private boolean isComplete(ChainId chain) {
        ChainEntry entry = properties.getChain().get(chain.name());
        return entry != null
                && entry.getRpcUrls().stream().anyMatch(u -> u != null && !u.isBlank())
                && entry.getContractAddress() != null && !entry.getContractAddress().isBlank();
    }

    private static Optional<ChainId> parseChain(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.strip().toUpperCase();
        for (ChainId chain : ChainId.values()) {
            if (chain.name().equals(normalized) || String.valueOf(chain.id()).equals(normalized)) {
                return Optional.of(chain);
            }
        }
        return Optional.empty();
    }
}
