package com.launchradar.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-chain endpoints and contract. Key = ChainId name (e.g. BASE, BASE_SEPOLIA).
 * A chain counts as configured only with at least one RPC URL and a contract address.
 */
@ConfigurationProperties(prefix = "launchradar.ingestion")
@NoArgsConstructor
@Getter
@Setter
public class IngestionChainProperties {

    /** ChainId name of the chain whose misconfiguration is fatal at startup. */
    private String defaultChain = "BASE_SEPOLIA";

    private Map<String, ChainEntry> chain = new HashMap<>();

    public void setChain(Map<String, ChainEntry> chain) {
        this.chain = chain != null ? chain : new HashMap<>();
    }

    /**
     * One chain's HTTP RPC URLs (round-robin), socket URL and bonding-curve contract.
     * {@code startBlock} overrides the global backfill start block for this chain.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class ChainEntry {

        private List<String> rpcUrls = new ArrayList<>();
        private String wsUrl;
        private String contractAddress;
        private Long startBlock;

        public void setRpcUrls(List<String> rpcUrls) {
            this.rpcUrls = rpcUrls != null ? rpcUrls : new ArrayList<>();
        }
    }
}
