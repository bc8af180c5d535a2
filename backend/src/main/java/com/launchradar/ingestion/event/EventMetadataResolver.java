package com.launchradar.ingestion.event;

import com.fasterxml.jackson.databind.JsonNode;
import com.launchradar.ingestion.adapter.ChainReadClient;
import com.launchradar.ingestion.config.ListenerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Resolves transaction hash and block number of a pushed event, whatever shape the provider wrapped it in.
 * Priority:
 * <ol>
 *     <li>nested {@code log} object ({@code log.transactionHash}, {@code log.blockNumber});</li>
 *     <li>direct properties on the wrapper ({@code transactionHash} or {@code hash}, {@code blockNumber});</li>
 *     <li>contract logs of the same event and token over the last {@code metadataLookbackBlocks} blocks,
 *     latest match wins;</li>
 *     <li>receipt lookup when a hash is known but the block number is not.</li>
 * </ol>
 * Empty when no hash is found; such events are left to the backfill scanner.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventMetadataResolver {

    private final ListenerProperties listenerProperties;

    public Optional<EventMetadata> resolve(JsonNode wrapper, CurveEvent event, ChainReadClient client) {
        String txHash = null;
        Long blockNumber = null;
        long logIndex = 0;
        EventMetadata.Source source = null;

        JsonNode nested = wrapper.path("log");
        if (nested.isObject()) {
            txHash = hash(nested);
            blockNumber = parseQuantity(nested.path("blockNumber"));
            logIndex = orZero(parseQuantity(nested.path("logIndex")));
            source = txHash != null ? EventMetadata.Source.NESTED_LOG : null;
        }
        if (txHash == null) {
            txHash = hash(wrapper);
            Long directBlock = parseQuantity(wrapper.path("blockNumber"));
            if (directBlock != null) {
                blockNumber = directBlock;
            }
            Long directIndex = parseQuantity(wrapper.path("logIndex"));
            if (directIndex != null) {
                logIndex = directIndex;
            }
            source = txHash != null ? EventMetadata.Source.DIRECT : null;
        }
        if (txHash == null) {
            Optional<JsonNode> match = queryRecentLogs(event, client);
            if (match.isPresent()) {
                JsonNode found = match.get();
                txHash = hash(found);
                blockNumber = parseQuantity(found.path("blockNumber"));
                logIndex = orZero(parseQuantity(found.path("logIndex")));
                source = EventMetadata.Source.LOG_QUERY;
            }
        }
        if (txHash == null) {
            log.warn("Dropping {} for token {} on {}: no transaction hash in event or recent logs",
                    event.getClass().getSimpleName(), event.tokenAddress(), client.chain());
            return Optional.empty();
        }
        if (blockNumber == null) {
            blockNumber = blockFromReceipt(txHash, client);
            if (blockNumber != null) {
                source = EventMetadata.Source.RECEIPT;
            }
        }
        if (blockNumber == null) {
            log.warn("Block number unknown for tx {} on {}", txHash, client.chain());
        }
        return Optional.of(new EventMetadata(txHash, orZero(blockNumber), logIndex, source));
    }

    private Optional<JsonNode> queryRecentLogs(CurveEvent event, ChainReadClient client) {
        try {
            long head = client.getBlockNumber();
            long from = Math.max(0, head - listenerProperties.getMetadataLookbackBlocks());
            List<JsonNode> logs = client.getLogs(from, head, List.of(event.topic()),
                    CurveEvents.addressTopic(event.tokenAddress()));
            return logs.isEmpty() ? Optional.empty() : Optional.of(logs.get(logs.size() - 1));
        } catch (RuntimeException e) {
            log.warn("Recent log lookup for {} on {} failed: {}", event.tokenAddress(), client.chain(), e.getMessage());
            return Optional.empty();
        }
    }

    private Long blockFromReceipt(String txHash, ChainReadClient client) {
        try {
            return client.getTransactionReceipt(txHash)
                    .map(receipt -> parseQuantity(receipt.path("blockNumber")))
                    .orElse(null);
        } catch (RuntimeException e) {
            log.warn("Receipt lookup for {} on {} failed: {}", txHash, client.chain(), e.getMessage());
            return null;
        }
    }

    private static String hash(JsonNode node) {
        String txHash = text(node.path("transactionHash"));
        return txHash != null ? txHash : text(node.path("hash"));
    }

    private static String text(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String value = node.asText("").strip();
        return value.isEmpty() ? null : value.toLowerCase();
    }

    /**
     * Hex ({@code 0x..}) or decimal quantity, as string or number. Null when absent or unparseable.
     */
    public static Long parseQuantity(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        String value = node.asText("").strip();
        try {
            if (value.startsWith("0x") || value.startsWith("0X")) {
                return value.length() > 2 ? Long.parseLong(value.substring(2), 16) : null;
            }
            return value.isEmpty() ? null : Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
