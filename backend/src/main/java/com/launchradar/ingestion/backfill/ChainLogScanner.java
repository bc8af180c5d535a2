package com.launchradar.ingestion.backfill;

import com.fasterxml.jackson.databind.JsonNode;
import com.launchradar.ingestion.adapter.ChainReadClient;
import com.launchradar.ingestion.adapter.RpcErrors;
import com.launchradar.ingestion.config.BackfillProperties;
import com.launchradar.ingestion.event.CurveEvent;
import com.launchradar.ingestion.event.CurveEventProcessor;
import com.launchradar.ingestion.event.CurveEvents;
import com.launchradar.ingestion.event.CurveLogDecoder;
import com.launchradar.ingestion.event.EventMetadata;
import com.launchradar.ingestion.event.EventMetadataResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replays every curve event of a block range through the {@link CurveEventProcessor}, in (block, logIndex) order.
 * Ranges the RPC rejects as too wide are split in halves down to {@code minSplitBlocks}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChainLogScanner {

    private static final Comparator<JsonNode> CHAIN_ORDER = Comparator
            .comparingLong((JsonNode entry) -> quantity(entry, "blockNumber"))
            .thenComparingLong(entry -> quantity(entry, "logIndex"));

    private final CurveLogDecoder decoder;
    private final CurveEventProcessor processor;
    private final BackfillProperties backfillProperties;
    private final Clock clock;

    /**
     * @return number of events the projector applied
     * @throws RuntimeException when the logs of the range cannot be fetched; nothing was processed then
     */
    public int scan(ChainReadClient client, long fromBlock, long toBlock) {
        List<JsonNode> logs = new ArrayList<>(fetch(client, fromBlock, toBlock));
        logs.sort(CHAIN_ORDER);
        Map<Long, Instant> timestamps = new HashMap<>();
        int applied = 0;
        for (JsonNode rawLog : logs) {
            if (rawLog.path("removed").asBoolean(false)) {
                continue;
            }
            Optional<CurveEvent> event = decoder.decode(rawLog);
            if (event.isEmpty()) {
                continue;
            }
            String txHash = rawLog.path("transactionHash").asText("").toLowerCase();
            if (txHash.isEmpty()) {
                log.warn("Log without transaction hash in [{}, {}] on {}", fromBlock, toBlock, client.chain());
                continue;
            }
            long blockNumber = quantity(rawLog, "blockNumber");
            EventMetadata meta = new EventMetadata(txHash, blockNumber, quantity(rawLog, "logIndex"), EventMetadata.Source.DIRECT);
            Instant at = timestamps.computeIfAbsent(blockNumber, b -> blockTimestamp(client, b));
            if (processor.process(client.chain(), client.contractAddress(), event.get(), meta, at)) {
                applied++;
            }
        }
        log.debug("Scanned [{}, {}] on {}: {} logs, {} applied", fromBlock, toBlock, client.chain(), logs.size(), applied);
        return applied;
    }

    private List<JsonNode> fetch(ChainReadClient client, long fromBlock, long toBlock) {
        try {
            return client.getLogs(fromBlock, toBlock, CurveEvents.ALL_TOPICS, null);
        } catch (RuntimeException e) {
            if (!RpcErrors.isRangeTooWide(e) || toBlock - fromBlock + 1 < backfillProperties.getMinSplitBlocks() * 2) {
                throw e;
            }
            long mid = fromBlock + (toBlock - fromBlock) / 2;
            log.warn("Reducing block range [{}-{}] on {}: {}", fromBlock, toBlock, client.chain(), e.getMessage());
            List<JsonNode> combined = new ArrayList<>(fetch(client, fromBlock, mid));
            combined.addAll(fetch(client, mid + 1, toBlock));
            return combined;
        }
    }

    private Instant blockTimestamp(ChainReadClient client, long blockNumber) {
        try {
            return client.getBlockTimestamp(blockNumber).orElseGet(clock::instant);
        } catch (RuntimeException e) {
            log.debug("Block {} timestamp on {} unavailable: {}", blockNumber, client.chain(), e.getMessage());
            return clock.instant();
        }
    }

    private static long quantity(JsonNode entry, String field) {
        Long value = EventMetadataResolver.parseQuantity(entry.path(field));
        return value == null ? 0L : value;
    }
}
