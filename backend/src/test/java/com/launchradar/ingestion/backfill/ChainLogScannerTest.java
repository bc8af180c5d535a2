package com.launchradar.ingestion.backfill;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.launchradar.MutableClock;
import com.launchradar.domain.ChainId;
import com.launchradar.ingestion.adapter.ChainReadClient;
import com.launchradar.ingestion.adapter.RpcException;
import com.launchradar.ingestion.config.BackfillProperties;
import com.launchradar.ingestion.event.CurveEventProcessor;
import com.launchradar.ingestion.event.CurveLogDecoder;
import com.launchradar.ingestion.event.EventMetadata;
import com.launchradar.ingestion.event.TokenCreatedLog;
import com.launchradar.ingestion.event.TokenGraduatedLog;
import com.launchradar.ingestion.event.TokenTradeLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.launchradar.ingestion.event.CurveLogFixtures.CURVE;
import static com.launchradar.ingestion.event.CurveLogFixtures.ONE_ETH;
import static com.launchradar.ingestion.event.CurveLogFixtures.bought;
import static com.launchradar.ingestion.event.CurveLogFixtures.created;
import static com.launchradar.ingestion.event.CurveLogFixtures.graduated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChainLogScannerTest {

    private static final Instant BLOCK_TIME = Instant.parse("2025-03-01T11:00:00Z");

    @Mock
    ChainReadClient client;
    @Mock
    CurveEventProcessor processor;

    private ChainLogScanner scanner;

    @BeforeEach
    void setUp() {
        BackfillProperties properties = new BackfillProperties();
        properties.setMinSplitBlocks(2);
        scanner = new ChainLogScanner(new CurveLogDecoder(), processor, properties,
                new MutableClock(Instant.parse("2025-03-01T12:00:00Z")));
        when(client.chain()).thenReturn(ChainId.BASE_SEPOLIA);
        when(client.contractAddress()).thenReturn(CURVE);
        when(client.getBlockTimestamp(anyLong())).thenReturn(Optional.of(BLOCK_TIME));
        when(processor.process(any(), any(), any(), any(), any())).thenReturn(true);
    }

    @Test
    @DisplayName("events are processed in (block, logIndex) order whatever order the RPC returns")
    void chainOrder() {
        BigInteger tokens = BigInteger.valueOf(1_000).multiply(ONE_ETH);
        List<JsonNode> unordered = List.of(
                graduated("0x03", 12, 0),
                bought("0x02", 10, 5, ONE_ETH, tokens),
                created("0x01", 10, 1));
        when(client.getLogs(eq(10L), eq(20L), any(), isNull())).thenReturn(unordered);

        assertThat(scanner.scan(client, 10, 20)).isEqualTo(3);

        InOrder order = inOrder(processor);
        order.verify(processor).process(any(), eq(CURVE), any(TokenCreatedLog.class), any(), eq(BLOCK_TIME));
        order.verify(processor).process(any(), eq(CURVE), any(TokenTradeLog.class), any(), eq(BLOCK_TIME));
        order.verify(processor).process(any(), eq(CURVE), any(TokenGraduatedLog.class), any(), eq(BLOCK_TIME));
        verify(client, times(1)).getBlockTimestamp(10);
        verify(client, times(1)).getBlockTimestamp(12);
    }

    @Test
    @DisplayName("metadata comes straight from the log")
    void directMetadata() {
        when(client.getLogs(eq(1L), eq(5L), any(), isNull())).thenReturn(List.of(graduated("0xABC", 4, 7)));

        scanner.scan(client, 1, 5);

        ArgumentCaptor<EventMetadata> meta = ArgumentCaptor.forClass(EventMetadata.class);
        verify(processor).process(any(), any(), any(), meta.capture(), any());
        assertThat(meta.getValue()).isEqualTo(new EventMetadata("0xabc", 4, 7, EventMetadata.Source.DIRECT));
    }

    @Test
    @DisplayName("removed logs and unrelated events are skipped")
    void skipsRemovedAndForeign() {
        ObjectNode removed = graduated("0x01", 3, 0);
        removed.put("removed", true);
        ObjectNode foreign = graduated("0x02", 3, 1);
        ArrayNode topics = (ArrayNode) foreign.get("topics");
        topics.removeAll();
        topics.add("0xddf252ad1be2c89b69c2b068fc378daa952ba7f163c4a11628f55a4df523b3ef");
        when(client.getLogs(eq(1L), eq(5L), any(), isNull())).thenReturn(List.of(removed, foreign));

        assertThat(scanner.scan(client, 1, 5)).isZero();

        verify(processor, never()).process(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("a range rejected as too wide is split in halves")
    void splitsTooWideRange() {
        when(client.getLogs(eq(0L), eq(99L), any(), isNull()))
                .thenThrow(new RpcException("query returned more than 10000 results"));
        when(client.getLogs(eq(0L), eq(49L), any(), isNull())).thenReturn(List.of(graduated("0x01", 20, 0)));
        when(client.getLogs(eq(50L), eq(99L), any(), isNull())).thenReturn(List.of(graduated("0x02", 70, 0)));

        assertThat(scanner.scan(client, 0, 99)).isEqualTo(2);
    }

    @Test
    @DisplayName("other fetch failures propagate and nothing is processed")
    void fetchFailurePropagates() {
        when(client.getLogs(anyLong(), anyLong(), any(), isNull())).thenThrow(new RpcException("connection reset"));

        assertThatThrownBy(() -> scanner.scan(client, 0, 99)).isInstanceOf(RpcException.class);

        verify(processor, never()).process(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("a missing block timestamp falls back to the clock")
    void timestampFallback() {
        when(client.getBlockTimestamp(anyLong())).thenReturn(Optional.empty());
        when(client.getLogs(eq(1L), eq(5L), any(), isNull())).thenReturn(List.of(graduated("0x01", 3, 0)));

        scanner.scan(client, 1, 5);

        verify(processor).process(any(), any(), any(), any(), eq(Instant.parse("2025-03-01T12:00:00Z")));
    }
}
