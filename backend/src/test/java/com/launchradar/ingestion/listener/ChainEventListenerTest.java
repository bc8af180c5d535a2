package com.launchradar.ingestion.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.launchradar.MutableClock;
import com.launchradar.common.BackoffPolicy;
import com.launchradar.domain.ChainId;
import com.launchradar.ingestion.adapter.ChainConnectionManager;
import com.launchradar.ingestion.adapter.ChainReadClient;
import com.launchradar.ingestion.adapter.RpcException;
import com.launchradar.ingestion.adapter.SocketCloseListener;
import com.launchradar.ingestion.adapter.SocketConnection;
import com.launchradar.ingestion.config.ListenerProperties;
import com.launchradar.ingestion.event.CurveEventProcessor;
import com.launchradar.ingestion.event.CurveEvents;
import com.launchradar.ingestion.event.CurveLogDecoder;
import com.launchradar.ingestion.event.CurveLogFixtures;
import com.launchradar.ingestion.event.EventMetadata;
import com.launchradar.ingestion.event.EventMetadataResolver;
import com.launchradar.ingestion.event.TokenTradeLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.TaskScheduler;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.launchradar.ingestion.event.CurveLogFixtures.CURVE;
import static com.launchradar.ingestion.event.CurveLogFixtures.ONE_ETH;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ChainEventListenerTest {

    private static final ChainId CHAIN = ChainId.BASE_SEPOLIA;
    private static final Instant T0 = Instant.parse("2025-03-01T12:00:00Z");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    ChainConnectionManager connectionManager;
    @Mock
    ChainReadClient client;
    @Mock
    SocketConnection socket;
    @Mock
    CurveEventProcessor processor;
    @Mock
    TaskScheduler scheduler;

    private final List<ChainId> abandoned = new ArrayList<>();
    private ChainEventListener listener;

    @BeforeEach
    void setUp() {
        when(connectionManager.getProvider(CHAIN)).thenReturn(client);
        when(client.chain()).thenReturn(CHAIN);
        when(client.contractAddress()).thenReturn(CURVE);
        when(client.getBlockTimestamp(anyLong())).thenReturn(Optional.of(T0.minusSeconds(5)));
        listener = new ChainEventListener(
                CHAIN,
                connectionManager,
                new CurveLogDecoder(),
                new EventMetadataResolver(new ListenerProperties()),
                processor,
                scheduler,
                BackoffPolicy.socketReconnect(),
                16,
                MAPPER,
                new MutableClock(T0),
                abandoned::add);
    }

    private SocketCloseListener connect() {
        when(connectionManager.getSocketConnection(CHAIN)).thenReturn(socket);
        listener.attemptConnection();
        ArgumentCaptor<SocketCloseListener> closeListener = ArgumentCaptor.forClass(SocketCloseListener.class);
        verify(socket).addCloseListener(closeListener.capture());
        return closeListener.getValue();
    }

    @Test
    @DisplayName("connect subscribes to all curve events of the chain's contract")
    void subscribes() {
        connect();

        verify(socket).attachFrameQueue(listener.frames());
        verify(socket).subscribeLogs(CURVE, CurveEvents.ALL_TOPICS);
        assertThat(listener.state()).isEqualTo(ListenerState.SUBSCRIBED);
        assertThat(listener.reconnectAttempts()).isZero();
    }

    @Test
    @DisplayName("abnormal close reconnects after 2s, 4s, 8s ... capped at 60s; no eleventh attempt")
    void reconnectSchedule() {
        SocketCloseListener onClose = connect();
        onClose.onClose(SocketConnection.ABNORMAL_CLOSURE, "gone", null);
        when(connectionManager.getSocketConnection(CHAIN)).thenReturn(null);
        for (int i = 0; i < 9; i++) {
            listener.attemptConnection();
        }

        ArgumentCaptor<Instant> at = ArgumentCaptor.forClass(Instant.class);
        verify(scheduler, times(10)).schedule(any(Runnable.class), at.capture());
        assertThat(at.getAllValues()).extracting(i -> i.toEpochMilli() - T0.toEpochMilli())
                .containsExactly(2_000L, 4_000L, 8_000L, 16_000L, 32_000L, 60_000L, 60_000L, 60_000L, 60_000L, 60_000L);
        assertThat(listener.state()).isEqualTo(ListenerState.RECONNECT_SCHEDULED);
        assertThat(abandoned).isEmpty();

        listener.attemptConnection();

        verify(scheduler, times(10)).schedule(any(Runnable.class), any(Instant.class));
        assertThat(listener.state()).isEqualTo(ListenerState.ABANDONED);
        assertThat(abandoned).containsExactly(CHAIN);
    }

    @Test
    @DisplayName("normal close (1000) stops the listener without reconnecting")
    void normalClose() {
        SocketCloseListener onClose = connect();

        onClose.onClose(SocketConnection.NORMAL_CLOSURE, "bye", null);

        assertThat(listener.state()).isEqualTo(ListenerState.STOPPED);
        verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    @DisplayName("successful resubscribe resets the attempt counter")
    void resubscribeResetsAttempts() {
        SocketCloseListener onClose = connect();
        onClose.onClose(SocketConnection.ABNORMAL_CLOSURE, "gone", null);
        assertThat(listener.reconnectAttempts()).isEqualTo(1);

        listener.attemptConnection();

        assertThat(listener.state()).isEqualTo(ListenerState.SUBSCRIBED);
        assertThat(listener.reconnectAttempts()).isZero();
    }

    @Test
    @DisplayName("close of a socket that was already replaced is ignored")
    void staleCloseIgnored() {
        SocketCloseListener onClose = connect();
        onClose.onClose(SocketConnection.ABNORMAL_CLOSURE, "gone", null);

        onClose.onClose(SocketConnection.ABNORMAL_CLOSURE, "gone again", null);

        verify(scheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    @DisplayName("socket creation failure and cool-down both count as failed attempts")
    void creationFailures() {
        when(connectionManager.getSocketConnection(CHAIN)).thenThrow(new RpcException("429 Too Many Requests"));
        listener.attemptConnection();
        doReturn(null).when(connectionManager).getSocketConnection(CHAIN);
        listener.attemptConnection();

        assertThat(listener.reconnectAttempts()).isEqualTo(2);
        verify(scheduler).schedule(any(Runnable.class), eq(T0.plusMillis(2_000)));
        verify(scheduler).schedule(any(Runnable.class), eq(T0.plusMillis(4_000)));
    }

    @Test
    @DisplayName("stop cancels reconnects for good")
    void stop() {
        SocketCloseListener onClose = connect();
        listener.stop();

        onClose.onClose(SocketConnection.ABNORMAL_CLOSURE, "gone", null);
        listener.attemptConnection();

        assertThat(listener.state()).isEqualTo(ListenerState.STOPPED);
        verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
        verify(connectionManager, times(1)).getSocketConnection(CHAIN);
    }

    @Test
    @DisplayName("log notification is decoded and handed to the processor with its block timestamp")
    void notification() throws Exception {
        ObjectNode log = CurveLogFixtures.bought("0xAB", 77, 3, ONE_ETH, ONE_ETH.multiply(BigInteger.valueOf(1_000)));
        String frame = "{\"jsonrpc\":\"2.0\",\"method\":\"eth_subscription\",\"params\":{\"subscription\":\"0x9\",\"result\":"
                + MAPPER.writeValueAsString(log) + "}}";

        listener.processFrame(frame);

        ArgumentCaptor<EventMetadata> meta = ArgumentCaptor.forClass(EventMetadata.class);
        verify(processor).process(eq(CHAIN), eq(CURVE), any(TokenTradeLog.class), meta.capture(), eq(T0.minusSeconds(5)));
        assertThat(meta.getValue().txHash()).isEqualTo("0xab");
        assertThat(meta.getValue().blockNumber()).isEqualTo(77);
        assertThat(meta.getValue().logIndex()).isEqualTo(3);
    }

    @Test
    @DisplayName("acks, errors, removed logs and foreign frames are not processed")
    void ignoredFrames() throws Exception {
        ObjectNode removed = CurveLogFixtures.graduated("0xcd", 80, 0);
        removed.put("removed", true);

        listener.processFrame("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"0x9\"}");
        listener.processFrame("{\"jsonrpc\":\"2.0\",\"id\":2,\"error\":{\"code\":-32000,\"message\":\"nope\"}}");
        listener.processFrame("{\"jsonrpc\":\"2.0\",\"method\":\"eth_subscription\",\"params\":{\"result\":"
                + MAPPER.writeValueAsString(removed) + "}}");
        listener.processFrame("{\"jsonrpc\":\"2.0\",\"method\":\"something_else\",\"params\":{}}");
        listener.processFrame("not json");

        verify(processor, never()).process(any(), any(), any(), any(), any());
    }

    @Test
    @DisplayName("stop is not blocked by a slow handshake, and the late socket is not subscribed")
    void stopDuringHandshake() throws Exception {
        CountDownLatch handshakeStarted = new CountDownLatch(1);
        CountDownLatch handshakeDone = new CountDownLatch(1);
        when(connectionManager.getSocketConnection(CHAIN)).thenAnswer(inv -> {
            handshakeStarted.countDown();
            handshakeDone.await(5, TimeUnit.SECONDS);
            return socket;
        });
        CompletableFuture<Void> connecting = CompletableFuture.runAsync(listener::attemptConnection);
        assertThat(handshakeStarted.await(2, TimeUnit.SECONDS)).isTrue();

        CompletableFuture.runAsync(listener::stop).get(1, TimeUnit.SECONDS);
        handshakeDone.countDown();
        connecting.get(2, TimeUnit.SECONDS);

        assertThat(listener.state()).isEqualTo(ListenerState.STOPPED);
        verify(socket, never()).subscribeLogs(any(), any());
        verify(scheduler, never()).schedule(any(Runnable.class), any(Instant.class));
    }
}
