package com.launchradar.ingestion.listener;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchradar.common.BackoffPolicy;
import com.launchradar.domain.ChainId;
import com.launchradar.ingestion.adapter.ChainConnectionManager;
import com.launchradar.ingestion.adapter.ChainReadClient;
import com.launchradar.ingestion.adapter.SocketConnection;
import com.launchradar.ingestion.event.CurveEvent;
import com.launchradar.ingestion.event.CurveEventProcessor;
import com.launchradar.ingestion.event.CurveEvents;
import com.launchradar.ingestion.event.CurveLogDecoder;
import com.launchradar.ingestion.event.EventMetadata;
import com.launchradar.ingestion.event.EventMetadataResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Real-time listener of one chain. The socket puts raw frames on this listener's queue; a dedicated consumer
 * thread decodes them in arrival order and hands them to the {@link CurveEventProcessor}. An abnormal socket close
 * schedules a reconnect using the reconnect {@link BackoffPolicy}; once attempts are exhausted the listener is
 * abandoned and reported through {@code onAbandoned}. Events missed while disconnected are left to backfill.
 */
@Slf4j
public class ChainEventListener {

    private static final long POLL_TIMEOUT_MS = 1_000;

    private final ChainId chain;
    private final ChainConnectionManager connectionManager;
    private final CurveLogDecoder decoder;
    private final EventMetadataResolver metadataResolver;
    private final CurveEventProcessor processor;
    private final TaskScheduler scheduler;
    private final BackoffPolicy reconnectPolicy;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Consumer<ChainId> onAbandoned;
    private final BlockingQueue<String> frames;

    private ListenerState state = ListenerState.IDLE;
    private int reconnectAttempts;
    private SocketConnection connection;
    private ScheduledFuture<?> pendingReconnect;
    private Thread consumer;

    public ChainEventListener(ChainId chain,
                              ChainConnectionManager connectionManager,
                              CurveLogDecoder decoder,
                              EventMetadataResolver metadataResolver,
                              CurveEventProcessor processor,
                              TaskScheduler scheduler,
                              BackoffPolicy reconnectPolicy,
                              int queueCapacity,
                              ObjectMapper objectMapper,
                              Clock clock,
                              Consumer<ChainId> onAbandoned) {
        this.chain = chain;
        this.connectionManager = connectionManager;
        this.decoder = decoder;
        this.metadataResolver = metadataResolver;
        this.processor = processor;
        this.scheduler = scheduler;
        this.reconnectPolicy = reconnectPolicy;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.onAbandoned = onAbandoned;
        this.frames = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
    }

    public ChainId chain() {
        return chain;
    }

    public synchronized ListenerState state() {
        return state;
    }

    synchronized int reconnectAttempts() {
        return reconnectAttempts;
    }

    BlockingQueue<String> frames() {
        return frames;
    }

    public void start() {
        synchronized (this) {
            if (state != ListenerState.IDLE) {
                return;
            }
            consumer = new Thread(this::consumeLoop, "listener-" + chain.name().toLowerCase());
            consumer.setDaemon(true);
            consumer.start();
        }
        attemptConnection();
    }

    public synchronized void stop() {
        if (isTerminal()) {
            return;
        }
        state = ListenerState.STOPPED;
        cancelPendingReconnect();
        if (consumer != null) {
            consumer.interrupt();
        }
        log.info("Listener for {} stopped", chain);
    }

    /**
     * Obtains a socket from the connection manager and subscribes to the curve events. A null socket (rate-limit
     * cool-down) or a creation failure counts as a failed attempt. The handshake runs without holding the listener
     * lock, so close callbacks and {@link #stop()} are never blocked behind it.
     */
    void attemptConnection() {
        synchronized (this) {
            if (isTerminal()) {
                return;
            }
            state = ListenerState.CONNECTING;
            pendingReconnect = null;
        }
        SocketConnection socket;
        String contract;
        try {
            socket = connectionManager.getSocketConnection(chain);
            contract = connectionManager.getProvider(chain).contractAddress();
        } catch (RuntimeException e) {
            log.warn("Socket for {} unavailable: {}", chain, e.getMessage());
            retryUnlessTerminal();
            return;
        }
        if (socket == null) {
            log.warn("Socket for {} unavailable: provider cooling down", chain);
            retryUnlessTerminal();
            return;
        }
        subscribe(socket, contract);
    }

    private synchronized void subscribe(SocketConnection socket, String contract) {
        if (state != ListenerState.CONNECTING) {
            log.info("Listener for {} left CONNECTING ({}) during the handshake; not subscribing", chain, state);
            return;
        }
        try {
            socket.attachFrameQueue(frames);
            socket.addCloseListener((code, reason, error) -> onSocketClosed(socket, code, reason));
            socket.subscribeLogs(contract, CurveEvents.ALL_TOPICS);
            connection = socket;
            reconnectAttempts = 0;
            state = ListenerState.SUBSCRIBED;
            log.info("Listening for curve events on {} (contract {})", chain, contract);
        } catch (RuntimeException e) {
            log.warn("Subscribing on {} failed: {}", chain, e.getMessage());
            scheduleReconnect();
        }
    }

    private synchronized void retryUnlessTerminal() {
        if (state == ListenerState.CONNECTING) {
            scheduleReconnect();
        }
    }

    private boolean isTerminal() {
        return state == ListenerState.STOPPED || state == ListenerState.ABANDONED;
    }

    synchronized void onSocketClosed(SocketConnection closed, int code, String reason) {
        if (closed != connection || isTerminal()) {
            return;
        }
        connection = null;
        if (code == SocketConnection.NORMAL_CLOSURE) {
            state = ListenerState.STOPPED;
            log.info("Socket for {} closed normally ({}); not reconnecting", chain, reason);
            return;
        }
        log.warn("Socket for {} closed with code {} ({})", chain, code, reason);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (!reconnectPolicy.allowsAttempt(reconnectAttempts)) {
            state = ListenerState.ABANDONED;
            connection = null;
            if (consumer != null) {
                consumer.interrupt();
            }
            log.error("Giving up on {} after {} reconnect attempts; restart required", chain, reconnectAttempts);
            onAbandoned.accept(chain);
            return;
        }
        long delayMs = reconnectPolicy.delayMs(reconnectAttempts);
        reconnectAttempts++;
        state = ListenerState.RECONNECT_SCHEDULED;
        log.info("Reconnecting {} in {} ms (attempt {}/{})", chain, delayMs, reconnectAttempts, reconnectPolicy.getMaxAttempts());
        pendingReconnect = scheduler.schedule(this::attemptConnection, clock.instant().plusMillis(delayMs));
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }
    }

    private void consumeLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            String frame;
            try {
                frame = frames.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (frame != null) {
                processFrame(frame);
            }
        }
        log.debug("Consumer for {} exited", chain);
    }

    /**
     * Handles one socket frame: subscription acknowledgements are logged, log notifications are decoded, located
     * and projected. Any failure is logged and the frame dropped.
     */
    void processFrame(String frame) {
        try {
            JsonNode message = objectMapper.readTree(frame);
            if (message.has("id") && message.has("result")) {
                log.info("Subscription on {} acknowledged: {}", chain, message.path("result").asText());
                return;
            }
            if (message.has("error")) {
                log.warn("Socket error frame on {}: {}", chain, message.path("error"));
                return;
            }
            if (!"eth_subscription".equals(message.path("method").asText())) {
                return;
            }
            JsonNode wrapper = message.path("params").path("result");
            if (!wrapper.isObject()) {
                return;
            }
            JsonNode rawLog = wrapper.has("topics") ? wrapper : wrapper.path("log");
            if (wrapper.path("removed").asBoolean(false) || rawLog.path("removed").asBoolean(false)) {
                log.debug("Ignoring removed log on {}", chain);
                return;
            }
            Optional<CurveEvent> event = decoder.decode(rawLog);
            if (event.isEmpty()) {
                return;
            }
            ChainReadClient client = connectionManager.getProvider(chain);
            Optional<EventMetadata> meta = metadataResolver.resolve(wrapper, event.get(), client);
            if (meta.isEmpty()) {
                return;
            }
            Instant blockTimestamp = blockTimestamp(client, meta.get().blockNumber());
            processor.process(chain, client.contractAddress(), event.get(), meta.get(), blockTimestamp);
        } catch (Exception e) {
            log.warn("Dropping frame on {}: {}", chain, e.getMessage(), e);
        }
    }

    private Instant blockTimestamp(ChainReadClient client, long blockNumber) {
        if (blockNumber <= 0) {
            return clock.instant();
        }
        try {
            return client.getBlockTimestamp(blockNumber).orElseGet(clock::instant);
        } catch (RuntimeException e) {
            log.debug("Block {} timestamp on {} unavailable: {}", blockNumber, chain, e.getMessage());
            return clock.instant();
        }
    }
}
