package com.launchradar.ingestion.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchradar.domain.ChainId;
import lombok.extern.slf4j.Slf4j;

import java.net.http.WebSocket;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link SocketConnection} on {@link java.net.http.WebSocket}. Acts as the socket's listener: partial text
 * messages are assembled, complete frames are put on the attached queue, then one more frame is requested.
 */
@Slf4j
public class JdkSocketConnection implements SocketConnection, WebSocket.Listener {

    private final ChainId chain;
    private final ObjectMapper objectMapper;
    private final AtomicReference<SocketState> state = new AtomicReference<>(SocketState.CONNECTING);
    private final AtomicReference<BlockingQueue<String>> frameQueue = new AtomicReference<>();
    private final List<SocketCloseListener> closeListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closeNotified = new AtomicBoolean();
    private final AtomicLong requestIds = new AtomicLong();
    private final StringBuilder buffer = new StringBuilder();
    private volatile WebSocket webSocket;

    public JdkSocketConnection(ChainId chain, ObjectMapper objectMapper) {
        this.chain = chain;
        this.objectMapper = objectMapper;
    }

    @Override
    public ChainId chain() {
        return chain;
    }

    @Override
    public SocketState state() {
        return state.get();
    }

    @Override
    public void attachFrameQueue(BlockingQueue<String> queue) {
        frameQueue.set(queue);
    }

    @Override
    public void addCloseListener(SocketCloseListener listener) {
        closeListeners.add(listener);
        if (state.get() == SocketState.CLOSED && closeNotified.get()) {
            listener.onClose(ABNORMAL_CLOSURE, "already closed", null);
        }
    }

    @Override
    public void subscribeLogs(String contractAddress, List<String> eventTopics) {
        WebSocket ws = webSocket;
        if (ws == null || state.get() != SocketState.OPEN) {
            throw new SocketConnectionException("Socket for " + chain + " is not open", null);
        }
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("address", contractAddress);
        filter.put("topics", List.of(List.copyOf(eventTopics)));
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", "2.0");
        request.put("id", requestIds.incrementAndGet());
        request.put("method", "eth_subscribe");
        request.put("params", List.of("logs", filter));
        try {
            ws.sendText(objectMapper.writeValueAsString(request), true).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode eth_subscribe request", e);
        }
    }

    @Override
    public void close(int code, String reason) {
        WebSocket ws = webSocket;
        SocketState previous = state.getAndUpdate(s -> s == SocketState.CLOSED ? s : SocketState.CLOSING);
        if (ws == null || previous == SocketState.CLOSED) {
            return;
        }
        ws.sendClose(code, reason == null ? "" : reason).whenComplete((w, error) -> {
            if (error != null) {
                log.debug("Close handshake for {} failed, aborting: {}", chain, error.getMessage());
                ws.abort();
                notifyClosed(code, reason, null);
            }
        });
    }

    @Override
    public void onOpen(WebSocket webSocket) {
        this.webSocket = webSocket;
        state.set(SocketState.OPEN);
        webSocket.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
        buffer.append(data);
        if (last) {
            String frame = buffer.toString();
            buffer.setLength(0);
            enqueue(frame);
        }
        webSocket.request(1);
        return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
        notifyClosed(statusCode, reason, null);
        return null;
    }

    @Override
    public void onError(WebSocket webSocket, Throwable error) {
        notifyClosed(ABNORMAL_CLOSURE, error.getMessage(), error);
    }

    private void enqueue(String frame) {
        BlockingQueue<String> queue = frameQueue.get();
        if (queue == null) {
            log.debug("Dropping frame on {}: no consumer attached", chain);
            return;
        }
        try {
            queue.put(frame);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while enqueuing frame on {}", chain);
        }
    }

    private void notifyClosed(int code, String reason, Throwable error) {
        state.set(SocketState.CLOSED);
        if (!closeNotified.compareAndSet(false, true)) {
            return;
        }
        for (SocketCloseListener listener : closeListeners) {
            try {
                listener.onClose(code, reason, error);
            } catch (RuntimeException e) {
                log.error("Close listener failed on {}", chain, e);
            }
        }
    }
}
