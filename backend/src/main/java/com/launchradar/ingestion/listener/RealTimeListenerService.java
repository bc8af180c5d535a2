package com.launchradar.ingestion.listener;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.launchradar.common.BackoffPolicy;
import com.launchradar.domain.ChainId;
import com.launchradar.ingestion.adapter.ChainConnectionManager;
import com.launchradar.ingestion.adapter.ChainRegistry;
import com.launchradar.ingestion.config.ChainSchedulers;
import com.launchradar.ingestion.config.ListenerProperties;
import com.launchradar.ingestion.event.CurveEventProcessor;
import com.launchradar.ingestion.event.CurveLogDecoder;
import com.launchradar.ingestion.event.EventMetadataResolver;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starts one {@link ChainEventListener} per configured chain with a socket URL once the application is ready, and
 * drops chains whose listener gave up reconnecting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RealTimeListenerService {

    private final ChainRegistry chainRegistry;
    private final ChainConnectionManager connectionManager;
    private final CurveLogDecoder decoder;
    private final EventMetadataResolver metadataResolver;
    private final CurveEventProcessor processor;
    private final ListenerProperties listenerProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ChainSchedulers chainSchedulers;

    private final Map<ChainId, ChainEventListener> listeners = new ConcurrentHashMap<>();

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (!listenerProperties.isEnabled()) {
            log.info("Real-time listener disabled");
            return;
        }
        for (ChainId chain : chainRegistry.configuredChains()) {
            if (chainRegistry.wsUrl(chain).isEmpty()) {
                log.info("No ws-url for {}; real-time tracking disabled", chain);
                continue;
            }
            start(chain);
        }
    }

    void start(ChainId chain) {
        ChainEventListener listener = new ChainEventListener(
                chain,
                connectionManager,
                decoder,
                metadataResolver,
                processor,
                chainSchedulers.forChain(chain, ChainSchedulers.LISTENER),
                reconnectPolicy(),
                listenerProperties.getFrameQueueCapacity(),
                objectMapper,
                clock,
                this::onAbandoned);
        if (listeners.putIfAbsent(chain, listener) == null) {
            listener.start();
        }
    }

    public Set<ChainId> activeChains() {
        return Set.copyOf(listeners.keySet());
    }

    @PreDestroy
    public void stopAll() {
        listeners.values().forEach(ChainEventListener::stop);
        listeners.clear();
    }

    private void onAbandoned(ChainId chain) {
        listeners.remove(chain);
        log.error("{} removed from real-time tracking", chain);
    }

    private BackoffPolicy reconnectPolicy() {
        return new BackoffPolicy(
                listenerProperties.getReconnectBaseDelayMs(),
                listenerProperties.getReconnectMaxDelayMs(),
                30,
                0,
                listenerProperties.getReconnectMaxAttempts());
    }
}
