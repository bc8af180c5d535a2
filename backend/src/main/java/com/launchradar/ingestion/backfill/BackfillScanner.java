package com.launchradar.ingestion.backfill;

import com.launchradar.domain.BackfillCursor;
import com.launchradar.domain.BackfillCursorRepository;
import com.launchradar.domain.ChainId;
import com.launchradar.ingestion.adapter.ChainConnectionManager;
import com.launchradar.ingestion.adapter.ChainReadClient;
import com.launchradar.ingestion.adapter.ChainRegistry;
import com.launchradar.ingestion.config.BackfillProperties;
import com.launchradar.ingestion.config.ChainSchedulers;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * One-shot historical catch-up per chain. Each tick scans {@code [cursor, min(cursor + window, head)]} and moves
 * the persisted cursor past it; a failed tick leaves the cursor where it was so the range is retried. The chain's
 * timer cancels itself once a tick has scanned through the head seen at that tick.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BackfillScanner {

    private final ChainRegistry chainRegistry;
    private final ChainConnectionManager connectionManager;
    private final ChainLogScanner logScanner;
    private final BackfillCursorRepository cursorRepository;
    private final BackfillProperties backfillProperties;
    private final Clock clock;
    private final ChainSchedulers chainSchedulers;

    private final Map<ChainId, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (!backfillProperties.isEnabled()) {
            log.info("Backfill disabled");
            return;
        }
        chainRegistry.configuredChains().forEach(this::start);
    }

    void start(ChainId chain) {
        BackfillCursor cursor = seedCursor(chain);
        timers.computeIfAbsent(chain, c -> {
            TaskScheduler scheduler = chainSchedulers.forChain(c, ChainSchedulers.BACKFILL);
            return scheduler.scheduleAtFixedRate(() -> {
                if (tick(c)) {
                    cancel(c);
                }
            }, Duration.ofMillis(backfillProperties.getTickIntervalMs()));
        });
        log.info("Backfill for {} scheduled from block {} every {} ms", chain, cursor.getNextBlock(),
                backfillProperties.getTickIntervalMs());
    }

    /**
     * Scans the next window of the chain.
     *
     * @return true when the chain is caught up and needs no further ticks
     */
    boolean tick(ChainId chain) {
        BackfillCursor cursor = cursorRepository.findById(chain.name()).orElseGet(() -> seedCursor(chain));
        long from = cursor.getNextBlock();
        try {
            ChainReadClient client = connectionManager.getProvider(chain);
            long head = client.getBlockNumber();
            if (from > head) {
                markCaughtUp(cursor, head);
                log.info("Backfill for {} caught up (cursor {} past head {})", chain, from, head);
                return true;
            }
            long end = Math.min(from + backfillProperties.getWindowBlocks(), head);
            int applied = logScanner.scan(client, from, end);
            cursor.setNextBlock(end + 1);
            cursor.setLastHeadSeen(head);
            cursor.setCaughtUp(end == head);
            cursor.setUpdatedAt(clock.instant());
            cursorRepository.save(cursor);
            log.info("Backfill {} blocks [{}, {}] done: {} events applied", chain, from, end, applied);
            if (end == head) {
                log.info("Backfill for {} caught up at head {}", chain, head);
                return true;
            }
            return false;
        } catch (Exception e) {
            log.warn("Backfill {} from block {} failed, retrying next tick: {}", chain, from, e.getMessage());
            return false;
        }
    }

    public Set<ChainId> runningChains() {
        return Set.copyOf(timers.keySet());
    }

    @PreDestroy
    public void stopAll() {
        timers.keySet().forEach(this::cancel);
    }

    /**
     * Persisted cursor, moved up to the configured start block when that is further ahead. Every start runs one
     * catch-up, so blocks produced while the process was down are scanned too.
     */
    BackfillCursor seedCursor(ChainId chain) {
        long configured = chainRegistry.startBlock(chain).orElse(backfillProperties.getStartBlock());
        BackfillCursor cursor = cursorRepository.findById(chain.name()).orElseGet(() -> {
            BackfillCursor fresh = new BackfillCursor();
            fresh.setId(chain.name());
            fresh.setChainId(chain.id());
            fresh.setNextBlock(configured);
            return fresh;
        });
        if (cursor.getNextBlock() < configured) {
            cursor.setNextBlock(configured);
        }
        cursor.setCaughtUp(false);
        cursor.setUpdatedAt(clock.instant());
        return cursorRepository.save(cursor);
    }

    private void markCaughtUp(BackfillCursor cursor, long head) {
        cursor.setCaughtUp(true);
        cursor.setLastHeadSeen(head);
        cursor.setUpdatedAt(clock.instant());
        cursorRepository.save(cursor);
    }

    private void cancel(ChainId chain) {
        ScheduledFuture<?> timer = timers.remove(chain);
        if (timer != null) {
            timer.cancel(false);
        }
    }
}
