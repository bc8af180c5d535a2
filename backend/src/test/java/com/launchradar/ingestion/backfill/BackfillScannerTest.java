package com.launchradar.ingestion.backfill;

import com.launchradar.MutableClock;
import com.launchradar.domain.BackfillCursor;
import com.launchradar.domain.BackfillCursorRepository;
import com.launchradar.domain.ChainId;
import com.launchradar.ingestion.adapter.ChainConnectionManager;
import com.launchradar.ingestion.adapter.ChainReadClient;
import com.launchradar.ingestion.adapter.ChainRegistry;
import com.launchradar.ingestion.adapter.RpcException;
import com.launchradar.ingestion.config.BackfillProperties;
import com.launchradar.ingestion.config.ChainSchedulers;
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

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BackfillScannerTest {

    private static final ChainId CHAIN = ChainId.BASE_SEPOLIA;

    @Mock
    ChainRegistry chainRegistry;
    @Mock
    ChainConnectionManager connectionManager;
    @Mock
    ChainReadClient client;
    @Mock
    ChainLogScanner logScanner;
    @Mock
    BackfillCursorRepository cursorRepository;
    @Mock
    TaskScheduler scheduler;
    @Mock
    ChainSchedulers chainSchedulers;
    @Mock
    ScheduledFuture<Object> timer;

    private final AtomicReference<BackfillCursor> stored = new AtomicReference<>();
    private BackfillProperties properties;
    private BackfillScanner scanner;

    @BeforeEach
    void setUp() {
        properties = new BackfillProperties();
        properties.setStartBlock(100);
        properties.setWindowBlocks(100);
        properties.setTickIntervalMs(10_000);
        scanner = new BackfillScanner(chainRegistry, connectionManager, logScanner, cursorRepository, properties,
                new MutableClock(Instant.parse("2025-03-01T12:00:00Z")), chainSchedulers);

        when(chainRegistry.configuredChains()).thenReturn(List.of(CHAIN));
        when(chainRegistry.startBlock(CHAIN)).thenReturn(Optional.empty());
        when(connectionManager.getProvider(CHAIN)).thenReturn(client);
        when(cursorRepository.findById(CHAIN.name())).thenAnswer(inv -> Optional.ofNullable(copy(stored.get())));
        when(cursorRepository.save(any(BackfillCursor.class))).thenAnswer(inv -> {
            BackfillCursor saved = inv.getArgument(0);
            stored.set(copy(saved));
            return saved;
        });
        when(chainSchedulers.forChain(CHAIN, ChainSchedulers.BACKFILL)).thenReturn(scheduler);
        doReturn(timer).when(scheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
    }

    private static BackfillCursor copy(BackfillCursor source) {
        if (source == null) {
            return null;
        }
        BackfillCursor c = new BackfillCursor();
        c.setId(source.getId());
        c.setChainId(source.getChainId());
        c.setNextBlock(source.getNextBlock());
        c.setLastHeadSeen(source.getLastHeadSeen());
        c.setCaughtUp(source.isCaughtUp());
        c.setUpdatedAt(source.getUpdatedAt());
        return c;
    }

    private void persisted(long nextBlock, boolean caughtUp) {
        BackfillCursor c = new BackfillCursor();
        c.setId(CHAIN.name());
        c.setChainId(CHAIN.id());
        c.setNextBlock(nextBlock);
        c.setCaughtUp(caughtUp);
        stored.set(c);
    }

    @Test
    @DisplayName("fresh chain starts at the configured block")
    void seedFresh() {
        assertThat(scanner.seedCursor(CHAIN).getNextBlock()).isEqualTo(100);
        assertThat(stored.get().getChainId()).isEqualTo(CHAIN.id());
    }

    @Test
    @DisplayName("persisted cursor ahead of the configured block is kept, and caught-up is reset")
    void seedKeepsProgress() {
        persisted(5_000, true);

        BackfillCursor cursor = scanner.seedCursor(CHAIN);

        assertThat(cursor.getNextBlock()).isEqualTo(5_000);
        assertThat(cursor.isCaughtUp()).isFalse();
    }

    @Test
    @DisplayName("configured block ahead of the persisted cursor wins; per-chain start block overrides the global one")
    void seedMovesForward() {
        persisted(50, false);
        when(chainRegistry.startBlock(CHAIN)).thenReturn(Optional.of(700L));

        assertThat(scanner.seedCursor(CHAIN).getNextBlock()).isEqualTo(700);
    }

    @Test
    @DisplayName("tick scans [cursor, cursor + window] and moves the cursor past it")
    void tickAdvances() {
        persisted(100, false);
        when(client.getBlockNumber()).thenReturn(1_000L);

        assertThat(scanner.tick(CHAIN)).isFalse();

        verify(logScanner).scan(client, 100, 200);
        assertThat(stored.get().getNextBlock()).isEqualTo(201);
        assertThat(stored.get().getLastHeadSeen()).isEqualTo(1_000L);
        assertThat(stored.get().isCaughtUp()).isFalse();
    }

    @Test
    @DisplayName("window is clipped at head and the chain is then caught up")
    void tickReachesHead() {
        persisted(950, false);
        when(client.getBlockNumber()).thenReturn(1_000L);

        assertThat(scanner.tick(CHAIN)).isTrue();

        verify(logScanner).scan(client, 950, 1_000);
        assertThat(stored.get().getNextBlock()).isEqualTo(1_001);
        assertThat(stored.get().isCaughtUp()).isTrue();
    }

    @Test
    @DisplayName("cursor beyond head means caught up without scanning")
    void cursorPastHead() {
        persisted(1_001, false);
        when(client.getBlockNumber()).thenReturn(1_000L);

        assertThat(scanner.tick(CHAIN)).isTrue();

        verify(logScanner, never()).scan(any(), anyLong(), anyLong());
        assertThat(stored.get().getNextBlock()).isEqualTo(1_001);
    }

    @Test
    @DisplayName("failed scan leaves the cursor for the next tick")
    void failureKeepsCursor() {
        persisted(100, false);
        when(client.getBlockNumber()).thenReturn(1_000L);
        when(logScanner.scan(client, 100, 200)).thenThrow(new RpcException("connection reset"));

        assertThat(scanner.tick(CHAIN)).isFalse();

        assertThat(stored.get().getNextBlock()).isEqualTo(100);
    }

    @Test
    @DisplayName("head lookup failure leaves the cursor for the next tick")
    void headFailureKeepsCursor() {
        persisted(100, false);
        when(client.getBlockNumber()).thenThrow(new RpcException("timeout"));

        assertThat(scanner.tick(CHAIN)).isFalse();

        assertThat(stored.get().getNextBlock()).isEqualTo(100);
    }

    @Test
    @DisplayName("start schedules one timer per chain that cancels itself once caught up")
    void timerCancelsWhenCaughtUp() {
        when(client.getBlockNumber()).thenReturn(150L);
        scanner.onApplicationReady(null);
        scanner.onApplicationReady(null);

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).scheduleAtFixedRate(task.capture(), any(Duration.class));
        assertThat(scanner.runningChains()).containsExactly(CHAIN);

        task.getValue().run();

        verify(logScanner).scan(client, 100, 150);
        verify(timer).cancel(false);
        assertThat(scanner.runningChains()).isEmpty();
    }

    @Test
    @DisplayName("disabled backfill schedules nothing")
    void disabled() {
        properties.setEnabled(false);

        scanner.onApplicationReady(null);

        verify(scheduler, never()).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
    }
}
