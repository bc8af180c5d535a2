package com.launchradar.ingestion.adapter;

import com.launchradar.common.BackoffPolicy;
import com.launchradar.domain.ChainId;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-chain rate-limit cool-down for socket creation. Each signal extends the window by the
 * {@link BackoffPolicy#connectionRateLimit()} formula and bumps the attempt count.
 */
public class ConnectionBackoffTable {

    private final BackoffPolicy policy;
    private final Clock clock;
    private final Map<ChainId, Entry> entries = new ConcurrentHashMap<>();

    public ConnectionBackoffTable(BackoffPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    public boolean isBackingOff(ChainId chain) {
        Entry entry = entries.get(chain);
        return entry != null && clock.instant().isBefore(entry.backoffUntil());
    }

    /**
     * Records a rate-limit signal and returns the new end of the cool-down.
     */
    public Instant recordRateLimit(ChainId chain) {
        Entry updated = entries.compute(chain, (c, previous) -> {
            int attempts = previous == null ? 0 : previous.attempts();
            Instant until = clock.instant().plusMillis(policy.delayMs(attempts));
            return new Entry(attempts + 1, until);
        });
        return updated.backoffUntil();
    }

    public void reset(ChainId chain) {
        entries.remove(chain);
    }

    public int attempts(ChainId chain) {
        Entry entry = entries.get(chain);
        return entry == null ? 0 : entry.attempts();
    }

    public Optional<Instant> backoffUntil(ChainId chain) {
        return Optional.ofNullable(entries.get(chain)).map(Entry::backoffUntil);
    }

    private record Entry(int attempts, Instant backoffUntil) {
    }
}
