package me.internalizable.cricketscore.cache;

import lombok.Builder;
import lombok.Getter;
import me.internalizable.cricketscore.model.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Single-slot cache for the ranked scoreboard.
 *
 * A snapshot is served while its age is below the TTL. Misses are not coalesced:
 * concurrent callers that miss may all reload from the store and the last put wins.
 */
public class ScoreboardCache {

    private static final Logger logger = LoggerFactory.getLogger(ScoreboardCache.class);

    public enum State { COLD, WARM, STALE }

    @Getter
    private final String name;
    @Getter
    private final Duration ttl;
    private final Clock clock;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private ScoreboardSnapshot snapshot;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    @Builder
    public ScoreboardCache(String name, Duration ttl, Clock clock) {
        this.name = name != null ? name : "scoreboard";
        this.ttl = ttl != null ? ttl : Duration.ofSeconds(2);
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public Optional<List<Participant>> get() {
        ScoreboardSnapshot current = currentSnapshot();
        if (current != null && current.isFresh(ttl, clock.instant())) {
            hits.incrementAndGet();
            logger.trace("[{}] Cache hit ({} entries)", name, current.participants().size());
            return Optional.of(current.participants());
        }
        misses.incrementAndGet();
        logger.trace("[{}] Cache miss", name);
        return Optional.empty();
    }

    public void put(List<Participant> participants) {
        ScoreboardSnapshot next = ScoreboardSnapshot.of(participants, clock.instant());
        lock.writeLock().lock();
        try {
            snapshot = next;
        } finally {
            lock.writeLock().unlock();
        }
        logger.trace("[{}] Cached {} entries", name, next.participants().size());
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            snapshot = null;
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("[{}] Cache cleared", name);
    }

    public State getState() {
        ScoreboardSnapshot current = currentSnapshot();
        if (current == null) {
            return State.COLD;
        }
        return current.isFresh(ttl, clock.instant()) ? State.WARM : State.STALE;
    }

    public long getHitCount() {
        return hits.get();
    }

    public long getMissCount() {
        return misses.get();
    }

    /**
     * @return Hit rate as percentage (0-100)
     */
    public double getHitRate() {
        long total = hits.get() + misses.get();
        return total > 0 ? (double) hits.get() / total * 100 : 0;
    }

    public Map<String, Object> getStats() {
        ScoreboardSnapshot current = currentSnapshot();
        Instant now = clock.instant();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", name);
        result.put("type", "local");
        result.put("state", getState().name());
        result.put("ttl_ms", ttl.toMillis());
        result.put("size", current != null ? current.participants().size() : 0);
        result.put("age_ms", current != null ? current.getAge(now).toMillis() : null);
        result.put("hits", getHitCount());
        result.put("misses", getMissCount());
        result.put("hit_rate", String.format("%.2f%%", getHitRate()));
        return result;
    }

    private ScoreboardSnapshot currentSnapshot() {
        lock.readLock().lock();
        try {
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }
}
