package me.internalizable.cricketscore.ratelimit;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process rate limiter keeping the last accepted event time per identity.
 *
 * Entries expire from the Caffeine table once their cooldown has passed. Lookups
 * share a read lock, updates take the write lock so check-and-record is atomic.
 */
public class LocalRateLimiter implements RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(LocalRateLimiter.class);

    private final Cache<String, Instant> lastAccepted;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Duration cooldown;
    private final Clock clock;

    public LocalRateLimiter(Duration cooldown, Clock clock) {
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be zero or positive");
        }
        this.cooldown = cooldown;
        this.clock = clock;
        this.lastAccepted = Caffeine.newBuilder()
                .expireAfterWrite(cooldown)
                .ticker(() -> clock.millis() * 1_000_000L)
                .build();
    }

    @Override
    public boolean isThrottled(String identity) {
        Instant last;
        lock.readLock().lock();
        try {
            last = lastAccepted.getIfPresent(identity);
        } finally {
            lock.readLock().unlock();
        }
        return last != null && withinCooldown(last, clock.instant());
    }

    @Override
    public void record(String identity) {
        lock.writeLock().lock();
        try {
            lastAccepted.put(identity, clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean tryAcquire(String identity) {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            Instant last = lastAccepted.getIfPresent(identity);
            if (last != null && withinCooldown(last, now)) {
                return false;
            }
            lastAccepted.put(identity, now);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void reset(String identity) {
        lock.writeLock().lock();
        try {
            lastAccepted.invalidate(identity);
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Rate limit reset for roll number: {}", identity);
    }

    @Override
    public long size() {
        lastAccepted.cleanUp();
        return lastAccepted.estimatedSize();
    }

    private boolean withinCooldown(Instant last, Instant now) {
        return Duration.between(last, now).compareTo(cooldown) < 0;
    }
}
