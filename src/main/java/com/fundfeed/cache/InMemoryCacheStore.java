package com.fundfeed.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-durable {@link CacheStore} backed by a size-bounded Caffeine cache.
 *
 * <p>Caffeine's own expiry is not used: expired entries must stay readable
 * for the stale fallback, so expiry is evaluated here against {@link CacheEntry#getExpiresAt()}.
 * Used for tests and for local runs with {@code fundfeed.cache.store=memory}.
 */
public class InMemoryCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCacheStore.class);

    private final Cache<String, CacheEntry> entries;
    private final ReentrantLock lock = new ReentrantLock();

    public InMemoryCacheStore(long maxEntries) {
        this.entries = Caffeine.newBuilder().maximumSize(maxEntries).build();
    }

    @Override
    public Optional<String> get(String key, Instant now) {
        lock.lock();
        try {
            CacheEntry entry = entries.getIfPresent(key);
            if (entry == null || entry.isExpired(now)) {
                return Optional.empty();
            }
            return Optional.of(entry.getValue());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CacheLookup> getAllowStale(String key, Instant now) {
        lock.lock();
        try {
            CacheEntry entry = entries.getIfPresent(key);
            if (entry == null) {
                return Optional.empty();
            }
            return Optional.of(new CacheLookup(entry.getValue(), entry.isExpired(now)));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, String value, Duration ttl, Instant now) {
        CacheEntry entry = CacheStore.newEntry(key, value, ttl, now);
        lock.lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int compact(Duration retention, Instant now) {
        Instant cutoff = now.minus(retention);
        lock.lock();
        try {
            int before = entries.asMap().size();
            entries.asMap().values().removeIf(entry -> entry.getExpiresAt().isBefore(cutoff));
            int removed = before - entries.asMap().size();
            log.debug("In-memory cache compaction removed {} entries expired before {}", removed, cutoff);
            return removed;
        } finally {
            lock.unlock();
        }
    }
}
