package com.fundfeed.cache;

import com.fundfeed.entity.CacheEntryEntity;
import com.fundfeed.mapper.CacheEntryMapper;
import com.fundfeed.repository.jpa.CacheEntryJpaRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable {@link CacheStore}: writes go through to the cache_entry table synchronously,
 * reads hit a Caffeine front first and fall back to the table.
 *
 * <p>A value is on disk before {@link #set} returns, so a process restart right after a
 * successful fetch still finds it. The front only mirrors rows; losing it costs one
 * table read per key.
 */
public class JpaCacheStore implements CacheStore {

    private static final Logger log = LoggerFactory.getLogger(JpaCacheStore.class);

    private final CacheEntryJpaRepository cacheEntryJpaRepository;
    private final CacheEntryMapper cacheEntryMapper;
    private final Cache<String, CacheEntry> front;
    private final ReentrantLock lock = new ReentrantLock();

    public JpaCacheStore(
            CacheEntryJpaRepository cacheEntryJpaRepository, CacheEntryMapper cacheEntryMapper, long maxFrontEntries) {
        this.cacheEntryJpaRepository = cacheEntryJpaRepository;
        this.cacheEntryMapper = cacheEntryMapper;
        this.front = Caffeine.newBuilder().maximumSize(maxFrontEntries).build();
    }

    @Override
    public Optional<String> get(String key, Instant now) {
        return load(key).filter(entry -> !entry.isExpired(now)).map(CacheEntry::getValue);
    }

    @Override
    public Optional<CacheLookup> getAllowStale(String key, Instant now) {
        return load(key).map(entry -> new CacheLookup(entry.getValue(), entry.isExpired(now)));
    }

    @Override
    public void set(String key, String value, Duration ttl, Instant now) {
        CacheEntry entry = CacheStore.newEntry(key, value, ttl, now);
        lock.lock();
        try {
            cacheEntryJpaRepository.save(cacheEntryMapper.toEntity(entry));
            front.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int compact(Duration retention, Instant now) {
        Instant cutoff = now.minus(retention);
        lock.lock();
        try {
            int removed = cacheEntryJpaRepository.deleteExpiredBefore(cutoff);
            front.asMap().values().removeIf(entry -> entry.getExpiresAt().isBefore(cutoff));
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private Optional<CacheEntry> load(String key) {
        lock.lock();
        try {
            CacheEntry cached = front.getIfPresent(key);
            if (cached != null) {
                return Optional.of(cached);
            }
            Optional<CacheEntryEntity> row = cacheEntryJpaRepository.findById(key);
            if (row.isEmpty()) {
                return Optional.empty();
            }
            CacheEntry entry = cacheEntryMapper.toDomain(row.get());
            front.put(key, entry);
            log.debug("Loaded cache entry {} from table (expires {})", key, entry.getExpiresAt());
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }
}
