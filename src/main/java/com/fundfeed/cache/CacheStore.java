package com.fundfeed.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Keyed store of serialized values with per-entry expiry.
 *
 * <p>Expired entries are not removed on read: {@link #getAllowStale(String)} keeps
 * returning them (flagged stale) until {@link #compact(Duration)} deletes entries that
 * expired more than the retention window ago. Concurrent writers to the same key follow
 * last-writer-wins.
 *
 * <p>Every time-dependent operation has an overload taking an explicit {@code now} so the
 * expiry rules can be exercised without waiting on the wall clock.
 */
public interface CacheStore {

    /** Returns the value only if the entry exists and has not expired. */
    default Optional<String> get(String key) {
        return get(key, Instant.now());
    }

    Optional<String> get(String key, Instant now);

    /** Returns the value regardless of expiry, with a flag telling whether it is stale. */
    default Optional<CacheLookup> getAllowStale(String key) {
        return getAllowStale(key, Instant.now());
    }

    Optional<CacheLookup> getAllowStale(String key, Instant now);

    /**
     * Upserts the entry with {@code createdAt = now} and {@code expiresAt = now + ttl}.
     *
     * @throws IllegalArgumentException if {@code ttl} is zero or negative
     */
    default void set(String key, String value, Duration ttl) {
        set(key, value, ttl, Instant.now());
    }

    void set(String key, String value, Duration ttl, Instant now);

    /**
     * Deletes entries whose expiry is older than {@code now - retention}.
     *
     * @return number of entries removed
     */
    default int compact(Duration retention) {
        return compact(retention, Instant.now());
    }

    int compact(Duration retention, Instant now);

    /** Builds the entry for a write, rejecting non-positive TTLs. */
    static CacheEntry newEntry(String key, String value, Duration ttl, Instant now) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must be positive, got " + ttl + " for key " + key);
        }
        if (value == null) {
            throw new IllegalArgumentException("Cache value must not be null for key " + key);
        }
        return CacheEntry.builder()
                .key(key)
                .value(value)
                .createdAt(now)
                .expiresAt(now.plus(ttl))
                .build();
    }
}
