package com.fundfeed.cache;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One stored value with its write time and expiry. An entry is fresh while
 * {@code now <= expiresAt}; after that it is only served through stale reads until
 * compaction removes it.
 */
@Value
@Builder
public class CacheEntry {

    String key;
    String value;
    Instant createdAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
