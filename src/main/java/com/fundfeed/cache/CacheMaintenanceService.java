package com.fundfeed.cache;

import com.fundfeed.config.CacheConfig;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically deletes cache entries that expired longer ago than the stale retention
 * window. Until then an expired entry remains available as a stale fallback.
 */
@Service
public class CacheMaintenanceService {

    private static final Logger log = LoggerFactory.getLogger(CacheMaintenanceService.class);

    private final CacheStore cacheStore;
    private final CacheConfig cacheConfig;

    public CacheMaintenanceService(CacheStore cacheStore, CacheConfig cacheConfig) {
        this.cacheStore = cacheStore;
        this.cacheConfig = cacheConfig;
    }

    @Scheduled(
            fixedDelayString = "${fundfeed.cache.compaction-interval:PT1H}",
            initialDelayString = "${fundfeed.cache.compaction-initial-delay:PT5M}")
    public void compactExpired() {
        compactExpired(Instant.now());
    }

    /** Testable version: compacts relative to the given instant. */
    public int compactExpired(Instant now) {
        try {
            int removed = cacheStore.compact(cacheConfig.getStaleRetention(), now);
            if (removed > 0) {
                log.info("Cache compaction removed {} entries older than {}", removed, cacheConfig.getStaleRetention());
            }
            return removed;
        } catch (RuntimeException e) {
            log.error("Cache compaction failed", e);
            return 0;
        }
    }
}
