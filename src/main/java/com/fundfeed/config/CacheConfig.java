package com.fundfeed.config;

import com.fundfeed.cache.CacheStore;
import com.fundfeed.cache.InMemoryCacheStore;
import com.fundfeed.cache.JpaCacheStore;
import com.fundfeed.mapper.CacheEntryMapper;
import com.fundfeed.repository.jpa.CacheEntryJpaRepository;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties and the {@link CacheStore} bean for the fetch cache.
 *
 * <p>Binds to {@code fundfeed.cache.*}. {@code store=persistent} (default) keeps entries in
 * the H2 cache_entry table behind a Caffeine front; {@code store=memory} keeps them in
 * Caffeine only.
 */
@Configuration
@ConfigurationProperties(prefix = "fundfeed.cache")
@Getter
@Setter
public class CacheConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheConfig.class);

    /** persistent | memory */
    private String store = "persistent";

    /** Upper bound on entries held in memory. */
    private long maxEntries = 10_000;

    /** How long an expired entry stays available as a stale fallback. */
    private Duration staleRetention = Duration.ofDays(7);

    /** Delay between compaction runs. */
    private Duration compactionInterval = Duration.ofHours(1);

    @Bean
    public CacheStore cacheStore(CacheEntryJpaRepository cacheEntryJpaRepository, CacheEntryMapper cacheEntryMapper) {
        if ("memory".equalsIgnoreCase(store)) {
            log.info("Using in-memory fetch cache (max {} entries)", maxEntries);
            return new InMemoryCacheStore(maxEntries);
        }
        if (!"persistent".equalsIgnoreCase(store)) {
            throw new IllegalStateException("Unknown fundfeed.cache.store '" + store + "', expected persistent|memory");
        }
        log.info("Using persistent fetch cache (front max {} entries)", maxEntries);
        return new JpaCacheStore(cacheEntryJpaRepository, cacheEntryMapper, maxEntries);
    }
}
