package com.fundfeed.repository.jpa;

import com.fundfeed.entity.CacheEntryEntity;
import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the cache_entry table.
 * Written through by JpaCacheStore; compacted by CacheMaintenanceService.
 */
@Repository
public interface CacheEntryJpaRepository extends JpaRepository<CacheEntryEntity, String> {

    /** Deletes rows that expired before the cutoff. Uses idx_cache_entry_expires_at. */
    @Modifying
    @Transactional
    @Query("DELETE FROM CacheEntryEntity c WHERE c.expiresAt < :cutoff")
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
