package com.fundfeed.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the cache_entry table.
 * Durable backing of the fetch cache so that the last good value survives a restart and can
 * still be served as a stale fallback while every vendor is down.
 */
@Entity
@Table(name = "cache_entry", indexes = @Index(name = "idx_cache_entry_expires_at", columnList = "expires_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CacheEntryEntity {

    @Id
    @Column(name = "cache_key", length = 255)
    private String cacheKey;

    /** Serialized JSON payload. Sector rankings can run to tens of kilobytes. */
    @Lob
    @Column(name = "cache_value", nullable = false)
    private String cacheValue;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
