package com.fundfeed.mapper;

import com.fundfeed.cache.CacheEntry;
import com.fundfeed.entity.CacheEntryEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between the CacheEntry value and CacheEntryEntity.
 * The entity prefixes key and value columns to stay clear of SQL reserved words.
 */
@Mapper
public interface CacheEntryMapper {

    @Mapping(source = "key", target = "cacheKey")
    @Mapping(source = "value", target = "cacheValue")
    CacheEntryEntity toEntity(CacheEntry entry);

    @Mapping(source = "cacheKey", target = "key")
    @Mapping(source = "cacheValue", target = "value")
    CacheEntry toDomain(CacheEntryEntity entity);
}
