package com.kidsmap.datablock.service.block;

import com.kidsmap.datablock.config.RedisCacheConfig;
import com.kidsmap.datablock.dto.block.BlockStats;
import com.kidsmap.datablock.dto.block.ContentBlockDto;
import com.kidsmap.datablock.dto.block.PlaceBlockDto;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * placeBlocks / contentBlocks / blockStats 캐시 접근.
 * 캐시 오류는 CacheErrorHandler 로 넘기고 조회 실패로만 취급해 DB 경로로 계속 진행한다.
 */
@Component
@RequiredArgsConstructor
public class BlockCache {

    private static final String STATS_KEY = "latest";

    private final CacheManager cacheManager;
    private final CacheErrorHandler cacheErrorHandler;

    public PlaceBlockDto getPlace(UUID id) {
        return get(RedisCacheConfig.PLACE_BLOCKS, id, PlaceBlockDto.class);
    }

    public void putPlace(PlaceBlockDto dto) {
        put(RedisCacheConfig.PLACE_BLOCKS, dto.getId(), dto);
    }

    public void evictPlace(UUID id) {
        evict(RedisCacheConfig.PLACE_BLOCKS, id);
    }

    public ContentBlockDto getContent(UUID id) {
        return get(RedisCacheConfig.CONTENT_BLOCKS, id, ContentBlockDto.class);
    }

    public void putContent(ContentBlockDto dto) {
        put(RedisCacheConfig.CONTENT_BLOCKS, dto.getId(), dto);
    }

    public void evictContent(UUID id) {
        evict(RedisCacheConfig.CONTENT_BLOCKS, id);
    }

    public BlockStats getStats() {
        return get(RedisCacheConfig.BLOCK_STATS, STATS_KEY, BlockStats.class);
    }

    public void putStats(BlockStats stats) {
        put(RedisCacheConfig.BLOCK_STATS, STATS_KEY, stats);
    }

    private <T> T get(String cacheName, Object key, Class<T> type) {
        Cache cache = key != null ? cacheManager.getCache(cacheName) : null;
        if (cache == null) return null;
        try {
            return cache.get(key.toString(), type);
        } catch (RuntimeException e) {
            cacheErrorHandler.handleCacheGetError(e, cache, key);
            return null;
        }
    }

    private void put(String cacheName, Object key, Object value) {
        Cache cache = key != null ? cacheManager.getCache(cacheName) : null;
        if (cache == null) return;
        try {
            cache.put(key.toString(), value);
        } catch (RuntimeException e) {
            cacheErrorHandler.handleCachePutError(e, cache, key, value);
        }
    }

    private void evict(String cacheName, UUID id) {
        Cache cache = id != null ? cacheManager.getCache(cacheName) : null;
        if (cache == null) return;
        try {
            cache.evict(id.toString());
        } catch (RuntimeException e) {
            cacheErrorHandler.handleCacheEvictError(e, cache, id);
        }
    }
}
