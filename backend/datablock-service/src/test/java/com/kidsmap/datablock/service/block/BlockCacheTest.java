package com.kidsmap.datablock.service.block;

import com.kidsmap.datablock.config.RedisCacheConfig;
import com.kidsmap.datablock.dto.block.PlaceBlockDto;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * BlockCache 단위 테스트. 에러 핸들러는 RedisCacheConfig 의 것을 그대로 쓴다.
 */
class BlockCacheTest {

    private final UUID id = UUID.fromString("11111111-2222-3333-4444-555555555555");

    private SimpleMeterRegistry meterRegistry;
    private RedisCacheConfig cacheConfig;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        cacheConfig = new RedisCacheConfig(meterRegistry, mock(ObjectProvider.class));
    }

    private double errors(String operation) {
        var counter = meterRegistry.find("cache.error").tag("operation", operation).counter();
        return counter != null ? counter.count() : 0;
    }

    @Test
    @DisplayName("캐시에 넣은 장소는 같은 id 로 다시 조회되고 evict 후에는 사라진다")
    void putGetEvict() {
        // given
        BlockCache blockCache = new BlockCache(
                new ConcurrentMapCacheManager(RedisCacheConfig.PLACE_BLOCKS), cacheConfig.cacheErrorHandler());
        PlaceBlockDto dto = PlaceBlockDto.builder().id(id).name("서울어린이대공원").build();

        // when
        blockCache.putPlace(dto);

        // then
        assertThat(blockCache.getPlace(id)).isSameAs(dto);
        blockCache.evictPlace(id);
        assertThat(blockCache.getPlace(id)).isNull();
    }

    @Test
    @DisplayName("Redis 장애는 에러 핸들러가 받아 메트릭만 남기고 캐시 미스로 처리한다")
    void redisFailureIsHandled() {
        // given
        Cache cache = mock(Cache.class);
        when(cache.getName()).thenReturn(RedisCacheConfig.PLACE_BLOCKS);
        RedisConnectionFailureException failure = new RedisConnectionFailureException("Connection refused");
        when(cache.get(anyString(), eq(PlaceBlockDto.class))).thenThrow(failure);
        doThrow(failure).when(cache).put(anyString(), any());
        doThrow(failure).when(cache).evict(any());
        CacheManager cacheManager = mock(CacheManager.class);
        when(cacheManager.getCache(RedisCacheConfig.PLACE_BLOCKS)).thenReturn(cache);
        BlockCache blockCache = new BlockCache(cacheManager, cacheConfig.cacheErrorHandler());

        // when & then
        assertThat(blockCache.getPlace(id)).isNull();
        assertThatCode(() -> blockCache.putPlace(PlaceBlockDto.builder().id(id).build())).doesNotThrowAnyException();
        assertThatCode(() -> blockCache.evictPlace(id)).doesNotThrowAnyException();
        assertThat(errors("get")).isEqualTo(1.0);
        assertThat(errors("put")).isEqualTo(1.0);
        assertThat(errors("evict")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("등록되지 않은 캐시 이름이면 조회하지 않는다")
    void missingCache() {
        CacheManager cacheManager = mock(CacheManager.class);
        BlockCache blockCache = new BlockCache(cacheManager, cacheConfig.cacheErrorHandler());

        assertThat(blockCache.getStats()).isNull();
        verify(cacheManager).getCache(RedisCacheConfig.BLOCK_STATS);
    }
}
