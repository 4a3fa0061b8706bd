package com.kidsmap.datablock.config;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.jsontype.impl.LaissezFaireSubTypeValidator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.cache.support.CompositeCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.GenericJackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 블록 조회 캐시 설정
 *
 * - Redis 가 켜져 있으면 Redis 우선, Caffeine 로컬 캐시 폴백
 * - Redis 장애 시 에러 핸들러가 로깅/메트릭만 남기고 DB 조회로 진행 (BlockCache 가 사용)
 */
@Configuration
@Slf4j
public class RedisCacheConfig {

    public static final String PLACE_BLOCKS = "placeBlocks";
    public static final String CONTENT_BLOCKS = "contentBlocks";
    public static final String BLOCK_STATS = "blockStats";

    @Value("${spring.application.name:kidsmap-datablock}")
    private String applicationName;

    @Value("${datablock.cache.redis-enabled:false}")
    private boolean redisEnabled;

    @Value("${cache.blocks.ttl-minutes:60}")
    private int blocksTtlMinutes;

    @Value("${cache.stats.ttl-minutes:10}")
    private int statsTtlMinutes;

    @Value("${cache.local.max-size:5000}")
    private int localCacheMaxSize;

    @Value("${cache.local.ttl-minutes:10}")
    private int localCacheTtlMinutes;

    private final MeterRegistry meterRegistry;
    private final ObjectProvider<RedisConnectionFactory> connectionFactoryProvider;

    public RedisCacheConfig(MeterRegistry meterRegistry,
                            ObjectProvider<RedisConnectionFactory> connectionFactoryProvider) {
        this.meterRegistry = meterRegistry;
        this.connectionFactoryProvider = connectionFactoryProvider;
    }

    /**
     * ObjectMapper 설정 (타입 정보 포함)
     */
    private ObjectMapper createCacheObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.activateDefaultTyping(
                LaissezFaireSubTypeValidator.instance,
                ObjectMapper.DefaultTyping.NON_FINAL,
                JsonTypeInfo.As.PROPERTY
        );
        return mapper;
    }

    private RedisCacheManager buildRedisCacheManager(RedisConnectionFactory connectionFactory) {
        String keyPrefix = applicationName + ":cache:";

        RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(Duration.ofMinutes(blocksTtlMinutes))
                .prefixCacheNameWith(keyPrefix)
                .serializeKeysWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                                new StringRedisSerializer()
                        )
                )
                .serializeValuesWith(
                        RedisSerializationContext.SerializationPair.fromSerializer(
                                new GenericJackson2JsonRedisSerializer(createCacheObjectMapper())
                        )
                )
                .disableCachingNullValues();

        Map<String, RedisCacheConfiguration> cacheConfigurations = new HashMap<>();
        cacheConfigurations.put(PLACE_BLOCKS, defaultConfig);
        cacheConfigurations.put(CONTENT_BLOCKS, defaultConfig);
        // 통계는 주기적으로 재계산되므로 짧게
        cacheConfigurations.put(BLOCK_STATS, defaultConfig.entryTtl(Duration.ofMinutes(statsTtlMinutes)));

        RedisCacheManager cacheManager = RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(defaultConfig)
                .withInitialCacheConfigurations(cacheConfigurations)
                .enableStatistics()
                .build();
        cacheManager.afterPropertiesSet();

        log.info("Redis Cache Manager initialized with prefix: {}", keyPrefix);
        return cacheManager;
    }

    /**
     * 로컬 캐시 매니저 (Caffeine) - 폴백용
     */
    @Bean
    public CaffeineCacheManager caffeineCacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(
                Caffeine.newBuilder()
                        .maximumSize(localCacheMaxSize)
                        .expireAfterWrite(Duration.ofMinutes(localCacheTtlMinutes))
                        .recordStats()
        );
        cacheManager.setCacheNames(List.of(PLACE_BLOCKS, CONTENT_BLOCKS, BLOCK_STATS));
        return cacheManager;
    }

    /**
     * 복합 캐시 매니저 (Redis 우선, Caffeine 폴백)
     */
    @Bean
    @Primary
    public CacheManager cacheManager() {
        List<CacheManager> managers = new ArrayList<>();

        RedisConnectionFactory connectionFactory = redisEnabled ? connectionFactoryProvider.getIfAvailable() : null;
        if (connectionFactory != null) {
            managers.add(buildRedisCacheManager(connectionFactory));
            log.info("Using Redis as primary cache with Caffeine fallback");
        } else {
            log.info("Redis disabled, using Caffeine as primary cache");
        }
        managers.add(caffeineCacheManager());

        CompositeCacheManager compositeCacheManager = new CompositeCacheManager();
        compositeCacheManager.setCacheManagers(managers);
        compositeCacheManager.setFallbackToNoOpCache(false);
        return compositeCacheManager;
    }

    /**
     * 캐시 에러 핸들러 - Redis 장애 시 로깅만 하고 계속 진행
     */
    @Bean
    public CacheErrorHandler cacheErrorHandler() {
        return new CacheErrorHandler() {
            @Override
            public void handleCacheGetError(RuntimeException exception, Cache cache, Object key) {
                log.warn("Cache GET error - cache: {}, key: {}, error: {}",
                        cache.getName(), key, exception.getMessage());
                meterRegistry.counter("cache.error",
                        "cache", cache.getName(),
                        "operation", "get").increment();
            }

            @Override
            public void handleCachePutError(RuntimeException exception, Cache cache, Object key, Object value) {
                log.warn("Cache PUT error - cache: {}, key: {}, error: {}",
                        cache.getName(), key, exception.getMessage());
                meterRegistry.counter("cache.error",
                        "cache", cache.getName(),
                        "operation", "put").increment();
            }

            @Override
            public void handleCacheEvictError(RuntimeException exception, Cache cache, Object key) {
                log.warn("Cache EVICT error - cache: {}, key: {}, error: {}",
                        cache.getName(), key, exception.getMessage());
                meterRegistry.counter("cache.error",
                        "cache", cache.getName(),
                        "operation", "evict").increment();
            }

            @Override
            public void handleCacheClearError(RuntimeException exception, Cache cache) {
                log.warn("Cache CLEAR error - cache: {}, error: {}",
                        cache.getName(), exception.getMessage());
                meterRegistry.counter("cache.error",
                        "cache", cache.getName(),
                        "operation", "clear").increment();
            }
        };
    }
}
