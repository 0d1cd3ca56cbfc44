package com.hhplus.strategy.infrastructure.config;

import com.hhplus.strategy.domain.cache.EntityCachePolicy;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * 캐시 계층 설정
 *
 * 구성:
 * 1. entityCachePolicy: 엔티티별 TTL 등급 / 무효화 태그 (설정으로 TTL 재정의)
 * 2. cacheWriteExecutor: getOrSet 미스 후 비동기 기록
 * 3. cacheWarmupExecutor: 워밍업 계산 병렬 실행
 *
 * 캐시 값 ObjectMapper 는 JacksonConfig 에서 등록한다.
 */
@Configuration
@EnableConfigurationProperties(CacheProperties.class)
public class CacheConfig {

    @Bean
    public EntityCachePolicy entityCachePolicy(CacheProperties cacheProperties) {
        return new EntityCachePolicy(cacheProperties.getPolicy().getTtlOverrides());
    }

    /**
     * 캐시 기록 전용 Executor
     *
     * 큐가 가득 차면 거부되며, 거부된 기록은 CacheService 가 로그만 남기고 버린다.
     * 값은 다음 미스에서 다시 계산된다.
     */
    @Bean("cacheWriteExecutor")
    public Executor cacheWriteExecutor(CacheProperties cacheProperties) {
        CacheProperties.Executor settings = cacheProperties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getWritePoolSize());
        executor.setMaxPoolSize(settings.getWritePoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix("cache-write-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean("cacheWarmupExecutor")
    public Executor cacheWarmupExecutor(CacheProperties cacheProperties) {
        CacheProperties.Executor settings = cacheProperties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getWarmupPoolSize());
        executor.setMaxPoolSize(settings.getWarmupPoolSize());
        executor.setThreadNamePrefix("cache-warmup-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
