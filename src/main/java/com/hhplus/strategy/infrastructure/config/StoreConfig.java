package com.hhplus.strategy.infrastructure.config;

import com.hhplus.strategy.infrastructure.store.CappedLinearDelay;
import com.hhplus.strategy.infrastructure.store.InMemoryStoreClient;
import com.hhplus.strategy.infrastructure.store.RedisStoreClient;
import com.hhplus.strategy.infrastructure.store.StoreClient;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.TimeoutOptions;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

/**
 * 캐시 저장소 설정
 *
 * cache.store.type 에 따라 저장소 클라이언트를 선택한다.
 * - redis (기본): Lettuce 연결 + RedisStoreClient
 * - in-memory: InMemoryStoreClient (로컬 실행, 테스트)
 *
 * Redis 연결 정책:
 * - 재연결 지연: min(attempt × baseDelay, maxDelay)
 * - offline-queue=true 면 연결이 끊긴 동안 명령을 큐에 적재, false 면 즉시 거부
 * - 연결 타임아웃, 명령 타임아웃 적용
 * - 연결은 첫 명령 시점에 맺는다 (LettuceConnectionFactory 기본 동작)
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(StoreProperties.class)
public class StoreConfig {

    private static final String STORE_TYPE = "cache.store.type";

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(name = STORE_TYPE, havingValue = "redis", matchIfMissing = true)
    public ClientResources storeClientResources(StoreProperties storeProperties) {
        StoreProperties.Retry retry = storeProperties.getRetry();
        return DefaultClientResources.builder()
                .reconnectDelay(new CappedLinearDelay(retry.getBaseDelay(), retry.getMaxDelay()))
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = STORE_TYPE, havingValue = "redis", matchIfMissing = true)
    public LettuceConnectionFactory redisConnectionFactory(StoreProperties storeProperties,
                                                           ClientResources storeClientResources) {
        RedisStandaloneConfiguration standalone =
                new RedisStandaloneConfiguration(storeProperties.getHost(), storeProperties.getPort());
        standalone.setDatabase(storeProperties.getDatabase());
        if (StringUtils.hasText(storeProperties.getPassword())) {
            standalone.setPassword(RedisPassword.of(storeProperties.getPassword()));
        }

        ClientOptions clientOptions = ClientOptions.builder()
                .autoReconnect(true)
                .disconnectedBehavior(storeProperties.isOfflineQueue()
                        ? ClientOptions.DisconnectedBehavior.ACCEPT_COMMANDS
                        : ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                .socketOptions(SocketOptions.builder()
                        .connectTimeout(storeProperties.getConnectTimeout())
                        .build())
                .timeoutOptions(TimeoutOptions.enabled(storeProperties.getCommandTimeout()))
                .build();

        LettuceClientConfiguration clientConfiguration = LettuceClientConfiguration.builder()
                .clientOptions(clientOptions)
                .clientResources(storeClientResources)
                .commandTimeout(storeProperties.getCommandTimeout())
                .build();

        log.info("[StoreConfig] Redis 저장소 설정 - {}:{} db={}, prefix={}",
                storeProperties.getHost(), storeProperties.getPort(),
                storeProperties.getDatabase(), storeProperties.getKeyPrefix());
        return new LettuceConnectionFactory(standalone, clientConfiguration);
    }

    @Bean
    @ConditionalOnProperty(name = STORE_TYPE, havingValue = "redis", matchIfMissing = true)
    public StringRedisTemplate storeRedisTemplate(LettuceConnectionFactory redisConnectionFactory) {
        return new StringRedisTemplate(redisConnectionFactory);
    }

    @Bean
    @ConditionalOnProperty(name = STORE_TYPE, havingValue = "redis", matchIfMissing = true)
    public StoreClient redisStoreClient(StringRedisTemplate storeRedisTemplate, StoreProperties storeProperties) {
        return new RedisStoreClient(storeRedisTemplate, storeProperties);
    }

    @Bean
    @ConditionalOnProperty(name = STORE_TYPE, havingValue = "in-memory")
    public StoreClient inMemoryStoreClient() {
        log.info("[StoreConfig] 인메모리 저장소 사용");
        return new InMemoryStoreClient();
    }
}
