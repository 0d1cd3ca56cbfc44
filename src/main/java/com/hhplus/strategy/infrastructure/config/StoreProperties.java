package com.hhplus.strategy.infrastructure.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 캐시 저장소 연결 설정 (cache.store.*)
 *
 * 환경 변수로 재정의 가능 (REDIS_HOST, REDIS_PORT, REDIS_PASSWORD, REDIS_DB).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "cache.store")
public class StoreProperties {

    /**
     * redis | in-memory
     */
    private String type = "redis";

    private String host = "localhost";

    private int port = 6379;

    private String password;

    private int database = 0;

    private String keyPrefix = "strategy-performance:";

    /**
     * 연결이 끊긴 동안 명령을 큐에 쌓을지 (false 면 즉시 거부)
     */
    private boolean offlineQueue = true;

    /**
     * 연결 실패 시 명령당 재시도 횟수
     */
    private int maxRetriesPerRequest = 3;

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration commandTimeout = Duration.ofSeconds(2);

    private Retry retry = new Retry();

    @Getter
    @Setter
    public static class Retry {

        /**
         * 재연결 지연 = min(attempt × baseDelay, maxDelay)
         */
        private Duration baseDelay = Duration.ofMillis(50);

        private Duration maxDelay = Duration.ofSeconds(2);

        /**
         * 이 시간 이상 연속 실패하면 명령을 보내지 않고 즉시 실패 처리
         */
        private Duration maxRetryDuration = Duration.ofMinutes(5);

        /**
         * 즉시 실패 상태에서 연결 복구를 확인하는 주기
         */
        private Duration probeInterval = Duration.ofSeconds(30);
    }
}
