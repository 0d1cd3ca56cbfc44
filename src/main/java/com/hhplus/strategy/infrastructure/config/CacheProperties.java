package com.hhplus.strategy.infrastructure.config;

import com.hhplus.strategy.domain.cache.TtlTier;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * 캐시 동작 설정 (cache.lock / cache.aside / cache.executor / cache.maintenance / cache.policy)
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

    private Lock lock = new Lock();

    private Aside aside = new Aside();

    private Executor executor = new Executor();

    private Maintenance maintenance = new Maintenance();

    private Policy policy = new Policy();

    @Getter
    @Setter
    public static class Lock {

        private Duration defaultLease = Duration.ofSeconds(5);

        private Duration maxWait = Duration.ofSeconds(10);

        private Duration initialBackoff = Duration.ofMillis(50);

        private Duration maxBackoff = Duration.ofSeconds(1);
    }

    @Getter
    @Setter
    public static class Aside {

        /**
         * true 면 getOrSet 미스 후 기록을 호출 스레드에서 동기 수행
         */
        private boolean synchronousWrite = false;
    }

    @Getter
    @Setter
    public static class Executor {

        private int writePoolSize = 4;

        private int queueCapacity = 1000;

        private int warmupPoolSize = 4;
    }

    @Getter
    @Setter
    public static class Maintenance {

        private boolean enabled = true;

        private Duration cleanupInterval = Duration.ofMinutes(10);
    }

    @Getter
    @Setter
    public static class Policy {

        /**
         * 모델명 → TTL 등급 재정의 (예: cache.policy.ttl-overrides.User=LONG)
         */
        private Map<String, TtlTier> ttlOverrides = new HashMap<>();
    }
}
