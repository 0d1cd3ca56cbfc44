package com.hhplus.strategy.application.cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 캐시 유지보수 스케줄러
 *
 * 주기적으로 비어 있는 태그 Set 을 정리한다.
 * 만료된 값은 저장소 TTL 이 회수하므로 여기서는 다루지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "cache.maintenance.enabled", havingValue = "true", matchIfMissing = true)
public class CacheMaintenanceScheduler {

    private final CacheService cacheService;

    @Scheduled(fixedDelayString = "${cache.maintenance.cleanup-interval:PT10M}",
            initialDelayString = "${cache.maintenance.cleanup-interval:PT10M}")
    public void cleanupEmptyTagSets() {
        log.debug("[CacheMaintenance] 태그 Set 정리 시작");
        cacheService.cleanup();
    }
}
