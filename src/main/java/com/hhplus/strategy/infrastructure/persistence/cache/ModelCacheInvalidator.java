package com.hhplus.strategy.infrastructure.persistence.cache;

import com.hhplus.strategy.application.cache.CacheService;
import com.hhplus.strategy.domain.cache.CacheTag;
import com.hhplus.strategy.domain.cache.EntityCachePolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 엔티티 변경 후 캐시 무효화
 *
 * 무효화 대상:
 * 1. jpa:{Model}:* 패턴의 리포지토리 조회 캐시 (deleteMany)
 * 2. 모델에 매핑된 태그 (invalidateByTag)
 *
 * 실행 시점:
 * - 트랜잭션 동기화가 활성화된 경우: 커밋 후 (afterCommit), 롤백되면 무효화하지 않음
 * - 트랜잭션 밖: 즉시
 *
 * 한 트랜잭션에서 같은 모델을 여러 번 변경해도 커밋 후 한 번만 무효화한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelCacheInvalidator {

    private final CacheService cacheService;
    private final EntityCachePolicy entityCachePolicy;

    public void invalidateAfterCommit(String model) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            invalidate(model);
            return;
        }
        PendingInvalidation pending = currentPending().orElseGet(() -> {
            PendingInvalidation created = new PendingInvalidation();
            TransactionSynchronizationManager.registerSynchronization(created);
            return created;
        });
        if (pending.models.add(model)) {
            log.debug("[RepositoryCache] 커밋 후 무효화 예약 - model: {}", model);
        }
    }

    /**
     * 현재 트랜잭션에서 변경했지만 아직 커밋되지 않은 모델인지
     */
    public boolean hasPendingInvalidation(String model) {
        return currentPending().map(pending -> pending.models.contains(model)).orElse(false);
    }

    public void invalidate(String model) {
        long deleted = cacheService.deleteMany(QueryCacheKeyGenerator.modelPattern(model));
        long invalidated = 0;
        for (CacheTag tag : entityCachePolicy.invalidationTagsOf(model)) {
            invalidated += cacheService.invalidateByTag(tag);
        }
        log.info("[RepositoryCache] 캐시 무효화 - model: {}, 조회 캐시: {}, 태그 캐시: {}", model, deleted, invalidated);
    }

    private Optional<PendingInvalidation> currentPending() {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return Optional.empty();
        }
        return TransactionSynchronizationManager.getSynchronizations().stream()
                .filter(PendingInvalidation.class::isInstance)
                .map(PendingInvalidation.class::cast)
                .findFirst();
    }

    /**
     * 트랜잭션 커밋 후 예약된 모델을 무효화하는 TransactionSynchronization
     */
    private class PendingInvalidation implements TransactionSynchronization {

        private final Set<String> models = new LinkedHashSet<>();

        @Override
        public void afterCommit() {
            for (String model : models) {
                try {
                    invalidate(model);
                } catch (RuntimeException e) {
                    log.warn("[RepositoryCache] 커밋 후 무효화 실패 - model: {}", model, e);
                }
            }
        }

        @Override
        public void afterCompletion(int status) {
            if (status != STATUS_COMMITTED && !models.isEmpty()) {
                log.debug("[RepositoryCache] 롤백으로 무효화 취소 - models: {}", models);
            }
            models.clear();
        }
    }
}
