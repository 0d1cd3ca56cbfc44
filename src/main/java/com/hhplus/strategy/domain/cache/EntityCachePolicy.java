package com.hhplus.strategy.domain.cache;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 엔티티 타입 → (TTL 등급, 무효화 태그) 매핑
 *
 * 특징:
 * - 전체 함수: 규칙이 없는 모델은 SHORT 등급, 무효화 태그 없음
 * - 설정(cache.policy.ttl-overrides)으로 모델별 TTL 등급 재정의 가능
 */
public class EntityCachePolicy {

    static final TtlTier DEFAULT_TIER = TtlTier.SHORT;

    private final Map<String, TtlTier> ttlOverrides;

    public EntityCachePolicy() {
        this(Collections.emptyMap());
    }

    public EntityCachePolicy(Map<String, TtlTier> ttlOverrides) {
        this.ttlOverrides = ttlOverrides == null ? Collections.emptyMap() : new HashMap<>(ttlOverrides);
    }

    public TtlTier ttlTierOf(String modelName) {
        TtlTier override = ttlOverrides.get(modelName);
        if (override != null) {
            return override;
        }
        return EntityCacheRule.fromModel(modelName)
                .map(EntityCacheRule::getTtlTier)
                .orElse(DEFAULT_TIER);
    }

    public Duration ttlOf(String modelName) {
        return ttlTierOf(modelName).getTtl();
    }

    public Set<CacheTag> invalidationTagsOf(String modelName) {
        return EntityCacheRule.fromModel(modelName)
                .map(EntityCacheRule::getInvalidationTags)
                .orElse(Collections.emptySet());
    }
}
