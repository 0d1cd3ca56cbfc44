package com.hhplus.strategy.domain.cache;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * 엔티티 타입별 캐시 규칙
 *
 * 리포지토리 조회 결과의 TTL 등급과, 해당 엔티티가 변경될 때 무효화할 태그를 정의한다.
 */
public enum EntityCacheRule {

    USER("User", TtlTier.DB_USER, CacheTag.USER),
    ENTERPRISE("Enterprise", TtlTier.DB_ENTERPRISE, CacheTag.ENTERPRISE),
    DEPARTMENT("Department", TtlTier.DB_DEPARTMENT, CacheTag.DEPARTMENT),
    STRATEGY("Strategy", TtlTier.DB_STRATEGY, CacheTag.STRATEGY),
    MARKET_SELECTION("MarketSelection", TtlTier.DB_STRATEGY, CacheTag.STRATEGY),
    STRATEGY_FRAMEWORK("StrategyFramework", TtlTier.SHORT, CacheTag.STRATEGY),
    WINNING_POINT("WinningPoint", TtlTier.SHORT, CacheTag.STRATEGY),
    ACTION_PLAN("ActionPlan", TtlTier.SHORT, CacheTag.STRATEGY),
    KEY_METRIC("KeyMetric", TtlTier.SHORT, CacheTag.STRATEGY),
    DASHBOARD_CARD("DashboardCard", TtlTier.MEDIUM, CacheTag.DASHBOARD),
    DEPARTMENT_METRIC_TREND("DepartmentMetricTrend", TtlTier.SHORT, CacheTag.DASHBOARD),
    CUSTOMER_STRUCTURE_DATA("CustomerStructureData", TtlTier.MEDIUM),
    STRATEGY_TABLE_DATA("StrategyTableData", TtlTier.SHORT);

    private final String modelName;
    private final TtlTier ttlTier;
    private final Set<CacheTag> invalidationTags;

    EntityCacheRule(String modelName, TtlTier ttlTier, CacheTag... invalidationTags) {
        this.modelName = modelName;
        this.ttlTier = ttlTier;
        this.invalidationTags = invalidationTags.length == 0
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.of(invalidationTags[0], invalidationTags));
    }

    public static Optional<EntityCacheRule> fromModel(String modelName) {
        return Arrays.stream(values())
                .filter(rule -> rule.modelName.equals(modelName))
                .findFirst();
    }

    public String getModelName() {
        return modelName;
    }

    public TtlTier getTtlTier() {
        return ttlTier;
    }

    public Set<CacheTag> getInvalidationTags() {
        return invalidationTags;
    }
}
