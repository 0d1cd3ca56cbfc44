package com.hhplus.strategy.domain.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntityCachePolicy 단위 테스트")
class EntityCachePolicyTest {

    private final EntityCachePolicy policy = new EntityCachePolicy();

    @Test
    @DisplayName("등록된 모델 - 규칙의 TTL 등급")
    void testTtlOf_KnownModels() {
        assertEquals(TtlTier.DB_USER, policy.ttlTierOf("User"));
        assertEquals(Duration.ofMinutes(10), policy.ttlOf("User"));
        assertEquals(Duration.ofMinutes(30), policy.ttlOf("Enterprise"));
        assertEquals(Duration.ofMinutes(15), policy.ttlOf("Department"));
        assertEquals(Duration.ofMinutes(5), policy.ttlOf("Strategy"));
        assertEquals(Duration.ofMinutes(30), policy.ttlOf("DashboardCard"));
    }

    @Test
    @DisplayName("미등록 모델 - SHORT 등급, 태그 없음")
    void testUnknownModel() {
        assertEquals(TtlTier.SHORT, policy.ttlTierOf("AuditLog"));
        assertTrue(policy.invalidationTagsOf("AuditLog").isEmpty());
    }

    @Test
    @DisplayName("무효화 태그 - 모델별 규칙")
    void testInvalidationTags() {
        assertEquals(EnumSet.of(CacheTag.USER), policy.invalidationTagsOf("User"));
        assertEquals(EnumSet.of(CacheTag.STRATEGY), policy.invalidationTagsOf("WinningPoint"));
        assertEquals(EnumSet.of(CacheTag.DASHBOARD), policy.invalidationTagsOf("DepartmentMetricTrend"));
        assertTrue(policy.invalidationTagsOf("CustomerStructureData").isEmpty());
    }

    @Test
    @DisplayName("설정 재정의 - 규칙보다 우선")
    void testTtlOverride() {
        EntityCachePolicy overridden = new EntityCachePolicy(Map.of("User", TtlTier.LONG, "AuditLog", TtlTier.MEDIUM));

        assertEquals(TtlTier.LONG, overridden.ttlTierOf("User"));
        assertEquals(TtlTier.MEDIUM, overridden.ttlTierOf("AuditLog"));
        assertEquals(EnumSet.of(CacheTag.USER), overridden.invalidationTagsOf("User"));
    }
}
