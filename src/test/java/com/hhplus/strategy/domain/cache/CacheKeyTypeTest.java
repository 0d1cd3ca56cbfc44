package com.hhplus.strategy.domain.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CacheKeyTypeTest - 키 명명 규칙 테스트
 *
 * 테스트 범위:
 * 1. 플레이스홀더 치환 / 추가 세그먼트
 * 2. 파라미터 부족, 정적 키 조회 오류
 * 3. 선언된 TTL 등급과 태그
 */
@DisplayName("CacheKeyType 단위 테스트")
class CacheKeyTypeTest {

    @Test
    @DisplayName("파라미터 치환 - user:id:42")
    void testBuildKey_SingleParameter() {
        assertEquals("user:id:42", CacheKeyType.USER_BY_ID.buildKey(42L));
    }

    @Test
    @DisplayName("추가 파라미터는 세그먼트로 덧붙임")
    void testBuildKey_ExtraParameters() {
        assertEquals("strategy:list:1:status=ACTIVE", CacheKeyType.STRATEGY_LIST.buildKey(1L, "status=ACTIVE"));
        assertEquals("strategy:list:1", CacheKeyType.STRATEGY_LIST.buildKey(1L, ""));
    }

    @Test
    @DisplayName("값에 특수문자($, {}) 포함 - 그대로 치환")
    void testBuildKey_SpecialCharacters() {
        assertEquals("user:email:a$b{c}@x.com", CacheKeyType.USER_BY_EMAIL.buildKey("a$b{c}@x.com"));
    }

    @Test
    @DisplayName("파라미터 부족 - IllegalArgumentException")
    void testBuildKey_MissingParameter() {
        assertThrows(IllegalArgumentException.class, () -> CacheKeyType.LOCK.buildKey("dashboard"));
    }

    @Test
    @DisplayName("정적 키 조회 - 파라미터가 필요하면 IllegalStateException")
    void testGetKey() {
        assertEquals("enterprise:list", CacheKeyType.ENTERPRISE_LIST.getKey());
        assertThrows(IllegalStateException.class, CacheKeyType.USER_BY_ID::getKey);
    }

    @Test
    @DisplayName("구조화된 키 - 선언된 태그와 TTL 포함")
    void testKey_CarriesTagsAndTtl() {
        CacheKey key = CacheKeyType.ENTERPRISE_USERS.key(7L);

        assertEquals("enterprise:7:users", key.getValue());
        assertEquals(EnumSet.of(CacheTag.ENTERPRISE, CacheTag.USER), key.getTags());
        assertEquals(Duration.ofMinutes(30), key.getDefaultTtl());
    }

    @Test
    @DisplayName("락 키 - TTL 등급 없음, 태그 없음")
    void testKey_LockHasNoTtl() {
        CacheKey key = CacheKeyType.LOCK.key("dashboard", 1L);

        assertEquals("lock:dashboard:1", key.getValue());
        assertNull(key.getDefaultTtl());
        assertTrue(key.getTags().isEmpty());
    }

    @Test
    @DisplayName("glob 패턴 - 플레이스홀더를 * 로")
    void testGetGlobPattern() {
        assertEquals("user:id:*", CacheKeyType.USER_BY_ID.getGlobPattern());
        assertEquals("enterprise:*:users", CacheKeyType.ENTERPRISE_USERS.getGlobPattern());
    }

    @Test
    @DisplayName("빈 키 - IllegalArgumentException")
    void testCacheKey_BlankValue() {
        assertThrows(IllegalArgumentException.class, () -> CacheKey.raw(" "));
    }

    @Test
    @DisplayName("raw 키 - 세그먼트로 태그 계산, TTL 등급 없음")
    void testCacheKey_Raw() {
        CacheKey key = CacheKey.raw("department:3:members");

        assertEquals(EnumSet.of(CacheTag.DEPARTMENT), key.getTags());
        assertNull(key.getTtlTier());
    }
}
