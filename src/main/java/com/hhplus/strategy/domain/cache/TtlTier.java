package com.hhplus.strategy.domain.cache;

import java.time.Duration;

/**
 * TTL 등급
 *
 * 기본 등급(SHORT ~ SESSION), API 응답 등급(API_*), DB 조회 등급(DB_*)으로 나뉜다.
 * 모든 캐시 가능한 엔티티 타입은 정확히 하나의 등급에 매핑된다.
 */
public enum TtlTier {

    // 기본
    SHORT(Duration.ofMinutes(5)),
    MEDIUM(Duration.ofMinutes(30)),
    LONG(Duration.ofHours(2)),
    EXTRA_LONG(Duration.ofHours(24)),
    SESSION(Duration.ofHours(1)),

    // API 응답
    API_LIST(Duration.ofMinutes(5)),
    API_DETAIL(Duration.ofMinutes(10)),
    API_STATS(Duration.ofMinutes(15)),
    API_CONFIG(Duration.ofMinutes(30)),

    // DB 조회
    DB_USER(Duration.ofMinutes(10)),
    DB_ENTERPRISE(Duration.ofMinutes(30)),
    DB_DEPARTMENT(Duration.ofMinutes(15)),
    DB_STRATEGY(Duration.ofMinutes(5));

    private final Duration ttl;

    TtlTier(Duration ttl) {
        this.ttl = ttl;
    }

    public Duration getTtl() {
        return ttl;
    }

    public long getSeconds() {
        return ttl.getSeconds();
    }
}
