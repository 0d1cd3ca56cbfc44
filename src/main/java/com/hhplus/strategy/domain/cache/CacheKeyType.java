package com.hhplus.strategy.domain.cache;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 캐시 키 명명 규칙 Enum
 *
 * 목표:
 * 1. 모든 캐시 키를 한 곳에서 관리
 * 2. 키마다 기본 TTL 등급과 소속 태그를 함께 선언
 * 3. 태그를 키 문자열에서 추론하지 않고 명시
 *
 * 사용법:
 * - 정적 키: CacheKeyType.ENTERPRISE_LIST.key()
 * - 파라미터: CacheKeyType.USER_BY_ID.key(42L) → "user:id:42"
 * - 추가 세그먼트: CacheKeyType.STRATEGY_LIST.key(1L, "status=ACTIVE") → "strategy:list:1:status=ACTIVE"
 */
public enum CacheKeyType {

    // ===== 사용자 =====

    USER_BY_ID("user:id:{id}", TtlTier.DB_USER, tags(CacheTag.USER), "사용자 단건"),
    USER_BY_EMAIL("user:email:{email}", TtlTier.DB_USER, tags(CacheTag.USER), "이메일로 조회한 사용자"),
    SESSION("session:{userId}", TtlTier.SESSION, tags(), "사용자 세션"),

    // ===== 기업 =====

    ENTERPRISE_LIST("enterprise:list", TtlTier.DB_ENTERPRISE, tags(CacheTag.ENTERPRISE), "기업 목록"),
    ENTERPRISE_BY_ID("enterprise:id:{id}", TtlTier.DB_ENTERPRISE, tags(CacheTag.ENTERPRISE), "기업 단건"),
    ENTERPRISE_USERS("enterprise:{id}:users", TtlTier.DB_ENTERPRISE,
            tags(CacheTag.ENTERPRISE, CacheTag.USER), "기업 소속 사용자"),
    ENTERPRISE_DEPARTMENTS("enterprise:{id}:departments", TtlTier.DB_ENTERPRISE,
            tags(CacheTag.ENTERPRISE, CacheTag.DEPARTMENT), "기업 소속 부서"),

    // ===== 부서 =====

    DEPARTMENT_BY_ID("department:id:{id}", TtlTier.DB_DEPARTMENT, tags(CacheTag.DEPARTMENT), "부서 단건"),
    DEPARTMENTS_BY_ENTERPRISE("departments:enterprise:{enterpriseId}", TtlTier.DB_DEPARTMENT,
            tags(CacheTag.DEPARTMENT, CacheTag.ENTERPRISE), "기업별 부서 목록"),
    DEPARTMENT_MEMBERS("department:{id}:members", TtlTier.DB_DEPARTMENT,
            tags(CacheTag.DEPARTMENT, CacheTag.USER), "부서 구성원"),

    // ===== 전략 =====

    STRATEGY_LIST("strategy:list:{enterpriseId}", TtlTier.DB_STRATEGY, tags(CacheTag.STRATEGY), "기업별 전략 목록"),
    STRATEGY_BY_ID("strategy:id:{id}", TtlTier.DB_STRATEGY, tags(CacheTag.STRATEGY), "전략 단건"),
    STRATEGIES_BY_DEPARTMENT("strategies:department:{departmentId}", TtlTier.DB_STRATEGY,
            tags(CacheTag.STRATEGY, CacheTag.DEPARTMENT), "부서별 전략 목록"),

    // ===== 대시보드 =====

    DASHBOARD("dashboard:{enterpriseId}", TtlTier.MEDIUM, tags(CacheTag.DASHBOARD), "기업 대시보드"),

    // ===== API 응답 =====

    API_RESPONSE("api:{method}:{path}", TtlTier.API_LIST, tags(), "API 응답"),

    // ===== 성능 통계 =====

    PERF_STATS("perf:stats:{operation}", TtlTier.API_STATS, tags(), "성능 통계"),
    PERF_DAILY("perf:daily:{date}", TtlTier.EXTRA_LONG, tags(), "일별 성능 통계"),

    // ===== 분산 락 =====

    LOCK("lock:{operation}:{id}", null, tags(), "분산 락"),

    // ===== 리포지토리 조회 캐시 =====

    JPA_ENTITY_BY_ID("jpa:{model}:id:{id}", TtlTier.SHORT, tags(), "리포지토리 ID 조회"),
    JPA_QUERY("jpa:{model}:query:{fingerprint}", TtlTier.SHORT, tags(), "리포지토리 조건 조회");

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{[^}]*\\}");

    private final String pattern;
    private final TtlTier ttlTier;
    private final Set<CacheTag> tags;
    private final String description;

    CacheKeyType(String pattern, TtlTier ttlTier, Set<CacheTag> tags, String description) {
        this.pattern = pattern;
        this.ttlTier = ttlTier;
        this.tags = tags;
        this.description = description;
    }

    /**
     * 실제 키 문자열 생성 (플레이스홀더 순서대로 치환)
     *
     * 플레이스홀더보다 많은 값은 ":" 로 이어 붙인다 (필터, 쿼리 파라미터 등).
     * 빈 문자열이나 null 인 추가 값은 무시한다.
     *
     * @throws IllegalArgumentException 치환되지 않은 플레이스홀더가 남은 경우
     */
    public String buildKey(Object... values) {
        Matcher matcher = PLACEHOLDER.matcher(pattern);
        StringBuilder key = new StringBuilder();
        int index = 0;
        while (matcher.find()) {
            if (index >= values.length) {
                throw new IllegalArgumentException(
                        String.format("%s 키에 필요한 파라미터가 부족합니다: %s", name(), pattern)
                );
            }
            matcher.appendReplacement(key, Matcher.quoteReplacement(String.valueOf(values[index++])));
        }
        matcher.appendTail(key);
        for (; index < values.length; index++) {
            Object value = values[index];
            if (value != null && !String.valueOf(value).isEmpty()) {
                key.append(':').append(value);
            }
        }
        return key.toString();
    }

    /**
     * 구조화된 키 생성 (선언된 태그와 TTL 등급 포함)
     */
    public CacheKey key(Object... values) {
        return CacheKey.of(buildKey(values), tags, ttlTier);
    }

    /**
     * 정적 키 조회
     *
     * @throws IllegalStateException 파라미터가 필요한 경우
     */
    public String getKey() {
        if (pattern.contains("{")) {
            throw new IllegalStateException(
                    String.format("%s requires parameters: %s", name(), pattern)
            );
        }
        return pattern;
    }

    /**
     * 이 유형의 모든 키에 매칭되는 glob 패턴 (예: "user:id:*")
     */
    public String getGlobPattern() {
        return PLACEHOLDER.matcher(pattern).replaceAll("*");
    }

    public String getPattern() {
        return pattern;
    }

    public TtlTier getTtlTier() {
        return ttlTier;
    }

    public Set<CacheTag> getTags() {
        return tags;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s (ttl=%s, tags=%s, pattern=%s)",
                this.name(),
                this.description,
                this.ttlTier != null ? this.ttlTier.getSeconds() + "s" : "none",
                this.tags,
                this.pattern);
    }

    private static Set<CacheTag> tags(CacheTag... tags) {
        if (tags.length == 0) {
            return Collections.emptySet();
        }
        EnumSet<CacheTag> set = EnumSet.noneOf(CacheTag.class);
        Collections.addAll(set, tags);
        return Collections.unmodifiableSet(set);
    }
}
