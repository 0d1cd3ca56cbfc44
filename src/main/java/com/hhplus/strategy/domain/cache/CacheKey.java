package com.hhplus.strategy.domain.cache;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * 구조화된 캐시 키
 *
 * 문자열 키와 함께 소속 태그와 기본 TTL 등급을 명시적으로 가진다.
 * 태그는 키 문자열에서 추론하지 않고 생성 시점에 결정된다.
 * 단, {@link #raw(String)}로 만든 키는 {@link CacheTagPolicy#tagsOf(String)}로 태그를 계산한다.
 */
public final class CacheKey {

    private final String value;
    private final Set<CacheTag> tags;
    private final TtlTier ttlTier;

    private CacheKey(String value, Set<CacheTag> tags, TtlTier ttlTier) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("캐시 키는 비어 있을 수 없습니다");
        }
        this.value = value;
        this.tags = tags.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(tags));
        this.ttlTier = ttlTier;
    }

    public static CacheKey of(String value, Set<CacheTag> tags, TtlTier ttlTier) {
        return new CacheKey(value, tags, ttlTier);
    }

    /**
     * 문자열 키로부터 생성 (태그는 키의 세그먼트로 계산, TTL 등급 없음)
     */
    public static CacheKey raw(String value) {
        return new CacheKey(value, CacheTagPolicy.tagsOf(value), null);
    }

    /**
     * 태그를 교체한 새 키
     */
    public CacheKey withTags(Set<CacheTag> newTags) {
        return new CacheKey(value, newTags, ttlTier);
    }

    /**
     * TTL 등급을 교체한 새 키
     */
    public CacheKey withTtlTier(TtlTier newTier) {
        return new CacheKey(value, tags, newTier);
    }

    public String getValue() {
        return value;
    }

    public Set<CacheTag> getTags() {
        return tags;
    }

    public TtlTier getTtlTier() {
        return ttlTier;
    }

    /**
     * 기본 TTL (등급이 없으면 null = 만료 없음)
     */
    public Duration getDefaultTtl() {
        return ttlTier != null ? ttlTier.getTtl() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheKey)) {
            return false;
        }
        CacheKey other = (CacheKey) o;
        return value.equals(other.value) && tags.equals(other.tags) && ttlTier == other.ttlTier;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, tags, ttlTier);
    }

    @Override
    public String toString() {
        return value + " " + tags;
    }
}
