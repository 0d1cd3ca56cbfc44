package com.hhplus.strategy.domain.cache;

import java.util.Arrays;
import java.util.Optional;

/**
 * 캐시 태그 - 함께 무효화되는 키 묶음
 *
 * 각 태그는 저장소의 Set(`tag:{name}`)으로 관리되며,
 * 해당 태그가 적용된 상태로 마지막 기록된 캐시 키들을 멤버로 가진다.
 */
public enum CacheTag {

    USER("user"),
    ENTERPRISE("enterprise"),
    DEPARTMENT("department"),
    STRATEGY("strategy"),
    DASHBOARD("dashboard");

    private static final String KEY_PREFIX = "tag:";

    private final String segment;

    CacheTag(String segment) {
        this.segment = segment;
    }

    /**
     * 태그 Set 키 (예: "tag:user")
     */
    public String getKey() {
        return KEY_PREFIX + segment;
    }

    public String getSegment() {
        return segment;
    }

    /**
     * "tag:strategy" 또는 "strategy" 형태의 문자열로 태그 조회
     */
    public static Optional<CacheTag> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String segment = key.startsWith(KEY_PREFIX) ? key.substring(KEY_PREFIX.length()) : key;
        return Arrays.stream(values())
                .filter(tag -> tag.segment.equals(segment))
                .findFirst();
    }
}
