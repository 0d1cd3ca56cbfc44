package com.hhplus.strategy.domain.cache;

import java.util.EnumSet;
import java.util.Set;

/**
 * 캐시 키 → 태그 매핑
 *
 * 문자열 키는 ':' 단위 세그먼트로 나누어 판정한다.
 * - "user", "enterprise", "department", "strategy" 세그먼트가 있으면 해당 태그
 * - "dashboard"로 시작하는 세그먼트가 있으면 DASHBOARD
 *
 * 세그먼트 단위로 비교하므로 "superuser:1" 같은 키는 USER 태그에 속하지 않는다.
 */
public final class CacheTagPolicy {

    private CacheTagPolicy() {
    }

    public static Set<CacheTag> tagsOf(String key) {
        Set<CacheTag> tags = EnumSet.noneOf(CacheTag.class);
        if (key == null || key.isEmpty()) {
            return tags;
        }
        for (String segment : key.split(":")) {
            if (segment.startsWith(CacheTag.DASHBOARD.getSegment())) {
                tags.add(CacheTag.DASHBOARD);
                continue;
            }
            for (CacheTag tag : CacheTag.values()) {
                if (tag != CacheTag.DASHBOARD && tag.getSegment().equals(segment)) {
                    tags.add(tag);
                }
            }
        }
        return tags;
    }

    public static Set<CacheTag> tagsOf(CacheKey key) {
        return key.getTags();
    }
}
