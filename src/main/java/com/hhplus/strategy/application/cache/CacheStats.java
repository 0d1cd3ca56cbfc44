package com.hhplus.strategy.application.cache;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * 저장소 진단 정보
 */
@Getter
@Builder
public class CacheStats {

    private final long dbSize;

    /**
     * INFO stats 섹션 (keyspace_hits, keyspace_misses 등)
     */
    private final Map<String, String> info;

    private final boolean connected;
}
