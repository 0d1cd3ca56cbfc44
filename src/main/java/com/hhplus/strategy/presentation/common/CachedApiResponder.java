package com.hhplus.strategy.presentation.common;

import com.fasterxml.jackson.databind.JavaType;
import com.hhplus.strategy.application.cache.CacheSerializer;
import com.hhplus.strategy.application.cache.CacheService;
import com.hhplus.strategy.domain.cache.CacheKey;
import com.hhplus.strategy.domain.cache.TtlTier;
import com.hhplus.strategy.presentation.common.response.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * API 응답 캐시 래퍼 (Cache-Aside)
 *
 * 처리 흐름:
 * 1. 캐시 조회 (실패해도 요청은 계속 진행)
 * 2. 미스면 계산
 * 3. 결과 기록은 기다리지 않음 (CacheService.writeBehind)
 * 4. X-Cache: HIT|MISS, X-Cache-Key 헤더와 함께 응답
 *
 * TTL 을 지정하지 않으면 API_LIST 등급을 사용한다.
 */
@Slf4j
@Component
public class CachedApiResponder {

    public static final String CACHE_STATUS_HEADER = "X-Cache";
    public static final String CACHE_KEY_HEADER = "X-Cache-Key";

    private static final Duration DEFAULT_TTL = TtlTier.API_LIST.getTtl();

    private final CacheService cacheService;
    private final CacheSerializer cacheSerializer;

    public CachedApiResponder(CacheService cacheService, CacheSerializer cacheSerializer) {
        this.cacheService = cacheService;
        this.cacheSerializer = cacheSerializer;
    }

    public <T> ResponseEntity<ApiResponse<T>> respond(String key, Class<T> type, Supplier<T> compute) {
        return respond(CacheKey.raw(key), cacheSerializer.typeOf(type), DEFAULT_TTL, compute);
    }

    public <T> ResponseEntity<ApiResponse<T>> respond(String key, Class<T> type, Duration ttl, Supplier<T> compute) {
        return respond(CacheKey.raw(key), cacheSerializer.typeOf(type), ttl, compute);
    }

    /**
     * 키에 TTL 등급이 있으면 그 등급을, 없으면 API_LIST 등급을 사용한다.
     */
    public <T> ResponseEntity<ApiResponse<T>> respond(CacheKey key, Class<T> type, Supplier<T> compute) {
        Duration ttl = key.getDefaultTtl() != null ? key.getDefaultTtl() : DEFAULT_TTL;
        return respond(key, cacheSerializer.typeOf(type), ttl, compute);
    }

    public <T> ResponseEntity<ApiResponse<T>> respond(CacheKey key, JavaType type, Duration ttl, Supplier<T> compute) {
        Optional<T> cached = cacheService.get(key.getValue(), type);
        if (cached.isPresent()) {
            log.debug("[CachedApiResponder] 캐시 히트 - key: {}", key.getValue());
            return ResponseEntity.ok()
                    .header(CACHE_STATUS_HEADER, "HIT")
                    .header(CACHE_KEY_HEADER, key.getValue())
                    .body(ApiResponse.success(cached.get()));
        }

        T value = compute.get();
        if (value != null) {
            cacheService.writeBehind(key, value, ttl);
        }
        return ResponseEntity.ok()
                .header(CACHE_STATUS_HEADER, "MISS")
                .header(CACHE_KEY_HEADER, key.getValue())
                .body(ApiResponse.success(value));
    }
}
