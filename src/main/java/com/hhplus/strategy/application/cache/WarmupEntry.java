package com.hhplus.strategy.application.cache;

import com.hhplus.strategy.domain.cache.CacheKey;
import lombok.Getter;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 워밍업 대상 (키, 계산, TTL)
 */
@Getter
public class WarmupEntry<T> {

    private final CacheKey key;
    private final Supplier<T> compute;
    private final Duration ttl;

    private WarmupEntry(CacheKey key, Supplier<T> compute, Duration ttl) {
        this.key = key;
        this.compute = compute;
        this.ttl = ttl;
    }

    public static <T> WarmupEntry<T> of(String key, Supplier<T> compute, Duration ttl) {
        return new WarmupEntry<>(CacheKey.raw(key), compute, ttl);
    }

    public static <T> WarmupEntry<T> of(CacheKey key, Supplier<T> compute) {
        return new WarmupEntry<>(key, compute, key.getDefaultTtl());
    }
}
