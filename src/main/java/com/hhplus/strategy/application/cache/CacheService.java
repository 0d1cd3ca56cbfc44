package com.hhplus.strategy.application.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.hhplus.strategy.domain.cache.CacheKey;
import com.hhplus.strategy.domain.cache.CacheTag;
import com.hhplus.strategy.domain.cache.CacheTagPolicy;
import com.hhplus.strategy.infrastructure.config.CacheProperties;
import com.hhplus.strategy.infrastructure.store.StoreClient;
import com.hhplus.strategy.infrastructure.store.StoreUnavailableException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 캐시 서비스 (Cache-Aside + 태그 기반 무효화 + 분산락)
 *
 * 역할:
 * 1. 값 조회/기록/삭제 (JSON 직렬화, TTL)
 * 2. 태그 Set 으로 관련 키 일괄 무효화
 * 3. getOrSet: 미스 시 계산 후 비동기 기록
 * 4. withLock: SET NX PX + 토큰 비교 삭제 기반 분산락
 * 5. 워밍업, 태그 Set 정리 (만료된 멤버, 빈 Set), 저장소 진단
 *
 * 실패 정책:
 * - 캐시 실패는 호출자의 실패가 되지 않는다
 * - 내부 연산은 CacheResult 로 실패 유형을 돌려주고, 공개 연산이 기본값(빈 Optional, false, 0)으로 변환한다
 * - 저장소 실패는 WARN, 직렬화 실패는 ERROR 로 기록
 *
 * 일관성:
 * - getOrSet 의 비동기 기록은 동시에 실행된 무효화보다 늦게 반영될 수 있다.
 *   이 경우 다음 무효화나 TTL 만료까지 이전 값이 남는다.
 *   cache.aside.synchronous-write=true 로 호출 스레드에서 기록하도록 바꿀 수 있다.
 */
@Slf4j
@Service
public class CacheService {

    private final StoreClient storeClient;
    private final CacheSerializer serializer;
    private final Executor cacheWriteExecutor;
    private final Executor cacheWarmupExecutor;
    private final CacheProperties cacheProperties;

    public CacheService(StoreClient storeClient,
                        CacheSerializer serializer,
                        @Qualifier("cacheWriteExecutor") Executor cacheWriteExecutor,
                        @Qualifier("cacheWarmupExecutor") Executor cacheWarmupExecutor,
                        CacheProperties cacheProperties) {
        this.storeClient = storeClient;
        this.serializer = serializer;
        this.cacheWriteExecutor = cacheWriteExecutor;
        this.cacheWarmupExecutor = cacheWarmupExecutor;
        this.cacheProperties = cacheProperties;
    }

    @PostConstruct
    public void init() {
        try {
            storeClient.ping();
            log.info("[CacheService] 캐시 저장소 연결 확인 완료");
        } catch (StoreUnavailableException e) {
            log.warn("[CacheService] 캐시 저장소 연결 실패 - 캐시 없이 동작합니다: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void close() {
        storeClient.close();
    }

    // ========== 조회 ==========

    public <T> Optional<T> get(String key, Class<T> type) {
        return get(key, serializer.typeOf(type));
    }

    public <T> Optional<T> get(CacheKey key, Class<T> type) {
        return get(key.getValue(), serializer.typeOf(type));
    }

    public <T> Optional<T> get(String key, JavaType type) {
        CacheResult<Optional<T>> result = read(key, type);
        return result.orElse(Optional.empty());
    }

    // ========== 기록 ==========

    /**
     * 만료 없이 기록 (태그는 키 세그먼트로 계산)
     */
    public boolean set(String key, Object value) {
        return set(key, value, null);
    }

    /**
     * @param ttl null 이면 만료 없음
     */
    public boolean set(String key, Object value, Duration ttl) {
        return write(key, value, ttl, CacheTagPolicy.tagsOf(key)).orElse(false);
    }

    /**
     * 키에 선언된 태그와 TTL 등급으로 기록
     */
    public boolean set(CacheKey key, Object value) {
        return set(key, value, key.getDefaultTtl());
    }

    public boolean set(CacheKey key, Object value, Duration ttl) {
        return write(key.getValue(), value, ttl, CacheTagPolicy.tagsOf(key)).orElse(false);
    }

    // ========== 삭제 / 무효화 ==========

    /**
     * 값을 삭제하고 모든 태그 Set 에서 키를 제거한다.
     *
     * @return 값이 실제로 삭제되었으면 true
     */
    public boolean delete(String key) {
        try {
            long removed = storeClient.del(key);
            removeFromTags(List.of(key));
            log.debug("[CacheService] 캐시 삭제 - key: {}, removed: {}", key, removed);
            return removed > 0;
        } catch (StoreUnavailableException e) {
            log.warn("[CacheService] 캐시 삭제 실패 - key: {}, error: {}", key, e.getMessage());
            return false;
        }
    }

    public boolean delete(CacheKey key) {
        return delete(key.getValue());
    }

    /**
     * glob 패턴에 매칭되는 키를 한 번의 파이프라인으로 삭제
     *
     * @return 삭제한 키 수 (매칭 없으면 0)
     */
    public long deleteMany(String pattern) {
        try {
            Set<String> keys = storeClient.keys(pattern);
            if (keys.isEmpty()) {
                return 0L;
            }
            storeClient.pipeline(pipeline -> {
                for (String key : keys) {
                    pipeline.del(key);
                    for (CacheTag tag : CacheTag.values()) {
                        pipeline.srem(tag.getKey(), key);
                    }
                }
            });
            log.info("[CacheService] 패턴 삭제 - pattern: {}, count: {}", pattern, keys.size());
            return keys.size();
        } catch (StoreUnavailableException e) {
            log.warn("[CacheService] 패턴 삭제 실패 - pattern: {}, error: {}", pattern, e.getMessage());
            return 0L;
        }
    }

    public long invalidateByTag(CacheTag tag) {
        return invalidateTagSet(tag.getKey());
    }

    /**
     * @param tag "tag:strategy" 또는 "strategy" 형태. 알 수 없는 이름은 그대로 Set 키로 사용한다.
     */
    public long invalidateByTag(String tag) {
        String tagKey = CacheTag.fromKey(tag).map(CacheTag::getKey).orElse(tag);
        return invalidateTagSet(tagKey);
    }

    private long invalidateTagSet(String tagKey) {
        try {
            Set<String> members = storeClient.smembers(tagKey);
            if (members.isEmpty()) {
                log.debug("[CacheService] 무효화 대상 없음 - tag: {}", tagKey);
                return 0L;
            }
            storeClient.pipeline(pipeline -> {
                for (String member : members) {
                    pipeline.del(member);
                }
                pipeline.del(tagKey);
            });
            log.info("[CacheService] 태그 무효화 - tag: {}, count: {}", tagKey, members.size());
            return members.size();
        } catch (StoreUnavailableException e) {
            log.warn("[CacheService] 태그 무효화 실패 - tag: {}, error: {}", tagKey, e.getMessage());
            return 0L;
        }
    }

    // ========== Cache-Aside ==========

    public <T> T getOrSet(String key, Class<T> type, Supplier<T> compute, Duration ttl) {
        return getOrSet(CacheKey.raw(key), serializer.typeOf(type), compute, ttl);
    }

    public <T> T getOrSet(CacheKey key, Class<T> type, Supplier<T> compute) {
        return getOrSet(key, serializer.typeOf(type), compute, key.getDefaultTtl());
    }

    /**
     * 캐시 조회 후 미스면 계산하고, 계산 결과는 기다리지 않고 바로 반환한다.
     *
     * - 히트: compute 를 호출하지 않는다
     * - 미스: compute 를 한 번 호출하고 결과 기록은 cacheWriteExecutor 에서 수행
     * - 동시 미스는 중복 제거하지 않는다 (필요하면 compute 를 withLock 으로 감쌀 것)
     * - compute 의 예외는 그대로 전파, null 결과는 캐시하지 않는다
     */
    public <T> T getOrSet(CacheKey key, JavaType type, Supplier<T> compute, Duration ttl) {
        CacheResult<Optional<T>> cached = read(key.getValue(), type);
        if (cached.isSuccess() && cached.getValue().isPresent()) {
            return cached.getValue().get();
        }

        T value = compute.get();
        if (value != null) {
            writeBehind(key, value, ttl);
        }
        return value;
    }

    /**
     * getOrSet 미스 후 기록 (동기 또는 비동기)
     */
    public void writeBehind(CacheKey key, Object value, Duration ttl) {
        Set<CacheTag> tags = CacheTagPolicy.tagsOf(key);
        if (cacheProperties.getAside().isSynchronousWrite()) {
            write(key.getValue(), value, ttl, tags);
            return;
        }
        try {
            CompletableFuture.runAsync(() -> write(key.getValue(), value, ttl, tags), cacheWriteExecutor)
                    .exceptionally(e -> {
                        log.warn("[CacheService] 비동기 캐시 기록 실패 - key: {}", key.getValue(), e);
                        return null;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("[CacheService] 비동기 캐시 기록 거부 (큐 포화) - key: {}", key.getValue());
        }
    }

    // ========== 분산락 ==========

    public <T> T withLock(String lockKey, Supplier<T> fn) {
        return withLock(lockKey, fn, cacheProperties.getLock().getDefaultLease());
    }

    /**
     * 락을 획득한 상태에서 fn 실행
     *
     * - 경합 시 지수 백오프로 재시도, cache.lock.max-wait 까지 대기
     * - 저장소 장애 시 락 없이 fn 실행 (가용성 우선)
     * - fn 의 예외는 그대로 전파되며, 락은 항상 해제를 시도한다
     *
     * @param leaseTime 락 보유 최대 시간 (저장소 만료)
     * @throws LockAcquisitionTimeoutException 최대 대기 시간 안에 획득하지 못한 경우
     */
    public <T> T withLock(String lockKey, Supplier<T> fn, Duration leaseTime) {
        CacheResult<T> result = tryWithLock(lockKey, fn, leaseTime, cacheProperties.getLock().getMaxWait());
        if (!result.isSuccess()) {
            throw new LockAcquisitionTimeoutException(lockKey);
        }
        return result.getValue();
    }

    /**
     * 기본 보유 시간 / 최대 대기 시간으로 tryWithLock
     */
    public <T> CacheResult<T> tryWithLock(String lockKey, Supplier<T> fn) {
        CacheProperties.Lock lock = cacheProperties.getLock();
        return tryWithLock(lockKey, fn, lock.getDefaultLease(), lock.getMaxWait());
    }

    /**
     * withLock 과 같지만 획득 실패를 예외 대신 LOCK_TIMEOUT 결과로 돌려준다.
     * 획득하지 못했을 때 락 없이 실행할지는 호출자가 결정한다.
     */
    public <T> CacheResult<T> tryWithLock(String lockKey, Supplier<T> fn, Duration leaseTime, Duration maxWait) {
        String token = UUID.randomUUID().toString();
        boolean acquired;
        try {
            acquired = acquireLock(lockKey, token, leaseTime, maxWait);
        } catch (StoreUnavailableException e) {
            log.warn("[DistributedLock] 저장소 장애로 락 없이 실행 - key: {}, error: {}", lockKey, e.getMessage());
            return CacheResult.success(fn.get());
        }

        if (!acquired) {
            log.warn("[DistributedLock] 락 획득 시간 초과 - key: {}, maxWait: {}ms", lockKey, maxWait.toMillis());
            return CacheResult.failure(CacheError.LOCK_TIMEOUT, null);
        }

        log.debug("[DistributedLock] 락 획득 성공 - key: {}", lockKey);
        try {
            return CacheResult.success(fn.get());
        } finally {
            releaseLock(lockKey, token);
        }
    }

    private boolean acquireLock(String lockKey, String token, Duration leaseTime, Duration maxWait) {
        CacheProperties.Lock lock = cacheProperties.getLock();
        long initialBackoff = Math.max(1L, lock.getInitialBackoff().toMillis());
        long maxBackoff = Math.max(initialBackoff + 1, lock.getMaxBackoff().toMillis());

        RetryTemplate retryTemplate = RetryTemplate.builder()
                .exponentialBackoff(initialBackoff, 2.0, maxBackoff)
                .withinMillis(Math.max(1L, maxWait.toMillis()))
                .retryOn(LockContendedException.class)
                .build();

        try {
            return retryTemplate.execute(context -> {
                if (storeClient.setIfAbsent(lockKey, token, leaseTime)) {
                    return true;
                }
                throw new LockContendedException(lockKey);
            });
        } catch (LockContendedException e) {
            return false;
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[DistributedLock] 락 대기 중 인터럽트 - key: {}", lockKey);
            return false;
        }
    }

    private void releaseLock(String lockKey, String token) {
        try {
            if (storeClient.compareAndDelete(lockKey, token)) {
                log.debug("[DistributedLock] 락 해제 성공 - key: {}", lockKey);
            } else {
                log.warn("[DistributedLock] 락이 이미 만료되었거나 다른 소유자가 보유 중 - key: {}", lockKey);
            }
        } catch (StoreUnavailableException e) {
            log.warn("[DistributedLock] 락 해제 실패 (만료 시 자동 해제) - key: {}, error: {}", lockKey, e.getMessage());
        }
    }

    // ========== 유지보수 ==========

    /**
     * 모든 계산을 병렬 실행하고 성공한 결과를 기록한다.
     * 한 항목의 실패는 다른 항목에 영향을 주지 않는다.
     */
    public WarmupReport warmup(Collection<? extends WarmupEntry<?>> entries) {
        List<CompletableFuture<Boolean>> futures = new ArrayList<>();
        List<String> keys = new ArrayList<>();

        for (WarmupEntry<?> entry : entries) {
            keys.add(entry.getKey().getValue());
            futures.add(warmupOne(entry));
        }

        int succeeded = 0;
        List<String> failedKeys = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            if (Boolean.TRUE.equals(futures.get(i).join())) {
                succeeded++;
            } else {
                failedKeys.add(keys.get(i));
            }
        }

        log.info("[CacheService] 워밍업 완료 - 성공: {}, 실패: {}", succeeded, failedKeys.size());
        return new WarmupReport(succeeded, failedKeys.size(), List.copyOf(failedKeys));
    }

    private CompletableFuture<Boolean> warmupOne(WarmupEntry<?> entry) {
        CacheKey key = entry.getKey();
        try {
            return CompletableFuture
                    .supplyAsync(entry.getCompute(), cacheWarmupExecutor)
                    .thenApply(value -> value != null
                            && write(key.getValue(), value, entry.getTtl(), CacheTagPolicy.tagsOf(key)).orElse(false))
                    .exceptionally(e -> {
                        log.warn("[CacheService] 워밍업 계산 실패 - key: {}, error: {}", key.getValue(), e.getMessage());
                        return false;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("[CacheService] 워밍업 작업 거부 - key: {}", key.getValue());
            return CompletableFuture.completedFuture(false);
        }
    }

    /**
     * 태그 Set 정리
     *
     * 1. 값 키가 만료/삭제된 멤버를 태그 Set 에서 제거
     * 2. 비어 있는 태그 Set 제거
     *
     * 태그 Set 에는 TTL 이 없으므로 자연 만료된 키가 남아 Set 이 계속 커지는 것을 막는다.
     *
     * @return 제거한 멤버 수 + 제거한 태그 Set 수
     */
    public int cleanup() {
        int removed = 0;
        try {
            for (CacheTag tag : CacheTag.values()) {
                String tagKey = tag.getKey();
                Set<String> members = storeClient.smembers(tagKey);
                int stale = 0;
                for (String member : members) {
                    if (!storeClient.exists(member)) {
                        storeClient.srem(tagKey, member);
                        stale++;
                    }
                }
                removed += stale;
                if (stale > 0) {
                    log.debug("[CacheService] 만료된 태그 멤버 제거 - tag: {}, count: {}", tagKey, stale);
                }
                if (storeClient.scard(tagKey) == 0) {
                    removed += storeClient.del(tagKey);
                }
            }
            log.info("[CacheService] 태그 Set 정리 완료 - removed: {}", removed);
        } catch (StoreUnavailableException e) {
            log.warn("[CacheService] 태그 Set 정리 실패 - error: {}", e.getMessage());
        }
        return removed;
    }

    public Optional<CacheStats> getStats() {
        try {
            long dbSize = storeClient.dbSize();
            Properties info = storeClient.info("stats");
            Map<String, String> infoMap = new HashMap<>();
            for (String name : info.stringPropertyNames()) {
                infoMap.put(name, info.getProperty(name));
            }
            return Optional.of(CacheStats.builder()
                    .dbSize(dbSize)
                    .info(infoMap)
                    .connected(true)
                    .build());
        } catch (StoreUnavailableException e) {
            log.warn("[CacheService] 저장소 진단 조회 실패 - error: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // ========== 내부 연산 ==========

    private <T> CacheResult<Optional<T>> read(String key, JavaType type) {
        String payload;
        try {
            payload = storeClient.get(key).orElse(null);
        } catch (StoreUnavailableException e) {
            log.warn("[CacheService] 캐시 조회 실패 - key: {}, error: {}", key, e.getMessage());
            return CacheResult.failure(CacheError.STORE_UNAVAILABLE, e);
        }

        if (payload == null) {
            log.debug("[CacheService] 캐시 미스 - key: {}", key);
            return CacheResult.success(Optional.empty());
        }

        try {
            T value = serializer.deserialize(payload, type);
            log.debug("[CacheService] 캐시 히트 - key: {}", key);
            return CacheResult.success(Optional.ofNullable(value));
        } catch (CacheSerializationException e) {
            log.error("[CacheService] 캐시 값 역직렬화 실패 - key: {}, type: {}", key, type, e);
            return CacheResult.failure(CacheError.SERIALIZATION, e);
        }
    }

    private CacheResult<Boolean> write(String key, Object value, Duration ttl, Set<CacheTag> tags) {
        if (value == null) {
            log.debug("[CacheService] null 값은 캐시하지 않음 - key: {}", key);
            return CacheResult.success(false);
        }
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            log.warn("[CacheService] 유효하지 않은 TTL - key: {}, ttl: {}", key, ttl);
            return CacheResult.success(false);
        }

        String payload;
        try {
            payload = serializer.serialize(value);
        } catch (CacheSerializationException e) {
            log.error("[CacheService] 캐시 값 직렬화 실패 - key: {}", key, e);
            return CacheResult.failure(CacheError.SERIALIZATION, e);
        }

        try {
            if (ttl != null) {
                storeClient.setex(key, ttl, payload);
            } else {
                storeClient.set(key, payload);
            }
        } catch (StoreUnavailableException e) {
            log.warn("[CacheService] 캐시 기록 실패 - key: {}, error: {}", key, e.getMessage());
            return CacheResult.failure(CacheError.STORE_UNAVAILABLE, e);
        }

        indexTags(key, tags);
        log.debug("[CacheService] 캐시 기록 - key: {}, ttl: {}, tags: {}", key, ttl, tags);
        return CacheResult.success(true);
    }

    /**
     * 태그 인덱싱 실패는 값 기록을 되돌리지 않는다.
     */
    private void indexTags(String key, Set<CacheTag> tags) {
        if (tags.isEmpty()) {
            return;
        }
        try {
            storeClient.pipeline(pipeline -> {
                for (CacheTag tag : tags) {
                    pipeline.sadd(tag.getKey(), key);
                }
            });
        } catch (StoreUnavailableException e) {
            log.warn("[CacheService] 태그 인덱싱 실패 - key: {}, tags: {}, error: {}", key, tags, e.getMessage());
        }
    }

    private void removeFromTags(Collection<String> keys) {
        try {
            storeClient.pipeline(pipeline -> {
                for (String key : keys) {
                    for (CacheTag tag : EnumSet.allOf(CacheTag.class)) {
                        pipeline.srem(tag.getKey(), key);
                    }
                }
            });
        } catch (StoreUnavailableException e) {
            log.warn("[CacheService] 태그 멤버십 제거 실패 - keys: {}, error: {}", keys, e.getMessage());
        }
    }

    /**
     * 락 경합 (재시도 신호)
     */
    private static class LockContendedException extends RuntimeException {

        LockContendedException(String lockKey) {
            super("lock contended: " + lockKey, null, false, false);
        }
    }
}
