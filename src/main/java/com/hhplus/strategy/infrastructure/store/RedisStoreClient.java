package com.hhplus.strategy.infrastructure.store;

import com.hhplus.strategy.infrastructure.config.StoreProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.StringRedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Redis 기반 저장소 클라이언트 (Spring Data Redis + Lettuce)
 *
 * 역할:
 * 1. 논리 키 ↔ 접두사가 붙은 실제 키 변환
 * 2. 연결 실패 시 명령당 재시도 (Spring Retry)
 * 3. 장시간 장애 시 즉시 실패 + 주기적 복구 확인
 * 4. 모든 실패를 StoreUnavailableException 으로 변환
 *
 * 락 해제는 Lua 스크립트로 값 비교와 삭제를 원자적으로 수행한다.
 */
@Slf4j
public class RedisStoreClient implements StoreClient {

    private static final RedisScript<Long> COMPARE_AND_DELETE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then "
                    + "return redis.call('del', KEYS[1]) "
                    + "else return 0 end",
            Long.class
    );

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;
    private final RetryTemplate retryTemplate;
    private final Duration maxRetryDuration;
    private final Duration probeInterval;
    private final Clock clock;

    private final AtomicLong failingSince = new AtomicLong(0);
    private final AtomicLong lastProbeAt = new AtomicLong(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RedisStoreClient(StringRedisTemplate redisTemplate, StoreProperties properties) {
        this(redisTemplate, properties, Clock.systemUTC());
    }

    public RedisStoreClient(StringRedisTemplate redisTemplate, StoreProperties properties, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = properties.getKeyPrefix() == null ? "" : properties.getKeyPrefix();
        this.maxRetryDuration = properties.getRetry().getMaxRetryDuration();
        this.probeInterval = properties.getRetry().getProbeInterval();
        this.clock = clock;
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(Math.max(1, properties.getMaxRetriesPerRequest() + 1))
                .fixedBackoff(Math.max(1L, properties.getRetry().getBaseDelay().toMillis()))
                .retryOn(RedisConnectionFailureException.class)
                .retryOn(QueryTimeoutException.class)
                .traversingCauses()
                .build();
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(execute("GET", () -> redisTemplate.opsForValue().get(prefixed(key))));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(execute("EXISTS", () -> redisTemplate.hasKey(prefixed(key))));
    }

    @Override
    public void setex(String key, Duration ttl, String payload) {
        execute("SETEX", () -> {
            redisTemplate.opsForValue().set(prefixed(key), payload, ttl);
            return null;
        });
    }

    @Override
    public void set(String key, String payload) {
        execute("SET", () -> {
            redisTemplate.opsForValue().set(prefixed(key), payload);
            return null;
        });
    }

    @Override
    public long del(String key) {
        Boolean deleted = execute("DEL", () -> redisTemplate.delete(prefixed(key)));
        return Boolean.TRUE.equals(deleted) ? 1L : 0L;
    }

    @Override
    public long del(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0L;
        }
        List<String> prefixedKeys = keys.stream().map(this::prefixed).collect(Collectors.toList());
        Long deleted = execute("DEL", () -> redisTemplate.delete(prefixedKeys));
        return deleted == null ? 0L : deleted;
    }

    @Override
    public void sadd(String setKey, String member) {
        execute("SADD", () -> redisTemplate.opsForSet().add(prefixed(setKey), member));
    }

    @Override
    public void srem(String setKey, String member) {
        execute("SREM", () -> redisTemplate.opsForSet().remove(prefixed(setKey), member));
    }

    @Override
    public Set<String> smembers(String setKey) {
        Set<String> members = execute("SMEMBERS", () -> redisTemplate.opsForSet().members(prefixed(setKey)));
        return members == null ? Collections.emptySet() : members;
    }

    @Override
    public long scard(String setKey) {
        Long size = execute("SCARD", () -> redisTemplate.opsForSet().size(prefixed(setKey)));
        return size == null ? 0L : size;
    }

    @Override
    public Set<String> keys(String pattern) {
        Set<String> keys = execute("KEYS", () -> redisTemplate.keys(prefixed(pattern)));
        if (keys == null || keys.isEmpty()) {
            return Collections.emptySet();
        }
        Set<String> logicalKeys = new LinkedHashSet<>();
        for (String key : keys) {
            logicalKeys.add(stripPrefix(key));
        }
        return logicalKeys;
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Boolean acquired = execute("SET NX PX",
                () -> redisTemplate.opsForValue().setIfAbsent(prefixed(key), value, ttl));
        return Boolean.TRUE.equals(acquired);
    }

    @Override
    public boolean compareAndDelete(String key, String expected) {
        Long deleted = execute("EVAL compare-and-delete",
                () -> redisTemplate.execute(COMPARE_AND_DELETE_SCRIPT, List.of(prefixed(key)), expected));
        return deleted != null && deleted > 0;
    }

    @Override
    public void pipeline(Consumer<StorePipeline> commands) {
        execute("PIPELINE", () -> redisTemplate.executePipelined((RedisCallback<Object>) connection -> {
            StringRedisConnection stringConnection = (StringRedisConnection) connection;
            commands.accept(new RedisPipeline(stringConnection));
            return null;
        }));
    }

    @Override
    public Properties info(String section) {
        Properties info = execute("INFO", () -> redisTemplate.execute(
                (RedisCallback<Properties>) connection -> connection.serverCommands().info(section)));
        return info == null ? new Properties() : info;
    }

    @Override
    public long dbSize() {
        Long size = execute("DBSIZE", () -> redisTemplate.execute(
                (RedisCallback<Long>) connection -> connection.serverCommands().dbSize()));
        return size == null ? 0L : size;
    }

    @Override
    public void ping() {
        execute("PING", () -> redisTemplate.execute((RedisCallback<String>) RedisConnection::ping));
    }

    /**
     * 이후 모든 명령을 거부한다. 연결 팩토리는 스프링 컨테이너가 정리한다.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("[RedisStoreClient] 클라이언트 종료");
        }
    }

    /**
     * 명령 실행 공통 처리
     *
     * 1. 종료/즉시 실패 상태 확인
     * 2. 연결 실패는 maxRetriesPerRequest 만큼 재시도
     * 3. 성공하면 장애 상태 해제, 연결/시간 초과 실패면 장애 시작 시각 기록
     *
     * WRONGTYPE 같은 명령 오류는 저장소가 응답한 것이므로 장애 상태에 반영하지 않는다.
     */
    private <T> T execute(String operation, Supplier<T> command) {
        if (closed.get()) {
            throw new StoreUnavailableException("클라이언트가 종료되었습니다 - op: " + operation);
        }
        if (shouldFailFast()) {
            throw new StoreUnavailableException("저장소 장애 지속으로 즉시 실패 - op: " + operation);
        }
        try {
            T result = retryTemplate.execute(context -> command.get());
            markHealthy();
            return result;
        } catch (RuntimeException e) {
            if (isConnectionFailure(e)) {
                markFailing();
            }
            log.warn("[RedisStoreClient] 명령 실패 - op: {}, error: {}", operation, e.getMessage());
            throw new StoreUnavailableException("op: " + operation, e);
        }
    }

    private boolean isConnectionFailure(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof DataAccessResourceFailureException || current instanceof QueryTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private boolean shouldFailFast() {
        long since = failingSince.get();
        if (since == 0) {
            return false;
        }
        long now = clock.millis();
        if (now - since < maxRetryDuration.toMillis()) {
            return false;
        }
        long lastProbe = lastProbeAt.get();
        if (now - lastProbe >= probeInterval.toMillis() && lastProbeAt.compareAndSet(lastProbe, now)) {
            log.info("[RedisStoreClient] 저장소 복구 확인 시도");
            return false;
        }
        return true;
    }

    private void markHealthy() {
        long since = failingSince.getAndSet(0);
        if (since != 0) {
            log.info("[RedisStoreClient] 저장소 연결 복구 - 장애 지속 시간: {}ms", clock.millis() - since);
        }
    }

    private void markFailing() {
        failingSince.compareAndSet(0, clock.millis());
    }

    private String prefixed(String key) {
        return keyPrefix + key;
    }

    private String stripPrefix(String key) {
        return !keyPrefix.isEmpty() && key.startsWith(keyPrefix) ? key.substring(keyPrefix.length()) : key;
    }

    private final class RedisPipeline implements StorePipeline {

        private final StringRedisConnection connection;

        private RedisPipeline(StringRedisConnection connection) {
            this.connection = connection;
        }

        @Override
        public void del(String key) {
            connection.del(prefixed(key));
        }

        @Override
        public void sadd(String setKey, String member) {
            connection.sAdd(prefixed(setKey), member);
        }

        @Override
        public void srem(String setKey, String member) {
            connection.sRem(prefixed(setKey), member);
        }
    }
}
