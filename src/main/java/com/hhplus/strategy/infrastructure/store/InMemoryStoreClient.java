package com.hhplus.strategy.infrastructure.store;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * 단일 프로세스용 저장소 클라이언트
 *
 * 로컬 실행과 테스트에서 Redis 대신 사용한다 (cache.store.type=in-memory).
 *
 * 특징:
 * - 문자열 값과 Set 이 하나의 키 공간을 공유 (Redis 와 동일)
 * - TTL 은 조회 시점에 만료 처리
 * - 모든 명령은 인스턴스 모니터로 직렬화되어 NX, 비교 후 삭제, 파이프라인이 원자적으로 동작
 */
@Slf4j
public class InMemoryStoreClient implements StoreClient {

    private final Map<String, ValueEntry> values = new HashMap<>();
    private final Map<String, Set<String>> sets = new HashMap<>();
    private final Clock clock;

    private long hits;
    private long misses;
    private long commands;
    private boolean closed;

    public InMemoryStoreClient() {
        this(Clock.systemUTC());
    }

    public InMemoryStoreClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<String> get(String key) {
        touch("GET");
        ValueEntry entry = liveEntry(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        hits++;
        return Optional.of(entry.value);
    }

    @Override
    public synchronized boolean exists(String key) {
        touch("EXISTS");
        return liveEntry(key) != null || sets.containsKey(key);
    }

    @Override
    public synchronized void setex(String key, Duration ttl, String payload) {
        touch("SETEX");
        sets.remove(key);
        values.put(key, new ValueEntry(payload, clock.millis() + ttl.toMillis()));
    }

    @Override
    public synchronized void set(String key, String payload) {
        touch("SET");
        sets.remove(key);
        values.put(key, new ValueEntry(payload, 0L));
    }

    @Override
    public synchronized long del(String key) {
        touch("DEL");
        return delete(key) ? 1L : 0L;
    }

    @Override
    public synchronized long del(Collection<String> keys) {
        touch("DEL");
        long deleted = 0;
        for (String key : keys) {
            if (delete(key)) {
                deleted++;
            }
        }
        return deleted;
    }

    @Override
    public synchronized void sadd(String setKey, String member) {
        touch("SADD");
        values.remove(setKey);
        sets.computeIfAbsent(setKey, k -> new LinkedHashSet<>()).add(member);
    }

    @Override
    public synchronized void srem(String setKey, String member) {
        touch("SREM");
        Set<String> members = sets.get(setKey);
        if (members != null) {
            members.remove(member);
            if (members.isEmpty()) {
                sets.remove(setKey);
            }
        }
    }

    @Override
    public synchronized Set<String> smembers(String setKey) {
        touch("SMEMBERS");
        Set<String> members = sets.get(setKey);
        return members == null ? Collections.emptySet() : new LinkedHashSet<>(members);
    }

    @Override
    public synchronized long scard(String setKey) {
        touch("SCARD");
        Set<String> members = sets.get(setKey);
        return members == null ? 0L : members.size();
    }

    @Override
    public synchronized Set<String> keys(String pattern) {
        touch("KEYS");
        Pattern regex = globToRegex(pattern);
        Set<String> matched = new LinkedHashSet<>();
        for (String key : new LinkedHashSet<>(values.keySet())) {
            if (liveEntry(key) != null && regex.matcher(key).matches()) {
                matched.add(key);
            }
        }
        for (String key : sets.keySet()) {
            if (regex.matcher(key).matches()) {
                matched.add(key);
            }
        }
        return matched;
    }

    @Override
    public synchronized boolean setIfAbsent(String key, String value, Duration ttl) {
        touch("SET NX PX");
        if (liveEntry(key) != null || sets.containsKey(key)) {
            return false;
        }
        values.put(key, new ValueEntry(value, clock.millis() + ttl.toMillis()));
        return true;
    }

    @Override
    public synchronized boolean compareAndDelete(String key, String expected) {
        touch("EVAL compare-and-delete");
        ValueEntry entry = liveEntry(key);
        if (entry == null || !entry.value.equals(expected)) {
            return false;
        }
        values.remove(key);
        return true;
    }

    @Override
    public synchronized void pipeline(Consumer<StorePipeline> commands) {
        touch("PIPELINE");
        commands.accept(new StorePipeline() {
            @Override
            public void del(String key) {
                delete(key);
            }

            @Override
            public void sadd(String setKey, String member) {
                InMemoryStoreClient.this.sadd(setKey, member);
            }

            @Override
            public void srem(String setKey, String member) {
                InMemoryStoreClient.this.srem(setKey, member);
            }
        });
    }

    @Override
    public synchronized Properties info(String section) {
        touch("INFO");
        Properties info = new Properties();
        info.setProperty("keyspace_hits", String.valueOf(hits));
        info.setProperty("keyspace_misses", String.valueOf(misses));
        info.setProperty("total_commands_processed", String.valueOf(commands));
        return info;
    }

    @Override
    public synchronized long dbSize() {
        touch("DBSIZE");
        long now = clock.millis();
        values.values().removeIf(entry -> entry.isExpired(now));
        return values.size() + sets.size();
    }

    @Override
    public synchronized void ping() {
        touch("PING");
    }

    @Override
    public synchronized void close() {
        if (!closed) {
            closed = true;
            log.info("[InMemoryStoreClient] 클라이언트 종료");
        }
    }

    /**
     * 모든 데이터 삭제 (테스트 격리용)
     */
    public synchronized void flushAll() {
        values.clear();
        sets.clear();
        hits = 0;
        misses = 0;
    }

    private void touch(String operation) {
        if (closed) {
            throw new StoreUnavailableException("클라이언트가 종료되었습니다 - op: " + operation);
        }
        commands++;
    }

    private boolean delete(String key) {
        boolean removedValue = liveEntry(key) != null && values.remove(key) != null;
        boolean removedSet = sets.remove(key) != null;
        return removedValue || removedSet;
    }

    private ValueEntry liveEntry(String key) {
        ValueEntry entry = values.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpired(clock.millis())) {
            values.remove(key);
            return null;
        }
        return entry;
    }

    /**
     * Redis glob → 정규표현식 (*, ?, 그 외 문자는 리터럴)
     */
    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static final class ValueEntry {

        private final String value;
        private final long expiresAtMillis;

        private ValueEntry(String value, long expiresAtMillis) {
            this.value = value;
            this.expiresAtMillis = expiresAtMillis;
        }

        private boolean isExpired(long nowMillis) {
            return expiresAtMillis > 0 && nowMillis >= expiresAtMillis;
        }
    }
}
