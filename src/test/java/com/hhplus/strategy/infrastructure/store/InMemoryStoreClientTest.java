package com.hhplus.strategy.infrastructure.store;

import com.hhplus.strategy.config.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryStoreClientTest - 인메모리 저장소 테스트
 *
 * 테스트 범위:
 * 1. TTL 만료
 * 2. glob 패턴 조회
 * 3. NX 설정 / 비교 후 삭제 (락 기본 연산)
 * 4. Set 연산, 파이프라인
 * 5. 종료 후 명령 거부
 */
@DisplayName("InMemoryStoreClient 단위 테스트")
class InMemoryStoreClientTest {

    private MutableClock clock;
    private InMemoryStoreClient store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        store = new InMemoryStoreClient(clock);
    }

    @Test
    @DisplayName("TTL 경과 전에는 조회, 경과 후에는 미스")
    void testSetex_ExpiresAfterTtl() {
        store.setex("user:id:1", Duration.ofSeconds(10), "{}");

        clock.advance(Duration.ofSeconds(9));
        assertEquals("{}", store.get("user:id:1").orElseThrow());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(store.get("user:id:1").isEmpty());
    }

    @Test
    @DisplayName("존재 확인 - 값/Set 키, 만료된 키는 없음, 조회 통계에 포함하지 않음")
    void testExists() {
        store.setex("user:id:1", Duration.ofSeconds(10), "{}");
        store.sadd("tag:user", "user:id:1");

        assertTrue(store.exists("user:id:1"));
        assertTrue(store.exists("tag:user"));
        assertFalse(store.exists("user:id:2"));

        clock.advance(Duration.ofSeconds(10));
        assertFalse(store.exists("user:id:1"));

        Properties info = store.info("stats");
        assertEquals("0", info.getProperty("keyspace_hits"));
        assertEquals("0", info.getProperty("keyspace_misses"));
    }

    @Test
    @DisplayName("TTL 없는 set - 만료되지 않음")
    void testSet_NoExpiry() {
        store.set("perf:daily:2025-01-01", "1");

        clock.advance(Duration.ofDays(365));

        assertTrue(store.get("perf:daily:2025-01-01").isPresent());
    }

    @Test
    @DisplayName("glob 패턴 - *, ? 와 리터럴 특수문자")
    void testKeys_GlobPattern() {
        store.set("user:id:1", "a");
        store.set("user:id:22", "b");
        store.set("user:email:x", "c");
        store.set("a.b", "d");
        store.set("axb", "e");

        assertEquals(Set.of("user:id:1", "user:id:22"), store.keys("user:id:*"));
        assertEquals(Set.of("user:id:1"), store.keys("user:id:?"));
        assertEquals(Set.of("a.b"), store.keys("a.b"));
        assertTrue(store.keys("nothing:*").isEmpty());
    }

    @Test
    @DisplayName("만료된 키는 패턴 조회에서 제외")
    void testKeys_SkipsExpired() {
        store.setex("session:1", Duration.ofSeconds(1), "s");
        clock.advance(Duration.ofSeconds(2));

        assertTrue(store.keys("session:*").isEmpty());
    }

    @Test
    @DisplayName("NX 설정 - 이미 있으면 실패, 만료 후 재획득 가능")
    void testSetIfAbsent() {
        assertTrue(store.setIfAbsent("lock:op:1", "token-a", Duration.ofSeconds(5)));
        assertFalse(store.setIfAbsent("lock:op:1", "token-b", Duration.ofSeconds(5)));

        clock.advance(Duration.ofSeconds(5));

        assertTrue(store.setIfAbsent("lock:op:1", "token-b", Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("비교 후 삭제 - 토큰이 일치할 때만 삭제")
    void testCompareAndDelete() {
        store.setIfAbsent("lock:op:1", "token-a", Duration.ofSeconds(5));

        assertFalse(store.compareAndDelete("lock:op:1", "token-b"));
        assertTrue(store.get("lock:op:1").isPresent());

        assertTrue(store.compareAndDelete("lock:op:1", "token-a"));
        assertTrue(store.get("lock:op:1").isEmpty());
    }

    @Test
    @DisplayName("Set 연산 - 마지막 멤버 제거 시 Set 삭제")
    void testSetOperations() {
        store.sadd("tag:user", "user:id:1");
        store.sadd("tag:user", "user:id:2");
        store.sadd("tag:user", "user:id:1");

        assertEquals(2, store.scard("tag:user"));
        assertEquals(Set.of("user:id:1", "user:id:2"), store.smembers("tag:user"));

        store.srem("tag:user", "user:id:1");
        store.srem("tag:user", "user:id:2");

        assertEquals(0, store.scard("tag:user"));
        assertTrue(store.keys("tag:*").isEmpty());
    }

    @Test
    @DisplayName("파이프라인 - 삭제와 Set 연산을 한 번에 적용")
    void testPipeline() {
        store.set("user:id:1", "a");
        store.sadd("tag:user", "user:id:1");

        store.pipeline(pipeline -> {
            pipeline.del("user:id:1");
            pipeline.srem("tag:user", "user:id:1");
            pipeline.sadd("tag:enterprise", "enterprise:list");
        });

        assertTrue(store.get("user:id:1").isEmpty());
        assertEquals(0, store.scard("tag:user"));
        assertEquals(1, store.scard("tag:enterprise"));
    }

    @Test
    @DisplayName("다중 삭제 - 실제 삭제된 개수 반환")
    void testDelMany() {
        store.set("a", "1");
        store.sadd("b", "x");

        assertEquals(2, store.del(List.of("a", "b", "c")));
        assertEquals(0, store.del("a"));
    }

    @Test
    @DisplayName("dbSize / info - 값과 Set 개수, 히트/미스 통계")
    void testDbSizeAndInfo() {
        store.set("a", "1");
        store.setex("b", Duration.ofSeconds(1), "2");
        store.sadd("tag:user", "a");
        store.get("a");
        store.get("missing");

        clock.advance(Duration.ofSeconds(1));

        assertEquals(2, store.dbSize());
        Properties info = store.info("stats");
        assertEquals("1", info.getProperty("keyspace_hits"));
        assertEquals("1", info.getProperty("keyspace_misses"));
    }

    @Test
    @DisplayName("종료 후 명령 - StoreUnavailableException")
    void testClosed() {
        store.close();
        store.close();

        assertThrows(StoreUnavailableException.class, () -> store.get("a"));
    }
}
