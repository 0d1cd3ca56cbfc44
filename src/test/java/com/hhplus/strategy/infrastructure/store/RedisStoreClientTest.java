package com.hhplus.strategy.infrastructure.store;

import com.hhplus.strategy.config.MutableClock;
import com.hhplus.strategy.infrastructure.config.StoreProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * RedisStoreClientTest - Redis 클라이언트 단위 테스트 (Mockito)
 *
 * 테스트 범위:
 * 1. 키 접두사 적용 / 제거
 * 2. 연결 실패 재시도 후 StoreUnavailableException
 * 3. 장애 지속 시 즉시 실패와 복구 확인 (명령 오류는 장애로 보지 않음)
 */
@DisplayName("RedisStoreClient 단위 테스트")
class RedisStoreClientTest {

    private static final String PREFIX = "sp:";

    private StringRedisTemplate redisTemplate;
    private ValueOperations<String, String> valueOperations;
    private MutableClock clock;
    private RedisStoreClient client;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        valueOperations = mock(ValueOperations.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);

        StoreProperties properties = new StoreProperties();
        properties.setKeyPrefix(PREFIX);
        properties.setMaxRetriesPerRequest(2);
        properties.getRetry().setBaseDelay(Duration.ofMillis(1));
        properties.getRetry().setMaxRetryDuration(Duration.ofMinutes(5));
        properties.getRetry().setProbeInterval(Duration.ofSeconds(30));

        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        client = new RedisStoreClient(redisTemplate, properties, clock);
    }

    @Test
    @DisplayName("조회 - 접두사가 붙은 키로 요청")
    void testGet_AppliesPrefix() {
        when(valueOperations.get("sp:user:id:1")).thenReturn("{\"name\":\"kim\"}");

        assertEquals("{\"name\":\"kim\"}", client.get("user:id:1").orElseThrow());
        assertTrue(client.get("user:id:2").isEmpty());
    }

    @Test
    @DisplayName("패턴 조회 - 패턴에 접두사 적용, 결과에서 접두사 제거")
    void testKeys_StripsPrefix() {
        when(redisTemplate.keys("sp:user:*")).thenReturn(Set.of("sp:user:id:1", "sp:user:id:2"));

        assertEquals(Set.of("user:id:1", "user:id:2"), client.keys("user:*"));
    }

    @Test
    @DisplayName("TTL 기록 - 접두사 키와 TTL 전달")
    void testSetex() {
        client.setex("dashboard:1", Duration.ofMinutes(30), "{}");

        verify(valueOperations).set("sp:dashboard:1", "{}", Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("NX 설정 - 결과 그대로 반환")
    void testSetIfAbsent() {
        when(valueOperations.setIfAbsent("sp:lock:op:1", "token", Duration.ofSeconds(5))).thenReturn(true);

        assertTrue(client.setIfAbsent("lock:op:1", "token", Duration.ofSeconds(5)));
        assertFalse(client.setIfAbsent("lock:op:2", "token", Duration.ofSeconds(5)));
    }

    @Test
    @DisplayName("비교 후 삭제 - Lua 스크립트 결과 1 이면 true")
    @SuppressWarnings("unchecked")
    void testCompareAndDelete() {
        when(redisTemplate.execute(any(RedisScript.class), eq(List.of("sp:lock:op:1")), eq("token")))
                .thenReturn(1L);

        assertTrue(client.compareAndDelete("lock:op:1", "token"));
        assertFalse(client.compareAndDelete("lock:op:1", "other"));
    }

    @Test
    @DisplayName("연결 실패 - 재시도 후 StoreUnavailableException")
    void testConnectionFailure_RetriedThenWrapped() {
        when(valueOperations.get("sp:a")).thenThrow(new RedisConnectionFailureException("down"));

        StoreUnavailableException exception =
                assertThrows(StoreUnavailableException.class, () -> client.get("a"));

        assertEquals("SYSTEM_CACHE_STORE_UNAVAILABLE", exception.getErrorCodeValue());
        verify(valueOperations, times(3)).get("sp:a");
    }

    @Test
    @DisplayName("연결 외 오류 - 재시도 없이 StoreUnavailableException")
    void testOtherFailure_NotRetried() {
        when(valueOperations.get("sp:a")).thenThrow(new RedisSystemException("WRONGTYPE", null));

        assertThrows(StoreUnavailableException.class, () -> client.get("a"));

        verify(valueOperations, times(1)).get("sp:a");
    }

    @Test
    @DisplayName("명령 오류 반복 - 장애로 보지 않고 최대 재시도 시간 이후에도 저장소 호출")
    void testCommandError_DoesNotOpenFailFastWindow() {
        // Given: WRONGTYPE 명령 오류 후 최대 재시도 시간 경과
        when(valueOperations.get("sp:a")).thenThrow(new RedisSystemException("WRONGTYPE", null));
        when(valueOperations.get("sp:b")).thenReturn("v");
        assertThrows(StoreUnavailableException.class, () -> client.get("a"));
        clock.advance(Duration.ofMinutes(6));

        // When
        assertThrows(StoreUnavailableException.class, () -> client.get("a"));

        // Then: 즉시 실패하지 않고 매번 저장소를 호출한다
        verify(valueOperations, times(2)).get("sp:a");
        assertEquals("v", client.get("b").orElseThrow());
    }

    @Test
    @DisplayName("시간 초과 - 연결 실패와 같이 장애로 기록")
    void testTimeout_OpensFailFastWindow() {
        when(valueOperations.get("sp:a")).thenThrow(new QueryTimeoutException("timeout"));
        assertThrows(StoreUnavailableException.class, () -> client.get("a"));
        verify(valueOperations, times(3)).get("sp:a");

        clock.advance(Duration.ofMinutes(6));
        assertThrows(StoreUnavailableException.class, () -> client.get("a"));
        assertThrows(StoreUnavailableException.class, () -> client.get("a"));

        // 복구 확인 1회만 저장소 호출
        verify(valueOperations, times(6)).get("sp:a");
    }

    @Test
    @DisplayName("존재 확인 - 접두사 키로 EXISTS")
    void testExists() {
        when(redisTemplate.hasKey("sp:user:id:1")).thenReturn(true);

        assertTrue(client.exists("user:id:1"));
        assertFalse(client.exists("user:id:2"));
    }

    @Test
    @DisplayName("장애 지속 - 최대 재시도 시간 이후 즉시 실패, 복구 확인 주기마다 한 번 시도")
    void testFailFastAfterMaxRetryDuration() {
        when(valueOperations.get("sp:a")).thenThrow(new RedisConnectionFailureException("down"));
        assertThrows(StoreUnavailableException.class, () -> client.get("a"));
        verify(valueOperations, times(3)).get("sp:a");

        clock.advance(Duration.ofMinutes(6));

        // 복구 확인 시도 (다시 실패)
        assertThrows(StoreUnavailableException.class, () -> client.get("a"));
        verify(valueOperations, times(6)).get("sp:a");

        // 확인 주기 안에서는 저장소를 호출하지 않는다
        assertThrows(StoreUnavailableException.class, () -> client.get("a"));
        verify(valueOperations, times(6)).get("sp:a");
    }

    @Test
    @DisplayName("장애 후 성공 - 정상 상태로 복귀")
    void testRecovery() {
        when(valueOperations.get("sp:a"))
                .thenThrow(new RedisConnectionFailureException("down"))
                .thenThrow(new RedisConnectionFailureException("down"))
                .thenThrow(new RedisConnectionFailureException("down"))
                .thenReturn("v");
        assertThrows(StoreUnavailableException.class, () -> client.get("a"));

        assertEquals("v", client.get("a").orElseThrow());

        clock.advance(Duration.ofMinutes(10));
        assertEquals("v", client.get("a").orElseThrow());
    }

    @Test
    @DisplayName("종료 후 - 저장소 호출 없이 StoreUnavailableException")
    void testClosed() {
        client.close();

        assertThrows(StoreUnavailableException.class, () -> client.get("a"));
        verifyNoInteractions(valueOperations);
    }
}
