package com.hhplus.strategy.infrastructure.store;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.function.Consumer;

/**
 * 캐시 저장소 클라이언트
 *
 * 역할:
 * - 키-값, Set, 조건부 쓰기, 파이프라인 등 캐시 계층이 사용하는 저장소 명령 제공
 * - 모든 키는 논리 키로 다루며 접두사(namespace) 처리는 구현체가 담당
 *
 * 특징:
 * - 연결/명령 실패는 모두 {@link StoreUnavailableException}으로 변환된다
 * - 저장소 구현 라이브러리의 예외 타입은 이 패키지 밖으로 나가지 않는다
 */
public interface StoreClient extends AutoCloseable {

    Optional<String> get(String key);

    /**
     * 값/Set 구분 없이 살아 있는 키인지 확인. 조회 통계에는 포함되지 않는다.
     */
    boolean exists(String key);

    void setex(String key, Duration ttl, String payload);

    void set(String key, String payload);

    long del(String key);

    long del(Collection<String> keys);

    void sadd(String setKey, String member);

    void srem(String setKey, String member);

    Set<String> smembers(String setKey);

    long scard(String setKey);

    /**
     * glob 패턴에 매칭되는 논리 키 목록
     */
    Set<String> keys(String pattern);

    /**
     * 키가 없을 때만 TTL과 함께 기록 (SET NX PX)
     *
     * @return 기록에 성공했으면 true
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    /**
     * 현재 값이 expected 와 같을 때만 삭제 (원자적)
     *
     * @return 삭제했으면 true
     */
    boolean compareAndDelete(String key, String expected);

    /**
     * 여러 명령을 한 번의 왕복으로 실행
     */
    void pipeline(Consumer<StorePipeline> commands);

    Properties info(String section);

    long dbSize();

    void ping();

    @Override
    void close();
}
