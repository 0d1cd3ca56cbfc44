package com.hhplus.strategy.application.cache;

/**
 * 캐시 내부 연산 실패 유형
 */
public enum CacheError {

    /**
     * 저장소 연결 또는 명령 실패 (미스로 취급)
     */
    STORE_UNAVAILABLE,

    /**
     * 값 직렬화 / 역직렬화 실패
     */
    SERIALIZATION,

    /**
     * 최대 대기 시간 안에 락을 얻지 못함
     */
    LOCK_TIMEOUT,

    UNKNOWN
}
