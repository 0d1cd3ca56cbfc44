package com.hhplus.strategy.common.exception;

/**
 * ErrorCode - 예외 코드 정의
 *
 * 역할:
 * - 모든 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: SYSTEM_CACHE_STORE_UNAVAILABLE, APP_INVALID_CACHE_KEY
 */
public enum ErrorCode {

    // ========== Domain Errors (4XX) ==========

    ENTERPRISE_NOT_FOUND("DOMAIN_ENTERPRISE_NOT_FOUND", "기업을 찾을 수 없습니다", 404),

    // ========== Application Errors (4XX) ==========

    INVALID_CACHE_KEY("APP_INVALID_CACHE_KEY", "유효하지 않은 캐시 키입니다", 400),
    UNKNOWN_CACHE_TAG("APP_UNKNOWN_CACHE_TAG", "알 수 없는 캐시 태그입니다", 400),
    INVALID_REQUEST("APP_INVALID_REQUEST", "잘못된 요청입니다", 400),

    // ========== System Errors (5XX) ==========

    CACHE_STORE_UNAVAILABLE("SYSTEM_CACHE_STORE_UNAVAILABLE", "캐시 저장소에 연결할 수 없습니다", 503),
    CACHE_SERIALIZATION_FAILED("SYSTEM_CACHE_SERIALIZATION_FAILED", "캐시 값 직렬화에 실패했습니다", 500),
    LOCK_ACQUISITION_TIMEOUT("SYSTEM_LOCK_ACQUISITION_TIMEOUT", "분산락 획득 대기 시간을 초과했습니다", 503),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
