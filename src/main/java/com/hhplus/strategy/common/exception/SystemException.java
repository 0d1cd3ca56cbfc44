package com.hhplus.strategy.common.exception;

/**
 * SystemException - 인프라 계층 오류 예외
 *
 * 역할:
 * - 캐시 저장소, 직렬화, 분산락 등 인프라 오류
 * - 항상 서버 오류(5XX)로 응답
 *
 * 특징:
 * - 클라이언트 재시도 가능성 있음
 * - 캐시 계층에서는 대부분 안전한 기본값으로 흡수되고 로그만 남긴다
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }

    public SystemException(ErrorCode errorCode, String detailMessage, Throwable cause) {
        super(errorCode, detailMessage, cause);
    }
}
