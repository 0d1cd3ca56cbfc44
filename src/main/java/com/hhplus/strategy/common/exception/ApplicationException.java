package com.hhplus.strategy.common.exception;

/**
 * ApplicationException - 잘못된 요청으로 인한 예외 (4XX)
 *
 * 사용 예:
 * - 알 수 없는 캐시 태그로 무효화 요청
 * - 비어 있는 삭제 패턴
 * - 존재하지 않는 기업 조회
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
