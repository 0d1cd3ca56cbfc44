package com.hhplus.strategy.infrastructure.store;

import com.hhplus.strategy.common.exception.ErrorCode;
import com.hhplus.strategy.common.exception.SystemException;

/**
 * 캐시 저장소 연결/명령 실패
 *
 * 캐시 계층 상위에서는 "캐시 미스"와 동일하게 취급한다.
 */
public class StoreUnavailableException extends SystemException {

    public StoreUnavailableException(String detailMessage) {
        super(ErrorCode.CACHE_STORE_UNAVAILABLE, detailMessage);
    }

    public StoreUnavailableException(String detailMessage, Throwable cause) {
        super(ErrorCode.CACHE_STORE_UNAVAILABLE, detailMessage, cause);
    }
}
