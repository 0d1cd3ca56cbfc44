package com.hhplus.strategy.application.cache;

import com.hhplus.strategy.common.exception.ErrorCode;
import com.hhplus.strategy.common.exception.SystemException;

/**
 * 캐시 값 직렬화 / 역직렬화 실패
 */
public class CacheSerializationException extends SystemException {

    public CacheSerializationException(String detailMessage, Throwable cause) {
        super(ErrorCode.CACHE_SERIALIZATION_FAILED, detailMessage, cause);
    }
}
