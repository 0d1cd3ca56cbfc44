package com.hhplus.strategy.application.cache;

import com.hhplus.strategy.common.exception.ErrorCode;
import com.hhplus.strategy.common.exception.SystemException;

/**
 * 최대 대기 시간 안에 분산락을 획득하지 못함
 */
public class LockAcquisitionTimeoutException extends SystemException {

    private final String lockKey;

    public LockAcquisitionTimeoutException(String lockKey) {
        super(ErrorCode.LOCK_ACQUISITION_TIMEOUT, "lockKey: " + lockKey);
        this.lockKey = lockKey;
    }

    public String getLockKey() {
        return lockKey;
    }
}
