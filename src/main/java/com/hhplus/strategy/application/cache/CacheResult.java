package com.hhplus.strategy.application.cache;

import java.util.Optional;
import java.util.function.Function;

/**
 * 캐시 내부 연산 결과 (성공 값 또는 실패 유형)
 *
 * 공개 연산은 이 결과를 문서화된 기본값(빈 Optional, false, 0)으로 변환해 반환한다.
 */
public final class CacheResult<T> {

    private final T value;
    private final CacheError error;
    private final Throwable cause;

    private CacheResult(T value, CacheError error, Throwable cause) {
        this.value = value;
        this.error = error;
        this.cause = cause;
    }

    public static <T> CacheResult<T> success(T value) {
        return new CacheResult<>(value, null, null);
    }

    public static <T> CacheResult<T> failure(CacheError error, Throwable cause) {
        return new CacheResult<>(null, error, cause);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @throws IllegalStateException 실패 결과인 경우
     */
    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("실패한 캐시 연산 결과입니다: " + error, cause);
        }
        return value;
    }

    public Optional<CacheError> getError() {
        return Optional.ofNullable(error);
    }

    public Optional<Throwable> getCause() {
        return Optional.ofNullable(cause);
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    public <R> CacheResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return new CacheResult<>(null, error, cause);
        }
        return new CacheResult<>(mapper.apply(value), null, null);
    }

    @Override
    public String toString() {
        return error == null ? "CacheResult[success=" + value + "]" : "CacheResult[failure=" + error + "]";
    }
}
