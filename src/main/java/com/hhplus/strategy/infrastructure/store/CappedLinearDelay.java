package com.hhplus.strategy.infrastructure.store;

import io.lettuce.core.resource.Delay;

import java.time.Duration;

/**
 * 재연결 지연: attempt × base, 최대 max
 *
 * 예 (base=50ms, max=2s): 50ms, 100ms, 150ms ... 2s, 2s
 */
public class CappedLinearDelay extends Delay {

    private final Duration base;
    private final Duration max;

    public CappedLinearDelay(Duration base, Duration max) {
        this.base = base;
        this.max = max;
    }

    @Override
    public Duration createDelay(long attempt) {
        long millis = Math.min(Math.max(attempt, 1) * base.toMillis(), max.toMillis());
        return Duration.ofMillis(millis);
    }
}
