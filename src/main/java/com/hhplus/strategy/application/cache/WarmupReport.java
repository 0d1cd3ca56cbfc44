package com.hhplus.strategy.application.cache;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * 워밍업 결과
 *
 * 계산과 기록이 모두 성공한 항목만 succeeded 로 센다.
 */
@Getter
@RequiredArgsConstructor
public class WarmupReport {

    private final int succeeded;
    private final int failed;
    private final List<String> failedKeys;

    public int getTotal() {
        return succeeded + failed;
    }
}
