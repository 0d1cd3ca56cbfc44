package com.hhplus.strategy.presentation.cache.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 무효화/정리 결과 (대상, 삭제 건수)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class InvalidationResponse {
    @JsonProperty("target")
    private String target;

    @JsonProperty("removed_count")
    private long removedCount;
}
