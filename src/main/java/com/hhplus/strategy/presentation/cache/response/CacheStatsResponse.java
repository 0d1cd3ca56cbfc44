package com.hhplus.strategy.presentation.cache.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.strategy.application.cache.CacheStats;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.Map;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatsResponse {
    @JsonProperty("connected")
    private boolean connected;

    @JsonProperty("db_size")
    private long dbSize;

    @JsonProperty("info")
    private Map<String, String> info;

    public static CacheStatsResponse from(CacheStats stats) {
        return CacheStatsResponse.builder()
                .connected(stats.isConnected())
                .dbSize(stats.getDbSize())
                .info(stats.getInfo())
                .build();
    }

    public static CacheStatsResponse disconnected() {
        return CacheStatsResponse.builder()
                .connected(false)
                .dbSize(0)
                .info(Collections.emptyMap())
                .build();
    }
}
