package com.hhplus.strategy.presentation.cache.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.strategy.application.cache.WarmupReport;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class WarmupResponse {
    @JsonProperty("succeeded")
    private int succeeded;

    @JsonProperty("failed")
    private int failed;

    @JsonProperty("failed_keys")
    private List<String> failedKeys;

    public static WarmupResponse from(WarmupReport report) {
        return new WarmupResponse(report.getSucceeded(), report.getFailed(), report.getFailedKeys());
    }
}
