package com.hhplus.strategy.application.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 기업 대시보드 요약 (dashboard:{enterpriseId} 키로 캐시)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardSummary {
    @JsonProperty("enterprise_id")
    private Long enterpriseId;

    @JsonProperty("enterprise_name")
    private String enterpriseName;

    @JsonProperty("department_count")
    private int departmentCount;

    @JsonProperty("user_count")
    private long userCount;

    @JsonProperty("active_strategy_count")
    private int activeStrategyCount;

    @JsonProperty("card_count")
    private int cardCount;

    @JsonProperty("generated_at")
    private LocalDateTime generatedAt;
}
