package com.hhplus.strategy.application.enterprise.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.strategy.domain.enterprise.Enterprise;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnterpriseResponse {
    @JsonProperty("enterprise_id")
    private Long enterpriseId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("industry")
    private String industry;

    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    public static EnterpriseResponse from(Enterprise enterprise) {
        return EnterpriseResponse.builder()
                .enterpriseId(enterprise.getEnterpriseId())
                .name(enterprise.getName())
                .industry(enterprise.getIndustry())
                .updatedAt(enterprise.getUpdatedAt())
                .build();
    }
}
