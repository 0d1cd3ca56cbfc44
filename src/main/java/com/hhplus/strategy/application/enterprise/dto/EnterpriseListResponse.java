package com.hhplus.strategy.application.enterprise.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.List;

/**
 * 기업 목록 응답
 *
 * 캐시 직렬화 시 타입 정보가 함께 기록되므로 enterprises 는 ArrayList 로 채운다.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class EnterpriseListResponse {
    @JsonProperty("enterprises")
    private List<EnterpriseResponse> enterprises;

    @JsonProperty("total_count")
    private int totalCount;
}
