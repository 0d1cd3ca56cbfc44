package com.hhplus.strategy.presentation.enterprise.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CreateEnterpriseRequest {
    @JsonProperty("name")
    private String name;

    @JsonProperty("industry")
    private String industry;
}
