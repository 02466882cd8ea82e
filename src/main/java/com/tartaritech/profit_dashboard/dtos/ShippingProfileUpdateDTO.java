package com.tartaritech.profit_dashboard.dtos;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Partial update, null fields keep their stored value.
 */
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ShippingProfileUpdateDTO {

    @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
    private String name;

    private String description;

    private Integer priority;

    @JsonProperty("is_active")
    private Boolean active;

    @JsonProperty("is_default")
    private Boolean defaultProfile;

    @Valid
    private MatchConditionDTO matchCondition;

    @Valid
    private CostRuleDTO costRule;
}
