package com.tartaritech.profit_dashboard.dtos;

import java.math.BigDecimal;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProfileTestResponseDTO {

    private boolean matched;

    // null when not matched
    private BigDecimal calculatedCost;

    private MatchConditionDTO matchCondition;

    private CostRuleDTO costRule;
}
