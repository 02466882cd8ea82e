package com.tartaritech.profit_dashboard.dtos;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tartaritech.profit_dashboard.enums.ShippingEstimateStatus;

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
public class RecomputeResultDTO {

    private String orderId;

    private ShippingEstimateStatus status;

    private BigDecimal shippingCostEstimated;

    // null when several rules contributed
    private Long matchedRuleId;

    private Set<Long> appliedRuleIds;

    private List<ShippingBreakdownDTO> breakdown = new ArrayList<>();

    private List<ItemMatchDTO> matchedItems = new ArrayList<>();
}
