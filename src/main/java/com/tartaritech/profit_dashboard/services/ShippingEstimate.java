package com.tartaritech.profit_dashboard.services;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

import com.tartaritech.profit_dashboard.dtos.ItemMatchDTO;
import com.tartaritech.profit_dashboard.dtos.ShippingBreakdownDTO;
import com.tartaritech.profit_dashboard.enums.ShippingEstimateStatus;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class ShippingEstimate {

    // null when no rule matched
    private final BigDecimal totalCost;
    private final ShippingEstimateStatus status;
    private final Long primaryRuleId;
    private final Set<Long> appliedRuleIds;
    private final List<ShippingBreakdownDTO> breakdown;
    private final List<ItemMatchDTO> matchedItems;
}
