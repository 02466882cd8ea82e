package com.tartaritech.profit_dashboard.dtos;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProjectionStateDTO {

    private int baseMonthIndex;
    private String baseMonth;
    private BigDecimal baseRevenue;
    private List<String> availableMonths = new ArrayList<>();
    private List<ProjectionRowDTO> rows = new ArrayList<>();
    private BigDecimal totalProjectedRevenue = BigDecimal.ZERO;
    private BigDecimal totalProjectedExpenses = BigDecimal.ZERO;
    private BigDecimal totalProjectedProfit = BigDecimal.ZERO;
}
