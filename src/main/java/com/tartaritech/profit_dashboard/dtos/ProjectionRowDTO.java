package com.tartaritech.profit_dashboard.dtos;

import java.io.Serializable;
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
public class ProjectionRowDTO implements Serializable {

    private static final long serialVersionUID = 1L;

    private String month;
    private BigDecimal multiplier;
    private boolean currentMonth;
    private BigDecimal projectedRevenue = BigDecimal.ZERO;
    private BigDecimal projectedAdSpend = BigDecimal.ZERO;
    private BigDecimal projectedCogs = BigDecimal.ZERO;
    private BigDecimal projectedShippingCost = BigDecimal.ZERO;
    private BigDecimal projectedExpenses = BigDecimal.ZERO;
    private BigDecimal projectedProfit = BigDecimal.ZERO;
}
