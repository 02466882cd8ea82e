package com.tartaritech.profit_dashboard.dtos;

import java.math.BigDecimal;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tartaritech.profit_dashboard.enums.MetricSource;

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
public class SourceSummaryDTO {

    private MetricSource source;
    private int days;
    private BigDecimal spend = BigDecimal.ZERO;
    private long clicks;
    private long impressions;
    private BigDecimal ctr;
    private BigDecimal conversions = BigDecimal.ZERO;
    private BigDecimal revenue = BigDecimal.ZERO;
    private BigDecimal shippingRevenue = BigDecimal.ZERO;
    private BigDecimal shippingCost = BigDecimal.ZERO;
    private BigDecimal cogs = BigDecimal.ZERO;
    private long orderCount;
}
