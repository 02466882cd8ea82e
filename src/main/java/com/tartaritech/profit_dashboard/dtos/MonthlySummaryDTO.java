package com.tartaritech.profit_dashboard.dtos;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tartaritech.profit_dashboard.enums.MetricSource;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One calendar month of merged ad and Shopify metrics. Ratio fields are null when their
 * denominator is zero.
 */
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MonthlySummaryDTO {

    public static final String WARNING_NO_DATA = "NO_DATA";
    public static final String WARNING_AGGREGATION_GAP = "AGGREGATION_GAP";

    private String month; // Format: "YYYY-MM", null for multi-month totals

    private BigDecimal revenue = BigDecimal.ZERO;
    private BigDecimal shippingRevenue = BigDecimal.ZERO;
    private BigDecimal totalRevenue = BigDecimal.ZERO;
    private BigDecimal shippingCost = BigDecimal.ZERO;
    private BigDecimal cogs = BigDecimal.ZERO;
    private long orderCount;

    private BigDecimal adSpend = BigDecimal.ZERO;
    private BigDecimal googleAdsSpend = BigDecimal.ZERO;
    private BigDecimal metaAdsSpend = BigDecimal.ZERO;
    private long clicks;
    private long impressions;
    private BigDecimal conversions = BigDecimal.ZERO;

    private BigDecimal ctr;
    private BigDecimal roas;
    private BigDecimal poas;
    private BigDecimal profit = BigDecimal.ZERO;
    private BigDecimal profitMargin;

    private Set<MetricSource> sources = EnumSet.noneOf(MetricSource.class);
    private boolean partial;
    private Integer daysElapsed;
    private Integer daysInMonth;
    private boolean singleSource;
    private long ordersMissingEstimate;
    private List<String> warnings = new ArrayList<>();

    public BigDecimal getTotalExpenses() {
        return adSpend.add(cogs).add(shippingCost);
    }

    public boolean hasData() {
        return !sources.isEmpty();
    }
}
