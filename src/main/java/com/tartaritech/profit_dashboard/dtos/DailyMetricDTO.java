package com.tartaritech.profit_dashboard.dtos;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tartaritech.profit_dashboard.entities.DailyMetric;
import com.tartaritech.profit_dashboard.enums.MetricSource;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
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
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DailyMetricDTO {

    @NotNull(message = "Source is required")
    private MetricSource source;

    @NotNull(message = "Date is required")
    @JsonProperty("date")
    private LocalDate metricDate;

    private String campaignId;

    @DecimalMin(value = "0.0", message = "Spend cannot be negative")
    private BigDecimal spend;

    @Min(value = 0, message = "Clicks cannot be negative")
    private Long clicks;

    @Min(value = 0, message = "Impressions cannot be negative")
    private Long impressions;

    private BigDecimal ctr;

    private BigDecimal conversions;

    private BigDecimal revenue;

    private BigDecimal shippingRevenue;

    private BigDecimal shippingCost;

    private BigDecimal cogs;

    @Min(value = 0, message = "Order count cannot be negative")
    private Integer orderCount;

    public DailyMetricDTO(DailyMetric entity) {
        this.source = entity.getSource();
        this.metricDate = entity.getMetricDate();
        this.campaignId = entity.getCampaignId().isEmpty() ? null : entity.getCampaignId();
        this.spend = entity.getSpend();
        this.clicks = entity.getClicks();
        this.impressions = entity.getImpressions();
        this.ctr = entity.getCtr();
        this.conversions = entity.getConversions();
        this.revenue = entity.getRevenue();
        this.shippingRevenue = entity.getShippingRevenue();
        this.shippingCost = entity.getShippingCost();
        this.cogs = entity.getCogs();
        this.orderCount = entity.getOrderCount();
    }

    public DailyMetric toEntity() {
        DailyMetric metric = DailyMetric.create(source, metricDate, campaignId);
        metric.setSpend(orZero(spend));
        metric.setClicks(clicks != null ? clicks : 0L);
        metric.setImpressions(impressions != null ? impressions : 0L);
        metric.setCtr(ctr);
        metric.setConversions(orZero(conversions));
        metric.setRevenue(orZero(revenue));
        metric.setShippingRevenue(orZero(shippingRevenue));
        metric.setShippingCost(orZero(shippingCost));
        metric.setCogs(orZero(cogs));
        metric.setOrderCount(orderCount != null ? orderCount : 0);
        return metric;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
