package com.tartaritech.profit_dashboard.entities;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

import com.tartaritech.profit_dashboard.enums.MetricSource;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Entity
@Table(name = "tb_daily_metric",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_daily_metric_key", columnNames = {"metric_source", "metric_date", "campaign_id"})
    },
    indexes = {
        @Index(name = "idx_daily_metric_date", columnList = "metric_date")
    })
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
public class DailyMetric {

    public static final String ACCOUNT_LEVEL = "";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "metric_source", nullable = false, length = 16)
    private MetricSource source;

    @Column(name = "metric_date", nullable = false)
    private LocalDate metricDate;

    // empty string for account-level rows
    @Column(name = "campaign_id", nullable = false)
    private String campaignId = ACCOUNT_LEVEL;

    @Column(precision = 19, scale = 2)
    private BigDecimal spend = BigDecimal.ZERO;

    private Long clicks = 0L;

    private Long impressions = 0L;

    @Column(precision = 9, scale = 4)
    private BigDecimal ctr;

    @Column(precision = 19, scale = 2)
    private BigDecimal conversions = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal revenue = BigDecimal.ZERO;

    @Column(name = "shipping_revenue", precision = 19, scale = 2)
    private BigDecimal shippingRevenue = BigDecimal.ZERO;

    @Column(name = "shipping_cost", precision = 19, scale = 2)
    private BigDecimal shippingCost = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal cogs = BigDecimal.ZERO;

    @Column(name = "order_count")
    private Integer orderCount = 0;

    @Column(name = "last_updated_at", nullable = false)
    private Instant lastUpdatedAt;

    @PrePersist
    @PreUpdate
    void updateTimestamp() {
        lastUpdatedAt = Instant.now();
    }

    public static DailyMetric create(MetricSource source, LocalDate date, String campaignId) {
        DailyMetric metric = new DailyMetric();
        metric.setSource(source);
        metric.setMetricDate(date);
        metric.setCampaignId(campaignId != null ? campaignId : ACCOUNT_LEVEL);
        metric.setLastUpdatedAt(Instant.now());
        return metric;
    }

    public void copyValuesFrom(DailyMetric other) {
        this.spend = other.getSpend();
        this.clicks = other.getClicks();
        this.impressions = other.getImpressions();
        this.ctr = other.getCtr();
        this.conversions = other.getConversions();
        this.revenue = other.getRevenue();
        this.shippingRevenue = other.getShippingRevenue();
        this.shippingCost = other.getShippingCost();
        this.cogs = other.getCogs();
        this.orderCount = other.getOrderCount();
    }
}
