package com.tartaritech.profit_dashboard.entities;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import com.tartaritech.profit_dashboard.enums.ShippingEstimateStatus;

import jakarta.persistence.CascadeType;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "tb_order", indexes = {
    @Index(name = "idx_order_date", columnList = "order_date")
})
@EntityListeners(AuditingEntityListener.class)
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
public class Order {

    // Shopify order id
    @Id
    private String id;

    private Integer orderNumber;

    @Column(name = "order_date", nullable = false)
    private LocalDate orderDate;

    private String customerEmail;

    private String currency = "USD";

    private String financialStatus;

    @Column(precision = 19, scale = 2)
    private BigDecimal subtotal = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal totalDiscounts = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal totalPrice = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal shippingCharged = BigDecimal.ZERO;

    @Column(precision = 19, scale = 2)
    private BigDecimal shippingCostEstimated;

    private Long matchedRuleId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "tb_order_applied_rule", joinColumns = @JoinColumn(name = "order_id"))
    @Column(name = "rule_id")
    private Set<Long> appliedRuleIds = new HashSet<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ShippingEstimateStatus shippingEstimateStatus = ShippingEstimateStatus.NOT_CALCULATED;

    private Instant shippingCalculatedAt;

    @CreatedDate
    private LocalDateTime createdDate;

    @LastModifiedDate
    private LocalDateTime lastModifiedDate;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<LineItem> lineItems = new ArrayList<>();

    public void addLineItem(LineItem lineItem) {
        lineItem.setOrder(this);
        lineItems.add(lineItem);
    }

    public void replaceLineItems(List<LineItem> items) {
        lineItems.clear();
        items.forEach(this::addLineItem);
    }

    public void applyShippingEstimate(BigDecimal estimate, Long matchedRuleId, Set<Long> ruleIds,
            ShippingEstimateStatus status, Instant calculatedAt) {
        this.shippingCostEstimated = estimate;
        this.matchedRuleId = matchedRuleId;
        this.appliedRuleIds.clear();
        this.appliedRuleIds.addAll(ruleIds);
        this.shippingEstimateStatus = status;
        this.shippingCalculatedAt = calculatedAt;
    }

    // previous estimate and rule ids stay as they were
    public void markMisconfigured(Instant checkedAt) {
        this.shippingEstimateStatus = ShippingEstimateStatus.MISCONFIGURED_RULE;
        this.shippingCalculatedAt = checkedAt;
    }
}
