package com.tartaritech.profit_dashboard.entities;

import java.math.BigDecimal;

import com.tartaritech.profit_dashboard.enums.CostRuleType;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Tagged cost formula of a shipping profile. Only the parameter read by {@link #type} is
 * expected to be populated; presence is checked when the rule is evaluated.
 */
@Embeddable
@AllArgsConstructor
@NoArgsConstructor
@Getter
@Setter
@ToString
@EqualsAndHashCode
public class CostRule {

    @Enumerated(EnumType.STRING)
    @Column(name = "cost_type", length = 32)
    private CostRuleType type;

    @Column(name = "base_cost", precision = 19, scale = 2)
    private BigDecimal baseCost;

    @Column(name = "per_item_cost", precision = 19, scale = 2)
    private BigDecimal perItemCost;

    @Column(name = "percentage", precision = 9, scale = 4)
    private BigDecimal percentage;

    @Column(name = "adjustment", precision = 19, scale = 2)
    private BigDecimal adjustment;

    public static CostRule fixed(BigDecimal baseCost) {
        return new CostRule(CostRuleType.FIXED, baseCost, null, null, null);
    }

    public static CostRule perItem(BigDecimal perItemCost) {
        return new CostRule(CostRuleType.PER_ITEM, null, perItemCost, null, null);
    }

    public static CostRule percentage(BigDecimal percentage) {
        return new CostRule(CostRuleType.PERCENTAGE, null, null, percentage, null);
    }

    public static CostRule basedOnShippingCharged(BigDecimal adjustment) {
        return new CostRule(CostRuleType.BASED_ON_SHIPPING_CHARGED, null, null, null, adjustment);
    }
}
