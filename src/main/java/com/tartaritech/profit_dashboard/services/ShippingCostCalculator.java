package com.tartaritech.profit_dashboard.services;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import org.springframework.stereotype.Component;

import com.tartaritech.profit_dashboard.entities.CostRule;
import com.tartaritech.profit_dashboard.entities.LineItem;
import com.tartaritech.profit_dashboard.entities.Order;
import com.tartaritech.profit_dashboard.entities.ShippingProfile;
import com.tartaritech.profit_dashboard.exceptions.ShippingRuleConfigurationException;

@Component
public class ShippingCostCalculator {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    public BigDecimal calculate(Order order, ShippingProfile rule) {
        return calculate(order, rule, order.getLineItems());
    }

    /**
     * Cost of shipping the given items of the order under the rule. Fixed costs apply once
     * per call, per item costs scale with the summed quantity of {@code matchedItems}.
     */
    public BigDecimal calculate(Order order, ShippingProfile rule, List<LineItem> matchedItems) {
        int quantity = matchedItems.stream()
                .mapToInt(item -> item.getQuantity() != null ? item.getQuantity() : 0)
                .sum();
        return calculate(rule, new ShippingCostInput(order.getSubtotal(), quantity, order.getShippingCharged()));
    }

    public BigDecimal calculate(ShippingProfile rule, ShippingCostInput input) {
        CostRule costRule = rule.getCostRule();
        if (costRule == null || costRule.getType() == null) {
            throw new ShippingRuleConfigurationException(rule.getId(),
                    "Shipping profile '" + rule.getName() + "' has no cost rule type");
        }

        BigDecimal cost;
        switch (costRule.getType()) {
            case FIXED:
                cost = required(rule, costRule.getBaseCost());
                break;
            case PER_ITEM:
                cost = required(rule, costRule.getPerItemCost()).multiply(BigDecimal.valueOf(input.getQuantity()));
                break;
            case PERCENTAGE:
                cost = orZero(input.getOrderSubtotal())
                        .multiply(required(rule, costRule.getPercentage()))
                        .divide(ONE_HUNDRED, 4, RoundingMode.HALF_UP);
                break;
            case BASED_ON_SHIPPING_CHARGED:
                cost = orZero(input.getShippingCharged()).add(required(rule, costRule.getAdjustment()))
                        .max(BigDecimal.ZERO);
                break;
            default:
                throw new ShippingRuleConfigurationException(rule.getId(),
                        "Unsupported cost rule type: " + costRule.getType());
        }
        return cost.setScale(2, RoundingMode.HALF_UP);
    }

    private BigDecimal required(ShippingProfile rule, BigDecimal value) {
        if (value == null) {
            throw new ShippingRuleConfigurationException(rule.getId(),
                    "Shipping profile '" + rule.getName() + "' uses cost type "
                            + rule.getCostRule().getType().getValue() + " but has no "
                            + rule.getCostRule().getType().getRequiredParameter());
        }
        return value;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
